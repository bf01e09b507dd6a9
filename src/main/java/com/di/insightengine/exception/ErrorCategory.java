package com.di.insightengine.exception;

import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.QueryTimeoutException;
import org.springframework.jdbc.BadSqlGrammarException;

import java.sql.SQLException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Predicate;

/**
 * Standardized error categories for per-metric failure logging and REST error responses.
 * <p>Usage: {@code ErrorCategory category = ErrorCategory.categorize(exception);}
 * <p>Store failures are classified by their cause, so a {@link TimeSeriesStoreException} wrapping a refused
 * connection reads as {@link #STORE_CONNECTION_ERROR}.
 */
public enum ErrorCategory {

    STORE_CONNECTION_ERROR("Store connection error", "Failed to establish or maintain the metric store connection"),
    STORE_QUERY_ERROR("Store query error", "Invalid SQL or schema mismatch against the metric store"),
    STORE_ERROR("Store error", "General metric or insight store failure"),
    INVALID_TIME_WINDOW("Invalid time window", "Window string does not match <digits><s|m|h|d>"),
    VALIDATION_ERROR("Validation error", "Input validation or request parameter violation"),
    CONFIGURATION_ERROR("Configuration error", "Application configuration issue"),
    SERIALIZATION_ERROR("Serialization error", "JSON serialization or deserialization failure"),
    TIMEOUT_ERROR("Timeout error", "Operation exceeded maximum time limit"),
    ANALYSIS_ERROR("Analysis error", "Numeric failure while analysing a series"),
    APPLICATION_ERROR("Application error", "General application error"),
    UNKNOWN("Unknown error", "Unclassified or unknown error type");

    private final String name;
    private final String description;

    ErrorCategory(String name, String description) {
        this.name = name;
        this.description = description;
    }

    public String getName() {
        return name;
    }

    public String getDescription() {
        return description;
    }

    /** Order matters: first match wins. */
    private static final Map<Predicate<Throwable>, ErrorCategory> MATCHERS = new LinkedHashMap<>();

    static {
        MATCHERS.put(t -> t instanceof InvalidTimeWindowException, INVALID_TIME_WINDOW);
        MATCHERS.put(ErrorCategory::isTimeoutError, TIMEOUT_ERROR);
        MATCHERS.put(ErrorCategory::isSerializationError, SERIALIZATION_ERROR);
        MATCHERS.put(ErrorCategory::isConfigurationError, CONFIGURATION_ERROR);
        MATCHERS.put(t -> t instanceof ArithmeticException, ANALYSIS_ERROR);
        MATCHERS.put(ErrorCategory::isValidationError, VALIDATION_ERROR);
    }

    public static ErrorCategory categorize(Throwable exception) {
        if (exception == null) {
            return UNKNOWN;
        }
        if (exception instanceof TimeSeriesStoreException) {
            ErrorCategory byCause = exception.getCause() != null ? categorize(exception.getCause()) : STORE_ERROR;
            return byCause == APPLICATION_ERROR || byCause == VALIDATION_ERROR ? STORE_ERROR : byCause;
        }
        if (exception instanceof DataAccessException) {
            return categorizeDataAccess((DataAccessException) exception);
        }
        if (exception instanceof SQLException) {
            return categorizeSqlException((SQLException) exception);
        }
        for (Map.Entry<Predicate<Throwable>, ErrorCategory> e : MATCHERS.entrySet()) {
            if (e.getKey().test(exception)) {
                return e.getValue();
            }
        }
        return APPLICATION_ERROR;
    }

    private static ErrorCategory categorizeDataAccess(DataAccessException e) {
        if (e instanceof QueryTimeoutException) return TIMEOUT_ERROR;
        if (e instanceof DataAccessResourceFailureException) return STORE_CONNECTION_ERROR;
        if (e instanceof BadSqlGrammarException) return STORE_QUERY_ERROR;
        Throwable cause = e.getMostSpecificCause();
        if (cause instanceof SQLException) {
            return categorizeSqlException((SQLException) cause);
        }
        return STORE_ERROR;
    }

    private static ErrorCategory categorizeSqlException(SQLException sqlEx) {
        String sqlState = sqlEx.getSQLState();
        if (sqlState != null) {
            ErrorCategory byState = SQL_STATE_PREFIX.get(sqlState.substring(0, Math.min(2, sqlState.length())));
            if (byState != null) {
                return byState;
            }
        }
        String msg = sqlEx.getMessage();
        if (msg != null) {
            String lower = msg.toLowerCase();
            if (containsAny(lower, "connection", "refused", "closed")) return STORE_CONNECTION_ERROR;
            if (containsAny(lower, "timeout", "canceling statement")) return TIMEOUT_ERROR;
            if (containsAny(lower, "syntax", "does not exist", "parse error")) return STORE_QUERY_ERROR;
        }
        return STORE_ERROR;
    }

    private static final Map<String, ErrorCategory> SQL_STATE_PREFIX = Map.of(
            "08", STORE_CONNECTION_ERROR,
            "42", STORE_QUERY_ERROR,
            "57", TIMEOUT_ERROR
    );

    // --- Matcher helpers ---

    private static boolean isTimeoutError(Throwable t) {
        return t instanceof java.util.concurrent.TimeoutException
                || t instanceof java.net.SocketTimeoutException
                || t instanceof java.util.concurrent.CancellationException
                || messageContains(t, "timeout", "timed out");
    }

    private static boolean isValidationError(Throwable t) {
        return t instanceof IllegalArgumentException
                || t instanceof IllegalStateException
                || t instanceof java.util.NoSuchElementException
                || t instanceof IndexOutOfBoundsException;
    }

    private static boolean isConfigurationError(Throwable t) {
        return t instanceof org.springframework.beans.factory.BeanCreationException
                || t instanceof org.springframework.context.ApplicationContextException
                || t instanceof org.springframework.boot.context.properties.bind.BindException;
    }

    private static boolean isSerializationError(Throwable t) {
        return t instanceof com.fasterxml.jackson.core.JsonProcessingException
                || (t instanceof java.io.UncheckedIOException
                && t.getCause() instanceof com.fasterxml.jackson.core.JsonProcessingException);
    }

    private static boolean messageContains(Throwable t, String... keywords) {
        String msg = t.getMessage();
        return msg != null && containsAny(msg.toLowerCase(), keywords);
    }

    private static boolean containsAny(String text, String... keywords) {
        if (text == null) return false;
        for (String k : keywords) {
            if (text.contains(k)) return true;
        }
        return false;
    }

    @Override
    public String toString() {
        return name();
    }
}
