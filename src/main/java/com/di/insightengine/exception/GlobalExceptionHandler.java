package com.di.insightengine.exception;

import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.TimeoutException;

/**
 * Global exception handler for the analytics API.
 *
 * <p>Every error is categorized with {@link ErrorCategory}, logged once and returned as an {@link ErrorResponse}:
 * <ul>
 *   <li>invalid window, bad or missing parameter: 400</li>
 *   <li>metric store failure: 502</li>
 *   <li>timeout: 408</li>
 *   <li>anything else: 500</li>
 * </ul>
 */
@Slf4j
@ControllerAdvice
public class GlobalExceptionHandler {

    /**
     * Handles malformed window strings.
     */
    @ExceptionHandler(InvalidTimeWindowException.class)
    public ResponseEntity<ErrorResponse> handleInvalidTimeWindow(InvalidTimeWindowException e, HttpServletRequest request) {
        ErrorCategory category = ErrorCategory.categorize(e);
        logError("INVALID_TIME_WINDOW", category, e, false);
        ErrorResponse errorResponse = buildErrorResponse(category, e, HttpStatus.BAD_REQUEST, request);
        errorResponse.addDetail("window", e.getWindow());
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(errorResponse);
    }

    /**
     * Handles missing or unparsable request parameters and other validation errors.
     */
    @ExceptionHandler({MissingServletRequestParameterException.class,
                      MethodArgumentTypeMismatchException.class,
                      IllegalArgumentException.class})
    public ResponseEntity<ErrorResponse> handleValidationException(Exception e, HttpServletRequest request) {
        logError("VALIDATION_EXCEPTION", ErrorCategory.VALIDATION_ERROR, e, false);
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(buildErrorResponse(ErrorCategory.VALIDATION_ERROR, e, HttpStatus.BAD_REQUEST, request));
    }

    /**
     * Handles metric/insight store failures.
     */
    @ExceptionHandler({TimeSeriesStoreException.class, DataAccessException.class})
    public ResponseEntity<ErrorResponse> handleStoreException(RuntimeException e, HttpServletRequest request) {
        ErrorCategory category = ErrorCategory.categorize(e);
        logError("STORE_EXCEPTION", category, e, true);
        return ResponseEntity.status(HttpStatus.BAD_GATEWAY)
                .body(buildErrorResponse(category, e, HttpStatus.BAD_GATEWAY, request));
    }

    /**
     * Handles timeout errors.
     */
    @ExceptionHandler(TimeoutException.class)
    public ResponseEntity<ErrorResponse> handleTimeoutException(TimeoutException e, HttpServletRequest request) {
        ErrorCategory category = ErrorCategory.categorize(e);
        logError("TIMEOUT_EXCEPTION", category, e, true);
        return ResponseEntity.status(HttpStatus.REQUEST_TIMEOUT)
                .body(buildErrorResponse(category, e, HttpStatus.REQUEST_TIMEOUT, request));
    }

    /**
     * Handles all other unhandled exceptions (catch-all).
     */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGenericException(Exception e, HttpServletRequest request) {
        ErrorCategory category = ErrorCategory.categorize(e);
        logError("UNHANDLED_EXCEPTION", category, e, true);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(buildErrorResponse(category, e, HttpStatus.INTERNAL_SERVER_ERROR, request));
    }

    private void logError(String eventType, ErrorCategory category, Throwable exception, boolean withStack) {
        Throwable rootCause = getRootCause(exception);
        if (withStack) {
            log.error("[API] {} [{}] {} rootCause={}", eventType, category.getName(), exception.getMessage(),
                    rootCause.getClass().getSimpleName(), exception);
        } else {
            log.warn("[API] {} [{}] {}", eventType, category.getName(), exception.getMessage());
        }
    }

    private ErrorResponse buildErrorResponse(ErrorCategory category, Throwable exception, HttpStatus status,
                                             HttpServletRequest request) {
        ErrorResponse response = new ErrorResponse();
        response.setTimestamp(Instant.now().toString());
        response.setStatus(status.value());
        response.setError(status.getReasonPhrase());
        response.setMessage(exception.getMessage() != null ? exception.getMessage() : exception.getClass().getSimpleName());
        response.setErrorCategory(category.name());
        response.setErrorCategoryName(category.getName());
        response.setPath(request != null ? request.getRequestURI() : "/unknown");

        response.addDetail("exceptionType", exception.getClass().getName());
        Throwable rootCause = getRootCause(exception);
        if (rootCause != exception) {
            response.addDetail("rootCauseType", rootCause.getClass().getName());
            response.addDetail("rootCauseMessage", rootCause.getMessage());
        }
        return response;
    }

    private Throwable getRootCause(Throwable exception) {
        Throwable cause = exception.getCause();
        if (cause == null || cause == exception) {
            return exception;
        }
        return getRootCause(cause);
    }

    /**
     * Structured error response for API endpoints.
     */
    public static class ErrorResponse {
        private String timestamp;
        private int status;
        private String error;
        private String message;
        private String errorCategory;
        private String errorCategoryName;
        private String path;
        private Map<String, Object> details = new HashMap<>();

        public String getTimestamp() {
            return timestamp;
        }

        public void setTimestamp(String timestamp) {
            this.timestamp = timestamp;
        }

        public int getStatus() {
            return status;
        }

        public void setStatus(int status) {
            this.status = status;
        }

        public String getError() {
            return error;
        }

        public void setError(String error) {
            this.error = error;
        }

        public String getMessage() {
            return message;
        }

        public void setMessage(String message) {
            this.message = message;
        }

        public String getErrorCategory() {
            return errorCategory;
        }

        public void setErrorCategory(String errorCategory) {
            this.errorCategory = errorCategory;
        }

        public String getErrorCategoryName() {
            return errorCategoryName;
        }

        public void setErrorCategoryName(String errorCategoryName) {
            this.errorCategoryName = errorCategoryName;
        }

        public String getPath() {
            return path;
        }

        public void setPath(String path) {
            this.path = path;
        }

        public Map<String, Object> getDetails() {
            return details;
        }

        public void setDetails(Map<String, Object> details) {
            this.details = details;
        }

        public void addDetail(String key, Object value) {
            this.details.put(key, value);
        }
    }
}
