package com.di.insightengine.exception;

/**
 * Read failure at the time-series store boundary. Aborts the analysis of a single metric
 * for the current tick; surfaced as 502 on the REST side.
 */
public class TimeSeriesStoreException extends RuntimeException {

    public TimeSeriesStoreException(String message) {
        super(message);
    }

    public TimeSeriesStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
