package com.di.insightengine.exception;

/**
 * Thrown when a window string does not match {@code ^\d+[smhd]$}.
 *
 * <p>Raised while configuration is parsed (startup) or while a request parameter is parsed;
 * never by the analyzers themselves. Mapped to 400 by {@link GlobalExceptionHandler}.
 */
public class InvalidTimeWindowException extends IllegalArgumentException {

    private final String window;

    public InvalidTimeWindowException(String window, String reason) {
        super("Invalid time window '" + window + "': " + reason);
        this.window = window;
    }

    public String getWindow() {
        return window;
    }
}
