package com.di.insightengine.config;

import com.di.insightengine.exception.InvalidTimeWindowException;

import java.time.Duration;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses window strings such as {@code 30s}, {@code 5m}, {@code 24h}, {@code 7d}.
 */
public final class TimeWindow {

    private static final Pattern WINDOW = Pattern.compile("^(\\d+)([smhd])$");

    private TimeWindow() {
    }

    /**
     * @throws InvalidTimeWindowException when the string is null, malformed, uses an unknown unit or is zero
     */
    public static Duration parse(String window) {
        if (window == null || window.isBlank()) {
            throw new InvalidTimeWindowException(window, "window is empty");
        }
        Matcher m = WINDOW.matcher(window.trim());
        if (!m.matches()) {
            throw new InvalidTimeWindowException(window, "expected <number><s|m|h|d>");
        }
        long amount;
        try {
            amount = Long.parseLong(m.group(1));
        } catch (NumberFormatException e) {
            throw new InvalidTimeWindowException(window, "amount out of range");
        }
        if (amount <= 0) {
            throw new InvalidTimeWindowException(window, "amount must be positive");
        }
        try {
            switch (m.group(2)) {
                case "s": return Duration.ofSeconds(amount);
                case "m": return Duration.ofMinutes(amount);
                case "h": return Duration.ofHours(amount);
                case "d": return Duration.ofDays(amount);
                default: throw new InvalidTimeWindowException(window, "unknown unit " + m.group(2));
            }
        } catch (ArithmeticException e) {
            throw new InvalidTimeWindowException(window, "amount out of range");
        }
    }

    /** Returns {@code true} if {@link #parse(String)} would accept the string. */
    public static boolean isValid(String window) {
        try {
            parse(window);
            return true;
        } catch (InvalidTimeWindowException e) {
            return false;
        }
    }
}
