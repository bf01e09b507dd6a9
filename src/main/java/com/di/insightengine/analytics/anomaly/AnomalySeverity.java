package com.di.insightengine.analytics.anomaly;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Severity bands. {@link #fromScore(double)} is monotone in the deviation score.
 */
public enum AnomalySeverity {
    LOW(1.0),
    MEDIUM(2.0),
    HIGH(3.0),
    CRITICAL(4.0);

    private static final double CRITICAL_ABOVE = 4.0;
    private static final double HIGH_ABOVE = 3.0;
    private static final double MEDIUM_ABOVE = 2.5;

    private final double weight;

    AnomalySeverity(double weight) {
        this.weight = weight;
    }

    /** Ranking weight used when scoring insight impact. */
    public double getWeight() {
        return weight;
    }

    public boolean isAtLeast(AnomalySeverity other) {
        return compareTo(other) >= 0;
    }

    public static AnomalySeverity fromScore(double deviationScore) {
        if (deviationScore > CRITICAL_ABOVE) return CRITICAL;
        if (deviationScore > HIGH_ABOVE) return HIGH;
        if (deviationScore > MEDIUM_ABOVE) return MEDIUM;
        return LOW;
    }

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
