package com.di.insightengine.insight;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Coarse level of an insight's impact score.
 */
public enum InsightImpact {
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL;

    public static InsightImpact fromScore(double impact) {
        if (impact >= 3.0) return CRITICAL;
        if (impact >= 1.5) return HIGH;
        if (impact >= 0.5) return MEDIUM;
        return LOW;
    }

    public boolean isAtLeast(InsightImpact other) {
        return compareTo(other) >= 0;
    }

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static InsightImpact fromWireName(String value) {
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
