package com.di.insightengine.insight;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum InsightType {
    TREND,
    ANOMALY,
    CAPACITY,
    CORRELATION,
    SEASONALITY;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static InsightType fromWireName(String value) {
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
