package com.di.insightengine.analytics.capacity;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum RecommendationPriority {
    LOW,
    MEDIUM,
    HIGH,
    URGENT;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
