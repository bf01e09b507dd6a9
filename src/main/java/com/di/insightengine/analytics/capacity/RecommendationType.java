package com.di.insightengine.analytics.capacity;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum RecommendationType {
    SCALE_UP,
    SCALE_OUT,
    OPTIMIZE,
    MONITOR;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
