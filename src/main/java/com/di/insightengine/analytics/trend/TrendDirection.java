package com.di.insightengine.analytics.trend;

import com.fasterxml.jackson.annotation.JsonValue;

public enum TrendDirection {
    INCREASING,
    DECREASING,
    STABLE;

    @JsonValue
    public String wireName() {
        return name().toLowerCase();
    }
}
