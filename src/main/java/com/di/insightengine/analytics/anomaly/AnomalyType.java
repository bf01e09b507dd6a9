package com.di.insightengine.analytics.anomaly;

import com.fasterxml.jackson.annotation.JsonValue;

public enum AnomalyType {
    /** Sample above the baseline. */
    SPIKE,
    /** Sample below the baseline. */
    DIP,
    /** Sustained shift of the recent level away from the earlier level. */
    DRIFT,
    /** Expected samples absent (gap wider than the sampling interval allows). */
    MISSING;

    @JsonValue
    public String wireName() {
        return name().toLowerCase();
    }
}
