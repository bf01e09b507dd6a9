package com.di.insightengine.analytics.trend;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * One forecast step. Invariant: {@code lower <= predicted <= upper}.
 */
@Value
@Builder
public class ForecastPoint {
    Instant timestamp;
    double predicted;
    double lower;
    double upper;
    /** Non-increasing along the forecast horizon, floored at 0.1. */
    double confidence;
}
