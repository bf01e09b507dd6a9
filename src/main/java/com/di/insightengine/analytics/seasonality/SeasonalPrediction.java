package com.di.insightengine.analytics.seasonality;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

@Value
@Builder
public class SeasonalPrediction {
    Instant timestamp;
    SeasonalPeriod periodType;
    double expected;
    double lower;
    double upper;
}
