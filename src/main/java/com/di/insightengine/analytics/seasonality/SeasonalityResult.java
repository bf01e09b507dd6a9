package com.di.insightengine.analytics.seasonality;

import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class SeasonalityResult {
    String metric;
    /** Strongest first. */
    List<SeasonalPattern> patterns;
    List<SeasonalPrediction> predictions;

    public static SeasonalityResult empty(String metric) {
        return new SeasonalityResult(metric, List.of(), List.of());
    }

    public boolean hasPatterns() {
        return !patterns.isEmpty();
    }
}
