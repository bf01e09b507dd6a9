package com.di.insightengine.analytics.capacity;

import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class CapacityResult {
    public static final String UNKNOWN = "unknown";

    String component;
    double currentUtilization;
    double predictedUtilization;
    /** Human bucket: now, &lt; 1 day, N days, N weeks, N months or unknown. */
    String timeToCapacity;
    /** Null when no finite crossing exists. */
    Double daysToCapacity;
    double confidence;
    int forecastDays;
    List<CapacityRecommendation> recommendations;
    List<ResourceMetric> resourceMetrics;

    public static CapacityResult empty(String component, int forecastDays) {
        return CapacityResult.builder()
                .component(component)
                .timeToCapacity(UNKNOWN)
                .forecastDays(forecastDays)
                .recommendations(List.of())
                .resourceMetrics(List.of())
                .build();
    }
}
