package com.di.insightengine.analytics.correlation;

import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class CorrelationResult {
    String primaryMetric;
    /** Sorted by |coefficient| descending; never contains the primary itself. */
    List<CorrelatedMetric> correlatedMetrics;
    List<String> insights;
}
