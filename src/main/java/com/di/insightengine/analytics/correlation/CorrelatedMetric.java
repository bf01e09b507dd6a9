package com.di.insightengine.analytics.correlation;

import lombok.Builder;
import lombok.Value;

/**
 * One retained partner of a primary metric.
 * Positive {@code lag} means this metric follows the primary by that many buckets.
 */
@Value
@Builder
public class CorrelatedMetric {
    String metric;
    double coefficient;
    double significance;
    int lag;
    String description;
}
