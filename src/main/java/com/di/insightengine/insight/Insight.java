package com.di.insightengine.insight;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Ranked, immutable unit of analysis output. A newer insight for the same metric supersedes an older one
 * for display but never rewrites it.
 */
@Value
@Builder
public class Insight {
    String id;
    String tenantId;
    InsightType type;
    String title;
    String description;
    /** confidence × magnitude × severity weight. */
    double impact;
    InsightImpact impactLevel;
    double confidence;
    List<String> metrics;
    String timeWindow;
    /** Named numbers backing the insight (rate, score, coefficient ...). */
    Map<String, Double> values;
    List<String> recommendations;
    Instant createdAt;
}
