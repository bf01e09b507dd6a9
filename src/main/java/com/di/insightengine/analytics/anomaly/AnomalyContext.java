package com.di.insightengine.analytics.anomaly;

import com.di.insightengine.analytics.trend.TrendDirection;
import lombok.Builder;
import lombok.Value;

/**
 * Baseline the anomaly was scored against.
 */
@Value
@Builder
public class AnomalyContext {
    double historicalAverage;
    double historicalStddev;
    TrendDirection recentTrend;
    int sampleCount;
}
