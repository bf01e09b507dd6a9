package com.di.insightengine.analytics.capacity;

import com.di.insightengine.analytics.trend.TrendDirection;
import lombok.Builder;
import lombok.Value;

/** Per utilization metric view of a component's capacity. */
@Value
@Builder
public class ResourceMetric {
    String name;
    double current;
    double projected;
    String unit;
    double threshold;
    TrendDirection utilizationTrend;
}
