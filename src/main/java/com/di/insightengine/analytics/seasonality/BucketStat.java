package com.di.insightengine.analytics.seasonality;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class BucketStat {
    int bucket;
    String label;
    double mean;
    double stddev;
    int count;
}
