package com.di.insightengine.analytics.seasonality;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * A periodic component whose strength (between-bucket variance over total variance) passed the configured minimum.
 */
@Value
@Builder
public class SeasonalPattern {
    SeasonalPeriod periodType;
    double strength;
    /** Highest-mean buckets, highest first. */
    List<BucketStat> peaks;
    /** Lowest-mean buckets, lowest first. */
    List<BucketStat> valleys;
    /** Every populated bucket, by bucket index. */
    List<BucketStat> buckets;

    public BucketStat bucket(int index) {
        for (BucketStat b : buckets) {
            if (b.getBucket() == index) return b;
        }
        return null;
    }
}
