package com.di.insightengine.analytics.correlation;

import lombok.Value;

/** Best lag found by a cross-correlation scan and the coefficient at that lag. */
@Value(staticConstructor = "of")
public class CrossCorrelation {
    int lag;
    double coefficient;
    /** Number of overlapping points the coefficient was computed on. */
    int overlap;

    public static CrossCorrelation none() {
        return of(0, 0.0, 0);
    }
}
