package com.di.insightengine.model;

import lombok.Value;

import java.time.Instant;

/**
 * One observation of a metric: timestamp and a finite value.
 */
@Value(staticConstructor = "of")
public class Sample {
    Instant timestamp;
    double value;
}
