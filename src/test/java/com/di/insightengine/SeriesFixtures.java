package com.di.insightengine;

import com.di.insightengine.model.Sample;
import com.di.insightengine.model.SeriesKey;
import com.di.insightengine.model.TimeSeries;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/** Builders for regularly sampled series used across the analyzer tests. */
public final class SeriesFixtures {

    public static final String TENANT = "tenant-a";
    public static final Instant BASE = Instant.parse("2024-01-01T00:00:00Z");

    private SeriesFixtures() {
    }

    public static TimeSeries series(String metric, Duration step, double... values) {
        return series(metric, BASE, step, values);
    }

    public static TimeSeries series(String metric, Instant start, Duration step, double... values) {
        List<Sample> samples = new ArrayList<>(values.length);
        for (int i = 0; i < values.length; i++) {
            samples.add(Sample.of(start.plus(step.multipliedBy(i)), values[i]));
        }
        return TimeSeries.of(SeriesKey.of(metric, TENANT), samples);
    }

    /** Alternating {@code center - 1}, {@code center + 1}: mean {@code center}, stddev 1. */
    public static double[] noisy(double center, int n) {
        double[] out = new double[n];
        for (int i = 0; i < n; i++) out[i] = center + (i % 2 == 0 ? -1 : 1);
        return out;
    }

    public static double[] ramp(double start, double step, int n) {
        double[] out = new double[n];
        for (int i = 0; i < n; i++) out[i] = start + step * i;
        return out;
    }
}
