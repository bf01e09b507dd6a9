package com.di.insightengine.model;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Ordered, immutable sequence of samples for one series key over a time range.
 * Timestamps are strictly increasing and values are finite.
 */
public final class TimeSeries {

    private final SeriesKey key;
    private final List<Sample> samples;

    private TimeSeries(SeriesKey key, List<Sample> samples) {
        this.key = key;
        this.samples = Collections.unmodifiableList(samples);
    }

    /**
     * Builds a series from samples already in ascending timestamp order.
     *
     * @throws IllegalArgumentException if timestamps are not strictly increasing or a value is not finite
     */
    public static TimeSeries of(SeriesKey key, List<Sample> samples) {
        List<Sample> copy = new ArrayList<>(samples != null ? samples : List.of());
        for (int i = 0; i < copy.size(); i++) {
            Sample s = copy.get(i);
            if (!Double.isFinite(s.getValue())) {
                throw new IllegalArgumentException("Non-finite value at " + s.getTimestamp() + " for " + describe(key));
            }
            if (i > 0 && !s.getTimestamp().isAfter(copy.get(i - 1).getTimestamp())) {
                throw new IllegalArgumentException("Timestamps must be strictly increasing at " + s.getTimestamp()
                        + " for " + describe(key));
            }
        }
        return new TimeSeries(key, copy);
    }

    /**
     * Builds a series from samples in any order: sorts by timestamp, averages samples that share a
     * timestamp (e.g. several tag sets merged) and drops non-finite values.
     */
    public static TimeSeries fromUnordered(SeriesKey key, List<Sample> samples) {
        Map<Instant, double[]> byTs = new TreeMap<>();
        if (samples != null) {
            for (Sample s : samples) {
                if (s == null || s.getTimestamp() == null || !Double.isFinite(s.getValue())) continue;
                double[] acc = byTs.computeIfAbsent(s.getTimestamp(), t -> new double[2]);
                acc[0] += s.getValue();
                acc[1] += 1;
            }
        }
        List<Sample> out = new ArrayList<>(byTs.size());
        byTs.forEach((ts, acc) -> out.add(Sample.of(ts, acc[0] / acc[1])));
        return new TimeSeries(key, out);
    }

    public static TimeSeries empty(SeriesKey key) {
        return new TimeSeries(key, List.of());
    }

    public SeriesKey getKey() {
        return key;
    }

    public String getMetric() {
        return key != null ? key.getMetric() : null;
    }

    public List<Sample> getSamples() {
        return samples;
    }

    public int size() {
        return samples.size();
    }

    public boolean isEmpty() {
        return samples.isEmpty();
    }

    public double[] values() {
        double[] out = new double[samples.size()];
        for (int i = 0; i < out.length; i++) {
            out[i] = samples.get(i).getValue();
        }
        return out;
    }

    public Sample first() {
        return samples.isEmpty() ? null : samples.get(0);
    }

    public Sample last() {
        return samples.isEmpty() ? null : samples.get(samples.size() - 1);
    }

    /** Last {@code n} samples (or all when fewer) as a new series with the same key. */
    public TimeSeries tail(int n) {
        if (n >= samples.size()) return this;
        return new TimeSeries(key, new ArrayList<>(samples.subList(samples.size() - Math.max(0, n), samples.size())));
    }

    /** Mean spacing between consecutive samples; {@link Duration#ZERO} when fewer than 2 samples. */
    public Duration meanInterval() {
        if (samples.size() < 2) return Duration.ZERO;
        Duration span = Duration.between(first().getTimestamp(), last().getTimestamp());
        return span.dividedBy(samples.size() - 1);
    }

    /** Median spacing between consecutive samples; {@link Duration#ZERO} when fewer than 2 samples. */
    public Duration medianInterval() {
        if (samples.size() < 2) return Duration.ZERO;
        List<Duration> gaps = new ArrayList<>(samples.size() - 1);
        for (int i = 1; i < samples.size(); i++) {
            gaps.add(Duration.between(samples.get(i - 1).getTimestamp(), samples.get(i).getTimestamp()));
        }
        gaps.sort(Comparator.naturalOrder());
        int mid = gaps.size() / 2;
        if (gaps.size() % 2 == 1) return gaps.get(mid);
        return gaps.get(mid - 1).plus(gaps.get(mid)).dividedBy(2);
    }

    private static String describe(SeriesKey key) {
        return key != null ? key.getMetric() + "@" + key.getTenantId() : "series";
    }

    @Override
    public String toString() {
        return "TimeSeries{" + describe(key) + ", samples=" + samples.size() + "}";
    }
}
