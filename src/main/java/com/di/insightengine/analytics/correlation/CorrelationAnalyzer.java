package com.di.insightengine.analytics.correlation;

import com.di.insightengine.config.AnalyticsProperties;
import com.di.insightengine.model.Sample;
import com.di.insightengine.model.TimeSeries;
import com.di.insightengine.stats.Statistics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.NavigableMap;
import java.util.TreeMap;

/**
 * Pairwise and lagged Pearson correlation across a metric set.
 *
 * <p>Series are bucketed to {@code insights.analytics.correlation.bucket} (bucket mean) so that metrics sampled at
 * different rates line up. For each ordered pair the lag in {@code [-maxLagBuckets, maxLagBuckets]} with the largest
 * |coefficient| wins; ties go to the smaller |lag|. Cost is O(metrics² × lags × buckets), so the metric set is
 * truncated to {@code maxMetrics}.
 */
@Slf4j
@Component
public class CorrelationAnalyzer {

    private static final double STRONG = 0.7;
    private static final double MODERATE = 0.5;

    private final AnalyticsProperties.Correlation config;

    public CorrelationAnalyzer(AnalyticsProperties properties) {
        this.config = properties.getCorrelation();
    }

    /**
     * One result per metric that has at least one partner with |coefficient| ≥ threshold.
     * Iteration order of {@code seriesByMetric} decides which metrics survive truncation.
     */
    public List<CorrelationResult> analyze(Map<String, TimeSeries> seriesByMetric) {
        if (seriesByMetric == null || seriesByMetric.size() < 2) {
            return List.of();
        }
        Map<String, TimeSeries> capped = cap(seriesByMetric);
        long bucketMillis = config.getBucketDuration().toMillis();
        Map<String, NavigableMap<Long, Double>> bucketed = new LinkedHashMap<>();
        capped.forEach((metric, series) -> {
            if (series != null && series.size() >= 2) {
                bucketed.put(metric, bucketize(series, bucketMillis));
            }
        });

        List<CorrelationResult> results = new ArrayList<>();
        for (Map.Entry<String, NavigableMap<Long, Double>> primary : bucketed.entrySet()) {
            List<CorrelatedMetric> partners = new ArrayList<>();
            for (Map.Entry<String, NavigableMap<Long, Double>> secondary : bucketed.entrySet()) {
                if (primary.getKey().equals(secondary.getKey())) continue;
                CrossCorrelation best = correlate(primary.getValue(), secondary.getValue(), bucketMillis);
                if (best.getOverlap() == 0 || Math.abs(best.getCoefficient()) < config.getThreshold()) continue;
                partners.add(CorrelatedMetric.builder()
                        .metric(secondary.getKey())
                        .coefficient(best.getCoefficient())
                        .significance(Math.abs(best.getCoefficient()))
                        .lag(best.getLag())
                        .description(describe(best.getCoefficient()))
                        .build());
            }
            if (partners.isEmpty()) continue;
            partners.sort(Comparator.comparingDouble((CorrelatedMetric c) -> Math.abs(c.getCoefficient())).reversed());
            results.add(CorrelationResult.builder()
                    .primaryMetric(primary.getKey())
                    .correlatedMetrics(List.copyOf(partners))
                    .insights(insightsFor(primary.getKey(), partners))
                    .build());
        }
        log.debug("[CORRELATION] metrics={} bucket={} results={}", bucketed.size(), config.getBucket(), results.size());
        return results;
    }

    /**
     * Scans lags {@code -maxLag..maxLag} pairing {@code a[i]} with {@code b[i + lag]}. NaN entries mark empty buckets
     * and are skipped. Lags with fewer than {@code minOverlap} pairs are ignored; if none qualifies the result
     * has overlap 0.
     */
    public static CrossCorrelation crossCorrelate(double[] a, double[] b, int maxLag, int minOverlap) {
        CrossCorrelation best = CrossCorrelation.none();
        int required = Math.max(2, minOverlap);
        for (int step = 0; step <= maxLag; step++) {
            for (int lag : step == 0 ? new int[]{0} : new int[]{step, -step}) {
                double[][] pairs = pairsAtLag(a, b, lag);
                int overlap = pairs[0].length;
                if (overlap < required) continue;
                double r = Statistics.pearson(pairs[0], pairs[1]);
                if (best.getOverlap() == 0 || Math.abs(r) > Math.abs(best.getCoefficient())) {
                    best = CrossCorrelation.of(lag, r, overlap);
                }
            }
        }
        return best;
    }

    private CrossCorrelation correlate(NavigableMap<Long, Double> primary, NavigableMap<Long, Double> secondary,
                                       long bucketMillis) {
        long start = Math.min(primary.firstKey(), secondary.firstKey());
        long end = Math.max(primary.lastKey(), secondary.lastKey());
        int length = (int) ((end - start) / bucketMillis) + 1;
        return crossCorrelate(dense(primary, start, bucketMillis, length), dense(secondary, start, bucketMillis, length),
                config.getMaxLagBuckets(), config.getMinSamples());
    }

    private Map<String, TimeSeries> cap(Map<String, TimeSeries> seriesByMetric) {
        int max = config.getMaxMetrics();
        if (seriesByMetric.size() <= max) return seriesByMetric;
        log.warn("[CORRELATION] metric set truncated from {} to {} (max-metrics)", seriesByMetric.size(), max);
        Map<String, TimeSeries> capped = new LinkedHashMap<>();
        for (Map.Entry<String, TimeSeries> e : seriesByMetric.entrySet()) {
            if (capped.size() == max) break;
            capped.put(e.getKey(), e.getValue());
        }
        return capped;
    }

    static NavigableMap<Long, Double> bucketize(TimeSeries series, long bucketMillis) {
        TreeMap<Long, double[]> sums = new TreeMap<>();
        for (Sample s : series.getSamples()) {
            long bucket = Math.floorDiv(s.getTimestamp().toEpochMilli(), bucketMillis) * bucketMillis;
            double[] acc = sums.computeIfAbsent(bucket, k -> new double[2]);
            acc[0] += s.getValue();
            acc[1] += 1;
        }
        TreeMap<Long, Double> means = new TreeMap<>();
        sums.forEach((bucket, acc) -> means.put(bucket, acc[0] / acc[1]));
        return means;
    }

    private static double[] dense(NavigableMap<Long, Double> buckets, long start, long bucketMillis, int length) {
        double[] out = new double[length];
        Arrays.fill(out, Double.NaN);
        buckets.forEach((bucket, mean) -> out[(int) ((bucket - start) / bucketMillis)] = mean);
        return out;
    }

    private static double[][] pairsAtLag(double[] a, double[] b, int lag) {
        int from = Math.max(0, -lag);
        int to = Math.min(a.length, b.length - lag);
        double[] xs = new double[Math.max(0, to - from)];
        double[] ys = new double[xs.length];
        int n = 0;
        for (int i = from; i < to; i++) {
            double x = a[i];
            double y = b[i + lag];
            if (Double.isNaN(x) || Double.isNaN(y)) continue;
            xs[n] = x;
            ys[n] = y;
            n++;
        }
        return new double[][]{Arrays.copyOf(xs, n), Arrays.copyOf(ys, n)};
    }

    static String describe(double coefficient) {
        double abs = Math.abs(coefficient);
        String strength = abs >= STRONG ? "strong" : abs >= MODERATE ? "moderate" : "weak";
        return strength + (coefficient >= 0 ? " positive" : " negative") + " correlation";
    }

    private List<String> insightsFor(String primary, List<CorrelatedMetric> partners) {
        List<String> insights = new ArrayList<>();
        for (CorrelatedMetric c : partners) {
            if (Math.abs(c.getCoefficient()) < STRONG) continue;
            if (c.getLag() > 0) {
                insights.add(String.format(Locale.ROOT, "%s follows %s by %d bucket(s) of %s (r=%.2f)",
                        c.getMetric(), primary, c.getLag(), config.getBucket(), c.getCoefficient()));
            } else if (c.getLag() < 0) {
                insights.add(String.format(Locale.ROOT, "%s leads %s by %d bucket(s) of %s (r=%.2f)",
                        c.getMetric(), primary, -c.getLag(), config.getBucket(), c.getCoefficient()));
            } else {
                insights.add(String.format(Locale.ROOT, "%s has a %s with %s (r=%.2f)",
                        primary, c.getDescription(), c.getMetric(), c.getCoefficient()));
            }
        }
        return insights;
    }
}
