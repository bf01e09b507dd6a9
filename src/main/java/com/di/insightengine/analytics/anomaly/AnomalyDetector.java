package com.di.insightengine.analytics.anomaly;

import com.di.insightengine.analytics.trend.TrendDirection;
import com.di.insightengine.config.AnalyticsProperties;
import com.di.insightengine.model.Sample;
import com.di.insightengine.model.TimeSeries;
import com.di.insightengine.stats.Statistics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Deviation scoring against a baseline built from the analysis window.
 *
 * <p>Point anomalies: each sample is scored against the mean/stddev of the window without that sample,
 * so a lone outlier cannot inflate its own baseline. A zero-stddev baseline is skipped, not scored.
 * Drift and missing-data anomalies are reported from the same window.
 * Results are sorted by deviation score, highest first.
 */
@Slf4j
@Component
public class AnomalyDetector {

    private static final double DEGENERATE_STDDEV = 1e-12;
    private static final double FLAT_SLOPE = 0.01;

    private final AnalyticsProperties.Anomaly config;

    public AnomalyDetector(AnalyticsProperties properties) {
        this.config = properties.getAnomaly();
    }

    public List<AnomalyResult> detect(TimeSeries series) {
        return detect(series, series != null && series.getKey() != null ? series.getKey().getTenantId() : null);
    }

    /**
     * Scores every sample of the series. Fewer than 3 samples or a constant series yields an empty list.
     */
    public List<AnomalyResult> detect(TimeSeries series, String tenantId) {
        if (series == null || series.size() < 3) {
            return List.of();
        }
        String metric = series.getMetric();
        double[] values = series.values();
        int n = values.length;
        double mean = Statistics.mean(values);
        double sumSquares = 0.0;
        for (double v : values) {
            sumSquares += (v - mean) * (v - mean);
        }
        double stddev = Math.sqrt(sumSquares / n);
        AnomalyContext context = AnomalyContext.builder()
                .historicalAverage(mean)
                .historicalStddev(stddev)
                .recentTrend(trendOf(values))
                .sampleCount(n)
                .build();

        List<AnomalyResult> anomalies = new ArrayList<>();
        List<Sample> samples = series.getSamples();
        for (int i = 0; i < n; i++) {
            double x = values[i];
            double baselineMean = leaveOneOutMean(values, i);
            double baselineStd = leaveOneOutStddev(values, i, baselineMean);
            if (baselineStd <= DEGENERATE_STDDEV * Math.max(1.0, Math.abs(baselineMean))) {
                continue;
            }
            double score = Math.abs(x - baselineMean) / baselineStd;
            if (score > config.getScoreThreshold()) {
                AnomalyType type = x > baselineMean ? AnomalyType.SPIKE : AnomalyType.DIP;
                anomalies.add(AnomalyResult.builder()
                        .metric(metric)
                        .tenantId(tenantId)
                        .timestamp(samples.get(i).getTimestamp())
                        .value(x)
                        .expectedValue(baselineMean)
                        .deviationScore(score)
                        .type(type)
                        .severity(AnomalySeverity.fromScore(score))
                        .context(context)
                        .possibleCauses(possibleCauses(metric, type))
                        .build());
            }
        }

        if (config.isDriftEnabled()) {
            detectDrift(series, values, tenantId, context).ifPresent(anomalies::add);
        }
        anomalies.addAll(detectMissing(series, tenantId, context));

        anomalies.sort(Comparator.comparingDouble(AnomalyResult::getDeviationScore).reversed());
        if (!anomalies.isEmpty()) {
            log.debug("[ANOMALY] metric={} n={} anomalies={} top={}",
                    metric, n, anomalies.size(), anomalies.get(0).getDeviationScore());
        }
        return anomalies;
    }

    private static double leaveOneOutMean(double[] values, int skip) {
        double sum = 0.0;
        for (int j = 0; j < values.length; j++) {
            if (j != skip) sum += values[j];
        }
        return sum / (values.length - 1);
    }

    /** Population stddev of every sample except {@code skip}; exactly 0 when the others are all equal. */
    private static double leaveOneOutStddev(double[] values, int skip, double baselineMean) {
        double ss = 0.0;
        for (int j = 0; j < values.length; j++) {
            if (j == skip) continue;
            double d = values[j] - baselineMean;
            ss += d * d;
        }
        return Math.sqrt(ss / (values.length - 1));
    }

    /**
     * Compares the median of the most recent quarter with the median of the earlier part,
     * in units of the earlier part's stddev.
     */
    Optional<AnomalyResult> detectDrift(TimeSeries series, double[] values, String tenantId,
                                                  AnomalyContext context) {
        int n = values.length;
        if (n < Math.max(8, config.getDriftMinSamples())) return Optional.empty();
        int recentSize = Math.max(2, n / 4);
        int split = n - recentSize;
        double[] earlier = Arrays.copyOfRange(values, 0, split);
        double[] recent = Arrays.copyOfRange(values, split, n);
        double earlierStd = Statistics.stddev(earlier);
        double earlierMedian = Statistics.median(earlier);
        if (earlierStd <= DEGENERATE_STDDEV * Math.max(1.0, Math.abs(earlierMedian))) {
            return Optional.empty();
        }
        double recentMedian = Statistics.median(recent);
        double score = Math.abs(recentMedian - earlierMedian) / earlierStd;
        if (score <= config.getDriftThreshold()) return Optional.empty();
        return Optional.of(AnomalyResult.builder()
                .metric(series.getMetric())
                .tenantId(tenantId)
                .timestamp(series.getSamples().get(split).getTimestamp())
                .value(recentMedian)
                .expectedValue(earlierMedian)
                .deviationScore(score)
                .type(AnomalyType.DRIFT)
                .severity(AnomalySeverity.fromScore(score))
                .context(context)
                .possibleCauses(possibleCauses(series.getMetric(), AnomalyType.DRIFT))
                .build());
    }

    /**
     * Reports gaps wider than {@code missingGapFactor} times the median sampling interval.
     * The deviation score is the gap length in intervals.
     */
    List<AnomalyResult> detectMissing(TimeSeries series, String tenantId, AnomalyContext context) {
        Duration interval = series.medianInterval();
        if (interval.isZero() || interval.isNegative()) return List.of();
        double intervalNanos = interval.toNanos();
        List<AnomalyResult> out = new ArrayList<>();
        List<Sample> samples = series.getSamples();
        for (int i = 1; i < samples.size(); i++) {
            Duration gap = Duration.between(samples.get(i - 1).getTimestamp(), samples.get(i).getTimestamp());
            double ratio = gap.toNanos() / intervalNanos;
            if (ratio > config.getMissingGapFactor()) {
                out.add(AnomalyResult.builder()
                        .metric(series.getMetric())
                        .tenantId(tenantId)
                        .timestamp(samples.get(i - 1).getTimestamp().plus(interval))
                        .value(0.0)
                        .expectedValue(context.getHistoricalAverage())
                        .deviationScore(ratio)
                        .type(AnomalyType.MISSING)
                        .severity(AnomalySeverity.fromScore(ratio))
                        .context(context)
                        .possibleCauses(possibleCauses(series.getMetric(), AnomalyType.MISSING))
                        .build());
            }
        }
        return out;
    }

    static List<String> possibleCauses(String metric, AnomalyType type) {
        List<String> causes = new ArrayList<>();
        if (type == AnomalyType.MISSING) {
            causes.add("Collector outage");
            causes.add("Ingestion pipeline delay");
            return causes;
        }
        String m = metric != null ? metric.toLowerCase(Locale.ROOT) : "";
        if (m.contains("latency")) {
            causes.add("Network congestion");
            causes.add("Database slow queries");
            causes.add("High system load");
        }
        if (m.contains("memory")) {
            causes.add("Memory leak");
            causes.add("High traffic");
            causes.add("Inefficient queries");
        }
        if (m.contains("cpu")) {
            causes.add("High system load");
            causes.add("CPU-bound hot path");
        }
        if (m.contains("error") || m.contains("success_rate")) {
            causes.add("Downstream dependency failure");
            causes.add("Recent deployment");
        }
        if (type == AnomalyType.DRIFT && causes.isEmpty()) {
            causes.add("Sustained change in traffic or workload");
        }
        return causes;
    }

    private static TrendDirection trendOf(double[] values) {
        double slope = Statistics.linearRegression(values).getSlope();
        if (Math.abs(slope) <= FLAT_SLOPE) return TrendDirection.STABLE;
        return slope > 0 ? TrendDirection.INCREASING : TrendDirection.DECREASING;
    }
}
