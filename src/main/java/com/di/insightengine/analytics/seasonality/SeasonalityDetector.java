package com.di.insightengine.analytics.seasonality;

import com.di.insightengine.config.AnalyticsProperties;
import com.di.insightengine.model.Sample;
import com.di.insightengine.model.TimeSeries;
import com.di.insightengine.stats.Statistics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Hourly, daily and weekly seasonality by bucket means.
 *
 * <p>strength = between-bucket variance / total variance, so it lies in [0, 1]; a constant series has strength 0.
 */
@Slf4j
@Component
public class SeasonalityDetector {

    private final AnalyticsProperties.Seasonality config;
    private final ZoneId zone;

    public SeasonalityDetector(AnalyticsProperties properties) {
        this.config = properties.getSeasonality();
        this.zone = ZoneId.of(config.getZoneId());
    }

    public SeasonalityResult detect(TimeSeries series) {
        if (series == null || series.size() < 2) {
            return SeasonalityResult.empty(series != null ? series.getMetric() : null);
        }
        List<SeasonalPattern> patterns = new ArrayList<>();
        for (SeasonalPeriod period : SeasonalPeriod.values()) {
            evaluate(series, period)
                    .filter(p -> p.getStrength() > config.getMinStrength())
                    .ifPresent(patterns::add);
        }
        patterns.sort(Comparator.comparingDouble(SeasonalPattern::getStrength).reversed());

        List<SeasonalPrediction> predictions = patterns.isEmpty()
                ? List.of()
                : predictHourly(patterns.get(0), series.last().getTimestamp(), config.getPredictionHorizon());
        log.debug("[SEASONALITY] metric={} n={} patterns={}", series.getMetric(), series.size(), patterns.size());
        return SeasonalityResult.builder()
                .metric(series.getMetric())
                .patterns(List.copyOf(patterns))
                .predictions(predictions)
                .build();
    }

    /**
     * Buckets the series by {@code period} and computes strength, peaks and valleys, whatever the strength.
     * Empty when fewer than {@code minBuckets} buckets are populated.
     */
    public Optional<SeasonalPattern> evaluate(TimeSeries series, SeasonalPeriod period) {
        int bucketCount = period.getBucketCount();
        List<List<Double>> grouped = new ArrayList<>(bucketCount);
        for (int i = 0; i < bucketCount; i++) grouped.add(new ArrayList<>());
        for (Sample s : series.getSamples()) {
            grouped.get(period.bucketOf(s.getTimestamp().atZone(zone))).add(s.getValue());
        }

        List<BucketStat> buckets = new ArrayList<>();
        for (int i = 0; i < bucketCount; i++) {
            List<Double> values = grouped.get(i);
            if (values.isEmpty()) continue;
            double[] arr = values.stream().mapToDouble(Double::doubleValue).toArray();
            buckets.add(BucketStat.builder()
                    .bucket(i)
                    .label(period.label(i))
                    .mean(Statistics.mean(arr))
                    .stddev(Statistics.stddev(arr))
                    .count(arr.length)
                    .build());
        }
        if (buckets.size() < Math.max(2, config.getMinBuckets())) {
            return Optional.empty();
        }

        double[] all = series.values();
        double total = Statistics.variance(all);
        double strength = 0.0;
        if (total > 0) {
            double grand = Statistics.mean(all);
            double between = 0.0;
            for (BucketStat b : buckets) {
                between += b.getCount() * (b.getMean() - grand) * (b.getMean() - grand);
            }
            strength = Statistics.clamp(between / all.length / total, 0.0, 1.0);
        }

        int k = Math.max(0, config.getPeakCount());
        List<BucketStat> byMeanDesc = new ArrayList<>(buckets);
        byMeanDesc.sort(Comparator.comparingDouble(BucketStat::getMean).reversed());
        List<BucketStat> byMeanAsc = new ArrayList<>(buckets);
        byMeanAsc.sort(Comparator.comparingDouble(BucketStat::getMean));

        return Optional.of(SeasonalPattern.builder()
                .periodType(period)
                .strength(strength)
                .peaks(List.copyOf(byMeanDesc.subList(0, Math.min(k, byMeanDesc.size()))))
                .valleys(List.copyOf(byMeanAsc.subList(0, Math.min(k, byMeanAsc.size()))))
                .buckets(List.copyOf(buckets))
                .build());
    }

    /**
     * Expected value at {@code at}: the mean of its bucket, range ± one bucket stddev (lower floored at 0).
     * Empty when that bucket had no history.
     */
    public Optional<SeasonalPrediction> predict(SeasonalPattern pattern, Instant at) {
        BucketStat bucket = pattern.bucket(pattern.getPeriodType().bucketOf(at.atZone(zone)));
        if (bucket == null) return Optional.empty();
        return Optional.of(SeasonalPrediction.builder()
                .timestamp(at)
                .periodType(pattern.getPeriodType())
                .expected(bucket.getMean())
                .lower(Math.max(0.0, bucket.getMean() - bucket.getStddev()))
                .upper(bucket.getMean() + bucket.getStddev())
                .build());
    }

    private List<SeasonalPrediction> predictHourly(SeasonalPattern pattern, Instant last, int horizon) {
        Instant next = last.truncatedTo(ChronoUnit.HOURS).plus(Duration.ofHours(1));
        List<SeasonalPrediction> out = new ArrayList<>();
        for (int h = 0; h < horizon; h++) {
            predict(pattern, next.plus(Duration.ofHours(h))).ifPresent(out::add);
        }
        return out;
    }
}
