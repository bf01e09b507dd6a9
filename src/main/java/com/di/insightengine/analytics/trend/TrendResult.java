package com.di.insightengine.analytics.trend;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.util.List;

/**
 * Direction, rate and confidence of a metric's trend, with a forward forecast.
 * {@code direction} is {@link TrendDirection#STABLE} whenever |slope| is within the flat threshold.
 */
@Value
@Builder
public class TrendResult {
    String metric;
    String window;
    TrendDirection direction;
    /** |slope| x 100, slope measured per sample. */
    double changeRatePct;
    /** R squared clamped to [0, 1]. */
    double confidence;
    int sampleCount;
    /** Signed regression slope per sample. */
    double slope;
    double intercept;
    /** Pearson correlation of sample index against value. */
    double correlation;
    /** Mean spacing of the analysed samples; zero when fewer than 2. */
    Duration sampleInterval;
    List<ForecastPoint> forecast;
    List<String> insights;

    /** Neutral result for series too short to fit: stable, zero confidence, no forecast. */
    public static TrendResult empty(String metric, String window, int sampleCount) {
        return TrendResult.builder()
                .metric(metric)
                .window(window)
                .direction(TrendDirection.STABLE)
                .changeRatePct(0.0)
                .confidence(0.0)
                .sampleCount(sampleCount)
                .slope(0.0)
                .intercept(0.0)
                .correlation(0.0)
                .sampleInterval(Duration.ZERO)
                .forecast(List.of())
                .insights(List.of())
                .build();
    }

    /**
     * Signed slope converted to change per day, using the mean sampling interval.
     * Zero when the interval is unknown.
     */
    public double slopePerDay() {
        if (sampleInterval == null || sampleInterval.isZero() || sampleInterval.isNegative()) return 0.0;
        double samplesPerDay = (double) Duration.ofDays(1).toNanos() / sampleInterval.toNanos();
        return slope * samplesPerDay;
    }
}
