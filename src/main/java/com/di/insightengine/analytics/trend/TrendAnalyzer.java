package com.di.insightengine.analytics.trend;

import com.di.insightengine.config.AnalyticsProperties;
import com.di.insightengine.model.TimeSeries;
import com.di.insightengine.stats.RegressionResult;
import com.di.insightengine.stats.Statistics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Index-as-time linear trend over a series plus a short extrapolated forecast.
 *
 * <p>The regression uses the sample index as x (not wall-clock), so irregular sampling does not skew the slope.
 * Stateless; safe to call from several worker threads.
 */
@Slf4j
@Component
public class TrendAnalyzer {

    private static final double FORECAST_CONFIDENCE_FLOOR = 0.1;
    private static final double CONFIDENCE_DECAY_PER_STEP = 0.02;
    private static final double INTERVAL_GROWTH_PER_STEP = 0.1;

    private final AnalyticsProperties.Trend config;

    public TrendAnalyzer(AnalyticsProperties properties) {
        this.config = properties.getTrend();
    }

    /**
     * Analyzes the series with the configured forecast horizon.
     */
    public TrendResult analyze(TimeSeries series, String window) {
        return analyze(series, window, config.getForecastHorizon());
    }

    /**
     * Fits the trend and forecasts {@code horizon} steps past the last sample.
     * Fewer than the minimum sample count yields {@link TrendResult#empty}, never an exception.
     */
    public TrendResult analyze(TimeSeries series, String window, int horizon) {
        String metric = series != null ? series.getMetric() : null;
        int n = series != null ? series.size() : 0;
        if (n < Math.max(3, config.getMinSamples())) {
            log.debug("[TREND] metric={} window={} insufficient samples n={}", metric, window, n);
            return TrendResult.empty(metric, window, n);
        }

        double[] values = series.values();
        TrendFit fit = fit(values);
        double correlation = Statistics.pearson(Statistics.indices(n), values);
        List<ForecastPoint> forecast = forecast(series, horizon);
        List<String> insights = new ArrayList<>();
        if (fit.confidence > config.getInsightConfidence() && fit.direction != TrendDirection.STABLE) {
            insights.add(String.format(Locale.ROOT, "%s shows %s trend with %.1f%% change rate",
                    metric, fit.direction.wireName(), fit.changeRatePct));
        }

        log.debug("[TREND] metric={} window={} n={} direction={} rate={} confidence={}",
                metric, window, n, fit.direction, fit.changeRatePct, fit.confidence);

        return TrendResult.builder()
                .metric(metric)
                .window(window)
                .direction(fit.direction)
                .changeRatePct(fit.changeRatePct)
                .confidence(fit.confidence)
                .sampleCount(n)
                .slope(fit.regression.getSlope())
                .intercept(fit.regression.getIntercept())
                .correlation(correlation)
                .sampleInterval(series.meanInterval())
                .forecast(forecast)
                .insights(insights)
                .build();
    }

    /**
     * Forecast from the trailing window: {@code predicted[h] = recentAvg * (1 + trendAdjustment(h) / 100)},
     * band half-width {@code stddev * (1 + 0.1h)}, confidence {@code max(0.1, confidence * (1 - 0.02h))}.
     */
    public List<ForecastPoint> forecast(TimeSeries series, int horizon) {
        if (series == null || horizon <= 0) return List.of();
        int windowSize = Math.min(Math.max(1, config.getForecastWindow()), series.size());
        if (windowSize < 3) return List.of();

        TimeSeries recent = series.tail(windowSize);
        double[] recentValues = recent.values();
        TrendFit recentFit = fit(recentValues);
        double recentAvg = Statistics.mean(recentValues);
        double spread = Statistics.stddev(recentValues);
        Duration step = config.getForecastStepDuration();
        Instant last = series.last().getTimestamp();

        List<ForecastPoint> out = new ArrayList<>(horizon);
        for (int h = 1; h <= horizon; h++) {
            double adjustment = trendAdjustment(recentFit, h);
            double predicted = Math.max(0.0, recentAvg + (adjustment / 100.0) * recentAvg);
            double halfWidth = spread * (1.0 + h * INTERVAL_GROWTH_PER_STEP);
            double confidence = Math.max(FORECAST_CONFIDENCE_FLOOR,
                    recentFit.confidence * (1.0 - h * CONFIDENCE_DECAY_PER_STEP));
            out.add(ForecastPoint.builder()
                    .timestamp(last.plus(step.multipliedBy(h)))
                    .predicted(predicted)
                    .lower(Math.max(0.0, predicted - halfWidth))
                    .upper(predicted + halfWidth)
                    .confidence(confidence)
                    .build());
        }
        return out;
    }

    /** Fits direction, rate and confidence to raw values (x = index). */
    TrendFit fit(double[] values) {
        RegressionResult regression = Statistics.linearRegression(values);
        double slope = regression.getSlope();
        TrendDirection direction = Math.abs(slope) <= config.getFlatSlopeThreshold()
                ? TrendDirection.STABLE
                : (slope > 0 ? TrendDirection.INCREASING : TrendDirection.DECREASING);
        double confidence = Statistics.clamp(regression.getRSquared(), 0.0, 1.0);
        return new TrendFit(direction, Math.abs(slope) * 100.0, confidence, regression);
    }

    private static double trendAdjustment(TrendFit fit, int h) {
        switch (fit.direction) {
            case INCREASING: return fit.changeRatePct * h;
            case DECREASING: return -fit.changeRatePct * h;
            default: return 0.0;
        }
    }

    /** Intermediate fit; not exposed outside the package. */
    static final class TrendFit {
        final TrendDirection direction;
        final double changeRatePct;
        final double confidence;
        final RegressionResult regression;

        TrendFit(TrendDirection direction, double changeRatePct, double confidence, RegressionResult regression) {
            this.direction = direction;
            this.changeRatePct = changeRatePct;
            this.confidence = confidence;
            this.regression = regression;
        }
    }
}
