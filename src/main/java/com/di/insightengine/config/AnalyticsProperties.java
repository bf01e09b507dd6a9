package com.di.insightengine.config;

import jakarta.annotation.PostConstruct;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Single binding for all analytics configuration.
 *
 * <p>Thresholds are heuristic defaults, not derived constants; tune them per deployment.
 *
 * <pre>
 * insights:
 *   analytics:
 *     trend:
 *       default-window: 24h
 *       flat-slope-threshold: 0.01
 *     anomaly:
 *       score-threshold: 2.5
 *     correlation:
 *       threshold: 0.3
 *       max-metrics: 10
 *       max-lag-buckets: 6
 *     capacity:
 *       threshold-pct: 90
 *     engine:
 *       tick-interval: 5m
 *       full-sweep-interval: 1d
 * </pre>
 *
 * <p>Every window string is parsed in {@link #validate()} so a malformed value fails the context
 * before the engine starts.
 */
@Slf4j
@Data
@Component
@ConfigurationProperties(prefix = "insights.analytics")
public class AnalyticsProperties {

    /** Tenant used when a request or tick does not name one. */
    private String defaultTenantId = "00000000-0000-0000-0000-000000000000";

    private Trend trend = new Trend();
    private Anomaly anomaly = new Anomaly();
    private Correlation correlation = new Correlation();
    private Seasonality seasonality = new Seasonality();
    private Capacity capacity = new Capacity();
    private Engine engine = new Engine();

    @PostConstruct
    public void validate() {
        TimeWindow.parse(trend.getDefaultWindow());
        TimeWindow.parse(trend.getForecastStep());
        TimeWindow.parse(anomaly.getDefaultWindow());
        TimeWindow.parse(correlation.getDefaultWindow());
        TimeWindow.parse(correlation.getBucket());
        TimeWindow.parse(seasonality.getDefaultWindow());
        TimeWindow.parse(capacity.getWindow());
        Duration tickInterval = TimeWindow.parse(engine.getTickInterval());
        TimeWindow.parse(engine.getFullSweepInterval());
        Duration tickTimeout = TimeWindow.parse(engine.getTickTimeout());
        TimeWindow.parse(engine.getShortWindow());
        TimeWindow.parse(engine.getSweepWindow());
        if (tickTimeout.compareTo(tickInterval) >= 0) {
            throw new IllegalArgumentException("insights.analytics.engine.tick-timeout (" + engine.getTickTimeout()
                    + ") must be shorter than tick-interval (" + engine.getTickInterval() + ")");
        }
        if (correlation.getMaxMetrics() < 2) {
            throw new IllegalArgumentException("insights.analytics.correlation.max-metrics must be >= 2");
        }
        if (correlation.getMaxLagBuckets() < 0) {
            throw new IllegalArgumentException("insights.analytics.correlation.max-lag-buckets must be >= 0");
        }
        if (engine.getWorkerPoolCap() < 1) {
            throw new IllegalArgumentException("insights.analytics.engine.worker-pool-cap must be >= 1");
        }
        if (engine.getTopN() < 1) {
            throw new IllegalArgumentException("insights.analytics.engine.top-n must be >= 1");
        }
        log.info("[CONFIG] Analytics configured: tick={} sweep={} scoreThreshold={} corrThreshold={} capacity={}%",
                engine.getTickInterval(), engine.getFullSweepInterval(), anomaly.getScoreThreshold(),
                correlation.getThreshold(), capacity.getThresholdPct());
    }

    @Data
    public static class Trend {
        private String defaultWindow = "24h";
        /** |slope| at or below this is reported as stable. */
        private double flatSlopeThreshold = 0.01;
        /** Minimum samples for a non-empty trend. */
        private int minSamples = 3;
        /** Number of trailing samples the forecast is fitted on. */
        private int forecastWindow = 10;
        private int forecastHorizon = 24;
        private String forecastStep = "1h";
        /** Trend confidence above which a textual trend insight is attached. */
        private double insightConfidence = 0.7;

        public Duration getForecastStepDuration() {
            return TimeWindow.parse(forecastStep);
        }
    }

    @Data
    public static class Anomaly {
        private String defaultWindow = "7d";
        /** Deviation score above which a sample is flagged. */
        private double scoreThreshold = 2.5;
        /** A gap wider than this multiple of the median interval is reported as missing data. */
        private double missingGapFactor = 3.0;
        /** Median shift, in baseline stddevs, that is reported as drift. */
        private double driftThreshold = 3.0;
        private int driftMinSamples = 8;
        private boolean driftEnabled = true;
    }

    @Data
    public static class Correlation {
        private String defaultWindow = "24h";
        private double threshold = 0.3;
        /** Hard cap on the metric-set size of one correlation pass. */
        private int maxMetrics = 10;
        /** Hard cap on the lag search range, in buckets each side. */
        private int maxLagBuckets = 6;
        /** Alignment granularity. */
        private String bucket = "5m";
        /** Minimum overlapping buckets for a coefficient to be considered. */
        private int minSamples = 10;

        public Duration getBucketDuration() {
            return TimeWindow.parse(bucket);
        }
    }

    @Data
    public static class Seasonality {
        private String defaultWindow = "30d";
        private double minStrength = 0.3;
        private String zoneId = "UTC";
        private int peakCount = 3;
        private int predictionHorizon = 24;
        /** Minimum number of populated buckets for a period to be evaluated. */
        private int minBuckets = 2;
    }

    @Data
    public static class Capacity {
        private String window = "30d";
        private int forecastDays = 30;
        /** Utilization (%) at which a component is considered saturated. */
        private double thresholdPct = 90.0;
        private int urgentDays = 14;
        private int highDays = 30;
        private List<String> components = new ArrayList<>(List.of("notifications", "database", "api"));
    }

    @Data
    public static class Engine {
        private boolean enabled = true;
        private String tickInterval = "5m";
        private String fullSweepInterval = "1d";
        /** Upper bound for one tick; outstanding per-metric work is abandoned after it. */
        private String tickTimeout = "4m";
        /** Window analysed by the short (per-tick) trend and anomaly pass. */
        private String shortWindow = "1h";
        /** Window analysed by the daily correlation and seasonality sweep. */
        private String sweepWindow = "7d";
        private int workerPoolCap = 4;
        private int topN = 20;
        /** Bounded queue in front of the insight-store writer. */
        private int writeQueueCapacity = 1000;
        private List<String> criticalMetrics = new ArrayList<>(List.of(
                "notification.delivery.latency",
                "notification.delivery.success_rate",
                "database.query.latency",
                "api.request.latency",
                "system.memory.usage",
                "system.cpu.usage"));
        /** When true, every metric the store knows for the tenant is analysed, not only critical ones. */
        private boolean includeAllMetrics = false;
        /** Tenants analysed by scheduled passes; empty means the default tenant only. */
        private List<String> tenants = new ArrayList<>();
    }
}
