package com.di.insightengine.insight;

import com.di.insightengine.analytics.anomaly.AnomalyDetector;
import com.di.insightengine.analytics.anomaly.AnomalyResult;
import com.di.insightengine.analytics.capacity.CapacityPredictor;
import com.di.insightengine.analytics.capacity.CapacityResult;
import com.di.insightengine.analytics.correlation.CorrelationAnalyzer;
import com.di.insightengine.analytics.correlation.CorrelationResult;
import com.di.insightengine.analytics.seasonality.SeasonalityDetector;
import com.di.insightengine.analytics.seasonality.SeasonalityResult;
import com.di.insightengine.analytics.trend.TrendAnalyzer;
import com.di.insightengine.analytics.trend.TrendResult;
import com.di.insightengine.config.AnalyticsProperties;
import com.di.insightengine.config.TimeWindow;
import com.di.insightengine.model.TimeSeries;
import com.di.insightengine.store.TimeSeriesStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Fetch-then-analyze operations over the metric store, one per analysis kind.
 *
 * <p>Each call reads {@code [now - window, now)} fresh from the {@link TimeSeriesStore}; nothing is cached between
 * calls. A null window or tenant falls back to the configured default. Store failures propagate as
 * {@link com.di.insightengine.exception.TimeSeriesStoreException}.
 */
@Slf4j
@Service
public class AnalyticsService {

    private final TimeSeriesStore timeSeriesStore;
    private final TrendAnalyzer trendAnalyzer;
    private final AnomalyDetector anomalyDetector;
    private final CorrelationAnalyzer correlationAnalyzer;
    private final SeasonalityDetector seasonalityDetector;
    private final CapacityPredictor capacityPredictor;
    private final AnalyticsProperties properties;
    private final Clock clock;

    public AnalyticsService(TimeSeriesStore timeSeriesStore,
                            TrendAnalyzer trendAnalyzer,
                            AnomalyDetector anomalyDetector,
                            CorrelationAnalyzer correlationAnalyzer,
                            SeasonalityDetector seasonalityDetector,
                            CapacityPredictor capacityPredictor,
                            AnalyticsProperties properties,
                            Clock clock) {
        this.timeSeriesStore = timeSeriesStore;
        this.trendAnalyzer = trendAnalyzer;
        this.anomalyDetector = anomalyDetector;
        this.correlationAnalyzer = correlationAnalyzer;
        this.seasonalityDetector = seasonalityDetector;
        this.capacityPredictor = capacityPredictor;
        this.properties = properties;
        this.clock = clock;
    }

    public TrendResult analyzeTrend(String metric, String window, String tenantId) {
        String w = orDefault(window, properties.getTrend().getDefaultWindow());
        return trendAnalyzer.analyze(fetch(metric, w, tenantId), w);
    }

    public List<AnomalyResult> detectAnomalies(String metric, String window, String tenantId) {
        String w = orDefault(window, properties.getAnomaly().getDefaultWindow());
        return anomalyDetector.detect(fetch(metric, w, tenantId), resolveTenant(tenantId));
    }

    /**
     * Utilization metrics of the component ({@code <component>.*usage*|*utilization*}) over the capacity window.
     */
    public CapacityResult predictCapacity(String component, Integer forecastDays, String tenantId) {
        int days = forecastDays != null && forecastDays > 0 ? forecastDays : properties.getCapacity().getForecastDays();
        String w = properties.getCapacity().getWindow();
        Map<String, TimeSeries> series = new LinkedHashMap<>();
        for (String metric : listMetrics(tenantId)) {
            if (CapacityPredictor.isUtilizationMetric(component, metric)) {
                series.put(metric, fetch(metric, w, tenantId));
            }
        }
        return capacityPredictor.predict(component, series, days);
    }

    /**
     * Correlates the given metrics; duplicates are dropped and the set is cut to {@code max-metrics}
     * before anything is fetched.
     */
    public List<CorrelationResult> analyzeCorrelations(List<String> metrics, String window, String tenantId) {
        String w = orDefault(window, properties.getCorrelation().getDefaultWindow());
        List<String> distinct = new ArrayList<>(new LinkedHashSet<>(metrics));
        int max = properties.getCorrelation().getMaxMetrics();
        if (distinct.size() > max) {
            log.warn("[CORRELATION] {} metrics requested, analysing the first {} (max-metrics)", distinct.size(), max);
            distinct = distinct.subList(0, max);
        }
        Map<String, TimeSeries> series = new LinkedHashMap<>();
        for (String metric : distinct) {
            series.put(metric, fetch(metric, w, tenantId));
        }
        return correlationAnalyzer.analyze(series);
    }

    public SeasonalityResult detectSeasonality(String metric, String window, String tenantId) {
        String w = orDefault(window, properties.getSeasonality().getDefaultWindow());
        return seasonalityDetector.detect(fetch(metric, w, tenantId));
    }

    public List<String> listMetrics(String tenantId) {
        return timeSeriesStore.listMetricNames(resolveTenant(tenantId));
    }

    /**
     * Metrics the scheduled passes analyse: the configured critical metrics that exist for the tenant,
     * or every known metric when {@code include-all-metrics} is set.
     */
    public List<String> trackedMetrics(String tenantId) {
        List<String> known = listMetrics(tenantId);
        if (properties.getEngine().isIncludeAllMetrics()) {
            return known;
        }
        return properties.getEngine().getCriticalMetrics().stream()
                .filter(known::contains)
                .collect(Collectors.toList());
    }

    public String resolveTenant(String tenantId) {
        return tenantId == null || tenantId.isBlank() ? properties.getDefaultTenantId() : tenantId.trim();
    }

    TimeSeries fetch(String metric, String window, String tenantId) {
        Duration length = TimeWindow.parse(window);
        Instant end = Instant.now(clock);
        return timeSeriesStore.getSeries(metric, resolveTenant(tenantId), end.minus(length), end);
    }

    private static String orDefault(String window, String fallback) {
        return window == null || window.isBlank() ? fallback : window.trim();
    }
}
