package com.di.insightengine.insight;

import com.di.insightengine.analytics.anomaly.AnomalyResult;
import com.di.insightengine.analytics.capacity.CapacityResult;
import com.di.insightengine.analytics.correlation.CorrelationResult;
import com.di.insightengine.analytics.seasonality.SeasonalityResult;
import com.di.insightengine.analytics.trend.TrendResult;
import com.di.insightengine.config.AnalyticsProperties;
import com.di.insightengine.exception.ErrorCategory;
import com.di.insightengine.util.AnalyticsMetrics;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Merges analyzer output into ranked insights.
 *
 * <p>The per-metric entry points ({@link #analyzeMetric}, {@link #analyzeSeasonality}) let exceptions through so the
 * caller can isolate them per task; the multi-item entry points ({@link #analyzeCapacity}, {@link #generateInsights})
 * catch per item, log with the {@link ErrorCategory} and carry on.
 */
@Slf4j
@Component
public class InsightAggregator {

    /** Highest impact first; ties broken by type then id so the order is stable. */
    public static final Comparator<Insight> BY_IMPACT = Comparator.comparingDouble(Insight::getImpact).reversed()
            .thenComparing(Insight::getType)
            .thenComparing(Insight::getId);

    private final AnalyticsService analyticsService;
    private final InsightFactory insightFactory;
    private final AnalyticsProperties properties;
    private final AnalyticsMetrics metrics;

    public InsightAggregator(AnalyticsService analyticsService, InsightFactory insightFactory,
                             AnalyticsProperties properties, AnalyticsMetrics metrics) {
        this.analyticsService = analyticsService;
        this.insightFactory = insightFactory;
        this.properties = properties;
        this.metrics = metrics;
    }

    /** Trend and anomaly pass for one metric. */
    public MetricAnalysis analyzeMetric(String metric, String window, String tenantId) {
        String tenant = analyticsService.resolveTenant(tenantId);
        TrendResult trend = analyticsService.analyzeTrend(metric, window, tenant);
        List<AnomalyResult> anomalies = analyticsService.detectAnomalies(metric, window, tenant);
        List<Insight> insights = new ArrayList<>();
        insightFactory.fromTrend(trend, tenant).ifPresent(insights::add);
        for (AnomalyResult anomaly : anomalies) {
            metrics.recordAnomaly(anomaly.getSeverity());
            insights.add(insightFactory.fromAnomaly(anomaly, window));
        }
        return new MetricAnalysis(metric, trend, anomalies, insights);
    }

    /** Capacity pass over the configured components; a failing component is skipped. */
    public List<Insight> analyzeCapacity(String tenantId) {
        String tenant = analyticsService.resolveTenant(tenantId);
        List<Insight> insights = new ArrayList<>();
        for (String component : properties.getCapacity().getComponents()) {
            try {
                CapacityResult capacity = analyticsService.predictCapacity(component, null, tenant);
                insightFactory.fromCapacity(capacity, tenant).ifPresent(insights::add);
            } catch (RuntimeException e) {
                recordFailure("capacity:" + component, e);
            }
        }
        return insights;
    }

    public List<Insight> analyzeCorrelations(List<String> metricNames, String window, String tenantId) {
        String tenant = analyticsService.resolveTenant(tenantId);
        List<CorrelationResult> correlations = analyticsService.analyzeCorrelations(metricNames, window, tenant);
        return insightFactory.fromCorrelations(correlations, tenant, window);
    }

    public List<Insight> analyzeSeasonality(String metric, String window, String tenantId) {
        String tenant = analyticsService.resolveTenant(tenantId);
        SeasonalityResult seasonality = analyticsService.detectSeasonality(metric, window, tenant);
        return insightFactory.fromSeasonality(seasonality, tenant, window).stream().collect(Collectors.toList());
    }

    /**
     * Synchronous insight pass for the read API: trend and anomalies for every known metric, capacity for the
     * configured components and correlations across the first {@code max-metrics} metrics. Ranked, top-N.
     */
    public List<Insight> generateInsights(String window, String tenantId) {
        String tenant = analyticsService.resolveTenant(tenantId);
        String w = window == null || window.isBlank() ? properties.getTrend().getDefaultWindow() : window;
        List<String> metricNames = analyticsService.listMetrics(tenant);
        List<Insight> insights = new ArrayList<>();
        for (String metric : metricNames) {
            try {
                insights.addAll(analyzeMetric(metric, w, tenant).getInsights());
            } catch (RuntimeException e) {
                recordFailure(metric, e);
            }
        }
        insights.addAll(analyzeCapacity(tenant));
        if (metricNames.size() >= 2) {
            try {
                insights.addAll(analyzeCorrelations(metricNames, w, tenant));
            } catch (RuntimeException e) {
                recordFailure("correlation", e);
            }
        }
        List<Insight> ranked = rank(insights, properties.getEngine().getTopN());
        log.info("[AGGREGATOR] tenant={} window={} metrics={} candidates={} returned={}",
                tenant, w, metricNames.size(), insights.size(), ranked.size());
        return ranked;
    }

    public static List<Insight> rank(Collection<Insight> insights, int topN) {
        return insights.stream()
                .sorted(BY_IMPACT)
                .limit(Math.max(0, topN))
                .collect(Collectors.toList());
    }

    public void recordFailure(String item, Throwable e) {
        metrics.recordMetricFailure();
        log.warn("[AGGREGATOR] analysis of {} failed [{}]: {}", item, ErrorCategory.categorize(e), e.getMessage());
    }

    /** Output of one metric's trend and anomaly pass. */
    @Value
    public static class MetricAnalysis {
        String metric;
        TrendResult trend;
        List<AnomalyResult> anomalies;
        List<Insight> insights;
    }
}
