package com.di.insightengine.controller;

import com.di.insightengine.analytics.anomaly.AnomalyResult;
import com.di.insightengine.analytics.capacity.CapacityResult;
import com.di.insightengine.analytics.correlation.CorrelationResult;
import com.di.insightengine.analytics.seasonality.SeasonalityResult;
import com.di.insightengine.analytics.trend.TrendResult;
import com.di.insightengine.config.TimeWindow;
import com.di.insightengine.insight.AnalyticsService;
import com.di.insightengine.insight.Insight;
import com.di.insightengine.insight.InsightAggregator;
import com.di.insightengine.store.InsightStore;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Read API for the monitoring dashboard.
 * Use: GET /api/analytics/trends?metric=api.request.latency&amp;timeWindow=24h
 */
@RestController
@RequestMapping("/api/analytics")
@RequiredArgsConstructor
public class AnalyticsController {

    private static final int DEFAULT_RECENT_LIMIT = 50;

    private final AnalyticsService analyticsService;
    private final InsightAggregator insightAggregator;
    private final InsightStore insightStore;

    /** Runs a synchronous insight pass and returns the top-N by impact. */
    @GetMapping("/insights")
    public ResponseEntity<List<Insight>> insights(
            @RequestParam(required = false) String timeWindow,
            @RequestParam(required = false) String tenantId) {
        validateWindow(timeWindow);
        return ResponseEntity.ok(insightAggregator.generateInsights(timeWindow, tenantId));
    }

    /** Insights persisted by the engine, newest first. */
    @GetMapping("/insights/recent")
    public ResponseEntity<List<Insight>> recentInsights(
            @RequestParam(required = false) String tenantId,
            @RequestParam(defaultValue = "" + DEFAULT_RECENT_LIMIT) int limit) {
        return ResponseEntity.ok(insightStore.findRecentInsights(analyticsService.resolveTenant(tenantId), limit));
    }

    @GetMapping("/trends")
    public ResponseEntity<TrendResult> trends(
            @RequestParam String metric,
            @RequestParam(required = false) String timeWindow,
            @RequestParam(required = false) String tenantId) {
        validateWindow(timeWindow);
        return ResponseEntity.ok(analyticsService.analyzeTrend(requireText(metric, "metric"), timeWindow, tenantId));
    }

    @GetMapping("/anomalies")
    public ResponseEntity<List<AnomalyResult>> anomalies(
            @RequestParam String metric,
            @RequestParam(required = false) String timeWindow,
            @RequestParam(required = false) String tenantId) {
        validateWindow(timeWindow);
        return ResponseEntity.ok(analyticsService.detectAnomalies(requireText(metric, "metric"), timeWindow, tenantId));
    }

    /** Anomalies persisted by the engine (high and critical only), newest first. */
    @GetMapping("/anomalies/recent")
    public ResponseEntity<List<AnomalyResult>> recentAnomalies(
            @RequestParam(required = false) String metric,
            @RequestParam(required = false) String tenantId,
            @RequestParam(defaultValue = "" + DEFAULT_RECENT_LIMIT) int limit) {
        return ResponseEntity.ok(insightStore.findRecentAnomalies(analyticsService.resolveTenant(tenantId), metric, limit));
    }

    @GetMapping("/capacity")
    public ResponseEntity<CapacityResult> capacity(
            @RequestParam String component,
            @RequestParam(required = false) Integer forecastDays,
            @RequestParam(required = false) String tenantId) {
        if (forecastDays != null && forecastDays <= 0) {
            throw new IllegalArgumentException("forecastDays must be > 0");
        }
        return ResponseEntity.ok(analyticsService.predictCapacity(requireText(component, "component"), forecastDays, tenantId));
    }

    /** {@code metrics} is a comma-separated list of at least two names. */
    @GetMapping("/correlations")
    public ResponseEntity<List<CorrelationResult>> correlations(
            @RequestParam String metrics,
            @RequestParam(required = false) String timeWindow,
            @RequestParam(required = false) String tenantId) {
        validateWindow(timeWindow);
        List<String> names = Arrays.stream(metrics.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .distinct()
                .collect(Collectors.toList());
        if (names.size() < 2) {
            throw new IllegalArgumentException("metrics must name at least two metrics");
        }
        return ResponseEntity.ok(analyticsService.analyzeCorrelations(names, timeWindow, tenantId));
    }

    @GetMapping("/seasonality")
    public ResponseEntity<SeasonalityResult> seasonality(
            @RequestParam String metric,
            @RequestParam(required = false) String timeWindow,
            @RequestParam(required = false) String tenantId) {
        validateWindow(timeWindow);
        return ResponseEntity.ok(analyticsService.detectSeasonality(requireText(metric, "metric"), timeWindow, tenantId));
    }

    private static void validateWindow(String timeWindow) {
        if (timeWindow != null && !timeWindow.isBlank()) {
            TimeWindow.parse(timeWindow.trim());
        }
    }

    private static String requireText(String value, String name) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(name + " is required");
        }
        return value.trim();
    }
}
