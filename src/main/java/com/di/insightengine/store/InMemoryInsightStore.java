package com.di.insightengine.store;

import com.di.insightengine.analytics.anomaly.AnomalyResult;
import com.di.insightengine.insight.Insight;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * In-memory implementation of InsightStore. Suitable for single-node and testing.
 * When insights.persistence-enabled=true, JdbcInsightStore is used instead.
 */
@Component
@ConditionalOnProperty(name = "insights.persistence-enabled", havingValue = "false", matchIfMissing = true)
public class InMemoryInsightStore implements InsightStore {

    private final Map<String, Insight> insightsById = new ConcurrentHashMap<>();
    private final Map<String, AnomalyResult> anomaliesByKey = new ConcurrentHashMap<>();

    @Override
    public void writeAnomaly(AnomalyResult anomaly) {
        if (anomaly == null || anomaly.getMetric() == null || anomaly.getTimestamp() == null) return;
        anomaliesByKey.put(anomalyKey(anomaly), anomaly);
    }

    @Override
    public void writeInsight(Insight insight) {
        if (insight == null || insight.getId() == null) return;
        insightsById.put(insight.getId(), insight);
    }

    @Override
    public List<Insight> findRecentInsights(String tenantId, int limit) {
        return insightsById.values().stream()
                .filter(i -> Objects.equals(i.getTenantId(), tenantId))
                .sorted(Comparator.comparing(Insight::getCreatedAt, Comparator.nullsLast(Comparator.reverseOrder())))
                .limit(Math.max(1, limit))
                .collect(Collectors.toList());
    }

    @Override
    public List<AnomalyResult> findRecentAnomalies(String tenantId, String metric, int limit) {
        return anomaliesByKey.values().stream()
                .filter(a -> Objects.equals(a.getTenantId(), tenantId))
                .filter(a -> metric == null || metric.equals(a.getMetric()))
                .sorted(Comparator.comparing(AnomalyResult::getTimestamp).reversed())
                .limit(Math.max(1, limit))
                .collect(Collectors.toList());
    }

    private static String anomalyKey(AnomalyResult a) {
        return a.getMetric() + '|' + a.getTenantId() + '|' + a.getTimestamp() + '|' + a.getType();
    }
}
