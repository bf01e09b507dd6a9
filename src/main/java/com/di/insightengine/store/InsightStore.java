package com.di.insightengine.store;

import com.di.insightengine.analytics.anomaly.AnomalyResult;
import com.di.insightengine.insight.Insight;

import java.util.List;

/**
 * Write side for analysis output. Writes are upserts: an anomaly is keyed by
 * (metric, tenant, timestamp, type), an insight by its id, so concurrent writers never collide.
 */
public interface InsightStore {

    void writeAnomaly(AnomalyResult anomaly);

    void writeInsight(Insight insight);

    /** Newest first. */
    List<Insight> findRecentInsights(String tenantId, int limit);

    /** Newest first; a null metric matches every metric. */
    List<AnomalyResult> findRecentAnomalies(String tenantId, String metric, int limit);
}
