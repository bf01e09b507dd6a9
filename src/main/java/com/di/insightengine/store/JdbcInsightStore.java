package com.di.insightengine.store;

import com.di.insightengine.analytics.anomaly.AnomalyContext;
import com.di.insightengine.analytics.anomaly.AnomalyResult;
import com.di.insightengine.analytics.anomaly.AnomalySeverity;
import com.di.insightengine.analytics.anomaly.AnomalyType;
import com.di.insightengine.analytics.trend.TrendDirection;
import com.di.insightengine.insight.Insight;
import com.di.insightengine.insight.InsightImpact;
import com.di.insightengine.insight.InsightType;
import com.di.insightengine.sql.SqlQueriesProperties;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Component;

import java.io.UncheckedIOException;
import java.sql.Array;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * JDBC implementation of InsightStore over {@code anomaly_detections} and {@code performance_insights}.
 * Both writes are {@code INSERT ... ON CONFLICT DO UPDATE}. Enable with insights.persistence-enabled=true.
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "insights.persistence-enabled", havingValue = "true")
public class JdbcInsightStore implements InsightStore {

    private static final TypeReference<List<String>> STRING_LIST = new TypeReference<>() { };
    private static final TypeReference<Map<String, Double>> VALUE_MAP = new TypeReference<>() { };

    private final JdbcTemplate jdbc;
    private final SqlQueriesProperties sql;
    private final ObjectMapper objectMapper;

    private final RowMapper<AnomalyResult> anomalyRowMapper = this::mapAnomaly;
    private final RowMapper<Insight> insightRowMapper = this::mapInsight;

    public JdbcInsightStore(JdbcTemplate jdbcTemplate, SqlQueriesProperties sql, ObjectMapper objectMapper) {
        this.jdbc = jdbcTemplate;
        this.sql = sql;
        this.objectMapper = objectMapper;
    }

    private static Instant toInstant(Timestamp ts) {
        return ts != null ? ts.toInstant() : null;
    }

    private static Timestamp toTimestamp(Instant i) {
        return i != null ? Timestamp.from(i) : null;
    }

    @Override
    public void writeAnomaly(AnomalyResult a) {
        if (a == null || a.getMetric() == null || a.getTimestamp() == null) return;
        String contextJson = toJson(a.getContext());
        List<String> causes = a.getPossibleCauses() != null ? a.getPossibleCauses() : List.of();
        jdbc.update(sql.getAnomaly().getUpsert(), ps -> {
            ps.setString(1, a.getMetric());
            ps.setString(2, a.getTenantId());
            ps.setTimestamp(3, toTimestamp(a.getTimestamp()));
            ps.setString(4, a.getType().wireName());
            ps.setDouble(5, a.getValue());
            ps.setDouble(6, a.getExpectedValue());
            ps.setDouble(7, a.getDeviationScore());
            ps.setString(8, a.getSeverity().wireName());
            ps.setString(9, contextJson);
            ps.setArray(10, ps.getConnection().createArrayOf("text", causes.toArray()));
            ps.setTimestamp(11, toTimestamp(Instant.now()));
        });
        log.debug("[STORE] anomaly upserted metric={} type={} severity={}", a.getMetric(), a.getType(), a.getSeverity());
    }

    @Override
    public void writeInsight(Insight i) {
        if (i == null || i.getId() == null) return;
        jdbc.update(sql.getInsight().getUpsert(),
                i.getId(),
                i.getTenantId(),
                i.getType().wireName(),
                i.getTitle(),
                i.getDescription(),
                i.getImpact(),
                i.getImpactLevel().wireName(),
                i.getConfidence(),
                toJson(i.getMetrics()),
                i.getTimeWindow(),
                toJson(i.getValues()),
                toJson(i.getRecommendations()),
                toTimestamp(i.getCreatedAt() != null ? i.getCreatedAt() : Instant.now()));
        log.debug("[STORE] insight upserted id={} type={} level={}", i.getId(), i.getType(), i.getImpactLevel());
    }

    @Override
    public List<Insight> findRecentInsights(String tenantId, int limit) {
        return jdbc.query(sql.getInsight().getFindRecent(), insightRowMapper, tenantId, Math.max(1, limit));
    }

    @Override
    public List<AnomalyResult> findRecentAnomalies(String tenantId, String metric, int limit) {
        int lim = Math.max(1, limit);
        if (metric == null || metric.isBlank()) {
            return jdbc.query(sql.getAnomaly().getFindRecent(), anomalyRowMapper, tenantId, lim);
        }
        return jdbc.query(sql.getAnomaly().getFindRecentByMetric(), anomalyRowMapper, tenantId, metric.trim(), lim);
    }

    private AnomalyResult mapAnomaly(ResultSet rs, int rowNum) throws SQLException {
        Array causes = rs.getArray("possible_causes");
        return AnomalyResult.builder()
                .metric(rs.getString("metric"))
                .tenantId(rs.getString("tenant_id"))
                .timestamp(toInstant(rs.getTimestamp("timestamp")))
                .type(AnomalyType.valueOf(rs.getString("anomaly_type").toUpperCase(Locale.ROOT)))
                .value(rs.getDouble("value"))
                .expectedValue(rs.getDouble("expected_value"))
                .deviationScore(rs.getDouble("deviation_score"))
                .severity(AnomalySeverity.valueOf(rs.getString("severity").toUpperCase(Locale.ROOT)))
                .context(readContext(rs.getString("context")))
                .possibleCauses(causes != null ? Arrays.asList((String[]) causes.getArray()) : List.of())
                .build();
    }

    private Insight mapInsight(ResultSet rs, int rowNum) throws SQLException {
        return Insight.builder()
                .id(rs.getString("id"))
                .tenantId(rs.getString("tenant_id"))
                .type(InsightType.fromWireName(rs.getString("type")))
                .title(rs.getString("title"))
                .description(rs.getString("description"))
                .impact(rs.getDouble("impact_score"))
                .impactLevel(InsightImpact.fromWireName(rs.getString("impact")))
                .confidence(rs.getDouble("confidence"))
                .metrics(fromJson(rs.getString("metrics"), STRING_LIST))
                .timeWindow(rs.getString("time_window"))
                .values(fromJson(rs.getString("data"), VALUE_MAP))
                .recommendations(fromJson(rs.getString("recommendations"), STRING_LIST))
                .createdAt(toInstant(rs.getTimestamp("created_at")))
                .build();
    }

    private AnomalyContext readContext(String json) {
        if (json == null) return null;
        try {
            JsonNode node = objectMapper.readTree(json);
            JsonNode trend = node.get("recentTrend");
            return AnomalyContext.builder()
                    .historicalAverage(node.path("historicalAverage").asDouble())
                    .historicalStddev(node.path("historicalStddev").asDouble())
                    .recentTrend(trend != null && !trend.isNull()
                            ? TrendDirection.valueOf(trend.asText().toUpperCase(Locale.ROOT)) : null)
                    .sampleCount(node.path("sampleCount").asInt())
                    .build();
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Malformed anomaly context: " + json, e);
        }
    }

    private String toJson(Object value) {
        if (value == null) return null;
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Cannot serialize " + value.getClass().getSimpleName(), e);
        }
    }

    private <T> T fromJson(String json, TypeReference<T> type) {
        if (json == null) return null;
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Malformed JSON column: " + json, e);
        }
    }
}
