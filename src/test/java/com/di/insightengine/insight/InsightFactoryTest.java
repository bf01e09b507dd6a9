package com.di.insightengine.insight;

import com.di.insightengine.analytics.anomaly.AnomalyResult;
import com.di.insightengine.analytics.anomaly.AnomalySeverity;
import com.di.insightengine.analytics.anomaly.AnomalyType;
import com.di.insightengine.analytics.capacity.CapacityRecommendation;
import com.di.insightengine.analytics.capacity.CapacityResult;
import com.di.insightengine.analytics.capacity.RecommendationPriority;
import com.di.insightengine.analytics.capacity.RecommendationType;
import com.di.insightengine.analytics.correlation.CorrelatedMetric;
import com.di.insightengine.analytics.correlation.CorrelationResult;
import com.di.insightengine.analytics.seasonality.SeasonalityResult;
import com.di.insightengine.analytics.trend.TrendDirection;
import com.di.insightengine.analytics.trend.TrendResult;
import com.di.insightengine.config.AnalyticsProperties;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("InsightFactory Tests")
class InsightFactoryTest {

    private static final Instant NOW = Instant.parse("2024-03-01T12:00:00Z");
    private static final String TENANT = "t";

    private final InsightFactory factory = new InsightFactory(new AnalyticsProperties(), Clock.fixed(NOW, ZoneOffset.UTC));

    private static AnomalyResult anomaly(double score) {
        return AnomalyResult.builder()
                .metric("api.request.latency")
                .tenantId(TENANT)
                .timestamp(NOW.minusSeconds(60))
                .value(150)
                .expectedValue(100)
                .deviationScore(score)
                .type(AnomalyType.SPIKE)
                .severity(AnomalySeverity.fromScore(score))
                .possibleCauses(List.of("Network congestion"))
                .build();
    }

    private static TrendResult trend(double rate, double confidence, List<String> insights) {
        return TrendResult.builder()
                .metric("database.query.latency")
                .window("24h")
                .direction(TrendDirection.INCREASING)
                .changeRatePct(rate)
                .confidence(confidence)
                .sampleCount(50)
                .slope(rate / 100)
                .sampleInterval(Duration.ofMinutes(1))
                .forecast(List.of())
                .insights(insights)
                .build();
    }

    @Test
    @DisplayName("Critical anomaly is a critical insight weighted by severity")
    void testCriticalAnomaly() {
        Insight insight = factory.fromAnomaly(anomaly(50), "1h");

        assertEquals(InsightType.ANOMALY, insight.getType());
        assertEquals(4.0, insight.getImpact(), 1e-9);
        assertEquals(InsightImpact.CRITICAL, insight.getImpactLevel());
        assertEquals(TENANT, insight.getTenantId());
        assertEquals(NOW, insight.getCreatedAt());
        assertEquals(List.of("Check for network congestion"), insight.getRecommendations());
        assertNotNull(insight.getId());
    }

    @Test
    @DisplayName("Insight values keep their order and cannot be modified")
    void testValuesAreReadOnly() {
        Insight insight = factory.fromAnomaly(anomaly(50), "1h");

        assertEquals(List.of("value", "expectedValue", "deviationScore"), List.copyOf(insight.getValues().keySet()));
        assertThrows(UnsupportedOperationException.class, () -> insight.getValues().put("value", 0.0));
        assertEquals(150.0, insight.getValues().get("value"), 1e-9);
    }

    @Test
    @DisplayName("Medium anomaly scales confidence by score")
    void testMediumAnomaly() {
        Insight insight = factory.fromAnomaly(anomaly(2.8), "1h");

        assertEquals(0.7 * 2.0, insight.getImpact(), 1e-9);
        assertEquals(InsightImpact.MEDIUM, insight.getImpactLevel());
    }

    @Test
    @DisplayName("Trend magnitude is the change rate capped at 3")
    void testTrendMagnitude() {
        Insight moderate = factory.fromTrend(trend(100, 0.9, List.of("rising")), TENANT).orElseThrow();
        Insight steep = factory.fromTrend(trend(1000, 1.0, List.of("rising")), TENANT).orElseThrow();

        assertEquals(0.9, moderate.getImpact(), 1e-9);
        assertEquals(InsightImpact.MEDIUM, moderate.getImpactLevel());
        assertEquals(3.0, steep.getImpact(), 1e-9);
        assertEquals(InsightImpact.CRITICAL, steep.getImpactLevel());
        assertTrue(factory.fromTrend(trend(100, 0.9, List.of()), TENANT).isEmpty());
    }

    @Test
    @DisplayName("Capacity impact uses predicted over threshold and the first recommendation's priority")
    void testCapacity() {
        CapacityResult capacity = CapacityResult.builder()
                .component("database")
                .currentUtilization(80)
                .predictedUtilization(90)
                .timeToCapacity("10 days")
                .daysToCapacity(10.0)
                .confidence(0.5)
                .forecastDays(30)
                .recommendations(List.of(CapacityRecommendation.builder()
                        .type(RecommendationType.SCALE_UP)
                        .priority(RecommendationPriority.URGENT)
                        .description("Scale up database")
                        .build()))
                .resourceMetrics(List.of())
                .build();

        Insight insight = factory.fromCapacity(capacity, TENANT).orElseThrow();

        assertEquals(0.5 * 1.0 * 4.0, insight.getImpact(), 1e-9);
        assertEquals(InsightImpact.HIGH, insight.getImpactLevel());
        assertEquals(10.0, insight.getValues().get("daysToCapacity"), 1e-9);
        assertTrue(factory.fromCapacity(CapacityResult.empty("database", 30), TENANT).isEmpty());
    }

    @Test
    @DisplayName("Correlation impact is the squared strongest coefficient")
    void testCorrelation() {
        CorrelationResult result = CorrelationResult.builder()
                .primaryMetric("a")
                .correlatedMetrics(List.of(CorrelatedMetric.builder()
                        .metric("b").coefficient(-0.8).significance(0.8).lag(0)
                        .description("strong negative correlation").build()))
                .insights(List.of())
                .build();

        List<Insight> insights = factory.fromCorrelations(List.of(result), TENANT, "24h");

        assertEquals(1, insights.size());
        assertEquals(0.64, insights.get(0).getImpact(), 1e-9);
        assertEquals(List.of("a", "b"), insights.get(0).getMetrics());
    }

    @Test
    @DisplayName("Seasonality without patterns yields no insight")
    void testSeasonalityEmpty() {
        assertTrue(factory.fromSeasonality(SeasonalityResult.empty("m"), TENANT, "30d").isEmpty());
    }

    @ParameterizedTest
    @CsvSource({"0.1,LOW", "0.5,MEDIUM", "1.49,MEDIUM", "1.5,HIGH", "2.99,HIGH", "3.0,CRITICAL"})
    @DisplayName("Impact levels follow the score bands")
    void testImpactLevels(double score, InsightImpact expected) {
        assertEquals(expected, InsightImpact.fromScore(score));
    }
}
