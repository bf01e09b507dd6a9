package com.di.insightengine.insight;

import com.di.insightengine.analytics.anomaly.AnomalyResult;
import com.di.insightengine.analytics.capacity.CapacityRecommendation;
import com.di.insightengine.analytics.capacity.CapacityResult;
import com.di.insightengine.analytics.capacity.RecommendationPriority;
import com.di.insightengine.analytics.correlation.CorrelatedMetric;
import com.di.insightengine.analytics.correlation.CorrelationResult;
import com.di.insightengine.analytics.seasonality.BucketStat;
import com.di.insightengine.analytics.seasonality.SeasonalPattern;
import com.di.insightengine.analytics.seasonality.SeasonalityResult;
import com.di.insightengine.analytics.trend.TrendResult;
import com.di.insightengine.config.AnalyticsProperties;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Turns analyzer output into {@link Insight}s with {@code impact = confidence × magnitude × weight}.
 *
 * <ul>
 *   <li>trend: confidence = fit confidence, magnitude = min(changeRatePct / 100, 3), weight 1</li>
 *   <li>anomaly: confidence = min(1, score / 4), magnitude 1, weight = severity weight</li>
 *   <li>capacity: confidence = capacity confidence, magnitude = predicted / threshold,
 *       weight = priority of the first recommendation (low 1 .. urgent 4)</li>
 *   <li>correlation: confidence = magnitude = strongest |coefficient|, weight 1</li>
 *   <li>seasonality: confidence = magnitude = strength of the strongest pattern, weight 1</li>
 * </ul>
 */
@Component
public class InsightFactory {

    private static final double MAX_TREND_MAGNITUDE = 3.0;
    private static final double ANOMALY_FULL_CONFIDENCE_SCORE = 4.0;

    private final AnalyticsProperties properties;
    private final Clock clock;

    public InsightFactory(AnalyticsProperties properties, Clock clock) {
        this.properties = properties;
        this.clock = clock;
    }

    /** Empty unless the trend carries a textual insight (confident, non-stable). */
    public Optional<Insight> fromTrend(TrendResult trend, String tenantId) {
        if (trend == null || trend.getInsights().isEmpty()) return Optional.empty();
        double magnitude = Math.min(trend.getChangeRatePct() / 100.0, MAX_TREND_MAGNITUDE);
        Map<String, Double> values = new LinkedHashMap<>();
        values.put("changeRatePct", trend.getChangeRatePct());
        values.put("slope", trend.getSlope());
        values.put("confidence", trend.getConfidence());
        List<String> recommendations = new ArrayList<>();
        recommendations.add("Review recent changes affecting " + trend.getMetric());
        if (!trend.getForecast().isEmpty()) {
            recommendations.add(String.format(Locale.ROOT, "Expected value in %d steps: %.2f",
                    trend.getForecast().size(), trend.getForecast().get(trend.getForecast().size() - 1).getPredicted()));
        }
        return Optional.of(build(tenantId, InsightType.TREND,
                String.format(Locale.ROOT, "%s is %s", trend.getMetric(), trend.getDirection().wireName()),
                String.join("; ", trend.getInsights()),
                trend.getConfidence(), magnitude, 1.0,
                List.of(trend.getMetric()), trend.getWindow(), values, recommendations));
    }

    public Insight fromAnomaly(AnomalyResult anomaly, String window) {
        double confidence = Math.min(1.0, anomaly.getDeviationScore() / ANOMALY_FULL_CONFIDENCE_SCORE);
        Map<String, Double> values = new LinkedHashMap<>();
        values.put("value", anomaly.getValue());
        values.put("expectedValue", anomaly.getExpectedValue());
        values.put("deviationScore", anomaly.getDeviationScore());
        String description = String.format(Locale.ROOT, "%s %s at %s: value %.2f vs expected %.2f (score %.1f)",
                anomaly.getSeverity().wireName(), anomaly.getType().wireName(), anomaly.getTimestamp(),
                anomaly.getValue(), anomaly.getExpectedValue(), anomaly.getDeviationScore());
        List<String> recommendations = anomaly.getPossibleCauses() == null ? List.of()
                : anomaly.getPossibleCauses().stream().map(c -> "Check for " + c.toLowerCase(Locale.ROOT))
                .collect(Collectors.toList());
        return build(anomaly.getTenantId(), InsightType.ANOMALY,
                String.format(Locale.ROOT, "Anomaly (%s) in %s", anomaly.getType().wireName(), anomaly.getMetric()),
                description, confidence, 1.0, anomaly.getSeverity().getWeight(),
                List.of(anomaly.getMetric()), window, values, recommendations);
    }

    /** Empty when the prediction has no recommendations (no utilization metrics). */
    public Optional<Insight> fromCapacity(CapacityResult capacity, String tenantId) {
        if (capacity == null || capacity.getRecommendations().isEmpty()) return Optional.empty();
        CapacityRecommendation first = capacity.getRecommendations().get(0);
        double threshold = properties.getCapacity().getThresholdPct();
        double magnitude = threshold > 0 ? capacity.getPredictedUtilization() / threshold : 0.0;
        Map<String, Double> values = new LinkedHashMap<>();
        values.put("currentUtilization", capacity.getCurrentUtilization());
        values.put("predictedUtilization", capacity.getPredictedUtilization());
        if (capacity.getDaysToCapacity() != null) {
            values.put("daysToCapacity", capacity.getDaysToCapacity());
        }
        return Optional.of(build(tenantId, InsightType.CAPACITY,
                String.format(Locale.ROOT, "Capacity outlook for %s: %s", capacity.getComponent(),
                        capacity.getTimeToCapacity()),
                first.getDescription(),
                capacity.getConfidence(), magnitude, priorityWeight(first.getPriority()),
                capacity.getResourceMetrics().stream().map(r -> r.getName()).collect(Collectors.toList()),
                properties.getCapacity().getWindow(), values,
                capacity.getRecommendations().stream().map(CapacityRecommendation::getDescription)
                        .collect(Collectors.toList())));
    }

    public List<Insight> fromCorrelations(List<CorrelationResult> correlations, String tenantId, String window) {
        List<Insight> out = new ArrayList<>();
        for (CorrelationResult result : correlations) {
            CorrelatedMetric top = result.getCorrelatedMetrics().get(0);
            double strength = Math.abs(top.getCoefficient());
            Map<String, Double> values = new LinkedHashMap<>();
            values.put("coefficient", top.getCoefficient());
            values.put("lag", (double) top.getLag());
            List<String> metrics = new ArrayList<>();
            metrics.add(result.getPrimaryMetric());
            result.getCorrelatedMetrics().forEach(c -> metrics.add(c.getMetric()));
            out.add(build(tenantId, InsightType.CORRELATION,
                    String.format(Locale.ROOT, "%s correlates with %s", result.getPrimaryMetric(), top.getMetric()),
                    result.getInsights().isEmpty()
                            ? String.format(Locale.ROOT, "%s (r=%.2f)", top.getDescription(), top.getCoefficient())
                            : String.join("; ", result.getInsights()),
                    strength, strength, 1.0, metrics, window, values,
                    List.of("Investigate " + top.getMetric() + " when " + result.getPrimaryMetric() + " degrades")));
        }
        return out;
    }

    /** Empty when no pattern passed the strength threshold. */
    public Optional<Insight> fromSeasonality(SeasonalityResult seasonality, String tenantId, String window) {
        if (seasonality == null || !seasonality.hasPatterns()) return Optional.empty();
        SeasonalPattern strongest = seasonality.getPatterns().get(0);
        String peaks = strongest.getPeaks().stream().map(BucketStat::getLabel).collect(Collectors.joining(", "));
        String valleys = strongest.getValleys().stream().map(BucketStat::getLabel).collect(Collectors.joining(", "));
        Map<String, Double> values = new LinkedHashMap<>();
        values.put("strength", strongest.getStrength());
        return Optional.of(build(tenantId, InsightType.SEASONALITY,
                String.format(Locale.ROOT, "%s has a %s pattern", seasonality.getMetric(),
                        strongest.getPeriodType().wireName()),
                String.format(Locale.ROOT, "Peaks at %s; lows at %s (strength %.2f)", peaks, valleys,
                        strongest.getStrength()),
                strongest.getStrength(), strongest.getStrength(), 1.0,
                List.of(seasonality.getMetric()), window, values,
                List.of("Schedule maintenance around " + (valleys.isEmpty() ? "low-traffic periods" : valleys))));
    }

    static double priorityWeight(RecommendationPriority priority) {
        switch (priority) {
            case URGENT: return 4.0;
            case HIGH: return 3.0;
            case MEDIUM: return 2.0;
            default: return 1.0;
        }
    }

    private Insight build(String tenantId, InsightType type, String title, String description,
                          double confidence, double magnitude, double weight, List<String> metrics,
                          String window, Map<String, Double> values, List<String> recommendations) {
        double impact = Math.max(0.0, confidence * magnitude * weight);
        return Insight.builder()
                .id(UUID.randomUUID().toString())
                .tenantId(tenantId)
                .type(type)
                .title(title)
                .description(description)
                .impact(impact)
                .impactLevel(InsightImpact.fromScore(impact))
                .confidence(confidence)
                .metrics(List.copyOf(metrics))
                .timeWindow(window)
                .values(Collections.unmodifiableMap(new LinkedHashMap<>(values)))
                .recommendations(List.copyOf(recommendations))
                .createdAt(Instant.now(clock))
                .build();
    }
}
