package com.di.insightengine.analytics.capacity;

import com.di.insightengine.analytics.trend.TrendAnalyzer;
import com.di.insightengine.analytics.trend.TrendResult;
import com.di.insightengine.config.AnalyticsProperties;
import com.di.insightengine.model.TimeSeries;
import com.di.insightengine.stats.Statistics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Projects a component's utilization forward from the trends of its utilization metrics.
 *
 * <p>Utilization values are percentages. The component is as full as its fullest metric, so
 * {@code currentUtilization} is the maximum latest value; the growth rate is the confidence-weighted mean of the
 * per-metric slopes converted to percentage points per day.
 */
@Slf4j
@Component
public class CapacityPredictor {

    private static final String UNIT = "%";

    private final AnalyticsProperties.Capacity config;
    private final TrendAnalyzer trendAnalyzer;

    public CapacityPredictor(AnalyticsProperties properties, TrendAnalyzer trendAnalyzer) {
        this.config = properties.getCapacity();
        this.trendAnalyzer = trendAnalyzer;
    }

    /** True for {@code <component>.*} metric names that carry usage or utilization. */
    public static boolean isUtilizationMetric(String component, String metricName) {
        if (component == null || metricName == null) return false;
        if (!metricName.startsWith(component + ".")) return false;
        String lower = metricName.toLowerCase(Locale.ROOT);
        return lower.contains("usage") || lower.contains("utilization");
    }

    public CapacityResult predict(String component, Map<String, TimeSeries> utilizationSeries) {
        return predict(component, utilizationSeries, config.getForecastDays());
    }

    /**
     * @param utilizationSeries metric name to its series over the capacity window; series that are too short for
     *                          a trend still contribute their latest value
     */
    public CapacityResult predict(String component, Map<String, TimeSeries> utilizationSeries, int forecastDays) {
        if (utilizationSeries == null || utilizationSeries.isEmpty()) {
            log.debug("[CAPACITY] component={} no utilization metrics", component);
            return CapacityResult.empty(component, forecastDays);
        }

        double threshold = config.getThresholdPct();
        double current = 0.0;
        double weightedSlope = 0.0;
        double plainSlope = 0.0;
        double weights = 0.0;
        double confidenceSum = 0.0;
        int analysed = 0;
        List<ResourceMetric> resources = new ArrayList<>();

        for (Map.Entry<String, TimeSeries> e : utilizationSeries.entrySet()) {
            TimeSeries series = e.getValue();
            if (series == null || series.isEmpty()) continue;
            TrendResult trend = trendAnalyzer.analyze(series, config.getWindow(), 0);
            double latest = series.last().getValue();
            double slopePerDay = trend.slopePerDay();
            current = analysed == 0 ? latest : Math.max(current, latest);
            weightedSlope += slopePerDay * trend.getConfidence();
            plainSlope += slopePerDay;
            weights += trend.getConfidence();
            confidenceSum += trend.getConfidence();
            analysed++;
            resources.add(ResourceMetric.builder()
                    .name(e.getKey())
                    .current(latest)
                    .projected(Statistics.clamp(latest + slopePerDay * forecastDays, 0.0, 100.0))
                    .unit(UNIT)
                    .threshold(threshold)
                    .utilizationTrend(trend.getDirection())
                    .build());
        }
        if (analysed == 0) {
            return CapacityResult.empty(component, forecastDays);
        }

        double slopePerDay = weights > 0 ? weightedSlope / weights : plainSlope / analysed;
        double predicted = Statistics.clamp(current + slopePerDay * forecastDays, 0.0, 100.0);
        Double days = daysToCapacity(current, slopePerDay, threshold);
        double confidence = confidenceSum / analysed;

        log.info("[CAPACITY] component={} current={} predicted={} slopePerDay={} daysToCapacity={}",
                component, current, predicted, slopePerDay, days);

        return CapacityResult.builder()
                .component(component)
                .currentUtilization(current)
                .predictedUtilization(predicted)
                .timeToCapacity(formatTimeToCapacity(days))
                .daysToCapacity(days)
                .confidence(confidence)
                .forecastDays(forecastDays)
                .recommendations(recommend(component, current, predicted, slopePerDay, days))
                .resourceMetrics(List.copyOf(resources))
                .build();
    }

    /**
     * Solves {@code current + slopePerDay * t = threshold}; null when utilization is not growing,
     * 0 when it is growing and already at or over the threshold.
     */
    static Double daysToCapacity(double current, double slopePerDay, double threshold) {
        if (slopePerDay <= 0 || !Double.isFinite(slopePerDay)) return null;
        if (current >= threshold) return 0.0;
        return (threshold - current) / slopePerDay;
    }

    static String formatTimeToCapacity(Double days) {
        if (days == null) return CapacityResult.UNKNOWN;
        if (days <= 0) return "now";
        if (days < 1) return "< 1 day";
        if (days < 14) return plural((long) Math.floor(days), "day");
        if (days < 60) return plural(Math.round(days / 7.0), "week");
        return plural(Math.max(2, Math.round(days / 30.0)), "month");
    }

    private static String plural(long n, String unit) {
        return n + " " + unit + (n == 1 ? "" : "s");
    }

    private List<CapacityRecommendation> recommend(String component, double current, double predicted,
                                                   double slopePerDay, Double days) {
        List<CapacityRecommendation> out = new ArrayList<>();
        if (days != null && days < config.getUrgentDays()) {
            out.add(CapacityRecommendation.builder()
                    .type(RecommendationType.SCALE_UP)
                    .priority(RecommendationPriority.URGENT)
                    .description(String.format(Locale.ROOT,
                            "Scale up %s immediately: utilization %.1f%% will reach %.0f%% in %s",
                            component, current, config.getThresholdPct(), formatTimeToCapacity(days)))
                    .estimatedBenefit("Prevents saturation and service degradation")
                    .timeline("Within 1 week")
                    .build());
        } else if (days != null && days < config.getHighDays()) {
            out.add(CapacityRecommendation.builder()
                    .type(RecommendationType.SCALE_OUT)
                    .priority(RecommendationPriority.HIGH)
                    .description(String.format(Locale.ROOT,
                            "Plan horizontal scaling for %s: projected utilization %.1f%%", component, predicted))
                    .estimatedBenefit("Keeps headroom ahead of projected growth")
                    .timeline("Within 2 weeks")
                    .build());
        } else if (slopePerDay > 0) {
            out.add(CapacityRecommendation.builder()
                    .type(RecommendationType.OPTIMIZE)
                    .priority(RecommendationPriority.MEDIUM)
                    .description(String.format(Locale.ROOT,
                            "Utilization of %s is growing slowly (%.2f points/day); review resource efficiency",
                            component, slopePerDay))
                    .estimatedBenefit("Delays the need for additional capacity")
                    .timeline("Within 1 month")
                    .build());
        } else {
            out.add(CapacityRecommendation.builder()
                    .type(RecommendationType.MONITOR)
                    .priority(RecommendationPriority.LOW)
                    .description(String.format(Locale.ROOT,
                            "Utilization of %s is stable or decreasing; continue monitoring", component))
                    .estimatedBenefit("Early warning if the trend changes")
                    .timeline("Ongoing")
                    .build());
        }
        return out;
    }
}
