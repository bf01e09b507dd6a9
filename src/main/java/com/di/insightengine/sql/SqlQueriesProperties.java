package com.di.insightengine.sql;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * SQL queries loaded from sql-queries.yml (insights.sql.*).
 * No SQL is hardcoded in JDBC store classes; they use these named queries.
 */
@Component
@ConfigurationProperties(prefix = "insights.sql")
public class SqlQueriesProperties {

    private Metrics metrics = new Metrics();
    private Anomaly anomaly = new Anomaly();
    private Insight insight = new Insight();

    public Metrics getMetrics() { return metrics; }
    public void setMetrics(Metrics metrics) { this.metrics = metrics; }
    public Anomaly getAnomaly() { return anomaly; }
    public void setAnomaly(Anomaly anomaly) { this.anomaly = anomaly; }
    public Insight getInsight() { return insight; }
    public void setInsight(Insight insight) { this.insight = insight; }

    /** performance_metrics (read only). */
    public static class Metrics {
        private String findSeries;
        private String findSeriesByTags;
        private String listMetricNames;
        public String getFindSeries() { return findSeries; }
        public void setFindSeries(String findSeries) { this.findSeries = findSeries; }
        public String getFindSeriesByTags() { return findSeriesByTags; }
        public void setFindSeriesByTags(String findSeriesByTags) { this.findSeriesByTags = findSeriesByTags; }
        public String getListMetricNames() { return listMetricNames; }
        public void setListMetricNames(String listMetricNames) { this.listMetricNames = listMetricNames; }
    }

    /** anomaly_detections. */
    public static class Anomaly {
        private String upsert;
        private String findRecent;
        private String findRecentByMetric;
        public String getUpsert() { return upsert; }
        public void setUpsert(String upsert) { this.upsert = upsert; }
        public String getFindRecent() { return findRecent; }
        public void setFindRecent(String findRecent) { this.findRecent = findRecent; }
        public String getFindRecentByMetric() { return findRecentByMetric; }
        public void setFindRecentByMetric(String findRecentByMetric) { this.findRecentByMetric = findRecentByMetric; }
    }

    /** performance_insights. */
    public static class Insight {
        private String upsert;
        private String findRecent;
        public String getUpsert() { return upsert; }
        public void setUpsert(String upsert) { this.upsert = upsert; }
        public String getFindRecent() { return findRecent; }
        public void setFindRecent(String findRecent) { this.findRecent = findRecent; }
    }
}
