package com.di.insightengine.store;

import com.di.insightengine.model.Sample;
import com.di.insightengine.model.SeriesKey;
import com.di.insightengine.model.TimeSeries;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * In-memory implementation of TimeSeriesStore. Suitable for single-node and testing.
 * When insights.persistence-enabled=true, JdbcTimeSeriesStore is used instead.
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "insights.persistence-enabled", havingValue = "false", matchIfMissing = true)
public class InMemoryTimeSeriesStore implements TimeSeriesStore {

    /** tenant -> metric -> points in arrival order. */
    private final Map<String, Map<String, List<Point>>> points = new ConcurrentHashMap<>();

    public void append(String metric, String tenantId, Instant timestamp, double value) {
        append(SeriesKey.of(metric, tenantId), timestamp, value);
    }

    /** Non-finite values are rejected the way the JDBC path would never persist them. */
    public void append(SeriesKey key, Instant timestamp, double value) {
        if (key == null || key.getMetric() == null || key.getTenantId() == null || timestamp == null) return;
        if (!Double.isFinite(value)) {
            log.debug("[STORE] dropping non-finite sample metric={} value={}", key.getMetric(), value);
            return;
        }
        List<Point> list = points
                .computeIfAbsent(key.getTenantId(), t -> new ConcurrentHashMap<>())
                .computeIfAbsent(key.getMetric(), m -> new ArrayList<>());
        synchronized (list) {
            list.add(new Point(key, Sample.of(timestamp, value)));
        }
    }

    @Override
    public TimeSeries getSeries(String metric, String tenantId, Instant start, Instant end) {
        return getSeries(metric, tenantId, Map.of(), start, end);
    }

    @Override
    public TimeSeries getSeries(String metric, String tenantId, Map<String, String> tags, Instant start, Instant end) {
        SeriesKey key = SeriesKey.of(metric, tenantId, tags != null ? tags : Map.of());
        List<Point> list = tenantId == null || metric == null ? null : points.getOrDefault(tenantId, Map.of()).get(metric);
        if (list == null) return TimeSeries.empty(key);
        List<Sample> selected = new ArrayList<>();
        synchronized (list) {
            for (Point p : list) {
                Instant ts = p.sample.getTimestamp();
                if (ts.isBefore(start) || !ts.isBefore(end)) continue;
                if (!p.key.matches(key.getTags())) continue;
                selected.add(p.sample);
            }
        }
        return TimeSeries.fromUnordered(key, selected);
    }

    @Override
    public List<String> listMetricNames(String tenantId) {
        if (tenantId == null) return List.of();
        return points.getOrDefault(tenantId, Map.of()).keySet().stream()
                .sorted()
                .collect(Collectors.toList());
    }

    public void clear() {
        points.clear();
    }

    private static final class Point {
        final SeriesKey key;
        final Sample sample;

        Point(SeriesKey key, Sample sample) {
            this.key = key;
            this.sample = sample;
        }
    }
}
