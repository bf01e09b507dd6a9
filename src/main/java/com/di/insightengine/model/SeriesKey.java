package com.di.insightengine.model;

import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * Identity of a time series: metric name, tenant and tag set.
 * Tags are order-irrelevant and only used for grouping/filtering.
 */
@Value
@Builder
public class SeriesKey {
    String metric;
    String tenantId;
    Map<String, String> tags;

    public static SeriesKey of(String metric, String tenantId) {
        return new SeriesKey(metric, tenantId, Map.of());
    }

    public static SeriesKey of(String metric, String tenantId, Map<String, String> tags) {
        return new SeriesKey(metric, tenantId, tags != null ? Map.copyOf(tags) : Map.of());
    }

    public Map<String, String> getTags() {
        return tags != null ? tags : Map.of();
    }

    /** True when every tag in {@code filter} is present on this key with the same value. */
    public boolean matches(Map<String, String> filter) {
        if (filter == null || filter.isEmpty()) return true;
        Map<String, String> own = getTags();
        for (Map.Entry<String, String> e : filter.entrySet()) {
            if (!e.getValue().equals(own.get(e.getKey()))) return false;
        }
        return true;
    }
}
