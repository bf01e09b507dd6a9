package com.di.insightengine.store;

import com.di.insightengine.model.TimeSeries;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Read side of the metric store. Implementations can be in-memory or JDBC (see schema.sql).
 * Every method returns ascending, de-duplicated series; no data is an empty series, not an error.
 * Read failures surface as {@link com.di.insightengine.exception.TimeSeriesStoreException}.
 */
public interface TimeSeriesStore {

    /** Samples of {@code metric} for the tenant in {@code [start, end)}, across all tag sets. */
    TimeSeries getSeries(String metric, String tenantId, Instant start, Instant end);

    /** As above, restricted to samples whose tags contain every entry of {@code tags}. */
    TimeSeries getSeries(String metric, String tenantId, Map<String, String> tags, Instant start, Instant end);

    /** Distinct metric names recorded for the tenant, sorted. */
    List<String> listMetricNames(String tenantId);
}
