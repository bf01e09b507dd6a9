package com.di.insightengine.store;

import com.di.insightengine.exception.TimeSeriesStoreException;
import com.di.insightengine.model.Sample;
import com.di.insightengine.model.SeriesKey;
import com.di.insightengine.model.TimeSeries;
import com.di.insightengine.sql.SqlQueriesProperties;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Component;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * JDBC implementation of TimeSeriesStore over {@code performance_metrics}.
 * Tag filtering uses JSONB containment ({@code tags @> ?}).
 * Enable with insights.persistence-enabled=true and a configured datasource.
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "insights.persistence-enabled", havingValue = "true")
public class JdbcTimeSeriesStore implements TimeSeriesStore {

    private static final RowMapper<Sample> SAMPLE_ROW_MAPPER = (rs, rowNum) ->
            Sample.of(toInstant(rs.getTimestamp("timestamp")), rs.getDouble("value"));

    private final JdbcTemplate jdbc;
    private final SqlQueriesProperties sql;
    private final ObjectMapper objectMapper;

    public JdbcTimeSeriesStore(JdbcTemplate jdbcTemplate, SqlQueriesProperties sql, ObjectMapper objectMapper) {
        this.jdbc = jdbcTemplate;
        this.sql = sql;
        this.objectMapper = objectMapper;
    }

    private static Instant toInstant(Timestamp ts) {
        return ts != null ? ts.toInstant() : null;
    }

    @Override
    public TimeSeries getSeries(String metric, String tenantId, Instant start, Instant end) {
        SeriesKey key = SeriesKey.of(metric, tenantId);
        try {
            List<Sample> samples = jdbc.query(sql.getMetrics().getFindSeries(), SAMPLE_ROW_MAPPER,
                    metric, tenantId, Timestamp.from(start), Timestamp.from(end));
            log.debug("[STORE] metric={} tenant={} start={} end={} rows={}", metric, tenantId, start, end, samples.size());
            return TimeSeries.fromUnordered(key, samples);
        } catch (DataAccessException e) {
            throw new TimeSeriesStoreException("Failed to read series " + metric + " for tenant " + tenantId, e);
        }
    }

    @Override
    public TimeSeries getSeries(String metric, String tenantId, Map<String, String> tags, Instant start, Instant end) {
        if (tags == null || tags.isEmpty()) {
            return getSeries(metric, tenantId, start, end);
        }
        SeriesKey key = SeriesKey.of(metric, tenantId, tags);
        String tagJson;
        try {
            tagJson = objectMapper.writeValueAsString(key.getTags());
        } catch (JsonProcessingException e) {
            throw new TimeSeriesStoreException("Cannot encode tag filter " + tags, e);
        }
        try {
            List<Sample> samples = jdbc.query(sql.getMetrics().getFindSeriesByTags(), SAMPLE_ROW_MAPPER,
                    metric, tenantId, tagJson, Timestamp.from(start), Timestamp.from(end));
            return TimeSeries.fromUnordered(key, samples);
        } catch (DataAccessException e) {
            throw new TimeSeriesStoreException("Failed to read series " + metric + " tags=" + tags
                    + " for tenant " + tenantId, e);
        }
    }

    @Override
    public List<String> listMetricNames(String tenantId) {
        try {
            return jdbc.queryForList(sql.getMetrics().getListMetricNames(), String.class, tenantId);
        } catch (DataAccessException e) {
            throw new TimeSeriesStoreException("Failed to list metrics for tenant " + tenantId, e);
        }
    }
}
