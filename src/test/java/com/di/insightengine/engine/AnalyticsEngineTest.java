package com.di.insightengine.engine;

import com.di.insightengine.AnalyticsFixture;
import com.di.insightengine.analytics.anomaly.AnomalyResult;
import com.di.insightengine.config.AnalyticsProperties;
import com.di.insightengine.exception.TimeSeriesStoreException;
import com.di.insightengine.insight.Insight;
import com.di.insightengine.insight.InsightImpact;
import com.di.insightengine.insight.InsightType;
import com.di.insightengine.model.TimeSeries;
import com.di.insightengine.store.InMemoryTimeSeriesStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static com.di.insightengine.SeriesFixtures.noisy;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("AnalyticsEngine Tests")
class AnalyticsEngineTest {

    private static final Duration MINUTE = Duration.ofMinutes(1);

    private AnalyticsEngine engine;

    @AfterEach
    void tearDown() {
        if (engine != null) engine.stop();
    }

    private AnalyticsEngine engineFor(AnalyticsFixture fixture) {
        engine = new AnalyticsEngine(fixture.aggregator, fixture.analyticsService, fixture.insightStore,
                fixture.properties, fixture.metrics);
        return engine;
    }

    private static double[] withSpike(double spike) {
        double[] values = noisy(100, 31);
        values[15] = spike;
        return values;
    }

    /** Store that never answers for one metric until interrupted. */
    static class HangingStore extends InMemoryTimeSeriesStore {
        private final String slow;

        HangingStore(String slow) {
            this.slow = slow;
        }

        @Override
        public TimeSeries getSeries(String metric, String tenantId, Map<String, String> tags, Instant start, Instant end) {
            if (slow.equals(metric)) {
                try {
                    Thread.sleep(30_000);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new TimeSeriesStoreException("read interrupted", e);
                }
            }
            return super.getSeries(metric, tenantId, tags, start, end);
        }
    }

    @Test
    @DisplayName("Tick publishes high and critical findings to the insight store")
    void testTickPublishes() {
        AnalyticsFixture fixture = new AnalyticsFixture();
        fixture.load("api.request.latency", MINUTE, withSpike(150));
        engineFor(fixture).start(false);

        TickReport report = engine.runTick();
        engine.stop();

        assertFalse(report.isTimedOut());
        assertEquals(0, report.getFailures());
        // one tracked metric plus the capacity task
        assertEquals(2, report.getTasks());
        assertEquals(1, report.getAnomaliesPublished());
        assertEquals(1, report.getInsightsPublished());
        List<AnomalyResult> stored = fixture.insightStore.findRecentAnomalies(fixture.tenant(), null, 10);
        assertEquals(1, stored.size());
        List<Insight> insights = fixture.insightStore.findRecentInsights(fixture.tenant(), 10);
        assertEquals(1, insights.size());
        assertEquals(InsightType.ANOMALY, insights.get(0).getType());
        assertTrue(insights.get(0).getImpactLevel().isAtLeast(InsightImpact.HIGH));
        assertEquals(1.0, fixture.meterRegistry.get("insights.engine.tick.total").tag("status", "success")
                .counter().count());
    }

    @Test
    @DisplayName("Medium findings are returned but not persisted")
    void testMediumNotPublished() {
        AnalyticsFixture fixture = new AnalyticsFixture();
        double[] values = noisy(100, 200);
        values[100] = 102.8;
        fixture.load("api.request.latency", MINUTE, values);
        fixture.properties.getEngine().setShortWindow("4h");
        engineFor(fixture).start(false);

        TickReport report = engine.runTick();

        assertEquals(0, report.getAnomaliesPublished());
        assertEquals(0, report.getInsightsPublished());
        assertTrue(report.getInsights().stream().allMatch(i -> !i.getImpactLevel().isAtLeast(InsightImpact.HIGH)));
    }

    @Test
    @DisplayName("A failing metric is counted and the rest of the tick completes")
    void testFailureIsolation() {
        AnalyticsFixture fixture = new AnalyticsFixture(new AnalyticsProperties(),
                new FailingStore("system.cpu.usage"));
        fixture.load("api.request.latency", MINUTE, withSpike(150));
        fixture.load("system.cpu.usage", MINUTE, noisy(50, 31));
        engineFor(fixture).start(false);

        TickReport report = engine.runTick();

        assertEquals(3, report.getTasks());
        assertEquals(1, report.getFailures());
        assertEquals(1, report.getAnomaliesPublished());
        assertEquals(1.0, fixture.meterRegistry.get("insights.analysis.failures").counter().count());
    }

    @Test
    @DisplayName("Work still running at the tick timeout is abandoned")
    void testTickTimeout() {
        AnalyticsProperties properties = new AnalyticsProperties();
        properties.getEngine().setTickTimeout("1s");
        AnalyticsFixture fixture = new AnalyticsFixture(properties, new HangingStore("system.cpu.usage"));
        fixture.load("api.request.latency", MINUTE, withSpike(150));
        fixture.load("system.cpu.usage", MINUTE, noisy(50, 31));
        engineFor(fixture).start(false);

        long started = System.nanoTime();
        TickReport report = engine.runTick();
        long elapsedMs = Duration.ofNanos(System.nanoTime() - started).toMillis();

        assertTrue(report.isTimedOut());
        assertEquals(1, report.getAbandoned());
        assertEquals(1, report.getAnomaliesPublished());
        assertTrue(elapsedMs < 10_000, "tick took " + elapsedMs + "ms");
        assertEquals(1.0, fixture.meterRegistry.get("insights.engine.tick.total").tag("status", "timeout")
                .counter().count());
    }

    @Test
    @DisplayName("Sweep correlates all metrics and evaluates seasonality per metric")
    void testSweep() {
        AnalyticsFixture fixture = new AnalyticsFixture();
        double[] load = new double[120];
        double[] latency = new double[120];
        for (int i = 0; i < load.length; i++) {
            load[i] = (i * 37) % 11;
            latency[i] = 20 + 3 * load[i];
        }
        fixture.load("api.request.count", Duration.ofMinutes(5), load);
        fixture.load("api.request.latency", Duration.ofMinutes(5), latency);
        engineFor(fixture).start(false);

        TickReport report = engine.runSweep();

        assertEquals("sweep", report.getKind());
        // correlation plus one seasonality task per metric
        assertEquals(3, report.getTasks());
        assertTrue(report.getInsights().stream().anyMatch(i -> i.getType() == InsightType.CORRELATION));
        assertEquals(1.0, fixture.meterRegistry.get("insights.engine.sweep.total").counter().count());
    }

    @Test
    @DisplayName("Passes require a started engine; stop is idempotent")
    void testLifecycle() {
        AnalyticsFixture fixture = new AnalyticsFixture();
        engineFor(fixture);

        assertFalse(engine.isRunning());
        assertThrows(IllegalStateException.class, () -> engine.runTick());

        engine.start(false);
        assertTrue(engine.isRunning());
        engine.stop();
        engine.stop();
        assertFalse(engine.isRunning());
        assertThrows(IllegalStateException.class, () -> engine.runSweep());
    }

    @Test
    @DisplayName("Scheduled start can be closed cleanly")
    void testScheduledStartAndClose() {
        AnalyticsFixture fixture = new AnalyticsFixture();
        try (AnalyticsEngine scheduled = engineFor(fixture)) {
            scheduled.start();
            assertTrue(scheduled.isRunning());
        }
        assertFalse(engine.isRunning());
    }

    /** Fails every read of one metric the way a broken connection would. */
    static class FailingStore extends InMemoryTimeSeriesStore {
        private final String broken;

        FailingStore(String broken) {
            this.broken = broken;
        }

        @Override
        public TimeSeries getSeries(String metric, String tenantId, Map<String, String> tags, Instant start, Instant end) {
            if (broken.equals(metric)) {
                throw new TimeSeriesStoreException("read failed");
            }
            return super.getSeries(metric, tenantId, tags, start, end);
        }
    }
}
