package com.di.insightengine.engine;

import com.di.insightengine.analytics.anomaly.AnomalyResult;
import com.di.insightengine.analytics.anomaly.AnomalySeverity;
import com.di.insightengine.config.AnalyticsProperties;
import com.di.insightengine.config.TimeWindow;
import com.di.insightengine.insight.AnalyticsService;
import com.di.insightengine.insight.Insight;
import com.di.insightengine.insight.InsightAggregator;
import com.di.insightengine.insight.InsightImpact;
import com.di.insightengine.store.InsightStore;
import com.di.insightengine.util.AnalyticsMetrics;
import com.di.insightengine.util.MdcPropagation;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Scheduled analysis: a short tick (trend + anomalies per tracked metric, capacity per component) and a full
 * sweep (correlations + seasonality across all metrics).
 *
 * <p>Both run on one scheduler thread, so passes never overlap. Inside a pass the per-metric work fans out to a
 * bounded worker pool and is bounded by {@code tick-timeout}; tasks still running at the deadline are cancelled
 * and the pass completes with what finished. One failing metric never aborts the pass.
 *
 * <pre>{@code
 * try (AnalyticsEngine engine = new AnalyticsEngine(...)) {
 *     engine.start();
 *     ...
 * }
 * }</pre>
 */
@Slf4j
public class AnalyticsEngine implements AutoCloseable {

    private static final long SHUTDOWN_WAIT_MS = 5_000L;

    private final InsightAggregator aggregator;
    private final AnalyticsService analyticsService;
    private final InsightStore insightStore;
    private final AnalyticsProperties properties;
    private final AnalyticsMetrics metrics;
    private final AtomicLong tickSequence = new AtomicLong();

    private ScheduledExecutorService scheduler;
    private ExecutorService workers;
    private InsightPublisher publisher;

    public AnalyticsEngine(InsightAggregator aggregator, AnalyticsService analyticsService, InsightStore insightStore,
                           AnalyticsProperties properties, AnalyticsMetrics metrics) {
        this.aggregator = aggregator;
        this.analyticsService = analyticsService;
        this.insightStore = insightStore;
        this.properties = properties;
        this.metrics = metrics;
    }

    /** Starts the executors; with {@code schedule} false, passes only run through {@link #runTick()}/{@link #runSweep()}. */
    public synchronized void start(boolean schedule) {
        if (workers != null) {
            log.debug("[ENGINE] already started");
            return;
        }
        AnalyticsProperties.Engine config = properties.getEngine();
        AtomicInteger workerIds = new AtomicInteger();
        ExecutorService pool = Executors.newFixedThreadPool(config.getWorkerPoolCap(), r -> {
            Thread t = new Thread(r, "insight-worker-" + workerIds.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        workers = MdcPropagation.wrapExecutor(pool);
        publisher = new InsightPublisher(insightStore, metrics, config.getWriteQueueCapacity());
        if (schedule) {
            long tickMs = TimeWindow.parse(config.getTickInterval()).toMillis();
            long sweepMs = TimeWindow.parse(config.getFullSweepInterval()).toMillis();
            scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
                Thread t = new Thread(r, "insight-engine-scheduler");
                t.setDaemon(true);
                return t;
            });
            scheduler.scheduleAtFixedRate(() -> runSafely("tick", this::runTick), tickMs, tickMs, TimeUnit.MILLISECONDS);
            scheduler.scheduleAtFixedRate(() -> runSafely("sweep", this::runSweep), sweepMs, sweepMs, TimeUnit.MILLISECONDS);
        }
        log.info("[ENGINE] started: scheduled={} tick={} sweep={} timeout={} workers={} topN={}",
                schedule, config.getTickInterval(), config.getFullSweepInterval(), config.getTickTimeout(),
                config.getWorkerPoolCap(), config.getTopN());
    }

    public void start() {
        start(true);
    }

    /** Cancels scheduled passes, interrupts running work and drains the writer. Idempotent. */
    public synchronized void stop() {
        if (workers == null) return;
        if (scheduler != null) {
            scheduler.shutdownNow();
            awaitQuietly(scheduler, "scheduler");
            scheduler = null;
        }
        workers.shutdownNow();
        awaitQuietly(workers, "workers");
        workers = null;
        publisher.close(SHUTDOWN_WAIT_MS);
        publisher = null;
        log.info("[ENGINE] stopped");
    }

    public synchronized boolean isRunning() {
        return workers != null;
    }

    @Override
    public void close() {
        stop();
    }

    /** Short pass: trend and anomalies per tracked metric plus capacity, for every configured tenant. */
    public TickReport runTick() {
        String window = properties.getEngine().getShortWindow();
        return runPass("tick", tenant -> {
            List<NamedTask> tasks = new ArrayList<>();
            for (String metric : analyticsService.trackedMetrics(tenant)) {
                tasks.add(new NamedTask(metric, () -> {
                    InsightAggregator.MetricAnalysis analysis = aggregator.analyzeMetric(metric, window, tenant);
                    return new TaskOutput(analysis.getInsights(), analysis.getAnomalies());
                }));
            }
            tasks.add(new NamedTask("capacity", () -> new TaskOutput(aggregator.analyzeCapacity(tenant), List.of())));
            return tasks;
        });
    }

    /** Full sweep: correlations across the tenant's metrics and seasonality per metric. */
    public TickReport runSweep() {
        String window = properties.getEngine().getSweepWindow();
        TickReport report = runPass("sweep", tenant -> {
            List<String> all = analyticsService.listMetrics(tenant);
            List<NamedTask> tasks = new ArrayList<>();
            if (all.size() >= 2) {
                tasks.add(new NamedTask("correlation", () ->
                        new TaskOutput(aggregator.analyzeCorrelations(all, window, tenant), List.of())));
            }
            for (String metric : all) {
                tasks.add(new NamedTask("seasonality:" + metric, () ->
                        new TaskOutput(aggregator.analyzeSeasonality(metric, window, tenant), List.of())));
            }
            return tasks;
        });
        metrics.recordSweep();
        return report;
    }

    private TickReport runPass(String kind, TaskPlanner planner) {
        ExecutorService pool;
        InsightPublisher writer;
        synchronized (this) {
            pool = workers;
            writer = publisher;
        }
        if (pool == null) {
            throw new IllegalStateException("Analytics engine is not started");
        }
        String tickId = kind + "-" + tickSequence.incrementAndGet();
        long startNs = System.nanoTime();
        long timeoutMs = TimeWindow.parse(properties.getEngine().getTickTimeout()).toMillis();
        List<NamedTask> tasks = new ArrayList<>();
        List<Insight> insights = new ArrayList<>();
        List<AnomalyResult> anomalies = new ArrayList<>();
        int[] counts = new int[2];
        boolean[] timedOut = new boolean[1];

        MdcPropagation.runWithMdcContext(Map.of(MdcPropagation.TICK_ID, tickId), () -> {
            for (String tenant : tenants()) {
                try {
                    tasks.addAll(planner.plan(tenant));
                } catch (RuntimeException e) {
                    aggregator.recordFailure("metric list for tenant " + tenant, e);
                    counts[0]++;
                }
            }
            List<Callable<TaskOutput>> callables = new ArrayList<>();
            tasks.forEach(t -> callables.add(t.work));
            List<Future<TaskOutput>> futures;
            try {
                futures = pool.invokeAll(callables, timeoutMs, TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("[ENGINE] {} interrupted before completion", tickId);
                timedOut[0] = true;
                return;
            }
            for (int i = 0; i < futures.size(); i++) {
                Future<TaskOutput> future = futures.get(i);
                try {
                    TaskOutput out = future.get();
                    insights.addAll(out.insights);
                    anomalies.addAll(out.anomalies);
                } catch (CancellationException e) {
                    timedOut[0] = true;
                    counts[1]++;
                } catch (ExecutionException e) {
                    aggregator.recordFailure(tasks.get(i).name, e.getCause());
                    counts[0]++;
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    timedOut[0] = true;
                    counts[1]++;
                }
            }
            if (timedOut[0]) {
                log.warn("[ENGINE] {} hit timeout {}; abandoned {} of {} tasks", tickId,
                        properties.getEngine().getTickTimeout(), counts[1], tasks.size());
            }
        });

        List<Insight> ranked = InsightAggregator.rank(insights, properties.getEngine().getTopN());
        int anomaliesPublished = 0;
        for (AnomalyResult anomaly : anomalies) {
            if (anomaly.getSeverity().isAtLeast(AnomalySeverity.HIGH)) {
                writer.publishAnomaly(anomaly);
                anomaliesPublished++;
            }
        }
        int insightsPublished = 0;
        for (Insight insight : ranked) {
            if (insight.getImpactLevel().isAtLeast(InsightImpact.HIGH)) {
                writer.publishInsight(insight);
                insightsPublished++;
            }
        }

        long durationMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNs);
        metrics.recordTick(durationMs, timedOut[0]);
        metrics.recordInsightsEmitted(ranked.size());
        log.info("[ENGINE] tickId={} kind={} tasks={} failures={} abandoned={} insights={} published={}/{} durationMs={}",
                tickId, kind, tasks.size(), counts[0], counts[1], ranked.size(), insightsPublished, anomaliesPublished,
                durationMs);

        return TickReport.builder()
                .tickId(tickId)
                .kind(kind)
                .tasks(tasks.size())
                .failures(counts[0])
                .abandoned(counts[1])
                .timedOut(timedOut[0])
                .durationMs(durationMs)
                .insights(ranked)
                .anomaliesPublished(anomaliesPublished)
                .insightsPublished(insightsPublished)
                .build();
    }

    private List<String> tenants() {
        List<String> configured = properties.getEngine().getTenants();
        return configured == null || configured.isEmpty() ? List.of(properties.getDefaultTenantId()) : configured;
    }

    private void runSafely(String kind, Runnable pass) {
        try {
            pass.run();
        } catch (RuntimeException e) {
            // a scheduled task that throws is never rescheduled
            log.error("[ENGINE] {} failed", kind, e);
        }
    }

    private static void awaitQuietly(ExecutorService executor, String name) {
        try {
            if (!executor.awaitTermination(SHUTDOWN_WAIT_MS, TimeUnit.MILLISECONDS)) {
                log.warn("[ENGINE] {} did not terminate within {}ms", name, SHUTDOWN_WAIT_MS);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    @FunctionalInterface
    private interface TaskPlanner {
        List<NamedTask> plan(String tenantId);
    }

    private static final class NamedTask {
        final String name;
        final Callable<TaskOutput> work;

        NamedTask(String name, Callable<TaskOutput> work) {
            this.name = name;
            this.work = work;
        }
    }

    private static final class TaskOutput {
        final List<Insight> insights;
        final List<AnomalyResult> anomalies;

        TaskOutput(List<Insight> insights, List<AnomalyResult> anomalies) {
            this.insights = insights;
            this.anomalies = anomalies;
        }
    }
}
