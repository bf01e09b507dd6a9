package com.di.insightengine.engine;

import com.di.insightengine.analytics.anomaly.AnomalyResult;
import com.di.insightengine.exception.ErrorCategory;
import com.di.insightengine.insight.Insight;
import com.di.insightengine.store.InsightStore;
import com.di.insightengine.util.AnalyticsMetrics;
import com.di.insightengine.util.MdcPropagation;
import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

/**
 * Fire-and-forget writer in front of the {@link InsightStore}.
 *
 * <p>One writer thread drains a bounded queue. A full queue drops the write, a failed write is logged and counted;
 * neither is retried and neither ever blocks the analysis tick.
 */
@Slf4j
public class InsightPublisher implements AutoCloseable {

    private final InsightStore store;
    private final AnalyticsMetrics metrics;
    private final ExecutorService writer;

    public InsightPublisher(InsightStore store, AnalyticsMetrics metrics, int queueCapacity) {
        this.store = store;
        this.metrics = metrics;
        this.writer = new ThreadPoolExecutor(1, 1, 0L, TimeUnit.MILLISECONDS,
                new ArrayBlockingQueue<>(Math.max(1, queueCapacity)),
                r -> {
                    Thread t = new Thread(r, "insight-writer");
                    t.setDaemon(true);
                    return t;
                },
                new ThreadPoolExecutor.AbortPolicy());
    }

    public void publishAnomaly(AnomalyResult anomaly) {
        submit("anomaly " + anomaly.getMetric(), () -> store.writeAnomaly(anomaly));
    }

    public void publishInsight(Insight insight) {
        submit("insight " + insight.getId(), () -> store.writeInsight(insight));
    }

    private void submit(String what, Runnable write) {
        Runnable guarded = MdcPropagation.wrapRunnable(() -> {
            try {
                write.run();
            } catch (RuntimeException e) {
                metrics.recordWriteFailure();
                log.warn("[STORE] write of {} failed [{}]: {}", what, ErrorCategory.categorize(e), e.getMessage());
            }
        });
        try {
            writer.execute(guarded);
        } catch (RejectedExecutionException e) {
            metrics.recordWriteDropped();
            log.warn("[STORE] write queue full or closed, dropping {}", what);
        }
    }

    /**
     * Stops accepting writes and waits up to {@code timeoutMs} for queued writes to finish.
     */
    public void close(long timeoutMs) {
        writer.shutdown();
        try {
            if (!writer.awaitTermination(timeoutMs, TimeUnit.MILLISECONDS)) {
                int pending = writer.shutdownNow().size();
                log.warn("[STORE] writer did not drain in {}ms, abandoned {} writes", timeoutMs, pending);
            }
        } catch (InterruptedException e) {
            writer.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    @Override
    public void close() {
        close(5_000L);
    }
}
