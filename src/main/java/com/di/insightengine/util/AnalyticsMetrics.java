package com.di.insightengine.util;

import com.di.insightengine.analytics.anomaly.AnomalySeverity;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * Self-observability for the analytics engine: tick duration and outcome, per-metric failures,
 * anomalies by severity, insights emitted per tick and insight-store write failures.
 */
@Slf4j
@Component
public class AnalyticsMetrics {

    // Tick Metrics
    private final Timer tickTimer;
    private final Counter tickSuccessCounter;
    private final Counter tickTimeoutCounter;
    private final Counter sweepCounter;

    // Analysis Metrics
    private final Counter metricFailureCounter;
    private final Map<AnomalySeverity, Counter> anomalyCounters = new EnumMap<>(AnomalySeverity.class);
    private final DistributionSummary insightsPerTick;

    // Store Metrics
    private final Counter writeFailureCounter;
    private final Counter writeDroppedCounter;

    public AnalyticsMetrics(MeterRegistry meterRegistry) {
        this.tickTimer = Timer.builder("insights.engine.tick.duration")
                .description("Time taken by one analysis tick")
                .register(meterRegistry);

        this.tickSuccessCounter = Counter.builder("insights.engine.tick.total")
                .description("Analysis ticks that completed")
                .tag("status", "success")
                .register(meterRegistry);

        this.tickTimeoutCounter = Counter.builder("insights.engine.tick.total")
                .description("Analysis ticks that hit the tick timeout")
                .tag("status", "timeout")
                .register(meterRegistry);

        this.sweepCounter = Counter.builder("insights.engine.sweep.total")
                .description("Full correlation/seasonality sweeps run")
                .register(meterRegistry);

        this.metricFailureCounter = Counter.builder("insights.analysis.failures")
                .description("Per-metric analyses that failed and were skipped")
                .register(meterRegistry);

        for (AnomalySeverity severity : AnomalySeverity.values()) {
            anomalyCounters.put(severity, Counter.builder("insights.anomalies.detected")
                    .description("Anomalies detected")
                    .tag("severity", severity.wireName())
                    .register(meterRegistry));
        }

        this.insightsPerTick = DistributionSummary.builder("insights.emitted")
                .description("Insights emitted per tick after top-N truncation")
                .baseUnit("insights")
                .register(meterRegistry);

        this.writeFailureCounter = Counter.builder("insights.store.write.failures")
                .description("Insight or anomaly writes that failed")
                .register(meterRegistry);

        this.writeDroppedCounter = Counter.builder("insights.store.write.dropped")
                .description("Writes dropped because the writer queue was full")
                .register(meterRegistry);
    }

    public void recordTick(long durationMs, boolean timedOut) {
        tickTimer.record(durationMs, TimeUnit.MILLISECONDS);
        (timedOut ? tickTimeoutCounter : tickSuccessCounter).increment();
        log.debug("Recorded tick: durationMs={}, timedOut={}", durationMs, timedOut);
    }

    public void recordSweep() {
        sweepCounter.increment();
    }

    public void recordMetricFailure() {
        metricFailureCounter.increment();
    }

    public void recordAnomaly(AnomalySeverity severity) {
        anomalyCounters.get(severity).increment();
    }

    public void recordInsightsEmitted(int count) {
        insightsPerTick.record(count);
    }

    public void recordWriteFailure() {
        writeFailureCounter.increment();
    }

    public void recordWriteDropped() {
        writeDroppedCounter.increment();
    }
}
