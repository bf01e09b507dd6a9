package com.di.insightengine.engine;

import com.di.insightengine.insight.Insight;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Outcome of one scheduled pass (tick or full sweep).
 */
@Value
@Builder
public class TickReport {
    String tickId;
    String kind;
    int tasks;
    int failures;
    /** Tasks cancelled because the pass hit the tick timeout. */
    int abandoned;
    boolean timedOut;
    long durationMs;
    /** Ranked, truncated to top-N. */
    List<Insight> insights;
    int anomaliesPublished;
    int insightsPublished;
}
