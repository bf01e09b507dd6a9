package com.di.insightengine.analytics.anomaly;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;

/**
 * A classified deviation. Immutable; the detector never alters the underlying samples.
 */
@Value
@Builder
public class AnomalyResult {
    String metric;
    String tenantId;
    Instant timestamp;
    double value;
    double expectedValue;
    /** Standard deviations from the baseline (for {@code missing}: gap length in sampling intervals). */
    double deviationScore;
    AnomalyType type;
    AnomalySeverity severity;
    AnomalyContext context;
    List<String> possibleCauses;
}
