package com.di.insightengine.analytics.anomaly;

import com.di.insightengine.config.AnalyticsProperties;
import com.di.insightengine.model.Sample;
import com.di.insightengine.model.SeriesKey;
import com.di.insightengine.model.TimeSeries;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;

import static com.di.insightengine.SeriesFixtures.BASE;
import static com.di.insightengine.SeriesFixtures.TENANT;
import static com.di.insightengine.SeriesFixtures.noisy;
import static com.di.insightengine.SeriesFixtures.series;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("AnomalyDetector Tests")
class AnomalyDetectorTest {

    private static final Duration MINUTE = Duration.ofMinutes(1);

    private AnomalyDetector detector;

    @BeforeEach
    void setUp() {
        detector = new AnomalyDetector(new AnalyticsProperties());
    }

    @Test
    @DisplayName("A single 150 among thirty samples around 100 is the only anomaly")
    void testSingleSpike() {
        double[] values = new double[31];
        double[] base = noisy(100, 30);
        System.arraycopy(base, 0, values, 0, 15);
        values[15] = 150;
        System.arraycopy(base, 15, values, 16, 15);

        List<AnomalyResult> anomalies = detector.detect(series("api.request.latency", MINUTE, values));

        assertEquals(1, anomalies.size());
        AnomalyResult a = anomalies.get(0);
        assertEquals(AnomalyType.SPIKE, a.getType());
        assertEquals(AnomalySeverity.CRITICAL, a.getSeverity());
        assertTrue(a.getDeviationScore() > 40, "score " + a.getDeviationScore());
        assertEquals(150.0, a.getValue());
        assertEquals(100.0, a.getExpectedValue(), 1e-9);
        assertEquals(BASE.plus(MINUTE.multipliedBy(15)), a.getTimestamp());
        assertEquals(TENANT, a.getTenantId());
        assertTrue(a.getPossibleCauses().contains("Network congestion"));
    }

    @Test
    @DisplayName("A deep drop is reported as a dip")
    void testDip() {
        double[] values = noisy(100, 40);
        values[20] = 60;

        List<AnomalyResult> anomalies = detector.detect(series("notification.delivery.success_rate", MINUTE, values));

        assertEquals(1, anomalies.size());
        assertEquals(AnomalyType.DIP, anomalies.get(0).getType());
        assertTrue(anomalies.get(0).getPossibleCauses().contains("Recent deployment"));
    }

    @Test
    @DisplayName("Constant and short series produce no anomalies")
    void testDegenerateInput() {
        assertTrue(detector.detect(series("m", MINUTE, 5, 5, 5, 5, 5, 5, 5, 5, 5, 5)).isEmpty());
        assertTrue(detector.detect(series("m", MINUTE, 1, 100)).isEmpty());
        assertTrue(detector.detect(TimeSeries.empty(SeriesKey.of("m", TENANT))).isEmpty());
        assertTrue(detector.detect(null).isEmpty());
    }

    @ParameterizedTest
    @ValueSource(doubles = {0.0, 0.1, 73.3})
    @DisplayName("A lone spike on a perfectly flat line has no baseline spread to be scored against")
    void testSpikeOnFlatLineIsSkipped(double level) {
        double[] values = new double[31];
        Arrays.fill(values, level);
        values[30] = level + 50;

        List<AnomalyResult> anomalies = detector.detect(series("database.disk.usage", MINUTE, values));

        assertTrue(anomalies.isEmpty(), () -> "unexpected " + anomalies);
    }

    @Test
    @DisplayName("A gap of ten intervals is reported as missing data")
    void testMissingGap() {
        List<Sample> samples = new ArrayList<>();
        double[] values = noisy(100, 20);
        for (int i = 0; i < 10; i++) samples.add(Sample.of(BASE.plus(MINUTE.multipliedBy(i)), values[i]));
        for (int i = 10; i < 20; i++) samples.add(Sample.of(BASE.plus(MINUTE.multipliedBy(i + 9)), values[i]));

        List<AnomalyResult> anomalies = detector.detect(TimeSeries.of(SeriesKey.of("database.query.latency", TENANT), samples));

        assertEquals(1, anomalies.size());
        AnomalyResult missing = anomalies.get(0);
        assertEquals(AnomalyType.MISSING, missing.getType());
        assertEquals(10.0, missing.getDeviationScore(), 1e-9);
        assertEquals(AnomalySeverity.CRITICAL, missing.getSeverity());
        assertEquals(BASE.plus(MINUTE.multipliedBy(10)), missing.getTimestamp());
        assertEquals(0.0, missing.getValue());
        assertTrue(missing.getPossibleCauses().contains("Collector outage"));
    }

    @Test
    @DisplayName("A sustained level shift in the last quarter is reported as drift")
    void testDrift() {
        double[] values = new double[40];
        System.arraycopy(noisy(100, 30), 0, values, 0, 30);
        System.arraycopy(noisy(120, 10), 0, values, 30, 10);

        List<AnomalyResult> anomalies = detector.detect(series("system.memory.usage", MINUTE, values));

        assertEquals(1, anomalies.size());
        AnomalyResult drift = anomalies.get(0);
        assertEquals(AnomalyType.DRIFT, drift.getType());
        assertEquals(100.0, drift.getExpectedValue(), 1e-9);
        assertEquals(120.0, drift.getValue(), 1e-9);
        assertEquals(BASE.plus(MINUTE.multipliedBy(30)), drift.getTimestamp());
        assertTrue(drift.getPossibleCauses().contains("Memory leak"));
    }

    @Test
    @DisplayName("Drift detection can be switched off")
    void testDriftDisabled() {
        AnalyticsProperties properties = new AnalyticsProperties();
        properties.getAnomaly().setDriftEnabled(false);
        double[] values = new double[40];
        System.arraycopy(noisy(100, 30), 0, values, 0, 30);
        System.arraycopy(noisy(120, 10), 0, values, 30, 10);

        assertTrue(new AnomalyDetector(properties).detect(series("m", MINUTE, values)).isEmpty());
    }

    @Test
    @DisplayName("Results are ordered by deviation score, highest first")
    void testOrdering() {
        double[] values = noisy(100, 60);
        values[10] = 130;
        values[40] = 160;

        List<AnomalyResult> anomalies = detector.detect(series("m", MINUTE, values));

        assertEquals(2, anomalies.size());
        assertEquals(160.0, anomalies.get(0).getValue());
        assertEquals(130.0, anomalies.get(1).getValue());
        assertTrue(anomalies.get(0).getDeviationScore() > anomalies.get(1).getDeviationScore());
    }

    @Test
    @DisplayName("Wire names do not depend on the default locale")
    void testWireNameIgnoresDefaultLocale() {
        Locale previous = Locale.getDefault();
        try {
            Locale.setDefault(new Locale("tr", "TR"));
            assertEquals("critical", AnomalySeverity.CRITICAL.wireName());
            assertEquals("high", AnomalySeverity.HIGH.wireName());
        } finally {
            Locale.setDefault(previous);
        }
    }

    @ParameterizedTest
    @CsvSource({"0.5,LOW", "2.5,LOW", "2.6,MEDIUM", "3.0,MEDIUM", "3.5,HIGH", "4.0,HIGH", "4.1,CRITICAL", "50,CRITICAL"})
    @DisplayName("Severity bands are monotone in the score")
    void testSeverityFromScore(double score, AnomalySeverity expected) {
        assertEquals(expected, AnomalySeverity.fromScore(score));
    }
}
