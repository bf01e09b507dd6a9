package com.di.insightengine.analytics.seasonality;

import com.di.insightengine.config.AnalyticsProperties;
import com.di.insightengine.model.TimeSeries;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.time.ZonedDateTime;
import java.time.ZoneOffset;
import java.util.Arrays;

import static com.di.insightengine.SeriesFixtures.BASE;
import static com.di.insightengine.SeriesFixtures.series;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("SeasonalityDetector Tests")
class SeasonalityDetectorTest {

    private static final Duration HOUR = Duration.ofHours(1);

    private SeasonalityDetector detector;

    @BeforeEach
    void setUp() {
        detector = new SeasonalityDetector(new AnalyticsProperties());
    }

    /** Hourly samples for two weeks: 150 during business hours (09-17 UTC), 100 otherwise. */
    private static TimeSeries businessHours() {
        double[] values = new double[14 * 24];
        for (int i = 0; i < values.length; i++) {
            int hour = i % 24;
            values[i] = hour >= 9 && hour <= 17 ? 150 : 100;
        }
        return series("api.request.count", HOUR, values);
    }

    @Test
    @DisplayName("Business-hour load is a strong daily pattern")
    void testDailyPattern() {
        SeasonalityResult result = detector.detect(businessHours());

        assertTrue(result.hasPatterns());
        assertEquals(1, result.getPatterns().size());
        SeasonalPattern daily = result.getPatterns().get(0);
        assertEquals(SeasonalPeriod.DAILY, daily.getPeriodType());
        assertEquals(1.0, daily.getStrength(), 1e-9);
        assertEquals(3, daily.getPeaks().size());
        daily.getPeaks().forEach(p -> assertEquals(150.0, p.getMean(), 1e-9));
        daily.getValleys().forEach(v -> assertEquals(100.0, v.getMean(), 1e-9));
        assertEquals(24, daily.getBuckets().size());
    }

    @Test
    @DisplayName("Hourly predictions follow the strongest pattern")
    void testPredictions() {
        SeasonalityResult result = detector.detect(businessHours());

        assertEquals(24, result.getPredictions().size());
        SeasonalPrediction first = result.getPredictions().get(0);
        // last sample is 23:00 on day 14, so the first prediction is midnight
        assertEquals(BASE.plus(Duration.ofDays(14)), first.getTimestamp());
        assertEquals(100.0, first.getExpected(), 1e-9);
        assertEquals(first.getExpected(), first.getLower(), 1e-9);
        SeasonalPrediction tenAm = result.getPredictions().get(10);
        assertEquals(150.0, tenAm.getExpected(), 1e-9);
    }

    @Test
    @DisplayName("Weekly evaluation of a day-invariant series has zero strength")
    void testWeeklyEvaluationWithoutSignal() {
        SeasonalPattern weekly = detector.evaluate(businessHours(), SeasonalPeriod.WEEKLY).orElseThrow();

        assertEquals(7, weekly.getBuckets().size());
        assertEquals(0.0, weekly.getStrength(), 1e-9);
    }

    @Test
    @DisplayName("Top-of-hour samples populate a single hourly slot, which is not evaluated")
    void testSingleBucketNotEvaluated() {
        assertTrue(detector.evaluate(businessHours(), SeasonalPeriod.HOURLY).isEmpty());
    }

    @Test
    @DisplayName("Constant and short series have no patterns")
    void testNoPatterns() {
        double[] flat = new double[48];
        Arrays.fill(flat, 10);
        SeasonalityResult constant = detector.detect(series("m", HOUR, flat));
        assertFalse(constant.hasPatterns());
        assertTrue(constant.getPredictions().isEmpty());

        assertFalse(detector.detect(series("m", HOUR, 5)).hasPatterns());
    }

    @Test
    @DisplayName("Prediction band is one bucket stddev with the lower bound floored at zero")
    void testPredictBand() {
        double[] values = new double[48];
        for (int i = 0; i < values.length; i++) {
            int hour = i % 24;
            int day = i / 24;
            values[i] = hour == 3 ? (day == 0 ? 0 : 10) : 100;
        }
        SeasonalPattern daily = detector.evaluate(series("m", HOUR, values), SeasonalPeriod.DAILY).orElseThrow();
        Instant threeAm = ZonedDateTime.of(2024, 1, 5, 3, 0, 0, 0, ZoneOffset.UTC).toInstant();

        SeasonalPrediction p = detector.predict(daily, threeAm).orElseThrow();

        assertEquals(5.0, p.getExpected(), 1e-9);
        assertEquals(0.0, p.getLower(), 1e-9);
        assertEquals(10.0, p.getUpper(), 1e-9);
    }

    @Test
    @DisplayName("Bucket labels are readable")
    void testLabels() {
        assertEquals("09:00", SeasonalPeriod.DAILY.label(9));
        assertEquals(":15", SeasonalPeriod.HOURLY.label(3));
        assertEquals("Monday", SeasonalPeriod.WEEKLY.label(0));
    }
}
