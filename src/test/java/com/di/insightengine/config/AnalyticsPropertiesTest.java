package com.di.insightengine.config;

import com.di.insightengine.exception.InvalidTimeWindowException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("AnalyticsProperties Tests")
class AnalyticsPropertiesTest {

    @Test
    @DisplayName("Defaults pass startup validation")
    void testDefaultsAreValid() {
        assertDoesNotThrow(() -> new AnalyticsProperties().validate());
    }

    @ParameterizedTest
    @CsvSource({"5m,5m", "5m,6m", "1h,2h"})
    @DisplayName("A tick timeout that does not end before the next tick is rejected")
    void testTickTimeoutMustBeShorterThanInterval(String interval, String timeout) {
        AnalyticsProperties properties = new AnalyticsProperties();
        properties.getEngine().setTickInterval(interval);
        properties.getEngine().setTickTimeout(timeout);

        IllegalArgumentException e = assertThrows(IllegalArgumentException.class, properties::validate);
        assertTrue(e.getMessage().contains("tick-timeout"), e.getMessage());
    }

    @Test
    @DisplayName("A tick timeout shorter than the interval is accepted")
    void testShorterTickTimeoutAccepted() {
        AnalyticsProperties properties = new AnalyticsProperties();
        properties.getEngine().setTickInterval("5m");
        properties.getEngine().setTickTimeout("299s");

        assertDoesNotThrow(properties::validate);
    }

    @Test
    @DisplayName("A malformed window fails validation")
    void testMalformedWindowRejected() {
        AnalyticsProperties properties = new AnalyticsProperties();
        properties.getEngine().setTickTimeout("4 minutes");

        assertThrows(InvalidTimeWindowException.class, properties::validate);
    }
}
