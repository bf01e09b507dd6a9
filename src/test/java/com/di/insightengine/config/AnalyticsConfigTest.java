package com.di.insightengine.config;

import com.di.insightengine.AnalyticsFixture;
import com.di.insightengine.engine.AnalyticsEngine;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("AnalyticsConfig Tests")
class AnalyticsConfigTest {

    private final AnalyticsConfig config = new AnalyticsConfig();

    @Test
    @DisplayName("Default clock runs in UTC")
    void clockIsUtc() {
        assertEquals(ZoneOffset.UTC, config.clock().getZone());
    }

    @Test
    @DisplayName("Engine bean is created stopped; Spring drives start and stop")
    void engineIsCreatedStopped() {
        AnalyticsFixture fixture = new AnalyticsFixture();
        AnalyticsEngine engine = config.analyticsEngine(fixture.aggregator, fixture.analyticsService,
                fixture.insightStore, fixture.properties, fixture.metrics);

        assertFalse(engine.isRunning());
        engine.start(false);
        assertTrue(engine.isRunning());
        engine.stop();
        assertFalse(engine.isRunning());
    }
}
