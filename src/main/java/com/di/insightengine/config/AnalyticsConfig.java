package com.di.insightengine.config;

import com.di.insightengine.engine.AnalyticsEngine;
import com.di.insightengine.insight.AnalyticsService;
import com.di.insightengine.insight.InsightAggregator;
import com.di.insightengine.store.InsightStore;
import com.di.insightengine.util.AnalyticsMetrics;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Wires the scheduled engine. Spring starts it once the context is up and stops it on shutdown;
 * set insights.analytics.engine.enabled=false to serve the read API only.
 */
@Configuration
public class AnalyticsConfig {

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean(initMethod = "start", destroyMethod = "stop")
    @ConditionalOnProperty(name = "insights.analytics.engine.enabled", havingValue = "true", matchIfMissing = true)
    public AnalyticsEngine analyticsEngine(InsightAggregator aggregator, AnalyticsService analyticsService,
                                           InsightStore insightStore, AnalyticsProperties properties,
                                           AnalyticsMetrics metrics) {
        return new AnalyticsEngine(aggregator, analyticsService, insightStore, properties, metrics);
    }
}
