package com.di.insightengine;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Performance analytics service: scheduled trend/anomaly/capacity ticks, a daily correlation and seasonality
 * sweep, and a read API for the dashboard. The datasource is only auto-configured under the {@code postgres}
 * profile (see application-postgres.yml); otherwise the in-memory stores are used.
 */
@SpringBootApplication
public class InsightEngineApplication {

	public static void main(String[] args) {
		SpringApplication.run(InsightEngineApplication.class, args);
	}
}
