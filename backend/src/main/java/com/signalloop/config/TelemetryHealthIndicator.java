package com.signalloop.config;

import com.signalloop.service.ControlPlaneService;
import com.signalloop.service.IngestionHealthService;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Reports ingestion rates and the cached active policy. Low scrape success is
 * reported as {@code OUT_OF_SERVICE}, not {@code DOWN}: ingestion degrades
 * without taking the service offline.
 */
@Component
public class TelemetryHealthIndicator implements HealthIndicator {

    static final double MIN_HEALTHY_SCRAPE_SUCCESS_RATE = 0.5;
    static final long MIN_ATTEMPTS_FOR_RATE = 10;

    private final IngestionHealthService ingestionHealthService;
    private final ControlPlaneService controlPlaneService;

    public TelemetryHealthIndicator(
            IngestionHealthService ingestionHealthService,
            ControlPlaneService controlPlaneService) {
        this.ingestionHealthService = ingestionHealthService;
        this.controlPlaneService = controlPlaneService;
    }

    @Override
    public Health health() {
        IngestionHealthService.HealthSnapshot snapshot = ingestionHealthService.snapshot();
        boolean degraded = snapshot.scrapeAttempts() >= MIN_ATTEMPTS_FOR_RATE
                && snapshot.scrapeSuccessRate() < MIN_HEALTHY_SCRAPE_SUCCESS_RATE;

        Health.Builder builder = degraded ? Health.outOfService() : Health.up();
        builder.withDetail("scrapeAttempts", snapshot.scrapeAttempts())
                .withDetail("scrapeSuccessRate", snapshot.scrapeSuccessRate())
                .withDetail("validationPassRate", snapshot.validationPassRate())
                .withDetail("alerts", snapshot.alerts())
                .withDetail("cacheHits", snapshot.cacheHits());
        controlPlaneService.cachedActiveState().ifPresent(active -> builder
                .withDetail("policyStateId", active.id())
                .withDetail("explorationRate", active.explorationRate())
                .withDetail("acceptanceThreshold", active.acceptanceThreshold()));
        return builder.build();
    }
}
