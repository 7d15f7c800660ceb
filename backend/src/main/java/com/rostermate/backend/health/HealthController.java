package com.rostermate.backend.health;

import java.time.Clock;
import java.time.Instant;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.actuate.health.CompositeHealth;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthComponent;
import org.springframework.boot.actuate.health.HealthEndpoint;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Liveness ({@code /healthz}) and readiness ({@code /readyz}) probes.
 * Readiness follows the datasource health since every roster operation needs the database.
 */
@RestController
public class HealthController {

    private static final Logger log = LoggerFactory.getLogger(HealthController.class);

    private final HealthEndpoint healthEndpoint;
    private final Clock clock;

    public HealthController(HealthEndpoint healthEndpoint, Clock clock) {
        this.healthEndpoint = healthEndpoint;
        this.clock = clock;
    }

    @GetMapping("/healthz")
    public HealthResponse healthz() {
        return new HealthResponse("UP", Instant.now(clock).toString());
    }

    @GetMapping("/readyz")
    public HealthResponse readyz() {
        try {
            HealthComponent healthComponent = healthEndpoint.health();
            String status = healthComponent.getStatus().getCode();
            if (healthComponent instanceof CompositeHealth composite
                    && composite.getComponents().get("db") instanceof Health dbHealth) {
                status = dbHealth.getStatus().getCode();
            }
            return new HealthResponse(status, Instant.now(clock).toString());
        } catch (RuntimeException ex) {
            log.warn("Readiness probe failed: {}", ex.getMessage());
            return new HealthResponse("DOWN", Instant.now(clock).toString());
        }
    }

    public record HealthResponse(
            String status,
            String timestamp
    ) {
    }
}
