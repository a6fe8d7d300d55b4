package com.certchaperone.backend.health;

import java.time.Clock;
import java.time.Instant;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.actuate.health.CompositeHealth;
import org.springframework.boot.actuate.health.HealthComponent;
import org.springframework.boot.actuate.health.HealthEndpoint;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Liveness and readiness probes. Readiness follows the database health indicator.
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

            if (healthComponent instanceof CompositeHealth composite) {
                HealthComponent db = composite.getComponents().get("db");
                if (db != null) {
                    status = db.getStatus().getCode();
                }
            }
            return new HealthResponse(status, Instant.now(clock).toString());
        } catch (RuntimeException ex) {
            log.warn("Readiness check failed", ex);
            return new HealthResponse("DOWN", Instant.now(clock).toString());
        }
    }

    @GetMapping("/health")
    public HealthResponse health() {
        return healthz();
    }

    public record HealthResponse(
            String status,
            String timestamp
    ) {
    }
}
