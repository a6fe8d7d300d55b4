package com.certchaperone.backend.health;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.boot.actuate.health.CompositeHealth;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthComponent;
import org.springframework.boot.actuate.health.HealthEndpoint;
import org.springframework.boot.actuate.health.Status;

class HealthControllerTest {

    private static final Instant NOW = Instant.parse("2025-03-01T12:00:00Z");

    private HealthEndpoint healthEndpoint;
    private HealthController controller;

    @BeforeEach
    void setUp() {
        healthEndpoint = mock(HealthEndpoint.class);
        controller = new HealthController(healthEndpoint, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void livenessIsAlwaysUp() {
        assertThat(controller.healthz().status()).isEqualTo("UP");
        assertThat(controller.healthz().timestamp()).isEqualTo("2025-03-01T12:00:00Z");
    }

    @Test
    void readinessFollowsDatabaseComponent() {
        CompositeHealth composite = mock(CompositeHealth.class);
        when(composite.getStatus()).thenReturn(Status.UP);
        Map<String, HealthComponent> components = Map.of("db", Health.down().build());
        when(composite.getComponents()).thenReturn(components);
        when(healthEndpoint.health()).thenReturn(composite);

        assertThat(controller.readyz().status()).isEqualTo("DOWN");
    }

    @Test
    void readinessIsDownWhenHealthLookupFails() {
        when(healthEndpoint.health()).thenThrow(new IllegalStateException("no indicators"));

        assertThat(controller.readyz().status()).isEqualTo("DOWN");
    }
}
