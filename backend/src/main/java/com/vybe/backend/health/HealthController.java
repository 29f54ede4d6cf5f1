package com.vybe.backend.health;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonInclude;

import org.springframework.boot.actuate.health.CompositeHealth;
import org.springframework.boot.actuate.health.HealthComponent;
import org.springframework.boot.actuate.health.HealthEndpoint;
import org.springframework.boot.actuate.health.Status;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Liveness ({@code /healthz}) and readiness ({@code /readyz}). Readiness requires both the
 * database and Redis to be up.
 */
@RestController
public class HealthController {

    static final String[] READINESS_COMPONENTS = {"db", "redis"};

    private final HealthEndpoint healthEndpoint;
    private final Clock clock;

    public HealthController(HealthEndpoint healthEndpoint, Clock clock) {
        this.healthEndpoint = healthEndpoint;
        this.clock = clock;
    }

    @GetMapping("/healthz")
    public HealthResponse healthz() {
        return new HealthResponse(Status.UP.getCode(), Instant.now(clock).toString(), null);
    }

    @GetMapping("/readyz")
    public ResponseEntity<HealthResponse> readyz() {
        Map<String, String> components = new LinkedHashMap<>();
        HealthComponent health = healthEndpoint.health();
        Map<String, HealthComponent> children = health instanceof CompositeHealth composite
                ? composite.getComponents()
                : Map.of();

        boolean ready = true;
        for (String name : READINESS_COMPONENTS) {
            HealthComponent component = children.get(name);
            String status = component != null ? component.getStatus().getCode() : Status.UNKNOWN.getCode();
            components.put(name, status);
            ready &= Status.UP.getCode().equals(status);
        }

        HealthResponse body = new HealthResponse(
                ready ? Status.UP.getCode() : Status.DOWN.getCode(),
                Instant.now(clock).toString(),
                components
        );
        return ResponseEntity.status(ready ? HttpStatus.OK : HttpStatus.SERVICE_UNAVAILABLE).body(body);
    }

    @GetMapping("/health")
    public HealthResponse health() {
        return healthz();
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record HealthResponse(
            String status,
            String timestamp,
            Map<String, String> components
    ) {
    }
}
