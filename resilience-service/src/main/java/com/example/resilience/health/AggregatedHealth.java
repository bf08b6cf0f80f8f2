package com.example.resilience.health;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Map;

/**
 * Salud de todo el sistema. up es false si algún breaker está UNHEALTHY.
 */
@Value
@Builder
public class AggregatedHealth {
    boolean up;
    HealthStatus status;
    Summary summary;
    Map<String, CircuitBreakerHealth> services;
    Instant timestamp;

    @Value
    public static class Summary {
        int total;
        int healthy;
        int degraded;
        int unhealthy;
    }
}
