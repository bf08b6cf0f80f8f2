package com.example.resilience.monitoring;

import com.example.resilience.circuitbreaker.CircuitBreakerMetrics;
import com.example.resilience.circuitbreaker.CircuitBreakerState;
import com.example.resilience.health.CircuitBreakerHealth;
import com.example.resilience.health.HealthStatus;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Map;

/**
 * Foto agregada de todos los breakers en un instante. services está indexado por clave de breaker.
 */
@Value
@Builder
public class MetricsSnapshot {
    Instant timestamp;
    int totalCircuitBreakers;
    Map<CircuitBreakerState, Integer> stateDistribution;
    Map<HealthStatus, Integer> healthDistribution;
    Map<String, ServiceSnapshot> services;
    AggregatedTotals aggregated;

    @Value
    public static class ServiceSnapshot {
        CircuitBreakerMetrics metrics;
        CircuitBreakerHealth health;
    }

    @Value
    @Builder
    public static class AggregatedTotals {
        long totalRequests;
        long totalSuccesses;
        long totalFailures;
        long totalRejections;
        double overallErrorPercentage;
        double averageResponseTime;
    }
}
