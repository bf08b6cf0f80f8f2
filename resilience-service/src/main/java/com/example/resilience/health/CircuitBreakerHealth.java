package com.example.resilience.health;

import com.example.resilience.circuitbreaker.BreakerKey;
import com.example.resilience.circuitbreaker.CircuitBreakerMetrics;
import com.example.resilience.circuitbreaker.CircuitBreakerState;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Salud de un breaker. Siempre se deriva de sus métricas, nunca se almacena.
 */
@Value
@Builder
public class CircuitBreakerHealth {
    String service;
    String serviceName;
    String operation;
    CircuitBreakerState state;
    HealthStatus status;
    CircuitBreakerMetrics metrics;
    Instant timestamp;

    public static CircuitBreakerHealth of(BreakerKey key, CircuitBreakerMetrics metrics,
                                          double alertThreshold, Instant timestamp) {
        return CircuitBreakerHealth.builder()
                .service(key.toString())
                .serviceName(key.serviceName())
                .operation(key.operation())
                .state(metrics.getState())
                .status(HealthClassifier.classify(metrics.getState(), metrics.getErrorPercentage(), alertThreshold))
                .metrics(metrics)
                .timestamp(timestamp)
                .build();
    }
}
