package com.example.resilience.health;

import com.example.resilience.circuitbreaker.CircuitBreakerState;

/**
 * Clasificación de salud derivada del estado del breaker y su tasa de errores.
 */
public final class HealthClassifier {

    private HealthClassifier() {
        // Utility class
    }

    /**
     * OPEN → UNHEALTHY; HALF_OPEN → DEGRADED; CLOSED con errores por encima del umbral → DEGRADED;
     * en cualquier otro caso HEALTHY.
     */
    public static HealthStatus classify(CircuitBreakerState state, double errorPercentage, double alertThreshold) {
        if (state == CircuitBreakerState.OPEN) {
            return HealthStatus.UNHEALTHY;
        }
        if (state == CircuitBreakerState.HALF_OPEN) {
            return HealthStatus.DEGRADED;
        }
        if (errorPercentage > alertThreshold) {
            return HealthStatus.DEGRADED;
        }
        return HealthStatus.HEALTHY;
    }
}
