package com.example.resilience.health;

import com.example.resilience.circuitbreaker.CircuitBreakerState;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class HealthClassifierTest {

    @Test
    void openIsUnhealthyRegardlessOfErrorRate() {
        assertThat(HealthClassifier.classify(CircuitBreakerState.OPEN, 0, 80)).isEqualTo(HealthStatus.UNHEALTHY);
    }

    @Test
    void halfOpenIsDegraded() {
        assertThat(HealthClassifier.classify(CircuitBreakerState.HALF_OPEN, 0, 80)).isEqualTo(HealthStatus.DEGRADED);
    }

    @Test
    void closedDependsOnAlertThreshold() {
        assertThat(HealthClassifier.classify(CircuitBreakerState.CLOSED, 80.0, 80)).isEqualTo(HealthStatus.HEALTHY);
        assertThat(HealthClassifier.classify(CircuitBreakerState.CLOSED, 80.1, 80)).isEqualTo(HealthStatus.DEGRADED);
    }
}
