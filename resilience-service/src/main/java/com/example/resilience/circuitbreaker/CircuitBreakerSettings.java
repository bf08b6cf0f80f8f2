package com.example.resilience.circuitbreaker;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.util.function.Predicate;

/**
 * Configuración ya fusionada de un circuit breaker. Se fija al crear el breaker.
 */
@Value
@Builder(toBuilder = true)
public class CircuitBreakerSettings {
    long timeout;
    int errorThresholdPercentage;
    long resetTimeout;
    int volumeThreshold;
    long rollingCountTimeout;
    int rollingCountBuckets;
    boolean enabled;

    /**
     * true si el error cuenta para la tasa de errores
     */
    @JsonIgnore
    @Builder.Default
    Predicate<Throwable> errorFilter = DefaultErrorFilter.INSTANCE;

    public Duration timeoutDuration() {
        return Duration.ofMillis(timeout);
    }
}
