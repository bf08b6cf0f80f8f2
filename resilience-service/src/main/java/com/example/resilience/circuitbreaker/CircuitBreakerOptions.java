package com.example.resilience.circuitbreaker;

import lombok.Builder;
import lombok.Value;

import java.util.function.Predicate;

/**
 * Overrides del llamante. Los campos nulos heredan del servicio, la operación o los valores por defecto.
 */
@Value
@Builder
public class CircuitBreakerOptions {
    public static final CircuitBreakerOptions NONE = CircuitBreakerOptions.builder().build();

    Long timeout;
    Integer errorThresholdPercentage;
    Long resetTimeout;
    Integer volumeThreshold;
    Long rollingCountTimeout;
    Integer rollingCountBuckets;
    Predicate<Throwable> errorFilter;
}
