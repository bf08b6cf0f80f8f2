package com.example.resilience.circuitbreaker;

import java.time.Instant;

/**
 * Transición de estado de un breaker. manual indica un reset administrativo.
 */
public record StateChangeEvent(BreakerKey key,
                               CircuitBreakerState from,
                               CircuitBreakerState to,
                               Instant timestamp,
                               boolean manual) {
}
