package com.example.resilience.exception;

import com.example.resilience.circuitbreaker.BreakerKey;

/**
 * Llamada rechazada sin intento real porque el circuit breaker está abierto
 * (o ya hay una prueba HALF_OPEN en curso).
 */
public class CircuitBreakerOpenException extends ServiceUnavailableException {
    private final transient BreakerKey key;
    private final long timeToResetMillis;

    public CircuitBreakerOpenException(BreakerKey key, long timeToResetMillis) {
        super(key.serviceName(), String.format("Circuit breaker for %s is open (retry in %d ms)", key, timeToResetMillis));
        this.key = key;
        this.timeToResetMillis = timeToResetMillis;
    }

    public BreakerKey getKey() {
        return key;
    }

    public long getTimeToResetMillis() {
        return timeToResetMillis;
    }
}
