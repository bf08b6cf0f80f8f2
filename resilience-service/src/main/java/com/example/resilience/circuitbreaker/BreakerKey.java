package com.example.resilience.circuitbreaker;

import java.util.Objects;

/**
 * Identidad de un circuit breaker. Sin operación, la clave cubre todas las operaciones del servicio.
 */
public record BreakerKey(String serviceName, String operation) {

    public BreakerKey {
        Objects.requireNonNull(serviceName, "serviceName must not be null");
        if (operation != null && operation.isBlank()) {
            operation = null;
        }
    }

    public static BreakerKey of(String serviceName) {
        return new BreakerKey(serviceName, null);
    }

    public static BreakerKey of(String serviceName, String operation) {
        return new BreakerKey(serviceName, operation);
    }

    public boolean hasOperation() {
        return operation != null;
    }

    @Override
    public String toString() {
        return operation == null ? serviceName : serviceName + ":" + operation;
    }
}
