package com.example.resilience.exception;

import com.example.resilience.circuitbreaker.CircuitBreakerResult;

/**
 * Fallo total de un dispatch sin fallback disponible. Transporta el resultado del
 * circuit breaker para diagnóstico.
 */
public class ServiceCallException extends ServiceUnavailableException {
    private final transient CircuitBreakerResult<?> circuitBreakerResult;
    private final String routingKey;

    public ServiceCallException(String serviceName, String routingKey, CircuitBreakerResult<?> result, Throwable cause) {
        this(serviceName, routingKey, result,
                result.getError() != null ? result.getError() : "Circuit breaker operation failed", cause);
    }

    public ServiceCallException(String serviceName, String routingKey, CircuitBreakerResult<?> result,
                                String message, Throwable cause) {
        super(serviceName, message, cause);
        this.circuitBreakerResult = result;
        this.routingKey = routingKey;
    }

    public CircuitBreakerResult<?> getCircuitBreakerResult() {
        return circuitBreakerResult;
    }

    public String getRoutingKey() {
        return routingKey;
    }
}
