package com.example.resilience.dispatcher;

import com.example.resilience.circuitbreaker.CircuitBreakerResult;
import com.example.resilience.circuitbreaker.CircuitBreakerState;
import com.example.resilience.timeout.TimeoutOperation;
import com.example.resilience.timeout.TimeoutSource;
import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Value;

/**
 * Resultado enriquecido de un dispatch.
 * timedOut es sólo diagnóstico: fallo con duración de al menos el 90% del timeout, o timeout explícito.
 */
@Value
@Builder
public class DispatchResult<T> {
    T data;
    long timeout;
    TimeoutSource timeoutSource;
    long actualDuration;
    boolean timedOut;
    String serviceName;
    TimeoutOperation operation;
    CircuitBreakerState circuitState;
    boolean fromFallback;
    @JsonIgnore
    CircuitBreakerResult<T> circuitBreakerResult;
}
