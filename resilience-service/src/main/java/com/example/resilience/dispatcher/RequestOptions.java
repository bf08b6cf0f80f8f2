package com.example.resilience.dispatcher;

import com.example.resilience.timeout.TimeoutOperation;
import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * Petición RPC. serviceName se deriva de la routing key si no se indica;
 * timeout sustituye al resuelto si se indica. Con useFallback=false un fallo total
 * llega al llamante como {@link com.example.resilience.exception.ServiceCallException}.
 */
@Value
@Builder
public class RequestOptions {
    String exchange;
    String routingKey;
    Object payload;
    String serviceName;
    @Builder.Default
    TimeoutOperation operation = TimeoutOperation.RPC_CALL;
    Long timeout;
    Map<String, Object> metadata;
    @Builder.Default
    boolean useFallback = true;
}
