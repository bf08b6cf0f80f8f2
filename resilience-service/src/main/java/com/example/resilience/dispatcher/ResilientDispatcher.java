package com.example.resilience.dispatcher;

import com.example.resilience.circuitbreaker.BreakerKey;
import com.example.resilience.circuitbreaker.CircuitBreakerMetrics;
import com.example.resilience.circuitbreaker.CircuitBreakerOptions;
import com.example.resilience.circuitbreaker.CircuitBreakerResult;
import com.example.resilience.circuitbreaker.ResilienceManager;
import com.example.resilience.config.DispatcherProperties;
import com.example.resilience.exception.OperationTimeoutException;
import com.example.resilience.exception.ServiceCallException;
import com.example.resilience.exception.ServiceUnavailableException;
import com.example.resilience.health.CircuitBreakerHealth;
import com.example.resilience.health.CircuitBreakerHealthService;
import com.example.resilience.messaging.MessageTransport;
import com.example.resilience.timeout.TimeoutOperation;
import com.example.resilience.timeout.TimeoutResolution;
import com.example.resilience.timeout.TimeoutResolver;
import com.example.resilience.utils.ReactiveUtils;
import com.example.resilience.utils.ServiceNames;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.Collections;
import java.util.Map;
import java.util.Optional;

/**
 * Punto de entrada para llamadas RPC y publicación de eventos sobre el broker.
 *
 * <p>Cada llamada resuelve su timeout, pasa por el circuit breaker de (servicio, operación)
 * y aplica el fallback del servicio. Los errores del llamante se propagan sin modificar.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ResilientDispatcher {

    static final String DISPATCH_METRIC = "resilience.dispatch";
    static final double TIMED_OUT_RATIO = 0.9;

    private final MessageTransport transport;
    private final ResilienceManager resilienceManager;
    private final TimeoutResolver timeoutResolver;
    private final FallbackFactory fallbackFactory;
    private final CircuitBreakerHealthService healthService;
    private final DispatcherProperties properties;
    private final MeterRegistry meterRegistry;

    public <T> Mono<DispatchResult<T>> request(RequestOptions options, Class<T> responseType) {
        String serviceName = options.getServiceName() != null
                ? ServiceNames.normalize(options.getServiceName())
                : ServiceNames.fromRoutingKey(options.getRoutingKey());
        TimeoutOperation operation = options.getOperation() != null ? options.getOperation() : TimeoutOperation.RPC_CALL;
        TimeoutResolution resolution = timeoutResolver.resolve(serviceName, operation, options.getTimeout());
        Duration timeout = Duration.ofMillis(resolution.getTimeout());
        BreakerKey key = BreakerKey.of(serviceName, operation.getValue());

        Map<String, String> context = ReactiveUtils.createContext(
                "serviceName", serviceName,
                "routingKey", options.getRoutingKey(),
                "operation", operation.getValue());

        return ReactiveUtils.withContextAndMetrics(context, () -> {
                    log.debug("Dispatching {} to {} (timeout={}ms, source={}, metadata={})",
                            options.getRoutingKey(), options.getExchange(), resolution.getTimeout(),
                            resolution.getSource(), options.getMetadata());
                    return resilienceManager.execute(key,
                                    () -> transport.send(options.getExchange(), options.getRoutingKey(),
                                            options.getPayload(), timeout, responseType),
                                    CircuitBreakerOptions.NONE,
                                    timeout,
                                    options.isUseFallback()
                                            ? fallbackFactory.forRequest(serviceName, operation, options.getRoutingKey(), responseType)
                                            : null)
                            .flatMap(result -> toDispatchResult(result, resolution, serviceName, operation,
                                    options.getRoutingKey()));
                }, meterRegistry, DISPATCH_METRIC,
                Tag.of("service", serviceName), Tag.of("operation", operation.getValue()));
    }

    private <T> Mono<DispatchResult<T>> toDispatchResult(CircuitBreakerResult<T> result,
                                                         TimeoutResolution resolution,
                                                         String serviceName,
                                                         TimeoutOperation operation,
                                                         String routingKey) {
        if (result.isCallerError()) {
            return Mono.error(result.getCause());
        }
        if (result.isFallbackFailed()) {
            log.warn("Fallback failed for {} on {}: {}", routingKey, serviceName, result.getError());
            Throwable cause = result.getCause();
            if (cause instanceof ServiceUnavailableException && !(cause instanceof ServiceCallException)) {
                // se conserva el mensaje del fallback y se adjunta el resultado del breaker
                return Mono.error(new ServiceCallException(serviceName, routingKey, result,
                        cause.getMessage(), cause.getCause()));
            }
            return Mono.error(cause);
        }
        if (!result.isSuccess()) {
            log.error("Call to {} on {} failed after {}ms: {}",
                    routingKey, serviceName, result.getExecutionTime(), result.getError());
            return Mono.error(new ServiceCallException(serviceName, routingKey, result, result.getCause()));
        }
        if (result.isFromFallback()) {
            log.info("Served {} from fallback (state={})", routingKey, result.getCircuitState());
        }

        long timeout = resolution.getTimeout();
        DispatchResult<T> dispatchResult = DispatchResult.<T>builder()
                .data(result.getData())
                .timeout(timeout)
                .timeoutSource(resolution.getSource())
                .actualDuration(result.getExecutionTime())
                .timedOut(isTimedOut(result, timeout))
                .serviceName(serviceName)
                .operation(operation)
                .circuitState(result.getCircuitState())
                .fromFallback(result.isFromFallback())
                .circuitBreakerResult(result)
                .build();
        return Mono.just(dispatchResult);
    }

    /**
     * Un resultado servido por fallback no cuenta como éxito para este diagnóstico.
     */
    static boolean isTimedOut(CircuitBreakerResult<?> result, long timeout) {
        boolean failed = !result.isSuccess() || result.isFromFallback();
        if (!failed) {
            return false;
        }
        return result.getCause() instanceof OperationTimeoutException
                || result.getExecutionTime() >= timeout * TIMED_OUT_RATIO;
    }

    /**
     * Publicación best-effort: los fallos se registran y se absorben.
     * Sólo se propagan errores del llamante o fallos del propio fallback.
     */
    public Mono<Void> publish(PublishOptions options) {
        String serviceName = options.getServiceName() != null
                ? ServiceNames.normalize(options.getServiceName())
                : ServiceNames.fromRoutingKey(options.getRoutingKey());
        BreakerKey key = BreakerKey.of(serviceName, TimeoutOperation.EVENT_PUBLISH.getValue());
        CircuitBreakerOptions publishOptions = CircuitBreakerOptions.builder()
                .timeout(properties.getPublishTimeout())
                .volumeThreshold(properties.getPublishVolumeThreshold())
                .build();

        Map<String, String> context = ReactiveUtils.createContext(
                "serviceName", serviceName,
                "routingKey", options.getRoutingKey(),
                "operation", TimeoutOperation.EVENT_PUBLISH.getValue());

        return ReactiveUtils.withContextAndMetrics(context, () ->
                        resilienceManager.execute(key,
                                        () -> transport.publish(options.getExchange(), options.getRoutingKey(),
                                                options.getPayload()),
                                        publishOptions,
                                        Duration.ofMillis(properties.getPublishTimeout()),
                                        fallbackFactory.forPublish(serviceName, options.getRoutingKey()))
                                .flatMap(result -> {
                                    if (result.isCallerError() || result.isFallbackFailed()) {
                                        return Mono.<Void>error(result.getCause());
                                    }
                                    if (!result.isSuccess()) {
                                        log.warn("Event {} to {} was not published: {}",
                                                options.getRoutingKey(), options.getExchange(), result.getError());
                                    }
                                    return Mono.<Void>empty();
                                }),
                meterRegistry, DISPATCH_METRIC,
                Tag.of("service", serviceName), Tag.of("operation", TimeoutOperation.EVENT_PUBLISH.getValue()));
    }

    /**
     * Health check RPC contra el exchange de comandos. Con el circuito abierto responde
     * con el estado sintético "unhealthy" del fallback.
     */
    @SuppressWarnings("unchecked")
    public Mono<DispatchResult<Map<String, Object>>> healthCheck(String serviceName, String routingKey) {
        Class<Map<String, Object>> responseType = (Class<Map<String, Object>>) (Class<?>) Map.class;
        return request(RequestOptions.builder()
                .exchange(properties.getCommandsExchange())
                .routingKey(routingKey)
                .payload(Collections.emptyMap())
                .serviceName(serviceName)
                .operation(TimeoutOperation.HEALTH_CHECK)
                .metadata(Map.of("healthCheck", true))
                .build(), responseType);
    }

    public TimeoutResolution resolveTimeout(String serviceName, TimeoutOperation operation) {
        return timeoutResolver.resolve(ServiceNames.normalize(serviceName), operation);
    }

    public Optional<CircuitBreakerHealth> getCircuitBreakerHealth(String serviceName, TimeoutOperation operation) {
        return healthService.getServiceHealth(ServiceNames.normalize(serviceName),
                operation != null ? operation.getValue() : null);
    }

    public Map<String, CircuitBreakerHealth> getAllCircuitBreakerHealth() {
        return healthService.getAllHealth();
    }

    public Optional<CircuitBreakerMetrics> getCircuitBreakerMetrics(String serviceName, TimeoutOperation operation) {
        return resilienceManager.getMetrics(BreakerKey.of(ServiceNames.normalize(serviceName),
                operation != null ? operation.getValue() : null));
    }

    public boolean resetCircuitBreaker(String serviceName, TimeoutOperation operation) {
        return resilienceManager.reset(BreakerKey.of(ServiceNames.normalize(serviceName),
                operation != null ? operation.getValue() : null));
    }

    public Map<String, Object> getTimeoutDebugInfo() {
        return timeoutResolver.getDebugInfo();
    }

    public Map<String, Object> getCircuitBreakerDebugInfo() {
        return resilienceManager.getDebugInfo();
    }
}
