package com.example.resilience.circuitbreaker;

import com.example.resilience.exception.OperationTimeoutException;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeoutException;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Registro central de circuit breakers, uno por {@link BreakerKey}, creados bajo demanda
 * con la configuración fusionada y vivos durante todo el proceso.
 */
@Slf4j
@Component
public class ResilienceManager {

    private final CircuitBreakerConfigResolver configResolver;
    private final MeterRegistry meterRegistry;
    private final Clock clock;
    private final Scheduler scheduler;

    // Caché para evitar recrear instancias
    private final Map<BreakerKey, CircuitBreaker> circuitBreakers = new ConcurrentHashMap<>();
    private final List<StateChangeListener> listeners = new CopyOnWriteArrayList<>();

    public ResilienceManager(CircuitBreakerConfigResolver configResolver,
                             MeterRegistry meterRegistry,
                             Clock clock,
                             @Qualifier("resilienceScheduler") Scheduler scheduler) {
        this.configResolver = configResolver;
        this.meterRegistry = meterRegistry;
        this.clock = clock;
        this.scheduler = scheduler;
    }

    public <T> Mono<CircuitBreakerResult<T>> execute(BreakerKey key, Supplier<Mono<T>> operation) {
        return execute(key, operation, CircuitBreakerOptions.NONE, null, null);
    }

    /**
     * Ejecuta la operación a través del breaker de la clave. Si los breakers están
     * deshabilitados para el servicio, la operación se ejecuta directamente (con timeout)
     * y el resultado informa CLOSED.
     *
     * @param timeout  timeout de esta llamada; nulo usa el del breaker
     * @param fallback sustituto en caso de fallo o rechazo; puede ser nulo
     */
    public <T> Mono<CircuitBreakerResult<T>> execute(BreakerKey key,
                                                     Supplier<Mono<T>> operation,
                                                     CircuitBreakerOptions options,
                                                     Duration timeout,
                                                     Function<Throwable, Mono<T>> fallback) {
        if (!configResolver.isEnabled(key.serviceName())) {
            return passThrough(key, operation, options, timeout);
        }
        return getOrCreate(key, options).execute(operation, timeout, fallback);
    }

    private <T> Mono<CircuitBreakerResult<T>> passThrough(BreakerKey key,
                                                         Supplier<Mono<T>> operation,
                                                         CircuitBreakerOptions options,
                                                         Duration timeout) {
        Duration limit = timeout != null ? timeout : configResolver.resolve(key, options).timeoutDuration();
        return Mono.defer(() -> {
            long start = clock.millis();
            return Mono.defer(operation)
                    .timeout(limit, scheduler)
                    .map(Optional::of)
                    .defaultIfEmpty(Optional.empty())
                    .map(value -> CircuitBreakerResult.success(value.orElse(null),
                            clock.millis() - start, CircuitBreakerState.CLOSED))
                    .onErrorResume(error -> {
                        Throwable cause = error instanceof TimeoutException
                                ? new OperationTimeoutException("Operation " + key + " timed out after "
                                + limit.toMillis() + " ms", limit.toMillis(), error)
                                : error;
                        return Mono.just(CircuitBreakerResult.<T>failure(cause,
                                clock.millis() - start, CircuitBreakerState.CLOSED, false));
                    });
        });
    }

    /**
     * Obtiene el breaker de la clave, creándolo con la configuración fusionada si no existe.
     * Los overrides del llamante sólo se aplican en la creación.
     */
    public CircuitBreaker getOrCreate(BreakerKey key, CircuitBreakerOptions options) {
        return circuitBreakers.computeIfAbsent(key, k -> {
            CircuitBreakerSettings settings = configResolver.resolve(k, options);
            log.info("Created circuit breaker {} (timeout={}ms, errorThreshold={}%, resetTimeout={}ms, volumeThreshold={})",
                    k, settings.getTimeout(), settings.getErrorThresholdPercentage(),
                    settings.getResetTimeout(), settings.getVolumeThreshold());
            return new CircuitBreaker(k, settings, clock, scheduler, meterRegistry, this::dispatchStateChange);
        });
    }

    public Optional<CircuitBreaker> find(BreakerKey key) {
        return Optional.ofNullable(circuitBreakers.get(key));
    }

    public Optional<CircuitBreakerMetrics> getMetrics(BreakerKey key) {
        return find(key).map(CircuitBreaker::getMetrics);
    }

    /**
     * Copia de los breakers actuales ordenada por clave; no bloquea las llamadas en curso.
     */
    public List<CircuitBreaker> getCircuitBreakers() {
        List<CircuitBreaker> snapshot = new ArrayList<>(circuitBreakers.values());
        snapshot.sort(Comparator.comparing(cb -> cb.getKey().toString()));
        return snapshot;
    }

    public Map<String, CircuitBreakerMetrics> getAllMetrics() {
        Map<String, CircuitBreakerMetrics> result = new LinkedHashMap<>();
        getCircuitBreakers().forEach(cb -> result.put(cb.getKey().toString(), cb.getMetrics()));
        return result;
    }

    public boolean reset(BreakerKey key) {
        CircuitBreaker circuitBreaker = circuitBreakers.get(key);
        if (circuitBreaker == null) {
            log.warn("Reset requested for unknown circuit breaker {}", key);
            return false;
        }
        circuitBreaker.reset();
        return true;
    }

    /**
     * Resetea todas las claves del servicio (con y sin operación).
     *
     * @return número de breakers reseteados
     */
    public int resetService(String serviceName) {
        int count = 0;
        for (CircuitBreaker circuitBreaker : getCircuitBreakers()) {
            if (circuitBreaker.getKey().serviceName().equals(serviceName)) {
                circuitBreaker.reset();
                count++;
            }
        }
        log.info("Reset {} circuit breaker(s) for service {}", count, serviceName);
        return count;
    }

    public void addStateChangeListener(StateChangeListener listener) {
        listeners.add(listener);
    }

    public void removeStateChangeListener(StateChangeListener listener) {
        listeners.remove(listener);
    }

    private void dispatchStateChange(StateChangeEvent event) {
        for (StateChangeListener listener : listeners) {
            try {
                listener.onStateChange(event);
            } catch (RuntimeException e) {
                log.error("Listener {} failed handling {} -> {} for {}",
                        listener.getClass().getSimpleName(), event.from(), event.to(), event.key(), e);
            }
        }
    }

    public CircuitBreakerConfigResolver getConfigResolver() {
        return configResolver;
    }

    public Map<String, Object> getDebugInfo() {
        Map<String, Object> breakers = new LinkedHashMap<>();
        for (CircuitBreaker circuitBreaker : getCircuitBreakers()) {
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("settings", circuitBreaker.getSettings());
            entry.put("metrics", circuitBreaker.getMetrics());
            breakers.put(circuitBreaker.getKey().toString(), entry);
        }
        Map<String, Object> info = new LinkedHashMap<>();
        info.put("totalCircuitBreakers", breakers.size());
        info.put("circuitBreakers", breakers);
        info.put("configuration", configResolver.getDebugInfo());
        return info;
    }
}
