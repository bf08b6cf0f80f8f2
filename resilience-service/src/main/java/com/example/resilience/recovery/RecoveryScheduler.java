package com.example.resilience.recovery;

import com.example.resilience.circuitbreaker.BreakerKey;
import com.example.resilience.circuitbreaker.CircuitBreaker;
import com.example.resilience.circuitbreaker.CircuitBreakerState;
import com.example.resilience.circuitbreaker.ResilienceManager;
import com.example.resilience.circuitbreaker.StateChangeEvent;
import com.example.resilience.circuitbreaker.StateChangeListener;
import com.example.resilience.utils.ServiceNames;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import reactor.core.Disposable;
import reactor.core.Disposables;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * Programa intentos de recuperación mientras un breaker permanece abierto, según la
 * {@link RecoveryStrategy} de su servicio.
 *
 * <p>Los timers se guardan por "clave-intento": una secuencia ya en marcha para la misma
 * clave no se duplica aunque el breaker vuelva a abrirse. Al cerrarse el breaker se
 * cancelan todos sus timers y se reinicia el contador de intentos.</p>
 */
@Slf4j
@Component
public class RecoveryScheduler implements StateChangeListener {

    private final ResilienceManager resilienceManager;
    private final Scheduler scheduler;

    private final Map<String, Disposable> timers = new ConcurrentHashMap<>();
    private final Map<BreakerKey, AtomicInteger> attempts = new ConcurrentHashMap<>();
    private final Map<String, Supplier<Mono<Boolean>>> customRecoveries = new ConcurrentHashMap<>();

    public RecoveryScheduler(ResilienceManager resilienceManager,
                             @Qualifier("resilienceScheduler") Scheduler scheduler) {
        this.resilienceManager = resilienceManager;
        this.scheduler = scheduler;
    }

    @PostConstruct
    public void init() {
        resilienceManager.addStateChangeListener(this);
    }

    @PreDestroy
    public void shutdown() {
        resilienceManager.removeStateChangeListener(this);
        timers.values().forEach(Disposable::dispose);
        timers.clear();
        attempts.clear();
    }

    /**
     * Registra la comprobación usada por la estrategia CUSTOM del servicio.
     */
    public void registerCustomRecovery(String serviceName, Supplier<Mono<Boolean>> customRecovery) {
        customRecoveries.put(ServiceNames.normalize(serviceName), customRecovery);
    }

    @Override
    public void onStateChange(StateChangeEvent event) {
        if (event.to() == CircuitBreakerState.OPEN) {
            scheduleRecovery(event.key());
        } else if (event.to() == CircuitBreakerState.CLOSED) {
            cancelRecovery(event.key());
        }
    }

    public RecoveryStrategy strategyFor(String serviceName) {
        RecoveryStrategy strategy = resilienceManager.getConfigResolver().recoveryStrategy(serviceName);
        Supplier<Mono<Boolean>> custom = customRecoveries.get(ServiceNames.normalize(serviceName));
        if (custom != null && strategy.getType() == RecoveryStrategyType.CUSTOM) {
            return strategy.toBuilder().customRecovery(custom).build();
        }
        return strategy;
    }

    void scheduleRecovery(BreakerKey key) {
        RecoveryStrategy strategy = strategyFor(key.serviceName());
        if (strategy.getType() == RecoveryStrategyType.IMMEDIATE) {
            log.debug("Immediate recovery for {}, relying on half-open probing", key);
            return;
        }

        int attempt = attempts.computeIfAbsent(key, k -> new AtomicInteger()).get();
        if (attempt >= strategy.getMaxAttempts()) {
            log.warn("Max recovery attempts ({}) reached for {}", strategy.getMaxAttempts(), key);
            return;
        }

        String timerKey = timerKey(key, attempt);
        Disposable.Swap handle = Disposables.swap();
        if (timers.putIfAbsent(timerKey, handle) != null) {
            log.debug("Recovery attempt {} already scheduled for {}", attempt, key);
            return;
        }

        long delay = RecoveryDelayCalculator.delay(strategy, attempt);
        log.info("Scheduling recovery attempt {}/{} for {} in {} ms ({})",
                attempt + 1, strategy.getMaxAttempts(), key, delay, strategy.getType());
        handle.update(Mono.delay(Duration.ofMillis(delay), scheduler)
                .flatMap(tick -> attemptRecovery(key, strategy, timerKey))
                .subscribe(
                        recovered -> log.debug("Recovery attempt for {} finished (recovered={})", key, recovered),
                        error -> log.error("Recovery attempt for {} failed unexpectedly", key, error)));
    }

    private Mono<Boolean> attemptRecovery(BreakerKey key, RecoveryStrategy strategy, String timerKey) {
        Optional<CircuitBreaker> circuitBreaker = resilienceManager.find(key);
        if (circuitBreaker.isEmpty() || circuitBreaker.get().getState() == CircuitBreakerState.CLOSED) {
            timers.remove(timerKey);
            attempts.remove(key);
            return Mono.just(true);
        }
        // el contador avanza antes de liberar el timer: un OPEN concurrente programa ya el siguiente intento
        int attempt = attempts.computeIfAbsent(key, k -> new AtomicInteger()).incrementAndGet();
        timers.remove(timerKey);

        Mono<Boolean> probe = Mono.just(false);
        if (strategy.getType() == RecoveryStrategyType.CUSTOM && strategy.getCustomRecovery() != null) {
            probe = Mono.defer(strategy.getCustomRecovery())
                    .defaultIfEmpty(false)
                    .onErrorResume(error -> {
                        log.warn("Custom recovery for {} failed on attempt {}: {}", key, attempt, error.getMessage());
                        return Mono.just(false);
                    });
        }

        return probe.map(recovered -> {
            if (Boolean.TRUE.equals(recovered)) {
                log.info("Custom recovery succeeded for {} on attempt {}, resetting circuit breaker", key, attempt);
                resilienceManager.reset(key);
                return true;
            }
            if (circuitBreaker.get().getState() == CircuitBreakerState.OPEN) {
                scheduleRecovery(key);
            }
            return false;
        });
    }

    /**
     * Cancela todos los timers pendientes de la clave.
     */
    public void cancelRecovery(BreakerKey key) {
        String prefix = key + "-";
        timers.entrySet().removeIf(entry -> {
            String timerKey = entry.getKey();
            if (timerKey.startsWith(prefix)
                    && timerKey.substring(prefix.length()).chars().allMatch(Character::isDigit)) {
                entry.getValue().dispose();
                return true;
            }
            return false;
        });
        attempts.remove(key);
    }

    public int pendingTimers() {
        return timers.size();
    }

    public int attemptsFor(BreakerKey key) {
        AtomicInteger counter = attempts.get(key);
        return counter == null ? 0 : counter.get();
    }

    private static String timerKey(BreakerKey key, int attempt) {
        return key + "-" + attempt;
    }
}
