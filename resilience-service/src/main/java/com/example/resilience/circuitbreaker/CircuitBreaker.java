package com.example.resilience.circuitbreaker;

import com.example.resilience.exception.CircuitBreakerOpenException;
import com.example.resilience.exception.OperationTimeoutException;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Máquina de estados CLOSED / OPEN / HALF_OPEN para una {@link BreakerKey}.
 *
 * <p>Todas las lecturas y escrituras de estado y contadores pasan por un único lock por
 * breaker; la operación protegida se ejecuta fuera del lock. Cada llamada admitida
 * recibe un ticket con la generación vigente: si entre la admisión y el resultado hubo
 * un reset manual, el resultado se descarta sin tocar los contadores.</p>
 *
 * <p>Una llamada que supera el timeout se cancela aguas arriba y cuenta como fallo; su
 * resultado tardío nunca llega al breaker.</p>
 */
@Slf4j
public class CircuitBreaker {

    private static final Map<CircuitBreakerState, Set<CircuitBreakerState>> TRANSITIONS = initializeTransitions();

    private final BreakerKey key;
    private final CircuitBreakerSettings settings;
    private final Clock clock;
    private final Scheduler timeoutScheduler;
    private final MeterRegistry meterRegistry;
    private final StateChangeListener listener;
    private final ReentrantLock lock = new ReentrantLock();
    private final RollingWindow window;

    private volatile CircuitBreakerState state = CircuitBreakerState.CLOSED;
    private Instant lastStateChange;
    private long openedAt;
    private boolean trialInFlight;
    private long generation;

    private long requestCount;
    private long successCount;
    private long failureCount;
    private long rejectionCount;
    private long ignoredCount;
    private long timedAttempts;
    private double averageResponseTime;
    private String lastError;

    public CircuitBreaker(BreakerKey key,
                          CircuitBreakerSettings settings,
                          Clock clock,
                          Scheduler timeoutScheduler,
                          MeterRegistry meterRegistry,
                          StateChangeListener listener) {
        this.key = key;
        this.settings = settings;
        this.clock = clock;
        this.timeoutScheduler = timeoutScheduler;
        this.meterRegistry = meterRegistry;
        this.listener = listener;
        this.window = new RollingWindow(settings.getRollingCountTimeout(), settings.getRollingCountBuckets());
        this.lastStateChange = clock.instant();

        Gauge.builder("circuit_breaker.state", this, cb -> cb.state.ordinal())
                .description("Estado del circuit breaker (0=CLOSED, 1=OPEN, 2=HALF_OPEN)")
                .tag("service", key.serviceName())
                .tag("operation", operationTag())
                .register(meterRegistry);
    }

    private static Map<CircuitBreakerState, Set<CircuitBreakerState>> initializeTransitions() {
        Map<CircuitBreakerState, Set<CircuitBreakerState>> map = new EnumMap<>(CircuitBreakerState.class);
        map.put(CircuitBreakerState.CLOSED, EnumSet.of(CircuitBreakerState.OPEN));
        map.put(CircuitBreakerState.OPEN, EnumSet.of(CircuitBreakerState.HALF_OPEN, CircuitBreakerState.CLOSED));
        map.put(CircuitBreakerState.HALF_OPEN, EnumSet.of(CircuitBreakerState.CLOSED, CircuitBreakerState.OPEN));
        return map;
    }

    public static boolean isValidTransition(CircuitBreakerState from, CircuitBreakerState to) {
        return TRANSITIONS.getOrDefault(from, EnumSet.noneOf(CircuitBreakerState.class)).contains(to);
    }

    public <T> Mono<CircuitBreakerResult<T>> execute(Supplier<Mono<T>> operation) {
        return execute(operation, settings.timeoutDuration(), null);
    }

    /**
     * Ejecuta la operación si el breaker la admite.
     *
     * @param operation operación asíncrona a proteger
     * @param timeout   límite de la llamada; nulo usa el configurado
     * @param fallback  sustituto para fallos contados y rechazos; puede ser nulo
     * @return resultado enriquecido; nunca termina en error
     */
    public <T> Mono<CircuitBreakerResult<T>> execute(Supplier<Mono<T>> operation,
                                                     Duration timeout,
                                                     Function<Throwable, Mono<T>> fallback) {
        Duration limit = timeout != null ? timeout : settings.timeoutDuration();
        return Mono.defer(() -> {
            Ticket ticket = admit();
            if (!ticket.permitted()) {
                return onRejected(ticket, fallback);
            }

            long start = clock.millis();
            return Mono.defer(operation)
                    .timeout(limit, timeoutScheduler)
                    .map(Optional::of)
                    .defaultIfEmpty(Optional.empty())
                    .map(value -> onSuccess(ticket, value.orElse(null), start))
                    .onErrorResume(error -> onFailure(ticket, translate(error, limit), start, fallback))
                    .doOnCancel(() -> onCancel(ticket));
        });
    }

    private Ticket admit() {
        lock.lock();
        try {
            requestCount++;
            long now = clock.millis();
            switch (state) {
                case CLOSED:
                    return new Ticket(true, false, generation, 0);
                case OPEN:
                    long elapsed = now - openedAt;
                    if (elapsed >= settings.getResetTimeout()) {
                        transitionTo(CircuitBreakerState.HALF_OPEN, false);
                        trialInFlight = true;
                        return new Ticket(true, true, generation, 0);
                    }
                    rejectionCount++;
                    return new Ticket(false, false, generation, settings.getResetTimeout() - elapsed);
                case HALF_OPEN:
                default:
                    if (!trialInFlight) {
                        trialInFlight = true;
                        return new Ticket(true, true, generation, 0);
                    }
                    rejectionCount++;
                    return new Ticket(false, false, generation, 0);
            }
        } finally {
            lock.unlock();
        }
    }

    private <T> Mono<CircuitBreakerResult<T>> onRejected(Ticket ticket, Function<Throwable, Mono<T>> fallback) {
        countCall("rejected");
        CircuitBreakerOpenException rejection = new CircuitBreakerOpenException(key, ticket.timeToReset());
        log.debug("Circuit breaker {} rejected call ({} ms to reset)", key, ticket.timeToReset());
        if (fallback == null) {
            return Mono.just(CircuitBreakerResult.failure(rejection, 0, state, true));
        }
        return applyFallback(fallback, rejection, 0, true);
    }

    private <T> CircuitBreakerResult<T> onSuccess(Ticket ticket, T data, long start) {
        long now = clock.millis();
        long elapsed = Math.max(0, now - start);
        CircuitBreakerState current;
        lock.lock();
        try {
            if (ticket.generation() != generation) {
                log.debug("Discarding outcome for {} admitted before reset", key);
                return CircuitBreakerResult.success(data, elapsed, state);
            }
            successCount++;
            recordResponseTime(elapsed);
            window.recordSuccess(now);
            if (ticket.trial()) {
                trialInFlight = false;
                if (state == CircuitBreakerState.HALF_OPEN) {
                    transitionTo(CircuitBreakerState.CLOSED, false);
                }
            } else {
                checkThresholds(now);
            }
            current = state;
        } finally {
            lock.unlock();
        }
        countCall("success");
        return CircuitBreakerResult.success(data, elapsed, current);
    }

    private <T> Mono<CircuitBreakerResult<T>> onFailure(Ticket ticket, Throwable error, long start,
                                                        Function<Throwable, Mono<T>> fallback) {
        long now = clock.millis();
        long elapsed = Math.max(0, now - start);
        boolean counted = countsAsFailure(error);
        CircuitBreakerState current;
        lock.lock();
        try {
            if (ticket.generation() == generation) {
                recordResponseTime(elapsed);
                if (counted) {
                    failureCount++;
                    lastError = describe(error);
                    window.recordFailure(now);
                } else {
                    ignoredCount++;
                }
                if (ticket.trial()) {
                    trialInFlight = false;
                    if (state == CircuitBreakerState.HALF_OPEN) {
                        transitionTo(counted ? CircuitBreakerState.OPEN : CircuitBreakerState.CLOSED, false);
                    }
                } else if (counted) {
                    checkThresholds(now);
                }
            } else {
                log.debug("Discarding failure for {} admitted before reset", key);
            }
            current = state;
        } finally {
            lock.unlock();
        }

        if (!counted) {
            countCall("ignored");
            return Mono.just(CircuitBreakerResult.callerError(error, elapsed, current));
        }
        countCall(error instanceof OperationTimeoutException ? "timeout" : "failure");
        if (fallback == null) {
            return Mono.just(CircuitBreakerResult.failure(error, elapsed, current, false));
        }
        return applyFallback(fallback, error, elapsed, false);
    }

    private void onCancel(Ticket ticket) {
        if (!ticket.trial()) {
            return;
        }
        lock.lock();
        try {
            if (ticket.generation() == generation && state == CircuitBreakerState.HALF_OPEN) {
                trialInFlight = false;
            }
        } finally {
            lock.unlock();
        }
    }

    private <T> Mono<CircuitBreakerResult<T>> applyFallback(Function<Throwable, Mono<T>> fallback,
                                                            Throwable cause, long elapsed, boolean rejected) {
        return Mono.defer(() -> fallback.apply(cause))
                .map(Optional::of)
                .defaultIfEmpty(Optional.empty())
                .map(value -> {
                    countCall("fallback");
                    return CircuitBreakerResult.fallback(value.orElse(null), elapsed, state, rejected, cause);
                })
                .onErrorResume(fallbackError -> {
                    log.warn("Fallback for {} failed: {}", key, fallbackError.getMessage());
                    return Mono.just(CircuitBreakerResult.<T>fallbackFailed(fallbackError, elapsed, state, rejected));
                });
    }

    private void checkThresholds(long now) {
        if (state != CircuitBreakerState.CLOSED) {
            return;
        }
        RollingWindow.Counts counts = window.counts(now);
        if (counts.total() >= settings.getVolumeThreshold()
                && counts.errorPercentage() >= settings.getErrorThresholdPercentage()) {
            log.warn("Circuit breaker {} tripping: {} calls in window, {}% errors (threshold {}%)",
                    key, counts.total(), String.format("%.1f", counts.errorPercentage()),
                    settings.getErrorThresholdPercentage());
            transitionTo(CircuitBreakerState.OPEN, false);
        }
    }

    /**
     * Fuerza CLOSED y pone a cero contadores y ventana. Las llamadas en curso no afectarán al nuevo estado.
     */
    public void reset() {
        lock.lock();
        try {
            generation++;
            CircuitBreakerState from = state;
            if (from != CircuitBreakerState.CLOSED) {
                transitionTo(CircuitBreakerState.CLOSED, true);
            } else {
                clearCounters();
            }
            log.info("Circuit breaker {} manually reset (was {})", key, from);
        } finally {
            lock.unlock();
        }
    }

    // Debe llamarse con el lock adquirido
    private void transitionTo(CircuitBreakerState to, boolean manual) {
        CircuitBreakerState from = state;
        if (from == to) {
            return;
        }
        if (!isValidTransition(from, to)) {
            throw new IllegalStateException("Invalid circuit breaker transition " + from + " -> " + to + " for " + key);
        }
        Instant now = clock.instant();
        state = to;
        lastStateChange = now;
        trialInFlight = false;
        if (to == CircuitBreakerState.OPEN) {
            openedAt = now.toEpochMilli();
            log.warn("Circuit breaker {} OPEN (from {}), next trial in {} ms", key, from, settings.getResetTimeout());
        } else if (to == CircuitBreakerState.HALF_OPEN) {
            log.info("Circuit breaker {} HALF_OPEN, admitting one trial call", key);
        } else {
            clearCounters();
            log.info("Circuit breaker {} CLOSED (from {})", key, from);
        }

        Counter.builder("circuit_breaker.transitions")
                .tag("service", key.serviceName())
                .tag("operation", operationTag())
                .tag("from", from.name())
                .tag("to", to.name())
                .register(meterRegistry)
                .increment();

        if (listener != null) {
            try {
                listener.onStateChange(new StateChangeEvent(key, from, to, now, manual));
            } catch (RuntimeException e) {
                log.error("State change listener failed for {} ({} -> {})", key, from, to, e);
            }
        }
    }

    private void clearCounters() {
        requestCount = 0;
        successCount = 0;
        failureCount = 0;
        rejectionCount = 0;
        ignoredCount = 0;
        timedAttempts = 0;
        averageResponseTime = 0;
        lastError = null;
        window.clear();
    }

    private void recordResponseTime(long elapsed) {
        timedAttempts++;
        averageResponseTime = (averageResponseTime * (timedAttempts - 1) + elapsed) / timedAttempts;
    }

    private boolean countsAsFailure(Throwable error) {
        try {
            return settings.getErrorFilter() == null || settings.getErrorFilter().test(error);
        } catch (RuntimeException e) {
            log.warn("Error filter for {} threw, counting error as failure: {}", key, e.getMessage());
            return true;
        }
    }

    private Throwable translate(Throwable error, Duration limit) {
        if (error instanceof TimeoutException) {
            return new OperationTimeoutException(
                    String.format("Operation %s timed out after %d ms", key, limit.toMillis()), limit.toMillis(), error);
        }
        return error;
    }

    private static String describe(Throwable error) {
        return error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
    }

    private void countCall(String outcome) {
        meterRegistry.counter("circuit_breaker.calls",
                        "service", key.serviceName(),
                        "operation", operationTag(),
                        "outcome", outcome)
                .increment();
    }

    private String operationTag() {
        return key.hasOperation() ? key.operation() : "all";
    }

    public CircuitBreakerMetrics getMetrics() {
        lock.lock();
        try {
            Long timeToReset = null;
            if (state == CircuitBreakerState.OPEN) {
                timeToReset = Math.max(0, settings.getResetTimeout() - (clock.millis() - openedAt));
            }
            return CircuitBreakerMetrics.builder()
                    .state(state)
                    .requestCount(requestCount)
                    .successCount(successCount)
                    .failureCount(failureCount)
                    .rejectionCount(rejectionCount)
                    .ignoredCount(ignoredCount)
                    .errorPercentage(CircuitBreakerMetrics.errorPercentage(successCount, failureCount))
                    .averageResponseTime(averageResponseTime)
                    .lastStateChange(lastStateChange)
                    .lastError(lastError)
                    .timeToReset(timeToReset)
                    .build();
        } finally {
            lock.unlock();
        }
    }

    public CircuitBreakerState getState() {
        return state;
    }

    public BreakerKey getKey() {
        return key;
    }

    public CircuitBreakerSettings getSettings() {
        return settings;
    }

    private record Ticket(boolean permitted, boolean trial, long generation, long timeToReset) {
    }
}
