package com.example.resilience.circuitbreaker;

import lombok.Getter;

/**
 * Resultado de una ejecución protegida. Nunca representa un error como señal reactiva:
 * el llamante decide qué hacer con {@link #getCause()}.
 */
@Getter
public class CircuitBreakerResult<T> {
    private final T data;
    private final boolean success;
    private final long executionTime;
    private final CircuitBreakerState circuitState;
    private final boolean fromFallback;
    private final boolean rejected;
    private final boolean callerError;
    private final boolean fallbackFailed;
    private final Throwable cause;

    private CircuitBreakerResult(T data, boolean success, long executionTime, CircuitBreakerState circuitState,
                                 boolean fromFallback, boolean rejected, boolean callerError,
                                 boolean fallbackFailed, Throwable cause) {
        this.data = data;
        this.success = success;
        this.executionTime = executionTime;
        this.circuitState = circuitState;
        this.fromFallback = fromFallback;
        this.rejected = rejected;
        this.callerError = callerError;
        this.fallbackFailed = fallbackFailed;
        this.cause = cause;
    }

    public static <T> CircuitBreakerResult<T> success(T data, long executionTime, CircuitBreakerState state) {
        return new CircuitBreakerResult<>(data, true, executionTime, state, false, false, false, false, null);
    }

    public static <T> CircuitBreakerResult<T> fallback(T data, long executionTime, CircuitBreakerState state,
                                                       boolean rejected, Throwable cause) {
        return new CircuitBreakerResult<>(data, true, executionTime, state, true, rejected, false, false, cause);
    }

    public static <T> CircuitBreakerResult<T> failure(Throwable cause, long executionTime, CircuitBreakerState state,
                                                      boolean rejected) {
        return new CircuitBreakerResult<>(null, false, executionTime, state, false, rejected, false, false, cause);
    }

    public static <T> CircuitBreakerResult<T> callerError(Throwable cause, long executionTime, CircuitBreakerState state) {
        return new CircuitBreakerResult<>(null, false, executionTime, state, false, false, true, false, cause);
    }

    public static <T> CircuitBreakerResult<T> fallbackFailed(Throwable fallbackError, long executionTime,
                                                             CircuitBreakerState state, boolean rejected) {
        return new CircuitBreakerResult<>(null, false, executionTime, state, true, rejected, false, true, fallbackError);
    }

    public String getError() {
        return cause == null ? null : cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
    }
}
