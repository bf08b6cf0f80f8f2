package com.example.resilience.exception;

/**
 * Errores que exponen un código de estado equivalente a HTTP.
 * El filtro de errores del circuit breaker lo usa para distinguir errores del llamante.
 */
public interface StatusAware {
    int getStatusCode();
}
