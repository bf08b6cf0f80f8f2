package com.example.resilience.circuitbreaker;

/**
 * Observador de transiciones de estado.
 * Se invoca bajo el lock del breaker, de modo que las notificaciones de una misma clave
 * llegan en el orden en que se aplicaron. Las implementaciones no deben bloquear.
 */
@FunctionalInterface
public interface StateChangeListener {
    void onStateChange(StateChangeEvent event);
}
