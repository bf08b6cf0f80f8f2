package com.example.resilience.monitoring;

import org.springframework.context.ApplicationEvent;

/**
 * Evento de aplicación publicado con cada alerta registrada.
 */
public class CircuitBreakerAlertEvent extends ApplicationEvent {

    private final CircuitBreakerAlert alert;

    public CircuitBreakerAlertEvent(Object source, CircuitBreakerAlert alert) {
        super(source);
        this.alert = alert;
    }

    public CircuitBreakerAlert getAlert() {
        return alert;
    }
}
