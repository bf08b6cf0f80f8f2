package com.example.resilience.monitoring;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Map;

@Value
@Builder
public class CircuitBreakerAlert {
    String id;
    AlertType type;
    AlertSeverity severity;
    /**
     * Clave del breaker ("auth-service" o "auth-service:health-check")
     */
    String service;
    String message;
    Map<String, Object> metadata;
    Instant timestamp;

    /**
     * true si la alerta pertenece al servicio indicado, con o sin operación.
     */
    public boolean concerns(String serviceOrKey) {
        return service.equals(serviceOrKey) || service.startsWith(serviceOrKey + ":");
    }
}
