package com.example.resilience.timeout;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * Tipos de operación con timeout propio.
 * El valor coincide con la clave usada en los overrides de circuit breaker por operación.
 */
public enum TimeoutOperation {
    RPC_CALL("rpc-call"),
    HEALTH_CHECK("health-check"),
    DATABASE_QUERY("database-query"),
    HTTP_REQUEST("http-request"),
    EVENT_PUBLISH("event-publish");

    private final String value;

    TimeoutOperation(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    /**
     * Acepta tanto "health-check" como "health_check" o "HEALTH_CHECK".
     */
    public static Optional<TimeoutOperation> fromValue(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT).replace('_', '-');
        return Arrays.stream(values())
                .filter(op -> op.value.equals(normalized))
                .findFirst();
    }
}
