package com.example.resilience.recovery;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Value;
import reactor.core.publisher.Mono;

import java.util.function.Supplier;

/**
 * Política de reintentos mientras un breaker está abierto. Inmutable una vez resuelta.
 */
@Value
@Builder(toBuilder = true)
public class RecoveryStrategy {
    RecoveryStrategyType type;
    long baseDelay;
    long maxDelay;
    double multiplier;
    int maxAttempts;

    /**
     * Sólo para CUSTOM: true si el servicio se considera recuperado
     */
    @JsonIgnore
    Supplier<Mono<Boolean>> customRecovery;
}
