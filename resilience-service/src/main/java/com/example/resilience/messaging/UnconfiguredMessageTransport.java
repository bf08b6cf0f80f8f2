package com.example.resilience.messaging;

import com.example.resilience.exception.TransportException;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

import java.time.Duration;

/**
 * Transporte usado cuando la aplicación no registra ninguno: todas las llamadas fallan.
 */
@Slf4j
public class UnconfiguredMessageTransport implements MessageTransport {

    public UnconfiguredMessageTransport() {
        log.warn("No MessageTransport bean configured; every dispatch will fail with TransportException");
    }

    @Override
    public <T> Mono<T> send(String exchange, String routingKey, Object payload, Duration timeout, Class<T> responseType) {
        return Mono.error(new TransportException(
                "No message transport configured (exchange=" + exchange + ", routingKey=" + routingKey + ")"));
    }

    @Override
    public Mono<Void> publish(String exchange, String routingKey, Object payload) {
        return Mono.error(new TransportException(
                "No message transport configured (exchange=" + exchange + ", routingKey=" + routingKey + ")"));
    }
}
