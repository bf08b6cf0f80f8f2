package com.example.resilience.messaging;

import reactor.core.publisher.Mono;

import java.time.Duration;

/**
 * Cliente del broker de mensajes. La capa de resiliencia lo trata como una operación
 * asíncrona opaca: sólo mide sus fallos y latencias.
 */
public interface MessageTransport {

    /**
     * Petición/respuesta (RPC sobre el broker).
     */
    <T> Mono<T> send(String exchange, String routingKey, Object payload, Duration timeout, Class<T> responseType);

    /**
     * Publicación sin respuesta.
     */
    Mono<Void> publish(String exchange, String routingKey, Object payload);
}
