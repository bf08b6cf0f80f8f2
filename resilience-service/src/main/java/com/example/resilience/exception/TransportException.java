package com.example.resilience.exception;

/**
 * Fallo del transporte de mensajes (broker caído, canal cerrado, etc.)
 */
public class TransportException extends ApplicationException {
    public TransportException(String message) {
        super(message);
    }

    public TransportException(String message, Throwable cause) {
        super(message, cause);
    }
}
