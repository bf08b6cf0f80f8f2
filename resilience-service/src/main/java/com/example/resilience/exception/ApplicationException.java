package com.example.resilience.exception;

/**
 * Excepción base para todas las excepciones de la capa de resiliencia
 */
public class ApplicationException extends RuntimeException {
    public ApplicationException(String message) {
        super(message);
    }

    public ApplicationException(String message, Throwable cause) {
        super(message, cause);
    }
}
