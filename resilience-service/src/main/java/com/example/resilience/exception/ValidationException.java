package com.example.resilience.exception;

/**
 * Entrada mal formada o rechazada por validación. Nunca cuenta como fallo del servicio destino.
 */
public class ValidationException extends ApplicationException implements StatusAware {
    public ValidationException(String message) {
        super(message);
    }

    public ValidationException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public int getStatusCode() {
        return 400;
    }
}
