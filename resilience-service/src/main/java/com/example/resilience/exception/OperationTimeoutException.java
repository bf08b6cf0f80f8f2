package com.example.resilience.exception;

/**
 * La llamada protegida superó el timeout resuelto para la clave
 */
public class OperationTimeoutException extends ApplicationException {
    private final long timeoutMillis;

    public OperationTimeoutException(String message, long timeoutMillis) {
        super(message);
        this.timeoutMillis = timeoutMillis;
    }

    public OperationTimeoutException(String message, long timeoutMillis, Throwable cause) {
        super(message, cause);
        this.timeoutMillis = timeoutMillis;
    }

    public long getTimeoutMillis() {
        return timeoutMillis;
    }
}
