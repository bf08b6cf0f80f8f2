package com.example.resilience.exception;

/**
 * Petición no autenticada (401) o no autorizada (403)
 */
public class AuthorizationException extends ApplicationException implements StatusAware {
    private final int statusCode;

    public AuthorizationException(String message, int statusCode) {
        super(message);
        if (statusCode != 401 && statusCode != 403) {
            throw new IllegalArgumentException("Authorization status must be 401 or 403, got " + statusCode);
        }
        this.statusCode = statusCode;
    }

    public static AuthorizationException unauthorized(String message) {
        return new AuthorizationException(message, 401);
    }

    public static AuthorizationException forbidden(String message) {
        return new AuthorizationException(message, 403);
    }

    @Override
    public int getStatusCode() {
        return statusCode;
    }
}
