package com.example.resilience.exception;

/**
 * Condición única de "servicio temporalmente no disponible" visible para el llamante.
 * Se distingue de los errores de negocio por tipo, no por mensaje.
 */
public class ServiceUnavailableException extends ApplicationException {
    private final String serviceName;

    public ServiceUnavailableException(String serviceName, String message) {
        super(message);
        this.serviceName = serviceName;
    }

    public ServiceUnavailableException(String serviceName, String message, Throwable cause) {
        super(message, cause);
        this.serviceName = serviceName;
    }

    public String getServiceName() {
        return serviceName;
    }
}
