package com.example.resilience.utils;

import java.util.Locale;

/**
 * Convenciones de nombres de servicio: las routing keys empiezan por el dominio
 * ("auth.register") y los servicios se nombran "auth-service".
 */
public final class ServiceNames {

    public static final String UNKNOWN_SERVICE = "unknown-service";
    private static final String SUFFIX = "-service";

    private ServiceNames() {
        // Utility class
    }

    /**
     * Deriva el servicio destino a partir del primer segmento de la routing key.
     */
    public static String fromRoutingKey(String routingKey) {
        if (routingKey == null || routingKey.isBlank()) {
            return UNKNOWN_SERVICE;
        }
        String domain = routingKey.trim().split("\\.")[0];
        if (domain.isEmpty()) {
            return UNKNOWN_SERVICE;
        }
        return normalize(domain);
    }

    /**
     * "billing" → "billing-service", "auth.register" → "auth-service", "Deploy-Service" → "deploy-service"
     */
    public static String normalize(String serviceName) {
        if (serviceName == null || serviceName.isBlank()) {
            return UNKNOWN_SERVICE;
        }
        String name = serviceName.trim().toLowerCase(Locale.ROOT);
        if (name.contains(".")) {
            return fromRoutingKey(name);
        }
        return name.endsWith(SUFFIX) ? name : name + SUFFIX;
    }

    /**
     * "billing-service" → "Billing"
     */
    public static String displayName(String serviceName) {
        String base = normalize(serviceName);
        base = base.substring(0, base.length() - SUFFIX.length());
        if (base.isEmpty()) {
            return serviceName;
        }
        return Character.toUpperCase(base.charAt(0)) + base.substring(1);
    }
}
