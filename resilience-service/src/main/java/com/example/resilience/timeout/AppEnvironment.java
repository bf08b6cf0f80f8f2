package com.example.resilience.timeout;

import java.util.Locale;

public enum AppEnvironment {
    TEST,
    LOCAL,
    DEVELOPMENT,
    STAGING,
    PRODUCTION,
    CANARY;

    /**
     * Interpreta el nombre de entorno con sus alias habituales. Desconocido o vacío → DEVELOPMENT.
     */
    public static AppEnvironment parse(String environment) {
        if (environment == null || environment.isBlank()) {
            return DEVELOPMENT;
        }
        switch (environment.trim().toLowerCase(Locale.ROOT)) {
            case "test":
                return TEST;
            case "local":
                return LOCAL;
            case "staging":
            case "stage":
                return STAGING;
            case "production":
            case "prod":
                return PRODUCTION;
            case "canary":
                return CANARY;
            case "development":
            case "dev":
            default:
                return DEVELOPMENT;
        }
    }
}
