package com.example.resilience.timeout;

/**
 * Clasificación de criticidad de un servicio
 */
public enum ServiceTier {
    CRITICAL,
    STANDARD,
    NON_CRITICAL
}
