package com.example.resilience.timeout;

/**
 * Origen del valor de timeout resuelto, de mayor a menor precedencia
 */
public enum TimeoutSource {
    CALLER_OVERRIDE,
    OPERATION_OVERRIDE,
    SERVICE_OVERRIDE,
    TIER_DEFAULT,
    GLOBAL_DEFAULT
}
