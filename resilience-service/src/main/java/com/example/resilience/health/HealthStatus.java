package com.example.resilience.health;

public enum HealthStatus {
    HEALTHY,
    DEGRADED,
    UNHEALTHY
}
