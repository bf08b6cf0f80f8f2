package com.example.resilience.monitoring;

public enum AlertType {
    STATE_CHANGE,
    HIGH_ERROR_RATE,
    HIGH_RESPONSE_TIME,
    RECOVERY
}
