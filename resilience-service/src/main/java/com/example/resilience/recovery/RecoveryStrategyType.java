package com.example.resilience.recovery;

public enum RecoveryStrategyType {
    IMMEDIATE,
    LINEAR_BACKOFF,
    EXPONENTIAL_BACKOFF,
    CUSTOM
}
