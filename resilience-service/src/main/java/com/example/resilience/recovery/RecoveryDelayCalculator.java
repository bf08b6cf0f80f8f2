package com.example.resilience.recovery;

/**
 * Retardo antes de cada intento de recuperación. attempt empieza en 0.
 */
public final class RecoveryDelayCalculator {

    private RecoveryDelayCalculator() {
        // Utility class
    }

    public static long delay(RecoveryStrategy strategy, int attempt) {
        int n = Math.max(0, attempt);
        switch (strategy.getType()) {
            case EXPONENTIAL_BACKOFF:
                double exponential = strategy.getBaseDelay() * Math.pow(strategy.getMultiplier(), n);
                return (long) Math.min(exponential, strategy.getMaxDelay());
            case LINEAR_BACKOFF:
                double linear = strategy.getBaseDelay() + (double) strategy.getBaseDelay() * n;
                return (long) Math.min(linear, strategy.getMaxDelay());
            case IMMEDIATE:
                return 0;
            case CUSTOM:
            default:
                return strategy.getBaseDelay();
        }
    }
}
