package com.example.resilience.circuitbreaker;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Foto de los contadores de un breaker. Los contadores se acumulan desde la creación,
 * el último cierre o el último reset manual.
 */
@Value
@Builder
public class CircuitBreakerMetrics {
    CircuitBreakerState state;
    long requestCount;
    long successCount;
    long failureCount;
    long rejectionCount;
    long ignoredCount;
    double errorPercentage;
    double averageResponseTime;
    Instant lastStateChange;
    String lastError;
    /**
     * Sólo presente en OPEN
     */
    Long timeToReset;

    public static double errorPercentage(long successCount, long failureCount) {
        long total = successCount + failureCount;
        if (total <= 0) {
            return 0.0;
        }
        double pct = (double) failureCount / total * 100.0;
        return Math.max(0.0, Math.min(100.0, pct));
    }
}
