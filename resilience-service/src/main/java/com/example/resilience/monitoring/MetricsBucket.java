package com.example.resilience.monitoring;

import com.example.resilience.circuitbreaker.CircuitBreakerMetrics;
import lombok.Value;

import java.time.Instant;

/**
 * Métricas promediadas de un breaker dentro de [bucketStart, bucketEnd).
 */
@Value
public class MetricsBucket {
    Instant bucketStart;
    Instant bucketEnd;
    int samples;
    CircuitBreakerMetrics metrics;
}
