package com.example.resilience.health;

import com.example.resilience.circuitbreaker.BreakerKey;
import com.example.resilience.circuitbreaker.CircuitBreaker;
import com.example.resilience.circuitbreaker.CircuitBreakerState;
import com.example.resilience.circuitbreaker.ResilienceManager;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * Deriva la salud de cada breaker y del sistema, y genera recomendaciones accionables.
 * Sólo lee el estado de los breakers, salvo {@link #resetServiceCircuitBreakers(String)}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CircuitBreakerHealthService {

    static final double HIGH_LATENCY_MS = 5000;

    private final ResilienceManager resilienceManager;
    private final Clock clock;

    public Map<String, CircuitBreakerHealth> getAllHealth() {
        Instant now = clock.instant();
        double threshold = alertThreshold();
        Map<String, CircuitBreakerHealth> result = new LinkedHashMap<>();
        for (CircuitBreaker circuitBreaker : resilienceManager.getCircuitBreakers()) {
            result.put(circuitBreaker.getKey().toString(),
                    CircuitBreakerHealth.of(circuitBreaker.getKey(), circuitBreaker.getMetrics(), threshold, now));
        }
        return result;
    }

    public AggregatedHealth getAggregatedHealth() {
        Map<String, CircuitBreakerHealth> all = getAllHealth();
        int healthy = 0;
        int degraded = 0;
        int unhealthy = 0;
        for (CircuitBreakerHealth health : all.values()) {
            switch (health.getStatus()) {
                case HEALTHY:
                    healthy++;
                    break;
                case DEGRADED:
                    degraded++;
                    break;
                default:
                    unhealthy++;
            }
        }
        HealthStatus overall = unhealthy > 0 ? HealthStatus.UNHEALTHY
                : degraded > 0 ? HealthStatus.DEGRADED
                : HealthStatus.HEALTHY;
        return AggregatedHealth.builder()
                .up(unhealthy == 0)
                .status(overall)
                .summary(new AggregatedHealth.Summary(all.size(), healthy, degraded, unhealthy))
                .services(all)
                .timestamp(clock.instant())
                .build();
    }

    public Optional<CircuitBreakerHealth> getServiceHealth(String serviceName, String operation) {
        BreakerKey key = BreakerKey.of(serviceName, operation);
        return resilienceManager.getMetrics(key)
                .map(metrics -> CircuitBreakerHealth.of(key, metrics, alertThreshold(), clock.instant()));
    }

    /**
     * Un servicio sin breaker todavía (nunca llamado) no se considera sano.
     */
    public boolean isServiceHealthy(String serviceName, String operation) {
        return getServiceHealth(serviceName, operation)
                .map(health -> health.getStatus() == HealthStatus.HEALTHY)
                .orElse(false);
    }

    public Map<String, CircuitBreakerHealth> getOpenCircuitBreakers() {
        return filter(health -> health.getState() == CircuitBreakerState.OPEN);
    }

    public Map<String, CircuitBreakerHealth> getDegradedCircuitBreakers() {
        return filter(health -> health.getStatus() == HealthStatus.DEGRADED);
    }

    private Map<String, CircuitBreakerHealth> filter(Predicate<CircuitBreakerHealth> predicate) {
        Map<String, CircuitBreakerHealth> result = new LinkedHashMap<>();
        getAllHealth().forEach((key, health) -> {
            if (predicate.test(health)) {
                result.put(key, health);
            }
        });
        return result;
    }

    public int resetServiceCircuitBreakers(String serviceName) {
        return resilienceManager.resetService(serviceName);
    }

    public List<HealthRecommendation> getHealthRecommendations() {
        List<HealthRecommendation> recommendations = new ArrayList<>();
        Map<String, CircuitBreakerHealth> all = getAllHealth();

        for (CircuitBreakerHealth health : all.values()) {
            String service = health.getService();
            switch (health.getState()) {
                case OPEN:
                    recommendations.add(new HealthRecommendation(HealthRecommendation.Type.ERROR, service,
                            "Circuit breaker is OPEN - service is failing fast",
                            "Check service logs and health. Consider manual reset if service is recovered."));
                    break;
                case HALF_OPEN:
                    recommendations.add(new HealthRecommendation(HealthRecommendation.Type.WARNING, service,
                            "Circuit breaker is HALF_OPEN - service is being tested for recovery",
                            "Monitor closely. Service is attempting recovery."));
                    break;
                default:
                    if (health.getStatus() == HealthStatus.DEGRADED) {
                        recommendations.add(new HealthRecommendation(HealthRecommendation.Type.WARNING, service,
                                String.format("Circuit breaker is CLOSED but service is degraded (%.1f%% error rate)",
                                        health.getMetrics().getErrorPercentage()),
                                "Monitor error rates. Service may trip to OPEN soon."));
                    } else if (health.getMetrics().getAverageResponseTime() > HIGH_LATENCY_MS) {
                        recommendations.add(new HealthRecommendation(HealthRecommendation.Type.INFO, service,
                                String.format("Service has high response times (%dms average)",
                                        Math.round(health.getMetrics().getAverageResponseTime())),
                                "Consider performance optimization or timeout adjustments."));
                    }
            }
        }

        long openCount = all.values().stream().filter(h -> h.getState() == CircuitBreakerState.OPEN).count();
        if (openCount > 1) {
            recommendations.add(new HealthRecommendation(HealthRecommendation.Type.ERROR, HealthRecommendation.SYSTEM,
                    String.format("Multiple services (%d) have circuit breakers in OPEN state", openCount),
                    "This may indicate a systemic issue. Check infrastructure, network, and dependencies."));
        }
        return recommendations;
    }

    @Scheduled(fixedDelayString = "${resilience.circuit-breaker.monitoring.health-check-interval:30000}",
            initialDelayString = "${resilience.circuit-breaker.monitoring.health-check-interval:30000}")
    public void performHealthCheck() {
        if (!resilienceManager.getConfigResolver().monitoring().isEnabled()) {
            return;
        }
        try {
            AggregatedHealth health = getAggregatedHealth();
            if (health.getSummary().getUnhealthy() > 0) {
                getOpenCircuitBreakers().forEach((key, h) ->
                        log.warn("Unhealthy circuit breaker {}: state={}, errorRate={}%, timeToReset={}ms",
                                key, h.getState(), String.format("%.1f", h.getMetrics().getErrorPercentage()),
                                h.getMetrics().getTimeToReset()));
            }
            log.debug("Circuit breaker health: total={}, healthy={}, degraded={}, unhealthy={}",
                    health.getSummary().getTotal(), health.getSummary().getHealthy(),
                    health.getSummary().getDegraded(), health.getSummary().getUnhealthy());
        } catch (RuntimeException e) {
            log.error("Error during circuit breaker health check: {}", e.getMessage(), e);
        }
    }

    private double alertThreshold() {
        return resilienceManager.getConfigResolver().monitoring().getAlertThreshold();
    }
}
