package com.example.resilience.health;

import com.example.resilience.circuitbreaker.CircuitBreakerConfigResolver;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.actuate.health.AbstractReactiveHealthIndicator;
import org.springframework.boot.actuate.health.Health;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Expone el estado de los circuit breakers en /actuator/health bajo "circuitBreakers".
 * DOWN si algún breaker está abierto.
 */
@Component("circuitBreakers")
@RequiredArgsConstructor
public class CircuitBreakerHealthIndicator extends AbstractReactiveHealthIndicator {

    private final CircuitBreakerHealthService healthService;
    private final CircuitBreakerConfigResolver configResolver;

    @Override
    protected Mono<Health> doHealthCheck(Health.Builder builder) {
        return Mono.fromCallable(() -> {
            if (!configResolver.isGloballyEnabled()) {
                return builder.up().withDetail("message", "Circuit breakers are disabled").build();
            }
            AggregatedHealth health = healthService.getAggregatedHealth();

            Map<String, Object> breakers = new LinkedHashMap<>();
            health.getServices().forEach((key, h) -> {
                Map<String, Object> detail = new LinkedHashMap<>();
                detail.put("status", h.getStatus());
                detail.put("state", h.getState());
                detail.put("errorPercentage", Math.round(h.getMetrics().getErrorPercentage() * 100) / 100.0);
                detail.put("requestCount", h.getMetrics().getRequestCount());
                detail.put("averageResponseTime", Math.round(h.getMetrics().getAverageResponseTime()));
                if (h.getMetrics().getTimeToReset() != null) {
                    detail.put("timeToReset", h.getMetrics().getTimeToReset());
                }
                breakers.put(key, detail);
            });

            Health.Builder status = health.isUp() ? builder.up() : builder.down();
            return status
                    .withDetail("summary", health.getSummary())
                    .withDetail("circuit-breakers", breakers)
                    .withDetail("message", health.isUp()
                            ? "All circuit breakers are healthy"
                            : health.getSummary().getUnhealthy() + " circuit breaker(s) are unhealthy")
                    .build();
        });
    }
}
