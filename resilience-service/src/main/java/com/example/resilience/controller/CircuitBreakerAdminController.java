package com.example.resilience.controller;

import com.example.resilience.circuitbreaker.ResilienceManager;
import com.example.resilience.health.AggregatedHealth;
import com.example.resilience.health.CircuitBreakerHealth;
import com.example.resilience.health.CircuitBreakerHealthService;
import com.example.resilience.health.HealthRecommendation;
import com.example.resilience.monitoring.AlertSeverity;
import com.example.resilience.monitoring.CircuitBreakerAlert;
import com.example.resilience.monitoring.CircuitBreakerMetricsCollector;
import com.example.resilience.monitoring.ErrorRateTrend;
import com.example.resilience.monitoring.MetricsBucket;
import com.example.resilience.monitoring.MetricsSnapshot;
import com.example.resilience.monitoring.ResponseTimePercentiles;
import com.example.resilience.monitoring.SummaryReport;
import com.example.resilience.timeout.TimeoutOperation;
import com.example.resilience.utils.ServiceNames;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Endpoints de consulta y gestión de los circuit breakers.
 */
@RestController
@RequestMapping("/api/circuit-breaker")
public class CircuitBreakerAdminController {
    private final CircuitBreakerHealthService healthService;
    private final CircuitBreakerMetricsCollector metricsCollector;
    private final ResilienceManager resilienceManager;

    public CircuitBreakerAdminController(CircuitBreakerHealthService healthService,
                                         CircuitBreakerMetricsCollector metricsCollector,
                                         ResilienceManager resilienceManager) {
        this.healthService = healthService;
        this.metricsCollector = metricsCollector;
        this.resilienceManager = resilienceManager;
    }

    @GetMapping("/health")
    public ResponseEntity<AggregatedHealth> getHealth() {
        return ResponseEntity.ok(healthService.getAggregatedHealth());
    }

    @GetMapping("/health/open")
    public ResponseEntity<Map<String, CircuitBreakerHealth>> getOpenCircuitBreakers() {
        return ResponseEntity.ok(healthService.getOpenCircuitBreakers());
    }

    @GetMapping("/health/degraded")
    public ResponseEntity<Map<String, CircuitBreakerHealth>> getDegradedCircuitBreakers() {
        return ResponseEntity.ok(healthService.getDegradedCircuitBreakers());
    }

    @GetMapping("/health/recommendations")
    public ResponseEntity<List<HealthRecommendation>> getHealthRecommendations() {
        return ResponseEntity.ok(healthService.getHealthRecommendations());
    }

    /**
     * Salud de un breaker concreto. 404 si nunca se ha creado.
     */
    @GetMapping("/health/{serviceName}")
    public ResponseEntity<CircuitBreakerHealth> getServiceHealth(@PathVariable String serviceName,
                                                                 @RequestParam(required = false) String operation) {
        return healthService.getServiceHealth(ServiceNames.normalize(serviceName), parseOperation(operation))
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    @PostMapping("/reset/{serviceName}")
    public ResponseEntity<Map<String, Object>> resetServiceCircuitBreakers(@PathVariable String serviceName) {
        String service = ServiceNames.normalize(serviceName);
        int resetCount = healthService.resetServiceCircuitBreakers(service);

        Map<String, Object> response = new LinkedHashMap<>();
        response.put("service", service);
        response.put("resetCount", resetCount);
        response.put("message", "Reset " + resetCount + " circuit breaker(s) for " + service);
        return ResponseEntity.ok(response);
    }

    @GetMapping("/metrics")
    public ResponseEntity<MetricsSnapshot> getCurrentMetrics() {
        return ResponseEntity.ok(metricsCollector.getCurrentSnapshot());
    }

    /**
     * @param startTime instante ISO-8601 inclusivo; opcional
     * @param endTime   instante ISO-8601 inclusivo; opcional
     */
    @GetMapping("/metrics/history")
    public ResponseEntity<List<MetricsSnapshot>> getMetricsHistory(@RequestParam(required = false) String startTime,
                                                                   @RequestParam(required = false) String endTime) {
        return ResponseEntity.ok(metricsCollector.getMetricsHistory(parseInstant(startTime), parseInstant(endTime)));
    }

    @GetMapping("/metrics/error-trends")
    public ResponseEntity<Map<String, ErrorRateTrend>> getErrorRateTrends(
            @RequestParam(defaultValue = "300000") long timeWindow) {
        return ResponseEntity.ok(metricsCollector.getErrorRateTrends(timeWindow));
    }

    @GetMapping("/metrics/{serviceName}/trend")
    public ResponseEntity<List<MetricsBucket>> getServiceMetricsTrend(@PathVariable String serviceName,
                                                                      @RequestParam(defaultValue = "300000") long timeWindow,
                                                                      @RequestParam(defaultValue = "30000") long bucketSize) {
        if (timeWindow <= 0 || bucketSize <= 0) {
            throw new IllegalArgumentException("timeWindow and bucketSize must be positive");
        }
        return ResponseEntity.ok(metricsCollector.getServiceMetricsOverTime(serviceName, timeWindow, bucketSize));
    }

    @GetMapping("/metrics/{serviceName}/response-times")
    public ResponseEntity<ResponseTimePercentiles> getResponseTimePercentiles(
            @PathVariable String serviceName,
            @RequestParam(defaultValue = "300000") long timeWindow) {
        return metricsCollector.getResponseTimePercentiles(serviceName, timeWindow)
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    @GetMapping("/alerts")
    public ResponseEntity<List<CircuitBreakerAlert>> getAlerts(@RequestParam(defaultValue = "50") int limit,
                                                               @RequestParam(required = false) String severity,
                                                               @RequestParam(required = false) String service) {
        AlertSeverity severityFilter = severity != null ? AlertSeverity.parse(severity) : null;
        return ResponseEntity.ok(metricsCollector.getAlerts(limit, severityFilter, normalizeServiceFilter(service)));
    }

    @GetMapping("/summary")
    public ResponseEntity<SummaryReport> getSummaryReport() {
        return ResponseEntity.ok(metricsCollector.generateSummaryReport());
    }

    @GetMapping("/debug")
    public ResponseEntity<Map<String, Object>> getDebugInfo() {
        return ResponseEntity.ok(resilienceManager.getDebugInfo());
    }

    private static String parseOperation(String operation) {
        if (operation == null || operation.isBlank()) {
            return null;
        }
        return TimeoutOperation.fromValue(operation)
                .map(TimeoutOperation::getValue)
                .orElseThrow(() -> new IllegalArgumentException("Unknown operation: " + operation));
    }

    /**
     * "auth" → "auth-service"; las claves completas ("auth-service:rpc-call") se usan tal cual.
     */
    private static String normalizeServiceFilter(String service) {
        if (service == null || service.isBlank()) {
            return null;
        }
        return service.contains(":") ? service : ServiceNames.normalize(service);
    }

    private static Instant parseInstant(String value) {
        return value == null || value.isBlank() ? null : Instant.parse(value);
    }
}
