package com.example.resilience.monitoring;

import com.example.resilience.circuitbreaker.CircuitBreaker;
import com.example.resilience.circuitbreaker.CircuitBreakerMetrics;
import com.example.resilience.circuitbreaker.CircuitBreakerState;
import com.example.resilience.circuitbreaker.ResilienceManager;
import com.example.resilience.circuitbreaker.StateChangeEvent;
import com.example.resilience.circuitbreaker.StateChangeListener;
import com.example.resilience.config.CircuitBreakerProperties;
import com.example.resilience.health.CircuitBreakerHealth;
import com.example.resilience.health.HealthStatus;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import reactor.core.scheduler.Scheduler;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;

/**
 * Recoge periódicamente una foto de todos los circuit breakers, la guarda en un histórico
 * acotado y evalúa las condiciones de alerta.
 *
 * <p>Alertas generadas:
 * <ul>
 *   <li>cambio de estado respecto a la foto anterior (ERROR si OPEN, WARNING si HALF_OPEN, INFO si no)</li>
 *   <li>tasa de errores por encima del umbral configurado (ERROR si supera el 80%)</li>
 *   <li>tiempo medio de respuesta por encima de 10s (ERROR si supera 30s)</li>
 *   <li>recuperación: el breaker vuelve a CLOSED</li>
 * </ul>
 * Cada alerta se registra en log, en Micrometer y como evento de aplicación.</p>
 */
@Component
public class CircuitBreakerMetricsCollector implements StateChangeListener {
    private static final Logger log = LoggerFactory.getLogger(CircuitBreakerMetricsCollector.class);

    public static final int MAX_HISTORY_SIZE = 1000;
    public static final int MAX_ALERTS_SIZE = 500;

    static final double HIGH_ERROR_RATE_ERROR = 80.0;
    static final double HIGH_RESPONSE_TIME_WARNING = 10000.0;
    static final double HIGH_RESPONSE_TIME_ERROR = 30000.0;
    static final double TREND_THRESHOLD = 5.0;
    static final long DEFAULT_TIME_WINDOW = 300000;

    private final ResilienceManager resilienceManager;
    private final Clock clock;
    private final Scheduler scheduler;
    private final ApplicationEventPublisher eventPublisher;
    private final MeterRegistry meterRegistry;

    private final BoundedHistory<MetricsSnapshot> history = new BoundedHistory<>(MAX_HISTORY_SIZE);
    private final BoundedHistory<CircuitBreakerAlert> alerts = new BoundedHistory<>(MAX_ALERTS_SIZE);
    private final AtomicLong alertSequence = new AtomicLong();
    private Instant lastSnapshotTime = Instant.EPOCH;

    public CircuitBreakerMetricsCollector(ResilienceManager resilienceManager,
                                          Clock clock,
                                          @Qualifier("resilienceScheduler") Scheduler scheduler,
                                          ApplicationEventPublisher eventPublisher,
                                          MeterRegistry meterRegistry) {
        this.resilienceManager = resilienceManager;
        this.clock = clock;
        this.scheduler = scheduler;
        this.eventPublisher = eventPublisher;
        this.meterRegistry = meterRegistry;
    }

    @PostConstruct
    public void init() {
        resilienceManager.addStateChangeListener(this);
        CircuitBreakerProperties.Monitoring monitoring = monitoring();
        if (monitoring.isEnabled()) {
            log.info("Circuit breaker metrics collection started (interval={}ms, alertThreshold={}%)",
                    monitoring.getMetricsInterval(), monitoring.getAlertThreshold());
        } else {
            log.info("Circuit breaker metrics collection disabled");
        }
    }

    @PreDestroy
    public void shutdown() {
        resilienceManager.removeStateChangeListener(this);
    }

    @Scheduled(fixedDelayString = "${resilience.circuit-breaker.monitoring.metrics-interval:60000}",
            initialDelayString = "${resilience.circuit-breaker.monitoring.metrics-interval:60000}")
    public void scheduledCollection() {
        if (!monitoring().isEnabled()) {
            return;
        }
        try {
            collect();
        } catch (RuntimeException e) {
            log.error("Error collecting circuit breaker metrics: {}", e.getMessage(), e);
        }
    }

    /**
     * Crea una foto, evalúa alertas contra la foto anterior y la añade al histórico.
     */
    public synchronized MetricsSnapshot collect() {
        Instant now = clock.instant();
        if (!now.isAfter(lastSnapshotTime)) {
            now = lastSnapshotTime.plusMillis(1);
        }
        lastSnapshotTime = now;

        MetricsSnapshot snapshot = createSnapshot(now);
        Optional<MetricsSnapshot> previous = history.latest();
        checkForAlerts(snapshot, previous.orElse(null));
        history.add(snapshot);
        log.debug("Collected metrics snapshot with {} circuit breakers", snapshot.getTotalCircuitBreakers());
        return snapshot;
    }

    public MetricsSnapshot getCurrentSnapshot() {
        return createSnapshot(clock.instant());
    }

    private MetricsSnapshot createSnapshot(Instant timestamp) {
        double alertThreshold = monitoring().getAlertThreshold();
        Map<CircuitBreakerState, Integer> stateDistribution = new EnumMap<>(CircuitBreakerState.class);
        for (CircuitBreakerState state : CircuitBreakerState.values()) {
            stateDistribution.put(state, 0);
        }
        Map<HealthStatus, Integer> healthDistribution = new EnumMap<>(HealthStatus.class);
        for (HealthStatus status : HealthStatus.values()) {
            healthDistribution.put(status, 0);
        }
        Map<String, MetricsSnapshot.ServiceSnapshot> services = new LinkedHashMap<>();

        long totalRequests = 0;
        long totalSuccesses = 0;
        long totalFailures = 0;
        long totalRejections = 0;
        double totalResponseTime = 0;
        int withResponseTime = 0;

        for (CircuitBreaker circuitBreaker : resilienceManager.getCircuitBreakers()) {
            CircuitBreakerMetrics metrics = circuitBreaker.getMetrics();
            CircuitBreakerHealth health = CircuitBreakerHealth.of(circuitBreaker.getKey(), metrics, alertThreshold, timestamp);
            stateDistribution.merge(health.getState(), 1, Integer::sum);
            healthDistribution.merge(health.getStatus(), 1, Integer::sum);
            services.put(health.getService(), new MetricsSnapshot.ServiceSnapshot(metrics, health));

            totalRequests += metrics.getRequestCount();
            totalSuccesses += metrics.getSuccessCount();
            totalFailures += metrics.getFailureCount();
            totalRejections += metrics.getRejectionCount();
            if (metrics.getAverageResponseTime() > 0) {
                totalResponseTime += metrics.getAverageResponseTime();
                withResponseTime++;
            }
        }

        return MetricsSnapshot.builder()
                .timestamp(timestamp)
                .totalCircuitBreakers(services.size())
                .stateDistribution(stateDistribution)
                .healthDistribution(healthDistribution)
                .services(services)
                .aggregated(MetricsSnapshot.AggregatedTotals.builder()
                        .totalRequests(totalRequests)
                        .totalSuccesses(totalSuccesses)
                        .totalFailures(totalFailures)
                        .totalRejections(totalRejections)
                        .overallErrorPercentage(CircuitBreakerMetrics.errorPercentage(totalSuccesses, totalFailures))
                        .averageResponseTime(withResponseTime > 0 ? totalResponseTime / withResponseTime : 0)
                        .build())
                .build();
    }

    private void checkForAlerts(MetricsSnapshot snapshot, MetricsSnapshot previous) {
        double alertThreshold = monitoring().getAlertThreshold();
        snapshot.getServices().forEach((service, data) -> {
            CircuitBreakerMetrics metrics = data.getMetrics();

            if (previous != null) {
                MetricsSnapshot.ServiceSnapshot before = previous.getServices().get(service);
                if (before != null && before.getHealth().getState() != data.getHealth().getState()) {
                    raiseStateChangeAlert(service, before.getHealth().getState(), data.getHealth());
                }
            }

            if (metrics.getErrorPercentage() > alertThreshold) {
                Map<String, Object> metadata = new LinkedHashMap<>();
                metadata.put("errorPercentage", metrics.getErrorPercentage());
                metadata.put("threshold", alertThreshold);
                metadata.put("requestCount", metrics.getRequestCount());
                addAlert(AlertType.HIGH_ERROR_RATE,
                        metrics.getErrorPercentage() > HIGH_ERROR_RATE_ERROR ? AlertSeverity.ERROR : AlertSeverity.WARNING,
                        service,
                        String.format("High error rate: %.1f%%", metrics.getErrorPercentage()),
                        metadata);
            }

            if (metrics.getAverageResponseTime() > HIGH_RESPONSE_TIME_WARNING) {
                Map<String, Object> metadata = new LinkedHashMap<>();
                metadata.put("averageResponseTime", metrics.getAverageResponseTime());
                metadata.put("requestCount", metrics.getRequestCount());
                addAlert(AlertType.HIGH_RESPONSE_TIME,
                        metrics.getAverageResponseTime() > HIGH_RESPONSE_TIME_ERROR ? AlertSeverity.ERROR : AlertSeverity.WARNING,
                        service,
                        String.format("High response time: %dms", Math.round(metrics.getAverageResponseTime())),
                        metadata);
            }
        });
    }

    private void raiseStateChangeAlert(String service, CircuitBreakerState previousState, CircuitBreakerHealth current) {
        AlertSeverity severity = AlertSeverity.INFO;
        if (current.getState() == CircuitBreakerState.OPEN) {
            severity = AlertSeverity.ERROR;
        } else if (current.getState() == CircuitBreakerState.HALF_OPEN) {
            severity = AlertSeverity.WARNING;
        }
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("previousState", previousState);
        metadata.put("currentState", current.getState());
        metadata.put("errorPercentage", current.getMetrics().getErrorPercentage());
        addAlert(AlertType.STATE_CHANGE, severity, service,
                String.format("Circuit breaker state changed from %s to %s", previousState, current.getState()),
                metadata);
    }

    /**
     * Alerta de recuperación cuando un breaker vuelve a CLOSED. Se registra fuera del lock del breaker.
     */
    @Override
    public void onStateChange(StateChangeEvent event) {
        if (event.to() != CircuitBreakerState.CLOSED || event.from() == CircuitBreakerState.CLOSED) {
            return;
        }
        scheduler.schedule(() -> {
            Map<String, Object> metadata = new LinkedHashMap<>();
            metadata.put("previousState", event.from());
            metadata.put("manual", event.manual());
            addAlert(AlertType.RECOVERY, AlertSeverity.INFO, event.key().toString(),
                    event.manual()
                            ? "Circuit breaker manually reset to CLOSED"
                            : "Circuit breaker recovered from " + event.from() + " to CLOSED",
                    metadata);
        });
    }

    CircuitBreakerAlert addAlert(AlertType type, AlertSeverity severity, String service,
                                 String message, Map<String, Object> metadata) {
        Instant now = clock.instant();
        CircuitBreakerAlert alert = CircuitBreakerAlert.builder()
                .id(String.format("%s-%s-%d-%d", service, type.name().toLowerCase().replace('_', '-'),
                        now.toEpochMilli(), alertSequence.incrementAndGet()))
                .type(type)
                .severity(severity)
                .service(service)
                .message(message)
                .metadata(metadata)
                .timestamp(now)
                .build();
        alerts.add(alert);

        switch (severity) {
            case ERROR:
                log.error("Circuit breaker alert [{}] {}: {}", type, service, message);
                break;
            case WARNING:
                log.warn("Circuit breaker alert [{}] {}: {}", type, service, message);
                break;
            default:
                log.info("Circuit breaker alert [{}] {}: {}", type, service, message);
        }

        meterRegistry.counter("circuit_breaker.alerts",
                "type", type.name(),
                "severity", severity.name()).increment();
        eventPublisher.publishEvent(new CircuitBreakerAlertEvent(this, alert));
        return alert;
    }

    /**
     * Histórico de fotos dentro del rango (ambos extremos opcionales e inclusivos).
     */
    public List<MetricsSnapshot> getMetricsHistory(Instant startTime, Instant endTime) {
        return history.toList().stream()
                .filter(s -> startTime == null || !s.getTimestamp().isBefore(startTime))
                .filter(s -> endTime == null || !s.getTimestamp().isAfter(endTime))
                .collect(Collectors.toList());
    }

    public int getHistorySize() {
        return history.size();
    }

    /**
     * Alertas más recientes primero, filtradas por severidad y servicio si se indican.
     */
    public List<CircuitBreakerAlert> getAlerts(int limit, AlertSeverity severity, String service) {
        List<CircuitBreakerAlert> all = alerts.toList();
        List<CircuitBreakerAlert> result = new ArrayList<>();
        for (int i = all.size() - 1; i >= 0 && result.size() < limit; i--) {
            CircuitBreakerAlert alert = all.get(i);
            if (severity != null && alert.getSeverity() != severity) {
                continue;
            }
            if (service != null && !alert.concerns(service)) {
                continue;
            }
            result.add(alert);
        }
        return result;
    }

    /**
     * Tendencia de la tasa de errores por breaker comparando las dos fotos más recientes de la ventana.
     * Un cambio mayor de 5 puntos se considera creciente o decreciente.
     */
    public Map<String, ErrorRateTrend> getErrorRateTrends(long timeWindow) {
        List<MetricsSnapshot> recent = recentSnapshots(timeWindow);
        Map<String, ErrorRateTrend> trends = new LinkedHashMap<>();
        if (recent.size() < 2) {
            return trends;
        }

        Set<String> keys = new LinkedHashSet<>();
        recent.forEach(s -> keys.addAll(s.getServices().keySet()));

        for (String key : keys) {
            List<ErrorRateTrend.Point> points = recent.stream()
                    .filter(s -> s.getServices().containsKey(key))
                    .map(s -> new ErrorRateTrend.Point(s.getTimestamp(),
                            s.getServices().get(key).getMetrics().getErrorPercentage()))
                    .collect(Collectors.toList());
            if (points.size() < 2) {
                continue;
            }
            double current = points.get(points.size() - 1).getErrorRate();
            double change = current - points.get(points.size() - 2).getErrorRate();
            ErrorRateTrend.Trend trend = ErrorRateTrend.Trend.STABLE;
            if (Math.abs(change) > TREND_THRESHOLD) {
                trend = change > 0 ? ErrorRateTrend.Trend.INCREASING : ErrorRateTrend.Trend.DECREASING;
            }
            trends.put(key, new ErrorRateTrend(current, trend, change, points));
        }
        return trends;
    }

    /**
     * Percentiles del tiempo medio de respuesta del breaker dentro de la ventana.
     * Vacío si no hay muestras con tiempo de respuesta.
     */
    public Optional<ResponseTimePercentiles> getResponseTimePercentiles(String service, long timeWindow) {
        List<Double> responseTimes = recentSnapshots(timeWindow).stream()
                .map(s -> s.getServices().get(service))
                .filter(data -> data != null && data.getMetrics().getAverageResponseTime() > 0)
                .map(data -> data.getMetrics().getAverageResponseTime())
                .sorted()
                .collect(Collectors.toList());
        if (responseTimes.isEmpty()) {
            return Optional.empty();
        }
        int count = responseTimes.size();
        double average = responseTimes.stream().mapToDouble(Double::doubleValue).average().orElse(0);
        return Optional.of(new ResponseTimePercentiles(
                percentile(responseTimes, 0.50),
                percentile(responseTimes, 0.95),
                percentile(responseTimes, 0.99),
                average,
                count));
    }

    private static double percentile(List<Double> sorted, double p) {
        int index = (int) Math.floor(sorted.size() * p);
        return sorted.get(Math.min(index, sorted.size() - 1));
    }

    /**
     * Métricas del breaker promediadas en buckets fijos sobre la ventana. Los buckets sin muestras se omiten.
     */
    public List<MetricsBucket> getServiceMetricsOverTime(String service, long timeWindow, long bucketSize) {
        if (bucketSize <= 0) {
            throw new IllegalArgumentException("bucketSize must be positive");
        }
        Instant end = clock.instant();
        Instant start = end.minusMillis(timeWindow);
        List<MetricsSnapshot> snapshots = history.toList();
        List<MetricsBucket> buckets = new ArrayList<>();

        for (Instant bucketStart = start; bucketStart.isBefore(end); bucketStart = bucketStart.plusMillis(bucketSize)) {
            Instant from = bucketStart;
            Instant to = bucketStart.plusMillis(bucketSize);
            List<CircuitBreakerMetrics> samples = snapshots.stream()
                    .filter(s -> !s.getTimestamp().isBefore(from) && s.getTimestamp().isBefore(to))
                    .map(s -> s.getServices().get(service))
                    .filter(data -> data != null)
                    .map(MetricsSnapshot.ServiceSnapshot::getMetrics)
                    .collect(Collectors.toList());
            if (!samples.isEmpty()) {
                buckets.add(new MetricsBucket(from, to, samples.size(), average(samples)));
            }
        }
        return buckets;
    }

    private static CircuitBreakerMetrics average(List<CircuitBreakerMetrics> samples) {
        int count = samples.size();
        CircuitBreakerMetrics latest = samples.get(count - 1);
        return CircuitBreakerMetrics.builder()
                .state(latest.getState())
                .requestCount(Math.round(samples.stream().mapToLong(CircuitBreakerMetrics::getRequestCount).sum() / (double) count))
                .successCount(Math.round(samples.stream().mapToLong(CircuitBreakerMetrics::getSuccessCount).sum() / (double) count))
                .failureCount(Math.round(samples.stream().mapToLong(CircuitBreakerMetrics::getFailureCount).sum() / (double) count))
                .rejectionCount(Math.round(samples.stream().mapToLong(CircuitBreakerMetrics::getRejectionCount).sum() / (double) count))
                .ignoredCount(Math.round(samples.stream().mapToLong(CircuitBreakerMetrics::getIgnoredCount).sum() / (double) count))
                .errorPercentage(samples.stream().mapToDouble(CircuitBreakerMetrics::getErrorPercentage).average().orElse(0))
                .averageResponseTime(samples.stream().mapToDouble(CircuitBreakerMetrics::getAverageResponseTime).average().orElse(0))
                .lastStateChange(samples.stream().map(CircuitBreakerMetrics::getLastStateChange)
                        .max(Comparator.naturalOrder()).orElse(latest.getLastStateChange()))
                .lastError(latest.getLastError())
                .timeToReset(latest.getTimeToReset())
                .build();
    }

    public SummaryReport generateSummaryReport() {
        MetricsSnapshot current = getCurrentSnapshot();
        List<SummaryReport.Issue> issues = new ArrayList<>();

        current.getServices().forEach((service, data) -> {
            CircuitBreakerMetrics metrics = data.getMetrics();
            if (metrics.getErrorPercentage() > 50) {
                issues.add(new SummaryReport.Issue(service,
                        String.format("High error rate: %.1f%%", metrics.getErrorPercentage()),
                        SummaryReport.IssueSeverity.HIGH,
                        "Check service logs and dependencies. Consider circuit breaker reset if service is recovered."));
            }
            if (metrics.getAverageResponseTime() > HIGH_RESPONSE_TIME_WARNING) {
                issues.add(new SummaryReport.Issue(service,
                        String.format("High response time: %dms", Math.round(metrics.getAverageResponseTime())),
                        SummaryReport.IssueSeverity.MEDIUM,
                        "Investigate performance issues. Consider timeout adjustments."));
            }
            if (data.getHealth().getState() == CircuitBreakerState.OPEN) {
                issues.add(new SummaryReport.Issue(service,
                        "Circuit breaker is OPEN",
                        SummaryReport.IssueSeverity.HIGH,
                        "Service is failing fast. Investigate and fix underlying issues before resetting."));
            }
        });
        issues.sort(Comparator.comparing(SummaryReport.Issue::getSeverity).reversed());

        Map<String, SummaryReport.TrendSummary> trends = new LinkedHashMap<>();
        getErrorRateTrends(DEFAULT_TIME_WINDOW).forEach((service, trend) ->
                trends.put(service, new SummaryReport.TrendSummary(trend.getTrend(), trend.getChange())));

        return SummaryReport.builder()
                .overview(SummaryReport.Overview.builder()
                        .totalServices(current.getTotalCircuitBreakers())
                        .healthyServices(current.getHealthDistribution().get(HealthStatus.HEALTHY))
                        .degradedServices(current.getHealthDistribution().get(HealthStatus.DEGRADED))
                        .unhealthyServices(current.getHealthDistribution().get(HealthStatus.UNHEALTHY))
                        .openCircuitBreakers(current.getStateDistribution().get(CircuitBreakerState.OPEN))
                        .build())
                .topIssues(issues.stream().limit(10).collect(Collectors.toList()))
                .recentAlerts(getAlerts(10, null, null))
                .trends(trends)
                .build();
    }

    private List<MetricsSnapshot> recentSnapshots(long timeWindow) {
        Instant from = clock.instant().minus(Duration.ofMillis(timeWindow));
        return history.toList().stream()
                .filter(s -> !s.getTimestamp().isBefore(from))
                .collect(Collectors.toList());
    }

    private CircuitBreakerProperties.Monitoring monitoring() {
        return resilienceManager.getConfigResolver().monitoring();
    }
}
