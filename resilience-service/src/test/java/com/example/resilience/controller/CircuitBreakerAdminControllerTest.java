package com.example.resilience.controller;

import com.example.resilience.circuitbreaker.BreakerKey;
import com.example.resilience.circuitbreaker.CircuitBreaker;
import com.example.resilience.circuitbreaker.CircuitBreakerConfigResolver;
import com.example.resilience.circuitbreaker.CircuitBreakerOptions;
import com.example.resilience.circuitbreaker.ResilienceManager;
import com.example.resilience.config.CircuitBreakerProperties;
import com.example.resilience.exception.TransportException;
import com.example.resilience.health.CircuitBreakerHealthService;
import com.example.resilience.monitoring.CircuitBreakerMetricsCollector;
import com.example.resilience.support.MutableClock;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.test.web.reactive.server.WebTestClient;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;

@ExtendWith(MockitoExtension.class)
class CircuitBreakerAdminControllerTest {

    private static final BreakerKey AUTH = BreakerKey.of("auth-service", "rpc-call");

    @Mock
    private ApplicationEventPublisher eventPublisher;

    private MutableClock clock;
    private Scheduler timeoutScheduler;
    private ResilienceManager manager;
    private CircuitBreakerMetricsCollector collector;
    private WebTestClient webTestClient;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2024-01-01T00:00:00Z");
        timeoutScheduler = Schedulers.newParallel("controller-test", 2, true);
        SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();
        manager = new ResilienceManager(new CircuitBreakerConfigResolver(new CircuitBreakerProperties()),
                meterRegistry, clock, timeoutScheduler);
        collector = new CircuitBreakerMetricsCollector(manager, clock, Schedulers.immediate(), eventPublisher,
                meterRegistry);
        collector.init();

        CircuitBreakerAdminController controller = new CircuitBreakerAdminController(
                new CircuitBreakerHealthService(manager, clock), collector, manager);
        webTestClient = WebTestClient.bindToController(controller)
                .controllerAdvice(new ApiExceptionHandler())
                .build();
    }

    @AfterEach
    void tearDown() {
        collector.shutdown();
        timeoutScheduler.dispose();
    }

    private CircuitBreaker authBreaker() {
        return manager.getOrCreate(AUTH, CircuitBreakerOptions.builder().volumeThreshold(2).build());
    }

    private void fail(CircuitBreaker circuitBreaker) {
        circuitBreaker.execute(() -> Mono.<String>error(new TransportException("down"))).block(Duration.ofSeconds(5));
    }

    private void tripAuthBreaker() {
        CircuitBreaker circuitBreaker = authBreaker();
        collector.collect();
        clock.advanceMillis(1000);
        fail(circuitBreaker);
        fail(circuitBreaker);
        clock.advanceMillis(1000);
        collector.collect();
    }

    @Test
    void unknownBreakerIsNotFound() {
        webTestClient.get().uri("/api/circuit-breaker/health/auth?operation=rpc-call")
                .exchange()
                .expectStatus().isNotFound();
    }

    @Test
    void unknownOperationIsBadRequest() {
        webTestClient.get().uri("/api/circuit-breaker/health/auth?operation=teleport")
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.error").isEqualTo("bad_request")
                .jsonPath("$.message").isEqualTo("Unknown operation: teleport");
    }

    @Test
    void serviceHealthUsesNormalizedName() {
        authBreaker();

        webTestClient.get().uri("/api/circuit-breaker/health/Auth?operation=rpc-call")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.service").isEqualTo("auth-service:rpc-call")
                .jsonPath("$.state").isEqualTo("CLOSED")
                .jsonPath("$.status").isEqualTo("HEALTHY");
    }

    @Test
    void openBreakerIsListedAndCanBeReset() {
        tripAuthBreaker();

        webTestClient.get().uri("/api/circuit-breaker/health/open")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$['auth-service:rpc-call'].state").isEqualTo("OPEN");

        webTestClient.post().uri("/api/circuit-breaker/reset/auth")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.service").isEqualTo("auth-service")
                .jsonPath("$.resetCount").isEqualTo(1)
                .jsonPath("$.message").isEqualTo("Reset 1 circuit breaker(s) for auth-service");

        webTestClient.get().uri("/api/circuit-breaker/health/open")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$['auth-service:rpc-call']").doesNotExist();
    }

    @Test
    void alertsCanBeFilteredBySeverityAndService() {
        tripAuthBreaker();

        webTestClient.get().uri("/api/circuit-breaker/alerts?severity=error&service=auth-service")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.length()").isEqualTo(2)
                .jsonPath("$[0].severity").isEqualTo("ERROR")
                .jsonPath("$[0].service").isEqualTo("auth-service:rpc-call");

        webTestClient.get().uri("/api/circuit-breaker/alerts?service=billing-service")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.length()").isEqualTo(0);
    }

    @Test
    void alertServiceFilterAcceptsShortNames() {
        tripAuthBreaker();

        webTestClient.get().uri("/api/circuit-breaker/alerts?service=auth")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.length()").isEqualTo(2)
                .jsonPath("$[0].service").isEqualTo("auth-service:rpc-call");

        webTestClient.get().uri("/api/circuit-breaker/alerts?service=auth-service:rpc-call")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.length()").isEqualTo(2);
    }

    @Test
    void invalidSeverityIsBadRequest() {
        webTestClient.get().uri("/api/circuit-breaker/alerts?severity=fatal")
                .exchange()
                .expectStatus().isBadRequest();
    }

    @Test
    void summaryReportsOpenBreakers() {
        tripAuthBreaker();

        webTestClient.get().uri("/api/circuit-breaker/summary")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.overview.totalServices").isEqualTo(1)
                .jsonPath("$.overview.openCircuitBreakers").isEqualTo(1)
                .jsonPath("$.topIssues[0].service").isEqualTo("auth-service:rpc-call");
    }

    @Test
    void trendRejectsNonPositiveBucketSize() {
        webTestClient.get().uri("/api/circuit-breaker/metrics/auth-service:rpc-call/trend?bucketSize=0")
                .exchange()
                .expectStatus().isBadRequest();
    }

    @Test
    void responseTimesWithoutHistoryAreNotFound() {
        webTestClient.get().uri("/api/circuit-breaker/metrics/auth-service:rpc-call/response-times")
                .exchange()
                .expectStatus().isNotFound();
    }

    @Test
    void malformedHistoryRangeIsBadRequest() {
        webTestClient.get().uri("/api/circuit-breaker/metrics/history?startTime=yesterday")
                .exchange()
                .expectStatus().isBadRequest();
    }

    @Test
    void currentMetricsAggregateAllBreakers() {
        tripAuthBreaker();

        webTestClient.get().uri("/api/circuit-breaker/metrics")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.totalCircuitBreakers").isEqualTo(1)
                .jsonPath("$.aggregated.totalFailures").isEqualTo(2)
                .jsonPath("$.aggregated.overallErrorPercentage").isEqualTo(100.0);
    }
}
