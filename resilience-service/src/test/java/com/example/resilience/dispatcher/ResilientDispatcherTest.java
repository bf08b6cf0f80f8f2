package com.example.resilience.dispatcher;

import com.example.resilience.circuitbreaker.BreakerKey;
import com.example.resilience.circuitbreaker.CircuitBreakerConfigResolver;
import com.example.resilience.circuitbreaker.CircuitBreakerState;
import com.example.resilience.circuitbreaker.ResilienceManager;
import com.example.resilience.config.CircuitBreakerProperties;
import com.example.resilience.config.DispatcherProperties;
import com.example.resilience.config.TimeoutProperties;
import com.example.resilience.exception.CircuitBreakerOpenException;
import com.example.resilience.exception.ServiceCallException;
import com.example.resilience.exception.ServiceUnavailableException;
import com.example.resilience.exception.TransportException;
import com.example.resilience.exception.ValidationException;
import com.example.resilience.health.CircuitBreakerHealthService;
import com.example.resilience.messaging.MessageTransport;
import com.example.resilience.support.MutableClock;
import com.example.resilience.timeout.TimeoutOperation;
import com.example.resilience.timeout.TimeoutResolver;
import com.example.resilience.timeout.TimeoutSource;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.slf4j.MDC;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ResilientDispatcherTest {

    private static final String EXCHANGE = "capsule.commands";

    @Mock
    private MessageTransport transport;

    private Scheduler scheduler;
    private SimpleMeterRegistry meterRegistry;
    private ResilienceManager manager;
    private ResilientDispatcher dispatcher;

    @BeforeEach
    void setUp() {
        MutableClock clock = MutableClock.startingAt("2024-01-01T00:00:00Z");
        scheduler = Schedulers.newParallel("dispatcher-test", 2, true);
        meterRegistry = new SimpleMeterRegistry();

        TimeoutProperties timeoutProperties = new TimeoutProperties();
        timeoutProperties.setEnvironment("test");
        TimeoutResolver timeoutResolver = new TimeoutResolver(timeoutProperties);

        manager = new ResilienceManager(new CircuitBreakerConfigResolver(new CircuitBreakerProperties()),
                meterRegistry, clock, scheduler);
        dispatcher = new ResilientDispatcher(transport, manager, timeoutResolver,
                new FallbackFactory(timeoutResolver, clock),
                new CircuitBreakerHealthService(manager, clock),
                new DispatcherProperties(), meterRegistry);
    }

    @AfterEach
    void tearDown() {
        scheduler.dispose();
    }

    private static RequestOptions rpc(String routingKey) {
        return RequestOptions.builder()
                .exchange(EXCHANGE)
                .routingKey(routingKey)
                .payload(Map.of("email", "user@example.com"))
                .build();
    }

    @Test
    void successfulRequestIsEnrichedWithTimeoutAndState() {
        when(transport.send(anyString(), anyString(), any(), any(Duration.class), eq(String.class)))
                .thenReturn(Mono.just("registered"));

        StepVerifier.create(dispatcher.request(rpc("auth.register"), String.class))
                .assertNext(result -> {
                    assertThat(result.getData()).isEqualTo("registered");
                    assertThat(result.getServiceName()).isEqualTo("auth-service");
                    assertThat(result.getOperation()).isEqualTo(TimeoutOperation.RPC_CALL);
                    assertThat(result.getTimeout()).isEqualTo(1000);
                    assertThat(result.getTimeoutSource()).isEqualTo(TimeoutSource.SERVICE_OVERRIDE);
                    assertThat(result.getCircuitState()).isEqualTo(CircuitBreakerState.CLOSED);
                    assertThat(result.isFromFallback()).isFalse();
                    assertThat(result.isTimedOut()).isFalse();
                })
                .verifyComplete();

        verify(transport).send(eq(EXCHANGE), eq("auth.register"), any(), eq(Duration.ofMillis(1000)), eq(String.class));
        assertThat(manager.find(BreakerKey.of("auth-service", "rpc-call"))).isPresent();
        assertThat(meterRegistry.get("resilience.dispatch").tag("status", "success").timer().count()).isEqualTo(1);
    }

    @Test
    void diagnosticContextIsSetDuringTheCallOnly() {
        AtomicReference<String> seenService = new AtomicReference<>();
        AtomicReference<String> seenOperation = new AtomicReference<>();
        when(transport.send(anyString(), anyString(), any(), any(Duration.class), eq(String.class)))
                .thenAnswer(invocation -> {
                    seenService.set(MDC.get("serviceName"));
                    seenOperation.set(MDC.get("operation"));
                    return Mono.just("ok");
                });

        dispatcher.request(rpc("deploy.start"), String.class).block(Duration.ofSeconds(5));

        assertThat(seenService).hasValue("deploy-service");
        assertThat(seenOperation).hasValue("rpc-call");
        assertThat(MDC.get("serviceName")).isNull();
    }

    @Test
    void explicitServiceNameAndTimeoutWin() {
        when(transport.send(anyString(), anyString(), any(), any(Duration.class), eq(String.class)))
                .thenReturn(Mono.just("ok"));

        StepVerifier.create(dispatcher.request(RequestOptions.builder()
                                .exchange(EXCHANGE)
                                .routingKey("users.lookup")
                                .serviceName("auth")
                                .timeout(2500L)
                                .build(),
                        String.class))
                .assertNext(result -> {
                    assertThat(result.getServiceName()).isEqualTo("auth-service");
                    assertThat(result.getTimeout()).isEqualTo(2500);
                    assertThat(result.getTimeoutSource()).isEqualTo(TimeoutSource.CALLER_OVERRIDE);
                })
                .verifyComplete();
    }

    @Test
    void callerErrorsPropagateUnchanged() {
        ValidationException invalid = new ValidationException("email is required");
        when(transport.send(anyString(), anyString(), any(), any(Duration.class), eq(String.class)))
                .thenReturn(Mono.error(invalid));

        StepVerifier.create(dispatcher.request(rpc("auth.register"), String.class))
                .expectErrorSatisfies(error -> assertThat(error).isSameAs(invalid))
                .verify();

        assertThat(manager.getMetrics(BreakerKey.of("auth-service", "rpc-call")))
                .hasValueSatisfying(metrics -> {
                    assertThat(metrics.getIgnoredCount()).isEqualTo(1);
                    assertThat(metrics.getFailureCount()).isZero();
                });
    }

    @Test
    void criticalServiceFailureBecomesTemporarilyUnavailable() {
        when(transport.send(anyString(), anyString(), any(), any(Duration.class), eq(String.class)))
                .thenReturn(Mono.error(new TransportException("broker down")));

        StepVerifier.create(dispatcher.request(rpc("auth.login"), String.class))
                .expectErrorSatisfies(error -> {
                    assertThat(error).isInstanceOf(ServiceUnavailableException.class)
                            .hasMessage("Auth service temporarily unavailable")
                            .hasCauseInstanceOf(TransportException.class);
                    assertThat(((ServiceUnavailableException) error).getServiceName()).isEqualTo("auth-service");
                    assertThat(error).isInstanceOf(ServiceCallException.class);
                    ServiceCallException callError = (ServiceCallException) error;
                    assertThat(callError.getRoutingKey()).isEqualTo("auth.login");
                    assertThat(callError.getCircuitBreakerResult().isFallbackFailed()).isTrue();
                    assertThat(callError.getCircuitBreakerResult().getCircuitState()).isEqualTo(CircuitBreakerState.CLOSED);
                })
                .verify();
    }

    @Test
    void billingFailureMentionsRetryQueue() {
        when(transport.send(anyString(), anyString(), any(), any(Duration.class), eq(String.class)))
                .thenReturn(Mono.error(new TransportException("broker down")));

        StepVerifier.create(dispatcher.request(rpc("billing.charge"), String.class))
                .expectErrorMessage("Billing service temporarily unavailable - operation queued for retry")
                .verify();
    }

    @Test
    void unknownServiceFailureUsesGenericMessage() {
        when(transport.send(anyString(), anyString(), any(), any(Duration.class), eq(String.class)))
                .thenReturn(Mono.error(new TransportException("broker down")));

        StepVerifier.create(dispatcher.request(rpc(""), String.class))
                .expectErrorMessage("Service temporarily unavailable")
                .verify();
    }

    @Test
    void failureWithoutFallbackCarriesTheBreakerResult() {
        when(transport.send(anyString(), anyString(), any(), any(Duration.class), eq(String.class)))
                .thenReturn(Mono.error(new TransportException("broker down")));

        StepVerifier.create(dispatcher.request(RequestOptions.builder()
                                .exchange(EXCHANGE)
                                .routingKey("deploy.start")
                                .useFallback(false)
                                .build(),
                        String.class))
                .expectErrorSatisfies(error -> {
                    assertThat(error).isInstanceOf(ServiceCallException.class).hasMessage("broker down");
                    ServiceCallException callError = (ServiceCallException) error;
                    assertThat(callError.getRoutingKey()).isEqualTo("deploy.start");
                    assertThat(callError.getCircuitBreakerResult().isSuccess()).isFalse();
                })
                .verify();

        assertThat(meterRegistry.get("resilience.dispatch").tag("status", "failed").timer().count()).isEqualTo(1);
    }

    @Test
    @SuppressWarnings("rawtypes")
    void nonCriticalServiceIsServedFromFallback() {
        when(transport.send(anyString(), anyString(), any(), any(Duration.class), eq(Map.class)))
                .thenReturn(Mono.error(new TransportException("broker down")));

        StepVerifier.create(dispatcher.request(rpc("monitor.metrics"), Map.class))
                .assertNext(result -> {
                    assertThat(result.isFromFallback()).isTrue();
                    assertThat(result.getData()).containsEntry("message", "Monitor data temporarily unavailable");
                    assertThat(result.isTimedOut()).isFalse();
                })
                .verifyComplete();
    }

    @Test
    void fallbackOfIncompatibleTypeIsUnavailable() {
        when(transport.send(anyString(), anyString(), any(), any(Duration.class), eq(Integer.class)))
                .thenReturn(Mono.error(new TransportException("broker down")));

        StepVerifier.create(dispatcher.request(rpc("monitor.count"), Integer.class))
                .expectError(ServiceUnavailableException.class)
                .verify();
    }

    @Test
    @SuppressWarnings("rawtypes")
    void slowCallIsFlaggedAsTimedOut() {
        when(transport.send(anyString(), anyString(), any(), any(Duration.class), eq(Map.class)))
                .thenReturn(Mono.never());

        StepVerifier.create(dispatcher.request(RequestOptions.builder()
                                .exchange(EXCHANGE)
                                .routingKey("monitor.metrics")
                                .timeout(600L)
                                .build(),
                        Map.class))
                .assertNext(result -> {
                    assertThat(result.isTimedOut()).isTrue();
                    assertThat(result.isFromFallback()).isTrue();
                })
                .verifyComplete();
    }

    @Test
    void healthCheckFallsBackToUnhealthyResponse() {
        when(transport.send(anyString(), anyString(), any(), any(Duration.class), eq(Map.class)))
                .thenReturn(Mono.error(new TransportException("no route")));

        StepVerifier.create(dispatcher.healthCheck("billing", "billing.health"))
                .assertNext(result -> {
                    assertThat(result.getOperation()).isEqualTo(TimeoutOperation.HEALTH_CHECK);
                    assertThat(result.getTimeout()).isEqualTo(1500);
                    assertThat(result.getData())
                            .containsEntry("status", "unhealthy")
                            .containsEntry("service", "billing-service")
                            .containsEntry("error", "Circuit breaker fallback")
                            .containsKey("timestamp");
                })
                .verifyComplete();

        verify(transport).send(eq(EXCHANGE), eq("billing.health"), any(), any(Duration.class), eq(Map.class));
        assertThat(manager.find(BreakerKey.of("billing-service", "health-check"))).isPresent();
    }

    @Test
    void openBreakerRejectsWithoutCallingTheTransport() {
        when(transport.send(anyString(), anyString(), any(), any(Duration.class), eq(String.class)))
                .thenReturn(Mono.error(new TransportException("broker down")));
        for (int i = 0; i < 5; i++) {
            StepVerifier.create(dispatcher.request(rpc("auth.login"), String.class))
                    .expectError(ServiceUnavailableException.class)
                    .verify();
        }

        StepVerifier.create(dispatcher.request(rpc("auth.login"), String.class))
                .expectErrorSatisfies(error -> assertThat(error)
                        .isInstanceOf(ServiceUnavailableException.class)
                        .hasCauseInstanceOf(CircuitBreakerOpenException.class))
                .verify();

        verify(transport, times(5)).send(anyString(), anyString(), any(), any(Duration.class), eq(String.class));
        assertThat(dispatcher.getCircuitBreakerMetrics("auth-service", TimeoutOperation.RPC_CALL))
                .hasValueSatisfying(metrics -> {
                    assertThat(metrics.getState()).isEqualTo(CircuitBreakerState.OPEN);
                    assertThat(metrics.getRejectionCount()).isEqualTo(1);
                });
        assertThat(dispatcher.resetCircuitBreaker("auth", TimeoutOperation.RPC_CALL)).isTrue();
    }

    @Test
    void publishUsesEventPublishBreaker() {
        when(transport.publish(anyString(), anyString(), any())).thenReturn(Mono.empty());

        StepVerifier.create(dispatcher.publish(PublishOptions.builder()
                        .exchange("capsule.events")
                        .routingKey("billing.invoice.created")
                        .payload(Map.of("invoiceId", 42))
                        .build()))
                .verifyComplete();

        assertThat(manager.find(BreakerKey.of("billing-service", "event-publish")))
                .hasValueSatisfying(cb -> {
                    assertThat(cb.getSettings().getTimeout()).isEqualTo(5000);
                    assertThat(cb.getSettings().getVolumeThreshold()).isEqualTo(5);
                });
    }

    @Test
    void publishFailuresAreAbsorbed() {
        when(transport.publish(anyString(), anyString(), any()))
                .thenReturn(Mono.error(new TransportException("exchange missing")));

        StepVerifier.create(dispatcher.publish(PublishOptions.builder()
                        .exchange("capsule.events")
                        .routingKey("deploy.finished")
                        .build()))
                .verifyComplete();

        assertThat(dispatcher.getCircuitBreakerHealth("deploy", TimeoutOperation.EVENT_PUBLISH))
                .hasValueSatisfying(health -> assertThat(health.getMetrics().getFailureCount()).isEqualTo(1));
    }

    @Test
    void publishPropagatesCallerErrors() {
        when(transport.publish(anyString(), anyString(), any()))
                .thenReturn(Mono.error(new ValidationException("payload too large")));

        StepVerifier.create(dispatcher.publish(PublishOptions.builder()
                        .exchange("capsule.events")
                        .routingKey("deploy.finished")
                        .build()))
                .expectError(ValidationException.class)
                .verify();
    }

    @Test
    void passThroughs() {
        assertThat(dispatcher.resolveTimeout("deploy", TimeoutOperation.RPC_CALL).getTimeout()).isEqualTo(7500);
        assertThat(dispatcher.resetCircuitBreaker("deploy", TimeoutOperation.RPC_CALL)).isFalse();
        assertThat(dispatcher.getAllCircuitBreakerHealth()).isEmpty();
        assertThat(dispatcher.getTimeoutDebugInfo()).containsEntry("environment", "test");
        assertThat(dispatcher.getCircuitBreakerDebugInfo()).containsEntry("totalCircuitBreakers", 0);
        verify(transport, never()).publish(anyString(), anyString(), any());
    }
}
