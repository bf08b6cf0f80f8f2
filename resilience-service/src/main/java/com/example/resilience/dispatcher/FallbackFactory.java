package com.example.resilience.dispatcher;

import com.example.resilience.exception.ServiceUnavailableException;
import com.example.resilience.timeout.ServiceTier;
import com.example.resilience.timeout.TimeoutOperation;
import com.example.resilience.timeout.TimeoutResolver;
import com.example.resilience.utils.ServiceNames;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Function;

/**
 * Fallbacks por servicio:
 * <ul>
 *   <li>health checks: respuesta sintética "unhealthy"</li>
 *   <li>servicios no críticos: valor por defecto</li>
 *   <li>resto: {@link ServiceUnavailableException}</li>
 * </ul>
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class FallbackFactory {

    static final String BILLING_SERVICE = "billing-service";

    private final TimeoutResolver timeoutResolver;
    private final Clock clock;

    public <T> Function<Throwable, Mono<T>> forRequest(String serviceName,
                                                       TimeoutOperation operation,
                                                       String routingKey,
                                                       Class<T> responseType) {
        return error -> Mono.defer(() -> {
            log.warn("{} fallback triggered for {} ({}): {}",
                    ServiceNames.displayName(serviceName), routingKey, operation.getValue(), error.getMessage());

            Object value;
            if (operation == TimeoutOperation.HEALTH_CHECK) {
                value = unhealthyResponse(serviceName);
            } else if (timeoutResolver.tierOf(serviceName) == ServiceTier.NON_CRITICAL) {
                Map<String, Object> defaults = new LinkedHashMap<>();
                defaults.put("message", ServiceNames.displayName(serviceName) + " data temporarily unavailable");
                value = defaults;
            } else {
                return Mono.error(new ServiceUnavailableException(serviceName, unavailableMessage(serviceName), error));
            }

            if (!responseType.isInstance(value)) {
                return Mono.error(new ServiceUnavailableException(serviceName,
                        unavailableMessage(serviceName) + " (no fallback for " + responseType.getSimpleName() + ")", error));
            }
            return Mono.just(responseType.cast(value));
        });
    }

    public Function<Throwable, Mono<Void>> forPublish(String serviceName, String routingKey) {
        return error -> {
            log.warn("Event publishing fallback triggered for {} ({}): {}", serviceName, routingKey, error.getMessage());
            return Mono.empty();
        };
    }

    private Map<String, Object> unhealthyResponse(String serviceName) {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("status", "unhealthy");
        response.put("service", serviceName);
        response.put("timestamp", clock.instant().toString());
        response.put("error", "Circuit breaker fallback");
        return response;
    }

    static String unavailableMessage(String serviceName) {
        if (ServiceNames.UNKNOWN_SERVICE.equals(serviceName)) {
            return "Service temporarily unavailable";
        }
        String message = ServiceNames.displayName(serviceName) + " service temporarily unavailable";
        if (BILLING_SERVICE.equals(serviceName)) {
            message += " - operation queued for retry";
        }
        return message;
    }
}
