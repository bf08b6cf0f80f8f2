package com.example.resilience.circuitbreaker;

import com.example.resilience.config.CircuitBreakerProperties;
import com.example.resilience.recovery.RecoveryStrategy;
import com.example.resilience.recovery.RecoveryStrategyType;
import com.example.resilience.utils.ServiceNames;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.TreeMap;

/**
 * Fusiona la configuración de un breaker: valores por defecto → servicio → operación → llamante.
 */
@Component
@RequiredArgsConstructor
public class CircuitBreakerConfigResolver {

    private static final String DEFAULT_RECOVERY = "default";

    private final CircuitBreakerProperties properties;

    public CircuitBreakerSettings resolve(BreakerKey key, CircuitBreakerOptions options) {
        CircuitBreakerProperties.Defaults defaults = properties.getDefaults();
        CircuitBreakerSettings.CircuitBreakerSettingsBuilder builder = CircuitBreakerSettings.builder()
                .timeout(defaults.getTimeout())
                .errorThresholdPercentage(defaults.getErrorThresholdPercentage())
                .resetTimeout(defaults.getResetTimeout())
                .volumeThreshold(defaults.getVolumeThreshold())
                .rollingCountTimeout(defaults.getRollingCountTimeout())
                .rollingCountBuckets(defaults.getRollingCountBuckets())
                .enabled(isEnabled(key.serviceName()));

        apply(builder, properties.getServices().get(ServiceNames.normalize(key.serviceName())));
        if (key.hasOperation()) {
            apply(builder, properties.getOperations().get(key.operation()));
        }

        if (options != null) {
            if (options.getTimeout() != null) builder.timeout(options.getTimeout());
            if (options.getErrorThresholdPercentage() != null) builder.errorThresholdPercentage(options.getErrorThresholdPercentage());
            if (options.getResetTimeout() != null) builder.resetTimeout(options.getResetTimeout());
            if (options.getVolumeThreshold() != null) builder.volumeThreshold(options.getVolumeThreshold());
            if (options.getRollingCountTimeout() != null) builder.rollingCountTimeout(options.getRollingCountTimeout());
            if (options.getRollingCountBuckets() != null) builder.rollingCountBuckets(options.getRollingCountBuckets());
            if (options.getErrorFilter() != null) builder.errorFilter(options.getErrorFilter());
        }
        return builder.build();
    }

    private void apply(CircuitBreakerSettings.CircuitBreakerSettingsBuilder builder,
                       CircuitBreakerProperties.BreakerOverride override) {
        if (override == null) {
            return;
        }
        if (override.getTimeout() != null) builder.timeout(override.getTimeout());
        if (override.getErrorThresholdPercentage() != null) builder.errorThresholdPercentage(override.getErrorThresholdPercentage());
        if (override.getResetTimeout() != null) builder.resetTimeout(override.getResetTimeout());
        if (override.getVolumeThreshold() != null) builder.volumeThreshold(override.getVolumeThreshold());
        if (override.getRollingCountTimeout() != null) builder.rollingCountTimeout(override.getRollingCountTimeout());
        if (override.getRollingCountBuckets() != null) builder.rollingCountBuckets(override.getRollingCountBuckets());
    }

    /**
     * Un servicio está protegido si el flag global está activo y su override no lo deshabilita.
     */
    public boolean isEnabled(String serviceName) {
        if (!properties.isEnabled()) {
            return false;
        }
        CircuitBreakerProperties.BreakerOverride override =
                properties.getServices().get(ServiceNames.normalize(serviceName));
        return override == null || override.getEnabled() == null || override.getEnabled();
    }

    public boolean isGloballyEnabled() {
        return properties.isEnabled();
    }

    public RecoveryStrategy recoveryStrategy(String serviceName) {
        Map<String, CircuitBreakerProperties.Recovery> recovery = properties.getRecovery();
        CircuitBreakerProperties.Recovery config = recovery.get(ServiceNames.normalize(serviceName));
        if (config == null) {
            config = recovery.get(DEFAULT_RECOVERY);
        }
        if (config == null) {
            config = new CircuitBreakerProperties.Recovery();
        }
        return RecoveryStrategy.builder()
                .type(config.getStrategy() != null ? config.getStrategy() : RecoveryStrategyType.EXPONENTIAL_BACKOFF)
                .baseDelay(config.getBaseDelay())
                .maxDelay(config.getMaxDelay())
                .multiplier(config.getMultiplier())
                .maxAttempts(config.getMaxAttempts())
                .build();
    }

    public CircuitBreakerProperties.Monitoring monitoring() {
        return properties.getMonitoring();
    }

    public Map<String, Object> getDebugInfo() {
        Map<String, Object> services = new TreeMap<>();
        properties.getServices().keySet()
                .forEach(service -> services.put(service, resolve(BreakerKey.of(service), null)));
        Map<String, Object> operations = new TreeMap<>();
        properties.getOperations().keySet()
                .forEach(op -> operations.put(op, resolve(BreakerKey.of("*", op), null)));

        Map<String, Object> info = new LinkedHashMap<>();
        info.put("enabled", properties.isEnabled());
        info.put("defaults", resolve(BreakerKey.of("*"), null));
        info.put("services", services);
        info.put("operations", operations);
        info.put("monitoring", properties.getMonitoring());
        return info;
    }
}
