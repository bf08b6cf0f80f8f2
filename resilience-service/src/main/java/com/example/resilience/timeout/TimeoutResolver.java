package com.example.resilience.timeout;

import com.example.resilience.config.TimeoutProperties;
import com.example.resilience.utils.ServiceNames;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Calcula el timeout efectivo de una llamada (servicio, operación).
 *
 * Precedencia: override explícito del llamante → override por operación
 * (health-check, database-query, http-request) → timeout específico del servicio →
 * timeout del tier del servicio → timeout global. Después se aplica el factor de
 * escala del entorno (salvo al override explícito) y el suelo mínimo.
 *
 * Nunca lanza excepciones: ante una configuración incompleta devuelve el timeout global.
 */
@Component
public class TimeoutResolver {

    private static final Logger log = LoggerFactory.getLogger(TimeoutResolver.class);
    private static final long FALLBACK_TIMEOUT = 5000;

    private final TimeoutProperties properties;
    private final AppEnvironment environment;

    public TimeoutResolver(TimeoutProperties properties) {
        this.properties = properties;
        this.environment = AppEnvironment.parse(properties.getEnvironment());
    }

    public TimeoutResolution resolve(String serviceName) {
        return resolve(serviceName, TimeoutOperation.RPC_CALL, null);
    }

    public TimeoutResolution resolve(String serviceName, TimeoutOperation operation) {
        return resolve(serviceName, operation, null);
    }

    public TimeoutResolution resolve(String serviceName, TimeoutOperation operation, Long explicitTimeout) {
        try {
            return doResolve(serviceName, operation != null ? operation : TimeoutOperation.RPC_CALL, explicitTimeout);
        } catch (RuntimeException e) {
            log.warn("Timeout resolution failed for {} ({}), using global default: {}",
                    serviceName, operation, e.getMessage());
            return TimeoutResolution.builder()
                    .timeout(globalDefault())
                    .source(TimeoutSource.GLOBAL_DEFAULT)
                    .tier(ServiceTier.STANDARD)
                    .scaled(false)
                    .build();
        }
    }

    private TimeoutResolution doResolve(String serviceName, TimeoutOperation operation, Long explicitTimeout) {
        String service = ServiceNames.normalize(serviceName);
        TimeoutProperties.ServiceTimeout serviceTimeout = properties.getServices().get(service);
        ServiceTier tier = serviceTimeout != null && serviceTimeout.getTier() != null
                ? serviceTimeout.getTier()
                : ServiceTier.STANDARD;

        if (explicitTimeout != null && explicitTimeout > 0) {
            return TimeoutResolution.builder()
                    .timeout(Math.max(explicitTimeout, properties.getMinimumTimeout()))
                    .source(TimeoutSource.CALLER_OVERRIDE)
                    .tier(tier)
                    .scaled(false)
                    .build();
        }

        long timeout;
        TimeoutSource source;
        Long operationTimeout = operationTimeout(operation);
        if (operationTimeout != null) {
            timeout = operationTimeout;
            source = TimeoutSource.OPERATION_OVERRIDE;
        } else if (serviceTimeout != null && serviceTimeout.getTimeout() != null) {
            timeout = serviceTimeout.getTimeout();
            source = TimeoutSource.SERVICE_OVERRIDE;
        } else if (serviceTimeout != null) {
            timeout = tierTimeout(tier);
            source = TimeoutSource.TIER_DEFAULT;
        } else {
            timeout = globalDefault();
            source = TimeoutSource.GLOBAL_DEFAULT;
        }

        double scaleFactor = scaleFactor();
        boolean scaled = properties.isEnableScaling() && scaleFactor != 1.0;
        long finalTimeout = scaled ? Math.round(timeout * scaleFactor) : timeout;
        finalTimeout = Math.max(finalTimeout, properties.getMinimumTimeout());

        log.debug("Resolved timeout for {} ({}): {}ms from {} (tier={}, scaled={})",
                service, operation.getValue(), finalTimeout, source, tier, scaled);

        return TimeoutResolution.builder()
                .timeout(finalTimeout)
                .source(source)
                .tier(tier)
                .scaled(scaled)
                .scaleFactor(scaled ? scaleFactor : null)
                .originalTimeout(scaled ? timeout : null)
                .build();
    }

    /**
     * Tier configurado para el servicio; STANDARD si no está clasificado.
     */
    public ServiceTier tierOf(String serviceName) {
        TimeoutProperties.ServiceTimeout serviceTimeout = properties.getServices().get(ServiceNames.normalize(serviceName));
        return serviceTimeout != null && serviceTimeout.getTier() != null ? serviceTimeout.getTier() : ServiceTier.STANDARD;
    }

    public AppEnvironment getEnvironment() {
        return environment;
    }

    public double scaleFactor() {
        switch (environment) {
            case PRODUCTION:
            case STAGING:
            case CANARY:
                return properties.getProductionScaleFactor();
            case DEVELOPMENT:
            case LOCAL:
                return properties.getDevelopmentScaleFactor();
            case TEST:
                return properties.getTestScaleFactor();
            default:
                return 1.0;
        }
    }

    public Map<String, Object> getDebugInfo() {
        Map<String, Object> services = new LinkedHashMap<>();
        for (String service : properties.getServices().keySet()) {
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("rpc", resolve(service, TimeoutOperation.RPC_CALL));
            entry.put("healthCheck", resolve(service, TimeoutOperation.HEALTH_CHECK));
            services.put(service, entry);
        }

        Map<String, Object> defaults = new LinkedHashMap<>();
        defaults.put("rpc", properties.getDefaultTimeout());
        defaults.put("healthCheck", properties.getHealthCheckTimeout());
        defaults.put("database", properties.getDatabaseQueryTimeout());
        defaults.put("http", properties.getHttpRequestTimeout());

        Map<String, Object> info = new LinkedHashMap<>();
        info.put("environment", environment.name().toLowerCase());
        info.put("scalingEnabled", properties.isEnableScaling());
        info.put("scaleFactor", scaleFactor());
        info.put("minimumTimeout", properties.getMinimumTimeout());
        info.put("services", services);
        info.put("defaults", defaults);
        return info;
    }

    private Long operationTimeout(TimeoutOperation operation) {
        switch (operation) {
            case HEALTH_CHECK:
                return properties.getHealthCheckTimeout();
            case DATABASE_QUERY:
                return properties.getDatabaseQueryTimeout();
            case HTTP_REQUEST:
                return properties.getHttpRequestTimeout();
            default:
                return null;
        }
    }

    private long tierTimeout(ServiceTier tier) {
        switch (tier) {
            case CRITICAL:
                return properties.getCriticalServiceTimeout();
            case NON_CRITICAL:
                return properties.getNonCriticalServiceTimeout();
            case STANDARD:
            default:
                return properties.getStandardServiceTimeout();
        }
    }

    private long globalDefault() {
        long value = properties.getDefaultTimeout();
        return value > 0 ? value : FALLBACK_TIMEOUT;
    }
}
