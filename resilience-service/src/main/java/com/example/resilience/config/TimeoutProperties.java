package com.example.resilience.config;

import com.example.resilience.timeout.ServiceTier;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Timeouts base por operación, por tier y por servicio, más el escalado por entorno.
 * Todos los valores en milisegundos.
 */
@ConfigurationProperties(prefix = "resilience.timeout")
@Validated
@Getter
@Setter
public class TimeoutProperties {

    /**
     * Entorno de ejecución (test, local, development, staging, production, canary)
     */
    private String environment = "development";

    @Min(1)
    private long defaultTimeout = 5000;

    @Min(1)
    private long healthCheckTimeout = 3000;

    @Min(1)
    private long criticalServiceTimeout = 2000;

    @Min(1)
    private long standardServiceTimeout = 5000;

    @Min(1)
    private long nonCriticalServiceTimeout = 10000;

    @Min(1)
    private long databaseQueryTimeout = 10000;

    @Min(1)
    private long httpRequestTimeout = 30000;

    @Valid
    private Map<String, ServiceTimeout> services = defaultServices();

    private boolean enableScaling = true;

    @DecimalMin("0.1")
    private double productionScaleFactor = 1.5;

    @DecimalMin("0.1")
    private double developmentScaleFactor = 0.8;

    @DecimalMin("0.1")
    private double testScaleFactor = 0.5;

    /**
     * Suelo aplicado a cualquier timeout resuelto
     */
    @Min(1)
    private long minimumTimeout = 500;

    @Getter
    @Setter
    public static class ServiceTimeout {
        @NotNull
        private ServiceTier tier = ServiceTier.STANDARD;

        /**
         * Timeout específico del servicio; si falta se usa el del tier
         */
        @Min(1)
        private Long timeout;

        public static ServiceTimeout of(ServiceTier tier, Long timeout) {
            ServiceTimeout st = new ServiceTimeout();
            st.setTier(tier);
            st.setTimeout(timeout);
            return st;
        }
    }

    private static Map<String, ServiceTimeout> defaultServices() {
        Map<String, ServiceTimeout> map = new LinkedHashMap<>();
        map.put("auth-service", ServiceTimeout.of(ServiceTier.CRITICAL, 2000L));
        map.put("billing-service", ServiceTimeout.of(ServiceTier.STANDARD, 8000L));
        map.put("deploy-service", ServiceTimeout.of(ServiceTier.STANDARD, 15000L));
        map.put("monitor-service", ServiceTimeout.of(ServiceTier.NON_CRITICAL, 10000L));
        return map;
    }
}
