package com.example.resilience.config;

import com.example.resilience.recovery.RecoveryStrategyType;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Propiedades configurables de los circuit breakers.
 * Los valores por defecto reproducen la configuración estándar de la plataforma;
 * application.yml los expone a través de variables de entorno.
 */
@ConfigurationProperties(prefix = "resilience.circuit-breaker")
@Validated
@Getter
@Setter
public class CircuitBreakerProperties {

    /**
     * Habilitar/deshabilitar todos los circuit breakers
     */
    private boolean enabled = true;

    @Valid
    @NotNull
    private Defaults defaults = new Defaults();

    /**
     * Overrides por servicio (auth-service, billing-service...)
     */
    @Valid
    private Map<String, BreakerOverride> services = defaultServices();

    /**
     * Overrides por tipo de operación (health-check, database-query, http-request)
     */
    @Valid
    private Map<String, BreakerOverride> operations = defaultOperations();

    /**
     * Estrategias de recuperación por servicio; la clave "default" aplica al resto
     */
    @Valid
    private Map<String, Recovery> recovery = defaultRecovery();

    @Valid
    @NotNull
    private Monitoring monitoring = new Monitoring();

    @Getter
    @Setter
    public static class Defaults {
        @Min(1)
        private long timeout = 5000;

        @Min(0)
        @Max(100)
        private int errorThresholdPercentage = 50;

        @Min(1)
        private long resetTimeout = 60000;

        @Min(1)
        private int volumeThreshold = 10;

        @Min(1)
        private long rollingCountTimeout = 60000;

        @Min(1)
        private int rollingCountBuckets = 10;
    }

    /**
     * Valores parciales: sólo los campos informados sustituyen a los heredados.
     */
    @Getter
    @Setter
    public static class BreakerOverride {
        private Boolean enabled;

        @Min(1)
        private Long timeout;

        @Min(0)
        @Max(100)
        private Integer errorThresholdPercentage;

        @Min(1)
        private Long resetTimeout;

        @Min(1)
        private Integer volumeThreshold;

        @Min(1)
        private Long rollingCountTimeout;

        @Min(1)
        private Integer rollingCountBuckets;

        public static BreakerOverride of(int errorThresholdPercentage, long resetTimeout, Integer volumeThreshold) {
            BreakerOverride o = new BreakerOverride();
            o.setErrorThresholdPercentage(errorThresholdPercentage);
            o.setResetTimeout(resetTimeout);
            o.setVolumeThreshold(volumeThreshold);
            return o;
        }
    }

    @Getter
    @Setter
    public static class Recovery {
        @NotNull
        private RecoveryStrategyType strategy = RecoveryStrategyType.EXPONENTIAL_BACKOFF;

        @Min(0)
        private long baseDelay = 1000;

        @Min(0)
        private long maxDelay = 60000;

        private double multiplier = 2.0;

        @Min(1)
        private int maxAttempts = 5;

        public static Recovery of(RecoveryStrategyType strategy, long baseDelay, long maxDelay,
                                  double multiplier, int maxAttempts) {
            Recovery r = new Recovery();
            r.setStrategy(strategy);
            r.setBaseDelay(baseDelay);
            r.setMaxDelay(maxDelay);
            r.setMultiplier(multiplier);
            r.setMaxAttempts(maxAttempts);
            return r;
        }
    }

    @Getter
    @Setter
    public static class Monitoring {
        private boolean enabled = true;

        @Min(1000)
        private long metricsInterval = 60000;

        @Min(1000)
        private long healthCheckInterval = 30000;

        @Min(0)
        @Max(100)
        private double alertThreshold = 80;
    }

    private static Map<String, BreakerOverride> defaultServices() {
        Map<String, BreakerOverride> map = new LinkedHashMap<>();
        map.put("auth-service", BreakerOverride.of(40, 30000, 5));
        map.put("billing-service", BreakerOverride.of(60, 120000, 3));
        map.put("deploy-service", BreakerOverride.of(70, 300000, 2));
        map.put("monitor-service", BreakerOverride.of(80, 180000, 5));
        return map;
    }

    private static Map<String, BreakerOverride> defaultOperations() {
        Map<String, BreakerOverride> map = new LinkedHashMap<>();
        BreakerOverride healthCheck = BreakerOverride.of(30, 15000, 3);
        healthCheck.setTimeout(3000L);
        map.put("health-check", healthCheck);
        BreakerOverride databaseQuery = BreakerOverride.of(40, 60000, null);
        databaseQuery.setTimeout(10000L);
        map.put("database-query", databaseQuery);
        BreakerOverride httpRequest = BreakerOverride.of(60, 90000, null);
        httpRequest.setTimeout(30000L);
        map.put("http-request", httpRequest);
        return map;
    }

    private static Map<String, Recovery> defaultRecovery() {
        Map<String, Recovery> map = new HashMap<>();
        map.put("default", Recovery.of(RecoveryStrategyType.EXPONENTIAL_BACKOFF, 1000, 60000, 2, 5));
        map.put("auth-service", Recovery.of(RecoveryStrategyType.EXPONENTIAL_BACKOFF, 500, 30000, 1.5, 3));
        map.put("billing-service", Recovery.of(RecoveryStrategyType.LINEAR_BACKOFF, 2000, 120000, 1, 3));
        map.put("deploy-service", Recovery.of(RecoveryStrategyType.EXPONENTIAL_BACKOFF, 5000, 300000, 2, 2));
        map.put("monitor-service", Recovery.of(RecoveryStrategyType.IMMEDIATE, 1000, 60000, 1, 10));
        return map;
    }
}
