package com.example.resilience.timeout;

import com.example.resilience.config.TimeoutProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class TimeoutResolverTest {

    private TimeoutProperties properties;

    @BeforeEach
    void setUp() {
        properties = new TimeoutProperties();
    }

    private TimeoutResolver resolverFor(String environment) {
        properties.setEnvironment(environment);
        return new TimeoutResolver(properties);
    }

    @Test
    void explicitTimeoutWinsAndIsNotScaled() {
        TimeoutResolution resolution = resolverFor("production")
                .resolve("auth-service", TimeoutOperation.RPC_CALL, 7000L);

        assertThat(resolution.getTimeout()).isEqualTo(7000);
        assertThat(resolution.getSource()).isEqualTo(TimeoutSource.CALLER_OVERRIDE);
        assertThat(resolution.isScaled()).isFalse();
        assertThat(resolution.getTier()).isEqualTo(ServiceTier.CRITICAL);
    }

    @Test
    void explicitTimeoutIsFlooredAtMinimum() {
        TimeoutResolution resolution = resolverFor("production")
                .resolve("auth-service", TimeoutOperation.RPC_CALL, 100L);

        assertThat(resolution.getTimeout()).isEqualTo(500);
    }

    @Test
    void healthCheckOperationOverridesServiceTimeout() {
        TimeoutResolution resolution = resolverFor("production")
                .resolve("billing-service", TimeoutOperation.HEALTH_CHECK);

        assertThat(resolution.getSource()).isEqualTo(TimeoutSource.OPERATION_OVERRIDE);
        assertThat(resolution.getTimeout()).isEqualTo(4500);
        assertThat(resolution.getOriginalTimeout()).isEqualTo(3000L);
        assertThat(resolution.getScaleFactor()).isEqualTo(1.5);
    }

    @Test
    void serviceSpecificTimeoutIsScaledForProduction() {
        TimeoutResolution resolution = resolverFor("prod").resolve("billing-service");

        assertThat(resolution.getSource()).isEqualTo(TimeoutSource.SERVICE_OVERRIDE);
        assertThat(resolution.getTimeout()).isEqualTo(12000);
    }

    @Test
    void developmentScalesDown() {
        TimeoutResolution resolution = resolverFor("development").resolve("auth-service");

        assertThat(resolution.getTimeout()).isEqualTo(1600);
        assertThat(resolution.isScaled()).isTrue();
    }

    @Test
    void tierTimeoutIsUsedWhenServiceHasNoSpecificTimeout() {
        TimeoutProperties.ServiceTimeout reports = new TimeoutProperties.ServiceTimeout();
        reports.setTier(ServiceTier.NON_CRITICAL);
        properties.getServices().put("reports-service", reports);

        TimeoutResolution resolution = resolverFor("production").resolve("reports");

        assertThat(resolution.getSource()).isEqualTo(TimeoutSource.TIER_DEFAULT);
        assertThat(resolution.getTier()).isEqualTo(ServiceTier.NON_CRITICAL);
        assertThat(resolution.getTimeout()).isEqualTo(15000);
    }

    @Test
    void unknownServiceFallsBackToGlobalDefault() {
        TimeoutResolution resolution = resolverFor("staging").resolve("inventory-service");

        assertThat(resolution.getSource()).isEqualTo(TimeoutSource.GLOBAL_DEFAULT);
        assertThat(resolution.getTier()).isEqualTo(ServiceTier.STANDARD);
        assertThat(resolution.getTimeout()).isEqualTo(7500);
    }

    @Test
    void scaledTimeoutIsFlooredAtMinimum() {
        properties.setMinimumTimeout(1500);
        TimeoutResolution resolution = resolverFor("test").resolve("auth-service");

        // 2000 * 0.5 = 1000 < 1500
        assertThat(resolution.getTimeout()).isEqualTo(1500);
    }

    @Test
    void disabledScalingKeepsConfiguredValue() {
        properties.setEnableScaling(false);
        TimeoutResolution resolution = resolverFor("production").resolve("deploy-service");

        assertThat(resolution.getTimeout()).isEqualTo(15000);
        assertThat(resolution.isScaled()).isFalse();
        assertThat(resolution.getScaleFactor()).isNull();
    }

    @Test
    void unknownEnvironmentIsTreatedAsDevelopment() {
        TimeoutResolver resolver = resolverFor("qa-cluster");

        assertThat(resolver.getEnvironment()).isEqualTo(AppEnvironment.DEVELOPMENT);
        assertThat(resolver.scaleFactor()).isEqualTo(0.8);
    }

    @Test
    void routingKeyStyleNamesAreNormalized() {
        TimeoutResolver resolver = resolverFor("production");

        assertThat(resolver.tierOf("auth.register")).isEqualTo(ServiceTier.CRITICAL);
        assertThat(resolver.tierOf("monitor")).isEqualTo(ServiceTier.NON_CRITICAL);
        assertThat(resolver.tierOf("unknown")).isEqualTo(ServiceTier.STANDARD);
    }

    @Test
    void debugInfoListsConfiguredServices() {
        assertThat(resolverFor("test").getDebugInfo())
                .containsEntry("environment", "test")
                .containsEntry("scaleFactor", 0.5)
                .containsKey("services");
    }

    @Test
    void operationValuesAcceptSeveralSpellings() {
        assertThat(TimeoutOperation.fromValue("HEALTH_CHECK")).contains(TimeoutOperation.HEALTH_CHECK);
        assertThat(TimeoutOperation.fromValue("database-query")).contains(TimeoutOperation.DATABASE_QUERY);
        assertThat(TimeoutOperation.fromValue("nope")).isEmpty();
    }
}
