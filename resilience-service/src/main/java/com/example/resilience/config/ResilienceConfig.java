package com.example.resilience.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;

/**
 * Reloj y scheduler compartidos por los breakers, el scheduler de recuperación y el colector.
 */
@Configuration
@EnableConfigurationProperties({
        CircuitBreakerProperties.class,
        TimeoutProperties.class,
        DispatcherProperties.class
})
public class ResilienceConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * Timers de timeout y de recuperación. No ejecuta trabajo bloqueante.
     */
    @Bean(destroyMethod = "dispose")
    public Scheduler resilienceScheduler() {
        return Schedulers.newParallel("resilience-timer", 2, true);
    }
}
