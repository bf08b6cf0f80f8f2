package com.example.resilience.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "resilience.dispatcher")
@Validated
@Getter
@Setter
public class DispatcherProperties {

    /**
     * Exchange usado por los health checks
     */
    @NotBlank
    private String commandsExchange = "capsule.commands";

    @Min(1)
    private long publishTimeout = 5000;

    @Min(1)
    private int publishVolumeThreshold = 5;
}
