package com.example.resilience.config;

import com.example.resilience.messaging.MessageTransport;
import com.example.resilience.messaging.UnconfiguredMessageTransport;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class MessagingConfig {

    @Bean
    @ConditionalOnMissingBean(MessageTransport.class)
    public MessageTransport messageTransport() {
        return new UnconfiguredMessageTransport();
    }
}
