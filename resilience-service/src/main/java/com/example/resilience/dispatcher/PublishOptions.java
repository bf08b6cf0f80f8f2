package com.example.resilience.dispatcher;

import lombok.Builder;
import lombok.Value;

import java.util.Map;

@Value
@Builder
public class PublishOptions {
    String exchange;
    String routingKey;
    Object payload;
    String serviceName;
    Map<String, Object> metadata;
}
