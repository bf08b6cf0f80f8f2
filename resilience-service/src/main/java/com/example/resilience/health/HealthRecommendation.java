package com.example.resilience.health;

import lombok.Value;

@Value
public class HealthRecommendation {
    public static final String SYSTEM = "system";

    Type type;
    String service;
    String message;
    String action;

    public enum Type {
        INFO,
        WARNING,
        ERROR
    }
}
