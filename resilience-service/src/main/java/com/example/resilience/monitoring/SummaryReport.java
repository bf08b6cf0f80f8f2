package com.example.resilience.monitoring;

import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;

@Value
@Builder
public class SummaryReport {
    Overview overview;
    List<Issue> topIssues;
    List<CircuitBreakerAlert> recentAlerts;
    Map<String, TrendSummary> trends;

    @Value
    @Builder
    public static class Overview {
        int totalServices;
        int healthyServices;
        int degradedServices;
        int unhealthyServices;
        int openCircuitBreakers;
    }

    @Value
    public static class Issue {
        String service;
        String issue;
        IssueSeverity severity;
        String recommendation;
    }

    public enum IssueSeverity {
        LOW,
        MEDIUM,
        HIGH
    }

    @Value
    public static class TrendSummary {
        ErrorRateTrend.Trend trend;
        double change;
    }
}
