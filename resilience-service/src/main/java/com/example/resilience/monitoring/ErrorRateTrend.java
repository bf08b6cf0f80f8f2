package com.example.resilience.monitoring;

import lombok.Value;

import java.time.Instant;
import java.util.List;

@Value
public class ErrorRateTrend {
    double current;
    Trend trend;
    double change;
    List<Point> history;

    public enum Trend {
        INCREASING,
        DECREASING,
        STABLE
    }

    @Value
    public static class Point {
        Instant timestamp;
        double errorRate;
    }
}
