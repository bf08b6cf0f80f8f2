package com.example.resilience.monitoring;

import lombok.Value;

@Value
public class ResponseTimePercentiles {
    double p50;
    double p95;
    double p99;
    double average;
    int count;
}
