package com.example.resilience.monitoring;

import java.util.Locale;

public enum AlertSeverity {
    INFO,
    WARNING,
    ERROR;

    public static AlertSeverity parse(String value) {
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
