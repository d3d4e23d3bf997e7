package com.auditq.monitoring;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum AlertSeverity {
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL;

    /**
     * Severity of a score that fell {@code shortfall} points below its threshold.
     */
    public static AlertSeverity forShortfall(double shortfall) {
        if (shortfall > 30) {
            return CRITICAL;
        }
        if (shortfall > 20) {
            return HIGH;
        }
        if (shortfall > 10) {
            return MEDIUM;
        }
        return LOW;
    }

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }
}
