package com.auditq.monitoring;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Why a monitoring run started. {@code SCHEDULED} runs are created only by the recurring monitor.
 */
public enum RunTrigger {
    MANUAL,
    SCHEDULED,
    UPSTREAM_EVENT;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static RunTrigger fromValue(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("triggerType must not be blank");
        }
        String normalized = value.trim().replace('-', '_').toUpperCase(Locale.ROOT);
        // Deployment hooks are the upstream event monitoring runs react to.
        if (normalized.equals("DEPLOYMENT_HOOK")) {
            return UPSTREAM_EVENT;
        }
        for (RunTrigger trigger : values()) {
            if (trigger.name().equals(normalized)) {
                return trigger;
            }
        }
        throw new IllegalArgumentException("Unsupported triggerType: " + value);
    }
}
