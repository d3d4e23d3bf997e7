package com.auditq;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Why a job was created. Each trigger type carries exactly one {@link TriggerData} variant.
 */
public enum TriggerType {
    MANUAL(TriggerData.Manual.class),
    SCHEDULED(TriggerData.Scheduled.class),
    UPSTREAM_EVENT(TriggerData.UpstreamEvent.class),
    FILE_UPLOAD(TriggerData.FileUpload.class);

    private final Class<? extends TriggerData> dataClass;

    TriggerType(Class<? extends TriggerData> dataClass) {
        this.dataClass = dataClass;
    }

    public Class<? extends TriggerData> dataClass() {
        return dataClass;
    }

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Accepts both {@code upstream_event} and {@code upstream-event} spellings.
     */
    @JsonCreator
    public static TriggerType fromValue(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("triggerType must not be blank");
        }
        String normalized = value.trim().replace('-', '_').toUpperCase(Locale.ROOT);
        for (TriggerType type : values()) {
            if (type.name().equals(normalized)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unsupported triggerType: " + value);
    }

    public static TriggerType forDataClass(Class<?> dataClass) {
        for (TriggerType type : values()) {
            if (type.dataClass.equals(dataClass)) {
                return type;
            }
        }
        throw new IllegalArgumentException("No trigger type is bound to " + dataClass.getName());
    }
}
