package com.auditq;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;

/**
 * Lifecycle of a job. {@code COMPLETED}, {@code FAILED} and {@code CANCELLED} are terminal.
 */
public enum JobStatus {
    QUEUED,
    RUNNING,
    RETRYING,
    COMPLETED,
    FAILED,
    CANCELLED;

    /**
     * States a worker may claim from once {@code scheduledAt} has passed.
     */
    public static final Set<JobStatus> CLAIMABLE = Set.copyOf(EnumSet.of(QUEUED, RETRYING));

    /**
     * States that count against the per-resource concurrency cap.
     */
    public static final Set<JobStatus> ACTIVE = Set.copyOf(EnumSet.of(QUEUED, RUNNING, RETRYING));

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED;
    }

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static JobStatus fromValue(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Job status must not be null");
        }
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
