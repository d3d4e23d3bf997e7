package com.auditq.monitoring;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;

public enum RunStatus {
    PENDING,
    RUNNING,
    COMPLETED,
    FAILED;

    /**
     * Runs whose remaining targets still count as pending work.
     */
    public static final Set<RunStatus> UNFINISHED = Set.copyOf(EnumSet.of(PENDING, RUNNING));

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }
}
