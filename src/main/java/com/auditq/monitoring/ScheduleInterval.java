package com.auditq.monitoring;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.time.OffsetDateTime;
import java.time.temporal.ChronoUnit;
import java.util.Locale;

public enum ScheduleInterval {
    HOURLY(ChronoUnit.HOURS),
    DAILY(ChronoUnit.DAYS),
    WEEKLY(ChronoUnit.WEEKS);

    private final ChronoUnit unit;

    ScheduleInterval(ChronoUnit unit) {
        this.unit = unit;
    }

    /**
     * One interval after {@code previous}.
     */
    public OffsetDateTime after(OffsetDateTime previous) {
        return previous.plus(1, unit);
    }

    /**
     * First slot of the grid {@code anchor + k * interval} with {@code k >= 1} that lies after
     * {@code now}.
     */
    public OffsetDateTime firstAfter(OffsetDateTime anchor, OffsetDateTime now) {
        long elapsed = Math.max(0, unit.between(anchor, now));
        return anchor.plus(elapsed + 1, unit);
    }

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static ScheduleInterval fromValue(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("scheduleInterval must not be blank");
        }
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
