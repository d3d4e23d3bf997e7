package com.auditq.monitoring;

import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Map;

/**
 * Input for a new monitoring configuration. Optional fields may be {@code null}.
 */
public record MonitoringConfigDefinition(
        String resourceId,
        String name,
        List<String> targets,
        Map<String, Double> thresholds,
        ScheduleInterval scheduleInterval,
        Integer maxRunsPerDay,
        Boolean avoidPeakHours,
        LocalTime peakStart,
        LocalTime peakEnd,
        OffsetDateTime nextRunAt) {

    public static MonitoringConfigDefinition of(String resourceId, List<String> targets,
            Map<String, Double> thresholds, ScheduleInterval scheduleInterval) {
        return new MonitoringConfigDefinition(resourceId, null, targets, thresholds, scheduleInterval, null, null,
                null, null, null);
    }

    public MonitoringConfigDefinition withMaxRunsPerDay(int value) {
        return new MonitoringConfigDefinition(resourceId, name, targets, thresholds, scheduleInterval, value,
                avoidPeakHours, peakStart, peakEnd, nextRunAt);
    }

    public MonitoringConfigDefinition withPeakHours(LocalTime start, LocalTime end) {
        return new MonitoringConfigDefinition(resourceId, name, targets, thresholds, scheduleInterval, maxRunsPerDay,
                true, start, end, nextRunAt);
    }

    public MonitoringConfigDefinition withNextRunAt(OffsetDateTime value) {
        return new MonitoringConfigDefinition(resourceId, name, targets, thresholds, scheduleInterval, maxRunsPerDay,
                avoidPeakHours, peakStart, peakEnd, value);
    }
}
