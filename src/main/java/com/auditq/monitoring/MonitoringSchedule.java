package com.auditq.monitoring;

import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;

/**
 * Calendar arithmetic for recurring monitoring: peak windows and daily run caps.
 */
public final class MonitoringSchedule {

    private MonitoringSchedule() {
    }

    /**
     * Whether {@code now}, seen in {@code zone}, falls in {@code [peakStart, peakEnd)}. A window whose end
     * precedes its start wraps midnight; a window with equal bounds is empty.
     */
    public static boolean isWithinPeak(OffsetDateTime now, ZoneId zone, LocalTime peakStart, LocalTime peakEnd) {
        if (peakStart == null || peakEnd == null || peakStart.equals(peakEnd)) {
            return false;
        }
        LocalTime local = now.atZoneSameInstant(zone).toLocalTime();
        if (peakStart.isBefore(peakEnd)) {
            return !local.isBefore(peakStart) && local.isBefore(peakEnd);
        }
        return !local.isBefore(peakStart) || local.isBefore(peakEnd);
    }

    public static boolean isWithinPeak(MonitoringConfig config, OffsetDateTime now, ZoneId zone) {
        return config.isAvoidPeakHours() && isWithinPeak(now, zone, config.getPeakStart(), config.getPeakEnd());
    }

    /**
     * Start of the calendar day containing {@code now} in {@code zone}, as an offset timestamp.
     */
    public static OffsetDateTime startOfDay(OffsetDateTime now, ZoneId zone) {
        return now.atZoneSameInstant(zone).toLocalDate().atStartOfDay(zone).toOffsetDateTime();
    }

    /**
     * Next run time after a claim. Stays on the grid of the previous schedule and skips the slots
     * already missed, so a config held back by peak hours, the daily cap or deactivation runs once
     * rather than once per missed slot. One interval past {@code now} when the config never had a
     * schedule.
     */
    public static OffsetDateTime nextRunAt(ScheduleInterval interval, OffsetDateTime previousNextRunAt,
            OffsetDateTime now) {
        if (previousNextRunAt == null) {
            return interval.after(now);
        }
        return interval.firstAfter(previousNextRunAt, now);
    }
}
