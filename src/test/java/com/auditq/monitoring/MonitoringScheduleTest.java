package com.auditq.monitoring;

import org.junit.jupiter.api.Test;

import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;

class MonitoringScheduleTest {

    private static final ZoneId UTC = ZoneOffset.UTC;

    @Test
    void shouldTreatPeakWindowAsHalfOpen() {
        LocalTime start = LocalTime.of(9, 0);
        LocalTime end = LocalTime.of(17, 0);

        assertThat(MonitoringSchedule.isWithinPeak(at(8, 59), UTC, start, end)).isFalse();
        assertThat(MonitoringSchedule.isWithinPeak(at(9, 0), UTC, start, end)).isTrue();
        assertThat(MonitoringSchedule.isWithinPeak(at(16, 59), UTC, start, end)).isTrue();
        assertThat(MonitoringSchedule.isWithinPeak(at(17, 0), UTC, start, end)).isFalse();
    }

    @Test
    void shouldWrapPeakWindowAcrossMidnight() {
        LocalTime start = LocalTime.of(22, 0);
        LocalTime end = LocalTime.of(6, 0);

        assertThat(MonitoringSchedule.isWithinPeak(at(23, 30), UTC, start, end)).isTrue();
        assertThat(MonitoringSchedule.isWithinPeak(at(2, 0), UTC, start, end)).isTrue();
        assertThat(MonitoringSchedule.isWithinPeak(at(6, 0), UTC, start, end)).isFalse();
        assertThat(MonitoringSchedule.isWithinPeak(at(12, 0), UTC, start, end)).isFalse();
    }

    @Test
    void shouldTreatEqualBoundsAsNoPeak() {
        LocalTime noon = LocalTime.NOON;

        assertThat(MonitoringSchedule.isWithinPeak(at(12, 0), UTC, noon, noon)).isFalse();
        assertThat(MonitoringSchedule.isWithinPeak(at(12, 0), UTC, null, noon)).isFalse();
    }

    @Test
    void shouldEvaluatePeakInConfiguredZone() {
        ZoneId berlin = ZoneId.of("Europe/Berlin");

        // 08:30 UTC is 09:30 in Berlin in January.
        assertThat(MonitoringSchedule.isWithinPeak(at(8, 30), berlin, LocalTime.of(9, 0), LocalTime.of(17, 0)))
                .isTrue();
    }

    @Test
    void shouldIgnorePeakWindowUnlessEnabled() {
        MonitoringConfig config = new MonitoringConfig();
        config.setPeakStart(LocalTime.of(9, 0));
        config.setPeakEnd(LocalTime.of(17, 0));

        assertThat(MonitoringSchedule.isWithinPeak(config, at(10, 0), UTC)).isFalse();
        config.setAvoidPeakHours(true);
        assertThat(MonitoringSchedule.isWithinPeak(config, at(10, 0), UTC)).isTrue();
    }

    @Test
    void shouldComputeStartOfDayInZone() {
        OffsetDateTime startUtc = MonitoringSchedule.startOfDay(at(23, 0), UTC);
        OffsetDateTime startTokyo = MonitoringSchedule.startOfDay(at(23, 0), ZoneId.of("Asia/Tokyo"));

        assertThat(startUtc).isEqualTo(OffsetDateTime.of(2025, 1, 6, 0, 0, 0, 0, ZoneOffset.UTC));
        assertThat(startTokyo.toInstant()).isEqualTo(OffsetDateTime.of(2025, 1, 6, 15, 0, 0, 0, ZoneOffset.UTC)
                .toInstant());
    }

    @Test
    void shouldAdvanceToFirstSlotAfterNowOnPreviousGrid() {
        OffsetDateTime previous = at(10, 0);

        assertThat(MonitoringSchedule.nextRunAt(ScheduleInterval.HOURLY, previous, at(10, 0))).isEqualTo(at(11, 0));
        assertThat(MonitoringSchedule.nextRunAt(ScheduleInterval.HOURLY, previous, at(10, 30))).isEqualTo(at(11, 0));
        assertThat(MonitoringSchedule.nextRunAt(ScheduleInterval.HOURLY, previous, at(13, 0))).isEqualTo(at(14, 0));
        assertThat(MonitoringSchedule.nextRunAt(ScheduleInterval.HOURLY, previous, at(17, 20))).isEqualTo(at(18, 0));
        assertThat(MonitoringSchedule.nextRunAt(ScheduleInterval.DAILY, previous, at(13, 0)))
                .isEqualTo(previous.plusDays(1));
        assertThat(MonitoringSchedule.nextRunAt(ScheduleInterval.WEEKLY, previous, at(13, 0)))
                .isEqualTo(previous.plusWeeks(1));
        assertThat(MonitoringSchedule.nextRunAt(ScheduleInterval.DAILY, null, at(13, 0)))
                .isEqualTo(at(13, 0).plusDays(1));
    }

    private static OffsetDateTime at(int hour, int minute) {
        return OffsetDateTime.of(2025, 1, 6, hour, minute, 0, 0, ZoneOffset.UTC);
    }
}
