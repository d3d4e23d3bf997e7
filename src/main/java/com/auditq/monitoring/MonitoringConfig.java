package com.auditq.monitoring;

import com.auditq.internal.JsonColumns;
import jakarta.persistence.Column;
import jakarta.persistence.Convert;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

@Entity
@Table(name = "auditq_monitoring_configs")
public class MonitoringConfig {

    @Id
    private UUID id;

    @Column(name = "resource_id", nullable = false)
    private String resourceId;

    @Column(name = "name")
    private String name;

    @Convert(converter = JsonColumns.StringListConverter.class)
    @Column(name = "targets", nullable = false)
    private List<String> targets = new ArrayList<>();

    @Convert(converter = JsonColumns.ScoreMapConverter.class)
    @Column(name = "thresholds", nullable = false)
    private Map<String, Double> thresholds = new LinkedHashMap<>();

    @Enumerated(EnumType.STRING)
    @Column(name = "schedule_interval", nullable = false)
    private ScheduleInterval scheduleInterval = ScheduleInterval.DAILY;

    @Column(name = "max_runs_per_day")
    private int maxRunsPerDay = 24;

    @Column(name = "avoid_peak_hours")
    private boolean avoidPeakHours;

    @Column(name = "peak_start")
    private LocalTime peakStart;

    @Column(name = "peak_end")
    private LocalTime peakEnd;

    @Column(name = "last_run_at")
    private OffsetDateTime lastRunAt;

    @Column(name = "next_run_at")
    private OffsetDateTime nextRunAt;

    @Column(name = "active")
    private boolean active = true;

    @Column(name = "created_at", updatable = false)
    private OffsetDateTime createdAt;

    public MonitoringConfig() {
    }

    public MonitoringConfig(UUID id, String resourceId, List<String> targets, Map<String, Double> thresholds,
            ScheduleInterval scheduleInterval) {
        this.id = id;
        this.resourceId = resourceId;
        this.targets = new ArrayList<>(targets);
        this.thresholds = new LinkedHashMap<>(thresholds);
        this.scheduleInterval = scheduleInterval;
    }

    public UUID getId() {
        return id;
    }

    public void setId(UUID id) {
        this.id = id;
    }

    public String getResourceId() {
        return resourceId;
    }

    public void setResourceId(String resourceId) {
        this.resourceId = resourceId;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public List<String> getTargets() {
        return targets;
    }

    public void setTargets(List<String> targets) {
        this.targets = targets;
    }

    public Map<String, Double> getThresholds() {
        return thresholds;
    }

    public void setThresholds(Map<String, Double> thresholds) {
        this.thresholds = thresholds;
    }

    public ScheduleInterval getScheduleInterval() {
        return scheduleInterval;
    }

    public void setScheduleInterval(ScheduleInterval scheduleInterval) {
        this.scheduleInterval = scheduleInterval;
    }

    public int getMaxRunsPerDay() {
        return maxRunsPerDay;
    }

    public void setMaxRunsPerDay(int maxRunsPerDay) {
        this.maxRunsPerDay = maxRunsPerDay;
    }

    public boolean isAvoidPeakHours() {
        return avoidPeakHours;
    }

    public void setAvoidPeakHours(boolean avoidPeakHours) {
        this.avoidPeakHours = avoidPeakHours;
    }

    public LocalTime getPeakStart() {
        return peakStart;
    }

    public void setPeakStart(LocalTime peakStart) {
        this.peakStart = peakStart;
    }

    public LocalTime getPeakEnd() {
        return peakEnd;
    }

    public void setPeakEnd(LocalTime peakEnd) {
        this.peakEnd = peakEnd;
    }

    public OffsetDateTime getLastRunAt() {
        return lastRunAt;
    }

    public void setLastRunAt(OffsetDateTime lastRunAt) {
        this.lastRunAt = lastRunAt;
    }

    public OffsetDateTime getNextRunAt() {
        return nextRunAt;
    }

    public void setNextRunAt(OffsetDateTime nextRunAt) {
        this.nextRunAt = nextRunAt;
    }

    public boolean isActive() {
        return active;
    }

    public void setActive(boolean active) {
        this.active = active;
    }

    public OffsetDateTime getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(OffsetDateTime createdAt) {
        this.createdAt = createdAt;
    }
}
