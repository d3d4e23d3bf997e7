package com.auditq.monitoring;

import com.auditq.internal.JsonColumns;
import com.fasterxml.jackson.databind.JsonNode;
import jakarta.persistence.Column;
import jakarta.persistence.Convert;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

import java.time.OffsetDateTime;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

@Entity
@Table(name = "auditq_monitoring_runs")
public class MonitoringRun {

    @Id
    private UUID id;

    @Column(name = "config_id", nullable = false)
    private UUID configId;

    @Enumerated(EnumType.STRING)
    @Column(name = "trigger_type", nullable = false)
    private RunTrigger triggerType;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false)
    private RunStatus status = RunStatus.PENDING;

    @Column(name = "total_targets")
    private int totalTargets;

    @Column(name = "completed_targets")
    private int completedTargets;

    @Column(name = "failed_targets")
    private int failedTargets;

    @Convert(converter = JsonColumns.ScoreMapConverter.class)
    @Column(name = "average_scores")
    private Map<String, Double> averageScores = new LinkedHashMap<>();

    @Convert(converter = JsonColumns.JsonNodeConverter.class)
    @Column(name = "trigger_context")
    private JsonNode triggerContext;

    @Column(name = "created_at", updatable = false)
    private OffsetDateTime createdAt;

    @Column(name = "started_at")
    private OffsetDateTime startedAt;

    @Column(name = "completed_at")
    private OffsetDateTime completedAt;

    public MonitoringRun() {
    }

    public MonitoringRun(UUID id, UUID configId, RunTrigger triggerType, int totalTargets) {
        this.id = id;
        this.configId = configId;
        this.triggerType = triggerType;
        this.totalTargets = totalTargets;
    }

    /**
     * Targets neither completed nor failed yet.
     */
    public int remainingTargets() {
        return Math.max(0, totalTargets - completedTargets - failedTargets);
    }

    public UUID getId() {
        return id;
    }

    public void setId(UUID id) {
        this.id = id;
    }

    public UUID getConfigId() {
        return configId;
    }

    public void setConfigId(UUID configId) {
        this.configId = configId;
    }

    public RunTrigger getTriggerType() {
        return triggerType;
    }

    public void setTriggerType(RunTrigger triggerType) {
        this.triggerType = triggerType;
    }

    public RunStatus getStatus() {
        return status;
    }

    public void setStatus(RunStatus status) {
        this.status = status;
    }

    public int getTotalTargets() {
        return totalTargets;
    }

    public void setTotalTargets(int totalTargets) {
        this.totalTargets = totalTargets;
    }

    public int getCompletedTargets() {
        return completedTargets;
    }

    public void setCompletedTargets(int completedTargets) {
        this.completedTargets = completedTargets;
    }

    public int getFailedTargets() {
        return failedTargets;
    }

    public void setFailedTargets(int failedTargets) {
        this.failedTargets = failedTargets;
    }

    public Map<String, Double> getAverageScores() {
        return averageScores;
    }

    public void setAverageScores(Map<String, Double> averageScores) {
        this.averageScores = averageScores;
    }

    public JsonNode getTriggerContext() {
        return triggerContext;
    }

    public void setTriggerContext(JsonNode triggerContext) {
        this.triggerContext = triggerContext;
    }

    public OffsetDateTime getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(OffsetDateTime createdAt) {
        this.createdAt = createdAt;
    }

    public OffsetDateTime getStartedAt() {
        return startedAt;
    }

    public void setStartedAt(OffsetDateTime startedAt) {
        this.startedAt = startedAt;
    }

    public OffsetDateTime getCompletedAt() {
        return completedAt;
    }

    public void setCompletedAt(OffsetDateTime completedAt) {
        this.completedAt = completedAt;
    }
}
