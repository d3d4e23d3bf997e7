package com.auditq.monitoring;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

import java.time.OffsetDateTime;
import java.util.UUID;

/**
 * A metric that scored below its configured threshold during a monitoring run. Append-only.
 */
@Entity
@Table(name = "auditq_threshold_alerts")
public class ThresholdAlert {

    @Id
    private UUID id;

    @Column(name = "run_id", nullable = false)
    private UUID runId;

    @Column(name = "target", nullable = false)
    private String target;

    @Column(name = "metric_name", nullable = false)
    private String metricName;

    @Column(name = "current_score")
    private double currentScore;

    @Column(name = "threshold_score")
    private double thresholdScore;

    @Enumerated(EnumType.STRING)
    @Column(name = "severity", nullable = false)
    private AlertSeverity severity;

    @Column(name = "created_at", updatable = false)
    private OffsetDateTime createdAt;

    protected ThresholdAlert() {
    }

    public ThresholdAlert(UUID id, UUID runId, String target, String metricName, double currentScore,
            double thresholdScore, OffsetDateTime createdAt) {
        this.id = id;
        this.runId = runId;
        this.target = target;
        this.metricName = metricName;
        this.currentScore = currentScore;
        this.thresholdScore = thresholdScore;
        this.severity = AlertSeverity.forShortfall(thresholdScore - currentScore);
        this.createdAt = createdAt;
    }

    public UUID getId() {
        return id;
    }

    public UUID getRunId() {
        return runId;
    }

    public String getTarget() {
        return target;
    }

    public String getMetricName() {
        return metricName;
    }

    public double getCurrentScore() {
        return currentScore;
    }

    public double getThresholdScore() {
        return thresholdScore;
    }

    public AlertSeverity getSeverity() {
        return severity;
    }

    public OffsetDateTime getCreatedAt() {
        return createdAt;
    }
}
