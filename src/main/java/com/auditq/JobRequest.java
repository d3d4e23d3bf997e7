package com.auditq;

import java.time.OffsetDateTime;

/**
 * Work submitted to {@link JobScheduler#enqueue(java.security.Principal, JobRequest)}. Null optional
 * fields fall back to the configured defaults.
 */
public record JobRequest(
        String resourceId,
        TriggerData triggerData,
        Integer priority,
        OffsetDateTime scheduledAt,
        Integer maxRetries) {

    public static JobRequest of(String resourceId, TriggerData triggerData) {
        return new JobRequest(resourceId, triggerData, null, null, null);
    }

    public JobRequest withPriority(int priority) {
        return new JobRequest(resourceId, triggerData, priority, scheduledAt, maxRetries);
    }

    public JobRequest withScheduledAt(OffsetDateTime scheduledAt) {
        return new JobRequest(resourceId, triggerData, priority, scheduledAt, maxRetries);
    }

    public JobRequest withMaxRetries(int maxRetries) {
        return new JobRequest(resourceId, triggerData, priority, scheduledAt, maxRetries);
    }
}
