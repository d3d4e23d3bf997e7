package com.auditq.broadcast;

import com.auditq.Job;
import com.auditq.JobStatus;

import java.util.UUID;

/**
 * Payload of every {@code job.*} event.
 */
public record JobUpdate(
        UUID jobId,
        String resourceId,
        JobStatus status,
        int progress,
        String statusMessage,
        int retryCount,
        String errorMessage) {

    public static JobUpdate of(Job job) {
        return new JobUpdate(job.getId(), job.getResourceId(), job.getStatus(), job.getProgress(),
                job.getStatusMessage(), job.getRetryCount(), job.getErrorMessage());
    }

    public JobUpdate with(JobStatus nextStatus, int nextProgress, String nextStatusMessage, int nextRetryCount,
            String nextErrorMessage) {
        return new JobUpdate(jobId, resourceId, nextStatus, nextProgress, nextStatusMessage, nextRetryCount,
                nextErrorMessage);
    }
}
