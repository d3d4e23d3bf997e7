package com.auditq;

import java.util.List;
import java.util.Map;

/**
 * Snapshot of the queue for one resource, or for all resources.
 */
public record QueueStatus(List<Job> jobs, Stats stats) {

    public record Stats(long total, long queued, long running, long completed, long failed, long retrying,
            long cancelled) {

        static Stats from(JobRepository.LifecycleCounts counts) {
            long queued = orZero(counts.getQueuedCount());
            long running = orZero(counts.getRunningCount());
            long retrying = orZero(counts.getRetryingCount());
            long completed = orZero(counts.getCompletedCount());
            long failed = orZero(counts.getFailedCount());
            long cancelled = orZero(counts.getCancelledCount());
            return new Stats(queued + running + retrying + completed + failed + cancelled,
                    queued, running, completed, failed, retrying, cancelled);
        }

        static Stats from(Map<JobStatus, Long> counts) {
            long queued = counts.getOrDefault(JobStatus.QUEUED, 0L);
            long running = counts.getOrDefault(JobStatus.RUNNING, 0L);
            long retrying = counts.getOrDefault(JobStatus.RETRYING, 0L);
            long completed = counts.getOrDefault(JobStatus.COMPLETED, 0L);
            long failed = counts.getOrDefault(JobStatus.FAILED, 0L);
            long cancelled = counts.getOrDefault(JobStatus.CANCELLED, 0L);
            return new Stats(queued + running + retrying + completed + failed + cancelled,
                    queued, running, completed, failed, retrying, cancelled);
        }

        private static long orZero(Long value) {
            return value == null ? 0L : value;
        }
    }
}
