package com.auditq.admission;

import com.auditq.JobRepository;
import com.auditq.JobStatus;
import com.auditq.config.AuditQProperties;
import com.auditq.monitoring.MonitoringRunRepository;
import com.auditq.monitoring.RunStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Two caps composed by AND: at most {@code max-active-jobs-per-resource} jobs per resource in
 * {@link JobStatus#ACTIVE}, and at most {@code max-queue-depth} units of pending work overall. Pending
 * work counts claimable jobs plus the targets monitoring runs still have to audit.
 */
@Component
public class AdmissionGuard {

    private static final Logger log = LoggerFactory.getLogger(AdmissionGuard.class);

    private final JobRepository jobRepository;
    private final MonitoringRunRepository runRepository;
    private final int maxActiveJobsPerResource;
    private final int maxQueueDepth;
    private final Duration retryAfter;

    public AdmissionGuard(JobRepository jobRepository, MonitoringRunRepository runRepository,
            AuditQProperties properties) {
        this.jobRepository = jobRepository;
        this.runRepository = runRepository;
        this.maxActiveJobsPerResource = properties.getAdmission().getMaxActiveJobsPerResource();
        this.maxQueueDepth = properties.getAdmission().getMaxQueueDepth();
        this.retryAfter = properties.getAdmission().getRetryAfter();
    }

    /**
     * @throws ResourceSaturatedException if the resource is at its concurrency cap
     * @throws QueueFullException         if one more job would exceed the global queue depth
     */
    public void checkJobAdmission(String resourceId) {
        long active = jobRepository.countByResourceIdAndStatusIn(resourceId, JobStatus.ACTIVE);
        if (active >= maxActiveJobsPerResource) {
            log.debug("Rejecting job for resource {}: {} active jobs (limit {})", resourceId, active,
                    maxActiveJobsPerResource);
            throw new ResourceSaturatedException(resourceId, active, maxActiveJobsPerResource);
        }
        checkQueueDepth(1);
    }

    /**
     * @throws QueueFullException if auditing {@code targetCount} more targets would exceed the global
     *                            queue depth
     */
    public void checkMonitoringAdmission(int targetCount) {
        checkQueueDepth(targetCount);
    }

    public long pendingWork() {
        long pendingJobs = jobRepository.countByStatusIn(JobStatus.CLAIMABLE);
        Long remainingTargets = runRepository.sumRemainingTargets(RunStatus.UNFINISHED);
        return pendingJobs + (remainingTargets == null ? 0L : remainingTargets);
    }

    private void checkQueueDepth(int requested) {
        long pending = pendingWork();
        if (pending + requested > maxQueueDepth) {
            log.warn("Queue depth {} + {} exceeds maximum {}; rejecting", pending, requested, maxQueueDepth);
            throw new QueueFullException(pending, requested, maxQueueDepth, retryAfter);
        }
    }
}
