package com.auditq.internal;

import com.auditq.Job;
import com.auditq.JobRepository;
import com.auditq.JobStatus;
import com.auditq.broadcast.BroadcastEvent;
import com.auditq.broadcast.Broadcaster;
import com.auditq.broadcast.JobUpdate;
import com.auditq.broadcast.Topics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.time.temporal.ChronoUnit;
import java.util.List;

/**
 * Recovers jobs whose worker stopped renewing its lease, typically because the process crashed. An
 * expired lease counts as a failed attempt and goes through the {@link RetryPolicy}.
 */
@Component
public class LeaseReaper {

    private static final Logger log = LoggerFactory.getLogger(LeaseReaper.class);
    private static final int BATCH_SIZE = 100;

    private final JobRepository jobRepository;
    private final RetryPolicy retryPolicy;
    private final Broadcaster broadcaster;
    private final Clock clock;

    public LeaseReaper(JobRepository jobRepository, RetryPolicy retryPolicy, Broadcaster broadcaster, Clock clock) {
        this.jobRepository = jobRepository;
        this.retryPolicy = retryPolicy;
        this.broadcaster = broadcaster;
        this.clock = clock;
    }

    /**
     * @return number of jobs taken back from dead workers
     */
    public int reap() {
        OffsetDateTime now = OffsetDateTime.now(clock).truncatedTo(ChronoUnit.MICROS);
        List<Job> expired = jobRepository.findExpiredLeases(now, PageRequest.of(0, BATCH_SIZE));
        int reclaimed = 0;
        for (Job job : expired) {
            try {
                if (reclaim(job, now)) {
                    reclaimed++;
                }
            } catch (Exception e) {
                log.error("Failed to reclaim job {} with expired lease", job.getId(), e);
            }
        }
        if (reclaimed > 0) {
            log.warn("Reclaimed {} job(s) whose worker lease expired", reclaimed);
        }
        return reclaimed;
    }

    private boolean reclaim(Job job, OffsetDateTime now) {
        String message = "Lease expired at " + job.getLeaseExpiresAt() + " while held by " + job.getLockedBy();

        if (job.isCancelRequested()) {
            int updated = jobRepository.reclaimAsTerminal(job.getId(), job.getLeaseExpiresAt(), JobStatus.CANCELLED,
                    QueueProcessor.CANCELLED_REASON, now);
            if (updated > 0) {
                publish(job, BroadcastEvent.JOB_CANCELLED, JobStatus.CANCELLED, job.getRetryCount(),
                        QueueProcessor.CANCELLED_REASON, now);
            }
            return updated > 0;
        }

        RetryPolicy.RetryDecision decision = retryPolicy.decide(job.getRetryCount(), job.getMaxRetries());
        if (decision instanceof RetryPolicy.RetryDecision.Retry retry) {
            int updated = jobRepository.reclaimForRetry(job.getId(), job.getLeaseExpiresAt(), job.getRetryCount(),
                    job.getRetryCount() + 1, message, now.plus(retry.delay()), now);
            if (updated > 0) {
                publish(job, BroadcastEvent.JOB_RETRYING, JobStatus.RETRYING, job.getRetryCount() + 1, message, now);
            }
            return updated > 0;
        }

        int updated = jobRepository.reclaimAsTerminal(job.getId(), job.getLeaseExpiresAt(), JobStatus.FAILED,
                message, now);
        if (updated > 0) {
            log.error("Job {} permanently failed: {}", job.getId(), message);
            publish(job, BroadcastEvent.JOB_FAILED, JobStatus.FAILED, job.getRetryCount(), message, now);
        }
        return updated > 0;
    }

    private void publish(Job job, String type, JobStatus status, int retryCount, String errorMessage,
            OffsetDateTime now) {
        JobUpdate update = JobUpdate.of(job).with(status, status == JobStatus.RETRYING ? 0 : job.getProgress(), null,
                retryCount, errorMessage);
        broadcaster.publishQuietly(Topics.resource(job.getResourceId()), BroadcastEvent.of(type, update, now));
    }
}
