package com.auditq.internal;

import com.auditq.AuditQIntegrationTestSupport;
import com.auditq.Job;
import com.auditq.JobRepository;
import com.auditq.JobRequest;
import com.auditq.JobScheduler;
import com.auditq.JobStatus;
import com.auditq.TriggerData;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class LeaseReaperIntegrationTest extends AuditQIntegrationTestSupport {

    @Autowired
    JobScheduler jobScheduler;

    @Autowired
    QueueProcessor queueProcessor;

    @Autowired
    LeaseReaper leaseReaper;

    @Autowired
    JobRepository jobRepository;

    @Test
    void shouldLeaveLiveLeasesAlone() {
        Job job = claimedJob(3);

        clock.advance(Duration.ofMinutes(9));

        assertThat(leaseReaper.reap()).isZero();
        assertThat(jobRepository.findById(job.getId()).orElseThrow().getStatus()).isEqualTo(JobStatus.RUNNING);
    }

    @Test
    void shouldRequeueJobWhoseWorkerDied() {
        Job job = claimedJob(3);
        clock.advance(Duration.ofMinutes(11));
        OffsetDateTime now = OffsetDateTime.now(clock);

        assertThat(leaseReaper.reap()).isEqualTo(1);

        Job reclaimed = jobRepository.findById(job.getId()).orElseThrow();
        assertThat(reclaimed.getStatus()).isEqualTo(JobStatus.RETRYING);
        assertThat(reclaimed.getRetryCount()).isEqualTo(1);
        assertThat(reclaimed.getLockedBy()).isNull();
        assertThat(reclaimed.getLeaseExpiresAt()).isNull();
        assertThat(reclaimed.getErrorMessage()).startsWith("Lease expired");
        assertThat(reclaimed.getScheduledAt()).isAtSameInstantAs(now.plusMinutes(5));
    }

    @Test
    void shouldFailExpiredJobWithoutRetriesLeft() {
        Job job = claimedJob(0);
        clock.advance(Duration.ofMinutes(11));

        leaseReaper.reap();

        Job failed = jobRepository.findById(job.getId()).orElseThrow();
        assertThat(failed.getStatus()).isEqualTo(JobStatus.FAILED);
        assertThat(failed.getCompletedAt()).isNotNull();
    }

    @Test
    void shouldCancelExpiredJobWithPendingCancellation() {
        Job job = claimedJob(3);
        jobScheduler.cancel(null, job.getId());
        clock.advance(Duration.ofMinutes(11));

        leaseReaper.reap();

        Job cancelled = jobRepository.findById(job.getId()).orElseThrow();
        assertThat(cancelled.getStatus()).isEqualTo(JobStatus.CANCELLED);
        assertThat(cancelled.getRetryCount()).isZero();
    }

    @Test
    void shouldNotReclaimLeaseRenewedByItsWorker() {
        Job job = claimedJob(3);
        clock.advance(Duration.ofMinutes(11));
        OffsetDateTime now = OffsetDateTime.now(clock);
        Job stale = jobRepository.findById(job.getId()).orElseThrow();
        jobRepository.renewLeases(List.of(job.getId()), stale.getLockedBy(), now.plusMinutes(10), now);

        int updated = jobRepository.reclaimForRetry(job.getId(), stale.getLeaseExpiresAt(), 0, 1, "late", now, now);

        assertThat(updated).isZero();
        assertThat(jobRepository.findById(job.getId()).orElseThrow().getStatus()).isEqualTo(JobStatus.RUNNING);
    }

    private Job claimedJob(int maxRetries) {
        Job job = jobScheduler.enqueue(null,
                JobRequest.of("site-1", new TriggerData.Manual(null, null)).withMaxRetries(maxRetries));
        assertThat(queueProcessor.claimNext(1)).extracting(Job::getId).containsExactly(job.getId());
        return job;
    }
}
