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
import org.springframework.context.ApplicationContext;
import org.springframework.test.context.TestPropertySource;

import java.time.Duration;
import java.time.Instant;
import java.time.OffsetDateTime;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;

/**
 * Jobs driven only through {@link QueueProcessor#tick()}, as an external cron does when the in-process
 * background server is disabled.
 */
@TestPropertySource(properties = "auditq.background-job-server.lease-renewal-interval-in-seconds=1")
class CronDrivenLeaseIntegrationTest extends AuditQIntegrationTestSupport {

    @Autowired
    ApplicationContext applicationContext;

    @Autowired
    JobScheduler jobScheduler;

    @Autowired
    QueueProcessor queueProcessor;

    @Autowired
    LeaseReaper leaseReaper;

    @Autowired
    JobRepository jobRepository;

    @Test
    void shouldRecoverJobOfCrashedWorkerThroughTick() {
        assertThat(applicationContext.getBeansOfType(BackgroundJobServer.class)).isEmpty();
        Job job = jobScheduler.enqueue(null, JobRequest.of("site-1", new TriggerData.Manual(null, null)));
        assertThat(queueProcessor.claimNext(1)).extracting(Job::getId).containsExactly(job.getId());

        clock.advance(Duration.ofMinutes(11));
        assertThat(queueProcessor.tick()).as("retry must wait for its backoff").isEmpty();

        Job reclaimed = jobRepository.findById(job.getId()).orElseThrow();
        assertThat(reclaimed.getStatus()).isEqualTo(JobStatus.RETRYING);
        assertThat(reclaimed.getRetryCount()).isEqualTo(1);
        assertThat(reclaimed.getLockedBy()).isNull();

        clock.advance(Duration.ofMinutes(5));
        assertThat(queueProcessor.tick()).contains(job.getId());
        assertThat(jobRepository.findById(job.getId()).orElseThrow().getStatus()).isEqualTo(JobStatus.COMPLETED);
        assertThat(manualExecutor.executed()).containsExactly(job.getId());
    }

    @Test
    void shouldKeepLeaseOfLongSynchronousExecutionAlive() {
        OffsetDateTime initialExpiry = OffsetDateTime.parse("2025-01-06T10:10:00Z");
        manualExecutor.behave((jobId, data, context) -> {
            clock.advance(Duration.ofMinutes(9));
            await().atMost(Duration.ofSeconds(10)).untilAsserted(() ->
                    assertThat(jobRepository.findById(jobId).orElseThrow().getLeaseExpiresAt())
                            .isAfter(initialExpiry));
            clock.advance(Duration.ofMinutes(5));
            assertThat(leaseReaper.reap()).isZero();
            return null;
        });
        Job job = jobScheduler.enqueue(null, JobRequest.of("site-1", new TriggerData.Manual(null, null)));

        assertThat(queueProcessor.tick()).contains(job.getId());

        Job completed = jobRepository.findById(job.getId()).orElseThrow();
        assertThat(completed.getStatus()).isEqualTo(JobStatus.COMPLETED);
        assertThat(completed.getRetryCount()).isZero();
        assertThat(clock.instant()).isEqualTo(Instant.parse("2025-01-06T10:14:00Z"));
    }
}
