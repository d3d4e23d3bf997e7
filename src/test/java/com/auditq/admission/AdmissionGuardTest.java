package com.auditq.admission;

import com.auditq.JobRepository;
import com.auditq.JobStatus;
import com.auditq.config.AuditQProperties;
import com.auditq.monitoring.MonitoringRunRepository;
import com.auditq.monitoring.RunStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class AdmissionGuardTest {

    private JobRepository jobRepository;
    private MonitoringRunRepository runRepository;
    private AdmissionGuard guard;

    @BeforeEach
    void setUp() {
        jobRepository = mock(JobRepository.class);
        runRepository = mock(MonitoringRunRepository.class);
        guard = new AdmissionGuard(jobRepository, runRepository, new AuditQProperties());
    }

    @Test
    void shouldAdmitBelowBothCaps() {
        when(jobRepository.countByResourceIdAndStatusIn("site-1", JobStatus.ACTIVE)).thenReturn(4L);
        when(jobRepository.countByStatusIn(JobStatus.CLAIMABLE)).thenReturn(90L);
        when(runRepository.sumRemainingTargets(RunStatus.UNFINISHED)).thenReturn(9L);

        assertThatCode(() -> guard.checkJobAdmission("site-1")).doesNotThrowAnyException();
    }

    @Test
    void shouldRejectSaturatedResourceBeforeCheckingQueueDepth() {
        when(jobRepository.countByResourceIdAndStatusIn("site-1", JobStatus.ACTIVE)).thenReturn(5L);

        assertThatThrownBy(() -> guard.checkJobAdmission("site-1"))
                .isInstanceOfSatisfying(ResourceSaturatedException.class, e -> {
                    assertThat(e.errorCode()).isEqualTo("ResourceSaturated");
                    assertThat(e.getActiveJobs()).isEqualTo(5L);
                    assertThat(e.getLimit()).isEqualTo(5);
                });
        verify(jobRepository, never()).countByStatusIn(JobStatus.CLAIMABLE);
    }

    @Test
    void shouldRejectWhenQueueIsFull() {
        when(jobRepository.countByResourceIdAndStatusIn("site-1", JobStatus.ACTIVE)).thenReturn(0L);
        when(jobRepository.countByStatusIn(JobStatus.CLAIMABLE)).thenReturn(60L);
        when(runRepository.sumRemainingTargets(RunStatus.UNFINISHED)).thenReturn(40L);

        assertThatThrownBy(() -> guard.checkJobAdmission("site-1"))
                .isInstanceOfSatisfying(QueueFullException.class, e -> {
                    assertThat(e.getQueueSize()).isEqualTo(100L);
                    assertThat(e.getMaxSize()).isEqualTo(100);
                    assertThat(e.getRetryAfter()).isEqualTo(Duration.ofSeconds(60));
                });
    }

    @Test
    void shouldCountEveryTargetOfAMonitoringRun() {
        when(jobRepository.countByStatusIn(JobStatus.CLAIMABLE)).thenReturn(95L);
        when(runRepository.sumRemainingTargets(RunStatus.UNFINISHED)).thenReturn(null);

        assertThatCode(() -> guard.checkMonitoringAdmission(5)).doesNotThrowAnyException();
        assertThatThrownBy(() -> guard.checkMonitoringAdmission(6)).isInstanceOf(QueueFullException.class);
    }

    @Test
    void shouldHonorConfiguredLimits() {
        AuditQProperties properties = new AuditQProperties();
        properties.getAdmission().setMaxActiveJobsPerResource(1);
        properties.getAdmission().setMaxQueueDepth(2);
        AdmissionGuard strict = new AdmissionGuard(jobRepository, runRepository, properties);
        when(jobRepository.countByResourceIdAndStatusIn("site-1", JobStatus.ACTIVE)).thenReturn(1L);

        assertThatThrownBy(() -> strict.checkJobAdmission("site-1")).isInstanceOf(ResourceSaturatedException.class);

        when(jobRepository.countByStatusIn(JobStatus.CLAIMABLE)).thenReturn(2L);
        when(runRepository.sumRemainingTargets(RunStatus.UNFINISHED)).thenReturn(0L);
        assertThat(strict.pendingWork()).isEqualTo(2L);
        assertThatThrownBy(() -> strict.checkMonitoringAdmission(1)).isInstanceOf(QueueFullException.class);
    }
}
