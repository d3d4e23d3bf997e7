package com.auditq.internal;

import com.auditq.JobRepository;
import com.auditq.JobStatus;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;

/**
 * Job gauges per status. All gauges read one aggregate query whose result is reused for a second, so a
 * scrape costs a single round trip.
 */
public class AuditQMetrics {

    private static final Logger log = LoggerFactory.getLogger(AuditQMetrics.class);
    private static final long SNAPSHOT_TTL_NANOS = Duration.ofSeconds(1).toNanos();

    private final JobRepository jobRepository;
    private final MeterRegistry meterRegistry;
    private final Object snapshotMonitor = new Object();

    private volatile Map<JobStatus, Long> cachedCounts = Map.of();
    private volatile long snapshotCapturedAtNanos = System.nanoTime() - SNAPSHOT_TTL_NANOS - 1;

    public AuditQMetrics(JobRepository jobRepository, MeterRegistry meterRegistry) {
        this.jobRepository = jobRepository;
        this.meterRegistry = meterRegistry;
    }

    @PostConstruct
    public void registerMetrics() {
        log.info("Registering AuditQ gauges with {}", meterRegistry.getClass().getSimpleName());
        for (JobStatus status : JobStatus.values()) {
            Gauge.builder("auditq.jobs.count", this, metrics -> metrics.countFor(status))
                    .description("Number of AuditQ jobs by status")
                    .tag("status", status.value())
                    .register(meterRegistry);
        }
        Gauge.builder("auditq.jobs.total", this, AuditQMetrics::totalCount)
                .description("Total number of AuditQ jobs in the database")
                .register(meterRegistry);
    }

    private double countFor(JobStatus status) {
        return snapshot().getOrDefault(status, 0L);
    }

    private double totalCount() {
        return snapshot().values().stream().mapToLong(Long::longValue).sum();
    }

    private Map<JobStatus, Long> snapshot() {
        long now = System.nanoTime();
        if (now - snapshotCapturedAtNanos <= SNAPSHOT_TTL_NANOS) {
            return cachedCounts;
        }
        synchronized (snapshotMonitor) {
            now = System.nanoTime();
            if (now - snapshotCapturedAtNanos > SNAPSHOT_TTL_NANOS) {
                cachedCounts = loadCounts();
                snapshotCapturedAtNanos = now;
            }
            return cachedCounts;
        }
    }

    private Map<JobStatus, Long> loadCounts() {
        try {
            JobRepository.LifecycleCounts counts = jobRepository.countLifecycleCounts();
            Map<JobStatus, Long> byStatus = new EnumMap<>(JobStatus.class);
            byStatus.put(JobStatus.QUEUED, orZero(counts.getQueuedCount()));
            byStatus.put(JobStatus.RUNNING, orZero(counts.getRunningCount()));
            byStatus.put(JobStatus.RETRYING, orZero(counts.getRetryingCount()));
            byStatus.put(JobStatus.COMPLETED, orZero(counts.getCompletedCount()));
            byStatus.put(JobStatus.FAILED, orZero(counts.getFailedCount()));
            byStatus.put(JobStatus.CANCELLED, orZero(counts.getCancelledCount()));
            return byStatus;
        } catch (RuntimeException e) {
            log.trace("Could not read job counts for metrics: {}", e.getMessage());
            return Map.of();
        }
    }

    private static long orZero(Long value) {
        return value == null ? 0L : value;
    }
}
