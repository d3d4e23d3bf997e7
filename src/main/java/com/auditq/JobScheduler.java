package com.auditq;

import com.auditq.admission.AdmissionGuard;
import com.auditq.admission.AdmissionLock;
import com.auditq.admission.ResourceAccessDeniedException;
import com.auditq.broadcast.BroadcastEvent;
import com.auditq.broadcast.Broadcaster;
import com.auditq.broadcast.JobUpdate;
import com.auditq.broadcast.Topics;
import com.auditq.config.AuditQProperties;
import com.auditq.internal.QueueProcessor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.security.Principal;
import java.time.Clock;
import java.time.OffsetDateTime;
import java.time.temporal.ChronoUnit;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Admission path for jobs: authorize, apply the admission caps, persist, announce.
 */
@Service
public class JobScheduler {

    private static final Logger log = LoggerFactory.getLogger(JobScheduler.class);
    static final String CANCELLED_BY_USER = "Cancelled by user";
    private static final int MAX_CANCEL_ATTEMPTS = 3;

    private final JobRepository jobRepository;
    private final AdmissionGuard admissionGuard;
    private final AdmissionLock admissionLock;
    private final ResourceAccessPolicy accessPolicy;
    private final Broadcaster broadcaster;
    private final QueueProcessor queueProcessor;
    private final AuditQProperties properties;
    private final Clock clock;

    public JobScheduler(JobRepository jobRepository, AdmissionGuard admissionGuard, AdmissionLock admissionLock,
            ResourceAccessPolicy accessPolicy, Broadcaster broadcaster, QueueProcessor queueProcessor,
            AuditQProperties properties, Clock clock) {
        this.jobRepository = jobRepository;
        this.admissionGuard = admissionGuard;
        this.admissionLock = admissionLock;
        this.accessPolicy = accessPolicy;
        this.broadcaster = broadcaster;
        this.queueProcessor = queueProcessor;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * Admits a job and returns it in state {@code queued}.
     *
     * @throws IllegalArgumentException                         if the request is malformed
     * @throws ResourceAccessDeniedException                    if the caller may not act on the resource
     * @throws com.auditq.admission.ResourceSaturatedException if the resource is at its concurrency cap
     * @throws com.auditq.admission.QueueFullException         if the global queue is full
     */
    public Job enqueue(Principal principal, JobRequest request) {
        if (request == null) {
            throw new IllegalArgumentException("Job request must not be null");
        }
        String resourceId = normalizeRequiredResourceId(request.resourceId());
        if (request.triggerData() == null) {
            throw new IllegalArgumentException("triggerData must not be null");
        }
        int maxRetries = request.maxRetries() != null
                ? request.maxRetries()
                : properties.getJobs().getDefaultMaxRetries();
        validateMaxRetries(maxRetries);
        int priority = request.priority() != null ? request.priority() : properties.getJobs().getDefaultPriority();
        checkAccess(principal, resourceId);

        OffsetDateTime now = now();
        OffsetDateTime scheduledAt = request.scheduledAt() != null
                ? request.scheduledAt().truncatedTo(ChronoUnit.MICROS)
                : now;

        Job job = new Job(UUID.randomUUID(), resourceId, request.triggerData(), priority, maxRetries, scheduledAt);
        job.setCreatedAt(now);
        job.setUpdatedAt(now);

        Job saved = admissionLock.execute(resourceId, () -> {
            admissionGuard.checkJobAdmission(resourceId);
            return jobRepository.save(job);
        });
        log.debug("Enqueued job {} ({}) for resource {} with priority {}", saved.getId(), saved.getTriggerType(),
                resourceId, priority);

        broadcaster.publishQuietly(Topics.resource(resourceId),
                BroadcastEvent.of(BroadcastEvent.JOB_CREATED, JobUpdate.of(saved), now));
        return saved;
    }

    public Job getJob(Principal principal, UUID jobId) {
        Job job = jobRepository.findById(jobId).orElseThrow(() -> AuditQNotFoundException.job(jobId));
        checkAccess(principal, job.getResourceId());
        return job;
    }

    /**
     * Up to 100 jobs in dequeue order plus counters per status. A {@code null} resource lists every
     * resource the caller may access.
     */
    public QueueStatus queueStatus(Principal principal, String resourceId) {
        if (resourceId == null || resourceId.isBlank()) {
            return accessibleQueueStatus(principal);
        }
        String normalized = resourceId.trim();
        checkAccess(principal, normalized);
        List<Job> jobs = jobRepository.findTop100ByResourceIdOrderByPriorityDescScheduledAtAsc(normalized);
        return new QueueStatus(jobs,
                QueueStatus.Stats.from(jobRepository.countLifecycleCountsForResource(normalized)));
    }

    /**
     * Cancels a job that has not finished. A queued or retrying job is cancelled immediately; a running
     * job is flagged and its executor observes the request cooperatively.
     *
     * @throws IllegalStateException if the job already reached a terminal state
     */
    public Job cancel(Principal principal, UUID jobId) {
        for (int attempt = 0; attempt < MAX_CANCEL_ATTEMPTS; attempt++) {
            Job job = getJob(principal, jobId);
            JobStatus status = job.getStatus();
            if (status.isTerminal()) {
                throw new IllegalStateException("Job " + jobId + " is already " + status.value());
            }

            OffsetDateTime now = now();
            if (status == JobStatus.RUNNING) {
                if (jobRepository.requestCancel(jobId, now) > 0) {
                    queueProcessor.signalCancellation(jobId);
                    log.info("Cancellation requested for running job {}", jobId);
                    return reload(jobId);
                }
            } else if (jobRepository.cancelPending(jobId, status, CANCELLED_BY_USER, now) > 0) {
                Job cancelled = reload(jobId);
                log.info("Cancelled {} job {}", status.value(), jobId);
                broadcaster.publishQuietly(Topics.resource(cancelled.getResourceId()),
                        BroadcastEvent.of(BroadcastEvent.JOB_CANCELLED, JobUpdate.of(cancelled), now));
                return cancelled;
            }
            log.debug("Job {} changed state while cancelling, re-reading", jobId);
        }
        throw new IllegalStateException("Job " + jobId + " changed state concurrently; try again");
    }

    private QueueStatus accessibleQueueStatus(Principal principal) {
        Map<String, Boolean> access = new HashMap<>();
        Map<JobStatus, Long> counts = new EnumMap<>(JobStatus.class);
        for (JobRepository.ResourceStatusCount count : jobRepository.countByResourceAndStatus()) {
            if (access.computeIfAbsent(count.getResourceId(), id -> accessPolicy.canAccess(principal, id))) {
                counts.merge(count.getStatus(), count.getJobCount(), Long::sum);
            }
        }
        List<String> accessible = access.entrySet().stream()
                .filter(Map.Entry::getValue)
                .map(Map.Entry::getKey)
                .toList();
        List<Job> jobs = accessible.isEmpty()
                ? List.of()
                : jobRepository.findTop100ByResourceIdInOrderByPriorityDescScheduledAtAsc(accessible);
        return new QueueStatus(jobs, QueueStatus.Stats.from(counts));
    }

    private Job reload(UUID jobId) {
        return jobRepository.findById(jobId).orElseThrow(() -> AuditQNotFoundException.job(jobId));
    }

    private void checkAccess(Principal principal, String resourceId) {
        if (!accessPolicy.canAccess(principal, resourceId)) {
            throw new ResourceAccessDeniedException(resourceId);
        }
    }

    private String normalizeRequiredResourceId(String resourceId) {
        if (resourceId == null) {
            throw new IllegalArgumentException("resourceId must not be null");
        }
        String trimmed = resourceId.trim();
        if (trimmed.isEmpty()) {
            throw new IllegalArgumentException("resourceId must not be blank");
        }
        return trimmed;
    }

    private void validateMaxRetries(int maxRetries) {
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must be >= 0");
        }
    }

    private OffsetDateTime now() {
        return OffsetDateTime.now(clock).truncatedTo(ChronoUnit.MICROS);
    }
}
