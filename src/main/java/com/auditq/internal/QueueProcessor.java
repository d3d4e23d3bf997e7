package com.auditq.internal;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.auditq.Job;
import com.auditq.JobCancelledException;
import com.auditq.JobExecutionContext;
import com.auditq.JobExecutor;
import com.auditq.JobRepository;
import com.auditq.JobStatus;
import com.auditq.TriggerData;
import com.auditq.TriggerType;
import com.auditq.broadcast.BroadcastEvent;
import com.auditq.broadcast.Broadcaster;
import com.auditq.broadcast.JobUpdate;
import com.auditq.broadcast.Topics;
import com.auditq.config.AuditQProperties;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Component;
import org.springframework.util.ClassUtils;

import java.time.Clock;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Worker loop. Claims eligible jobs with a conditional update, runs them through the matching
 * {@link JobExecutor} and records the outcome. Any number of processors may share one database; the
 * claim guarantees each attempt runs on exactly one of them.
 */
@Component
public class QueueProcessor {

    private static final Logger log = LoggerFactory.getLogger(QueueProcessor.class);
    private static final int MAX_ERROR_MESSAGE_LENGTH = 2000;
    // Candidates fetched per free slot, so a few lost claim races do not leave slots idle.
    private static final int CANDIDATE_OVERSAMPLING = 4;
    static final String CANCELLED_REASON = "Cancelled by user";

    private final JobRepository jobRepository;
    private final List<JobExecutor<?>> executors;
    private final RetryPolicy retryPolicy;
    private final LeaseReaper leaseReaper;
    private final Broadcaster broadcaster;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final Duration leaseDuration;
    private final long leaseRenewalIntervalSeconds;
    private final int workerCount;
    private final ThreadPoolExecutor processingExecutor;
    private final ScheduledThreadPoolExecutor leaseKeeper;

    private final String nodeId = "node-" + UUID.randomUUID();
    private final Map<UUID, InFlightExecution> inFlight = new ConcurrentHashMap<>();
    private Map<TriggerType, JobExecutor<?>> executorsByType = Map.of();

    @Autowired
    public QueueProcessor(
            JobRepository jobRepository,
            ObjectProvider<JobExecutor<?>> executors,
            RetryPolicy retryPolicy,
            LeaseReaper leaseReaper,
            Broadcaster broadcaster,
            ObjectMapper objectMapper,
            AuditQProperties properties,
            Clock clock) {
        this(jobRepository, executors.orderedStream().toList(), retryPolicy, leaseReaper, broadcaster, objectMapper,
                properties, clock);
    }

    public QueueProcessor(
            JobRepository jobRepository,
            List<JobExecutor<?>> executors,
            RetryPolicy retryPolicy,
            LeaseReaper leaseReaper,
            Broadcaster broadcaster,
            ObjectMapper objectMapper,
            AuditQProperties properties,
            Clock clock) {
        this.jobRepository = jobRepository;
        this.executors = executors;
        this.retryPolicy = retryPolicy;
        this.leaseReaper = leaseReaper;
        this.broadcaster = broadcaster;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.leaseDuration = properties.getBackgroundJobServer().getLeaseDuration();
        this.leaseRenewalIntervalSeconds = Math.max(1,
                properties.getBackgroundJobServer().getLeaseRenewalIntervalInSeconds());
        this.workerCount = Math.max(1, properties.getBackgroundJobServer().getWorkerCount());

        int processingQueueCapacity = Math.max(32, workerCount * 8);
        this.processingExecutor = new ThreadPoolExecutor(
                workerCount,
                workerCount,
                0L,
                TimeUnit.MILLISECONDS,
                new LinkedBlockingQueue<>(processingQueueCapacity),
                new ThreadPoolExecutor.CallerRunsPolicy());

        this.leaseKeeper = new ScheduledThreadPoolExecutor(1, runnable -> {
            Thread thread = new Thread(runnable, "auditq-lease-keeper");
            thread.setDaemon(true);
            return thread;
        });
        this.leaseKeeper.setRemoveOnCancelPolicy(true);
    }

    @PostConstruct
    public void init() {
        Map<TriggerType, JobExecutor<?>> registrations = new EnumMap<>(TriggerType.class);
        for (JobExecutor<?> executor : executors) {
            TriggerType triggerType = executor.getTriggerType();
            JobExecutor<?> existing = registrations.putIfAbsent(triggerType, executor);
            if (existing != null) {
                throw new IllegalStateException(
                        "Duplicate executor for trigger type '" + triggerType.value() + "': "
                                + ClassUtils.getUserClass(existing).getName() + " and "
                                + ClassUtils.getUserClass(executor).getName());
            }
        }
        this.executorsByType = registrations.isEmpty() ? Map.of() : new EnumMap<>(registrations);
        log.info("Queue processor initialized on {} with executors for {}", nodeId, executorsByType.keySet());
    }

    public String getNodeId() {
        return nodeId;
    }

    /**
     * Claims and executes at most one eligible job on the calling thread. Expired leases are reclaimed
     * first, so a cron driving only this method still recovers jobs of crashed workers. The lease of the
     * job is renewed in the background while it executes.
     *
     * @return the id of the job that was processed, empty when nothing was eligible
     */
    public Optional<UUID> tick() {
        reapExpiredLeases();
        List<Job> claimed = claimNext(1);
        if (claimed.isEmpty()) {
            return Optional.empty();
        }
        Job job = claimed.get(0);
        ScheduledFuture<?> renewal = leaseKeeper.scheduleWithFixedDelay(this::renewLeasesQuietly,
                leaseRenewalIntervalSeconds, leaseRenewalIntervalSeconds, TimeUnit.SECONDS);
        try {
            process(job);
        } finally {
            renewal.cancel(false);
        }
        return Optional.of(job.getId());
    }

    /**
     * Claims as many jobs as there are idle worker threads and hands them to the pool.
     *
     * @return number of jobs dispatched
     */
    public int poll() {
        int availableSlots = availableProcessingSlots();
        if (availableSlots <= 0) {
            return 0;
        }
        List<Job> claimed = claimNext(availableSlots);
        for (Job job : claimed) {
            try {
                processingExecutor.execute(() -> process(job));
            } catch (RejectedExecutionException shuttingDown) {
                // The claim stands; the lease reaper returns the job to the queue once the lease lapses.
                log.warn("Could not dispatch claimed job {}: {}", job.getId(), shuttingDown.getMessage());
            }
        }
        return claimed.size();
    }

    /**
     * Renews the lease of every job this node is executing and forwards cancellation requests made on
     * any node to the running executors.
     */
    public void renewLeases() {
        if (inFlight.isEmpty()) {
            return;
        }
        List<UUID> ids = new ArrayList<>(inFlight.keySet());
        OffsetDateTime now = now();
        int renewed = jobRepository.renewLeases(ids, nodeId, now.plus(leaseDuration), now);
        log.debug("Renewed {} of {} leases held by {}", renewed, ids.size(), nodeId);
        for (UUID cancelled : jobRepository.findCancelRequested(ids)) {
            signalCancellation(cancelled);
        }
    }

    private void renewLeasesQuietly() {
        try {
            renewLeases();
        } catch (RuntimeException e) {
            log.warn("Lease renewal on {} failed: {}", nodeId, e.getMessage());
        }
    }

    private void reapExpiredLeases() {
        try {
            leaseReaper.reap();
        } catch (RuntimeException e) {
            log.error("Lease reaper failed before processing", e);
        }
    }

    /**
     * Trips the cancellation token of a job running on this node. No-op for jobs running elsewhere;
     * those nodes pick the request up at their next lease renewal.
     */
    public void signalCancellation(UUID jobId) {
        InFlightExecution execution = inFlight.get(jobId);
        if (execution != null && execution.cancelRequested().compareAndSet(false, true)) {
            log.info("Signalled cancellation to running job {}", jobId);
        }
    }

    public int inFlightCount() {
        return inFlight.size();
    }

    List<Job> claimNext(int limit) {
        OffsetDateTime now = now();
        List<Job> candidates = new ArrayList<>(jobRepository.findEligible(
                JobStatus.CLAIMABLE, now, PageRequest.of(0, limit * CANDIDATE_OVERSAMPLING)));
        candidates.sort(JobOrdering.DEQUEUE_ORDER);

        List<Job> claimed = new ArrayList<>(limit);
        OffsetDateTime leaseExpiresAt = now.plus(leaseDuration);
        for (Job candidate : candidates) {
            if (claimed.size() >= limit) {
                break;
            }
            int updated = jobRepository.claim(candidate.getId(), candidate.getStatus(), nodeId, now, leaseExpiresAt);
            if (updated > 0) {
                candidate.markClaimed(nodeId, now, leaseExpiresAt);
                claimed.add(candidate);
                log.debug("Claimed job {} (priority {}, attempt {})", candidate.getId(), candidate.getPriority(),
                        candidate.getRetryCount() + 1);
            } else {
                log.debug("Lost claim race for job {}", candidate.getId());
            }
        }
        return claimed;
    }

    void process(Job job) {
        InFlightExecution execution = new InFlightExecution(job, new AtomicBoolean(false), new AtomicInteger(0));
        inFlight.put(job.getId(), execution);
        publish(job, BroadcastEvent.JOB_RUNNING, JobUpdate.of(job));
        try {
            JsonNode result = invokeExecutor(job, execution);
            if (execution.cancelRequested().get()) {
                markCancelled(job);
                return;
            }
            markCompleted(job, result);
        } catch (JobCancelledException cancelled) {
            markCancelled(job);
        } catch (Throwable failure) {
            if (failure instanceof VirtualMachineError fatal) {
                throw fatal;
            }
            if (execution.cancelRequested().get()) {
                log.info("Job {} failed after cancellation was requested; treating as cancelled", job.getId());
                markCancelled(job);
                return;
            }
            log.error("Failed to process job {} of type {} (attempt {})", job.getId(), job.getTriggerType().value(),
                    job.getRetryCount() + 1, failure);
            handleFailure(job, failure);
        } finally {
            inFlight.remove(job.getId());
        }
    }

    private JsonNode invokeExecutor(Job job, InFlightExecution execution) throws Exception {
        JobExecutor<?> executor = executorsByType.get(job.getTriggerType());
        if (executor == null) {
            throw new IllegalStateException("No executor registered for trigger type '"
                    + job.getTriggerType().value() + "'");
        }
        TriggerData triggerData = job.getTriggerData();
        if (!executor.getTriggerDataClass().isInstance(triggerData)) {
            throw new IllegalStateException("Job " + job.getId() + " carries "
                    + (triggerData == null ? "no trigger data" : triggerData.getClass().getSimpleName())
                    + " but executor expects " + executor.getTriggerDataClass().getSimpleName());
        }
        @SuppressWarnings("unchecked")
        JobExecutor<TriggerData> castExecutor = (JobExecutor<TriggerData>) executor;
        return castExecutor.execute(job.getId(), triggerData, new Context(job, execution));
    }

    private void reportProgress(Job job, InFlightExecution execution, int percent, String statusMessage) {
        int clamped = Math.max(0, Math.min(100, percent));
        if (clamped < execution.lastProgress().get()) {
            return;
        }
        OffsetDateTime now = now();
        int updated = jobRepository.updateProgress(job.getId(), nodeId, clamped, statusMessage,
                now.plus(leaseDuration), now);
        if (updated == 0) {
            log.debug("Progress update for job {} ignored; job no longer held by {}", job.getId(), nodeId);
            return;
        }
        execution.lastProgress().set(clamped);
        publish(job, BroadcastEvent.JOB_PROGRESS,
                JobUpdate.of(job).with(JobStatus.RUNNING, clamped, statusMessage, job.getRetryCount(), null));
        if (!jobRepository.findCancelRequested(List.of(job.getId())).isEmpty()) {
            signalCancellation(job.getId());
        }
    }

    private void markCompleted(Job job, JsonNode result) {
        String resultJson = serializeResult(job, result);
        int updated = jobRepository.markCompleted(job.getId(), nodeId, resultJson, now());
        if (updated == 0) {
            log.warn("Job {} changed state while executing on {}; completion discarded", job.getId(), nodeId);
            return;
        }
        log.debug("Successfully completed job {} of type {}", job.getId(), job.getTriggerType().value());
        publish(job, BroadcastEvent.JOB_COMPLETED,
                JobUpdate.of(job).with(JobStatus.COMPLETED, 100, job.getStatusMessage(), job.getRetryCount(), null));
    }

    private void markCancelled(Job job) {
        int updated = jobRepository.markCancelled(job.getId(), nodeId, CANCELLED_REASON, now());
        if (updated == 0) {
            log.warn("Job {} changed state before cancellation could be recorded", job.getId());
            return;
        }
        log.info("Job {} cancelled while running", job.getId());
        publish(job, BroadcastEvent.JOB_CANCELLED,
                JobUpdate.of(job).with(JobStatus.CANCELLED, job.getProgress(), null, job.getRetryCount(),
                        CANCELLED_REASON));
    }

    private void handleFailure(Job job, Throwable failure) {
        OffsetDateTime now = now();
        int currentRetryCount = job.getRetryCount();
        String errorMessage = describe(failure);
        RetryPolicy.RetryDecision decision = retryPolicy.decide(currentRetryCount, job.getMaxRetries());

        if (decision instanceof RetryPolicy.RetryDecision.Retry retry) {
            OffsetDateTime nextScheduledAt = now.plus(retry.delay());
            int updated = jobRepository.markForRetry(job.getId(), nodeId, currentRetryCount, currentRetryCount + 1,
                    errorMessage, nextScheduledAt, now);
            if (updated == 0) {
                log.warn("Job {} changed state while executing; retry not recorded", job.getId());
                return;
            }
            log.info("Job {} will retry ({}/{}) at {}", job.getId(), currentRetryCount + 1, job.getMaxRetries(),
                    nextScheduledAt);
            publish(job, BroadcastEvent.JOB_RETRYING,
                    JobUpdate.of(job).with(JobStatus.RETRYING, 0, null, currentRetryCount + 1, errorMessage));
            return;
        }

        int updated = jobRepository.markFailed(job.getId(), nodeId, currentRetryCount, errorMessage, now);
        if (updated == 0) {
            log.warn("Job {} changed state while executing; failure not recorded", job.getId());
            return;
        }
        log.error("Job {} permanently failed after {} attempt(s): {}", job.getId(), currentRetryCount + 1,
                errorMessage);
        publish(job, BroadcastEvent.JOB_FAILED,
                JobUpdate.of(job).with(JobStatus.FAILED, job.getProgress(), null, currentRetryCount, errorMessage));
    }

    private String serializeResult(Job job, JsonNode result) {
        if (result == null || result.isNull() || result.isMissingNode()) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(result);
        } catch (Exception e) {
            log.warn("Could not serialize result summary of job {}; storing none", job.getId(), e);
            return null;
        }
    }

    static String describe(Throwable failure) {
        String message = failure.getMessage();
        if (message == null || message.isBlank()) {
            message = failure.getClass().getName();
        }
        return message.length() > MAX_ERROR_MESSAGE_LENGTH ? message.substring(0, MAX_ERROR_MESSAGE_LENGTH) : message;
    }

    private void publish(Job job, String type, JobUpdate update) {
        broadcaster.publishQuietly(Topics.resource(job.getResourceId()), BroadcastEvent.of(type, update, now()));
    }

    private int availableProcessingSlots() {
        int busy = processingExecutor.getActiveCount() + processingExecutor.getQueue().size();
        return workerCount - busy;
    }

    private OffsetDateTime now() {
        return OffsetDateTime.now(clock).truncatedTo(ChronoUnit.MICROS);
    }

    @PreDestroy
    void shutdownExecutor() {
        processingExecutor.shutdown();
        leaseKeeper.shutdownNow();
    }

    private record InFlightExecution(Job job, AtomicBoolean cancelRequested, AtomicInteger lastProgress) {
    }

    private final class Context implements JobExecutionContext {

        private final Job job;
        private final InFlightExecution execution;

        private Context(Job job, InFlightExecution execution) {
            this.job = job;
            this.execution = execution;
        }

        @Override
        public int attempt() {
            return job.getRetryCount() + 1;
        }

        @Override
        public void reportProgress(int percent, String statusMessage) {
            QueueProcessor.this.reportProgress(job, execution, percent, statusMessage);
        }

        @Override
        public boolean isCancellationRequested() {
            return execution.cancelRequested().get();
        }
    }
}
