package com.auditq.monitoring;

import com.auditq.AuditQNotFoundException;
import com.auditq.admission.AdmissionGuard;
import com.auditq.admission.QueueFullException;
import com.auditq.broadcast.BroadcastEvent;
import com.auditq.broadcast.Broadcaster;
import com.auditq.broadcast.Topics;
import com.auditq.config.AuditQProperties;
import com.fasterxml.jackson.databind.JsonNode;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;

import java.net.URI;
import java.net.URISyntaxException;
import java.time.Clock;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

/**
 * Creates monitoring runs for configurations that are due and audits their targets in the background.
 * Scheduled runs honor the daily run cap, peak hours and the global queue depth; manual and
 * upstream-event runs only the queue depth.
 */
@Service
public class RecurringMonitor {

    private static final Logger log = LoggerFactory.getLogger(RecurringMonitor.class);
    private static final int DUE_BATCH_SIZE = 100;

    private final MonitoringConfigRepository configRepository;
    private final MonitoringRunRepository runRepository;
    private final ThresholdAlertRepository alertRepository;
    private final AdmissionGuard admissionGuard;
    private final ObjectProvider<AuditExecutor> auditExecutor;
    private final Broadcaster broadcaster;
    private final Clock clock;
    private final Duration interTargetDelay;
    private final ZoneId zone;
    private final int defaultMaxRunsPerDay;
    private final Executor runExecutor;

    @Autowired
    public RecurringMonitor(MonitoringConfigRepository configRepository, MonitoringRunRepository runRepository,
            ThresholdAlertRepository alertRepository, AdmissionGuard admissionGuard,
            ObjectProvider<AuditExecutor> auditExecutor, Broadcaster broadcaster, AuditQProperties properties,
            Clock clock) {
        this(configRepository, runRepository, alertRepository, admissionGuard, auditExecutor, broadcaster,
                properties, clock, newRunExecutor(properties.getMonitoring().getRunConcurrency()));
    }

    public RecurringMonitor(MonitoringConfigRepository configRepository, MonitoringRunRepository runRepository,
            ThresholdAlertRepository alertRepository, AdmissionGuard admissionGuard,
            ObjectProvider<AuditExecutor> auditExecutor, Broadcaster broadcaster, AuditQProperties properties,
            Clock clock, Executor runExecutor) {
        this.configRepository = configRepository;
        this.runRepository = runRepository;
        this.alertRepository = alertRepository;
        this.admissionGuard = admissionGuard;
        this.auditExecutor = auditExecutor;
        this.broadcaster = broadcaster;
        this.clock = clock;
        this.interTargetDelay = properties.getMonitoring().getInterTargetDelay();
        this.zone = properties.getMonitoring().getZone();
        this.defaultMaxRunsPerDay = properties.getMonitoring().getDefaultMaxRunsPerDay();
        this.runExecutor = runExecutor;
    }

    private static ExecutorService newRunExecutor(int runConcurrency) {
        int threads = Math.max(1, runConcurrency);
        return new ThreadPoolExecutor(threads, threads, 0L, TimeUnit.MILLISECONDS, new LinkedBlockingQueue<>());
    }

    public List<MonitoringRun> tick() {
        return tick(now());
    }

    /**
     * Creates a scheduled run for every active configuration due at {@code now} that passes the daily
     * cap, peak-hour and queue-depth checks.
     *
     * @return the runs created, already handed to the run executor
     */
    public List<MonitoringRun> tick(OffsetDateTime now) {
        List<MonitoringConfig> due = configRepository.findDue(now, PageRequest.of(0, DUE_BATCH_SIZE));
        List<MonitoringRun> created = new ArrayList<>();
        for (MonitoringConfig config : due) {
            try {
                scheduleIfAllowed(config, now).ifPresent(created::add);
            } catch (RuntimeException e) {
                log.error("Failed to schedule monitoring run for config {}", config.getId(), e);
            }
        }
        if (!created.isEmpty()) {
            log.info("Created {} scheduled monitoring run(s) of {} due config(s)", created.size(), due.size());
        }
        return created;
    }

    private Optional<MonitoringRun> scheduleIfAllowed(MonitoringConfig config, OffsetDateTime now) {
        OffsetDateTime dayStart = MonitoringSchedule.startOfDay(now, zone);
        long runsToday = runRepository.countByConfigIdAndCreatedAtGreaterThanEqual(config.getId(), dayStart);
        if (runsToday >= config.getMaxRunsPerDay()) {
            log.debug("Config {} reached its daily cap of {} run(s)", config.getId(), config.getMaxRunsPerDay());
            return Optional.empty();
        }
        if (MonitoringSchedule.isWithinPeak(config, now, zone)) {
            log.debug("Config {} skipped during peak hours {}-{}", config.getId(), config.getPeakStart(),
                    config.getPeakEnd());
            return Optional.empty();
        }
        try {
            admissionGuard.checkMonitoringAdmission(config.getTargets().size());
        } catch (QueueFullException e) {
            log.warn("Skipping monitoring config {}: {}", config.getId(), e.getMessage());
            return Optional.empty();
        }

        OffsetDateTime expected = config.getNextRunAt();
        OffsetDateTime next = MonitoringSchedule.nextRunAt(config.getScheduleInterval(), expected, now);
        int claimed = expected == null
                ? configRepository.claimUnscheduled(config.getId(), next, now)
                : configRepository.claim(config.getId(), expected, next, now);
        if (claimed == 0) {
            log.debug("Config {} was claimed by another monitor", config.getId());
            return Optional.empty();
        }
        config.setLastRunAt(now);
        config.setNextRunAt(next);
        return Optional.of(startRun(config, RunTrigger.SCHEDULED, null, now));
    }

    /**
     * Starts a run outside the schedule. Daily cap, peak hours and {@code nextRunAt} do not apply.
     *
     * @throws AuditQNotFoundException  if the configuration does not exist
     * @throws IllegalArgumentException for {@link RunTrigger#SCHEDULED}
     * @throws QueueFullException       if the targets would exceed the global queue depth
     */
    public MonitoringRun trigger(UUID configId, RunTrigger trigger, JsonNode triggerContext) {
        if (trigger == null) {
            throw new IllegalArgumentException("triggerType must not be null");
        }
        if (trigger == RunTrigger.SCHEDULED) {
            throw new IllegalArgumentException("Scheduled runs are created by the monitor, not on request");
        }
        MonitoringConfig config = findConfig(configId);
        admissionGuard.checkMonitoringAdmission(config.getTargets().size());
        MonitoringRun run = startRun(config, trigger, triggerContext, now());
        log.info("Started {} monitoring run {} for config {}", trigger.value(), run.getId(), configId);
        return run;
    }

    private MonitoringRun startRun(MonitoringConfig config, RunTrigger trigger, JsonNode triggerContext,
            OffsetDateTime now) {
        List<String> targets = List.copyOf(config.getTargets());
        Map<String, Double> thresholds = Map.copyOf(config.getThresholds());

        MonitoringRun run = new MonitoringRun(UUID.randomUUID(), config.getId(), trigger, targets.size());
        run.setStatus(RunStatus.RUNNING);
        run.setCreatedAt(now);
        run.setStartedAt(now);
        run.setTriggerContext(triggerContext);
        MonitoringRun saved = runRepository.save(run);
        publish(saved.getConfigId(), BroadcastEvent.RUN_STARTED, saved);

        try {
            runExecutor.execute(() -> processRun(saved, targets, thresholds));
        } catch (RejectedExecutionException shuttingDown) {
            log.warn("Could not dispatch monitoring run {}: {}", saved.getId(), shuttingDown.getMessage());
            failRemaining(saved, "Run executor unavailable");
        }
        return saved;
    }

    /**
     * Audits the targets of {@code run} one after another. A failing target is counted and never aborts
     * the run.
     */
    void processRun(MonitoringRun run, List<String> targets, Map<String, Double> thresholds) {
        AuditExecutor executor = auditExecutor.getIfAvailable();
        if (executor == null) {
            log.warn("No AuditExecutor bean available; every target of run {} fails", run.getId());
        }
        Map<String, Double> scoreSums = new LinkedHashMap<>();
        Map<String, Integer> scoreCounts = new LinkedHashMap<>();
        try {
            for (int i = 0; i < targets.size(); i++) {
                if (i > 0 && !pauseBetweenTargets()) {
                    log.warn("Monitoring run {} interrupted after {} target(s)", run.getId(), i);
                    break;
                }
                String target = targets.get(i);
                AuditResult result = audit(executor, run, target);
                if (result == null || result.isEmpty()) {
                    run.setFailedTargets(run.getFailedTargets() + 1);
                } else {
                    run.setCompletedTargets(run.getCompletedTargets() + 1);
                    result.scores().forEach((metric, score) -> {
                        scoreSums.merge(metric, score, Double::sum);
                        scoreCounts.merge(metric, 1, Integer::sum);
                    });
                    recordAlerts(run, target, result, thresholds);
                }
                runRepository.save(run);
                publish(run.getConfigId(), BroadcastEvent.RUN_PROGRESS, run);
            }
            // Targets never audited (interrupt) count as failed.
            run.setFailedTargets(run.getFailedTargets() + run.remainingTargets());
            finish(run, averages(scoreSums, scoreCounts));
        } catch (RuntimeException e) {
            log.error("Monitoring run {} aborted", run.getId(), e);
            failRemaining(run, e.getMessage());
        }
    }

    private AuditResult audit(AuditExecutor executor, MonitoringRun run, String target) {
        if (executor == null) {
            return null;
        }
        try {
            AuditResult result = executor.audit(target);
            if (result == null || result.isEmpty()) {
                log.warn("Audit of {} in run {} returned no scores", target, run.getId());
            }
            return result;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Audit of {} in run {} interrupted", target, run.getId());
            return null;
        } catch (Exception e) {
            log.warn("Audit of {} in run {} failed: {}", target, run.getId(), e.getMessage(), e);
            return null;
        }
    }

    private void recordAlerts(MonitoringRun run, String target, AuditResult result, Map<String, Double> thresholds) {
        for (Map.Entry<String, Double> threshold : thresholds.entrySet()) {
            Double score = result.scores().get(threshold.getKey());
            if (score == null || threshold.getValue() == null || score >= threshold.getValue()) {
                continue;
            }
            ThresholdAlert alert = alertRepository.save(new ThresholdAlert(UUID.randomUUID(), run.getId(), target,
                    threshold.getKey(), score, threshold.getValue(), now()));
            log.info("Threshold alert ({}) for {} on {}: {} < {}", alert.getSeverity().value(), alert.getMetricName(),
                    target, score, threshold.getValue());
            publish(run.getConfigId(), BroadcastEvent.ALERT_CREATED, alert);
        }
    }

    private boolean pauseBetweenTargets() {
        if (interTargetDelay.isZero() || interTargetDelay.isNegative()) {
            return !Thread.currentThread().isInterrupted();
        }
        try {
            Thread.sleep(interTargetDelay.toMillis());
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private void finish(MonitoringRun run, Map<String, Double> averageScores) {
        run.setAverageScores(averageScores);
        run.setStatus(run.getCompletedTargets() > 0 ? RunStatus.COMPLETED : RunStatus.FAILED);
        run.setCompletedAt(now());
        runRepository.save(run);
        log.info("Monitoring run {} {}: {} completed, {} failed of {} target(s)", run.getId(),
                run.getStatus().value(), run.getCompletedTargets(), run.getFailedTargets(), run.getTotalTargets());
        publish(run.getConfigId(),
                run.getStatus() == RunStatus.COMPLETED ? BroadcastEvent.RUN_COMPLETED : BroadcastEvent.RUN_FAILED,
                run);
    }

    private void failRemaining(MonitoringRun run, String reason) {
        run.setFailedTargets(run.getFailedTargets() + run.remainingTargets());
        run.setStatus(run.getCompletedTargets() > 0 ? RunStatus.COMPLETED : RunStatus.FAILED);
        run.setCompletedAt(now());
        try {
            runRepository.save(run);
        } catch (RuntimeException e) {
            log.error("Could not record end of monitoring run {} ({})", run.getId(), reason, e);
            return;
        }
        publish(run.getConfigId(),
                run.getStatus() == RunStatus.COMPLETED ? BroadcastEvent.RUN_COMPLETED : BroadcastEvent.RUN_FAILED,
                run);
    }

    static Map<String, Double> averages(Map<String, Double> sums, Map<String, Integer> counts) {
        Map<String, Double> averages = new LinkedHashMap<>();
        sums.forEach((metric, sum) -> averages.put(metric, sum / counts.get(metric)));
        return averages;
    }

    /**
     * Validates and stores a new configuration. {@code nextRunAt} defaults to now, so the first
     * scheduled run happens at the next tick.
     */
    public MonitoringConfig createConfig(MonitoringConfigDefinition definition) {
        if (definition == null) {
            throw new IllegalArgumentException("Monitoring config must not be null");
        }
        if (definition.resourceId() == null || definition.resourceId().isBlank()) {
            throw new IllegalArgumentException("resourceId must not be blank");
        }
        if (definition.scheduleInterval() == null) {
            throw new IllegalArgumentException("scheduleInterval must not be null");
        }
        List<String> targets = normalizeTargets(definition.targets());
        Map<String, Double> thresholds = normalizeThresholds(definition.thresholds());
        int maxRunsPerDay = definition.maxRunsPerDay() != null ? definition.maxRunsPerDay() : defaultMaxRunsPerDay;
        if (maxRunsPerDay < 1) {
            throw new IllegalArgumentException("maxRunsPerDay must be >= 1");
        }
        boolean avoidPeakHours = Boolean.TRUE.equals(definition.avoidPeakHours());
        if (avoidPeakHours && (definition.peakStart() == null || definition.peakEnd() == null)) {
            throw new IllegalArgumentException("peakStart and peakEnd are required when avoidPeakHours is set");
        }

        OffsetDateTime now = now();
        MonitoringConfig config = new MonitoringConfig(UUID.randomUUID(), definition.resourceId().trim(), targets,
                thresholds, definition.scheduleInterval());
        config.setName(definition.name());
        config.setMaxRunsPerDay(maxRunsPerDay);
        config.setAvoidPeakHours(avoidPeakHours);
        config.setPeakStart(definition.peakStart());
        config.setPeakEnd(definition.peakEnd());
        config.setNextRunAt(definition.nextRunAt() != null
                ? definition.nextRunAt().truncatedTo(ChronoUnit.MICROS)
                : now);
        config.setCreatedAt(now);
        MonitoringConfig saved = configRepository.save(config);
        log.info("Created monitoring config {} for resource {} with {} target(s), {}", saved.getId(),
                saved.getResourceId(), targets.size(), saved.getScheduleInterval().value());
        return saved;
    }

    public MonitoringConfig findConfig(UUID configId) {
        return configRepository.findById(configId)
                .orElseThrow(() -> AuditQNotFoundException.monitoringConfig(configId));
    }

    public MonitoringConfig setActive(UUID configId, boolean active) {
        if (configRepository.updateActive(configId, active) == 0) {
            throw AuditQNotFoundException.monitoringConfig(configId);
        }
        log.info("Monitoring config {} {}", configId, active ? "activated" : "deactivated");
        return findConfig(configId);
    }

    public MonitoringRun findRun(UUID runId) {
        return runRepository.findById(runId).orElseThrow(() -> AuditQNotFoundException.monitoringRun(runId));
    }

    /**
     * The 50 most recent runs of a configuration, newest first.
     */
    public List<MonitoringRun> runsFor(UUID configId) {
        findConfig(configId);
        return runRepository.findTop50ByConfigIdOrderByCreatedAtDesc(configId);
    }

    public List<ThresholdAlert> alertsFor(UUID runId) {
        findRun(runId);
        return alertRepository.findByRunIdOrderByCreatedAtAscTargetAscMetricNameAsc(runId);
    }

    private List<String> normalizeTargets(List<String> targets) {
        if (targets == null || targets.isEmpty()) {
            throw new IllegalArgumentException("targets must contain at least one URL");
        }
        Set<String> unique = new LinkedHashSet<>();
        for (String target : targets) {
            if (target == null || target.isBlank()) {
                throw new IllegalArgumentException("targets must not contain blank entries");
            }
            String trimmed = target.trim();
            validateUrl(trimmed);
            unique.add(trimmed);
        }
        return new ArrayList<>(unique);
    }

    private static void validateUrl(String target) {
        URI uri;
        try {
            uri = new URI(target);
        } catch (URISyntaxException e) {
            throw new IllegalArgumentException("Invalid target URL: " + target, e);
        }
        String scheme = uri.getScheme() == null ? null : uri.getScheme().toLowerCase(Locale.ROOT);
        if (!"http".equals(scheme) && !"https".equals(scheme) || uri.getHost() == null) {
            throw new IllegalArgumentException("Target must be an absolute http(s) URL: " + target);
        }
    }

    private static Map<String, Double> normalizeThresholds(Map<String, Double> thresholds) {
        Map<String, Double> normalized = new LinkedHashMap<>();
        if (thresholds == null) {
            return normalized;
        }
        thresholds.forEach((metric, score) -> {
            if (metric == null || metric.isBlank()) {
                throw new IllegalArgumentException("Threshold metric names must not be blank");
            }
            if (score == null || score < 0 || score > 100) {
                throw new IllegalArgumentException("Threshold for " + metric + " must be between 0 and 100");
            }
            normalized.put(metric.trim(), score);
        });
        return normalized;
    }

    private void publish(UUID configId, String type, Object payload) {
        broadcaster.publishQuietly(Topics.monitoring(configId), BroadcastEvent.of(type, payload, now()));
    }

    private OffsetDateTime now() {
        return OffsetDateTime.now(clock).truncatedTo(ChronoUnit.MICROS);
    }

    @PreDestroy
    void shutdownExecutor() {
        if (runExecutor instanceof ExecutorService executorService) {
            executorService.shutdown();
        }
    }
}
