package com.auditq.internal;

import com.auditq.config.AuditQProperties;
import com.auditq.monitoring.MonitoringRun;
import com.auditq.monitoring.RecurringMonitor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * In-process timers driving the queue processor, lease upkeep and the recurring monitor. Disable it to
 * drive the same operations from an external cron through the internal endpoints.
 */
@Component
@ConditionalOnProperty(prefix = "auditq.background-job-server", name = "enabled", havingValue = "true",
        matchIfMissing = true)
public class BackgroundJobServer {

    private static final Logger log = LoggerFactory.getLogger(BackgroundJobServer.class);

    private final QueueProcessor queueProcessor;
    private final LeaseReaper leaseReaper;
    private final RecurringMonitor recurringMonitor;
    private final boolean monitoringEnabled;

    public BackgroundJobServer(QueueProcessor queueProcessor, LeaseReaper leaseReaper,
            RecurringMonitor recurringMonitor, AuditQProperties properties) {
        this.queueProcessor = queueProcessor;
        this.leaseReaper = leaseReaper;
        this.recurringMonitor = recurringMonitor;
        this.monitoringEnabled = properties.getMonitoring().isEnabled();
    }

    @Scheduled(fixedDelayString = "${auditq.background-job-server.poll-interval-in-seconds:15}000")
    public void pollQueue() {
        try {
            int dispatched = queueProcessor.poll();
            if (dispatched > 0) {
                log.debug("Dispatched {} job(s) on {}", dispatched, queueProcessor.getNodeId());
            }
        } catch (RuntimeException e) {
            log.error("Queue poll failed", e);
        }
    }

    @Scheduled(fixedDelayString = "${auditq.background-job-server.lease-renewal-interval-in-seconds:30}000")
    public void renewLeases() {
        try {
            queueProcessor.renewLeases();
        } catch (RuntimeException e) {
            log.error("Lease renewal failed", e);
        }
    }

    @Scheduled(fixedDelayString = "${auditq.background-job-server.reaper-interval-in-seconds:60}000")
    public void reapExpiredLeases() {
        try {
            leaseReaper.reap();
        } catch (RuntimeException e) {
            log.error("Lease reaper failed", e);
        }
    }

    @Scheduled(fixedDelayString = "${auditq.monitoring.tick-interval-in-seconds:60}000")
    public void monitorTick() {
        if (!monitoringEnabled) {
            return;
        }
        try {
            List<MonitoringRun> runs = recurringMonitor.tick();
            if (!runs.isEmpty()) {
                log.debug("Monitoring tick started {} run(s)", runs.size());
            }
        } catch (RuntimeException e) {
            log.error("Monitoring tick failed", e);
        }
    }
}
