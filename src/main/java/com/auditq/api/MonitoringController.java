package com.auditq.api;

import com.auditq.ResourceAccessPolicy;
import com.auditq.admission.ResourceAccessDeniedException;
import com.auditq.monitoring.MonitoringConfig;
import com.auditq.monitoring.MonitoringConfigDefinition;
import com.auditq.monitoring.MonitoringRun;
import com.auditq.monitoring.RecurringMonitor;
import com.auditq.monitoring.RunTrigger;
import com.auditq.monitoring.ThresholdAlert;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.security.Principal;
import java.util.List;
import java.util.Map;
import java.util.UUID;

@RestController
@RequestMapping("/monitoring")
public class MonitoringController {

    private final RecurringMonitor recurringMonitor;
    private final ResourceAccessPolicy accessPolicy;

    public MonitoringController(RecurringMonitor recurringMonitor, ResourceAccessPolicy accessPolicy) {
        this.recurringMonitor = recurringMonitor;
        this.accessPolicy = accessPolicy;
    }

    @PostMapping("/configs")
    public ResponseEntity<MonitoringConfig> createConfig(@RequestBody MonitoringConfigDefinition definition,
            Principal principal) {
        if (definition == null) {
            throw new IllegalArgumentException("Request body is required");
        }
        if (definition.resourceId() != null) {
            checkAccess(principal, definition.resourceId().trim());
        }
        return ResponseEntity.status(HttpStatus.CREATED).body(recurringMonitor.createConfig(definition));
    }

    @GetMapping("/configs/{configId}")
    public MonitoringConfig getConfig(@PathVariable("configId") UUID configId, Principal principal) {
        return accessibleConfig(configId, principal);
    }

    @PostMapping("/configs/{configId}/active")
    public MonitoringConfig setActive(@PathVariable("configId") UUID configId, @RequestBody SetActiveRequest request,
            Principal principal) {
        if (request == null || request.active() == null) {
            throw new IllegalArgumentException("active must be provided");
        }
        accessibleConfig(configId, principal);
        return recurringMonitor.setActive(configId, request.active());
    }

    @PostMapping("/{configId}/run")
    public ResponseEntity<Map<String, UUID>> trigger(@PathVariable("configId") UUID configId,
            @RequestBody TriggerRunRequest request, Principal principal) {
        if (request == null) {
            throw new IllegalArgumentException("Request body is required");
        }
        RunTrigger trigger = RunTrigger.fromValue(request.triggerType());
        accessibleConfig(configId, principal);
        MonitoringRun run = recurringMonitor.trigger(configId, trigger, request.triggerContext());
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(Map.of("runId", run.getId()));
    }

    @GetMapping("/{configId}/runs")
    public List<MonitoringRun> runs(@PathVariable("configId") UUID configId, Principal principal) {
        accessibleConfig(configId, principal);
        return recurringMonitor.runsFor(configId);
    }

    @GetMapping("/runs/{runId}/alerts")
    public List<ThresholdAlert> alerts(@PathVariable("runId") UUID runId, Principal principal) {
        MonitoringRun run = recurringMonitor.findRun(runId);
        accessibleConfig(run.getConfigId(), principal);
        return recurringMonitor.alertsFor(runId);
    }

    /**
     * Runs one scheduling tick. Meant for an external cron when the in-process background server is
     * disabled.
     */
    @PostMapping("/process")
    public Map<String, List<UUID>> process() {
        List<UUID> runIds = recurringMonitor.tick().stream().map(MonitoringRun::getId).toList();
        return Map.of("processedRunIds", runIds);
    }

    private MonitoringConfig accessibleConfig(UUID configId, Principal principal) {
        MonitoringConfig config = recurringMonitor.findConfig(configId);
        checkAccess(principal, config.getResourceId());
        return config;
    }

    private void checkAccess(Principal principal, String resourceId) {
        if (!accessPolicy.canAccess(principal, resourceId)) {
            throw new ResourceAccessDeniedException(resourceId);
        }
    }
}
