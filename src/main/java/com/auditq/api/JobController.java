package com.auditq.api;

import com.auditq.Job;
import com.auditq.JobRequest;
import com.auditq.JobScheduler;
import com.auditq.QueueStatus;
import com.auditq.TriggerData;
import com.auditq.TriggerType;
import com.auditq.internal.QueueProcessor;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.security.Principal;
import java.util.Collections;
import java.util.Map;
import java.util.UUID;

@RestController
@RequestMapping("/jobs")
public class JobController {

    private final JobScheduler jobScheduler;
    private final QueueProcessor queueProcessor;
    private final ObjectMapper objectMapper;

    public JobController(JobScheduler jobScheduler, QueueProcessor queueProcessor, ObjectMapper objectMapper) {
        this.jobScheduler = jobScheduler;
        this.queueProcessor = queueProcessor;
        this.objectMapper = objectMapper;
    }

    @PostMapping
    public ResponseEntity<Job> create(@RequestBody CreateJobRequest request, Principal principal) {
        if (request == null) {
            throw new IllegalArgumentException("Request body is required");
        }
        TriggerType triggerType = TriggerType.fromValue(request.triggerType());
        TriggerData triggerData = toTriggerData(triggerType, request.triggerData());
        JobRequest jobRequest = new JobRequest(request.resourceId(), triggerData, request.priority(),
                request.scheduledAt(), request.maxRetries());
        Job job = jobScheduler.enqueue(principal, jobRequest);
        return ResponseEntity.status(HttpStatus.CREATED).body(job);
    }

    @GetMapping
    public QueueStatus list(@RequestParam(name = "resourceId", required = false) String resourceId,
            Principal principal) {
        return jobScheduler.queueStatus(principal, resourceId);
    }

    @GetMapping("/{id}")
    public Job get(@PathVariable("id") UUID id, Principal principal) {
        return jobScheduler.getJob(principal, id);
    }

    @PostMapping("/{id}/cancel")
    public Job cancel(@PathVariable("id") UUID id, Principal principal) {
        return jobScheduler.cancel(principal, id);
    }

    /**
     * Reclaims expired leases, then processes one eligible job synchronously. Meant for an external cron
     * when the in-process background server is disabled.
     */
    @PostMapping("/process")
    public Map<String, UUID> process() {
        UUID processed = queueProcessor.tick().orElse(null);
        return Collections.singletonMap("processedJobId", processed);
    }

    private TriggerData toTriggerData(TriggerType triggerType, JsonNode payload) {
        if (payload != null && !payload.isNull() && !payload.isObject()) {
            throw new IllegalArgumentException("triggerData must be a JSON object");
        }
        ObjectNode node = payload == null || payload.isNull()
                ? objectMapper.createObjectNode()
                : ((ObjectNode) payload).deepCopy();
        node.put("kind", triggerType.value());
        TriggerData data = objectMapper.convertValue(node, TriggerData.class);
        if (!triggerType.dataClass().isInstance(data)) {
            throw new IllegalArgumentException("triggerData does not match triggerType " + triggerType.value());
        }
        return data;
    }
}
