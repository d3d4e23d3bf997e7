package com.auditq.api;

import com.auditq.ResourceAccessPolicy;
import com.auditq.admission.ResourceAccessDeniedException;
import com.auditq.broadcast.SseBroadcaster;
import com.auditq.monitoring.RecurringMonitor;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.security.Principal;
import java.util.UUID;

/**
 * Server-Sent-Event subscriptions. Topics are {@code resource:{resourceId}} and
 * {@code monitoring:{configId}}. Served only when the active {@code Broadcaster} is the SSE one.
 */
@RestController
@RequestMapping("/events")
public class EventStreamController {

    private static final String RESOURCE_PREFIX = "resource:";
    private static final String MONITORING_PREFIX = "monitoring:";

    private final ObjectProvider<SseBroadcaster> broadcaster;
    private final RecurringMonitor recurringMonitor;
    private final ResourceAccessPolicy accessPolicy;

    public EventStreamController(ObjectProvider<SseBroadcaster> broadcaster, RecurringMonitor recurringMonitor,
            ResourceAccessPolicy accessPolicy) {
        this.broadcaster = broadcaster;
        this.recurringMonitor = recurringMonitor;
        this.accessPolicy = accessPolicy;
    }

    @GetMapping(value = "/{topic}", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public SseEmitter subscribe(@PathVariable("topic") String topic, Principal principal) {
        SseBroadcaster sse = broadcaster.getIfAvailable();
        if (sse == null) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, "Event streams are not served by this node");
        }
        String resourceId = owningResource(topic);
        if (!accessPolicy.canAccess(principal, resourceId)) {
            throw new ResourceAccessDeniedException(resourceId);
        }
        return sse.subscribe(topic);
    }

    private String owningResource(String topic) {
        if (topic.startsWith(RESOURCE_PREFIX) && topic.length() > RESOURCE_PREFIX.length()) {
            return topic.substring(RESOURCE_PREFIX.length());
        }
        if (topic.startsWith(MONITORING_PREFIX)) {
            UUID configId = UUID.fromString(topic.substring(MONITORING_PREFIX.length()));
            return recurringMonitor.findConfig(configId).getResourceId();
        }
        throw new IllegalArgumentException("Unknown topic: " + topic);
    }
}
