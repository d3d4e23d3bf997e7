package com.auditq.api;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.OffsetDateTime;

/**
 * Body of {@code POST /jobs}. {@code triggerData} is interpreted according to {@code triggerType}.
 */
public record CreateJobRequest(
        String resourceId,
        String triggerType,
        JsonNode triggerData,
        Integer priority,
        OffsetDateTime scheduledAt,
        Integer maxRetries) {
}
