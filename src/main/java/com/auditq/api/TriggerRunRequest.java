package com.auditq.api;

import com.fasterxml.jackson.databind.JsonNode;

public record TriggerRunRequest(String triggerType, JsonNode triggerContext) {
}
