package com.auditq.api;

public record SetActiveRequest(Boolean active) {
}
