package com.auditq.monitoring;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public record AuditResult(Map<String, Double> scores) {

    public AuditResult {
        scores = scores == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(scores));
    }

    public static AuditResult of(Map<String, Double> scores) {
        return new AuditResult(scores);
    }

    public boolean isEmpty() {
        return scores.isEmpty();
    }
}
