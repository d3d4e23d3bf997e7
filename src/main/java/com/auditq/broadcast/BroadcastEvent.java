package com.auditq.broadcast;

import java.time.OffsetDateTime;

public record BroadcastEvent(String type, Object payload, OffsetDateTime publishedAt) {

    public static final String JOB_CREATED = "job.created";
    public static final String JOB_RUNNING = "job.running";
    public static final String JOB_PROGRESS = "job.progress";
    public static final String JOB_COMPLETED = "job.completed";
    public static final String JOB_RETRYING = "job.retrying";
    public static final String JOB_FAILED = "job.failed";
    public static final String JOB_CANCELLED = "job.cancelled";
    public static final String RUN_STARTED = "run.started";
    public static final String RUN_PROGRESS = "run.progress";
    public static final String RUN_COMPLETED = "run.completed";
    public static final String RUN_FAILED = "run.failed";
    public static final String ALERT_CREATED = "alert.created";

    public static BroadcastEvent of(String type, Object payload, OffsetDateTime publishedAt) {
        return new BroadcastEvent(type, payload, publishedAt);
    }
}
