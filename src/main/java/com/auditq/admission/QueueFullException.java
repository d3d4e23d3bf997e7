package com.auditq.admission;

import java.time.Duration;

/**
 * Backpressure signal: total pending work across all resources is at its ceiling. Callers should retry
 * after {@link #getRetryAfter()}.
 */
public class QueueFullException extends AdmissionException {

    private final long queueSize;
    private final int maxSize;
    private final Duration retryAfter;

    public QueueFullException(long queueSize, int requested, int maxSize, Duration retryAfter) {
        super("Queue is full (" + queueSize + " pending, " + requested + " requested, max " + maxSize
                + "). Please try again later.");
        this.queueSize = queueSize;
        this.maxSize = maxSize;
        this.retryAfter = retryAfter;
    }

    public long getQueueSize() {
        return queueSize;
    }

    public int getMaxSize() {
        return maxSize;
    }

    public Duration getRetryAfter() {
        return retryAfter;
    }

    @Override
    public String errorCode() {
        return "QueueFull";
    }
}
