package com.auditq.admission;

/**
 * Work was rejected before anything was written. The caller sees it synchronously and the system
 * never retries it.
 */
public abstract class AdmissionException extends RuntimeException {

    protected AdmissionException(String message) {
        super(message);
    }

    /**
     * Stable machine-readable reason, rendered as {@code error} in API responses.
     */
    public abstract String errorCode();
}
