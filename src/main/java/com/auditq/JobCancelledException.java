package com.auditq;

/**
 * Thrown by an executor that stopped early because its job was cancelled.
 */
public class JobCancelledException extends RuntimeException {

    public JobCancelledException(String message) {
        super(message);
    }
}
