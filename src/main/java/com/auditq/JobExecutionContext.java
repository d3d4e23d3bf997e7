package com.auditq;

/**
 * Handed to a {@link JobExecutor} for the duration of one attempt.
 */
public interface JobExecutionContext {

    /**
     * 1-based attempt number; {@code retryCount + 1}.
     */
    int attempt();

    /**
     * Records progress for observers. Values lower than the last reported progress of this attempt are
     * ignored; values outside {@code 0..100} are clamped.
     */
    void reportProgress(int percent, String statusMessage);

    boolean isCancellationRequested();

    /**
     * @throws JobCancelledException if a user asked to cancel this job
     */
    default void throwIfCancellationRequested() {
        if (isCancellationRequested()) {
            throw new JobCancelledException("Job cancellation requested");
        }
    }
}
