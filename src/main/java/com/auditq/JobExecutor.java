package com.auditq;

import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.core.ResolvableType;
import org.springframework.util.ClassUtils;

import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Runs the analysis behind one trigger type. Register implementations as Spring beans; the
 * {@link com.auditq.internal.QueueProcessor} picks them up at startup. At most one executor may be
 * registered per trigger type.
 *
 * @param <T> the trigger payload this executor understands
 */
public interface JobExecutor<T extends TriggerData> {

    Map<Class<?>, Class<?>> TRIGGER_DATA_CLASS_CACHE = new ConcurrentHashMap<>();

    /**
     * Executes one attempt of a job.
     * Any exception thrown from this method fails the attempt; the retry policy then decides whether
     * the job is retried or permanently failed. Throwing {@link JobCancelledException} after observing
     * {@link JobExecutionContext#isCancellationRequested()} cancels the job instead.
     *
     * @param jobId       the job being executed
     * @param triggerData the job's payload
     * @param context     progress reporting and cancellation
     * @return the result summary recorded on the completed job, may be {@code null}
     * @throws Exception if the attempt fails
     */
    JsonNode execute(UUID jobId, T triggerData, JobExecutionContext context) throws Exception;

    /**
     * Returns the payload class. By default, this is inferred from {@code JobExecutor<T>}.
     */
    @SuppressWarnings("unchecked")
    default Class<T> getTriggerDataClass() {
        Class<?> targetClass = ClassUtils.getUserClass(this);
        return (Class<T>) TRIGGER_DATA_CLASS_CACHE.computeIfAbsent(targetClass, JobExecutor::inferTriggerDataClass);
    }

    default TriggerType getTriggerType() {
        return TriggerType.forDataClass(getTriggerDataClass());
    }

    private static Class<?> inferTriggerDataClass(Class<?> targetClass) {
        Class<?> resolved = ResolvableType.forClass(targetClass)
                .as(JobExecutor.class)
                .getGeneric(0)
                .resolve();
        if (resolved == null || resolved == TriggerData.class) {
            throw new IllegalStateException("JobExecutor " + targetClass.getName()
                    + " trigger data type cannot be inferred. Use a concrete TriggerData variant or override getTriggerDataClass().");
        }
        return resolved;
    }
}
