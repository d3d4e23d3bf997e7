package com.auditq;

import jakarta.persistence.QueryHint;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.jpa.repository.QueryHints;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.OffsetDateTime;
import java.util.Collection;
import java.util.List;
import java.util.UUID;

/**
 * Every state change on a job row is a conditional update on the expected prior state. A return
 * value of {@code 0} means another worker (or the reaper) got there first.
 */
@Repository
public interface JobRepository extends JpaRepository<Job, UUID> {

    /**
     * Aggregated lifecycle counters fetched in a single query.
     */
    interface LifecycleCounts {
        Long getQueuedCount();

        Long getRunningCount();

        Long getRetryingCount();

        Long getCompletedCount();

        Long getFailedCount();

        Long getCancelledCount();
    }

    /**
     * Job count of one status within one resource.
     */
    interface ResourceStatusCount {
        String getResourceId();

        JobStatus getStatus();

        Long getJobCount();
    }

    @Query("""
            SELECT j FROM Job j
            WHERE j.status IN :statuses
              AND j.scheduledAt <= :now
            ORDER BY j.priority DESC, j.scheduledAt ASC
            """)
    @QueryHints(@QueryHint(name = "org.hibernate.readOnly", value = "true"))
    List<Job> findEligible(@Param("statuses") Collection<JobStatus> statuses, @Param("now") OffsetDateTime now,
            Pageable pageable);

    @Query("""
            SELECT j FROM Job j
            WHERE j.status = com.auditq.JobStatus.RUNNING
              AND j.leaseExpiresAt < :now
            ORDER BY j.leaseExpiresAt ASC
            """)
    List<Job> findExpiredLeases(@Param("now") OffsetDateTime now, Pageable pageable);

    @Query("SELECT j.id FROM Job j WHERE j.id IN :ids AND j.cancelRequested = true")
    List<UUID> findCancelRequested(@Param("ids") Collection<UUID> ids);

    List<Job> findTop100ByResourceIdOrderByPriorityDescScheduledAtAsc(String resourceId);

    List<Job> findTop100ByResourceIdInOrderByPriorityDescScheduledAtAsc(Collection<String> resourceIds);

    @Query("""
            SELECT j.resourceId AS resourceId, j.status AS status, COUNT(j) AS jobCount
            FROM Job j
            GROUP BY j.resourceId, j.status
            """)
    List<ResourceStatusCount> countByResourceAndStatus();

    long countByResourceIdAndStatusIn(String resourceId, Collection<JobStatus> statuses);

    long countByStatusIn(Collection<JobStatus> statuses);

    @Query("""
            SELECT
              COALESCE(SUM(CASE WHEN j.status = com.auditq.JobStatus.QUEUED THEN 1 ELSE 0 END), 0) AS queuedCount,
              COALESCE(SUM(CASE WHEN j.status = com.auditq.JobStatus.RUNNING THEN 1 ELSE 0 END), 0) AS runningCount,
              COALESCE(SUM(CASE WHEN j.status = com.auditq.JobStatus.RETRYING THEN 1 ELSE 0 END), 0) AS retryingCount,
              COALESCE(SUM(CASE WHEN j.status = com.auditq.JobStatus.COMPLETED THEN 1 ELSE 0 END), 0) AS completedCount,
              COALESCE(SUM(CASE WHEN j.status = com.auditq.JobStatus.FAILED THEN 1 ELSE 0 END), 0) AS failedCount,
              COALESCE(SUM(CASE WHEN j.status = com.auditq.JobStatus.CANCELLED THEN 1 ELSE 0 END), 0) AS cancelledCount
            FROM Job j
            """)
    LifecycleCounts countLifecycleCounts();

    @Query("""
            SELECT
              COALESCE(SUM(CASE WHEN j.status = com.auditq.JobStatus.QUEUED THEN 1 ELSE 0 END), 0) AS queuedCount,
              COALESCE(SUM(CASE WHEN j.status = com.auditq.JobStatus.RUNNING THEN 1 ELSE 0 END), 0) AS runningCount,
              COALESCE(SUM(CASE WHEN j.status = com.auditq.JobStatus.RETRYING THEN 1 ELSE 0 END), 0) AS retryingCount,
              COALESCE(SUM(CASE WHEN j.status = com.auditq.JobStatus.COMPLETED THEN 1 ELSE 0 END), 0) AS completedCount,
              COALESCE(SUM(CASE WHEN j.status = com.auditq.JobStatus.FAILED THEN 1 ELSE 0 END), 0) AS failedCount,
              COALESCE(SUM(CASE WHEN j.status = com.auditq.JobStatus.CANCELLED THEN 1 ELSE 0 END), 0) AS cancelledCount
            FROM Job j
            WHERE j.resourceId = :resourceId
            """)
    LifecycleCounts countLifecycleCountsForResource(@Param("resourceId") String resourceId);

    @Modifying(clearAutomatically = true)
    @Transactional
    @Query("""
            UPDATE Job j
            SET j.status = com.auditq.JobStatus.RUNNING,
                j.startedAt = :now,
                j.progress = 0,
                j.statusMessage = NULL,
                j.lockedBy = :workerId,
                j.leaseExpiresAt = :leaseExpiresAt,
                j.cancelRequested = false,
                j.updatedAt = :now
            WHERE j.id = :id
              AND j.status = :expectedStatus
              AND j.scheduledAt <= :now
            """)
    int claim(
            @Param("id") UUID id,
            @Param("expectedStatus") JobStatus expectedStatus,
            @Param("workerId") String workerId,
            @Param("now") OffsetDateTime now,
            @Param("leaseExpiresAt") OffsetDateTime leaseExpiresAt);

    @Modifying(clearAutomatically = true)
    @Transactional
    @Query("""
            UPDATE Job j
            SET j.progress = :progress,
                j.statusMessage = :statusMessage,
                j.leaseExpiresAt = :leaseExpiresAt,
                j.updatedAt = :now
            WHERE j.id = :id
              AND j.status = com.auditq.JobStatus.RUNNING
              AND j.lockedBy = :workerId
              AND j.progress <= :progress
            """)
    int updateProgress(
            @Param("id") UUID id,
            @Param("workerId") String workerId,
            @Param("progress") int progress,
            @Param("statusMessage") String statusMessage,
            @Param("leaseExpiresAt") OffsetDateTime leaseExpiresAt,
            @Param("now") OffsetDateTime now);

    @Modifying(clearAutomatically = true)
    @Transactional
    @Query("""
            UPDATE Job j
            SET j.leaseExpiresAt = :leaseExpiresAt,
                j.updatedAt = :now
            WHERE j.id IN :ids
              AND j.status = com.auditq.JobStatus.RUNNING
              AND j.lockedBy = :workerId
            """)
    int renewLeases(
            @Param("ids") Collection<UUID> ids,
            @Param("workerId") String workerId,
            @Param("leaseExpiresAt") OffsetDateTime leaseExpiresAt,
            @Param("now") OffsetDateTime now);

    @Modifying(clearAutomatically = true)
    @Transactional
    @Query("""
            UPDATE Job j
            SET j.status = com.auditq.JobStatus.COMPLETED,
                j.progress = 100,
                j.completedAt = :now,
                j.resultSummary = :resultSummary,
                j.errorMessage = NULL,
                j.lockedBy = NULL,
                j.leaseExpiresAt = NULL,
                j.updatedAt = :now
            WHERE j.id = :id
              AND j.status = com.auditq.JobStatus.RUNNING
              AND j.lockedBy = :workerId
            """)
    int markCompleted(
            @Param("id") UUID id,
            @Param("workerId") String workerId,
            @Param("resultSummary") String resultSummary,
            @Param("now") OffsetDateTime now);

    @Modifying(clearAutomatically = true)
    @Transactional
    @Query("""
            UPDATE Job j
            SET j.status = com.auditq.JobStatus.RETRYING,
                j.retryCount = :nextRetryCount,
                j.scheduledAt = :nextScheduledAt,
                j.errorMessage = :errorMessage,
                j.progress = 0,
                j.lockedBy = NULL,
                j.leaseExpiresAt = NULL,
                j.updatedAt = :now
            WHERE j.id = :id
              AND j.status = com.auditq.JobStatus.RUNNING
              AND j.lockedBy = :workerId
              AND j.retryCount = :expectedRetryCount
            """)
    int markForRetry(
            @Param("id") UUID id,
            @Param("workerId") String workerId,
            @Param("expectedRetryCount") int expectedRetryCount,
            @Param("nextRetryCount") int nextRetryCount,
            @Param("errorMessage") String errorMessage,
            @Param("nextScheduledAt") OffsetDateTime nextScheduledAt,
            @Param("now") OffsetDateTime now);

    @Modifying(clearAutomatically = true)
    @Transactional
    @Query("""
            UPDATE Job j
            SET j.status = com.auditq.JobStatus.FAILED,
                j.completedAt = :now,
                j.errorMessage = :errorMessage,
                j.resultSummary = NULL,
                j.lockedBy = NULL,
                j.leaseExpiresAt = NULL,
                j.updatedAt = :now
            WHERE j.id = :id
              AND j.status = com.auditq.JobStatus.RUNNING
              AND j.lockedBy = :workerId
              AND j.retryCount = :expectedRetryCount
            """)
    int markFailed(
            @Param("id") UUID id,
            @Param("workerId") String workerId,
            @Param("expectedRetryCount") int expectedRetryCount,
            @Param("errorMessage") String errorMessage,
            @Param("now") OffsetDateTime now);

    @Modifying(clearAutomatically = true)
    @Transactional
    @Query("""
            UPDATE Job j
            SET j.status = com.auditq.JobStatus.CANCELLED,
                j.completedAt = :now,
                j.errorMessage = :reason,
                j.lockedBy = NULL,
                j.leaseExpiresAt = NULL,
                j.updatedAt = :now
            WHERE j.id = :id
              AND j.status = com.auditq.JobStatus.RUNNING
              AND j.lockedBy = :workerId
            """)
    int markCancelled(
            @Param("id") UUID id,
            @Param("workerId") String workerId,
            @Param("reason") String reason,
            @Param("now") OffsetDateTime now);

    @Modifying(clearAutomatically = true)
    @Transactional
    @Query("""
            UPDATE Job j
            SET j.status = com.auditq.JobStatus.CANCELLED,
                j.completedAt = :now,
                j.errorMessage = :reason,
                j.updatedAt = :now
            WHERE j.id = :id
              AND j.status = :expectedStatus
            """)
    int cancelPending(
            @Param("id") UUID id,
            @Param("expectedStatus") JobStatus expectedStatus,
            @Param("reason") String reason,
            @Param("now") OffsetDateTime now);

    @Modifying(clearAutomatically = true)
    @Transactional
    @Query("""
            UPDATE Job j
            SET j.cancelRequested = true,
                j.updatedAt = :now
            WHERE j.id = :id
              AND j.status = com.auditq.JobStatus.RUNNING
            """)
    int requestCancel(@Param("id") UUID id, @Param("now") OffsetDateTime now);

    /**
     * Feeds a job whose lease ran out back into the retry path. Keyed on the stale lease so a worker
     * that renewed in the meantime keeps its claim.
     */
    @Modifying(clearAutomatically = true)
    @Transactional
    @Query("""
            UPDATE Job j
            SET j.status = com.auditq.JobStatus.RETRYING,
                j.retryCount = :nextRetryCount,
                j.scheduledAt = :nextScheduledAt,
                j.errorMessage = :errorMessage,
                j.progress = 0,
                j.lockedBy = NULL,
                j.leaseExpiresAt = NULL,
                j.updatedAt = :now
            WHERE j.id = :id
              AND j.status = com.auditq.JobStatus.RUNNING
              AND j.leaseExpiresAt = :staleLeaseExpiresAt
              AND j.retryCount = :expectedRetryCount
            """)
    int reclaimForRetry(
            @Param("id") UUID id,
            @Param("staleLeaseExpiresAt") OffsetDateTime staleLeaseExpiresAt,
            @Param("expectedRetryCount") int expectedRetryCount,
            @Param("nextRetryCount") int nextRetryCount,
            @Param("errorMessage") String errorMessage,
            @Param("nextScheduledAt") OffsetDateTime nextScheduledAt,
            @Param("now") OffsetDateTime now);

    @Modifying(clearAutomatically = true)
    @Transactional
    @Query("""
            UPDATE Job j
            SET j.status = :terminalStatus,
                j.completedAt = :now,
                j.errorMessage = :errorMessage,
                j.lockedBy = NULL,
                j.leaseExpiresAt = NULL,
                j.updatedAt = :now
            WHERE j.id = :id
              AND j.status = com.auditq.JobStatus.RUNNING
              AND j.leaseExpiresAt = :staleLeaseExpiresAt
            """)
    int reclaimAsTerminal(
            @Param("id") UUID id,
            @Param("staleLeaseExpiresAt") OffsetDateTime staleLeaseExpiresAt,
            @Param("terminalStatus") JobStatus terminalStatus,
            @Param("errorMessage") String errorMessage,
            @Param("now") OffsetDateTime now);
}
