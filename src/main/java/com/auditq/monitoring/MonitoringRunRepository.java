package com.auditq.monitoring;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.OffsetDateTime;
import java.util.Collection;
import java.util.List;
import java.util.UUID;

@Repository
public interface MonitoringRunRepository extends JpaRepository<MonitoringRun, UUID> {

    @Query("SELECT COALESCE(SUM(r.totalTargets - r.completedTargets - r.failedTargets), 0) " +
            "FROM MonitoringRun r WHERE r.status IN :statuses")
    Long sumRemainingTargets(@Param("statuses") Collection<RunStatus> statuses);

    long countByConfigIdAndCreatedAtGreaterThanEqual(UUID configId, OffsetDateTime since);

    List<MonitoringRun> findTop50ByConfigIdOrderByCreatedAtDesc(UUID configId);
}
