package com.auditq.monitoring;

import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

@Repository
public interface MonitoringConfigRepository extends JpaRepository<MonitoringConfig, UUID> {

    @Query("SELECT c FROM MonitoringConfig c WHERE c.active = true " +
            "AND (c.nextRunAt IS NULL OR c.nextRunAt <= :now) " +
            "ORDER BY c.nextRunAt ASC NULLS FIRST, c.id ASC")
    List<MonitoringConfig> findDue(@Param("now") OffsetDateTime now, Pageable pageable);

    @Modifying(clearAutomatically = true)
    @Transactional
    @Query("UPDATE MonitoringConfig c SET c.lastRunAt = :now, c.nextRunAt = :nextRunAt " +
            "WHERE c.id = :id AND c.active = true AND c.nextRunAt = :expectedNextRunAt")
    int claim(@Param("id") UUID id,
            @Param("expectedNextRunAt") OffsetDateTime expectedNextRunAt,
            @Param("nextRunAt") OffsetDateTime nextRunAt,
            @Param("now") OffsetDateTime now);

    @Modifying(clearAutomatically = true)
    @Transactional
    @Query("UPDATE MonitoringConfig c SET c.lastRunAt = :now, c.nextRunAt = :nextRunAt " +
            "WHERE c.id = :id AND c.active = true AND c.nextRunAt IS NULL")
    int claimUnscheduled(@Param("id") UUID id,
            @Param("nextRunAt") OffsetDateTime nextRunAt,
            @Param("now") OffsetDateTime now);

    @Modifying(clearAutomatically = true)
    @Transactional
    @Query("UPDATE MonitoringConfig c SET c.active = :active WHERE c.id = :id")
    int updateActive(@Param("id") UUID id, @Param("active") boolean active);
}
