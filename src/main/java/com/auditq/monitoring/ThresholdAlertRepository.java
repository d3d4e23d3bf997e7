package com.auditq.monitoring;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface ThresholdAlertRepository extends JpaRepository<ThresholdAlert, UUID> {

    List<ThresholdAlert> findByRunIdOrderByCreatedAtAscTargetAscMetricNameAsc(UUID runId);
}
