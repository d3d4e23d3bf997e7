package com.auditq;

import com.auditq.ScriptedExecutors.ManualExecutor;
import com.auditq.ScriptedExecutors.ScriptedAuditExecutor;
import org.junit.jupiter.api.BeforeEach;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.ActiveProfiles;

import java.time.Instant;

/**
 * Shares one H2-backed context between the store-level tests and resets it before each test.
 */
@SpringBootTest(classes = {TestApplication.class, ScriptedExecutors.class})
@ActiveProfiles("test")
public abstract class AuditQIntegrationTestSupport {

    @Autowired
    protected JdbcTemplate jdbcTemplate;

    @Autowired
    protected MutableClock clock;

    @Autowired
    protected ManualExecutor manualExecutor;

    @Autowired
    protected ScriptedAuditExecutor auditExecutor;

    @BeforeEach
    protected void resetState() {
        jdbcTemplate.update("DELETE FROM auditq_threshold_alerts");
        jdbcTemplate.update("DELETE FROM auditq_monitoring_runs");
        jdbcTemplate.update("DELETE FROM auditq_monitoring_configs");
        jdbcTemplate.update("DELETE FROM auditq_jobs");
        clock.set(Instant.parse(ScriptedExecutors.START));
        manualExecutor.reset();
        auditExecutor.reset();
    }
}
