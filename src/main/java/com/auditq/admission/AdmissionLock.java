package com.auditq.admission;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.support.JdbcUtils;
import org.springframework.jdbc.support.MetaDataAccessException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionTemplate;

import javax.sql.DataSource;
import java.sql.DatabaseMetaData;
import java.util.Locale;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Serializes count-then-insert admission per resource so the concurrency cap holds even when callers
 * race. Inside one JVM a striped lock is enough; on PostgreSQL a transaction-scoped advisory lock
 * extends the guarantee to every node sharing the database.
 */
@Component
public class AdmissionLock {

    private static final Logger log = LoggerFactory.getLogger(AdmissionLock.class);
    private static final int STRIPES = 64;
    // First half of the two-int advisory lock key; keeps AuditQ locks apart from the host's own.
    private static final int ADVISORY_LOCK_NAMESPACE = 0x41_75_64_51;

    private final TransactionTemplate transactionTemplate;
    private final JdbcTemplate jdbcTemplate;
    private final boolean postgres;
    private final ReentrantLock[] stripes = new ReentrantLock[STRIPES];

    public AdmissionLock(TransactionTemplate transactionTemplate, JdbcTemplate jdbcTemplate, DataSource dataSource) {
        this.transactionTemplate = transactionTemplate;
        this.jdbcTemplate = jdbcTemplate;
        this.postgres = isPostgres(dataSource);
        for (int i = 0; i < STRIPES; i++) {
            stripes[i] = new ReentrantLock();
        }
    }

    /**
     * Runs {@code work} in a new transaction while holding the admission lock for {@code key}. The lock
     * is released only after the transaction commits or rolls back.
     */
    public <T> T execute(String key, Supplier<T> work) {
        ReentrantLock lock = stripes[Math.floorMod(key.hashCode(), STRIPES)];
        lock.lock();
        try {
            return transactionTemplate.execute(status -> {
                if (postgres) {
                    jdbcTemplate.query("SELECT pg_advisory_xact_lock(?, ?)", rs -> null,
                            ADVISORY_LOCK_NAMESPACE, key.hashCode());
                }
                return work.get();
            });
        } finally {
            lock.unlock();
        }
    }

    private static boolean isPostgres(DataSource dataSource) {
        try {
            String product = JdbcUtils.extractDatabaseMetaData(dataSource, DatabaseMetaData::getDatabaseProductName);
            return product != null && product.toLowerCase(Locale.ROOT).contains("postgresql");
        } catch (MetaDataAccessException | RuntimeException e) {
            log.warn("Could not determine database product; admission lock is limited to this JVM", e);
            return false;
        }
    }
}
