package com.auditq.internal;

import com.auditq.config.AuditQProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.InitializingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.core.io.ByteArrayResource;
import org.springframework.core.io.Resource;
import org.springframework.core.io.support.EncodedResource;
import org.springframework.core.io.support.PathMatchingResourcePatternResolver;
import org.springframework.jdbc.datasource.init.ScriptUtils;
import org.springframework.stereotype.Component;
import org.springframework.util.StreamUtils;

import javax.sql.DataSource;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Applies the versioned SQL scripts under {@code auditq/migration} once per database and records them
 * with a checksum. The configured table prefix is applied to every {@code auditq_} identifier in the
 * scripts, so prefixed and unprefixed installations can share a schema.
 */
@Component
@ConditionalOnProperty(prefix = "auditq.database", name = "skip-create", havingValue = "false", matchIfMissing = true)
public class AuditQSchemaInitializer implements InitializingBean {

    private static final Logger log = LoggerFactory.getLogger(AuditQSchemaInitializer.class);
    static final String MIGRATION_LOCATION = "classpath*:auditq/migration/V*__*.sql";
    private static final Pattern SCRIPT_NAME = Pattern.compile("^V(\\d+(?:_\\d+)*)__([A-Za-z0-9_\\-]+)\\.sql$");
    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");
    private static final Pattern AUDITQ_IDENTIFIER = Pattern.compile("(?<![A-Za-z0-9_])auditq_");
    private static final long MIGRATION_LOCK_KEY = 0x41_75_64_69_74_51_4D_31L;

    private final DataSource dataSource;
    private final String tablePrefix;
    private final boolean failOnMigrationError;

    public AuditQSchemaInitializer(DataSource dataSource, AuditQProperties properties) {
        this.dataSource = dataSource;
        this.tablePrefix = validatedPrefix(properties.getDatabase().getTablePrefix());
        this.failOnMigrationError = properties.getDatabase().isFailOnMigrationError();
    }

    @Override
    public void afterPropertiesSet() {
        String historyTable = render("auditq_schema_migrations");
        try (Connection connection = dataSource.getConnection()) {
            boolean postgres = isPostgres(connection);
            if (postgres) {
                executeLockFunction(connection, "pg_advisory_lock");
            }
            try {
                migrate(connection, historyTable);
            } finally {
                if (postgres) {
                    unlock(connection);
                }
            }
        } catch (Exception e) {
            if (failOnMigrationError) {
                throw new IllegalStateException("AuditQ schema migration failed", e);
            }
            log.error("AuditQ schema migration failed; continuing because "
                    + "auditq.database.fail-on-migration-error=false", e);
        }
    }

    private void migrate(Connection connection, String historyTable) throws SQLException, IOException {
        createHistoryTable(connection, historyTable);
        List<Migration> available = discover();
        if (available.isEmpty()) {
            throw new IllegalStateException("No AuditQ migrations found at " + MIGRATION_LOCATION);
        }
        Map<String, String> applied = appliedChecksums(connection, historyTable);
        verify(available, applied);

        int count = 0;
        for (Migration migration : available) {
            if (!applied.containsKey(migration.version())) {
                apply(connection, historyTable, migration);
                count++;
            }
        }
        if (count == 0) {
            log.info("AuditQ schema up to date ({} migration(s) in {})", applied.size(), historyTable);
        } else {
            log.info("Applied {} AuditQ migration(s) to {}", count, historyTable);
        }
    }

    private void createHistoryTable(Connection connection, String historyTable) throws SQLException {
        try (Statement statement = connection.createStatement()) {
            statement.execute("CREATE TABLE IF NOT EXISTS " + historyTable + " ("
                    + "version VARCHAR(64) PRIMARY KEY, "
                    + "description VARCHAR(255) NOT NULL, "
                    + "checksum VARCHAR(64) NOT NULL, "
                    + "installed_on TIMESTAMP WITH TIME ZONE DEFAULT CURRENT_TIMESTAMP NOT NULL, "
                    + "execution_time_ms BIGINT NOT NULL)");
        }
    }

    private List<Migration> discover() throws IOException {
        Resource[] resources = new PathMatchingResourcePatternResolver().getResources(MIGRATION_LOCATION);
        Map<String, Migration> byVersion = new LinkedHashMap<>();
        for (Resource resource : resources) {
            Migration migration = Migration.from(resource);
            if (migration == null) {
                continue;
            }
            Migration duplicate = byVersion.putIfAbsent(migration.version(), migration);
            if (duplicate != null) {
                throw new IllegalStateException("AuditQ migration version V" + migration.version()
                        + " is defined by both " + duplicate.fileName() + " and " + migration.fileName());
            }
        }
        List<Migration> ordered = new ArrayList<>(byVersion.values());
        ordered.sort(Comparator.comparing(Migration::version, AuditQSchemaInitializer::compareVersions));
        return ordered;
    }

    private Map<String, String> appliedChecksums(Connection connection, String historyTable) throws SQLException {
        Map<String, String> applied = new LinkedHashMap<>();
        try (PreparedStatement statement = connection.prepareStatement(
                "SELECT version, checksum FROM " + historyTable);
                ResultSet rs = statement.executeQuery()) {
            while (rs.next()) {
                applied.put(rs.getString(1), rs.getString(2));
            }
        }
        return applied;
    }

    private static void verify(List<Migration> available, Map<String, String> applied) {
        Map<String, Migration> byVersion = new LinkedHashMap<>();
        available.forEach(migration -> byVersion.put(migration.version(), migration));
        applied.forEach((version, checksum) -> {
            Migration migration = byVersion.get(version);
            if (migration == null) {
                throw new IllegalStateException("AuditQ migration V" + version
                        + " is recorded in the database but missing from the classpath");
            }
            if (!migration.checksum().equals(checksum)) {
                throw new IllegalStateException("AuditQ migration " + migration.fileName()
                        + " was modified after it was applied");
            }
        });
    }

    private void apply(Connection connection, String historyTable, Migration migration) throws SQLException {
        boolean autoCommit = connection.getAutoCommit();
        long started = System.currentTimeMillis();
        connection.setAutoCommit(false);
        try {
            byte[] script = render(migration.sql()).getBytes(StandardCharsets.UTF_8);
            ScriptUtils.executeSqlScript(connection,
                    new EncodedResource(new ByteArrayResource(script, migration.fileName()), StandardCharsets.UTF_8));
            long elapsed = System.currentTimeMillis() - started;
            try (PreparedStatement insert = connection.prepareStatement("INSERT INTO " + historyTable
                    + " (version, description, checksum, execution_time_ms) VALUES (?, ?, ?, ?)")) {
                insert.setString(1, migration.version());
                insert.setString(2, migration.description());
                insert.setString(3, migration.checksum());
                insert.setLong(4, elapsed);
                insert.executeUpdate();
            }
            connection.commit();
            log.info("Applied AuditQ migration {} in {} ms", migration.fileName(), elapsed);
        } catch (SQLException | RuntimeException e) {
            connection.rollback();
            throw new IllegalStateException("AuditQ migration " + migration.fileName() + " failed", e);
        } finally {
            connection.setAutoCommit(autoCommit);
        }
    }

    String render(String sql) {
        if (tablePrefix.isEmpty()) {
            return sql;
        }
        return AUDITQ_IDENTIFIER.matcher(sql).replaceAll(Matcher.quoteReplacement(tablePrefix + "auditq_"));
    }

    private static boolean isPostgres(Connection connection) throws SQLException {
        String product = connection.getMetaData().getDatabaseProductName();
        return product != null && product.toLowerCase(Locale.ROOT).contains("postgresql");
    }

    private static void executeLockFunction(Connection connection, String function) throws SQLException {
        try (PreparedStatement statement = connection.prepareStatement("SELECT " + function + "(?)")) {
            statement.setLong(1, MIGRATION_LOCK_KEY);
            statement.execute();
        }
    }

    private static void unlock(Connection connection) {
        try {
            executeLockFunction(connection, "pg_advisory_unlock");
        } catch (SQLException e) {
            log.warn("Could not release AuditQ migration lock; it is released when the connection closes", e);
        }
    }

    private static String validatedPrefix(String prefix) {
        if (prefix == null || prefix.isBlank()) {
            return "";
        }
        String trimmed = prefix.trim();
        if (!IDENTIFIER.matcher(trimmed).matches()) {
            throw new IllegalArgumentException("Invalid auditq.database.table-prefix: " + trimmed);
        }
        return trimmed;
    }

    static int compareVersions(String left, String right) {
        String[] l = left.split("_");
        String[] r = right.split("_");
        for (int i = 0; i < Math.max(l.length, r.length); i++) {
            long a = i < l.length ? Long.parseLong(l[i]) : 0;
            long b = i < r.length ? Long.parseLong(r[i]) : 0;
            if (a != b) {
                return Long.compare(a, b);
            }
        }
        return 0;
    }

    private record Migration(String version, String description, String fileName, String sql, String checksum) {

        static Migration from(Resource resource) throws IOException {
            String fileName = resource.getFilename();
            if (fileName == null) {
                return null;
            }
            Matcher matcher = SCRIPT_NAME.matcher(fileName);
            if (!matcher.matches()) {
                throw new IllegalStateException("AuditQ migration " + fileName
                        + " does not follow V<version>__<description>.sql");
            }
            String sql = StreamUtils.copyToString(resource.getInputStream(), StandardCharsets.UTF_8);
            return new Migration(matcher.group(1), matcher.group(2).replace('_', ' '), fileName, sql, sha256(sql));
        }

        private static String sha256(String sql) {
            try {
                byte[] hash = MessageDigest.getInstance("SHA-256").digest(sql.getBytes(StandardCharsets.UTF_8));
                return HexFormat.of().formatHex(hash);
            } catch (NoSuchAlgorithmException e) {
                throw new IllegalStateException("SHA-256 not available", e);
            }
        }
    }
}
