package com.cronq;

import com.cronq.config.CronQProperties;
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
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Applies the versioned {@code cronq/migration/V{n}__{description}.sql} scripts that
 * have not been applied yet, under a Postgres advisory lock so that concurrently
 * starting nodes migrate once.
 */
@Component
@ConditionalOnProperty(prefix = "cronq.database", name = "skip-create", havingValue = "false", matchIfMissing = true)
public class JobSchemaInitializer implements InitializingBean {

    private static final Logger log = LoggerFactory.getLogger(JobSchemaInitializer.class);
    private static final Pattern SAFE_IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");
    private static final Pattern VERSION_FILE_PATTERN = Pattern.compile("^V([0-9]+)__([A-Za-z0-9_\\-]+)\\.sql$");
    private static final String MIGRATION_RESOURCE_PATTERN = "classpath*:cronq/migration/V*__*.sql";
    private static final long POSTGRES_ADVISORY_LOCK_KEY = 4_112_907_334_517_220_011L;

    private final DataSource dataSource;
    private final PathMatchingResourcePatternResolver resourceResolver = new PathMatchingResourcePatternResolver();
    private final String tablePrefix;
    private final boolean failOnMigrationError;

    public JobSchemaInitializer(DataSource dataSource, CronQProperties properties) {
        this.dataSource = dataSource;
        this.tablePrefix = normalizePrefix(properties.getDatabase().getTablePrefix());
        this.failOnMigrationError = properties.getDatabase().isFailOnMigrationError();
    }

    @Override
    public void afterPropertiesSet() {
        String migrationTable = resolveIdentifier("cronq_schema_migrations");
        String jobsTable = resolveIdentifier("cronq_jobs");

        log.info("Initializing CronQ database schema using {}", migrationTable);

        try (Connection connection = dataSource.getConnection()) {
            boolean lockAcquired = acquireLockIfPostgres(connection);
            try {
                ensureMigrationTable(connection, migrationTable);
                Set<Integer> applied = loadAppliedVersions(connection, migrationTable);
                int appliedNow = 0;
                for (MigrationScript migration : loadMigrationScripts()) {
                    if (!applied.contains(migration.version())) {
                        applyMigration(connection, migrationTable, jobsTable, migration);
                        appliedNow++;
                    }
                }
                log.info("CronQ schema is up to date ({} migration(s) applied now, {} before).", appliedNow,
                        applied.size());
            } finally {
                releaseLockIfPostgres(connection, lockAcquired);
            }
        } catch (Exception e) {
            String message = "Failed to initialize CronQ database schema";
            if (failOnMigrationError) {
                throw new IllegalStateException(message, e);
            }
            log.error("{} (continuing because cronq.database.fail-on-migration-error=false)", message, e);
        }
    }

    private void ensureMigrationTable(Connection connection, String migrationTable) throws SQLException {
        String sql = """
                CREATE TABLE IF NOT EXISTS %s (
                    version INTEGER PRIMARY KEY,
                    description VARCHAR(255) NOT NULL,
                    installed_on TIMESTAMP WITH TIME ZONE NOT NULL DEFAULT CURRENT_TIMESTAMP
                )
                """.formatted(migrationTable);
        try (Statement statement = connection.createStatement()) {
            statement.execute(sql);
        }
    }

    private Set<Integer> loadAppliedVersions(Connection connection, String migrationTable) throws SQLException {
        Set<Integer> applied = new HashSet<>();
        try (PreparedStatement statement = connection.prepareStatement("SELECT version FROM " + migrationTable);
                ResultSet rs = statement.executeQuery()) {
            while (rs.next()) {
                applied.add(rs.getInt("version"));
            }
        }
        return applied;
    }

    private List<MigrationScript> loadMigrationScripts() throws IOException {
        Resource[] resources = resourceResolver.getResources(MIGRATION_RESOURCE_PATTERN);
        List<MigrationScript> scripts = new ArrayList<>(resources.length);
        for (Resource resource : resources) {
            String fileName = resource.getFilename();
            if (fileName == null) {
                continue;
            }
            Matcher matcher = VERSION_FILE_PATTERN.matcher(fileName);
            if (!matcher.matches()) {
                throw new IllegalStateException(
                        "Invalid CronQ migration filename '" + fileName + "'. Expected format: V{version}__{description}.sql");
            }
            String sql = StreamUtils.copyToString(resource.getInputStream(), StandardCharsets.UTF_8);
            scripts.add(new MigrationScript(Integer.parseInt(matcher.group(1)), matcher.group(2).replace('_', ' '),
                    fileName, sql));
        }
        if (scripts.isEmpty()) {
            throw new IllegalStateException("No CronQ migrations were found on classpath pattern "
                    + MIGRATION_RESOURCE_PATTERN);
        }
        scripts.sort(Comparator.comparingInt(MigrationScript::version));
        return scripts;
    }

    private void applyMigration(Connection connection, String migrationTable, String jobsTable,
            MigrationScript migration) throws SQLException {
        boolean originalAutoCommit = connection.getAutoCommit();
        try {
            connection.setAutoCommit(false);
            String resolvedSql = tablePrefix.isEmpty()
                    ? migration.sql()
                    : migration.sql().replace("cronq_jobs", jobsTable).replace("idx_cronq_jobs_",
                            tablePrefix + "idx_cronq_jobs_");
            ScriptUtils.executeSqlScript(connection, new EncodedResource(
                    new ByteArrayResource(resolvedSql.getBytes(StandardCharsets.UTF_8), migration.fileName()),
                    StandardCharsets.UTF_8));
            try (PreparedStatement statement = connection.prepareStatement(
                    "INSERT INTO " + migrationTable + " (version, description) VALUES (?, ?)")) {
                statement.setInt(1, migration.version());
                statement.setString(2, migration.description());
                statement.executeUpdate();
            }
            connection.commit();
            log.info("Applied CronQ migration V{} ({})", migration.version(), migration.description());
        } catch (Exception e) {
            connection.rollback();
            throw new IllegalStateException(
                    "Failed to apply CronQ migration V" + migration.version() + " (" + migration.description() + ")", e);
        } finally {
            connection.setAutoCommit(originalAutoCommit);
        }
    }

    private boolean acquireLockIfPostgres(Connection connection) throws SQLException {
        if (!isPostgres(connection)) {
            return false;
        }
        try (PreparedStatement statement = connection.prepareStatement("SELECT pg_advisory_lock(?)")) {
            statement.setLong(1, POSTGRES_ADVISORY_LOCK_KEY);
            statement.execute();
        }
        return true;
    }

    private void releaseLockIfPostgres(Connection connection, boolean lockAcquired) {
        if (!lockAcquired) {
            return;
        }
        try (PreparedStatement statement = connection.prepareStatement("SELECT pg_advisory_unlock(?)")) {
            statement.setLong(1, POSTGRES_ADVISORY_LOCK_KEY);
            statement.execute();
        } catch (SQLException e) {
            log.warn("Failed to release CronQ schema migration lock", e);
        }
    }

    private boolean isPostgres(Connection connection) throws SQLException {
        String dbName = connection.getMetaData().getDatabaseProductName();
        return dbName != null && dbName.toLowerCase(Locale.ROOT).contains("postgresql");
    }

    private String resolveIdentifier(String suffix) {
        String identifier = tablePrefix + suffix;
        if (!SAFE_IDENTIFIER.matcher(identifier).matches()) {
            throw new IllegalArgumentException("Unsupported SQL identifier for CronQ migration: " + identifier);
        }
        return identifier;
    }

    private static String normalizePrefix(String configuredPrefix) {
        String trimmed = configuredPrefix == null ? "" : configuredPrefix.trim();
        if (!trimmed.isEmpty() && !SAFE_IDENTIFIER.matcher(trimmed).matches()) {
            throw new IllegalArgumentException("Unsupported CronQ table-prefix: " + trimmed);
        }
        return trimmed;
    }

    private record MigrationScript(int version, String description, String fileName, String sql) {
    }
}
