package com.schedq;

import com.schedq.config.SchedQProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.InitializingBean;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.core.env.Environment;
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
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HexFormat;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Applies the versioned {@code schedq/migration/V*__*.sql} scripts once per database, recording each in
 * {@code schedq_schema_migrations} with a checksum. On PostgreSQL concurrent starts are serialized with an
 * advisory lock.
 */
@Component
@ConditionalOnProperty(prefix = "schedq.database", name = "skip-create", havingValue = "false", matchIfMissing = true)
public class SchedQSchemaInitializer implements InitializingBean {

    private static final Logger log = LoggerFactory.getLogger(SchedQSchemaInitializer.class);
    static final String MIGRATION_TABLE = "schedq_schema_migrations";
    private static final Pattern VERSION_FILE_PATTERN = Pattern.compile("^V([0-9]+(?:_[0-9]+)*)__([A-Za-z0-9_\\-]+)\\.sql$");
    private static final String MIGRATION_RESOURCE_PATTERN = "classpath*:schedq/migration/V*__*.sql";
    private static final long POSTGRES_ADVISORY_LOCK_KEY = 5_417_630_209_887_120_443L;

    private final DataSource dataSource;
    private final PathMatchingResourcePatternResolver resourceResolver = new PathMatchingResourcePatternResolver();
    private final boolean failOnMigrationError;

    public SchedQSchemaInitializer(
            DataSource dataSource,
            ObjectProvider<SchedQProperties> propertiesProvider,
            Environment environment) {
        this.dataSource = dataSource;
        SchedQProperties properties = propertiesProvider.getIfAvailable();
        this.failOnMigrationError = properties != null
                ? properties.getDatabase().isFailOnMigrationError()
                : environment.getProperty("schedq.database.fail-on-migration-error", Boolean.class, true);
    }

    @Override
    public void afterPropertiesSet() {
        log.info("Initializing scheduler database schema using {}", MIGRATION_TABLE);

        try (Connection connection = dataSource.getConnection()) {
            boolean lockAcquired = acquireLockIfPostgres(connection);
            try {
                ensureMigrationTable(connection);
                List<MigrationScript> migrations = loadMigrationScripts();
                if (migrations.isEmpty()) {
                    throw new IllegalStateException(
                            "No scheduler migrations were found on classpath pattern " + MIGRATION_RESOURCE_PATTERN);
                }

                Map<String, String> appliedChecksums = loadAppliedChecksums(connection);
                validateChecksums(migrations, appliedChecksums);
                int appliedNow = 0;
                for (MigrationScript migration : migrations) {
                    if (!appliedChecksums.containsKey(migration.version())) {
                        applyMigration(connection, migration);
                        appliedNow++;
                    }
                }

                if (appliedNow == 0) {
                    log.info("Scheduler schema is up to date. {} migration(s) already applied.", appliedChecksums.size());
                } else {
                    log.info("Applied {} scheduler migration(s). Schema is now up to date.", appliedNow);
                }
            } finally {
                releaseLockIfPostgres(connection, lockAcquired);
            }
        } catch (Exception e) {
            String message = "Failed to initialize scheduler database schema";
            if (failOnMigrationError) {
                throw new IllegalStateException(message, e);
            }
            log.error("{} (continuing because schedq.database.fail-on-migration-error=false)", message, e);
        }
    }

    private void ensureMigrationTable(Connection connection) throws SQLException {
        String sql = """
                CREATE TABLE IF NOT EXISTS %s (
                    version VARCHAR(64) PRIMARY KEY,
                    description VARCHAR(255) NOT NULL,
                    checksum VARCHAR(64) NOT NULL,
                    installed_on TIMESTAMP WITH TIME ZONE NOT NULL DEFAULT CURRENT_TIMESTAMP,
                    execution_time_ms BIGINT NOT NULL
                )
                """.formatted(MIGRATION_TABLE);
        try (Statement statement = connection.createStatement()) {
            statement.execute(sql);
        }
    }

    private List<MigrationScript> loadMigrationScripts() throws IOException {
        Resource[] resources = resourceResolver.getResources(MIGRATION_RESOURCE_PATTERN);
        List<MigrationScript> scripts = new ArrayList<>(resources.length);
        Map<String, String> fileByVersion = new HashMap<>();

        for (Resource resource : resources) {
            String fileName = resource.getFilename();
            if (fileName == null) {
                continue;
            }
            Matcher matcher = VERSION_FILE_PATTERN.matcher(fileName);
            if (!matcher.matches()) {
                throw new IllegalStateException("Invalid scheduler migration filename '" + fileName
                        + "'. Expected format: V{version}__{description}.sql");
            }
            String version = matcher.group(1);
            String previousFile = fileByVersion.putIfAbsent(version, fileName);
            if (previousFile != null) {
                throw new IllegalStateException("Duplicate scheduler migration version V" + version + " in files "
                        + previousFile + " and " + fileName);
            }
            String sql = StreamUtils.copyToString(resource.getInputStream(), StandardCharsets.UTF_8);
            scripts.add(new MigrationScript(version, parseVersion(version), matcher.group(2).replace('_', ' '),
                    resource, sha256(sql)));
        }

        scripts.sort(Comparator.comparing(MigrationScript::versionParts, SchedQSchemaInitializer::compareVersions));
        return scripts;
    }

    private Map<String, String> loadAppliedChecksums(Connection connection) throws SQLException {
        Map<String, String> applied = new HashMap<>();
        try (PreparedStatement statement = connection.prepareStatement(
                "SELECT version, checksum FROM " + MIGRATION_TABLE);
                ResultSet rs = statement.executeQuery()) {
            while (rs.next()) {
                applied.put(rs.getString("version"), rs.getString("checksum"));
            }
        }
        return applied;
    }

    private void validateChecksums(List<MigrationScript> migrations, Map<String, String> appliedChecksums) {
        Map<String, MigrationScript> scriptsByVersion = new HashMap<>();
        for (MigrationScript migration : migrations) {
            scriptsByVersion.put(migration.version(), migration);
        }
        for (Map.Entry<String, String> applied : appliedChecksums.entrySet()) {
            MigrationScript script = scriptsByVersion.get(applied.getKey());
            if (script == null) {
                throw new IllegalStateException("Migration V" + applied.getKey()
                        + " was applied in the database but is missing from the classpath.");
            }
            if (!script.checksum().equals(applied.getValue())) {
                throw new IllegalStateException("Checksum mismatch for migration V" + applied.getKey()
                        + ". The migration file changed after being applied.");
            }
        }
    }

    private void applyMigration(Connection connection, MigrationScript migration) {
        boolean originalAutoCommit = true;
        long started = System.nanoTime();
        try {
            originalAutoCommit = connection.getAutoCommit();
            connection.setAutoCommit(false);
            ScriptUtils.executeSqlScript(connection, new EncodedResource(migration.resource(), StandardCharsets.UTF_8));

            long executionMs = Duration.ofNanos(System.nanoTime() - started).toMillis();
            try (PreparedStatement statement = connection.prepareStatement("INSERT INTO " + MIGRATION_TABLE
                    + " (version, description, checksum, execution_time_ms) VALUES (?, ?, ?, ?)")) {
                statement.setString(1, migration.version());
                statement.setString(2, migration.description());
                statement.setString(3, migration.checksum());
                statement.setLong(4, executionMs);
                statement.executeUpdate();
            }
            connection.commit();
            log.info("Applied scheduler migration V{} ({}) in {} ms", migration.version(), migration.description(),
                    executionMs);
        } catch (Exception e) {
            try {
                connection.rollback();
            } catch (SQLException rollbackException) {
                log.error("Failed to rollback scheduler migration transaction", rollbackException);
            }
            throw new IllegalStateException("Failed to apply scheduler migration V" + migration.version() + " ("
                    + migration.description() + ")", e);
        } finally {
            try {
                connection.setAutoCommit(originalAutoCommit);
            } catch (SQLException e) {
                log.warn("Could not restore auto-commit after scheduler migration", e);
            }
        }
    }

    private boolean acquireLockIfPostgres(Connection connection) {
        try {
            if (!isPostgres(connection)) {
                return false;
            }
            try (PreparedStatement statement = connection.prepareStatement("SELECT pg_advisory_lock(?)")) {
                statement.setLong(1, POSTGRES_ADVISORY_LOCK_KEY);
                statement.execute();
            }
            return true;
        } catch (Exception e) {
            throw new IllegalStateException("Unable to acquire scheduler schema migration lock", e);
        }
    }

    private void releaseLockIfPostgres(Connection connection, boolean lockAcquired) {
        if (!lockAcquired) {
            return;
        }
        try (PreparedStatement statement = connection.prepareStatement("SELECT pg_advisory_unlock(?)")) {
            statement.setLong(1, POSTGRES_ADVISORY_LOCK_KEY);
            statement.execute();
        } catch (SQLException e) {
            log.warn("Failed to release scheduler schema migration lock", e);
        }
    }

    private static boolean isPostgres(Connection connection) throws SQLException {
        String dbName = connection.getMetaData().getDatabaseProductName();
        return dbName != null && dbName.toLowerCase(Locale.ROOT).contains("postgresql");
    }

    private static List<Integer> parseVersion(String version) {
        List<Integer> parsed = new ArrayList<>();
        for (String part : version.split("_")) {
            parsed.add(Integer.parseInt(part));
        }
        return parsed;
    }

    private static int compareVersions(List<Integer> left, List<Integer> right) {
        int max = Math.max(left.size(), right.size());
        for (int i = 0; i < max; i++) {
            int l = i < left.size() ? left.get(i) : 0;
            int r = i < right.size() ? right.get(i) : 0;
            if (l != r) {
                return Integer.compare(l, r);
            }
        }
        return 0;
    }

    private static String sha256(String input) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(input.getBytes(StandardCharsets.UTF_8)));
        } catch (Exception e) {
            throw new IllegalStateException("Unable to compute migration checksum", e);
        }
    }

    private record MigrationScript(
            String version,
            List<Integer> versionParts,
            String description,
            Resource resource,
            String checksum) {
    }
}
