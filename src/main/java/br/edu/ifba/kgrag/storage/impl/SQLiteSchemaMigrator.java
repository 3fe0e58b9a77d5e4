package br.edu.ifba.kgrag.storage.impl;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

import org.jboss.logging.Logger;

/**
 * Applies the SQL migrations under {@code /db/migrations/} in version order.
 *
 * <p>Each file is named {@code V{version}__{description}.sql} and must insert
 * its own row into {@code schema_version}. All pending migrations run in a
 * single transaction.</p>
 */
public final class SQLiteSchemaMigrator {

    private static final Logger LOG = Logger.getLogger(SQLiteSchemaMigrator.class);

    private static final String MIGRATION_PATH = "/db/migrations/";

    private final List<Migration> migrations;

    public SQLiteSchemaMigrator() {
        this.migrations = List.of(
            new ResourceMigration(1, "Knowledge graph and vector index schema",
                MIGRATION_PATH + "V001__initial_schema.sql"),
            new ResourceMigration(2, "Chunk to node mentions",
                MIGRATION_PATH + "V002__chunk_mentions.sql")
        );
    }

    /**
     * Gets current schema version from database.
     *
     * @param conn database connection
     * @return current version number, 0 if not initialized
     * @throws SQLException if the version table cannot be read
     */
    public int getCurrentVersion(Connection conn) throws SQLException {
        try (Statement stmt = conn.createStatement();
             ResultSet rs = stmt.executeQuery(
                 "SELECT name FROM sqlite_master WHERE type='table' AND name='schema_version'")) {
            if (!rs.next()) {
                return 0;
            }
        }

        try (Statement stmt = conn.createStatement();
             ResultSet rs = stmt.executeQuery("SELECT MAX(version) FROM schema_version")) {
            if (rs.next()) {
                int version = rs.getInt(1);
                if (!rs.wasNull()) {
                    return version;
                }
            }
        }
        return 0;
    }

    /**
     * Applies all pending migrations.
     *
     * @param conn database connection
     * @return the schema version after migrating
     * @throws SQLException if a migration fails; nothing is applied then
     */
    public int migrateToLatest(Connection conn) throws SQLException {
        int currentVersion = getCurrentVersion(conn);
        LOG.infof("Current schema version: %d", currentVersion);

        boolean autoCommit = conn.getAutoCommit();
        int version = currentVersion;
        try {
            conn.setAutoCommit(false);
            for (Migration migration : migrations) {
                if (migration.version() > currentVersion) {
                    LOG.infof("Applying migration V%03d: %s", migration.version(), migration.description());
                    migration.apply(conn);
                    version = migration.version();
                }
            }
            conn.commit();
        } catch (SQLException | RuntimeException e) {
            conn.rollback();
            throw e;
        } finally {
            conn.setAutoCommit(autoCommit);
        }

        if (version > currentVersion) {
            LOG.infof("Migrated schema from version %d to %d", currentVersion, version);
        }
        return version;
    }

    public List<Migration> getMigrations() {
        return new ArrayList<>(migrations);
    }

    /**
     * A schema migration step.
     */
    public interface Migration {

        int version();

        String description();

        void apply(Connection conn) throws SQLException;
    }

    private record ResourceMigration(int version, String description, String resourcePath) implements Migration {

        @Override
        public void apply(Connection conn) throws SQLException {
            try (Statement stmt = conn.createStatement()) {
                for (String statement : splitStatements(loadResource())) {
                    LOG.tracef("Executing: %s", statement.substring(0, Math.min(50, statement.length())));
                    stmt.execute(statement);
                }
            }
        }

        private String loadResource() {
            InputStream is = SQLiteSchemaMigrator.class.getResourceAsStream(resourcePath);
            if (is == null) {
                throw new IllegalStateException("Migration resource not found: " + resourcePath);
            }
            try (BufferedReader reader = new BufferedReader(new InputStreamReader(is, StandardCharsets.UTF_8))) {
                return reader.lines().collect(Collectors.joining("\n"));
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to load migration: " + resourcePath, e);
            }
        }
    }

    /**
     * Splits a script on semicolons outside quotes, dropping {@code --} comments.
     */
    static List<String> splitStatements(String sql) {
        StringBuilder cleaned = new StringBuilder();
        for (String line : sql.split("\n")) {
            int comment = findCommentStart(line);
            String code = comment >= 0 ? line.substring(0, comment) : line;
            if (!code.isBlank()) {
                cleaned.append(code).append('\n');
            }
        }

        List<String> statements = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        char quote = 0;
        for (int i = 0; i < cleaned.length(); i++) {
            char c = cleaned.charAt(i);
            if (quote != 0) {
                current.append(c);
                if (c == quote) {
                    quote = 0;
                }
            } else if (c == '\'' || c == '"') {
                current.append(c);
                quote = c;
            } else if (c == ';') {
                addStatement(statements, current);
                current.setLength(0);
            } else {
                current.append(c);
            }
        }
        addStatement(statements, current);
        return statements;
    }

    private static void addStatement(List<String> statements, StringBuilder current) {
        String statement = current.toString().trim();
        if (!statement.isEmpty()) {
            statements.add(statement);
        }
    }

    private static int findCommentStart(String line) {
        char quote = 0;
        for (int i = 0; i < line.length() - 1; i++) {
            char c = line.charAt(i);
            if (quote != 0) {
                if (c == quote) {
                    quote = 0;
                }
            } else if (c == '\'' || c == '"') {
                quote = c;
            } else if (c == '-' && line.charAt(i + 1) == '-') {
                return i;
            }
        }
        return -1;
    }
}
