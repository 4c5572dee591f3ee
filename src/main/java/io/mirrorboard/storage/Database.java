package io.mirrorboard.storage;

import io.mirrorboard.config.BoardConfig;
import io.mirrorboard.error.StorageException;
import io.mirrorboard.util.Timestamps;

import java.io.IOException;
import java.nio.file.Files;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Instant;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Properties;
import java.util.Set;

public final class Database {
    private static final String MIGRATION_SCHEMA_VERSION = "mirrorboard.schema.migration.v1";
    private final BoardConfig config;
    private final String jdbcUrl;
    private final Properties connectionProperties;
    private final ZoneId legacyZone;

    public Database(BoardConfig config) {
        this(config, ZoneId.systemDefault());
    }

    /**
     * @param legacyZone zone of the offset-less timestamps written by first-release databases
     */
    public Database(BoardConfig config, ZoneId legacyZone) {
        this.config = config;
        this.legacyZone = legacyZone;
        this.jdbcUrl = "jdbc:sqlite:" + config.dbFile().toString();
        this.connectionProperties = new Properties();
        // busy_timeout is per connection, so it travels with every open rather than a one-off PRAGMA.
        this.connectionProperties.setProperty("busy_timeout", Long.toString(BoardConfig.DEFAULT_BUSY_TIMEOUT_MS));
    }

    /**
     * Creates directories, schema and pragmas. Idempotent; concurrent callers on one instance are serialized.
     */
    public synchronized void init() {
        initDirectories();
        initSchema();
        applyAndValidatePragmas();
    }

    public Connection openConnection() throws SQLException {
        return DriverManager.getConnection(jdbcUrl, connectionProperties);
    }

    private void initDirectories() {
        try {
            Files.createDirectories(config.rootDir());
            Files.createDirectories(config.auditRoot());
        } catch (IOException e) {
            throw new StorageException("Failed to initialize directories under " + config.rootDir(), e);
        }
    }

    private void initSchema() {
        try (Connection conn = openConnection(); Statement st = conn.createStatement()) {
            st.execute("""
                    CREATE TABLE IF NOT EXISTS messages (
                        id INTEGER PRIMARY KEY AUTOINCREMENT,
                        content TEXT NOT NULL,
                        author TEXT NOT NULL,
                        timestamp TEXT NOT NULL,
                        remote_reference TEXT
                    )
                    """);
            ensureMessageColumns(conn);
            ensureSchemaMigrationsTable(conn);
            applyVersionedMigrations(conn);
        } catch (SQLException e) {
            throw new StorageException("Failed to initialize schema in " + config.dbFile(), e);
        }
    }

    // Databases created by the first release stored the mirror URL as github_url and wrote
    // timestamps as local wall-clock text without an offset.
    private void ensureMessageColumns(Connection conn) throws SQLException {
        Set<String> columns = new HashSet<>();
        try (Statement st = conn.createStatement();
             ResultSet rs = st.executeQuery("PRAGMA table_info(messages)")) {
            while (rs.next()) {
                columns.add(rs.getString("name").toLowerCase(Locale.ROOT));
            }
        }
        if (columns.contains("remote_reference")) {
            return;
        }
        // Before the new column appears, so an interrupted upgrade repeats this step.
        normalizeTimestamps(conn, legacyZone);
        try (Statement st = conn.createStatement()) {
            st.execute("ALTER TABLE messages ADD COLUMN remote_reference TEXT");
            if (columns.contains("github_url")) {
                st.execute("UPDATE messages SET remote_reference=github_url WHERE remote_reference IS NULL");
            }
        }
    }

    // Rewrites every parseable timestamp into the canonical form; unparseable text is left as found.
    private static void normalizeTimestamps(Connection conn, ZoneId zone) throws SQLException {
        List<Long> ids = new ArrayList<>();
        List<String> values = new ArrayList<>();
        try (Statement st = conn.createStatement();
             ResultSet rs = st.executeQuery("SELECT id,timestamp FROM messages")) {
            while (rs.next()) {
                String raw = rs.getString("timestamp");
                Optional<Instant> parsed = Timestamps.parse(raw, zone);
                if (parsed.isEmpty()) {
                    continue;
                }
                String canonical = Timestamps.format(parsed.get());
                if (!canonical.equals(raw)) {
                    ids.add(rs.getLong("id"));
                    values.add(canonical);
                }
            }
        }
        if (ids.isEmpty()) {
            return;
        }
        boolean autoCommit = conn.getAutoCommit();
        conn.setAutoCommit(false);
        try (PreparedStatement ps = conn.prepareStatement("UPDATE messages SET timestamp=? WHERE id=?")) {
            for (int i = 0; i < ids.size(); i++) {
                ps.setString(1, values.get(i));
                ps.setLong(2, ids.get(i));
                ps.addBatch();
            }
            ps.executeBatch();
            conn.commit();
        } catch (SQLException e) {
            conn.rollback();
            throw e;
        } finally {
            conn.setAutoCommit(autoCommit);
        }
    }

    private void ensureSchemaMigrationsTable(Connection conn) throws SQLException {
        try (Statement st = conn.createStatement()) {
            st.execute("""
                    CREATE TABLE IF NOT EXISTS schema_migrations (
                        version TEXT PRIMARY KEY,
                        description TEXT NOT NULL,
                        checksum TEXT NOT NULL,
                        applied_at_ms INTEGER NOT NULL
                    )
                    """);
        }
    }

    private void applyVersionedMigrations(Connection conn) throws SQLException {
        List<MigrationStep> steps = new ArrayList<>();
        steps.add(new MigrationStep(
                "20261019_001_messages_timestamp_index",
                "Index messages by timestamp for feed reads",
                List.of("CREATE INDEX IF NOT EXISTS idx_messages_timestamp ON messages(timestamp DESC, id DESC)")
        ));
        for (MigrationStep step : steps) {
            if (isMigrationApplied(conn, step.version())) {
                continue;
            }
            applyMigration(conn, step);
        }
    }

    private boolean isMigrationApplied(Connection conn, String version) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(
                "SELECT 1 FROM schema_migrations WHERE version=? LIMIT 1")) {
            ps.setString(1, version);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next();
            }
        }
    }

    private void applyMigration(Connection conn, MigrationStep step) throws SQLException {
        try (Statement st = conn.createStatement()) {
            for (String sql : step.sql()) {
                st.execute(sql);
            }
        }
        try (PreparedStatement ps = conn.prepareStatement(
                "INSERT OR IGNORE INTO schema_migrations(version,description,checksum,applied_at_ms) VALUES(?,?,?,?)")) {
            ps.setString(1, step.version());
            ps.setString(2, step.description());
            ps.setString(3, checksum(step));
            ps.setLong(4, Instant.now().toEpochMilli());
            ps.executeUpdate();
        }
    }

    private String checksum(MigrationStep step) {
        StringBuilder sb = new StringBuilder();
        sb.append(MIGRATION_SCHEMA_VERSION).append('|')
                .append(step.version()).append('|')
                .append(step.description()).append('|');
        for (String sql : step.sql()) {
            sb.append(sql).append(';');
        }
        return Integer.toHexString(sb.toString().hashCode());
    }

    private record MigrationStep(String version, String description, List<String> sql) {
    }

    private void applyAndValidatePragmas() {
        try (Connection conn = openConnection(); Statement st = conn.createStatement()) {
            st.execute("PRAGMA journal_mode=WAL");
            st.execute("PRAGMA synchronous=NORMAL");
            validatePragma(st, "journal_mode", "wal");
        } catch (SQLException e) {
            throw new StorageException("Failed to apply SQLite pragmas", e);
        }
    }

    private void validatePragma(Statement st, String pragma, String expected) throws SQLException {
        try (ResultSet rs = st.executeQuery("PRAGMA " + pragma)) {
            if (!rs.next()) {
                throw new IllegalStateException("PRAGMA " + pragma + " did not return a value");
            }
            String actual = rs.getString(1);
            if (actual == null || !actual.equalsIgnoreCase(expected)) {
                throw new IllegalStateException(
                        "PRAGMA " + pragma + " mismatch, expected=" + expected + ", actual=" + actual
                );
            }
        }
    }

    public List<SchemaMigrationRow> listSchemaMigrations() {
        List<SchemaMigrationRow> out = new ArrayList<>();
        try (Connection c = openConnection();
             PreparedStatement ps = c.prepareStatement(
                     "SELECT version,description,checksum,applied_at_ms FROM schema_migrations ORDER BY version");
             ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                out.add(new SchemaMigrationRow(
                        rs.getString("version"),
                        rs.getString("description"),
                        rs.getString("checksum"),
                        rs.getLong("applied_at_ms")
                ));
            }
            return out;
        } catch (SQLException e) {
            throw new StorageException("Failed to list schema migrations", e);
        }
    }

    public record SchemaMigrationRow(String version, String description, String checksum, long appliedAtMs) {
    }
}
