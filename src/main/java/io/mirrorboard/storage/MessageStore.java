package io.mirrorboard.storage;

import io.mirrorboard.error.StorageException;
import io.mirrorboard.error.ValidationException;
import io.mirrorboard.model.Message;
import io.mirrorboard.util.Timestamps;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Authoritative local table of board messages. A write is acknowledged once it is committed here.
 *
 * <p>Every call opens its own connection and runs as one short transaction. Id assignment and
 * write serialization are left to SQLite ({@code AUTOINCREMENT} and its write lock).
 */
public final class MessageStore {
    private static final String COLUMNS = "id,content,author,timestamp,remote_reference";
    // Shape of Timestamps.format output; only such values take part in timestamp comparisons.
    private static final String CANONICAL_GLOB =
            "[0-9][0-9][0-9][0-9]-[0-9][0-9]-[0-9][0-9]T[0-9][0-9]:[0-9][0-9]:[0-9][0-9].[0-9][0-9][0-9][0-9][0-9][0-9]Z";

    private final Database database;
    private final Clock clock;

    public MessageStore(Database database) {
        this(database, Clock.systemUTC());
    }

    public MessageStore(Database database, Clock clock) {
        this.database = database;
        this.clock = clock;
    }

    public void init() {
        database.init();
    }

    /**
     * Inserts a row and returns it as committed. The timestamp is taken now, but never earlier than
     * the newest stored timestamp, so creation order and timestamp order agree even if the clock steps back.
     */
    public Message store(String content, String author) {
        if (content == null || content.isBlank()) {
            throw new ValidationException("Message content must not be empty");
        }
        String resolvedAuthor = Message.authorOrDefault(author);
        String now = Timestamps.now(clock);
        // One statement reads the high-water mark and inserts under the same write lock.
        String insert = """
                INSERT INTO messages(content,author,timestamp,remote_reference)
                SELECT ?,?,CASE WHEN MAX(timestamp) > ? THEN MAX(timestamp) ELSE ? END,NULL FROM messages
                WHERE timestamp GLOB '%s'
                """.formatted(CANONICAL_GLOB);
        try (Connection c = database.openConnection()) {
            c.setAutoCommit(false);
            try {
                long id;
                try (PreparedStatement ps = c.prepareStatement(insert)) {
                    ps.setString(1, content);
                    ps.setString(2, resolvedAuthor);
                    ps.setString(3, now);
                    ps.setString(4, now);
                    ps.executeUpdate();
                }
                try (Statement st = c.createStatement();
                     ResultSet rs = st.executeQuery("SELECT last_insert_rowid()")) {
                    if (!rs.next()) {
                        throw new SQLException("No row id after insert");
                    }
                    id = rs.getLong(1);
                }
                Message stored = findById(c, id)
                        .orElseThrow(() -> new SQLException("Inserted row " + id + " not readable"));
                c.commit();
                return stored;
            } catch (SQLException e) {
                c.rollback();
                throw e;
            } finally {
                c.setAutoCommit(true);
            }
        } catch (SQLException e) {
            throw new StorageException("Failed to store message", e);
        }
    }

    public Optional<Message> get(long id) {
        try (Connection c = database.openConnection()) {
            return findById(c, id);
        } catch (SQLException e) {
            throw new StorageException("Failed to read message " + id, e);
        }
    }

    public List<Message> list(int limit) {
        if (limit <= 0) {
            throw new ValidationException("limit must be a positive integer, got " + limit);
        }
        // Text that is not in canonical form (an unparseable legacy value) sorts after every canonical one.
        String sql = "SELECT " + COLUMNS + " FROM messages ORDER BY (timestamp GLOB '" + CANONICAL_GLOB
                + "') DESC, timestamp DESC, id DESC LIMIT ?";
        List<Message> out = new ArrayList<>();
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setInt(1, limit);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(readMessage(rs));
                }
            }
            return out;
        } catch (SQLException e) {
            throw new StorageException("Failed to list messages", e);
        }
    }

    /**
     * Records the mirror URL for a row. Returns false when no such row exists. Last write wins.
     */
    public boolean setRemoteReference(long id, String reference) {
        try (Connection c = database.openConnection();
             PreparedStatement ps = c.prepareStatement("UPDATE messages SET remote_reference=? WHERE id=?")) {
            ps.setString(1, reference);
            ps.setLong(2, id);
            return ps.executeUpdate() > 0;
        } catch (SQLException e) {
            throw new StorageException("Failed to set remote reference for message " + id, e);
        }
    }

    public long count() {
        try (Connection c = database.openConnection();
             Statement st = c.createStatement();
             ResultSet rs = st.executeQuery("SELECT COUNT(*) FROM messages")) {
            return rs.next() ? rs.getLong(1) : 0L;
        } catch (SQLException e) {
            throw new StorageException("Failed to count messages", e);
        }
    }

    public long countMirrored() {
        try (Connection c = database.openConnection();
             Statement st = c.createStatement();
             ResultSet rs = st.executeQuery("SELECT COUNT(*) FROM messages WHERE remote_reference IS NOT NULL")) {
            return rs.next() ? rs.getLong(1) : 0L;
        } catch (SQLException e) {
            throw new StorageException("Failed to count mirrored messages", e);
        }
    }

    private Optional<Message> findById(Connection c, long id) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement("SELECT " + COLUMNS + " FROM messages WHERE id=?")) {
            ps.setLong(1, id);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) {
                    return Optional.empty();
                }
                return Optional.of(readMessage(rs));
            }
        }
    }

    private static Message readMessage(ResultSet rs) throws SQLException {
        return new Message(
                rs.getLong("id"),
                rs.getString("content"),
                rs.getString("author"),
                rs.getString("timestamp"),
                Message.LOCAL_SOURCE,
                rs.getString("remote_reference")
        );
    }
}
