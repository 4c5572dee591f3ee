package io.mirrorboard.runtime;

import io.mirrorboard.config.BoardConfig;
import io.mirrorboard.error.MirrorException;
import io.mirrorboard.error.ValidationException;
import io.mirrorboard.mirror.MirrorRegistry;
import io.mirrorboard.model.Message;
import io.mirrorboard.model.MessageOrder;
import io.mirrorboard.observability.AuditLogger;
import io.mirrorboard.storage.MessageStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Dual-write and merged-read paths of the board.
 *
 * <p>A post is committed once the local store accepts it; the mirror copy is best effort and its
 * failure only leaves the row without a remote reference. A read merges the local table with
 * every mirror and orders the result by timestamp alone.
 */
public final class MessageService {
    private static final Logger log = LoggerFactory.getLogger(MessageService.class);

    private final MessageStore store;
    private final MirrorRegistry registry;
    private final AuditLogger auditLogger;
    private final boolean dedupeMirrored;

    public MessageService(MessageStore store, MirrorRegistry registry, AuditLogger auditLogger,
                          boolean dedupeMirrored) {
        this.store = store;
        this.registry = registry;
        this.auditLogger = auditLogger;
        this.dedupeMirrored = dedupeMirrored;
    }

    /**
     * Parses a {@code limit} query value. Absent means {@link BoardConfig#DEFAULT_LIST_LIMIT}.
     */
    public static int parseLimit(String raw) {
        if (raw == null || raw.isBlank()) {
            return BoardConfig.DEFAULT_LIST_LIMIT;
        }
        int limit;
        try {
            limit = Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            throw new ValidationException("limit must be a positive integer, got '" + raw + "'");
        }
        if (limit <= 0) {
            throw new ValidationException("limit must be a positive integer, got " + limit);
        }
        return limit;
    }

    public PostOutcome post(String content, String author, String repository) {
        if (content == null || content.isBlank()) {
            throw new ValidationException("Message content must not be empty");
        }
        boolean mirror = !registry.isEmpty() || (repository != null && !repository.isBlank());
        if (mirror) {
            // Unknown targets are rejected before anything is written.
            registry.resolve(repository);
        }

        Message stored = store.store(content, author);
        audit("message.store", stored.author(), "message:" + stored.id(), "success", Map.of("timestamp", stored.timestamp()));
        if (!mirror) {
            return new PostOutcome(stored, null, null);
        }

        String target = registry.resolve(repository).source();
        MirrorRegistry.WriteOutcome written;
        try {
            written = registry.write(stored.content(), stored.author(), repository);
        } catch (MirrorException e) {
            log.warn("Message {} stored locally but mirroring to {} failed: {}", stored.id(), target, e.getMessage());
            return mirrorFailed(stored, target, e.getMessage());
        } catch (RuntimeException e) {
            log.warn("Message {} stored locally but mirroring to {} failed", stored.id(), target, e);
            return mirrorFailed(stored, target, String.valueOf(e.getMessage()));
        }
        store.setRemoteReference(stored.id(), written.reference());
        audit("mirror.write", stored.author(), "message:" + stored.id(), "success", Map.of(
                "repository", written.repository().fullName(),
                "reference", written.reference()
        ));
        return new PostOutcome(stored.withRemoteReference(written.reference()), written.repository().fullName(), null);
    }

    public List<Message> read(int limit) {
        return readDetailed(limit).messages();
    }

    /**
     * Mirror shards run on the pool while the caller reads the local table; both are joined before
     * ordering. The local read never waits behind mirror work.
     */
    public FeedOutcome readDetailed(int limit) {
        if (limit <= 0) {
            throw new ValidationException("limit must be a positive integer, got " + limit);
        }
        MirrorRegistry.PendingFetch pending = registry.startFetch(limit);
        List<Message> localRows;
        try {
            localRows = store.list(limit);
        } catch (RuntimeException e) {
            pending.cancel();
            throw e;
        }
        MirrorRegistry.FetchOutcome remote = pending.join();

        List<Message> merged = new ArrayList<>(localRows);
        int dropped = 0;
        if (dedupeMirrored) {
            Set<String> localReferences = new HashSet<>();
            for (Message m : localRows) {
                if (m.remoteReference() != null) {
                    localReferences.add(m.remoteReference());
                }
            }
            for (Message m : remote.messages()) {
                if (m.remoteReference() != null && localReferences.contains(m.remoteReference())) {
                    dropped++;
                } else {
                    merged.add(m);
                }
            }
        } else {
            merged.addAll(remote.messages());
        }
        return new FeedOutcome(MessageOrder.newestFirst(merged, limit), localRows.size(), remote.shards(), dropped);
    }

    private PostOutcome mirrorFailed(Message stored, String target, String error) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("repository", target);
        details.put("error", error);
        audit("mirror.write", stored.author(), "message:" + stored.id(), "failed", details);
        return new PostOutcome(stored, target, error);
    }

    private void audit(String action, String actor, String resource, String result, Map<String, Object> details) {
        if (auditLogger == null) {
            return;
        }
        try {
            auditLogger.log(AuditLogger.AuditEvent.of(action, actor, resource, result, details));
        } catch (UncheckedIOException e) {
            // The row is already committed.
            log.warn("Audit write for {} {} failed: {}", action, resource, e.getMessage());
        }
    }

    /**
     * @param mirroredTo  repository the copy was attempted on, {@code null} when no mirror is configured
     * @param mirrorError why the copy failed, {@code null} on success
     */
    public record PostOutcome(Message message, String mirroredTo, String mirrorError) {
        public boolean mirrored() {
            return message.remoteReference() != null;
        }
    }

    public record FeedOutcome(
            List<Message> messages,
            int localCount,
            List<MirrorRegistry.ShardReport> shards,
            int duplicatesDropped
    ) {
    }
}
