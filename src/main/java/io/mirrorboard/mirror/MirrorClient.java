package io.mirrorboard.mirror;

import io.mirrorboard.config.RepositoryConfig;
import io.mirrorboard.error.MirrorException;
import io.mirrorboard.model.Message;

import java.util.List;

/**
 * Copies board messages into one remote repository and reads them back.
 *
 * <p>A client owns the blobs under its repository and message path. Blobs are written once and
 * never updated or deleted.
 */
public interface MirrorClient {
    RepositoryConfig config();

    /**
     * Source identifier stamped on fetched messages, the repository full name.
     */
    default String source() {
        return config().fullName();
    }

    /**
     * Makes sure the message directory exists, creating it if the backend reports it missing.
     * Repeated calls neither fail nor create anything twice.
     */
    void ensureReady() throws MirrorException;

    /**
     * Writes one message blob and returns an opaque reference (URL) to it.
     */
    String store(String content, String author) throws MirrorException;

    /**
     * Reads up to {@code limit} messages, newest first. A missing directory is an empty mirror.
     */
    List<Message> fetch(int limit) throws MirrorException;
}
