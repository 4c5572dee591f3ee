package io.mirrorboard.model;

/**
 * One board message, from the local store or from a mirror.
 *
 * @param id              local row id, {@code null} for mirror-originated entries
 * @param source          {@link #LOCAL_SOURCE} or the repository full name {@code owner/name}
 * @param remoteReference URL of the mirrored blob, {@code null} until a mirror write succeeded
 */
public record Message(
        Long id,
        String content,
        String author,
        String timestamp,
        String source,
        String remoteReference
) {
    public static final String LOCAL_SOURCE = "local";
    public static final String DEFAULT_AUTHOR = "Anonymous";

    public boolean isLocal() {
        return LOCAL_SOURCE.equals(source);
    }

    public Message withRemoteReference(String reference) {
        return new Message(id, content, author, timestamp, source, reference);
    }

    public static String authorOrDefault(String author) {
        return author == null || author.isBlank() ? DEFAULT_AUTHOR : author;
    }
}
