package io.mirrorboard.mirror;

/**
 * One remote entry is not a usable message record. The entry is skipped, the rest of the shard is kept.
 */
final class MessageParseException extends Exception {
    MessageParseException(String message) {
        super(message);
    }

    MessageParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
