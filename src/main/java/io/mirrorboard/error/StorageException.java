package io.mirrorboard.error;

/**
 * The local durable store failed. Always fatal to the enclosing request.
 */
public class StorageException extends RuntimeException {
    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
