package io.mirrorboard.error;

/**
 * A remote mirror failed: network, auth, or an unexpected status from the content API.
 */
public class MirrorException extends Exception {
    private final int status;

    public MirrorException(String message) {
        this(message, -1, null);
    }

    public MirrorException(String message, Throwable cause) {
        this(message, -1, cause);
    }

    public MirrorException(String message, int status) {
        this(message, status, null);
    }

    private MirrorException(String message, int status, Throwable cause) {
        super(message, cause);
        this.status = status;
    }

    /**
     * HTTP status reported by the backend, or -1 when the request never got an answer.
     */
    public int status() {
        return status;
    }
}
