package io.mirrorboard.error;

/**
 * Rejected input: empty content, a non-positive or non-numeric limit, or an unknown mirror target.
 * Raised before any I/O and never worth retrying.
 */
public class ValidationException extends IllegalArgumentException {
    public ValidationException(String message) {
        super(message);
    }
}
