package com.afttsync.domain.exception;

/**
 * Raised after every retry attempt for a recoverable failure (I/O error, 5xx, 408, 429) was used up.
 */
public class TransientUpstreamException extends UpstreamException {

    private final int attempts;

    public TransientUpstreamException(String endpoint, int attempts, Throwable cause) {
        super(endpoint, "Upstream " + endpoint + " still failing after " + attempts + " attempt(s): "
            + (cause == null ? "unknown cause" : cause.getMessage()), cause);
        this.attempts = attempts;
    }

    public int getAttempts() {
        return attempts;
    }
}
