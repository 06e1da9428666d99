package com.afttsync.domain.exception;

/**
 * Non-retryable upstream answer, such as a 404.
 */
public class FatalUpstreamException extends UpstreamException {

    private final int statusCode;

    public FatalUpstreamException(String endpoint, int statusCode) {
        super(endpoint, "Upstream " + endpoint + " answered HTTP " + statusCode, null);
        this.statusCode = statusCode;
    }

    public int getStatusCode() {
        return statusCode;
    }
}
