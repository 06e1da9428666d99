package com.afttsync.domain.exception;

/**
 * Failure to obtain a document from the upstream catalog.
 */
public abstract class UpstreamException extends Exception {

    private final String endpoint;

    protected UpstreamException(String endpoint, String message, Throwable cause) {
        super(message, cause);
        this.endpoint = endpoint;
    }

    public String getEndpoint() {
        return endpoint;
    }
}
