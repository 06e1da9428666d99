package com.afttsync.domain.exception;

import java.io.IOException;

/**
 * Non-2xx HTTP answer reported by a transport. The retry layer classifies it by status code.
 */
public class HttpStatusException extends IOException {

    private final int statusCode;

    public HttpStatusException(int statusCode, String reason) {
        super("HTTP " + statusCode + (reason == null || reason.isBlank() ? "" : " " + reason));
        this.statusCode = statusCode;
    }

    public int getStatusCode() {
        return statusCode;
    }

    /**
     * 5xx, request timeout and too-many-requests are worth another attempt.
     */
    public boolean isRetryable() {
        return statusCode >= 500 || statusCode == 408 || statusCode == 429;
    }
}
