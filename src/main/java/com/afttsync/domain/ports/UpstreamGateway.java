package com.afttsync.domain.ports;

import com.afttsync.domain.exception.UpstreamException;
import com.afttsync.domain.model.UpstreamDocument;
import com.afttsync.domain.model.UpstreamRequest;

/**
 * Port for fetching catalog documents, retries included.
 */
public interface UpstreamGateway {

    /**
     * Fetches one document.
     *
     * @throws com.afttsync.domain.exception.TransientUpstreamException when every attempt failed
     *         with a recoverable error
     * @throws com.afttsync.domain.exception.FatalUpstreamException on a non-retryable answer
     */
    UpstreamDocument fetch(UpstreamRequest request) throws UpstreamException;
}
