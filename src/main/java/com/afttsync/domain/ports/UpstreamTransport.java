package com.afttsync.domain.ports;

import com.afttsync.domain.model.UpstreamDocument;
import com.afttsync.domain.model.UpstreamRequest;

import java.io.IOException;

/**
 * Single HTTP exchange without retries.
 */
public interface UpstreamTransport {

    /**
     * Executes the request once.
     *
     * @throws com.afttsync.domain.exception.HttpStatusException for any non-2xx answer
     * @throws IOException on connection or timeout errors
     */
    UpstreamDocument execute(UpstreamRequest request) throws IOException;
}
