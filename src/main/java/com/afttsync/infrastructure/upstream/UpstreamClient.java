package com.afttsync.infrastructure.upstream;

import com.afttsync.domain.exception.FatalUpstreamException;
import com.afttsync.domain.exception.HttpStatusException;
import com.afttsync.domain.exception.TransientUpstreamException;
import com.afttsync.domain.exception.UpstreamException;
import com.afttsync.domain.model.UpstreamDocument;
import com.afttsync.domain.model.UpstreamRequest;
import com.afttsync.domain.ports.UpstreamGateway;
import com.afttsync.domain.ports.UpstreamTransport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;

/**
 * Fetches catalog documents with exponential-backoff retry.
 *
 * <p>I/O errors, 5xx, 408 and 429 are retried until the policy's attempts run out. Any other
 * non-2xx answer fails at once. The client never paces between distinct calls.
 */
public class UpstreamClient implements UpstreamGateway {

    private static final Logger logger = LoggerFactory.getLogger(UpstreamClient.class);

    private final UpstreamTransport transport;
    private final RetryPolicy retryPolicy;
    private final Sleeper sleeper;

    public UpstreamClient(UpstreamTransport transport, RetryPolicy retryPolicy, Sleeper sleeper) {
        this.transport = transport;
        this.retryPolicy = retryPolicy;
        this.sleeper = sleeper;
    }

    @Override
    public UpstreamDocument fetch(UpstreamRequest request) throws UpstreamException {
        String endpoint = request.describe();
        IOException lastError = null;

        for (int attempt = 1; attempt <= retryPolicy.maxAttempts(); attempt++) {
            try {
                UpstreamDocument document = transport.execute(request);
                if (attempt > 1) {
                    logger.info("Fetched {} on attempt {}/{}", endpoint, attempt, retryPolicy.maxAttempts());
                }
                return document;
            } catch (HttpStatusException e) {
                if (!e.isRetryable()) {
                    logger.warn("Upstream {} answered HTTP {}, not retrying", endpoint, e.getStatusCode());
                    throw new FatalUpstreamException(endpoint, e.getStatusCode());
                }
                lastError = e;
            } catch (IOException e) {
                lastError = e;
            }

            logger.warn("Attempt {}/{} for {} failed: {}", attempt, retryPolicy.maxAttempts(), endpoint,
                lastError.getMessage());
            if (attempt < retryPolicy.maxAttempts()) {
                Duration delay = retryPolicy.delayAfter(attempt);
                try {
                    sleeper.sleep(delay);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new TransientUpstreamException(endpoint, attempt, e);
                }
            }
        }

        logger.error("Giving up on {} after {} attempts", endpoint, retryPolicy.maxAttempts());
        throw new TransientUpstreamException(endpoint, retryPolicy.maxAttempts(), lastError);
    }
}
