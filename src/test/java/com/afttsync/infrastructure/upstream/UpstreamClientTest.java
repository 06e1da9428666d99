package com.afttsync.infrastructure.upstream;

import com.afttsync.domain.exception.FatalUpstreamException;
import com.afttsync.domain.exception.HttpStatusException;
import com.afttsync.domain.exception.TransientUpstreamException;
import com.afttsync.domain.exception.UpstreamException;
import com.afttsync.domain.model.UpstreamDocument;
import com.afttsync.domain.model.UpstreamRequest;
import com.afttsync.domain.ports.UpstreamTransport;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.SocketTimeoutException;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for UpstreamClient retry behaviour.
 */
class UpstreamClientTest {

    private static final UpstreamRequest REQUEST = UpstreamRequest.postForm("https://data.aftt.be/annuaire/membres.php",
        Map.of("indice", "H004"), Duration.ofSeconds(5));

    private final List<Duration> sleeps = new ArrayList<>();
    private final Sleeper recordingSleeper = sleeps::add;

    @Test
    void testRetriesTransientFailuresWithBackoff() throws UpstreamException {
        ScriptedTransport transport = new ScriptedTransport(
            new SocketTimeoutException("Read timed out"), new HttpStatusException(503, "Service Unavailable"));
        UpstreamClient client = new UpstreamClient(transport, new RetryPolicy(3, Duration.ofSeconds(2), 2.0),
            recordingSleeper);

        UpstreamDocument document = client.fetch(REQUEST);

        assertEquals("<html>ok</html>", document.body());
        assertEquals(3, transport.calls);
        assertEquals(List.of(Duration.ofSeconds(2), Duration.ofSeconds(4)), sleeps);
    }

    @Test
    void testGivesUpAfterMaxAttempts() {
        ScriptedTransport transport = new ScriptedTransport(
            new IOException("Connection reset"), new IOException("Connection reset"), new IOException("Connection reset"));
        UpstreamClient client = new UpstreamClient(transport, RetryPolicy.DEFAULT, recordingSleeper);

        TransientUpstreamException e = assertThrows(TransientUpstreamException.class, () -> client.fetch(REQUEST));

        assertEquals(3, e.getAttempts());
        assertEquals(3, transport.calls);
        assertEquals(2, sleeps.size());
    }

    @Test
    void testClientErrorIsNotRetried() {
        ScriptedTransport transport = new ScriptedTransport(new HttpStatusException(404, "Not Found"));
        UpstreamClient client = new UpstreamClient(transport, RetryPolicy.DEFAULT, recordingSleeper);

        FatalUpstreamException e = assertThrows(FatalUpstreamException.class, () -> client.fetch(REQUEST));

        assertEquals(404, e.getStatusCode());
        assertEquals(1, transport.calls);
        assertTrue(sleeps.isEmpty());
    }

    @Test
    void testTooManyRequestsIsRetried() throws UpstreamException {
        ScriptedTransport transport = new ScriptedTransport(new HttpStatusException(429, "Too Many Requests"));
        UpstreamClient client = new UpstreamClient(transport, RetryPolicy.DEFAULT, recordingSleeper);

        client.fetch(REQUEST);

        assertEquals(2, transport.calls);
    }

    @Test
    void testBackoffDelays() {
        RetryPolicy policy = new RetryPolicy(4, Duration.ofMillis(500), 3.0);

        assertEquals(Duration.ofMillis(500), policy.delayAfter(1));
        assertEquals(Duration.ofMillis(1500), policy.delayAfter(2));
        assertEquals(Duration.ofMillis(4500), policy.delayAfter(3));
        assertThrows(IllegalArgumentException.class, () -> new RetryPolicy(0, Duration.ZERO, 2.0));
    }

    /**
     * Fails with the given errors in order, then answers 200.
     */
    private static class ScriptedTransport implements UpstreamTransport {
        private final Deque<IOException> failures;
        private int calls;

        ScriptedTransport(IOException... failures) {
            this.failures = new ArrayDeque<>(List.of(failures));
        }

        @Override
        public UpstreamDocument execute(UpstreamRequest request) throws IOException {
            calls++;
            IOException failure = failures.poll();
            if (failure != null) {
                throw failure;
            }
            return new UpstreamDocument(request, 200, "<html>ok</html>");
        }
    }
}
