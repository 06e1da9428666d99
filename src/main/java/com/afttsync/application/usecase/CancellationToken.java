package com.afttsync.application.usecase;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Cooperative cancellation flag for one task. Pauses wake up as soon as cancellation is requested.
 */
public class CancellationToken {

    private final CountDownLatch cancelled = new CountDownLatch(1);

    public void cancel() {
        cancelled.countDown();
    }

    public boolean isCancelled() {
        return cancelled.getCount() == 0 || Thread.currentThread().isInterrupted();
    }

    /**
     * Waits for the given duration unless cancellation comes first. An interrupt counts as cancellation.
     *
     * @return {@code true} when the full pause elapsed, {@code false} when the task was cancelled
     */
    public boolean pause(Duration duration) {
        if (duration.isZero() || duration.isNegative()) {
            return !isCancelled();
        }
        try {
            return !cancelled.await(duration.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
