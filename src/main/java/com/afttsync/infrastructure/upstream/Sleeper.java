package com.afttsync.infrastructure.upstream;

import java.time.Duration;

/**
 * Blocking pause, replaceable in tests.
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper SYSTEM = duration -> Thread.sleep(duration.toMillis());

    void sleep(Duration duration) throws InterruptedException;
}
