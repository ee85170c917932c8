package com.phillippitts.guardian.util;

import java.time.Duration;

/**
 * Blocking wait abstraction so that drain, grace and backoff delays can be skipped in tests.
 */
@FunctionalInterface
public interface Sleeper {

    /** Sleeper backed by {@link Thread#sleep(long)}. */
    Sleeper SYSTEM = duration -> {
        if (duration != null && !duration.isNegative() && !duration.isZero()) {
            Thread.sleep(duration.toMillis());
        }
    };

    /**
     * Blocks the calling thread for the given duration.
     *
     * @param duration time to wait; zero or negative returns immediately
     * @throws InterruptedException if the thread is interrupted while waiting
     */
    void sleep(Duration duration) throws InterruptedException;
}
