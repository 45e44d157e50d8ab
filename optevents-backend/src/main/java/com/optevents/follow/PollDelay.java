package com.optevents.follow;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Wait between polls of an exhausted follow cursor.
 */
@FunctionalInterface
public interface PollDelay {

    /** Waits on the cancellation latch so a cancel ends the wait early. */
    PollDelay LATCH = (interval, cancelled) -> cancelled.await(interval.toMillis(), TimeUnit.MILLISECONDS);

    /**
     * Waits for {@code interval} or until {@code cancelled} is released.
     *
     * @param interval follow interval
     * @param cancelled latch released on cancellation
     * @throws InterruptedException if the waiting thread is interrupted
     */
    void await(Duration interval, CountDownLatch cancelled) throws InterruptedException;
}
