package com.logistics.order.support;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * One-shot cooperative cancellation for background loops.
 * Loops wait on the signal instead of sleeping so that {@link #cancel()}
 * wakes them immediately.
 */
public class CancellationSignal {

    private final CountDownLatch cancelled = new CountDownLatch(1);

    public void cancel() {
        cancelled.countDown();
    }

    public boolean isCancelled() {
        return cancelled.getCount() == 0;
    }

    /**
     * Wait for up to {@code timeout}.
     *
     * @return true if the signal was cancelled before or during the wait
     */
    public boolean await(Duration timeout) throws InterruptedException {
        return cancelled.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }
}
