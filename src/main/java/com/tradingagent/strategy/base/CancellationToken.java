package com.tradingagent.strategy.base;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * One-shot stop signal shared by the scheduler and the loops it runs. Sleeping through
 * {@link #awaitCancellation(Duration)} wakes immediately on cancel.
 */
public final class CancellationToken {

    private final CountDownLatch latch = new CountDownLatch(1);

    public void cancel() {
        latch.countDown();
    }

    public boolean isCancelled() {
        return latch.getCount() == 0;
    }

    /**
     * Sleeps for {@code timeout} or until cancelled.
     *
     * @return true if the token is cancelled (including by thread interruption)
     */
    public boolean awaitCancellation(Duration timeout) {
        try {
            return latch.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return true;
        }
    }
}
