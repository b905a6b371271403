package com.example.channeluploader;

import com.example.channeluploader.remote.Sleeper;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Shared cancellation flag polled between units of work. Waits taken through
 * {@link #pause(Duration)} end early once the token is cancelled.
 */
public final class CancellationToken {
    private final CountDownLatch cancelled = new CountDownLatch(1);

    public void cancel() {
        cancelled.countDown();
    }

    public boolean isCancelled() {
        return cancelled.getCount() == 0;
    }

    public void pause(Duration duration) throws InterruptedException {
        cancelled.await(duration.toMillis(), TimeUnit.MILLISECONDS);
    }

    /**
     * A sleeper whose waits are cut short by cancellation.
     */
    public Sleeper sleeper() {
        return this::pause;
    }
}
