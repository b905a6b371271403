package com.example.channeluploader.remote;

import com.example.channeluploader.CancellationToken;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.function.Supplier;

/**
 * Re-runs a remote call while it reports a retryable outcome.
 * <p>
 * Permanent outcomes return at once. Transient ones wait {@code baseDelay * 2^attempt},
 * capped at {@code maxDelay}. A rate limit waits exactly the server-given duration. All
 * of them count toward {@code maxAttempts}.
 */
public final class RetryPolicy {
    private static final Logger LOGGER = LoggerFactory.getLogger(RetryPolicy.class);

    private final int maxAttempts;
    private final Duration baseDelay;
    private final Duration maxDelay;
    private final Sleeper sleeper;
    private final CancellationToken cancellation;

    public RetryPolicy(int maxAttempts, Duration baseDelay, Duration maxDelay, Sleeper sleeper, CancellationToken cancellation) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1");
        }
        this.maxAttempts = maxAttempts;
        this.baseDelay = baseDelay;
        this.maxDelay = maxDelay;
        this.sleeper = sleeper;
        this.cancellation = cancellation;
    }

    /**
     * Backoff before the retry that follows zero-based {@code attempt}.
     */
    public Duration backoff(int attempt) {
        Duration delay = baseDelay.multipliedBy(1L << Math.min(attempt, 30));
        return delay.compareTo(maxDelay) > 0 ? maxDelay : delay;
    }

    public <T> RemoteResult<T> execute(String operation, Supplier<RemoteResult<T>> call) {
        RemoteResult<T> result = RemoteResult.cancelled();
        for (int attempt = 0; attempt < maxAttempts; attempt++) {
            if (cancellation.isCancelled()) {
                return RemoteResult.cancelled();
            }
            result = call.get();
            if (!result.kind().isRetryable()) {
                return result;
            }
            if (attempt == maxAttempts - 1) {
                LOGGER.warn("{} gave up after {} attempts: {}", operation, maxAttempts, result.message());
                return result;
            }
            Duration wait = result.kind() == RemoteResult.Kind.RATE_LIMITED
                    ? result.retryAfter().orElse(backoff(attempt))
                    : backoff(attempt);
            LOGGER.info("{} failed (attempt {}/{}): {}. Retrying in {}s",
                    operation, attempt + 1, maxAttempts, result.message(), wait.toSeconds());
            try {
                sleeper.sleep(wait);
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
                return RemoteResult.cancelled();
            }
        }
        return cancellation.isCancelled() ? RemoteResult.cancelled() : result;
    }
}
