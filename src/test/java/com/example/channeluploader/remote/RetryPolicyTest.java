package com.example.channeluploader.remote;

import com.example.channeluploader.CancellationToken;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RetryPolicyTest {
    private final List<Duration> waits = new ArrayList<>();
    private final CancellationToken cancellation = new CancellationToken();
    private final RetryPolicy policy = new RetryPolicy(4, Duration.ofSeconds(1), Duration.ofSeconds(5), waits::add, cancellation);

    @Test
    void transientFailureStopsAtAttemptCeiling() {
        AtomicInteger calls = new AtomicInteger();

        RemoteResult<String> result = policy.execute("op", () -> {
            calls.incrementAndGet();
            return RemoteResult.transientFailure("timeout");
        });

        assertEquals(RemoteResult.Kind.TRANSIENT, result.kind());
        assertEquals(4, calls.get());
        assertEquals(List.of(Duration.ofSeconds(1), Duration.ofSeconds(2), Duration.ofSeconds(4)), waits);
    }

    @Test
    void permanentFailureIsNotRetried() {
        AtomicInteger calls = new AtomicInteger();

        RemoteResult<String> result = policy.execute("op", () -> {
            calls.incrementAndGet();
            return RemoteResult.rejected("Channel not found. Check the channel ID is correct.");
        });

        assertEquals(RemoteResult.Kind.REJECTED, result.kind());
        assertEquals(1, calls.get());
        assertTrue(waits.isEmpty());
    }

    @Test
    void rateLimitWaitIsHonouredExactly() {
        AtomicInteger calls = new AtomicInteger();

        RemoteResult<String> result = policy.execute("op", () -> calls.incrementAndGet() < 3
                ? RemoteResult.rateLimited("slow down", Duration.ofSeconds(42))
                : RemoteResult.success("done"));

        assertEquals("done", result.value());
        assertEquals(List.of(Duration.ofSeconds(42), Duration.ofSeconds(42)), waits);
    }

    @Test
    void backoffIsCapped() {
        assertEquals(Duration.ofSeconds(1), policy.backoff(0));
        assertEquals(Duration.ofSeconds(4), policy.backoff(2));
        assertEquals(Duration.ofSeconds(5), policy.backoff(3));
        assertEquals(Duration.ofSeconds(5), policy.backoff(40));
    }

    @Test
    void cancellationStopsBeforeNextAttempt() {
        AtomicInteger calls = new AtomicInteger();

        RemoteResult<String> result = policy.execute("op", () -> {
            calls.incrementAndGet();
            cancellation.cancel();
            return RemoteResult.transientFailure("timeout");
        });

        assertEquals(RemoteResult.Kind.CANCELLED, result.kind());
        assertEquals(1, calls.get());
    }

    @Test
    void interruptedWaitReportsCancelled() {
        RetryPolicy interrupting = new RetryPolicy(3, Duration.ofSeconds(1), Duration.ofSeconds(1), duration -> {
            throw new InterruptedException("stop");
        }, cancellation);

        RemoteResult<String> result = interrupting.execute("op", () -> RemoteResult.transientFailure("timeout"));

        assertEquals(RemoteResult.Kind.CANCELLED, result.kind());
        assertTrue(Thread.interrupted());
    }

    @Test
    void rejectsZeroAttempts() {
        assertThrows(IllegalArgumentException.class,
                () -> new RetryPolicy(0, Duration.ZERO, Duration.ZERO, Sleeper.SYSTEM, cancellation));
    }
}
