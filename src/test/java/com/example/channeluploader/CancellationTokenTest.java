package com.example.channeluploader;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CancellationTokenTest {
    @Test
    void cancelCutsPauseShort() throws Exception {
        CancellationToken token = new CancellationToken();
        long started = System.nanoTime();

        CompletableFuture<Void> waiting = CompletableFuture.runAsync(() -> {
            try {
                token.sleeper().sleep(Duration.ofMinutes(5));
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
            }
        });
        Thread.sleep(100);
        token.cancel();
        waiting.get(10, TimeUnit.SECONDS);

        assertTrue(token.isCancelled());
        assertTrue(System.nanoTime() - started < TimeUnit.SECONDS.toNanos(10));
    }

    @Test
    void startsUncancelled() {
        assertFalse(new CancellationToken().isCancelled());
    }
}
