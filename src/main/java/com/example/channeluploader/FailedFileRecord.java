package com.example.channeluploader;

import java.time.Instant;
import java.util.List;

/**
 * A file the orchestrator gave up on, with every transfer attempt made for it.
 */
public class FailedFileRecord {
    private final String relativePath;
    private final long size;
    private final int attempts;
    private final int maxAttempts;
    private final Instant lastAttemptTime;
    private final String lastError;
    private final List<RetryAttempt> retryAttempts;

    public FailedFileRecord(String relativePath,
                            long size,
                            int attempts,
                            int maxAttempts,
                            Instant lastAttemptTime,
                            String lastError,
                            List<RetryAttempt> retryAttempts) {
        this.relativePath = relativePath;
        this.size = size;
        this.attempts = attempts;
        this.maxAttempts = maxAttempts;
        this.lastAttemptTime = lastAttemptTime;
        this.lastError = lastError;
        this.retryAttempts = List.copyOf(retryAttempts);
    }

    public String getRelativePath() {
        return relativePath;
    }

    public long getSize() {
        return size;
    }

    public int getAttempts() {
        return attempts;
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    public Instant getLastAttemptTime() {
        return lastAttemptTime;
    }

    public String getLastError() {
        return lastError;
    }

    public List<RetryAttempt> getRetryAttempts() {
        return retryAttempts;
    }
}
