package com.example.channeluploader;

import java.time.Instant;

public class RetryAttempt {
    private final int attempt;
    private final Instant timestamp;
    private final String outcome;
    private final String error;

    public RetryAttempt(int attempt, Instant timestamp, String outcome, String error) {
        this.attempt = attempt;
        this.timestamp = timestamp;
        this.outcome = outcome;
        this.error = error;
    }

    public int getAttempt() {
        return attempt;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    /**
     * Result kind reported by the transfer client, e.g. {@code TRANSIENT}.
     */
    public String getOutcome() {
        return outcome;
    }

    public String getError() {
        return error;
    }
}
