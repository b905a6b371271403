package com.example.channeluploader.remote;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of one call to a remote service. Exactly one of the value (on success) or
 * the message (otherwise) is meaningful.
 */
public final class RemoteResult<T> {

    public enum Kind {
        SUCCESS,
        NOT_FOUND,
        REJECTED,
        PAYLOAD_TOO_LARGE,
        TRANSIENT,
        RATE_LIMITED,
        CANCELLED;

        public boolean isRetryable() {
            return this == TRANSIENT || this == RATE_LIMITED;
        }
    }

    private final Kind kind;
    private final T value;
    private final String message;
    private final Duration retryAfter;
    private final List<String> details;

    private RemoteResult(Kind kind, T value, String message, Duration retryAfter, List<String> details) {
        this.kind = kind;
        this.value = value;
        this.message = message;
        this.retryAfter = retryAfter;
        this.details = details == null ? List.of() : List.copyOf(details);
    }

    public static <T> RemoteResult<T> success(T value) {
        return new RemoteResult<>(Kind.SUCCESS, Objects.requireNonNull(value, "value"), null, null, null);
    }

    public static <T> RemoteResult<T> notFound(String message) {
        return new RemoteResult<>(Kind.NOT_FOUND, null, message, null, null);
    }

    public static <T> RemoteResult<T> rejected(String message) {
        return new RemoteResult<>(Kind.REJECTED, null, message, null, null);
    }

    public static <T> RemoteResult<T> rejected(String message, List<String> details) {
        return new RemoteResult<>(Kind.REJECTED, null, message, null, details);
    }

    public static <T> RemoteResult<T> payloadTooLarge(String message) {
        return new RemoteResult<>(Kind.PAYLOAD_TOO_LARGE, null, message, null, null);
    }

    public static <T> RemoteResult<T> transientFailure(String message) {
        return new RemoteResult<>(Kind.TRANSIENT, null, message, null, null);
    }

    public static <T> RemoteResult<T> rateLimited(String message, Duration retryAfter) {
        return new RemoteResult<>(Kind.RATE_LIMITED, null, message, Objects.requireNonNull(retryAfter, "retryAfter"), null);
    }

    public static <T> RemoteResult<T> cancelled() {
        return new RemoteResult<>(Kind.CANCELLED, null, "Cancelled", null, null);
    }

    /**
     * Re-types a non-success result so it can be returned from a call with a different payload.
     */
    public <U> RemoteResult<U> propagate() {
        if (kind == Kind.SUCCESS) {
            throw new IllegalStateException("Cannot propagate a successful result");
        }
        return new RemoteResult<>(kind, null, message, retryAfter, details);
    }

    public Kind kind() {
        return kind;
    }

    public boolean isSuccess() {
        return kind == Kind.SUCCESS;
    }

    public T value() {
        if (kind != Kind.SUCCESS) {
            throw new IllegalStateException("No value on a " + kind + " result: " + message);
        }
        return value;
    }

    public String message() {
        return message;
    }

    public Optional<Duration> retryAfter() {
        return Optional.ofNullable(retryAfter);
    }

    public List<String> details() {
        return details;
    }

    @Override
    public String toString() {
        return kind == Kind.SUCCESS ? "RemoteResult{SUCCESS, " + value + "}" : "RemoteResult{" + kind + ", " + message + "}";
    }
}
