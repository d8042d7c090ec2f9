package com.example.inkbatch;

import java.time.Duration;
import java.time.Instant;

/**
 * A failed attempt that is about to be retried after {@link #getDelay()}.
 */
public class RetryAttempt {
    private final int attempt;
    private final Instant timestamp;
    private final Throwable error;
    private final Duration delay;

    public RetryAttempt(int attempt, Instant timestamp, Throwable error, Duration delay) {
        this.attempt = attempt;
        this.timestamp = timestamp;
        this.error = error;
        this.delay = delay;
    }

    /**
     * One-based number of the attempt that failed.
     */
    public int getAttempt() {
        return attempt;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public Throwable getError() {
        return error;
    }

    public Duration getDelay() {
        return delay;
    }
}
