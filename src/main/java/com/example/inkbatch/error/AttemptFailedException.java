package com.example.inkbatch.error;

/**
 * Terminal outcome of a retried operation that did not succeed.
 */
public abstract class AttemptFailedException extends Exception {
    private final int attemptCount;

    protected AttemptFailedException(String message, Throwable cause, int attemptCount) {
        super(message, cause);
        this.attemptCount = attemptCount;
    }

    public int attemptCount() {
        return attemptCount;
    }

    /**
     * Retries consumed before giving up, i.e. attempts beyond the first.
     */
    public int retryCount() {
        return Math.max(0, attemptCount - 1);
    }
}
