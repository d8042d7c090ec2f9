package com.example.inkbatch.error;

public class RetryExhaustedException extends AttemptFailedException {
    public RetryExhaustedException(Throwable lastCause, int attemptCount) {
        super("Failed after " + attemptCount + " attempts: " + lastCause.getMessage(), lastCause, attemptCount);
    }
}
