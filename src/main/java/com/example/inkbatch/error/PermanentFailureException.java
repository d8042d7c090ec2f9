package com.example.inkbatch.error;

public class PermanentFailureException extends AttemptFailedException {
    public PermanentFailureException(Throwable cause, int attemptCount) {
        super("Permanent failure on attempt " + attemptCount + ": " + cause.getMessage(), cause, attemptCount);
    }
}
