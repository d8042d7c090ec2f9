package com.example.inkbatch.error;

/**
 * Failure of a single pipeline step. Transient failures may succeed on a later attempt.
 */
public class TransformException extends Exception {
    private final String stepName;
    private final boolean transientFailure;

    public TransformException(String stepName, String message, boolean transientFailure) {
        super(message + " (step: " + stepName + ")");
        this.stepName = stepName;
        this.transientFailure = transientFailure;
    }

    public TransformException(String stepName, Throwable cause, boolean transientFailure) {
        super("Step " + stepName + " failed: " + cause.getMessage(), cause);
        this.stepName = stepName;
        this.transientFailure = transientFailure;
    }

    public String stepName() {
        return stepName;
    }

    public boolean isTransient() {
        return transientFailure;
    }
}
