package com.example.inkbatch.error;

import java.time.Instant;

/**
 * One terminal failure observed during a batch run.
 */
public record ErrorRecord(
        String path,
        ErrorKind errorKind,
        String message,
        Severity severity,
        String stepName,
        Instant timestamp,
        int retryCount
) {
    public static ErrorRecord of(String path, Throwable error, Severity severity, String stepName) {
        Throwable cause = ErrorKind.unwrap(error);
        int retries = error instanceof AttemptFailedException attempt ? attempt.retryCount() : 0;
        return new ErrorRecord(
                path,
                ErrorKind.of(cause),
                cause.getMessage(),
                severity,
                stepName,
                Instant.now(),
                retries
        );
    }

    public static ErrorRecord warning(String path, ErrorKind kind, String message) {
        return new ErrorRecord(path, kind, message, Severity.WARNING, null, Instant.now(), 0);
    }

    @Override
    public String toString() {
        StringBuilder builder = new StringBuilder()
                .append('[').append(severity).append("] ")
                .append(errorKind).append(": ").append(message);
        if (stepName != null) {
            builder.append(" (step: ").append(stepName).append(')');
        }
        if (path != null) {
            builder.append(" - ").append(path);
        }
        if (retryCount > 0) {
            builder.append(" (retries: ").append(retryCount).append(')');
        }
        return builder.toString();
    }
}
