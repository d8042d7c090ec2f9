package com.example.inkbatch.error;

import java.io.IOException;

/**
 * Classification of a failure cause, used for error records and the default retry policy.
 */
public enum ErrorKind {
    VALIDATION(false),
    TRANSFORM(false),
    IO(true),
    ARCHIVE(true),
    MALFORMED_IMAGE(false),
    UNSUPPORTED_FORMAT(false),
    EMPTY_ARCHIVE(false),
    UNEXPECTED(false);

    private final boolean transientByDefault;

    ErrorKind(boolean transientByDefault) {
        this.transientByDefault = transientByDefault;
    }

    public static ErrorKind of(Throwable error) {
        Throwable cause = unwrap(error);
        if (cause instanceof ArchiveException) {
            return ARCHIVE;
        }
        if (cause instanceof IOException) {
            return IO;
        }
        if (cause instanceof TransformException) {
            return TRANSFORM;
        }
        if (cause instanceof MalformedImageException) {
            return MALFORMED_IMAGE;
        }
        if (cause instanceof ValidationException) {
            return VALIDATION;
        }
        return UNEXPECTED;
    }

    /**
     * Default retry predicate: I/O and archive failures, plus transforms that flagged themselves transient.
     */
    public static boolean isRetryable(Throwable error) {
        if (error instanceof TransformException transform) {
            return transform.isTransient();
        }
        return of(error).transientByDefault;
    }

    /**
     * Strips retry wrappers so records describe the underlying cause.
     */
    public static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while (current instanceof AttemptFailedException && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}
