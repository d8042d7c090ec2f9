package com.example.inkbatch.error;

/**
 * Raised for malformed configuration before any batch work starts.
 */
public class ValidationException extends IllegalArgumentException {
    public ValidationException(String message) {
        super(message);
    }

    public ValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
