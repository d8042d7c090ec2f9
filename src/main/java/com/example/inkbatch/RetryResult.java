package com.example.inkbatch;

/**
 * Successful outcome of a retried operation.
 */
public record RetryResult<T>(T value, int attemptCount) {
}
