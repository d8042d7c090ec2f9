package com.example.inkbatch;

@FunctionalInterface
public interface RetryListener {
    void onRetry(RetryAttempt attempt);

    RetryListener NONE = attempt -> {
    };
}
