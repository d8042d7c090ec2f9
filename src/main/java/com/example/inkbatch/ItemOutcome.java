package com.example.inkbatch;

import com.example.inkbatch.error.ErrorRecord;

import java.nio.file.Path;

/**
 * Terminal result of one work item: the written output, or the recorded failure.
 */
public final class ItemOutcome {
    private final WorkItem item;
    private final Path output;
    private final ErrorRecord failure;
    private final int attempts;

    private ItemOutcome(WorkItem item, Path output, ErrorRecord failure, int attempts) {
        this.item = item;
        this.output = output;
        this.failure = failure;
        this.attempts = attempts;
    }

    public static ItemOutcome success(WorkItem item, Path output, int attempts) {
        return new ItemOutcome(item, output, null, attempts);
    }

    public static ItemOutcome failure(WorkItem item, ErrorRecord failure, int attempts) {
        return new ItemOutcome(item, null, failure, attempts);
    }

    public boolean isSuccess() {
        return failure == null;
    }

    public WorkItem getItem() {
        return item;
    }

    /**
     * Destination written for a loose image, or the archive the member will be packed into.
     */
    public Path getOutput() {
        return output;
    }

    public ErrorRecord getFailure() {
        return failure;
    }

    public int getAttempts() {
        return attempts;
    }

    @Override
    public String toString() {
        return isSuccess()
                ? "SUCCESS after " + attempts + " attempt(s)"
                : "FAILED: " + failure;
    }
}
