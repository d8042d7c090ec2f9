package com.example.inkbatch;

import com.example.inkbatch.error.ErrorSummary;
import org.slf4j.event.Level;

import java.nio.file.Path;

/**
 * Receives progress and log events from a batch run. Implementations must be thread-safe;
 * item events arrive from worker threads.
 */
public interface ProgressSink {
    void log(String message, Level level);

    void onItemStart(Path path);

    void onItemDone(Path path, ItemOutcome outcome);

    void onBatchDone(ErrorSummary summary);

    static ProgressSink noop() {
        return new ProgressSink() {
            @Override
            public void log(String message, Level level) {
            }

            @Override
            public void onItemStart(Path path) {
            }

            @Override
            public void onItemDone(Path path, ItemOutcome outcome) {
            }

            @Override
            public void onBatchDone(ErrorSummary summary) {
            }
        };
    }
}
