package com.example.inkbatch;

import com.example.inkbatch.error.ErrorRecord;
import com.example.inkbatch.error.ErrorSummary;
import com.example.inkbatch.error.Severity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.event.Level;

import java.nio.file.Path;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Progress sink that writes everything to SLF4J, including the end-of-run error summary.
 */
public final class LoggingProgressSink implements ProgressSink {
    private static final Logger LOGGER = LoggerFactory.getLogger(LoggingProgressSink.class);
    private static final String RULE = "=".repeat(60);

    private final boolean verbose;
    private final AtomicLong completed = new AtomicLong();

    public LoggingProgressSink(boolean verbose) {
        this.verbose = verbose;
    }

    @Override
    public void log(String message, Level level) {
        LOGGER.atLevel(level).log(message);
    }

    @Override
    public void onItemStart(Path path) {
        LOGGER.debug("Processing {}", path);
    }

    @Override
    public void onItemDone(Path path, ItemOutcome outcome) {
        long done = completed.incrementAndGet();
        if (outcome.isSuccess()) {
            LOGGER.info("[{}] Done {}", done, path);
        } else {
            LOGGER.error("[{}] Failed {}: {}", done, path, outcome.getFailure().message());
        }
    }

    @Override
    public void onBatchDone(ErrorSummary summary) {
        if (summary.isEmpty()) {
            LOGGER.info("Processing completed successfully with no errors.");
            return;
        }
        LOGGER.warn(RULE);
        LOGGER.warn("ERROR SUMMARY");
        LOGGER.warn(RULE);
        LOGGER.warn("Total errors: {}", summary.total());
        LOGGER.warn("  Warnings: {}", summary.count(Severity.WARNING));
        LOGGER.error("  Errors: {}", summary.count(Severity.ERROR));
        LOGGER.error("  Critical: {}", summary.count(Severity.CRITICAL));
        LOGGER.warn("Files with errors: {}", summary.filesWithErrors());
        if (summary.mostProblematicFile() != null) {
            LOGGER.warn("Most problematic file: {} ({} errors)",
                    summary.mostProblematicFile().path(), summary.mostProblematicFile().count());
        }
        if (!summary.byStep().isEmpty()) {
            LOGGER.warn("Errors by step:");
            for (Map.Entry<String, Long> entry : summary.byStep().entrySet()) {
                LOGGER.warn("  {}: {}", entry.getKey(), entry.getValue());
            }
        }
        if (verbose) {
            LOGGER.warn("First {} errors in detail:", summary.firstRecords().size());
            for (ErrorRecord record : summary.firstRecords()) {
                LOGGER.error("  {}", record);
            }
        }
        LOGGER.warn(RULE);
    }
}
