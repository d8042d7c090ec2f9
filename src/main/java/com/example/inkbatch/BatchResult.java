package com.example.inkbatch;

import com.example.inkbatch.error.ErrorSummary;
import com.example.inkbatch.error.Severity;

/**
 * Final tally of a batch run.
 *
 * @param skipped items never dispatched because the run was aborted
 */
public record BatchResult(
        int discovered,
        int succeeded,
        int failed,
        int skipped,
        boolean aborted,
        boolean dryRun,
        ErrorSummary summary
) {
    public static final int EXIT_OK = 0;
    public static final int EXIT_ERRORS = 1;
    public static final int EXIT_CRITICAL = 2;

    public int exitCode() {
        if (dryRun) {
            return EXIT_OK;
        }
        if (aborted || summary.count(Severity.CRITICAL) > 0) {
            return EXIT_CRITICAL;
        }
        return summary.isEmpty() ? EXIT_OK : EXIT_ERRORS;
    }
}
