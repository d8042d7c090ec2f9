package com.example.inkbatch.error;

import java.util.List;
import java.util.Map;

/**
 * Read-only aggregate over the error records of one run.
 *
 * @param mostProblematicFile path with the highest record count, or {@code null} when no record has a path
 * @param firstRecords        the earliest records, capped for verbose output
 */
public record ErrorSummary(
        long total,
        Map<Severity, Long> bySeverity,
        Map<String, Long> byStep,
        int filesWithErrors,
        FileErrorCount mostProblematicFile,
        List<ErrorRecord> firstRecords
) {
    public long count(Severity severity) {
        return bySeverity.getOrDefault(severity, 0L);
    }

    public boolean isEmpty() {
        return total == 0;
    }

    public record FileErrorCount(String path, long count) {
    }
}
