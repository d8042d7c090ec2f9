package com.example.inkbatch.error;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Append-only collector of failure records shared by all workers of a run.
 */
public final class ErrorTracker {
    public static final int SUMMARY_SAMPLE_SIZE = 5;

    private final List<ErrorRecord> records = new ArrayList<>();
    private final Map<Severity, Long> severityCounts = new EnumMap<>(Severity.class);
    private final Map<String, Long> stepCounts = new LinkedHashMap<>();
    private final Map<String, Long> fileCounts = new HashMap<>();

    public synchronized void addError(ErrorRecord record) {
        records.add(record);
        severityCounts.merge(record.severity(), 1L, Long::sum);
        if (record.stepName() != null) {
            stepCounts.merge(record.stepName(), 1L, Long::sum);
        }
        if (record.path() != null) {
            fileCounts.merge(record.path(), 1L, Long::sum);
        }
    }

    public synchronized ErrorSummary summary() {
        Map<Severity, Long> bySeverity = new EnumMap<>(Severity.class);
        for (Severity severity : Severity.values()) {
            bySeverity.put(severity, severityCounts.getOrDefault(severity, 0L));
        }
        ErrorSummary.FileErrorCount worst = null;
        for (Map.Entry<String, Long> entry : fileCounts.entrySet()) {
            if (worst == null
                    || entry.getValue() > worst.count()
                    || (entry.getValue() == worst.count() && entry.getKey().compareTo(worst.path()) < 0)) {
                worst = new ErrorSummary.FileErrorCount(entry.getKey(), entry.getValue());
            }
        }
        return new ErrorSummary(
                records.size(),
                Collections.unmodifiableMap(bySeverity),
                Collections.unmodifiableMap(new LinkedHashMap<>(stepCounts)),
                fileCounts.size(),
                worst,
                List.copyOf(records.subList(0, Math.min(SUMMARY_SAMPLE_SIZE, records.size())))
        );
    }

    public synchronized boolean hasCritical() {
        return severityCounts.getOrDefault(Severity.CRITICAL, 0L) > 0;
    }

    public synchronized boolean hasErrors() {
        return !records.isEmpty();
    }

    public synchronized List<ErrorRecord> records() {
        return List.copyOf(records);
    }

    public synchronized List<ErrorRecord> records(Severity severity) {
        return records.stream().filter(record -> record.severity() == severity).toList();
    }
}
