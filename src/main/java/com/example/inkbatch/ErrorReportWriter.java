package com.example.inkbatch;

import com.example.inkbatch.error.ErrorRecord;
import com.example.inkbatch.error.ErrorSummary;
import com.example.inkbatch.error.ErrorTracker;
import com.example.inkbatch.error.Severity;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * Persists the error records of a run to a single JSON file.
 */
public final class ErrorReportWriter {
    private final ObjectMapper mapper;
    private final Path reportPath;

    public ErrorReportWriter(Path reportPath) {
        this.mapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        this.reportPath = reportPath;
    }

    public void write(ErrorTracker tracker) throws IOException {
        ErrorSummary summary = tracker.summary();
        ErrorReport report = new ErrorReport(
                summary.total(),
                summary.bySeverity(),
                summary.byStep(),
                summary.filesWithErrors(),
                summary.mostProblematicFile() == null ? null : summary.mostProblematicFile().path(),
                tracker.records()
        );
        Path parent = reportPath.toAbsolutePath().getParent();
        Files.createDirectories(parent);
        mapper.writerWithDefaultPrettyPrinter().writeValue(reportPath.toFile(), report);
    }

    public ErrorReport read() throws IOException {
        return mapper.readValue(reportPath.toFile(), ErrorReport.class);
    }

    public Path path() {
        return reportPath;
    }

    public record ErrorReport(
            long total,
            Map<Severity, Long> bySeverity,
            Map<String, Long> byStep,
            int filesWithErrors,
            String mostProblematicFile,
            List<ErrorRecord> records
    ) {
    }
}
