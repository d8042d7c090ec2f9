package com.example.inkbatch;

import com.example.inkbatch.error.ErrorKind;
import com.example.inkbatch.error.ValidationException;
import com.example.inkbatch.pipeline.Pipeline;
import com.example.inkbatch.pipeline.Resolution;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Optional;

/**
 * Immutable settings for one batch run.
 *
 * @param quality PNG and zip compression level, 1 (fastest) to 9 (smallest)
 */
public record BatchConfig(
        Path sourceRoot,
        Path destinationRoot,
        Pipeline pipeline,
        Resolution resolution,
        int quality,
        int workerCount,
        int maxRetries,
        Duration baseDelay,
        double backoffFactor,
        boolean continueOnError,
        boolean dryRun,
        boolean verbose,
        Optional<Path> errorReportFile
) {
    public BatchConfig {
        if (sourceRoot == null || destinationRoot == null) {
            throw new ValidationException("Source and destination directories are required");
        }
        if (pipeline == null) {
            throw new ValidationException("A pipeline is required");
        }
        if (resolution == null) {
            throw new ValidationException("A target resolution is required");
        }
        if (quality < 1 || quality > 9) {
            throw new ValidationException("Quality must be between 1 and 9, got " + quality);
        }
        if (workerCount < 1) {
            throw new ValidationException("Workers must be at least 1, got " + workerCount);
        }
        if (maxRetries < 0) {
            throw new ValidationException("Max retries must be non-negative, got " + maxRetries);
        }
        if (baseDelay == null || baseDelay.isNegative()) {
            throw new ValidationException("Base delay must be non-negative");
        }
        if (!(backoffFactor >= 1.0)) {
            throw new ValidationException("Backoff factor must be at least 1.0, got " + backoffFactor);
        }
        if (errorReportFile == null) {
            errorReportFile = Optional.empty();
        }
    }

    public RetryExecutor retryExecutor(Sleeper sleeper) {
        return new RetryExecutor(maxRetries, baseDelay, backoffFactor, ErrorKind::isRetryable, sleeper);
    }
}
