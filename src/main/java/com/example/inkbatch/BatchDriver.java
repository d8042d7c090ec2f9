package com.example.inkbatch;

import com.example.inkbatch.error.AttemptFailedException;
import com.example.inkbatch.error.ErrorKind;
import com.example.inkbatch.error.ErrorRecord;
import com.example.inkbatch.error.ErrorSummary;
import com.example.inkbatch.error.ErrorTracker;
import com.example.inkbatch.error.Severity;
import com.example.inkbatch.error.TransformException;
import com.example.inkbatch.pipeline.Pipeline;
import org.apache.tika.Tika;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.event.Level;

import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Orchestrates a batch run: source enumeration, dispatch of work items to a fixed worker pool,
 * retried pipeline execution, ordered archive reassembly, and error aggregation.
 */
public final class BatchDriver {
    private static final Logger LOGGER = LoggerFactory.getLogger(BatchDriver.class);

    static final String STEP_READ = "image_read";
    static final String STEP_ENCODE = "image_encode";
    static final String STEP_WRITE = "image_write";
    static final String STEP_ARCHIVE_EXTRACTION = "archive_extraction";
    static final String STEP_ARCHIVE_CREATION = "archive_creation";

    private final BatchConfig config;
    private final ProgressSink sink;
    private final Sleeper sleeper;
    private final ImageCodec codec;
    private final ErrorTracker tracker = new ErrorTracker();

    private final AtomicBoolean aborted = new AtomicBoolean();
    private final AtomicReference<ErrorRecord> abortCause = new AtomicReference<>();
    private final AtomicInteger succeeded = new AtomicInteger();
    private final AtomicInteger failed = new AtomicInteger();
    private final Set<Path> claimedOutputs = new HashSet<>();

    public BatchDriver(BatchConfig config, ProgressSink sink) {
        this(config, sink, Sleeper.THREAD, new ImageCodec());
    }

    BatchDriver(BatchConfig config, ProgressSink sink, Sleeper sleeper, ImageCodec codec) {
        this.config = config;
        this.sink = sink;
        this.sleeper = sleeper;
        this.codec = codec;
    }

    /**
     * Executes one run. Enumeration happens on the calling thread, which also acts as the
     * dispatcher; it never hands out more items than there are idle workers, so an abort
     * stops further items from starting.
     */
    public BatchResult run() throws IOException, InterruptedException {
        Pipeline pipeline = config.pipeline().withResize(config.resolution());
        SourceScanner scanner = new SourceScanner(new Tika());
        List<SourceScanner.SourceEntry> sources = scanner.scan(config.sourceRoot());
        sink.log("Pipeline: " + pipeline + ", target " + config.resolution(), Level.INFO);

        for (SourceScanner.SourceEntry source : sources) {
            if (source.type() == SourceScanner.SourceType.UNSUPPORTED_IMAGE) {
                tracker.addError(ErrorRecord.warning(source.path().toString(), ErrorKind.UNSUPPORTED_FORMAT,
                        "No image reader for " + source.mimeType()));
            }
        }

        if (config.dryRun()) {
            return dryRun(sources, pipeline);
        }

        RetryExecutor retry = config.retryExecutor(sleeper);
        ExecutorService workers = Executors.newFixedThreadPool(config.workerCount());
        Semaphore idleWorkers = new Semaphore(config.workerCount());
        List<ArchiveAssembly> assemblies = new ArrayList<>();
        int dispatched = 0;
        int skipped = 0;
        int unopenedArchives = 0;

        try {
            for (SourceScanner.SourceEntry source : sources) {
                if (aborted.get()) {
                    if (source.type() == SourceScanner.SourceType.IMAGE) {
                        skipped++;
                    } else if (source.type() == SourceScanner.SourceType.ARCHIVE) {
                        unopenedArchives++;
                    }
                    continue;
                }
                if (source.type() == SourceScanner.SourceType.IMAGE) {
                    WorkItem item = WorkItem.looseImage(source.path());
                    Path output = claimOutput(source.path(), ImageCodec.OUTPUT_EXTENSION);
                    if (dispatch(workers, idleWorkers, () -> processItem(item, output, null, pipeline, retry))) {
                        dispatched++;
                    } else {
                        skipped++;
                    }
                } else if (source.type() == SourceScanner.SourceType.ARCHIVE) {
                    ArchiveAssembly assembly = openArchive(source.path(), scanner, retry);
                    if (assembly == null) {
                        continue;
                    }
                    assemblies.add(assembly);
                    for (WorkItem member : assembly.members()) {
                        Runnable task = () -> processItem(member, assembly.output(), assembly, pipeline, retry);
                        if (dispatch(workers, idleWorkers, task)) {
                            dispatched++;
                        } else {
                            skipped++;
                        }
                    }
                }
            }
        } finally {
            // In-flight items always run to completion; nothing is interrupted.
            workers.shutdown();
            while (!workers.awaitTermination(1, TimeUnit.HOURS)) {
                LOGGER.info("Waiting for {} worker(s) to finish.", config.workerCount());
            }
            for (ArchiveAssembly assembly : assemblies) {
                assembly.close();
            }
        }

        if (unopenedArchives > 0) {
            LOGGER.warn("{} archive(s) were not processed because the run was aborted.", unopenedArchives);
        }
        if (aborted.get()) {
            sink.log("Batch aborted after terminal failure: " + abortCause.get(), Level.ERROR);
        }

        writeErrorReport();
        ErrorSummary summary = tracker.summary();
        sink.onBatchDone(summary);
        return new BatchResult(dispatched + skipped, succeeded.get(), failed.get(), skipped, aborted.get(), false, summary);
    }

    public ErrorTracker errorTracker() {
        return tracker;
    }

    private boolean dispatch(ExecutorService workers, Semaphore idleWorkers, Runnable task) throws InterruptedException {
        idleWorkers.acquire();
        if (aborted.get()) {
            idleWorkers.release();
            return false;
        }
        workers.execute(() -> {
            try {
                task.run();
            } finally {
                idleWorkers.release();
            }
        });
        return true;
    }

    private ArchiveAssembly openArchive(Path archive, SourceScanner scanner, RetryExecutor retry) throws InterruptedException {
        Path output = claimOutput(archive, ".cbz");
        ArchiveAssembly assembly;
        try {
            assembly = retry.run(() -> ArchiveAssembly.open(archive, output, scanner::isImageName)).value();
        } catch (AttemptFailedException ex) {
            ErrorRecord record = ErrorRecord.of(archive.toString(), ex, Severity.CRITICAL, STEP_ARCHIVE_EXTRACTION);
            LOGGER.error("Failed to extract archive {}", archive, ex);
            recordTerminalFailure(record);
            return null;
        }
        if (assembly.imageMemberCount() == 0) {
            tracker.addError(ErrorRecord.warning(archive.toString(), ErrorKind.EMPTY_ARCHIVE, "Archive contains no images"));
            closeAbandoned(assembly);
            return null;
        }
        LOGGER.info("Extracted {} image(s) from {}", assembly.imageMemberCount(), archive);
        return assembly;
    }

    private void processItem(WorkItem item, Path output, ArchiveAssembly assembly, Pipeline pipeline, RetryExecutor retry) {
        Path path = Path.of(item.displayPath());
        ItemStatus status = new ItemStatus(item);
        AtomicReference<String> phase = new AtomicReference<>(STEP_READ);

        sink.onItemStart(path);
        status.transition(ItemState.RUNNING);
        ItemOutcome outcome;
        try {
            RetryResult<byte[]> result = retry.run(() -> {
                if (status.state() == ItemState.RETRYING) {
                    status.transition(ItemState.RUNNING);
                }
                phase.set(STEP_READ);
                BufferedImage image = assembly == null
                        ? codec.read(item.sourcePath())
                        : codec.decode(assembly.readMember(item.positionInArchive()), item.displayPath());
                phase.set(null);
                BufferedImage processed = pipeline.process(image);
                phase.set(STEP_ENCODE);
                byte[] encoded = codec.encode(processed, config.quality());
                if (assembly == null) {
                    phase.set(STEP_WRITE);
                    codec.write(output, encoded);
                }
                return encoded;
            }, attempt -> {
                status.transition(ItemState.RETRYING);
                if (config.verbose()) {
                    sink.log("Retry " + attempt.getAttempt() + "/" + config.maxRetries() + " for " + path, Level.WARN);
                }
            });
            status.transition(ItemState.SUCCESS);
            succeeded.incrementAndGet();
            outcome = ItemOutcome.success(item, output, result.attemptCount());
            sink.onItemDone(path, outcome);
            if (assembly != null && assembly.complete(item.positionInArchive(), result.value())) {
                finishArchive(assembly, retry);
            }
        } catch (AttemptFailedException ex) {
            ErrorRecord record = ErrorKind.of(ex) == ErrorKind.ARCHIVE
                    ? ErrorRecord.of(path.toString(), ex, Severity.CRITICAL, STEP_ARCHIVE_EXTRACTION)
                    : ErrorRecord.of(path.toString(), ex, Severity.ERROR, stepName(ex, phase.get()));
            failItem(item, assembly, status, path, record, ex.attemptCount(), retry);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            failItem(item, assembly, status, path, ErrorRecord.of(path.toString(), ex, Severity.ERROR, phase.get()), 0, retry);
        }
    }

    private void failItem(WorkItem item,
                          ArchiveAssembly assembly,
                          ItemStatus status,
                          Path path,
                          ErrorRecord record,
                          int attempts,
                          RetryExecutor retry) {
        if (status.state() == ItemState.RETRYING) {
            status.transition(ItemState.RUNNING);
        }
        status.transition(ItemState.FAILED);
        failed.incrementAndGet();
        LOGGER.error("Failed to process {}: {}", path, record.message());
        recordTerminalFailure(record);
        sink.onItemDone(path, ItemOutcome.failure(item, record, attempts));
        if (assembly != null && assembly.fail(item.positionInArchive())) {
            finishArchive(assembly, retry);
        }
    }

    /**
     * Runs on the worker that completed the archive's last member.
     */
    private void finishArchive(ArchiveAssembly assembly, RetryExecutor retry) {
        try {
            if (assembly.hasFailures() && !config.continueOnError()) {
                sink.log("Not writing " + assembly.output() + ": a member failed and continueOnError is off", Level.WARN);
                return;
            }
            if (assembly.successfulMembers() == 0) {
                sink.log("Not writing " + assembly.output() + ": no member was processed successfully", Level.WARN);
                return;
            }
            try {
                retry.run(() -> {
                    assembly.write(config.quality());
                    return assembly.output();
                });
                LOGGER.info("Created archive {}", assembly.output());
            } catch (AttemptFailedException ex) {
                LOGGER.error("Failed to create archive {}", assembly.output(), ex);
                recordTerminalFailure(ErrorRecord.of(assembly.output().toString(), ex, Severity.CRITICAL, STEP_ARCHIVE_CREATION));
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
                recordTerminalFailure(ErrorRecord.of(assembly.output().toString(), ex, Severity.CRITICAL, STEP_ARCHIVE_CREATION));
            }
        } finally {
            closeAbandoned(assembly);
        }
    }

    private void recordTerminalFailure(ErrorRecord record) {
        tracker.addError(record);
        if (!config.continueOnError() && aborted.compareAndSet(false, true)) {
            abortCause.set(record);
            LOGGER.warn("Stopping dispatch after terminal failure of {}", record.path());
        }
    }

    private BatchResult dryRun(List<SourceScanner.SourceEntry> sources, Pipeline pipeline) {
        int planned = 0;
        for (SourceScanner.SourceEntry source : sources) {
            if (source.type() == SourceScanner.SourceType.IMAGE) {
                sink.log("Would process file: " + source.path() + " -> "
                        + claimOutput(source.path(), ImageCodec.OUTPUT_EXTENSION), Level.INFO);
                planned++;
            } else if (source.type() == SourceScanner.SourceType.ARCHIVE) {
                sink.log("Would extract archive: " + source.path() + " -> " + claimOutput(source.path(), ".cbz"), Level.INFO);
                planned++;
            }
        }
        sink.log("Dry run: " + planned + " source(s), steps " + pipeline.stepNames(), Level.INFO);
        ErrorSummary summary = tracker.summary();
        sink.onBatchDone(summary);
        return new BatchResult(planned, 0, 0, 0, false, true, summary);
    }

    private void writeErrorReport() {
        if (!tracker.hasErrors() || config.errorReportFile().isEmpty()) {
            return;
        }
        ErrorReportWriter writer = new ErrorReportWriter(config.errorReportFile().get());
        try {
            writer.write(tracker);
            LOGGER.info("Wrote error report to {}", writer.path());
        } catch (IOException ex) {
            LOGGER.warn("Failed to write error report {}", writer.path(), ex);
        }
    }

    /**
     * Reserves the destination for {@code source}. Sources that map to the same destination, such as
     * {@code p1.jpg} and {@code p1.png}, get a numeric suffix in enumeration order. Enumeration thread only.
     */
    private Path claimOutput(Path source, String extension) {
        Path candidate = outputPath(source, extension);
        Path output = candidate;
        for (int n = 1; !claimedOutputs.add(output); n++) {
            String name = candidate.getFileName().toString();
            output = candidate.resolveSibling(name.substring(0, name.length() - extension.length()) + "_" + n + extension);
        }
        if (!output.equals(candidate)) {
            LOGGER.warn("{} would overwrite another output; writing {} instead", source, output.getFileName());
        }
        return output;
    }

    private Path outputPath(Path source, String extension) {
        Path relative = config.sourceRoot().toAbsolutePath().normalize()
                .relativize(source.toAbsolutePath().normalize());
        Path target = config.destinationRoot().resolve(relative.toString());
        String name = target.getFileName().toString();
        int dot = name.lastIndexOf('.');
        String stem = dot > 0 ? name.substring(0, dot) : name;
        return target.resolveSibling(stem + extension);
    }

    private static String stepName(AttemptFailedException ex, String phase) {
        Throwable cause = ErrorKind.unwrap(ex);
        if (cause instanceof TransformException transform) {
            return transform.stepName();
        }
        return phase;
    }

    private static void closeAbandoned(ArchiveAssembly assembly) {
        try {
            assembly.close();
        } catch (IOException ex) {
            LOGGER.warn("Failed to close archive {}", assembly.source(), ex);
        }
    }
}
