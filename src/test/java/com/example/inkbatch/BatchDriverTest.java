package com.example.inkbatch;

import com.example.inkbatch.error.ErrorRecord;
import com.example.inkbatch.error.ErrorSummary;
import com.example.inkbatch.error.MalformedImageException;
import com.example.inkbatch.error.Severity;
import com.example.inkbatch.pipeline.Pipeline;
import com.example.inkbatch.pipeline.PresetFactory;
import com.example.inkbatch.pipeline.Resolution;
import org.junit.jupiter.api.Test;
import org.slf4j.event.Level;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class BatchDriverTest {
    private static final Sleeper NO_SLEEP = duration -> {
    };
    private static final Resolution PAGE = new Resolution(20, 30);

    @Test
    void convertsLooseImagesToTargetResolution() throws Exception {
        Path source = Files.createTempDirectory("ink-source");
        Path destination = Files.createTempDirectory("ink-dest");
        TestImages.writePng(source.resolve("chapter1/page1.png"), 20, 30);
        TestImages.writePng(source.resolve("page2.png"), 40, 20);

        BatchConfig config = config(source, destination, PresetFactory.getPreset("kindle"), new Resolution(60, 80), 2, 0, true);
        BatchResult result = new BatchDriver(config, ProgressSink.noop(), NO_SLEEP, new ImageCodec()).run();

        assertEquals(2, result.succeeded());
        assertEquals(BatchResult.EXIT_OK, result.exitCode());
        BufferedImage output = ImageIO.read(destination.resolve("chapter1/page1.png").toFile());
        assertEquals(60, output.getWidth());
        assertEquals(80, output.getHeight());
        assertTrue(Files.exists(destination.resolve("page2.png")));
        assertFalse(Files.exists(destination.resolve("errors.json")));
    }

    @Test
    void reassemblesArchiveInOriginalOrderWhenMembersFinishOutOfOrder() throws Exception {
        Path source = Files.createTempDirectory("ink-source");
        Path destination = Files.createTempDirectory("ink-dest");
        byte[] notes = "read right to left".getBytes(StandardCharsets.UTF_8);
        Map<String, byte[]> entries = new LinkedHashMap<>();
        entries.put("p1.png", TestImages.png(20, 30));
        entries.put("notes.txt", notes);
        entries.put("p2.png", TestImages.png(20, 30));
        entries.put("p3.jpg", jpeg());
        TestImages.writeZip(source.resolve("book.cbz"), entries);

        List<String> finished = Collections.synchronizedList(new ArrayList<>());
        ImageCodec slowFirstPage = new ImageCodec() {
            @Override
            public BufferedImage decode(byte[] data, String name) throws IOException, MalformedImageException {
                if (name.endsWith("p1.png")) {
                    try {
                        Thread.sleep(300);
                    } catch (InterruptedException ex) {
                        Thread.currentThread().interrupt();
                    }
                }
                BufferedImage image = super.decode(data, name);
                finished.add(name.substring(name.lastIndexOf('/') + 1));
                return image;
            }
        };

        BatchConfig config = config(source, destination, new Pipeline(), PAGE, 3, 0, true);
        BatchResult result = new BatchDriver(config, ProgressSink.noop(), NO_SLEEP, slowFirstPage).run();

        assertEquals(3, result.succeeded());
        assertEquals("p1.png", finished.get(finished.size() - 1));
        Path archive = destination.resolve("book.cbz");
        assertEquals(List.of("p1.png", "notes.txt", "p2.png", "p3.png"), TestImages.zipEntryNames(archive));
        assertArrayEquals(notes, TestImages.zipEntry(archive, "notes.txt"));
        BufferedImage converted = ImageIO.read(new ByteArrayInputStream(TestImages.zipEntry(archive, "p3.png")));
        assertEquals(20, converted.getWidth());
        assertSamePixels(TestImages.page(20, 30), decodeEntry(archive, "p1.png"));
        assertSamePixels(TestImages.page(20, 30), decodeEntry(archive, "p2.png"));
    }

    @Test
    void membersWithSameStemKeepDistinctEntries() throws Exception {
        Path source = Files.createTempDirectory("ink-source");
        Path destination = Files.createTempDirectory("ink-dest");
        Map<String, byte[]> entries = new LinkedHashMap<>();
        entries.put("page1.jpg", jpeg());
        entries.put("page1.png", TestImages.png(20, 30));
        entries.put("page2.png", TestImages.png(20, 30));
        TestImages.writeZip(source.resolve("book.cbz"), entries);

        BatchConfig config = config(source, destination, new Pipeline(), PAGE, 2, 1, true);
        BatchResult result = new BatchDriver(config, ProgressSink.noop(), NO_SLEEP, new ImageCodec()).run();

        assertEquals(3, result.succeeded());
        assertEquals(BatchResult.EXIT_OK, result.exitCode());
        Path archive = destination.resolve("book.cbz");
        assertEquals(List.of("page1.png", "page1_1.png", "page2.png"), TestImages.zipEntryNames(archive));
        assertSamePixels(TestImages.page(20, 30), decodeEntry(archive, "page1_1.png"));
    }

    @Test
    void looseImagesWithSameStemDoNotOverwriteEachOther() throws Exception {
        Path source = Files.createTempDirectory("ink-source");
        Path destination = Files.createTempDirectory("ink-dest");
        Files.write(source.resolve("page1.jpg"), jpeg());
        TestImages.writePng(source.resolve("page1.png"), 20, 30);

        BatchConfig config = config(source, destination, new Pipeline(), PAGE, 2, 0, true);
        BatchResult result = new BatchDriver(config, ProgressSink.noop(), NO_SLEEP, new ImageCodec()).run();

        assertEquals(2, result.succeeded());
        assertEquals(BatchResult.EXIT_OK, result.exitCode());
        assertTrue(Files.exists(destination.resolve("page1.png")));
        assertSamePixels(TestImages.page(20, 30), ImageIO.read(destination.resolve("page1_1.png").toFile()));
    }

    @Test
    void unreadableMemberDataIsCritical() throws Exception {
        Path source = Files.createTempDirectory("ink-source");
        Path destination = Files.createTempDirectory("ink-dest");
        Map<String, byte[]> entries = new LinkedHashMap<>();
        entries.put("p1.png", TestImages.png(20, 30));
        entries.put("p2.png", TestImages.png(20, 30));
        Path archive = TestImages.writeZip(source.resolve("book.cbz"), entries);
        corruptFirstEntryData(archive);

        BatchConfig config = config(source, destination, new Pipeline(), PAGE, 1, 1, true);
        BatchResult result = new BatchDriver(config, ProgressSink.noop(), NO_SLEEP, new ImageCodec()).run();

        assertEquals(1, result.succeeded());
        assertEquals(1, result.failed());
        assertEquals(1L, result.summary().count(Severity.CRITICAL));
        ErrorRecord record = result.summary().firstRecords().get(0);
        assertTrue(record.path().endsWith("book.cbz!/p1.png"));
        assertEquals(BatchDriver.STEP_ARCHIVE_EXTRACTION, record.stepName());
        assertEquals(1, record.retryCount());
        assertEquals(BatchResult.EXIT_CRITICAL, result.exitCode());
        assertEquals(List.of("p2.png"), TestImages.zipEntryNames(destination.resolve("book.cbz")));
    }

    @Test
    void failedMemberDemotesArchiveWhenContinueOnErrorIsOff() throws Exception {
        Path source = Files.createTempDirectory("ink-source");
        Path destination = Files.createTempDirectory("ink-dest");
        Map<String, byte[]> entries = new LinkedHashMap<>();
        entries.put("a.png", TestImages.png(20, 30));
        entries.put("b.png", TestImages.png(20, 30));
        entries.put("c.png", "not really a png".getBytes(StandardCharsets.UTF_8));
        TestImages.writeZip(source.resolve("book.cbz"), entries);

        BatchConfig config = config(source, destination, new Pipeline(), PAGE, 1, 0, false);
        BatchResult result = new BatchDriver(config, ProgressSink.noop(), NO_SLEEP, new ImageCodec()).run();

        assertTrue(result.aborted());
        assertEquals(2, result.succeeded());
        assertEquals(1, result.failed());
        assertEquals(BatchResult.EXIT_CRITICAL, result.exitCode());
        assertFalse(Files.exists(destination.resolve("book.cbz")));
    }

    @Test
    void continuesPastTransientFailureAndRecordsRetries() throws Exception {
        Path source = Files.createTempDirectory("ink-source");
        Path destination = Files.createTempDirectory("ink-dest");
        writePages(source, 5);

        BatchConfig config = config(source, destination, new Pipeline(), PAGE, 2, 2, true);
        BatchResult result = new BatchDriver(config, ProgressSink.noop(), NO_SLEEP, failingOn("img3.png")).run();

        assertEquals(4, result.succeeded());
        assertEquals(1, result.failed());
        assertFalse(result.aborted());
        assertEquals(BatchResult.EXIT_ERRORS, result.exitCode());
        assertEquals(1L, result.summary().total());
        ErrorRecord record = result.summary().firstRecords().get(0);
        assertEquals(Severity.ERROR, record.severity());
        assertEquals(2, record.retryCount());
        assertEquals(BatchDriver.STEP_READ, record.stepName());
        assertFalse(Files.exists(destination.resolve("img3.png")));
        assertTrue(Files.exists(destination.resolve("img5.png")));
        assertTrue(Files.exists(destination.resolve("errors.json")));
    }

    @Test
    void stopsDispatchingAfterFailureWhenContinueOnErrorIsOff() throws Exception {
        Path source = Files.createTempDirectory("ink-source");
        Path destination = Files.createTempDirectory("ink-dest");
        writePages(source, 5);

        BatchConfig config = config(source, destination, new Pipeline(), PAGE, 1, 1, false);
        BatchResult result = new BatchDriver(config, ProgressSink.noop(), NO_SLEEP, failingOn("img3.png")).run();

        assertTrue(result.aborted());
        assertEquals(2, result.succeeded());
        assertEquals(1, result.failed());
        assertEquals(2, result.skipped());
        assertEquals(BatchResult.EXIT_CRITICAL, result.exitCode());
        assertTrue(Files.exists(destination.resolve("img2.png")));
        assertFalse(Files.exists(destination.resolve("img4.png")));
        assertFalse(Files.exists(destination.resolve("img5.png")));
    }

    @Test
    void failedMemberIsDroppedFromArchive() throws Exception {
        Path source = Files.createTempDirectory("ink-source");
        Path destination = Files.createTempDirectory("ink-dest");
        Map<String, byte[]> entries = new LinkedHashMap<>();
        entries.put("a.png", TestImages.png(20, 30));
        entries.put("b.png", "not really a png".getBytes(StandardCharsets.UTF_8));
        entries.put("c.png", TestImages.png(20, 30));
        TestImages.writeZip(source.resolve("comic.zip"), entries);

        BatchConfig config = config(source, destination, new Pipeline(), PAGE, 2, 2, true);
        BatchResult result = new BatchDriver(config, ProgressSink.noop(), NO_SLEEP, new ImageCodec()).run();

        assertEquals(2, result.succeeded());
        assertEquals(1, result.failed());
        ErrorRecord record = result.summary().firstRecords().get(0);
        assertTrue(record.path().endsWith("comic.zip!/b.png"));
        // Malformed data is never retried.
        assertEquals(0, record.retryCount());
        assertEquals(List.of("a.png", "c.png"), TestImages.zipEntryNames(destination.resolve("comic.cbz")));
    }

    @Test
    void corruptArchiveIsCritical() throws Exception {
        Path source = Files.createTempDirectory("ink-source");
        Path destination = Files.createTempDirectory("ink-dest");
        Files.writeString(source.resolve("broken.cbz"), "this is not a zip file");
        TestImages.writePng(source.resolve("fine.png"), 20, 30);

        BatchConfig config = config(source, destination, new Pipeline(), PAGE, 2, 1, true);
        BatchResult result = new BatchDriver(config, ProgressSink.noop(), NO_SLEEP, new ImageCodec()).run();

        assertEquals(1, result.succeeded());
        assertEquals(1L, result.summary().count(Severity.CRITICAL));
        assertEquals(BatchDriver.STEP_ARCHIVE_EXTRACTION, result.summary().firstRecords().get(0).stepName());
        assertEquals(BatchResult.EXIT_CRITICAL, result.exitCode());
        assertFalse(Files.exists(destination.resolve("broken.cbz")));
    }

    @Test
    void archiveWithoutImagesIsAWarning() throws Exception {
        Path source = Files.createTempDirectory("ink-source");
        Path destination = Files.createTempDirectory("ink-dest");
        TestImages.writeZip(source.resolve("docs.cbz"), Map.of("readme.txt", "hello".getBytes(StandardCharsets.UTF_8)));

        BatchConfig config = config(source, destination, new Pipeline(), PAGE, 1, 0, true);
        BatchResult result = new BatchDriver(config, ProgressSink.noop(), NO_SLEEP, new ImageCodec()).run();

        assertEquals(1L, result.summary().count(Severity.WARNING));
        assertEquals(BatchResult.EXIT_ERRORS, result.exitCode());
        assertFalse(Files.exists(destination.resolve("docs.cbz")));
    }

    @Test
    void dryRunWritesNothing() throws Exception {
        Path source = Files.createTempDirectory("ink-source");
        Path destination = Files.createTempDirectory("ink-dest");
        writePages(source, 3);
        TestImages.writeZip(source.resolve("book.cbz"), Map.of("p1.png", TestImages.png(20, 30)));
        List<String> messages = Collections.synchronizedList(new ArrayList<>());

        BatchConfig config = new BatchConfig(source, destination, new Pipeline(), PAGE, 6, 2, 0, Duration.ZERO, 2.0,
                true, true, false, Optional.of(destination.resolve("errors.json")));
        BatchResult result = new BatchDriver(config, capturing(messages), NO_SLEEP, new ImageCodec()).run();

        assertTrue(result.dryRun());
        assertEquals(BatchResult.EXIT_OK, result.exitCode());
        assertEquals(4, result.discovered());
        assertEquals(0, result.succeeded());
        try (Stream<Path> files = Files.list(destination)) {
            assertEquals(0, files.count());
        }
        assertTrue(messages.stream().anyMatch(message -> message.startsWith("Would extract archive")));
        assertEquals(3, messages.stream().filter(message -> message.startsWith("Would process file")).count());
    }

    private static BatchConfig config(Path source,
                                      Path destination,
                                      Pipeline pipeline,
                                      Resolution resolution,
                                      int workers,
                                      int maxRetries,
                                      boolean continueOnError) {
        return new BatchConfig(source, destination, pipeline, resolution, 6, workers, maxRetries, Duration.ZERO, 2.0,
                continueOnError, false, false, Optional.of(destination.resolve("errors.json")));
    }

    private static void writePages(Path source, int count) throws IOException {
        for (int i = 1; i <= count; i++) {
            TestImages.writePng(source.resolve("img" + i + ".png"), 20, 30);
        }
    }

    private static ImageCodec failingOn(String fileName) {
        return new ImageCodec() {
            @Override
            public BufferedImage read(Path path) throws IOException, MalformedImageException {
                if (path.getFileName().toString().equals(fileName)) {
                    throw new IOException("Device not ready: " + path);
                }
                return super.read(path);
            }
        };
    }

    private static BufferedImage decodeEntry(Path archive, String name) throws IOException {
        return ImageIO.read(new ByteArrayInputStream(TestImages.zipEntry(archive, name)));
    }

    private static void assertSamePixels(BufferedImage expected, BufferedImage actual) {
        assertEquals(expected.getWidth(), actual.getWidth());
        assertEquals(expected.getHeight(), actual.getHeight());
        for (int y = 0; y < expected.getHeight(); y++) {
            for (int x = 0; x < expected.getWidth(); x++) {
                assertEquals(expected.getRGB(x, y), actual.getRGB(x, y), "pixel " + x + "," + y);
            }
        }
    }

    /**
     * Overwrites the first compressed byte of the first local entry with an invalid deflate block header.
     */
    private static void corruptFirstEntryData(Path zip) throws IOException {
        byte[] bytes = Files.readAllBytes(zip);
        int nameLength = (bytes[26] & 0xFF) | (bytes[27] & 0xFF) << 8;
        int extraLength = (bytes[28] & 0xFF) | (bytes[29] & 0xFF) << 8;
        bytes[30 + nameLength + extraLength] = (byte) 0xFF;
        Files.write(zip, bytes);
    }

    private static byte[] jpeg() throws IOException {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        ImageIO.write(TestImages.page(20, 30), "jpg", bytes);
        return bytes.toByteArray();
    }

    private static ProgressSink capturing(List<String> messages) {
        return new ProgressSink() {
            @Override
            public void log(String message, Level level) {
                messages.add(message);
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
