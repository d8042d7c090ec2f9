package com.example.inkbatch;

import com.example.inkbatch.error.ValidationException;
import org.apache.tika.Tika;
import org.apache.tika.mime.MediaType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.imageio.ImageIO;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Walks a source tree and classifies regular files by detected content type.
 */
public final class SourceScanner {
    private static final Logger LOGGER = LoggerFactory.getLogger(SourceScanner.class);
    private static final Set<String> ARCHIVE_TYPES = Set.of(
            "application/zip",
            "application/x-zip-compressed",
            "application/vnd.comicbook+zip",
            "application/x-cbz"
    );
    private static final Set<String> ARCHIVE_EXTENSIONS = Set.of(".cbz", ".zip");

    private final Tika tika;

    public SourceScanner(Tika tika) {
        this.tika = tika;
    }

    /**
     * Returns every classified file below {@code root} in path order, skipping symbolic links.
     */
    public List<SourceEntry> scan(Path root) throws IOException {
        if (!Files.isDirectory(root)) {
            throw new ValidationException(root + " is not a valid directory.");
        }
        try (Stream<Path> stream = Files.walk(root)) {
            List<Path> files = stream
                    .filter(path -> Files.isRegularFile(path) && !Files.isSymbolicLink(path))
                    .sorted()
                    .collect(Collectors.toList());
            return files.stream().map(this::classify).filter(entry -> entry.type() != SourceType.OTHER).toList();
        }
    }

    public SourceEntry classify(Path path) {
        String mimeType = detectMimeType(path);
        if (isArchive(path, mimeType)) {
            return new SourceEntry(path, SourceType.ARCHIVE, mimeType);
        }
        if (mimeType.startsWith("image/")) {
            SourceType type = ImageIO.getImageReadersByMIMEType(mimeType).hasNext()
                    ? SourceType.IMAGE
                    : SourceType.UNSUPPORTED_IMAGE;
            return new SourceEntry(path, type, mimeType);
        }
        LOGGER.debug("Ignoring {} ({})", path, mimeType);
        return new SourceEntry(path, SourceType.OTHER, mimeType);
    }

    /**
     * Name-only detection for archive entries, which are not on disk.
     */
    public boolean isImageName(String entryName) {
        return tika.detect(entryName).startsWith("image/");
    }

    private boolean isArchive(Path path, String mimeType) {
        String name = path.getFileName().toString().toLowerCase(Locale.ROOT);
        return ARCHIVE_TYPES.contains(mimeType) || ARCHIVE_EXTENSIONS.stream().anyMatch(name::endsWith);
    }

    private String detectMimeType(Path path) {
        try {
            MediaType mediaType = MediaType.parse(tika.detect(path));
            return mediaType == null ? "application/octet-stream" : mediaType.getBaseType().toString();
        } catch (IOException ex) {
            LOGGER.warn("Failed to detect content type of {}", path, ex);
            return "application/octet-stream";
        }
    }

    public enum SourceType {
        IMAGE,
        ARCHIVE,
        UNSUPPORTED_IMAGE,
        OTHER
    }

    public record SourceEntry(Path path, SourceType type, String mimeType) {
    }
}
