package com.example.inkbatch.error;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Extraction or re-encoding failure of a zip-based archive.
 */
public class ArchiveException extends IOException {
    private final Path archive;

    public ArchiveException(String message, Path archive, Throwable cause) {
        super(message + ": " + archive, cause);
        this.archive = archive;
    }

    public Path archive() {
        return archive;
    }
}
