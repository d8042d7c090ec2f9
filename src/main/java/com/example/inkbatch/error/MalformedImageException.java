package com.example.inkbatch.error;

import java.nio.file.Path;

/**
 * Image data that no installed reader can decode. Never retried.
 */
public class MalformedImageException extends Exception {
    public MalformedImageException(String source) {
        super("Could not decode image data: " + source);
    }

    public MalformedImageException(Path source) {
        this(source.toString());
    }
}
