package com.librarian.ingest;

import java.io.IOException;
import java.nio.file.Path;

public class BookExtractionException extends IOException {
    private final Path source;

    public BookExtractionException(Path source, String message) {
        super(message + ": " + source);
        this.source = source;
    }

    public BookExtractionException(Path source, String message, Throwable cause) {
        super(message + ": " + source, cause);
        this.source = source;
    }

    public Path source() {
        return source;
    }
}
