package com.librarian.ingest;

import java.nio.file.Path;

@FunctionalInterface
public interface IndexingProgressListener {
    IndexingProgressListener NONE = (book, position, total) -> {
    };

    void onBook(Path book, int position, int total);
}
