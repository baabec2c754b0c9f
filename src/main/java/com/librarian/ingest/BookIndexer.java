package com.librarian.ingest;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.List;
import java.util.function.BooleanSupplier;
import java.util.stream.Stream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.librarian.store.BookStore;

/**
 * Walks files and directories, feeding every supported book through extraction into an open store.
 * <p>
 * A book that fails to extract or index is counted and skipped; it never aborts the walk. Each book's chunks are
 * persisted before the next book starts, so stopping early keeps everything already indexed.
 */
public class BookIndexer {
    private static final Logger log = LoggerFactory.getLogger(BookIndexer.class);

    private final BookStore store;
    private final BookExtractors extractors;

    public BookIndexer(BookStore store) {
        this(store, new BookExtractors());
    }

    public BookIndexer(BookStore store, BookExtractors extractors) {
        this.store = store;
        this.extractors = extractors;
    }

    public List<Path> findBooks(Path directory) throws IOException {
        try (Stream<Path> files = Files.walk(directory)) {
            return files
                    .filter(Files::isRegularFile)
                    .filter(extractors::supports)
                    .sorted()
                    .toList();
        }
    }

    public IndexingStats indexDirectory(Path directory) throws IOException {
        return indexDirectory(directory, () -> false, IndexingProgressListener.NONE);
    }

    /**
     * Indexes every supported book below {@code directory}.
     *
     * @param interruptCheck polled once before each book; returning {@code true} ends the walk with
     *                       {@link IndexingStats#interrupted()} set
     * @throws NoSuchFileException if {@code directory} does not exist
     */
    public IndexingStats indexDirectory(Path directory,
            BooleanSupplier interruptCheck,
            IndexingProgressListener listener) throws IOException {
        if (!Files.isDirectory(directory)) {
            throw new NoSuchFileException(directory.toString(), null, "not a directory");
        }

        List<Path> books = findBooks(directory);
        if (books.isEmpty()) {
            log.info("No supported books found in {} (formats: {})", directory, extractors.supportedExtensions());
            return IndexingStats.empty();
        }
        log.info("Found {} book(s) in {}", books.size(), directory);

        int success = 0;
        int failed = 0;
        for (int i = 0; i < books.size(); i++) {
            if (interruptCheck.getAsBoolean()) {
                log.info("Indexing interrupted after {} of {} book(s)", i, books.size());
                return new IndexingStats(success, failed, 0, true);
            }
            Path book = books.get(i);
            listener.onBook(book, i + 1, books.size());
            if (indexBook(book)) {
                success++;
            } else {
                failed++;
            }
        }

        log.info("Indexing complete: success={}, failed={}", success, failed);
        return new IndexingStats(success, failed, 0, false);
    }

    /**
     * Indexes a single book file.
     *
     * @return {@code false} if the file is missing, unsupported, or could not be indexed
     */
    public boolean indexFile(Path file) {
        if (!Files.isRegularFile(file)) {
            log.error("File {} does not exist", file);
            return false;
        }
        if (!extractors.supports(file)) {
            log.error("Unsupported format {} (supported: {})", Document.formatOf(file), extractors.supportedExtensions());
            return false;
        }
        return indexBook(file);
    }

    private boolean indexBook(Path book) {
        try {
            Document document = extractors.extract(book);
            return store.upsert(document);
        } catch (IOException | RuntimeException e) {
            log.warn("Failed to index {}: {}", book, e.getMessage());
            log.debug("Indexing failure detail", e);
            return false;
        }
    }
}
