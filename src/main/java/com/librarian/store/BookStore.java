package com.librarian.store;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.librarian.ingest.Chunk;
import com.librarian.ingest.Chunker;
import com.librarian.ingest.Document;
import com.librarian.lock.LockException;
import com.librarian.lock.LockToken;
import com.librarian.lock.LockWaitListener;
import com.librarian.lock.StoreLock;
import com.librarian.runtime.LibrarianConfig;
import com.librarian.search.RankedBook;
import com.librarian.search.ResultFuser;

/**
 * Session on one on-disk book store. Opening acquires the store lock; nothing is read before the lock is held and
 * {@link #close()} releases it.
 */
public class BookStore implements AutoCloseable {
    public static final String INDEX_FILE_NAME = "vectors.json";

    private static final Logger log = LoggerFactory.getLogger(BookStore.class);

    private final Path storeDir;
    private final StoreLock storeLock;
    private final LockToken token;
    private final VectorIndex index;
    private final EmbeddingService embeddingService;
    private final Chunker chunker;
    private final ResultFuser fuser;
    private final int overFetchFactor;
    private boolean closed;

    BookStore(Path storeDir,
            StoreLock storeLock,
            LockToken token,
            VectorIndex index,
            EmbeddingService embeddingService,
            Chunker chunker,
            ResultFuser fuser,
            int overFetchFactor) {
        this.storeDir = storeDir;
        this.storeLock = storeLock;
        this.token = token;
        this.index = index;
        this.embeddingService = embeddingService;
        this.chunker = chunker;
        this.fuser = fuser;
        this.overFetchFactor = Math.max(1, overFetchFactor);
    }

    public static BookStore open(Path storeDir, LibrarianConfig config, EmbeddingService embeddingService)
            throws IOException {
        return open(storeDir, config, embeddingService, config.getStore().lockTimeout(), LockWaitListener.logging());
    }

    /**
     * Acquires the store lock, waiting at most {@code lockTimeout} ({@code null} waits indefinitely), then loads
     * the index. The lock is released again if loading fails.
     */
    public static BookStore open(Path storeDir,
            LibrarianConfig config,
            EmbeddingService embeddingService,
            Duration lockTimeout,
            LockWaitListener waitListener) throws IOException {
        Path root = storeDir.toAbsolutePath().normalize();
        StoreLock storeLock = new StoreLock(root, config.getStore().lockPollInterval(), waitListener);
        LockToken token = storeLock.acquire(lockTimeout);
        try {
            VectorIndex index = LocalJsonVectorIndex.load(root.resolve(INDEX_FILE_NAME));
            if (index.requiresReembedding(embeddingService.version())) {
                reembed(index, embeddingService);
            }
            log.debug("Opened store {} with {} chunks", root, index.size());
            return new BookStore(
                    root,
                    storeLock,
                    token,
                    index,
                    embeddingService,
                    new Chunker(config.getChunking().getChunkSize(), config.getChunking().getOverlap()),
                    new ResultFuser(config.getSearch().getExcerptLength()),
                    config.getSearch().getOverFetchFactor());
        } catch (IOException | RuntimeException e) {
            storeLock.release(token);
            throw e;
        }
    }

    /**
     * Brings every chunk into the vector space of {@code embeddingService}. All vectors are computed before the index
     * is touched, so a provider failure leaves the file as it was.
     */
    private static void reembed(VectorIndex index, EmbeddingService embeddingService) throws IOException {
        log.warn("Store was embedded under another model, re-embedding {} chunks as {}",
                index.size(), embeddingService.version());
        List<StoredChunk> reembedded = new ArrayList<>(index.size());
        for (StoredChunk chunk : index.chunks()) {
            reembedded.add(new StoredChunk(
                    chunk.id(),
                    chunk.documentId(),
                    chunk.sequenceIndex(),
                    chunk.totalChunks(),
                    chunk.text(),
                    chunk.metadata(),
                    embeddingService.embed(chunk.text()),
                    embeddingService.version()));
        }
        reembedded.forEach(index::upsert);
        index.save();
    }

    /**
     * Chunks, embeds and persists {@code document}.
     *
     * @return {@code true} if the document is indexed afterwards (including when it already was), {@code false} if
     *         it had no text
     */
    public boolean upsert(Document document) throws IOException {
        ensureOpen();
        if (index.contains(Chunk.idFor(document.id(), 0))) {
            log.info("Book already indexed: {}", document.filename());
            return true;
        }
        if (document.text().isBlank()) {
            log.warn("No content to index for {}", document.filename());
            return false;
        }

        List<Chunk> chunks = chunker.chunk(document);
        BookMetadata metadata = BookMetadata.of(document);
        // embed everything first so a failing embedding leaves no partial book in the index
        List<StoredChunk> stored = new ArrayList<>(chunks.size());
        for (Chunk chunk : chunks) {
            stored.add(new StoredChunk(
                    chunk.id(),
                    chunk.documentId(),
                    chunk.sequenceIndex(),
                    chunk.totalChunks(),
                    chunk.text(),
                    metadata,
                    embeddingService.embed(chunk.text()),
                    embeddingService.version()));
        }
        stored.forEach(index::upsert);
        index.save();
        log.info("Indexed: {} by {} ({} chunks)", document.title(), document.author(), chunks.size());
        return true;
    }

    public boolean isIndexed(Path source) {
        ensureOpen();
        return index.contains(Chunk.idFor(Document.idFor(source), 0));
    }

    public List<SimilarityHit> query(String text, int overFetchCount) {
        ensureOpen();
        if (text == null || text.isBlank()) {
            return List.of();
        }
        return index.nearest(embeddingService.embed(text), overFetchCount);
    }

    public List<RankedBook> search(String text, int limit) {
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be positive");
        }
        return fuser.fuse(query(text, limit * overFetchFactor), limit);
    }

    public Set<String> listIndexedDocumentKeys() {
        ensureOpen();
        Set<String> keys = new LinkedHashSet<>();
        index.chunks().forEach(chunk -> keys.add(chunk.documentId()));
        return keys;
    }

    /** Indexed books keyed by filename, in indexing order. */
    public Map<String, BookMetadata> indexedBooks() {
        ensureOpen();
        Map<String, BookMetadata> books = new LinkedHashMap<>();
        for (StoredChunk chunk : index.chunks()) {
            books.putIfAbsent(chunk.metadata().filename(), chunk.metadata());
        }
        return books;
    }

    public StoreStats stats() {
        ensureOpen();
        return new StoreStats(index.size(), listIndexedDocumentKeys().size(), storeDir);
    }

    public void reset() throws IOException {
        ensureOpen();
        index.clear();
        index.save();
        log.info("Store {} reset", storeDir);
    }

    public Path storeDir() {
        return storeDir;
    }

    @Override
    public void close() throws LockException {
        if (closed) {
            return;
        }
        closed = true;
        storeLock.release(token);
        log.debug("Closed store {}", storeDir);
    }

    private void ensureOpen() {
        if (closed) {
            throw new IllegalStateException("Store " + storeDir + " is closed");
        }
    }
}
