package com.librarian.store;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.librarian.ingest.Document;
import com.librarian.lock.LockTimeoutException;
import com.librarian.lock.LockWaitListener;
import com.librarian.runtime.LibrarianConfig;
import com.librarian.search.RankedBook;

class BookStoreTest {

    @TempDir
    Path tempDir;

    private final LibrarianConfig config = new LibrarianConfig();
    private final EmbeddingService embedding = new LocalEmbeddingService(128);

    @Test
    void shouldPersistBooksAcrossSessions() throws Exception {
        Path store = tempDir.resolve("store");
        Document dragons = book("dragons.fb2", "Dragon Lore", "Dragons breathe fire over the northern mountains. ");
        Document gardens = book("gardens.fb2", "Garden Care", "Roses and tulips need water and sunlight. ");

        try (BookStore session = BookStore.open(store, config, embedding)) {
            assertTrue(session.upsert(dragons));
            assertTrue(session.upsert(gardens));
        }
        assertTrue(Files.exists(store.resolve(BookStore.INDEX_FILE_NAME)));

        try (BookStore session = BookStore.open(store, config, embedding)) {
            StoreStats stats = session.stats();
            assertEquals(2, stats.bookCount());
            assertTrue(stats.chunkCount() >= 2);
            assertEquals(store.toAbsolutePath().normalize(), stats.storePath());
            assertEquals(Set.of(dragons.id(), gardens.id()), session.listIndexedDocumentKeys());

            Map<String, BookMetadata> books = session.indexedBooks();
            assertEquals(List.of(dragons.filename(), gardens.filename()), List.copyOf(books.keySet()));
            assertEquals("Dragon Lore", books.get(dragons.filename()).title());
        }
    }

    @Test
    void shouldNotDuplicateAlreadyIndexedBook() throws Exception {
        Document dragons = book("dragons.fb2", "Dragon Lore", "Dragons breathe fire. ".repeat(150));

        try (BookStore session = BookStore.open(tempDir.resolve("store"), config, embedding)) {
            assertTrue(session.upsert(dragons));
            int chunks = session.stats().chunkCount();
            assertTrue(chunks > 1);

            assertTrue(session.upsert(dragons));
            assertEquals(chunks, session.stats().chunkCount());
        }
    }

    @Test
    void shouldRejectBookWithoutText() throws Exception {
        try (BookStore session = BookStore.open(tempDir.resolve("store"), config, embedding)) {
            assertFalse(session.upsert(Document.of(tempDir.resolve("blank.pdf"), "Blank", null, "")));
            assertTrue(session.stats().isEmpty());
        }
    }

    @Test
    void shouldRankMostRelevantBookFirst() throws Exception {
        try (BookStore session = BookStore.open(tempDir.resolve("store"), config, embedding)) {
            session.upsert(book("dragons.fb2", "Dragon Lore", "Dragons breathe fire over the mountains. ".repeat(40)));
            session.upsert(book("gardens.fb2", "Garden Care", "Roses and tulips need water and sunlight. ".repeat(40)));
            session.upsert(book("sea.fb2", "Sea Stories", "Sailors cross the stormy ocean at night. ".repeat(40)));

            List<RankedBook> results = session.search("roses tulips water sunlight", 2);

            assertEquals(2, results.size());
            assertEquals("Garden Care", results.get(0).title());
            assertTrue(results.get(0).relevanceScore() >= results.get(1).relevanceScore());
            assertTrue(results.get(0).allMatchedChunks().size() >= 1);
            assertTrue(results.stream().map(RankedBook::documentId).distinct().count() == results.size());
        }
    }

    @Test
    void shouldReturnNothingForBlankQuery() throws Exception {
        try (BookStore session = BookStore.open(tempDir.resolve("store"), config, embedding)) {
            session.upsert(book("dragons.fb2", "Dragon Lore", "Dragons breathe fire."));

            assertTrue(session.search("   ", 5).isEmpty());
            assertThrows(IllegalArgumentException.class, () -> session.search("dragons", 0));
        }
    }

    @Test
    void shouldClearEverythingOnReset() throws Exception {
        Path store = tempDir.resolve("store");
        try (BookStore session = BookStore.open(store, config, embedding)) {
            session.upsert(book("dragons.fb2", "Dragon Lore", "Dragons breathe fire."));
            session.reset();
            assertTrue(session.stats().isEmpty());
        }
        try (BookStore session = BookStore.open(store, config, embedding)) {
            assertTrue(session.stats().isEmpty());
        }
    }

    @Test
    void shouldHoldStoreLockUntilClosed() throws Exception {
        Path store = tempDir.resolve("store");
        LockWaitListener quiet = lockFile -> {
        };

        BookStore first = BookStore.open(store, config, embedding);
        assertThrows(LockTimeoutException.class,
                () -> BookStore.open(store, config, embedding, Duration.ofMillis(100), quiet));

        first.close();
        first.close();
        try (BookStore second = BookStore.open(store, config, embedding, Duration.ofMillis(100), quiet)) {
            assertTrue(second.stats().isEmpty());
        }
        assertThrows(IllegalStateException.class, first::stats);
    }

    @Test
    void shouldReleaseLockWhenIndexFileIsCorrupt() throws Exception {
        Path store = tempDir.resolve("store");
        Files.createDirectories(store);
        Files.writeString(store.resolve(BookStore.INDEX_FILE_NAME), "{ not json");

        assertThrows(IOException.class, () -> BookStore.open(store, config, embedding));

        Files.delete(store.resolve(BookStore.INDEX_FILE_NAME));
        try (BookStore session = BookStore.open(store, config, embedding, Duration.ofMillis(100), lockFile -> {
        })) {
            assertTrue(session.stats().isEmpty());
        }
    }

    @Test
    void shouldReembedStoreOpenedWithAnotherEmbedding() throws Exception {
        Path store = tempDir.resolve("store");
        try (BookStore session = BookStore.open(store, config, new LocalEmbeddingService(64))) {
            session.upsert(book("dragons.fb2", "Dragon Lore", "Dragons breathe fire over the mountains."));
        }

        EmbeddingService wider = new LocalEmbeddingService(256);
        try (BookStore session = BookStore.open(store, config, wider)) {
            session.upsert(book("gardens.fb2", "Garden Care", "Roses and tulips need water and sunlight."));

            List<RankedBook> results = session.search("dragons breathe fire", 2);
            assertEquals("Dragon Lore", results.get(0).title());
            assertTrue(results.get(0).relevanceScore() > 0.3, results.toString());
        }

        LocalJsonVectorIndex onDisk = LocalJsonVectorIndex.load(store.resolve(BookStore.INDEX_FILE_NAME));
        assertFalse(onDisk.requiresReembedding(wider.version()));
        assertTrue(onDisk.chunks().stream().allMatch(chunk -> chunk.embedding().length == 256));
    }

    @Test
    void shouldLeaveStoreUntouchedWhenReembeddingFails() throws Exception {
        Path store = tempDir.resolve("store");
        try (BookStore session = BookStore.open(store, config, embedding)) {
            session.upsert(book("dragons.fb2", "Dragon Lore", "Dragons breathe fire."));
        }
        String before = Files.readString(store.resolve(BookStore.INDEX_FILE_NAME));
        EmbeddingService unavailable = new EmbeddingService() {
            @Override
            public float[] embed(String text) {
                throw new EmbeddingException("provider down");
            }

            @Override
            public int dimension() {
                return 128;
            }

            @Override
            public String version() {
                return "remote-v1";
            }
        };

        assertThrows(EmbeddingException.class, () -> BookStore.open(store, config, unavailable));

        assertEquals(before, Files.readString(store.resolve(BookStore.INDEX_FILE_NAME)));
        try (BookStore session = BookStore.open(store, config, embedding, Duration.ofMillis(100), lockFile -> {
        })) {
            assertEquals(1, session.stats().bookCount());
        }
    }

    private Document book(String fileName, String title, String text) {
        return Document.of(tempDir.resolve("books").resolve(fileName), title, "Some Author", text.strip());
    }
}
