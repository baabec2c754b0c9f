package com.librarian.background;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.librarian.BookFixtures;
import com.librarian.ingest.IndexingStats;
import com.librarian.lock.LockToken;
import com.librarian.lock.StoreLock;
import com.librarian.runtime.LibrarianConfig;
import com.librarian.store.BookStore;
import com.librarian.store.LocalEmbeddingService;

import picocli.CommandLine;

class IndexingWorkerTest {

    @TempDir
    Path tempDir;

    private final ByteArrayOutputStream stdout = new ByteArrayOutputStream();
    private final IndexingWorker worker = new IndexingWorker(
            new StatusChannel.Writer(new PrintStream(stdout, true, StandardCharsets.UTF_8)));

    @Test
    void shouldReportProgressAndFinalCountsForDirectory() throws Exception {
        Path books = tempDir.resolve("books");
        BookFixtures.fb2(books, "a.fb2", "Alpha", "Ann", "Author", "Alpha text.");
        BookFixtures.fb2(books, "b.fb2", "Beta", "Bob", "Writer", "Beta text.");
        BookFixtures.malformedPdf(books, "c.pdf");
        worker.target = books;
        worker.storeDir = tempDir.resolve("store");

        int exitCode = worker.run(new LibrarianConfig(), new LocalEmbeddingService(64), () -> false);

        List<StatusEvent> events = events();
        assertEquals(0, exitCode);
        assertEquals("Indexing directory: " + books, events.get(0).message());
        assertEquals("Processing: a.fb2 (1/3)", events.get(1).message());
        assertEquals("Processing: c.pdf (3/3)", events.get(3).message());
        StatusEvent last = events.get(events.size() - 1);
        assertEquals(StatusPhase.COMPLETED, last.phase());
        assertEquals(new IndexingStats(2, 1, 0, false), last.stats());

        try (BookStore store = BookStore.open(worker.storeDir, new LibrarianConfig(), new LocalEmbeddingService(64))) {
            assertEquals(2, store.stats().bookCount());
        }
    }

    @Test
    void shouldReportInterruptedWhenStopIsRequestedBeforeFirstBook() throws Exception {
        Path books = tempDir.resolve("books");
        BookFixtures.fb2(books, "a.fb2", "Alpha", "Ann", "Author", "Alpha text.");
        worker.target = books;
        worker.storeDir = tempDir.resolve("store");

        worker.run(new LibrarianConfig(), new LocalEmbeddingService(64), () -> true);

        StatusEvent last = lastEvent();
        assertEquals(StatusPhase.INTERRUPTED, last.phase());
        assertEquals(new IndexingStats(0, 0, 0, true), last.stats());
    }

    @Test
    void shouldIndexSingleFile() throws Exception {
        worker.target = BookFixtures.fb2(tempDir, "a.fb2", "Alpha", "Ann", "Author", "Alpha text.");
        worker.storeDir = tempDir.resolve("store");

        worker.run(new LibrarianConfig(), new LocalEmbeddingService(64), () -> false);

        assertEquals("Indexing file: " + worker.target, events().get(0).message());
        assertEquals(new IndexingStats(1, 0, 0, false), lastEvent().stats());
    }

    @Test
    void shouldReportErrorForMissingTarget() throws Exception {
        worker.target = tempDir.resolve("missing.fb2");
        worker.storeDir = tempDir.resolve("store");

        int exitCode = worker.run(new LibrarianConfig(), new LocalEmbeddingService(64), () -> false);

        assertEquals(1, exitCode);
        StatusEvent last = lastEvent();
        assertEquals(StatusPhase.ERROR, last.phase());
        assertTrue(last.error().contains("missing.fb2"), last.error());
    }

    @Test
    void shouldReportInterruptedWhenStoppedWhileWaitingForLock() throws Exception {
        Path store = tempDir.resolve("store");
        worker.target = BookFixtures.fb2(tempDir, "a.fb2", "Alpha", "Ann", "Author", "Alpha text.");
        worker.storeDir = store;
        LibrarianConfig config = new LibrarianConfig();
        config.getStore().setLockPollIntervalMs(20);
        AtomicBoolean stop = new AtomicBoolean();

        LockToken held = new StoreLock(store).acquire(null);
        try {
            AtomicReference<Thread> runner = new AtomicReference<>();
            CompletableFuture<Integer> result = CompletableFuture.supplyAsync(() -> {
                runner.set(Thread.currentThread());
                return worker.run(config, new LocalEmbeddingService(64), stop::get);
            });
            awaitMessage("Waiting for store lock");

            stop.set(true);
            runner.get().interrupt();

            assertEquals(0, result.get(5, TimeUnit.SECONDS));
        } finally {
            held.close();
        }
        StatusEvent last = lastEvent();
        assertEquals(StatusPhase.INTERRUPTED, last.phase());
        assertEquals(IndexingStats.empty(), last.stats());
    }

    @Test
    void shouldParseCommandLineAndEmitStartingEvent() throws Exception {
        Path book = BookFixtures.fb2(tempDir, "a.fb2", "Alpha", "Ann", "Author", "Alpha text.");
        Path store = tempDir.resolve("store");

        int exitCode = new CommandLine(worker).execute(
                "--grace-ms", "100",
                "--config", tempDir.resolve("absent.yml").toString(),
                book.toString(),
                store.toString());

        assertEquals(0, exitCode);
        assertEquals(StatusPhase.STARTING, events().get(0).phase());
        assertEquals(StatusPhase.COMPLETED, lastEvent().phase());
        assertEquals(100L, worker.graceMs);
    }

    private void awaitMessage(String fragment) throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(10);
        while (System.nanoTime() < deadline) {
            if (events().stream().anyMatch(event -> event.message().contains(fragment))) {
                return;
            }
            Thread.sleep(10);
        }
        throw new AssertionError("no event containing '" + fragment + "' in " + events());
    }

    private List<StatusEvent> events() {
        String[] lines = stdout.toString(StandardCharsets.UTF_8).split("\\R");
        return Arrays.stream(lines)
                .map(StatusChannel::decode)
                .flatMap(Optional::stream)
                .toList();
    }

    private StatusEvent lastEvent() {
        List<StatusEvent> events = events();
        return events.get(events.size() - 1);
    }
}
