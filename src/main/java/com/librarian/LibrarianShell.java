package com.librarian;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.librarian.background.IndexingSupervisor;
import com.librarian.background.StatusEvent;
import com.librarian.ingest.BookIndexer;
import com.librarian.ingest.IndexingStats;
import com.librarian.lock.LockTimeoutException;
import com.librarian.lock.LockWaitListener;
import com.librarian.runtime.LibrarianConfig;
import com.librarian.search.RankedBook;
import com.librarian.store.BookMetadata;
import com.librarian.store.BookStore;
import com.librarian.store.EmbeddingService;
import com.librarian.store.StoreStats;

/**
 * Interactive search loop. Free text is a query; slash commands manage the library.
 * <p>
 * Every command opens the store for its own duration only, bounded by the interactive lock timeout, so a
 * background indexer is never blocked by an idle prompt.
 */
public class LibrarianShell {
    static final String HELP = """
            Commands:
              <text>              search the library
              /index <path>       index a book file or directory now
              /index-bg <path>    index a book file or directory in the background
              /index-status       show background indexing progress
              /index-stop         stop background indexing
              /stats              show store statistics
              /books              list indexed books
              /help               show this help
              /quit, /exit        leave""";

    private static final Logger log = LoggerFactory.getLogger(LibrarianShell.class);

    private final BufferedReader in;
    private final PrintStream out;
    private final LibrarianConfig config;
    private final Path storeDir;
    private final IndexingSupervisor supervisor;
    private final EmbeddingService embeddingService;
    private StatusEvent lastBackgroundEvent;

    public LibrarianShell(BufferedReader in,
            PrintStream out,
            LibrarianConfig config,
            Path storeDir,
            IndexingSupervisor supervisor,
            EmbeddingService embeddingService) {
        this.in = in;
        this.out = out;
        this.config = config;
        this.storeDir = storeDir;
        this.supervisor = supervisor;
        this.embeddingService = embeddingService;
    }

    public void run() throws IOException {
        out.println("Librarian ready. Type a question to search, /help for commands.");
        try {
            while (true) {
                reportBackgroundEvents();
                out.print("library> ");
                out.flush();
                String line = in.readLine();
                if (line == null) {
                    break;
                }
                String input = line.trim();
                if (input.isEmpty()) {
                    continue;
                }
                if ("/quit".equals(input) || "/exit".equals(input)) {
                    break;
                }
                handle(input);
            }
        } finally {
            if (supervisor.isRunning()) {
                out.println("Stopping background indexing...");
            }
            supervisor.stop();
        }
        out.println("Goodbye.");
    }

    void handle(String input) {
        String command = input;
        String argument = "";
        if (input.startsWith("/")) {
            int space = input.indexOf(' ');
            if (space > 0) {
                command = input.substring(0, space);
                argument = input.substring(space + 1).trim();
            }
        }
        try {
            switch (command) {
                case "/help" -> out.println(HELP);
                case "/stats" -> withStore(store -> printStats(out, store.stats()));
                case "/books" -> withStore(store -> printBooks(out, store.indexedBooks()));
                case "/index" -> indexNow(argument);
                case "/index-bg" -> indexInBackground(argument);
                case "/index-status" -> printBackgroundStatus();
                case "/index-stop" -> stopBackground();
                default -> {
                    if (command.startsWith("/")) {
                        out.println("Unknown command " + command + ". Type /help for commands.");
                    } else {
                        search(input);
                    }
                }
            }
        } catch (LockTimeoutException e) {
            out.println("Store is busy (another process is using it, e.g. background indexing). Try again shortly.");
        } catch (IOException | RuntimeException e) {
            log.debug("Command {} failed", command, e);
            out.println("Error: " + e.getMessage());
        }
    }

    private void search(String query) throws IOException {
        withStore(store -> {
            if (store.stats().isEmpty()) {
                out.println("The library is empty. Use /index <path> to add books.");
                return;
            }
            printResults(out, store.search(query, config.getSearch().getDefaultLimit()));
        });
    }

    private void indexNow(String argument) throws IOException {
        if (argument.isEmpty()) {
            out.println("Usage: /index <path>");
            return;
        }
        Path target = Path.of(argument);
        if (!Files.exists(target)) {
            out.println("Path not found: " + target);
            return;
        }
        withStore(store -> {
            BookIndexer indexer = new BookIndexer(store);
            if (Files.isDirectory(target)) {
                printIndexingStats(out, indexer.indexDirectory(target, () -> false,
                        (book, position, total) -> out.printf("Processing: %s (%d/%d)%n", book.getFileName(), position, total)));
            } else if (indexer.indexFile(target)) {
                out.println("Indexed " + target.getFileName());
            } else {
                out.println("Could not index " + target.getFileName());
            }
        });
    }

    private void indexInBackground(String argument) throws IOException {
        if (argument.isEmpty()) {
            out.println("Usage: /index-bg <path>");
            return;
        }
        Path target = Path.of(argument);
        if (!Files.exists(target)) {
            out.println("Path not found: " + target);
            return;
        }
        if (supervisor.startIndexing(target, storeDir)) {
            lastBackgroundEvent = null;
            out.println("Background indexing started for " + target + ". Use /index-status to follow it.");
        } else {
            out.println("Background indexing is already running. Use /index-stop to stop it first.");
        }
    }

    private void printBackgroundStatus() {
        reportBackgroundEvents();
        if (supervisor.isRunning()) {
            String elapsed = supervisor.elapsedTime().map(LibrarianShell::formatElapsed).orElse("0s");
            out.println("Background indexing running for " + elapsed);
            if (lastBackgroundEvent != null) {
                out.println("  " + lastBackgroundEvent.message());
            }
        } else if (lastBackgroundEvent != null) {
            out.println("No background indexing running. Last status: " + lastBackgroundEvent.message());
        } else {
            out.println("No background indexing running.");
        }
    }

    private void stopBackground() {
        if (!supervisor.isRunning()) {
            out.println("No background indexing running.");
            return;
        }
        supervisor.stop();
        out.println("Background indexing stopped.");
        reportBackgroundEvents();
    }

    /** Drains pending worker events, printing the terminal ones. */
    void reportBackgroundEvents() {
        for (StatusEvent event : supervisor.drainAllStatus()) {
            lastBackgroundEvent = event;
            if (!event.isTerminal()) {
                continue;
            }
            switch (event.phase()) {
                case COMPLETED -> out.println("[background] " + event.message() + " " + describe(event.stats()));
                case INTERRUPTED -> out.println("[background] Indexing interrupted. " + describe(event.stats()));
                case ERROR -> out.println("[background] " + event.message()
                        + (event.error() == null ? "" : " (" + event.error() + ")"));
                default -> {
                }
            }
        }
    }

    private void withStore(StoreAction action) throws IOException {
        try (BookStore store = BookStore.open(storeDir, config, embeddingService,
                config.getStore().interactiveLockTimeout(), LockWaitListener.logging())) {
            action.run(store);
        }
    }

    @FunctionalInterface
    private interface StoreAction {
        void run(BookStore store) throws IOException;
    }

    static void printResults(PrintStream out, List<RankedBook> results) {
        if (results.isEmpty()) {
            out.println("No matching books found.");
            return;
        }
        for (int i = 0; i < results.size(); i++) {
            RankedBook book = results.get(i);
            out.printf(Locale.ROOT, "%d. %s by %s [%s] relevance %.4f%n",
                    i + 1, book.title(), book.author(), book.format(), book.relevanceScore());
            out.println("   " + book.filename());
            out.println("   " + book.bestMatchExcerpt());
            if (book.allMatchedChunks().size() > 1) {
                out.println("   (" + book.allMatchedChunks().size() + " matching passages)");
            }
        }
    }

    static void printStats(PrintStream out, StoreStats stats) {
        out.println("Store: " + stats.storePath());
        out.println("Books: " + stats.bookCount());
        out.println("Chunks: " + stats.chunkCount());
    }

    static void printBooks(PrintStream out, Map<String, BookMetadata> books) {
        if (books.isEmpty()) {
            out.println("The library is empty. Use /index <path> to add books.");
            return;
        }
        books.values().forEach(book -> out.printf("- %s by %s (%s) %s%n",
                book.title(), book.author(), book.format(), book.filename()));
    }

    static void printIndexingStats(PrintStream out, IndexingStats stats) {
        out.println((stats.interrupted() ? "Indexing interrupted. " : "Indexing finished. ") + describe(stats));
    }

    static String describe(IndexingStats stats) {
        if (stats == null) {
            return "";
        }
        return "Succeeded: %d, failed: %d".formatted(stats.success(), stats.failed());
    }

    static String formatElapsed(Duration elapsed) {
        long seconds = elapsed.getSeconds();
        if (seconds < 60) {
            return seconds + "s";
        }
        return "%dm %ds".formatted(seconds / 60, seconds % 60);
    }
}
