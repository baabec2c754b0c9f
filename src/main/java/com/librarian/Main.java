package com.librarian;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.librarian.background.IndexingSupervisor;
import com.librarian.background.ShutdownSignal;
import com.librarian.ingest.BookIndexer;
import com.librarian.ingest.IndexingStats;
import com.librarian.lock.LockTimeoutException;
import com.librarian.lock.LockWaitListener;
import com.librarian.runtime.LibrarianConfig;
import com.librarian.store.BookStore;
import com.librarian.store.EmbeddingService;
import com.librarian.store.EmbeddingServices;

import okhttp3.OkHttpClient;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

@Command(
        name = "librarian",
        mixinStandardHelpOptions = true,
        version = "librarian 0.1.0",
        description = "Personal book library with natural-language search.")
public class Main implements Callable<Integer> {
    static final int OK = 0;
    static final int USAGE = 2;
    static final int STORE_BUSY = 3;
    static final int FAILURE = 4;

    private static final Logger log = LoggerFactory.getLogger(Main.class);

    @Option(names = { "-c", "--config" }, description = "Path to YAML config file", defaultValue = "librarian.yml")
    Path configPath;

    @Option(names = "--mode", description = "Execution mode: ${COMPLETION-CANDIDATES}", defaultValue = "interactive")
    Mode mode;

    @Option(names = { "-d", "--store" }, description = "Store directory (default: store.path from config)")
    Path storePath;

    @Option(names = "--query", description = "Query text used in search mode")
    String query;

    @Option(names = "--limit", description = "Maximum number of books returned (default: search.defaultLimit from config)")
    Integer limit;

    @Parameters(index = "0", arity = "0..1", description = "Book file or directory to index")
    Path path;

    private final BufferedReader in;
    private final PrintStream out;
    private final OkHttpClient httpClient = new OkHttpClient();

    enum Mode {
        interactive,
        index,
        search,
        stats,
        books,
        reset
    }

    public Main() {
        this(new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8)), System.out);
    }

    Main(BufferedReader in, PrintStream out) {
        this.in = in;
        this.out = out;
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new Main()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() {
        LibrarianConfig config;
        try {
            config = LibrarianConfig.load(configPath);
        } catch (IOException e) {
            log.error("Unable to read config file {}: {}", configPath, e.getMessage());
            return USAGE;
        }
        Path storeDir = storePath != null ? storePath : Path.of(config.getStore().getPath());
        EmbeddingService embeddingService = EmbeddingServices.fromEnvironment(
                httpClient, config.getEmbedding().getDimension());

        log.info("Starting librarian in {} mode", mode);
        log.debug("Using config file {} and store {}", configPath, storeDir);

        try {
            return switch (mode) {
                case interactive -> runInteractive(config, storeDir, embeddingService);
                case index -> runIndex(config, storeDir, embeddingService);
                case search -> runSearch(config, storeDir, embeddingService);
                case stats -> withStore(config, storeDir, embeddingService, store -> {
                    LibrarianShell.printStats(out, store.stats());
                    return OK;
                });
                case books -> withStore(config, storeDir, embeddingService, store -> {
                    LibrarianShell.printBooks(out, store.indexedBooks());
                    return OK;
                });
                case reset -> withStore(config, storeDir, embeddingService, store -> {
                    store.reset();
                    out.println("Store reset: " + store.storeDir());
                    return OK;
                });
            };
        } catch (LockTimeoutException e) {
            log.error("Store {} is busy: {}", storeDir, e.getMessage());
            return STORE_BUSY;
        } catch (IOException | RuntimeException e) {
            log.error("Librarian failed in {} mode", mode, e);
            return FAILURE;
        }
    }

    private int runInteractive(LibrarianConfig config, Path storeDir, EmbeddingService embeddingService)
            throws IOException {
        if (path != null) {
            int indexed = runIndex(config, storeDir, embeddingService);
            if (indexed != OK) {
                return indexed;
            }
        }
        Path workerConfig = Files.exists(configPath) ? configPath : null;
        try (IndexingSupervisor supervisor = new IndexingSupervisor(config.getBackground().stopGrace(), workerConfig)) {
            new LibrarianShell(in, out, config, storeDir, supervisor, embeddingService).run();
        }
        return OK;
    }

    private int runIndex(LibrarianConfig config, Path storeDir, EmbeddingService embeddingService)
            throws IOException {
        if (path == null) {
            log.error("A book file or directory is required in index mode");
            return USAGE;
        }
        if (!Files.exists(path)) {
            log.error("Path {} does not exist", path);
            return USAGE;
        }
        try (ShutdownSignal stop = ShutdownSignal.install(config.getBackground().stopGrace())) {
            return withStore(config, storeDir, embeddingService, store -> {
                BookIndexer indexer = new BookIndexer(store);
                if (!Files.isDirectory(path)) {
                    if (!indexer.indexFile(path)) {
                        out.println("Could not index " + path);
                        return FAILURE;
                    }
                    out.println("Indexed " + path);
                    return OK;
                }
                IndexingStats stats = indexer.indexDirectory(path, stop,
                        (book, position, total) -> out.printf("Processing: %s (%d/%d)%n", book.getFileName(), position, total));
                LibrarianShell.printIndexingStats(out, stats);
                return OK;
            });
        }
    }

    private int runSearch(LibrarianConfig config, Path storeDir, EmbeddingService embeddingService)
            throws IOException {
        if (query == null || query.isBlank()) {
            log.error("--query is required in search mode");
            return USAGE;
        }
        int resultLimit = limit != null ? limit : config.getSearch().getDefaultLimit();
        if (resultLimit <= 0) {
            log.error("--limit must be positive");
            return USAGE;
        }
        return withStore(config, storeDir, embeddingService, store -> {
            if (store.stats().isEmpty()) {
                out.println("The library is empty. Index books first with --mode index <path>.");
                return OK;
            }
            LibrarianShell.printResults(out, store.search(query, resultLimit));
            return OK;
        });
    }

    private static int withStore(LibrarianConfig config,
            Path storeDir,
            EmbeddingService embeddingService,
            StoreCommand command) throws IOException {
        try (BookStore store = BookStore.open(storeDir, config, embeddingService,
                config.getStore().lockTimeout(), LockWaitListener.logging())) {
            return command.run(store);
        }
    }

    @FunctionalInterface
    private interface StoreCommand {
        int run(BookStore store) throws IOException;
    }
}
