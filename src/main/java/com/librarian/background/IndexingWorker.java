package com.librarian.background;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.function.BooleanSupplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.librarian.ingest.BookIndexer;
import com.librarian.ingest.IndexingStats;
import com.librarian.lock.LockException;
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

/**
 * Entry point of the isolated indexing process started by {@link IndexingSupervisor}.
 * <p>
 * Reports progress as {@link StatusEvent} lines on stdout and logs to stderr. The worker, not its supervisor, holds
 * the store lock, for the whole walk. A termination request stops the walk at the next book boundary and the
 * final event is then {@code INTERRUPTED}.
 */
@Command(
        name = "librarian-indexer",
        description = "Indexes a book file or directory into a store, reporting status on stdout.")
public class IndexingWorker implements Callable<Integer> {
    private static final Logger log = LoggerFactory.getLogger(IndexingWorker.class);

    @Parameters(index = "0", description = "Book file or directory to index")
    Path target;

    @Parameters(index = "1", description = "Store directory")
    Path storeDir;

    @Option(names = "--config", description = "Path to YAML config file")
    Path configPath;

    @Option(names = "--grace-ms", description = "How long a stop request waits for the current book", defaultValue = "2000")
    long graceMs;

    private final StatusChannel.Writer channel;
    private final Object lockWaitMonitor = new Object();
    private Thread lockWaiter;
    private volatile ShutdownSignal signal;

    public IndexingWorker(StatusChannel.Writer channel) {
        this.channel = channel;
    }

    public static void main(String[] args) {
        IndexingWorker worker = new IndexingWorker(new StatusChannel.Writer(System.out));
        int exitCode = new CommandLine(worker).execute(args);
        ShutdownSignal installed = worker.signal;
        if (installed == null || !installed.isRequested()) {
            System.exit(exitCode);
        }
    }

    @Override
    public Integer call() {
        channel.emit(StatusEvent.starting("Initializing indexer..."));
        LibrarianConfig config;
        try {
            config = LibrarianConfig.load(configPath);
        } catch (IOException e) {
            channel.emit(StatusEvent.error("Indexing failed: unreadable config " + configPath, e.getMessage()));
            return 1;
        }
        EmbeddingService embeddingService = EmbeddingServices.fromEnvironment(
                new OkHttpClient(), config.getEmbedding().getDimension());

        try (ShutdownSignal installed = ShutdownSignal.install(Duration.ofMillis(graceMs), this::interruptLockWait)) {
            signal = installed;
            return run(config, embeddingService, installed);
        }
    }

    int run(LibrarianConfig config, EmbeddingService embeddingService, BooleanSupplier stopRequested) {
        BookStore store;
        synchronized (lockWaitMonitor) {
            lockWaiter = Thread.currentThread();
        }
        try {
            store = BookStore.open(storeDir, config, embeddingService, config.getStore().lockTimeout(), lockWaitEvents());
        } catch (LockException e) {
            if (stopRequested.getAsBoolean()) {
                channel.emit(StatusEvent.interrupted(IndexingStats.empty()));
                return 0;
            }
            channel.emit(StatusEvent.error("Indexing failed: could not acquire store lock", e.getMessage()));
            return 1;
        } catch (IOException | RuntimeException e) {
            channel.emit(StatusEvent.error("Indexing failed: unable to open store " + storeDir, e.getMessage()));
            return 1;
        } finally {
            synchronized (lockWaitMonitor) {
                lockWaiter = null;
                // a stop request that raced the acquisition must not leak into file I/O
                Thread.interrupted();
            }
        }

        try (BookStore session = store) {
            BookIndexer indexer = new BookIndexer(session);
            IndexingStats stats;
            if (Files.isDirectory(target)) {
                channel.emit(StatusEvent.running("Indexing directory: " + target));
                stats = indexer.indexDirectory(target, stopRequested, (book, position, total) -> channel.emit(
                        StatusEvent.running("Processing: %s (%d/%d)".formatted(book.getFileName(), position, total))));
            } else {
                channel.emit(StatusEvent.running("Indexing file: " + target));
                stats = indexFile(indexer, stopRequested);
            }
            channel.emit(stats.interrupted() ? StatusEvent.interrupted(stats) : StatusEvent.completed(stats));
            return 0;
        } catch (IOException | RuntimeException e) {
            log.error("Indexing of {} failed", target, e);
            channel.emit(StatusEvent.error("Indexing failed: " + e.getMessage(), e.toString()));
            return 1;
        }
    }

    private IndexingStats indexFile(BookIndexer indexer, BooleanSupplier stopRequested) throws IOException {
        if (!Files.exists(target)) {
            throw new NoSuchFileException(target.toString());
        }
        if (stopRequested.getAsBoolean()) {
            return new IndexingStats(0, 0, 0, true);
        }
        boolean indexed = indexer.indexFile(target);
        return new IndexingStats(indexed ? 1 : 0, indexed ? 0 : 1, 0, false);
    }

    private LockWaitListener lockWaitEvents() {
        return new LockWaitListener() {
            @Override
            public void onWaiting(Path lockFile) {
                log.info("Waiting for store lock {}", lockFile);
                channel.emit(StatusEvent.running("Waiting for store lock (another process is using the store)..."));
            }

            @Override
            public void onAcquiredAfterWait(Path lockFile, Duration waited) {
                channel.emit(StatusEvent.running("Store lock acquired after %d ms".formatted(waited.toMillis())));
            }
        };
    }

    private void interruptLockWait() {
        synchronized (lockWaitMonitor) {
            if (lockWaiter != null) {
                lockWaiter.interrupt();
            }
        }
    }
}
