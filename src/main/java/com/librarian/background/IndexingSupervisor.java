package com.librarian.background;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.lang.ProcessBuilder.Redirect;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs at most one indexing job at a time in a separate JVM and buffers its status events for the owner to poll.
 * <p>
 * The worker shares no memory with the owner: it receives its job on the command line, writes {@link StatusEvent}
 * lines to stdout and takes the store lock itself. A pump thread moves decoded events into a queue that is
 * replaced on every {@link #startIndexing}, so events of an earlier job never leak into a later one.
 */
public class IndexingSupervisor implements AutoCloseable {
    public static final String WORKER_LOG_FILE_NAME = "indexer.log";

    private static final Logger log = LoggerFactory.getLogger(IndexingSupervisor.class);
    private static final Duration PUMP_DRAIN_TIMEOUT = Duration.ofSeconds(1);

    private final Duration stopGrace;
    private final WorkerStarter workerStarter;

    private Process process;
    private Instant startedAt;
    private BlockingQueue<StatusEvent> events = new LinkedBlockingQueue<>();
    private Thread pump;

    public IndexingSupervisor(Duration stopGrace, Path configPath) {
        this(stopGrace, new JvmWorkerStarter(configPath, stopGrace));
    }

    IndexingSupervisor(Duration stopGrace, WorkerStarter workerStarter) {
        this.stopGrace = stopGrace;
        this.workerStarter = workerStarter;
    }

    /**
     * Starts indexing {@code target} into the store at {@code storeDir}.
     *
     * @return {@code false} without starting anything if a job is still running
     * @throws IOException if the worker process cannot be launched
     */
    public synchronized boolean startIndexing(Path target, Path storeDir) throws IOException {
        if (isRunning()) {
            log.info("Background indexing already running, not starting {}", target);
            return false;
        }
        BlockingQueue<StatusEvent> channel = new LinkedBlockingQueue<>();
        Process started = workerStarter.start(target.toAbsolutePath().normalize(), storeDir.toAbsolutePath().normalize());
        closeWorkerInput(started);
        events = channel;
        process = started;
        startedAt = Instant.now();
        pump = startPump(started.getInputStream(), channel);
        log.info("Started background indexing of {} into {}", target, storeDir);
        return true;
    }

    public synchronized boolean isRunning() {
        return process != null && process.isAlive();
    }

    /**
     * Next buffered event, oldest first. Does not wait while the worker is alive; once it has exited, waits briefly
     * for the channel to reach end-of-stream so trailing events are not missed.
     */
    public synchronized Optional<StatusEvent> pollStatus() {
        StatusEvent next = events.poll();
        if (next == null && awaitChannelEndIfWorkerExited()) {
            next = events.poll();
        }
        return Optional.ofNullable(next);
    }

    public synchronized List<StatusEvent> drainAllStatus() {
        List<StatusEvent> drained = new ArrayList<>();
        Optional<StatusEvent> next = pollStatus();
        while (next.isPresent()) {
            drained.add(next.get());
            next = pollStatus();
        }
        return drained;
    }

    public synchronized Optional<Duration> elapsedTime() {
        if (startedAt == null) {
            return Optional.empty();
        }
        return Optional.of(Duration.between(startedAt, Instant.now()));
    }

    /**
     * Asks the worker to stop, waits up to the grace period, then kills it. Events the worker writes while shutting
     * down, its final {@link StatusPhase#INTERRUPTED} summary included, stay available to {@link #pollStatus()}.
     */
    public synchronized void stop() {
        Process current = process;
        if (current != null && current.isAlive()) {
            log.info("Stopping background indexing");
            // signal through the handle: Process.destroy would also close our end of the worker's stdout
            ProcessHandle worker = current.toHandle();
            worker.destroy();
            try {
                if (!current.waitFor(stopGrace.toMillis(), TimeUnit.MILLISECONDS)) {
                    log.warn("Indexing worker still alive {} ms after stop request, killing it", stopGrace.toMillis());
                    worker.destroyForcibly();
                    current.waitFor(stopGrace.toMillis(), TimeUnit.MILLISECONDS);
                }
            } catch (InterruptedException e) {
                worker.destroyForcibly();
                Thread.currentThread().interrupt();
            }
        }
        if (current != null) {
            finishChannel(current);
        }
        process = null;
        startedAt = null;
    }

    @Override
    public void close() {
        stop();
    }

    private boolean awaitChannelEndIfWorkerExited() {
        Thread current = pump;
        if (current == null || !current.isAlive()) {
            return false;
        }
        if (process != null && process.isAlive()) {
            return false;
        }
        try {
            current.join(PUMP_DRAIN_TIMEOUT.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
        return true;
    }

    private void finishChannel(Process worker) {
        Thread current = pump;
        if (current == null) {
            return;
        }
        try {
            current.join(PUMP_DRAIN_TIMEOUT.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        if (current.isAlive()) {
            log.warn("Status channel still open after worker exit, closing it");
            try {
                worker.getInputStream().close();
            } catch (IOException e) {
                log.warn("Unable to close status channel: {}", e.getMessage());
            }
        }
    }

    private static void closeWorkerInput(Process worker) {
        try {
            worker.getOutputStream().close();
        } catch (IOException e) {
            log.warn("Unable to close indexing worker stdin: {}", e.getMessage());
        }
    }

    private static Thread startPump(InputStream workerOutput, BlockingQueue<StatusEvent> channel) {
        Thread thread = new Thread(() -> pump(workerOutput, channel), "librarian-status-pump");
        thread.setDaemon(true);
        thread.start();
        return thread;
    }

    private static void pump(InputStream workerOutput, BlockingQueue<StatusEvent> channel) {
        try (BufferedReader reader = new BufferedReader(new InputStreamReader(workerOutput, StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                Optional<StatusEvent> event = StatusChannel.decode(line);
                if (event.isPresent()) {
                    channel.add(event.get());
                } else if (!line.isBlank()) {
                    log.debug("worker: {}", line);
                }
            }
        } catch (IOException e) {
            log.debug("Status channel closed: {}", e.getMessage());
        }
    }

    interface WorkerStarter {
        Process start(Path target, Path storeDir) throws IOException;
    }

    /** Launches {@link IndexingWorker} on the current JVM's runtime and class path. */
    static final class JvmWorkerStarter implements WorkerStarter {
        private final Path configPath;
        private final Duration grace;

        JvmWorkerStarter(Path configPath, Duration grace) {
            this.configPath = configPath;
            this.grace = grace;
        }

        @Override
        public Process start(Path target, Path storeDir) throws IOException {
            Files.createDirectories(storeDir);
            return new ProcessBuilder(command(target, storeDir))
                    .redirectError(Redirect.appendTo(storeDir.resolve(WORKER_LOG_FILE_NAME).toFile()))
                    .start();
        }

        List<String> command(Path target, Path storeDir) {
            List<String> command = new ArrayList<>();
            command.add(Path.of(System.getProperty("java.home"), "bin", "java").toString());
            command.add("-cp");
            command.add(System.getProperty("java.class.path"));
            command.add(IndexingWorker.class.getName());
            command.add("--grace-ms");
            command.add(String.valueOf(grace.toMillis()));
            if (configPath != null) {
                command.add("--config");
                command.add(configPath.toAbsolutePath().toString());
            }
            command.add(target.toString());
            command.add(storeDir.toString());
            return command;
        }

        @Override
        public String toString() {
            return "JvmWorkerStarter{" +
                    "configPath=" + configPath +
                    ", grace=" + grace +
                    '}';
        }
    }
}
