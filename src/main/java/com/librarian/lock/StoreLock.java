package com.librarian.lock;

import java.io.IOException;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.channels.OverlappingFileLockException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Duration;
import java.time.Instant;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Cross-process exclusive lock guarding a store directory.
 * <p>
 * Acquisition polls a non-blocking OS lock on {@value #LOCK_FILE_NAME} inside the store directory, so a bounded
 * timeout can be honoured between attempts. The lock is advisory: it only excludes processes that go through this
 * class.
 * <p>
 * POSIX record locks belong to the whole process, so a second acquirer inside the same JVM is turned away by an
 * in-process registry before it opens its own channel on the lock file.
 */
public class StoreLock {
    public static final String LOCK_FILE_NAME = ".store.lock";
    public static final Duration DEFAULT_POLL_INTERVAL = Duration.ofMillis(500);

    private static final Logger log = LoggerFactory.getLogger(StoreLock.class);
    private static final Set<Path> HELD_IN_PROCESS = ConcurrentHashMap.newKeySet();

    private final Path storeDir;
    private final Path lockFile;
    private final Duration pollInterval;
    private final LockWaitListener waitListener;

    public StoreLock(Path storeDir) {
        this(storeDir, DEFAULT_POLL_INTERVAL, LockWaitListener.logging());
    }

    public StoreLock(Path storeDir, Duration pollInterval, LockWaitListener waitListener) {
        if (pollInterval.isNegative() || pollInterval.isZero()) {
            throw new IllegalArgumentException("pollInterval must be positive");
        }
        this.storeDir = storeDir.toAbsolutePath().normalize();
        this.lockFile = this.storeDir.resolve(LOCK_FILE_NAME);
        this.pollInterval = pollInterval;
        this.waitListener = waitListener;
    }

    public Path lockFile() {
        return lockFile;
    }

    /**
     * Blocks the calling thread until the lock is held.
     *
     * @param timeout maximum time to wait, or {@code null} to wait indefinitely
     * @throws LockTimeoutException if the lock stayed contended past {@code timeout}
     * @throws LockException if the lock file cannot be created or opened, or the wait was interrupted
     */
    public LockToken acquire(Duration timeout) throws LockException {
        prepareLockFile();
        long startNanos = System.nanoTime();
        boolean waiting = false;

        while (true) {
            LockToken token = tryAcquire();
            if (token != null) {
                if (waiting) {
                    waitListener.onAcquiredAfterWait(lockFile, Duration.ofNanos(System.nanoTime() - startNanos));
                }
                log.debug("Acquired store lock {}", lockFile);
                return token;
            }

            if (!waiting) {
                waiting = true;
                waitListener.onWaiting(lockFile);
            }

            Duration elapsed = Duration.ofNanos(System.nanoTime() - startNanos);
            Duration sleep = pollInterval;
            if (timeout != null) {
                if (elapsed.compareTo(timeout) >= 0) {
                    log.warn("Timed out waiting for store lock {} after {} ms", lockFile, elapsed.toMillis());
                    throw new LockTimeoutException(lockFile, elapsed);
                }
                Duration remaining = timeout.minus(elapsed);
                if (remaining.compareTo(sleep) < 0) {
                    sleep = remaining;
                }
            }

            try {
                Thread.sleep(Math.max(1L, sleep.toMillis()));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new LockException("Interrupted while waiting for store lock " + lockFile, e);
            }
        }
    }

    /**
     * Releases {@code token}. Releasing a token twice, or a {@code null} token, does nothing.
     */
    public void release(LockToken token) throws LockException {
        if (token == null) {
            return;
        }
        token.close();
    }

    private void prepareLockFile() throws LockException {
        try {
            Files.createDirectories(storeDir);
        } catch (IOException e) {
            throw new LockException("Unable to create store directory " + storeDir, e);
        }
    }

    private LockToken tryAcquire() throws LockException {
        if (!HELD_IN_PROCESS.add(lockFile)) {
            return null;
        }
        FileChannel channel = null;
        try {
            channel = FileChannel.open(lockFile, StandardOpenOption.CREATE, StandardOpenOption.WRITE);
            FileLock fileLock = channel.tryLock();
            if (fileLock == null) {
                closeQuietly(channel);
                HELD_IN_PROCESS.remove(lockFile);
                return null;
            }
            return new LockToken(lockFile, channel, fileLock, Instant.now(), () -> HELD_IN_PROCESS.remove(lockFile));
        } catch (OverlappingFileLockException e) {
            closeQuietly(channel);
            HELD_IN_PROCESS.remove(lockFile);
            return null;
        } catch (IOException e) {
            closeQuietly(channel);
            HELD_IN_PROCESS.remove(lockFile);
            throw new LockException("Unable to open store lock file " + lockFile, e);
        }
    }

    private static void closeQuietly(FileChannel channel) {
        if (channel == null) {
            return;
        }
        try {
            channel.close();
        } catch (IOException e) {
            log.debug("Ignoring failure closing lock channel", e);
        }
    }

    @Override
    public String toString() {
        return "StoreLock{" +
                "lockFile=" + lockFile +
                ", pollInterval=" + pollInterval +
                '}';
    }
}
