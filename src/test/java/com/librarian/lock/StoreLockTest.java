package com.librarian.lock;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class StoreLockTest {

    @TempDir
    Path tempDir;

    @Test
    void shouldCreateStoreDirectoryAndLockFile() throws Exception {
        Path store = tempDir.resolve("nested").resolve("store");
        StoreLock lock = new StoreLock(store);

        try (LockToken token = lock.acquire(Duration.ofSeconds(1))) {
            assertTrue(token.isValid());
            assertTrue(Files.exists(store.resolve(StoreLock.LOCK_FILE_NAME)));
        }
        assertTrue(Files.exists(store.resolve(StoreLock.LOCK_FILE_NAME)));
    }

    @Test
    void shouldTimeOutWhileAnotherHolderHasTheLock() throws Exception {
        AtomicInteger waits = new AtomicInteger();
        StoreLock holder = new StoreLock(tempDir);
        StoreLock contender = new StoreLock(tempDir, Duration.ofMillis(20), lockFile -> waits.incrementAndGet());

        LockToken held = holder.acquire(null);
        try {
            long start = System.nanoTime();
            LockTimeoutException timeout = assertThrows(LockTimeoutException.class,
                    () -> contender.acquire(Duration.ofMillis(200)));
            long elapsedMs = (System.nanoTime() - start) / 1_000_000;

            assertTrue(elapsedMs >= 190, "waited only " + elapsedMs + " ms");
            assertTrue(elapsedMs < 2_000, "waited " + elapsedMs + " ms");
            assertEquals(tempDir.toAbsolutePath().normalize().resolve(StoreLock.LOCK_FILE_NAME), timeout.lockFile());
            assertEquals(1, waits.get());
        } finally {
            holder.release(held);
        }
    }

    @Test
    void shouldAllowReacquireAfterRelease() throws Exception {
        StoreLock lock = new StoreLock(tempDir);

        LockToken first = lock.acquire(Duration.ofSeconds(1));
        lock.release(first);
        assertFalse(first.isValid());

        LockToken second = assertDoesNotThrow(() -> lock.acquire(Duration.ofMillis(100)));
        assertTrue(second.isValid());
        lock.release(second);
    }

    @Test
    void shouldTreatRepeatedAndNullReleaseAsNoOp() throws Exception {
        StoreLock lock = new StoreLock(tempDir);
        LockToken token = lock.acquire(Duration.ofSeconds(1));

        lock.release(token);
        assertDoesNotThrow(() -> lock.release(token));
        assertDoesNotThrow(token::close);
        assertDoesNotThrow(() -> lock.release(null));

        // a stale release must not free a lock somebody else holds now
        LockToken other = lock.acquire(Duration.ofSeconds(1));
        lock.release(token);
        assertThrows(LockTimeoutException.class, () -> new StoreLock(tempDir, Duration.ofMillis(10), path -> {
        }).acquire(Duration.ofMillis(50)));
        lock.release(other);
    }

    @Test
    void shouldHandOverToWaiterWhenHolderReleases() throws Exception {
        StoreLock holder = new StoreLock(tempDir);
        AtomicInteger waits = new AtomicInteger();
        StoreLock waiter = new StoreLock(tempDir, Duration.ofMillis(20), new LockWaitListener() {
            @Override
            public void onWaiting(Path lockFile) {
                waits.incrementAndGet();
            }
        });

        LockToken held = holder.acquire(null);
        CompletableFuture<LockToken> pending = CompletableFuture.supplyAsync(() -> {
            try {
                return waiter.acquire(Duration.ofSeconds(10));
            } catch (LockException e) {
                throw new IllegalStateException(e);
            }
        });

        Thread.sleep(150);
        assertFalse(pending.isDone());
        holder.release(held);

        LockToken acquired = pending.get(5, TimeUnit.SECONDS);
        assertTrue(acquired.isValid());
        assertEquals(1, waits.get());
        waiter.release(acquired);
    }

    @Test
    void shouldFailInterruptedWaitWithLockException() throws Exception {
        StoreLock holder = new StoreLock(tempDir);
        StoreLock waiter = new StoreLock(tempDir, Duration.ofMillis(50), path -> {
        });
        LockToken held = holder.acquire(null);
        try {
            Thread.currentThread().interrupt();
            LockException failure = assertThrows(LockException.class, () -> waiter.acquire(null));
            assertFalse(failure instanceof LockTimeoutException);
            assertTrue(Thread.interrupted());
        } finally {
            holder.release(held);
        }
    }

    @Test
    void shouldCloseChannelBeforeFreeingLockForOtherThreads() throws Exception {
        Path lockFile = tempDir.resolve(StoreLock.LOCK_FILE_NAME);
        FileChannel channel = FileChannel.open(lockFile, StandardOpenOption.CREATE, StandardOpenOption.WRITE);
        FileLock fileLock = channel.tryLock();
        AtomicBoolean channelOpenWhenFreed = new AtomicBoolean(true);
        AtomicInteger freed = new AtomicInteger();
        LockToken token = new LockToken(lockFile, channel, fileLock, Instant.now(), () -> {
            channelOpenWhenFreed.set(channel.isOpen());
            freed.incrementAndGet();
        });

        token.close();
        token.close();

        assertFalse(channelOpenWhenFreed.get());
        assertEquals(1, freed.get());
        assertFalse(token.isValid());
    }

    @Test
    void shouldRejectNonPositivePollInterval() {
        assertThrows(IllegalArgumentException.class, () -> new StoreLock(tempDir, Duration.ZERO, path -> {
        }));
    }
}
