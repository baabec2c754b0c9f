package com.librarian.lock;

import java.io.IOException;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.file.Path;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicBoolean;

public final class LockToken implements AutoCloseable {
    private final Path lockFile;
    private final FileChannel channel;
    private final FileLock fileLock;
    private final Instant acquiredAt;
    private final Runnable afterRelease;
    private final AtomicBoolean released = new AtomicBoolean();

    LockToken(Path lockFile, FileChannel channel, FileLock fileLock, Instant acquiredAt, Runnable afterRelease) {
        this.lockFile = lockFile;
        this.channel = channel;
        this.fileLock = fileLock;
        this.acquiredAt = acquiredAt;
        this.afterRelease = afterRelease;
    }

    public Path lockFile() {
        return lockFile;
    }

    public Instant acquiredAt() {
        return acquiredAt;
    }

    public boolean isValid() {
        return !released.get() && fileLock.isValid();
    }

    @Override
    public void close() throws LockException {
        if (!released.compareAndSet(false, true)) {
            return;
        }
        try {
            if (fileLock.isValid()) {
                fileLock.release();
            }
        } catch (IOException e) {
            throw new LockException("Unable to release store lock " + lockFile, e);
        } finally {
            try {
                closeChannel();
            } finally {
                // only now may another acquirer in this JVM open a channel: closing ours drops every lock we hold
                afterRelease.run();
            }
        }
    }

    private void closeChannel() throws LockException {
        try {
            channel.close();
        } catch (IOException e) {
            throw new LockException("Unable to close store lock file " + lockFile, e);
        }
    }

    @Override
    public String toString() {
        return "LockToken{" +
                "lockFile=" + lockFile +
                ", acquiredAt=" + acquiredAt +
                ", released=" + released.get() +
                '}';
    }
}
