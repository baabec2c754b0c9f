package com.librarian.lock;

import java.nio.file.Path;
import java.time.Duration;

public class LockTimeoutException extends LockException {
    private final Path lockFile;
    private final Duration waited;

    public LockTimeoutException(Path lockFile, Duration waited) {
        super("Timed out waiting for store lock %s after %.1f seconds".formatted(lockFile, waited.toMillis() / 1000d));
        this.lockFile = lockFile;
        this.waited = waited;
    }

    public Path lockFile() {
        return lockFile;
    }

    public Duration waited() {
        return waited;
    }
}
