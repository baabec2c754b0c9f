package com.librarian.lock;

import java.nio.file.Path;
import java.time.Duration;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public interface LockWaitListener {
    void onWaiting(Path lockFile);

    default void onAcquiredAfterWait(Path lockFile, Duration waited) {
    }

    static LockWaitListener logging() {
        Logger log = LoggerFactory.getLogger(StoreLock.class);
        return new LockWaitListener() {
            @Override
            public void onWaiting(Path lockFile) {
                log.info("Waiting for store lock {} (another process is using the store)...", lockFile);
            }

            @Override
            public void onAcquiredAfterWait(Path lockFile, Duration waited) {
                log.info("Store lock acquired after {} ms", waited.toMillis());
            }
        };
    }
}
