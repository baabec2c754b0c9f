package com.librarian.background;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.BooleanSupplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns a JVM termination request (SIGTERM, Ctrl-C) into a cooperative stop flag.
 * <p>
 * The installed shutdown hook raises the flag, runs the optional {@code onRequest} action and then holds the JVM
 * open for up to {@code grace} until the guarded work calls {@link #close()}. Work polls the signal at safe
 * points, typically between books.
 */
public final class ShutdownSignal implements BooleanSupplier, AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(ShutdownSignal.class);

    private final AtomicBoolean requested = new AtomicBoolean();
    private final CountDownLatch finished = new CountDownLatch(1);
    private final Duration grace;
    private final Runnable onRequest;
    private final Thread hook;

    private ShutdownSignal(Duration grace, Runnable onRequest) {
        this.grace = grace;
        this.onRequest = onRequest;
        this.hook = new Thread(this::onShutdown, "librarian-shutdown");
    }

    public static ShutdownSignal install(Duration grace) {
        return install(grace, () -> {
        });
    }

    public static ShutdownSignal install(Duration grace, Runnable onRequest) {
        ShutdownSignal signal = new ShutdownSignal(grace, onRequest);
        Runtime.getRuntime().addShutdownHook(signal.hook);
        return signal;
    }

    public boolean isRequested() {
        return requested.get();
    }

    @Override
    public boolean getAsBoolean() {
        return requested.get();
    }

    /** Marks the guarded work as finished and unregisters the hook unless shutdown is already under way. */
    @Override
    public void close() {
        finished.countDown();
        if (requested.get()) {
            return;
        }
        try {
            Runtime.getRuntime().removeShutdownHook(hook);
        } catch (IllegalStateException e) {
            log.debug("JVM already shutting down, leaving hook in place");
        }
    }

    private void onShutdown() {
        requested.set(true);
        log.info("Stop requested, finishing current book (grace {} ms)", grace.toMillis());
        onRequest.run();
        try {
            if (!finished.await(grace.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("Work did not finish within {} ms of the stop request", grace.toMillis());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
