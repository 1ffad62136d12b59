package com.valuescreen.loader.ingest.http;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Cancellation signal shared by every layer of one ingestion run. Cancelling wakes backoff
 * sleeps and runs registered hooks (used to abort in-flight HTTP calls).
 */
public class IngestCancellation {
    private static final Logger log = LoggerFactory.getLogger(IngestCancellation.class);

    private final CountDownLatch latch = new CountDownLatch(1);
    private final List<Runnable> hooks = new CopyOnWriteArrayList<>();
    private volatile String reason;

    public static IngestCancellation create() {
        return new IngestCancellation();
    }

    public void cancel(String reason) {
        if (latch.getCount() == 0) {
            return;
        }
        this.reason = reason == null || reason.isBlank() ? "cancelled" : reason;
        latch.countDown();
        for (Runnable hook : hooks) {
            if (hooks.remove(hook)) {
                runHook(hook);
            }
        }
    }

    public void cancel() {
        cancel("cancelled");
    }

    public boolean isCancelled() {
        return latch.getCount() == 0;
    }

    public String reason() {
        return reason;
    }

    public void throwIfCancelled() {
        if (isCancelled()) {
            throw new IngestCancelledException(reason);
        }
    }

    /**
     * Sleeps up to {@code millis}. Returns {@code true} when woken by cancellation.
     */
    public boolean sleep(long millis) throws InterruptedException {
        if (millis <= 0) {
            return isCancelled();
        }
        return latch.await(millis, TimeUnit.MILLISECONDS);
    }

    /**
     * Registers a hook that runs once on cancellation, immediately if already cancelled.
     * The returned handle unregisters it.
     */
    public Runnable onCancel(Runnable hook) {
        hooks.add(hook);
        // whoever removes the hook first runs it, so it runs once even when racing cancel()
        if (isCancelled() && hooks.remove(hook)) {
            runHook(hook);
        }
        return () -> hooks.remove(hook);
    }

    private static void runHook(Runnable hook) {
        try {
            hook.run();
        } catch (RuntimeException e) {
            log.warn("Cancellation hook failed: {}", e.getMessage());
        }
    }
}
