package com.valuescreen.loader.ingest.http;

import java.util.concurrent.TimeUnit;

/**
 * Process-wide request pacing. Consecutive {@link #acquire()} calls return at least
 * {@code 1s / requestsPerSecond} apart, whichever thread makes them.
 */
public class RateLimiter {
    private final long intervalNanos;
    private long lastCallNanos;
    private boolean called;

    public RateLimiter(int requestsPerSecond) {
        this.intervalNanos = TimeUnit.SECONDS.toNanos(1) / Math.max(1, requestsPerSecond);
    }

    public synchronized void acquire() throws InterruptedException {
        if (called) {
            long elapsed = System.nanoTime() - lastCallNanos;
            long waitNanos = intervalNanos - elapsed;
            if (waitNanos > 0) {
                TimeUnit.NANOSECONDS.sleep(waitNanos);
            }
        }
        lastCallNanos = System.nanoTime();
        called = true;
    }

    public long intervalMillis() {
        return TimeUnit.NANOSECONDS.toMillis(intervalNanos);
    }
}
