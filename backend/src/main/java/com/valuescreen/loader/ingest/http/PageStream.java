package com.valuescreen.loader.ingest.http;

import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * Bounded hand-off between page producers and a single consumer. Producers block while the
 * buffer is full; {@link #complete()} marks the end once every producer has finished.
 */
public class PageStream<T> implements Iterable<PageBatch<T>>, AutoCloseable {
    private static final long POLL_MILLIS = 100;

    private final BlockingQueue<PageBatch<T>> queue;
    private final PageBatch<T> endMarker = new PageBatch<>(List.of(), null);
    private volatile boolean closed;
    private volatile boolean completed;
    private boolean drained;

    public PageStream(int capacity) {
        this.queue = new ArrayBlockingQueue<>(Math.max(1, capacity) + 1);
    }

    /**
     * Returns {@code false} when the consumer has closed the stream and the batch was dropped.
     */
    public boolean publish(PageBatch<T> batch) throws InterruptedException {
        while (!closed) {
            if (queue.offer(batch, POLL_MILLIS, TimeUnit.MILLISECONDS)) {
                return true;
            }
        }
        return false;
    }

    public void complete() {
        if (completed) {
            return;
        }
        completed = true;
        while (!closed) {
            try {
                if (queue.offer(endMarker, POLL_MILLIS, TimeUnit.MILLISECONDS)) {
                    return;
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            }
        }
    }

    /**
     * Blocks for the next batch. Returns {@code null} once the stream has ended or was closed.
     */
    public PageBatch<T> next() throws InterruptedException {
        if (drained) {
            return null;
        }
        while (!closed) {
            PageBatch<T> batch = queue.poll(POLL_MILLIS, TimeUnit.MILLISECONDS);
            if (batch == null) {
                continue;
            }
            if (batch == endMarker) {
                drained = true;
                return null;
            }
            return batch;
        }
        drained = true;
        return null;
    }

    public boolean isClosed() {
        return closed;
    }

    @Override
    public void close() {
        closed = true;
        queue.clear();
    }

    @Override
    public Iterator<PageBatch<T>> iterator() {
        return new Iterator<>() {
            private PageBatch<T> pending;

            @Override
            public boolean hasNext() {
                if (pending != null) {
                    return true;
                }
                try {
                    pending = PageStream.this.next();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    close();
                    throw new IngestCancelledException("interrupted while reading page stream");
                }
                return pending != null;
            }

            @Override
            public PageBatch<T> next() {
                if (!hasNext()) {
                    throw new NoSuchElementException();
                }
                PageBatch<T> batch = pending;
                pending = null;
                return batch;
            }
        };
    }
}
