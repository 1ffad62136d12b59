package com.valuescreen.loader.ingest.service;

import com.valuescreen.loader.config.LoaderProperties;
import com.valuescreen.loader.ingest.http.DatatableClient;
import com.valuescreen.loader.ingest.http.IngestCancellation;
import com.valuescreen.loader.ingest.http.PageBatch;
import com.valuescreen.loader.ingest.http.PageStream;
import com.valuescreen.loader.ingest.model.StreamingUnitResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.Semaphore;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Pipes a streamed datatable into its target: pages are fetched concurrently and each non-empty
 * page becomes one upsert on the write executor, with a bounded number of writes in flight.
 */
@Service
public class StreamingIngestionService {
    private static final Logger log = LoggerFactory.getLogger(StreamingIngestionService.class);

    private final DatatableClient client;
    private final ExecutorService writeExecutor;
    private final LoaderProperties properties;

    public StreamingIngestionService(
        DatatableClient client,
        @Qualifier("writeExecutor") ExecutorService writeExecutor,
        LoaderProperties properties
    ) {
        this.client = client;
        this.writeExecutor = writeExecutor;
        this.properties = properties;
    }

    public <T> StreamingUnitResult ingest(
        String unit,
        IngestTarget<T> target,
        Map<String, String> params,
        IngestCancellation cancellation
    ) {
        return ingest(
            unit,
            target,
            params,
            properties.getStream().getFetchConcurrency(),
            properties.getStream().getWriteConcurrency(),
            cancellation
        );
    }

    public <T> StreamingUnitResult ingest(
        String unit,
        IngestTarget<T> target,
        Map<String, String> params,
        int fetchConcurrency,
        int writeConcurrency,
        IngestCancellation cancellation
    ) {
        Semaphore writePermits = new Semaphore(Math.max(1, writeConcurrency));
        AtomicLong rowsWritten = new AtomicLong();
        List<String> writeErrors = Collections.synchronizedList(new ArrayList<>());
        List<CompletableFuture<Void>> writes = new ArrayList<>();
        String fetchError = null;
        int pages = 0;

        log.info("Streaming {} from {} (fetch concurrency {}, write concurrency {})",
            unit, target.datatable(), fetchConcurrency, writeConcurrency);
        try (PageStream<T> stream = client.stream(target.datatable(), params, target::parse, fetchConcurrency, cancellation)) {
            PageBatch<T> batch;
            while ((batch = stream.next()) != null) {
                if (batch.isError()) {
                    log.warn("Fetch error while streaming {}: {}", unit, batch.error().getMessage());
                    if (fetchError == null) {
                        fetchError = batch.error().getMessage();
                    }
                    continue;
                }
                if (batch.rows().isEmpty()) {
                    continue;
                }
                pages++;
                List<T> rows = batch.rows();
                int page = pages;
                writePermits.acquire();
                try {
                    writes.add(CompletableFuture.runAsync(
                        () -> writePage(unit, target, rows, page, rowsWritten, writeErrors, writePermits),
                        writeExecutor
                    ));
                } catch (RejectedExecutionException e) {
                    writePermits.release();
                    writeErrors.add("write rejected for page " + page + ": " + e.getMessage());
                    log.warn("Write executor rejected page {} of {}", page, unit);
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            cancellation.cancel("interrupted");
            if (fetchError == null) {
                fetchError = "interrupted while streaming " + unit;
            }
        } finally {
            CompletableFuture.allOf(writes.toArray(new CompletableFuture[0])).join();
        }

        StreamingUnitResult result = new StreamingUnitResult(unit, rowsWritten.get(), fetchError, List.copyOf(writeErrors));
        if (result.hasErrors()) {
            log.warn("Streamed {}: {} rows written from {} page(s) with errors (fetch={}, writeErrors={})",
                unit, result.rowsWritten(), pages, fetchError, writeErrors.size());
        } else {
            log.info("Streamed {}: {} rows written from {} page(s)", unit, result.rowsWritten(), pages);
        }
        return result;
    }

    private <T> void writePage(
        String unit,
        IngestTarget<T> target,
        List<T> rows,
        int page,
        AtomicLong rowsWritten,
        List<String> writeErrors,
        Semaphore writePermits
    ) {
        try {
            int written = target.upsert(rows);
            rowsWritten.addAndGet(written);
            log.debug("Upserted {} {} rows from page {}", written, target.name(), page);
        } catch (RuntimeException e) {
            writeErrors.add(e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage());
            log.warn("Upsert of page {} for {} failed: {}", page, unit, e.getMessage());
        } finally {
            writePermits.release();
        }
    }
}
