package com.valuescreen.loader.ingest.http;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import com.valuescreen.loader.config.LoaderProperties;
import com.valuescreen.loader.ingest.model.ColumnarResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Semaphore;
import java.util.function.Function;

/**
 * Client for cursor-paginated columnar datatables. Every attempt goes through the shared
 * {@link RateLimiter}; retryable failures back off exponentially.
 */
@Service
public class DatatableClient {
    private static final Logger log = LoggerFactory.getLogger(DatatableClient.class);
    private static final int MAX_ERROR_BODY_CHARS = 500;

    private final LoaderProperties properties;
    private final HttpClient client;
    private final RateLimiter rateLimiter;
    private final ExecutorService fetchExecutor;
    private final ObjectReader responseReader;

    public DatatableClient(
        LoaderProperties properties,
        @Qualifier("httpExecutor") ExecutorService httpExecutor,
        @Qualifier("fetchExecutor") ExecutorService fetchExecutor,
        RateLimiter rateLimiter,
        ObjectMapper objectMapper
    ) {
        this.properties = properties;
        this.client = HttpClient.newBuilder()
            .followRedirects(HttpClient.Redirect.NORMAL)
            .connectTimeout(Duration.ofSeconds(properties.getApi().getRequestTimeoutSeconds()))
            .version(HttpClient.Version.HTTP_1_1)
            .executor(httpExecutor)
            .build();
        this.rateLimiter = rateLimiter;
        this.fetchExecutor = fetchExecutor;
        this.responseReader = objectMapper.readerFor(ColumnarResponse.class)
            .with(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS);
    }

    /**
     * Follows the cursor chain to the end and returns every row under the first page's columns.
     */
    public ColumnarResponse fetchAll(String table, Map<String, String> params, IngestCancellation cancellation) {
        ColumnarResponse first = null;
        List<List<Object>> rows = new ArrayList<>();
        String cursor = null;
        int pages = 0;
        do {
            cancellation.throwIfCancelled();
            ColumnarResponse page = fetchPage(table, params, cursor, cancellation);
            pages++;
            if (first == null) {
                first = page;
            }
            rows.addAll(page.data());
            cursor = page.nextCursorId();
            log.debug("Fetched page {} of {} ({} rows, next cursor {})", pages, table, page.data().size(), cursor);
        } while (cursor != null);
        log.info("Fetched {} rows from {} in {} page(s)", rows.size(), table, pages);
        return ColumnarResponse.of(first.columns(), rows);
    }

    /**
     * Streams parsed pages as they arrive. A {@code ticker} filter is split into chunks, each its
     * own cursor chain; at most {@code concurrency} page requests are in flight at once. A failed
     * chain publishes one error batch and stops while the others continue.
     */
    public <T> PageStream<T> stream(
        String table,
        Map<String, String> params,
        Function<ColumnarResponse, List<T>> parser,
        int concurrency,
        IngestCancellation cancellation
    ) {
        PageStream<T> stream = new PageStream<>(properties.getStream().getQueueCapacity());
        Semaphore inFlight = new Semaphore(Math.max(1, concurrency));
        List<Map<String, String>> chains = splitTickerChains(params);
        List<CompletableFuture<Void>> futures = new ArrayList<>(chains.size());
        for (Map<String, String> chainParams : chains) {
            futures.add(CompletableFuture.runAsync(
                () -> runChain(table, chainParams, parser, inFlight, stream, cancellation),
                fetchExecutor
            ));
        }
        CompletableFuture.allOf(futures.toArray(new CompletableFuture[0]))
            .whenComplete((ignored, error) -> stream.complete());
        return stream;
    }

    public ColumnarResponse fetchPage(
        String table,
        Map<String, String> params,
        String cursor,
        IngestCancellation cancellation
    ) {
        URI uri = buildUri(table, params, cursor);
        int maxAttempts = properties.getApi().getRequestMaxAttempts();
        for (int attempt = 1; ; attempt++) {
            cancellation.throwIfCancelled();
            try {
                return executeOnce(uri, table, cancellation);
            } catch (DatatableFetchException e) {
                if (!e.retryable()) {
                    throw e;
                }
                if (attempt >= maxAttempts) {
                    throw new DatatableFetchException(
                        e.reason(),
                        e.statusCode(),
                        true,
                        "Giving up on " + table + " after " + maxAttempts + " attempt(s): " + e.getMessage(),
                        e
                    );
                }
                long delay = backoffDelayMs(attempt);
                log.warn("Attempt {}/{} for {} failed ({}), retrying in {} ms",
                    attempt, maxAttempts, table, e.reason(), delay);
                sleepBackoff(delay, cancellation);
            }
        }
    }

    private <T> void runChain(
        String table,
        Map<String, String> params,
        Function<ColumnarResponse, List<T>> parser,
        Semaphore inFlight,
        PageStream<T> stream,
        IngestCancellation cancellation
    ) {
        List<ColumnarResponse.Column> columns = null;
        String cursor = null;
        try {
            do {
                if (stream.isClosed()) {
                    return;
                }
                cancellation.throwIfCancelled();
                ColumnarResponse page;
                inFlight.acquire();
                try {
                    page = fetchPage(table, params, cursor, cancellation);
                } finally {
                    inFlight.release();
                }
                if (columns == null) {
                    columns = page.columns();
                } else {
                    page = page.withColumns(columns);
                }
                List<T> rows = parser.apply(page);
                if (!stream.publish(PageBatch.of(rows))) {
                    return;
                }
                cursor = page.nextCursorId();
            } while (cursor != null);
        } catch (DatatableFetchException e) {
            log.warn("Stream chain for {} failed: {}", table, e.getMessage());
            publishQuietly(stream, PageBatch.failed(e));
        } catch (IngestCancelledException e) {
            publishQuietly(stream, PageBatch.failed(
                new DatatableFetchException("cancelled", 0, false, "Fetch of " + table + " cancelled: " + e.getMessage(), e)
            ));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            publishQuietly(stream, PageBatch.failed(
                new DatatableFetchException("interrupted", 0, false, "Fetch of " + table + " interrupted", e)
            ));
        } catch (RuntimeException e) {
            log.warn("Stream chain for {} failed while parsing: {}", table, e.getMessage());
            publishQuietly(stream, PageBatch.failed(
                new DatatableFetchException("parse_error", 0, false, "Failed to parse " + table + " page: " + e.getMessage(), e)
            ));
        }
    }

    private <T> void publishQuietly(PageStream<T> stream, PageBatch<T> batch) {
        try {
            stream.publish(batch);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.debug("Interrupted while publishing error batch: {}", batch.error().getMessage());
        }
    }

    private ColumnarResponse executeOnce(URI uri, String table, IngestCancellation cancellation) {
        try {
            rateLimiter.acquire();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IngestCancelledException("interrupted while waiting for rate limiter");
        }
        cancellation.throwIfCancelled();

        HttpRequest request = HttpRequest.newBuilder(uri)
            .timeout(Duration.ofSeconds(properties.getApi().getRequestTimeoutSeconds()))
            .header("User-Agent", properties.getUserAgent())
            .header("Accept", "application/json")
            .GET()
            .build();
        CompletableFuture<HttpResponse<byte[]>> future = client.sendAsync(request, HttpResponse.BodyHandlers.ofByteArray());
        Runnable unregister = cancellation.onCancel(() -> future.cancel(true));
        HttpResponse<byte[]> response;
        try {
            response = future.get();
        } catch (CancellationException e) {
            throw new IngestCancelledException(cancellation.reason() == null ? "cancelled" : cancellation.reason());
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new IngestCancelledException("interrupted during request to " + table);
        } catch (ExecutionException e) {
            throw transportFailure(table, e.getCause() == null ? e : e.getCause());
        } finally {
            unregister.run();
        }

        int status = response.statusCode();
        byte[] bytes = response.body();
        if (status < 200 || status >= 300) {
            boolean retryable = status == 408 || status == 429 || status >= 500;
            String body = bytes == null ? "" : new String(bytes, StandardCharsets.UTF_8);
            throw new DatatableFetchException(
                "http_" + status,
                status,
                retryable,
                "HTTP " + status + " from " + table + ": " + truncate(body)
            );
        }
        try {
            ColumnarResponse decoded = responseReader.readValue(bytes == null ? new byte[0] : bytes);
            if (decoded == null) {
                throw new DatatableFetchException("decode_error", status, false, "Empty response body from " + table);
            }
            return decoded;
        } catch (IOException e) {
            throw new DatatableFetchException("decode_error", status, false,
                "Failed to decode " + table + " response: " + e.getMessage(), e);
        }
    }

    private DatatableFetchException transportFailure(String table, Throwable cause) {
        if (cause instanceof HttpTimeoutException) {
            return new DatatableFetchException("timeout", 0, true, "Request to " + table + " timed out", cause);
        }
        if (cause instanceof IOException) {
            return new DatatableFetchException("io_error", 0, true,
                "I/O error calling " + table + ": " + cause.getMessage(), cause);
        }
        return new DatatableFetchException("http_error", 0, true,
            "Request to " + table + " failed: " + cause.getMessage(), cause);
    }

    long backoffDelayMs(int attempt) {
        long base = properties.getApi().getRequestRetryBaseDelayMs();
        if (base <= 0) {
            return 0;
        }
        long delay = base * (1L << Math.min(20, Math.max(0, attempt)));
        int max = properties.getApi().getRequestRetryMaxDelayMs();
        if (max > 0) {
            delay = Math.min(delay, max);
        }
        return delay;
    }

    private void sleepBackoff(long delayMs, IngestCancellation cancellation) {
        try {
            if (cancellation.sleep(delayMs)) {
                throw new IngestCancelledException(cancellation.reason());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IngestCancelledException("interrupted during retry backoff");
        }
    }

    List<Map<String, String>> splitTickerChains(Map<String, String> params) {
        Map<String, String> base = params == null ? new LinkedHashMap<>() : new LinkedHashMap<>(params);
        String tickers = base.get("ticker");
        if (tickers == null || tickers.isBlank()) {
            return List.of(base);
        }
        List<String> symbols = new ArrayList<>();
        for (String part : tickers.split(",")) {
            String trimmed = part.trim();
            if (!trimmed.isEmpty()) {
                symbols.add(trimmed);
            }
        }
        int chunkSize = properties.getApi().getTickerChunkSize();
        if (symbols.size() <= chunkSize) {
            base.put("ticker", String.join(",", symbols));
            return List.of(base);
        }
        List<Map<String, String>> chains = new ArrayList<>();
        for (int start = 0; start < symbols.size(); start += chunkSize) {
            int end = Math.min(symbols.size(), start + chunkSize);
            Map<String, String> chain = new LinkedHashMap<>(base);
            chain.put("ticker", String.join(",", symbols.subList(start, end)));
            chains.add(chain);
        }
        return chains;
    }

    URI buildUri(String table, Map<String, String> params, String cursor) {
        StringBuilder url = new StringBuilder(properties.getApi().getBaseUrl())
            .append('/')
            .append(table)
            .append(".json?api_key=")
            .append(encode(properties.getApi().getApiKey()));
        if (params != null) {
            for (Map.Entry<String, String> entry : params.entrySet()) {
                if (entry.getValue() == null || entry.getValue().isBlank()) {
                    continue;
                }
                url.append('&').append(encode(entry.getKey())).append('=').append(encode(entry.getValue()));
            }
        }
        if (cursor != null && !cursor.isBlank()) {
            url.append("&qopts.cursor_id=").append(encode(cursor));
        }
        return URI.create(url.toString());
    }

    private static String encode(String value) {
        return URLEncoder.encode(value == null ? "" : value, StandardCharsets.UTF_8);
    }

    private static String truncate(String body) {
        if (body == null) {
            return "";
        }
        String trimmed = body.trim();
        return trimmed.length() <= MAX_ERROR_BODY_CHARS ? trimmed : trimmed.substring(0, MAX_ERROR_BODY_CHARS) + "...";
    }
}
