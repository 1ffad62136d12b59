package com.valuescreen.loader.ingest.http;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.valuescreen.loader.config.LoaderProperties;
import com.valuescreen.loader.ingest.DatatableJson;
import com.valuescreen.loader.ingest.model.ColumnarResponse;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.SocketPolicy;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowableOfType;

class DatatableClientRetryTest {
    private MockWebServer server;
    private ExecutorService httpExecutor;
    private ExecutorService fetchExecutor;
    private LoaderProperties properties;

    @BeforeEach
    void setUp() throws Exception {
        server = new MockWebServer();
        server.start();
        properties = new LoaderProperties();
        properties.getApi().setBaseUrl(server.url("/api/v3/datatables").toString());
        properties.getApi().setApiKey("test-key");
        properties.getApi().setRequestTimeoutSeconds(2);
        properties.getApi().setRequestMaxAttempts(3);
        properties.getApi().setRequestRetryBaseDelayMs(1);
        properties.getApi().setRequestRetryMaxDelayMs(5);
        httpExecutor = Executors.newFixedThreadPool(2);
        fetchExecutor = Executors.newFixedThreadPool(2);
    }

    @AfterEach
    void tearDown() throws Exception {
        server.shutdown();
        httpExecutor.shutdownNow();
        fetchExecutor.shutdownNow();
    }

    private DatatableClient client() {
        return new DatatableClient(properties, httpExecutor, fetchExecutor, new RateLimiter(100), new ObjectMapper());
    }

    @Test
    void retriesServerErrorThenSucceeds() {
        server.enqueue(new MockResponse().setResponseCode(500).setBody("boom"));
        server.enqueue(new MockResponse().setBody(DatatableJson.dailyPage("AAPL", 0, 2, null)));

        ColumnarResponse response = client().fetchAll("SHARADAR/DAILY", Map.of(), IngestCancellation.create());

        assertThat(response.data()).hasSize(2);
        assertThat(server.getRequestCount()).isEqualTo(2);
    }

    @Test
    void rateLimitedResponsesAreRetried() {
        server.enqueue(new MockResponse().setResponseCode(429).setBody("slow down"));
        server.enqueue(new MockResponse().setResponseCode(429).setBody("slow down"));
        server.enqueue(new MockResponse().setBody(DatatableJson.dailyPage("AAPL", 0, 1, null)));

        ColumnarResponse response = client().fetchAll("SHARADAR/DAILY", Map.of(), IngestCancellation.create());

        assertThat(response.data()).hasSize(1);
        assertThat(server.getRequestCount()).isEqualTo(3);
    }

    @Test
    void givesUpAfterMaxAttempts() {
        for (int i = 0; i < 3; i++) {
            server.enqueue(new MockResponse().setResponseCode(503).setBody("unavailable"));
        }

        DatatableFetchException error = catchThrowableOfType(
            () -> client().fetchAll("SHARADAR/SF1", Map.of(), IngestCancellation.create()),
            DatatableFetchException.class
        );

        assertThat(error).isNotNull();
        assertThat(error.statusCode()).isEqualTo(503);
        assertThat(error.reason()).isEqualTo("http_503");
        assertThat(error.getMessage()).contains("3 attempt(s)");
        assertThat(server.getRequestCount()).isEqualTo(3);
    }

    @Test
    void clientErrorFailsImmediatelyWithBody() {
        server.enqueue(new MockResponse().setResponseCode(400).setBody("{\"quandl_error\":\"bad filter\"}"));

        DatatableFetchException error = catchThrowableOfType(
            () -> client().fetchAll("SHARADAR/SF1", Map.of("dimension", "XYZ"), IngestCancellation.create()),
            DatatableFetchException.class
        );

        assertThat(error.retryable()).isFalse();
        assertThat(error.statusCode()).isEqualTo(400);
        assertThat(error.getMessage()).contains("bad filter");
        assertThat(server.getRequestCount()).isEqualTo(1);
    }

    @Test
    void malformedJsonIsNotRetried() {
        server.enqueue(new MockResponse().setBody("{not json"));

        DatatableFetchException error = catchThrowableOfType(
            () -> client().fetchAll("SHARADAR/SF1", Map.of(), IngestCancellation.create()),
            DatatableFetchException.class
        );

        assertThat(error.reason()).isEqualTo("decode_error");
        assertThat(server.getRequestCount()).isEqualTo(1);
    }

    @Test
    void droppedConnectionIsRetried() {
        server.enqueue(new MockResponse().setSocketPolicy(SocketPolicy.DISCONNECT_AT_START));
        server.enqueue(new MockResponse().setBody(DatatableJson.dailyPage("AAPL", 0, 1, null)));

        ColumnarResponse response = client().fetchAll("SHARADAR/DAILY", Map.of(), IngestCancellation.create());

        assertThat(response.data()).hasSize(1);
    }

    @Test
    void alreadyCancelledRunSendsNoRequest() {
        IngestCancellation cancellation = IngestCancellation.create();
        cancellation.cancel("stop");

        assertThatThrownBy(() -> client().fetchAll("SHARADAR/DAILY", Map.of(), cancellation))
            .isInstanceOf(IngestCancelledException.class)
            .hasMessageContaining("stop");
        assertThat(server.getRequestCount()).isZero();
    }

    @Test
    void cancellationInterruptsRetryBackoff() throws Exception {
        properties.getApi().setRequestRetryBaseDelayMs(10_000);
        properties.getApi().setRequestRetryMaxDelayMs(30_000);
        server.enqueue(new MockResponse().setResponseCode(500).setBody("boom"));
        DatatableClient client = client();
        IngestCancellation cancellation = IngestCancellation.create();

        CompletableFuture<ColumnarResponse> future = CompletableFuture.supplyAsync(
            () -> client.fetchAll("SHARADAR/DAILY", Map.of(), cancellation));
        assertThat(server.takeRequest(5, TimeUnit.SECONDS)).isNotNull();
        long cancelledAt = System.nanoTime();
        cancellation.cancel("shutdown");

        assertThatThrownBy(() -> future.get(5, TimeUnit.SECONDS))
            .isInstanceOf(ExecutionException.class)
            .hasCauseInstanceOf(IngestCancelledException.class);
        assertThat(TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - cancelledAt)).isLessThan(5_000);
        assertThat(server.getRequestCount()).isEqualTo(1);
    }

    @Test
    void cancellationAbortsInFlightRequest() throws Exception {
        properties.getApi().setRequestTimeoutSeconds(30);
        server.enqueue(new MockResponse()
            .setBody(DatatableJson.dailyPage("AAPL", 0, 1, null))
            .setHeadersDelay(10, TimeUnit.SECONDS));
        DatatableClient client = client();
        IngestCancellation cancellation = IngestCancellation.create();

        CompletableFuture<ColumnarResponse> future = CompletableFuture.supplyAsync(
            () -> client.fetchAll("SHARADAR/DAILY", Map.of(), cancellation));
        assertThat(server.takeRequest(5, TimeUnit.SECONDS)).isNotNull();
        cancellation.cancel("shutdown");

        assertThatThrownBy(() -> future.get(3, TimeUnit.SECONDS))
            .isInstanceOf(ExecutionException.class)
            .hasCauseInstanceOf(IngestCancelledException.class);
    }
}
