package com.valuescreen.loader.ingest.service;

import com.valuescreen.loader.config.LoaderProperties;
import com.valuescreen.loader.ingest.http.DatatableClient;
import com.valuescreen.loader.ingest.http.DatatableFetchException;
import com.valuescreen.loader.ingest.http.IngestCancellation;
import com.valuescreen.loader.ingest.model.ColumnarResponse;
import com.valuescreen.loader.ingest.model.IndexMembershipRow;
import com.valuescreen.loader.ingest.model.IngestRequest;
import com.valuescreen.loader.ingest.model.IngestResult;
import com.valuescreen.loader.ingest.model.IngestStatusResponse;
import com.valuescreen.loader.ingest.model.IngestTable;
import com.valuescreen.loader.ingest.model.StreamingUnitResult;
import com.valuescreen.loader.ingest.model.TickerRow;
import com.valuescreen.loader.ingest.parse.DatatableParser;
import com.valuescreen.loader.ingest.persistence.MarketDataJdbcRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class MarketDataIngestionServiceTest {

    @Mock
    private DatatableClient client;

    @Mock
    private StreamingIngestionService streaming;

    @Mock
    private DatatableParser parser;

    @Mock
    private MarketDataJdbcRepository repository;

    @Captor
    private ArgumentCaptor<Map<String, String>> params;

    @Captor
    private ArgumentCaptor<Map<String, String>> membershipParams;

    private MarketDataIngestionService service;

    @BeforeEach
    void setUp() {
        service = new MarketDataIngestionService(
            client, streaming, new IngestTargets(parser, repository), repository, new LoaderProperties());
    }

    @Test
    void incrementalDailyRunStartsFromWatermark() {
        when(repository.findActiveTickers()).thenReturn(List.of("AAPL", "MSFT"));
        when(repository.dailyPricesWatermark()).thenReturn(LocalDate.EPOCH);
        when(streaming.ingest(anyString(), any(), anyMap(), any())).thenReturn(unit("daily_prices", 42, null));

        IngestResult result = service.ingestDailyPrices(IngestRequest.defaults());

        verify(streaming).ingest(eq("daily_prices"), any(), params.capture(), any());
        assertThat(params.getValue())
            .containsEntry("ticker", "AAPL,MSFT")
            .containsEntry("lastupdated.gte", "1970-01-01");
        assertTrue(result.success());
        assertThat(result.count()).isEqualTo(42);
    }

    @Test
    void fullRunOmitsDateFilterAndUsesRequestedTickers() {
        when(streaming.ingest(anyString(), any(), anyMap(), any())).thenReturn(unit("daily_prices", 3, null));

        IngestResult result = service.ingestDailyPrices(new IngestRequest(List.of(" aapl ", "AAPL"), true, null, null));

        verify(streaming).ingest(eq("daily_prices"), any(), params.capture(), any());
        assertThat(params.getValue()).containsOnlyKeys("ticker").containsEntry("ticker", "AAPL");
        verify(repository, never()).dailyPricesWatermark();
        verify(repository, never()).findActiveTickers();
        assertTrue(result.success());
    }

    @Test
    void runsNeedCompaniesFirst() {
        when(repository.findActiveTickers()).thenReturn(List.of());

        IngestPreconditionException error = assertThrows(
            IngestPreconditionException.class,
            () -> service.ingestFundamentals(IngestRequest.defaults())
        );

        assertThat(error.getMessage()).contains("Run tickers ingestion first");
        assertFalse(service.isActive(IngestTable.FUNDAMENTALS));
    }

    @Test
    void fundamentalsRunOneUnitPerDefaultDimension() {
        when(repository.findActiveTickers()).thenReturn(List.of("AAPL"));
        when(repository.fundamentalsWatermark()).thenReturn(LocalDate.of(2024, 2, 1));
        when(streaming.ingest(anyString(), any(), anyMap(), any())).thenReturn(unit("fundamentals", 5, null));

        IngestResult result = service.ingestFundamentals(IngestRequest.defaults());

        ArgumentCaptor<String> units = ArgumentCaptor.forClass(String.class);
        verify(streaming, times(2)).ingest(units.capture(), any(), params.capture(), any());
        assertThat(units.getAllValues()).containsExactly("fundamentals/ARQ", "fundamentals/MRQ");
        assertThat(params.getAllValues())
            .extracting(p -> p.get("dimension"))
            .containsExactly("ARQ", "MRQ");
        assertThat(params.getAllValues().get(0)).containsEntry("lastupdated.gte", "2024-02-01");
        assertTrue(result.success());
        assertThat(result.count()).isEqualTo(10);
    }

    @Test
    void unitWithNothingWrittenFailsTheRun() {
        when(repository.findActiveTickers()).thenReturn(List.of("AAPL"));
        when(repository.dailyPricesWatermark()).thenReturn(LocalDate.EPOCH);
        when(streaming.ingest(anyString(), any(), anyMap(), any()))
            .thenReturn(unit("daily_prices", 0, "Giving up on SHARADAR/DAILY after 3 attempt(s): HTTP 503"));

        IngestResult result = service.ingestDailyPrices(IngestRequest.defaults());

        assertFalse(result.success());
        assertThat(result.message()).contains("HTTP 503");
    }

    @Test
    void tickerRunFiltersToSf1Companies() {
        ColumnarResponse response = ColumnarResponse.of(List.of(), List.of());
        List<TickerRow> rows = List.of(
            new TickerRow("AAPL", "Apple", "NASDAQ", null, null, null, false, null),
            new TickerRow("MSFT", "Microsoft", "NASDAQ", null, null, null, false, null)
        );
        when(client.fetchAll(eq("SHARADAR/TICKERS"), anyMap(), any())).thenReturn(response);
        when(parser.parseTickers(response)).thenReturn(rows);
        when(repository.upsertCompanies(rows)).thenReturn(2);

        IngestResult result = service.ingestTickers(IngestRequest.defaults());

        verify(client).fetchAll(eq("SHARADAR/TICKERS"), params.capture(), any());
        assertThat(params.getValue()).containsOnlyKeys("table").containsEntry("table", "SF1");
        assertTrue(result.success());
        assertThat(result.count()).isEqualTo(2);
    }

    @Test
    void tickerFetchFailureIsReportedAsFailedResult() {
        when(client.fetchAll(eq("SHARADAR/TICKERS"), anyMap(), any()))
            .thenThrow(new DatatableFetchException("http_401", 401, false, "HTTP 401 from SHARADAR/TICKERS"));

        IngestResult result = service.ingestTickers(new IngestRequest(List.of("AAPL"), false, null, null));

        assertFalse(result.success());
        assertThat(result.message()).contains("HTTP 401");
        verify(repository, never()).upsertCompanies(any());
    }

    @Test
    void sp500OnlyRunRestrictsTickersToCurrentConstituents() {
        ColumnarResponse constituents = ColumnarResponse.of(List.of(), List.of());
        ColumnarResponse companies = ColumnarResponse.of(List.of(), List.of());
        List<TickerRow> rows = List.of(
            new TickerRow("AAPL", "Apple", "NASDAQ", null, null, null, false, null),
            new TickerRow("MSFT", "Microsoft", "NASDAQ", null, null, null, false, null)
        );
        when(client.fetchAll(eq("SHARADAR/SP500"), anyMap(), any())).thenReturn(constituents);
        when(parser.parseIndexMembership(constituents)).thenReturn(List.of(
            new IndexMembershipRow(LocalDate.of(2024, 1, 2), "current", "AAPL", "Apple", null, null),
            new IndexMembershipRow(LocalDate.of(2024, 1, 2), "current", "MSFT", "Microsoft", null, null),
            new IndexMembershipRow(LocalDate.of(2024, 1, 3), "current", "AAPL", "Apple", null, null)
        ));
        when(client.fetchAll(eq("SHARADAR/TICKERS"), anyMap(), any())).thenReturn(companies);
        when(parser.parseTickers(companies)).thenReturn(rows);
        when(repository.upsertCompanies(rows)).thenReturn(2);

        IngestResult result = service.ingestTickers(new IngestRequest(null, null, null, true));

        verify(client).fetchAll(eq("SHARADAR/SP500"), membershipParams.capture(), any());
        assertThat(membershipParams.getValue()).containsOnlyKeys("action").containsEntry("action", "current");
        verify(client).fetchAll(eq("SHARADAR/TICKERS"), params.capture(), any());
        assertThat(params.getValue())
            .containsEntry("table", "SF1")
            .containsEntry("ticker", "AAPL,MSFT");
        assertTrue(result.success());
        assertThat(result.count()).isEqualTo(2);
    }

    @Test
    void sp500ConstituentFetchFailureIsReportedAsFailedResult() {
        when(client.fetchAll(eq("SHARADAR/SP500"), anyMap(), any()))
            .thenThrow(new DatatableFetchException("http_503", 503, true, "Giving up on SHARADAR/SP500 after 3 attempt(s): HTTP 503"));

        IngestResult result = service.ingestTickers(new IngestRequest(List.of(), false, null, true));

        assertFalse(result.success());
        assertThat(result.count()).isZero();
        assertThat(result.message()).contains("S&P 500 constituents").contains("HTTP 503");
        verify(client, never()).fetchAll(eq("SHARADAR/TICKERS"), anyMap(), any());
        verify(repository, never()).upsertCompanies(any());
        assertFalse(service.isActive(IngestTable.TICKERS));
    }

    @Test
    void cancelBetweenDimensionsKeepsCommittedCount() {
        when(repository.findActiveTickers()).thenReturn(List.of("AAPL"));
        when(repository.fundamentalsWatermark()).thenReturn(LocalDate.EPOCH);
        when(streaming.ingest(anyString(), any(), anyMap(), any())).thenAnswer(invocation -> {
            assertTrue(service.cancel(IngestTable.FUNDAMENTALS));
            return unit("fundamentals/ARQ", 500, null);
        });

        IngestResult result = service.ingestFundamentals(IngestRequest.defaults());

        verify(streaming, times(1)).ingest(eq("fundamentals/ARQ"), any(), anyMap(), any());
        verify(streaming, never()).ingest(eq("fundamentals/MRQ"), any(), anyMap(), any());
        assertFalse(result.success());
        assertThat(result.count()).isEqualTo(500);
        assertThat(result.message()).contains("cancelled");
        assertFalse(service.isActive(IngestTable.FUNDAMENTALS));
    }

    @Test
    void benchmarksNeedConfiguredTickers() {
        when(repository.findBenchmarkTickers()).thenReturn(List.of());

        assertThrows(IngestPreconditionException.class, () -> service.ingestBenchmarks(IngestRequest.defaults()));
    }

    @Test
    void secondRunForSameTableIsRejectedWhileFirstIsActive() {
        when(repository.findActiveTickers()).thenReturn(List.of("AAPL"));
        when(repository.dailyPricesWatermark()).thenReturn(LocalDate.EPOCH);
        AtomicReference<RuntimeException> nested = new AtomicReference<>();
        when(streaming.ingest(anyString(), any(), anyMap(), any())).thenAnswer(invocation -> {
            assertTrue(service.isActive(IngestTable.DAILY));
            try {
                service.ingestDailyPrices(IngestRequest.defaults());
            } catch (ActiveIngestionException e) {
                nested.set(e);
            }
            return unit("daily_prices", 1, null);
        });

        IngestResult result = service.ingestDailyPrices(IngestRequest.defaults());

        assertTrue(result.success());
        assertThat(nested.get()).isInstanceOf(ActiveIngestionException.class);
        assertFalse(service.isActive(IngestTable.DAILY));
    }

    @Test
    void cancelSignalsTheActiveRun() {
        when(repository.findActiveTickers()).thenReturn(List.of("AAPL"));
        when(repository.dailyPricesWatermark()).thenReturn(LocalDate.EPOCH);
        AtomicBoolean cancelledInsideRun = new AtomicBoolean();
        when(streaming.ingest(anyString(), any(), anyMap(), any())).thenAnswer(invocation -> {
            IngestCancellation cancellation = invocation.getArgument(3);
            assertTrue(service.cancel(IngestTable.DAILY));
            cancelledInsideRun.set(cancellation.isCancelled());
            return unit("daily_prices", 0, "cancelled");
        });

        IngestResult result = service.ingestDailyPrices(IngestRequest.defaults());

        assertTrue(cancelledInsideRun.get());
        assertFalse(result.success());
        assertFalse(service.cancel(IngestTable.DAILY));
    }

    @Test
    void statusHidesEmptyWatermarks() {
        when(repository.isDbReachable()).thenReturn(true);
        when(repository.tableCounts()).thenReturn(Map.of("companies", 2L));
        when(repository.fundamentalsWatermark()).thenReturn(LocalDate.EPOCH);
        when(repository.dailyPricesWatermark()).thenReturn(LocalDate.of(2024, 3, 1));
        when(repository.benchmarkPricesWatermark()).thenReturn(LocalDate.EPOCH);
        when(repository.indexMembershipWatermark()).thenReturn(LocalDate.EPOCH);

        IngestStatusResponse status = service.status();

        assertTrue(status.dbConnectivity());
        assertThat(status.lastUpdates())
            .containsEntry("daily_prices", "2024-03-01")
            .containsEntry("fundamentals", null);
        assertThat(status.activeRuns()).containsEntry("daily", false).hasSize(IngestTable.values().length);
    }

    private static StreamingUnitResult unit(String name, long rows, String fetchError) {
        return new StreamingUnitResult(name, rows, fetchError, List.of());
    }
}
