package com.valuescreen.loader.ingest.service;

import com.valuescreen.loader.config.LoaderProperties;
import com.valuescreen.loader.ingest.http.DatatableClient;
import com.valuescreen.loader.ingest.http.DatatableFetchException;
import com.valuescreen.loader.ingest.http.IngestCancellation;
import com.valuescreen.loader.ingest.http.IngestCancelledException;
import com.valuescreen.loader.ingest.model.ColumnarResponse;
import com.valuescreen.loader.ingest.model.DailyPriceRow;
import com.valuescreen.loader.ingest.model.IndexMembershipRow;
import com.valuescreen.loader.ingest.model.IngestRequest;
import com.valuescreen.loader.ingest.model.IngestResult;
import com.valuescreen.loader.ingest.model.IngestStatusResponse;
import com.valuescreen.loader.ingest.model.IngestTable;
import com.valuescreen.loader.ingest.model.StreamingUnitResult;
import com.valuescreen.loader.ingest.model.TickerRow;
import com.valuescreen.loader.ingest.persistence.BatchWriteException;
import com.valuescreen.loader.ingest.persistence.MarketDataJdbcRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

@Service
public class MarketDataIngestionService {
    private static final Logger log = LoggerFactory.getLogger(MarketDataIngestionService.class);
    private static final DateTimeFormatter DAY = DateTimeFormatter.ISO_LOCAL_DATE;
    private static final String NO_COMPANIES = "No companies in database. Run tickers ingestion first.";

    private final DatatableClient client;
    private final StreamingIngestionService streaming;
    private final IngestTargets targets;
    private final MarketDataJdbcRepository repository;
    private final LoaderProperties properties;
    private final Map<IngestTable, IngestCancellation> activeRuns = new ConcurrentHashMap<>();

    public MarketDataIngestionService(
        DatatableClient client,
        StreamingIngestionService streaming,
        IngestTargets targets,
        MarketDataJdbcRepository repository,
        LoaderProperties properties
    ) {
        this.client = client;
        this.streaming = streaming;
        this.targets = targets;
        this.repository = repository;
        this.properties = properties;
    }

    public IngestResult ingest(IngestTable table, IngestRequest request) {
        return switch (table) {
            case TICKERS -> ingestTickers(request);
            case FUNDAMENTALS -> ingestFundamentals(request);
            case DAILY -> ingestDailyPrices(request);
            case BENCHMARKS -> ingestBenchmarks(request);
            case INDEX_MEMBERSHIP -> ingestIndexMembership(request);
        };
    }

    public IngestResult ingestTickers(IngestRequest request) {
        IngestRequest safeRequest = request == null ? IngestRequest.defaults() : request;
        return exclusive(IngestTable.TICKERS, cancellation -> {
            Instant startedAt = Instant.now();
            List<String> tickers = safeRequest.normalizedTickers();
            if (tickers.isEmpty() && safeRequest.isSp500Only()) {
                try {
                    tickers = currentConstituents(cancellation);
                } catch (DatatableFetchException e) {
                    return failure("Failed to fetch S&P 500 constituents: " + e.getMessage(), 0, startedAt);
                }
                log.info("Restricting ticker ingestion to {} current S&P 500 constituents", tickers.size());
            }
            Map<String, String> params = new LinkedHashMap<>();
            params.put("table", "SF1");
            if (!tickers.isEmpty()) {
                params.put("ticker", String.join(",", tickers));
            }
            log.info("Starting ticker ingestion ({})", tickers.isEmpty() ? "all tickers" : tickers.size() + " tickers");
            try {
                IngestTarget<TickerRow> target = targets.tickers();
                ColumnarResponse response = client.fetchAll(target.datatable(), params, cancellation);
                List<TickerRow> rows = target.parse(response);
                log.info("Fetched {} tickers from API", rows.size());
                int written = target.upsert(rows);
                return success("Successfully ingested " + written + " companies", written, startedAt);
            } catch (DatatableFetchException e) {
                return failure("Failed to fetch tickers: " + e.getMessage(), 0, startedAt);
            } catch (BatchWriteException e) {
                return failure("Failed to upsert companies: " + e.getMessage(), 0, startedAt);
            }
        });
    }

    public IngestResult ingestFundamentals(IngestRequest request) {
        IngestRequest safeRequest = request == null ? IngestRequest.defaults() : request;
        return exclusive(IngestTable.FUNDAMENTALS, cancellation -> {
            Instant startedAt = Instant.now();
            List<String> tickers = resolveCompanyTickers(safeRequest);
            List<String> dimensions = safeRequest.normalizedDimensions();
            if (dimensions.isEmpty()) {
                dimensions = IngestRequest.normalize(List.of(properties.getFundamentals().getDefaultDimensions()));
            }
            log.info("Starting fundamentals ingestion (tickers: {}, dimensions: {}, full: {})",
                tickers.size(), dimensions, safeRequest.isFull());

            long total = 0;
            for (String dimension : dimensions) {
                if (cancellation.isCancelled()) {
                    return cancelled(cancellation, total, startedAt);
                }
                Map<String, String> params = new LinkedHashMap<>();
                params.put("ticker", String.join(",", tickers));
                params.put("dimension", dimension);
                if (!safeRequest.isFull()) {
                    LocalDate since = repository.fundamentalsWatermark();
                    params.put("lastupdated.gte", since.format(DAY));
                    log.info("Incremental fundamentals fetch for {} since {}", dimension, since);
                }
                StreamingUnitResult unit = streaming.ingest(
                    "fundamentals/" + dimension, targets.fundamentals(), params, cancellation);
                total += unit.rowsWritten();
                if (unit.failed()) {
                    return failure("Failed to ingest fundamentals (" + dimension + "): " + unit.firstError(), total, startedAt);
                }
                if (cancellation.isCancelled()) {
                    return cancelled(cancellation, total, startedAt);
                }
            }
            return success("Successfully ingested " + total + " financial metrics", total, startedAt);
        });
    }

    public IngestResult ingestDailyPrices(IngestRequest request) {
        IngestRequest safeRequest = request == null ? IngestRequest.defaults() : request;
        return exclusive(IngestTable.DAILY, cancellation -> {
            Instant startedAt = Instant.now();
            List<String> tickers = resolveCompanyTickers(safeRequest);
            Map<String, String> params = new LinkedHashMap<>();
            params.put("ticker", String.join(",", tickers));
            if (!safeRequest.isFull()) {
                LocalDate since = repository.dailyPricesWatermark();
                params.put("lastupdated.gte", since.format(DAY));
                log.info("Incremental daily price fetch since {}", since);
            }
            log.info("Starting daily price ingestion (tickers: {}, full: {})", tickers.size(), safeRequest.isFull());
            StreamingUnitResult unit = streaming.ingest("daily_prices", targets.dailyPrices(), params, cancellation);
            if (unit.failed()) {
                return failure("Failed to ingest daily prices: " + unit.firstError(), 0, startedAt);
            }
            return success("Successfully ingested " + unit.rowsWritten() + " daily prices", unit.rowsWritten(), startedAt);
        });
    }

    public IngestResult ingestBenchmarks(IngestRequest request) {
        IngestRequest safeRequest = request == null ? IngestRequest.defaults() : request;
        return exclusive(IngestTable.BENCHMARKS, cancellation -> {
            Instant startedAt = Instant.now();
            List<String> tickers = repository.findBenchmarkTickers();
            if (tickers.isEmpty()) {
                throw new IngestPreconditionException("No benchmarks configured in database");
            }
            Map<String, String> params = new LinkedHashMap<>();
            params.put("ticker", String.join(",", tickers));
            if (!safeRequest.isFull()) {
                LocalDate since = repository.benchmarkPricesWatermark();
                params.put("lastupdated.gte", since.format(DAY));
                log.info("Incremental benchmark fetch since {}", since);
            }
            log.info("Starting benchmark ingestion (tickers: {}, full: {})", tickers, safeRequest.isFull());
            try {
                IngestTarget<DailyPriceRow> target = targets.benchmarkPrices();
                ColumnarResponse response = client.fetchAll(target.datatable(), params, cancellation);
                List<DailyPriceRow> rows = target.parse(response);
                int written = target.upsert(rows);
                return success("Successfully ingested " + written + " benchmark prices", written, startedAt);
            } catch (DatatableFetchException e) {
                return failure("Failed to fetch benchmark prices: " + e.getMessage(), 0, startedAt);
            } catch (BatchWriteException e) {
                return failure("Failed to upsert benchmark prices: " + e.getMessage(), 0, startedAt);
            }
        });
    }

    public IngestResult ingestIndexMembership(IngestRequest request) {
        IngestRequest safeRequest = request == null ? IngestRequest.defaults() : request;
        return exclusive(IngestTable.INDEX_MEMBERSHIP, cancellation -> {
            Instant startedAt = Instant.now();
            Map<String, String> params = new LinkedHashMap<>();
            List<String> tickers = safeRequest.normalizedTickers();
            if (!tickers.isEmpty()) {
                params.put("ticker", String.join(",", tickers));
            }
            if (!safeRequest.isFull()) {
                LocalDate since = repository.indexMembershipWatermark();
                params.put("date.gte", since.format(DAY));
                log.info("Incremental index membership fetch since {}", since);
            }
            StreamingUnitResult unit = streaming.ingest(
                "index_membership", targets.indexMembership(), params, cancellation);
            if (unit.failed()) {
                return failure("Failed to ingest index membership: " + unit.firstError(), 0, startedAt);
            }
            return success("Successfully ingested " + unit.rowsWritten() + " index membership events",
                unit.rowsWritten(), startedAt);
        });
    }

    /**
     * Current S&P 500 constituents as reported by the membership datatable.
     */
    public List<String> currentConstituents(IngestCancellation cancellation) {
        Map<String, String> params = new LinkedHashMap<>();
        params.put("action", "current");
        IngestTarget<IndexMembershipRow> target = targets.indexMembership();
        ColumnarResponse response = client.fetchAll(target.datatable(), params, cancellation);
        Set<String> tickers = new LinkedHashSet<>();
        for (IndexMembershipRow row : target.parse(response)) {
            tickers.add(row.ticker());
        }
        return new ArrayList<>(tickers);
    }

    public boolean cancel(IngestTable table) {
        IngestCancellation cancellation = activeRuns.get(table);
        if (cancellation == null) {
            return false;
        }
        cancellation.cancel("cancel requested for " + table.key());
        return true;
    }

    public boolean isActive(IngestTable table) {
        return activeRuns.containsKey(table);
    }

    public IngestStatusResponse status() {
        boolean dbConnectivity;
        try {
            dbConnectivity = repository.isDbReachable();
        } catch (RuntimeException e) {
            log.warn("Database connectivity check failed: {}", e.getMessage());
            return new IngestStatusResponse(Instant.now(), false, Map.of(), Map.of(), activeRunFlags());
        }
        Map<String, String> lastUpdates = new LinkedHashMap<>();
        lastUpdates.put("fundamentals", formatWatermark(repository.fundamentalsWatermark()));
        lastUpdates.put("daily_prices", formatWatermark(repository.dailyPricesWatermark()));
        lastUpdates.put("benchmark_prices", formatWatermark(repository.benchmarkPricesWatermark()));
        lastUpdates.put("index_membership", formatWatermark(repository.indexMembershipWatermark()));
        return new IngestStatusResponse(
            Instant.now(),
            dbConnectivity,
            repository.tableCounts(),
            lastUpdates,
            activeRunFlags()
        );
    }

    private List<String> resolveCompanyTickers(IngestRequest request) {
        List<String> tickers = request.normalizedTickers();
        if (tickers.isEmpty()) {
            tickers = repository.findActiveTickers();
        }
        if (tickers.isEmpty()) {
            throw new IngestPreconditionException(NO_COMPANIES);
        }
        return tickers;
    }

    private IngestResult exclusive(IngestTable table, Function<IngestCancellation, IngestResult> body) {
        IngestCancellation cancellation = IngestCancellation.create();
        if (activeRuns.putIfAbsent(table, cancellation) != null) {
            throw new ActiveIngestionException("An ingestion run for " + table.key() + " is already active");
        }
        Instant startedAt = Instant.now();
        try {
            IngestResult result = body.apply(cancellation);
            log.info("{} ingestion finished: success={}, count={}, elapsed={}",
                table.key(), result.success(), result.count(), result.elapsed());
            return result;
        } catch (IngestCancelledException e) {
            log.warn("{} ingestion cancelled: {}", table.key(), e.getMessage());
            return failure("Ingestion cancelled: " + e.getMessage(), 0, startedAt);
        } finally {
            activeRuns.remove(table, cancellation);
        }
    }

    private Map<String, Boolean> activeRunFlags() {
        Map<String, Boolean> flags = new LinkedHashMap<>();
        for (IngestTable table : IngestTable.values()) {
            flags.put(table.key(), activeRuns.containsKey(table));
        }
        return flags;
    }

    private static String formatWatermark(LocalDate watermark) {
        return watermark == null || LocalDate.EPOCH.equals(watermark) ? null : watermark.format(DAY);
    }

    /**
     * Keeps the count of rows already committed; they stay in place after a cancel.
     */
    private static IngestResult cancelled(IngestCancellation cancellation, long count, Instant startedAt) {
        return failure("Ingestion cancelled: " + cancellation.reason(), count, startedAt);
    }

    private static IngestResult success(String message, long count, Instant startedAt) {
        return IngestResult.ok(message, count, Duration.between(startedAt, Instant.now()));
    }

    private static IngestResult failure(String message, long count, Instant startedAt) {
        log.warn(message);
        return IngestResult.failed(message, count, Duration.between(startedAt, Instant.now()));
    }
}
