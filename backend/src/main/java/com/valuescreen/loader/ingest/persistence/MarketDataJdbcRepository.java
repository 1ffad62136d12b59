package com.valuescreen.loader.ingest.persistence;

import com.valuescreen.loader.config.LoaderProperties;
import com.valuescreen.loader.ingest.model.DailyPriceRow;
import com.valuescreen.loader.ingest.model.FundamentalsRow;
import com.valuescreen.loader.ingest.model.IndexMembershipRow;
import com.valuescreen.loader.ingest.model.MarketDataRow;
import com.valuescreen.loader.ingest.model.TickerRow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.Date;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;

@Repository
public class MarketDataJdbcRepository {
    private static final Logger log = LoggerFactory.getLogger(MarketDataJdbcRepository.class);
    private static final int LOOKUP_BATCH_SIZE = 1000;
    private static final Set<String> TABLES = Set.of(
        "companies", "fundamentals", "daily_prices", "benchmarks", "benchmark_prices", "index_membership"
    );

    private static final List<String> COMPANY_COLUMNS = List.of(
        "ticker", "name", "exchange", "sector", "industry", "scale_revenue", "active", "last_updated"
    );
    private static final List<String> FUNDAMENTALS_COLUMNS = List.of(
        "ticker", "dimension", "date_key", "calendar_date", "report_period", "last_updated",
        "revenue", "net_income", "ebitda", "fcf", "roic", "pe_ratio", "ev_ebit", "pb_ratio",
        "debt_to_equity", "market_cap", "enterprise_value", "price"
    );
    private static final List<String> DAILY_COLUMNS = List.of(
        "ticker", "date", "open", "high", "low", "close", "volume", "dividends", "close_unadj",
        "market_cap", "enterprise_value", "pe_ratio", "pb_ratio", "last_updated"
    );
    private static final List<String> BENCHMARK_PRICE_COLUMNS = List.of(
        "ticker", "date", "open", "high", "low", "close", "volume", "dividends", "close_unadj", "last_updated"
    );
    private static final List<String> MEMBERSHIP_COLUMNS = List.of(
        "ticker", "date", "action", "name", "contra_ticker", "contra_name"
    );

    private final NamedParameterJdbcTemplate jdbc;
    private final TransactionTemplate chunkTransaction;
    private final LoaderProperties properties;
    private final boolean postgres;

    private final String companiesUpsert;
    private final String fundamentalsUpsert;
    private final String dailyPricesUpsert;
    private final String benchmarkPricesUpsert;
    private final String membershipUpsert;

    public MarketDataJdbcRepository(
        NamedParameterJdbcTemplate jdbc,
        PlatformTransactionManager transactionManager,
        LoaderProperties properties
    ) {
        this.jdbc = jdbc;
        this.properties = properties;
        this.chunkTransaction = new TransactionTemplate(transactionManager);
        this.chunkTransaction.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
        this.postgres = detectPostgres(jdbc);

        this.companiesUpsert = upsertSql("companies", List.of("ticker"), COMPANY_COLUMNS);
        this.fundamentalsUpsert = upsertSql("fundamentals", List.of("ticker", "dimension", "date_key"), FUNDAMENTALS_COLUMNS);
        this.dailyPricesUpsert = upsertSql("daily_prices", List.of("ticker", "date"), DAILY_COLUMNS);
        this.benchmarkPricesUpsert = upsertSql("benchmark_prices", List.of("ticker", "date"), BENCHMARK_PRICE_COLUMNS);
        this.membershipUpsert = upsertSql("index_membership", List.of("ticker", "date", "action"), MEMBERSHIP_COLUMNS);
    }

    public boolean isDbReachable() {
        Integer value = jdbc.getJdbcTemplate().queryForObject("SELECT 1", Integer.class);
        return value != null && value == 1;
    }

    public Map<String, Long> tableCounts() {
        Map<String, Long> counts = new LinkedHashMap<>();
        counts.put("companies", countTable("companies"));
        counts.put("fundamentals", countTable("fundamentals"));
        counts.put("daily_prices", countTable("daily_prices"));
        counts.put("benchmarks", countTable("benchmarks"));
        counts.put("benchmark_prices", countTable("benchmark_prices"));
        counts.put("index_membership", countTable("index_membership"));
        return counts;
    }

    public long countTable(String table) {
        if (!TABLES.contains(table)) {
            throw new IllegalArgumentException("Unknown table: " + table);
        }
        Long count = jdbc.getJdbcTemplate().queryForObject("SELECT COUNT(*) FROM " + table, Long.class);
        return count == null ? 0L : count;
    }

    public int upsertCompanies(List<TickerRow> rows) {
        return writeInChunks("companies", companiesUpsert, rows, row -> new MapSqlParameterSource()
            .addValue("ticker", row.ticker())
            .addValue("name", row.name())
            .addValue("exchange", row.exchange())
            .addValue("sector", row.sector())
            .addValue("industry", row.industry())
            .addValue("scale_revenue", row.scaleRevenue())
            .addValue("active", !row.delisted())
            .addValue("last_updated", row.lastUpdated())
        );
    }

    public int upsertFundamentals(List<FundamentalsRow> rows) {
        List<FundamentalsRow> known = retainKnown("fundamentals", rows, this::findExistingCompanyTickers);
        return writeInChunks("fundamentals", fundamentalsUpsert, known, row -> {
            String key = row.ticker() + "/" + row.dimension() + "/" + row.dateKey();
            return new MapSqlParameterSource()
                .addValue("ticker", row.ticker())
                .addValue("dimension", row.dimension())
                .addValue("date_key", row.dateKey())
                .addValue("calendar_date", row.calendarDate())
                .addValue("report_period", row.reportPeriod() == null ? row.dateKey() : row.reportPeriod())
                .addValue("last_updated", row.lastUpdated())
                .addValue("revenue", DecimalSanitizer.sanitize(row.revenue(), DecimalColumn.MONEY, key, "revenue"))
                .addValue("net_income", DecimalSanitizer.sanitize(row.netIncome(), DecimalColumn.MONEY, key, "net_income"))
                .addValue("ebitda", DecimalSanitizer.sanitize(row.ebitda(), DecimalColumn.MONEY, key, "ebitda"))
                .addValue("fcf", DecimalSanitizer.sanitize(row.fcf(), DecimalColumn.MONEY, key, "fcf"))
                .addValue("roic", DecimalSanitizer.sanitize(row.roic(), DecimalColumn.RATIO, key, "roic"))
                .addValue("pe_ratio", DecimalSanitizer.sanitize(row.pe(), DecimalColumn.RATIO, key, "pe_ratio"))
                .addValue("ev_ebit", DecimalSanitizer.sanitize(row.evEbit(), DecimalColumn.RATIO, key, "ev_ebit"))
                .addValue("pb_ratio", DecimalSanitizer.sanitize(row.pb(), DecimalColumn.RATIO, key, "pb_ratio"))
                .addValue("debt_to_equity", DecimalSanitizer.sanitize(row.debtToEquity(), DecimalColumn.RATIO, key, "debt_to_equity"))
                .addValue("market_cap", DecimalSanitizer.sanitize(row.marketCap(), DecimalColumn.MONEY, key, "market_cap"))
                .addValue("enterprise_value", DecimalSanitizer.sanitize(row.ev(), DecimalColumn.MONEY, key, "enterprise_value"))
                .addValue("price", DecimalSanitizer.sanitize(row.price(), DecimalColumn.PRICE, key, "price"));
        });
    }

    public int upsertDailyPrices(List<DailyPriceRow> rows) {
        List<DailyPriceRow> known = retainKnown("daily_prices", rows, this::findExistingCompanyTickers);
        return writeInChunks("daily_prices", dailyPricesUpsert, known, row -> {
            String key = row.ticker() + "/" + row.date();
            return priceParams(row, key)
                .addValue("market_cap", DecimalSanitizer.sanitize(row.marketCap(), DecimalColumn.MONEY, key, "market_cap"))
                .addValue("enterprise_value", DecimalSanitizer.sanitize(row.ev(), DecimalColumn.MONEY, key, "enterprise_value"))
                .addValue("pe_ratio", DecimalSanitizer.sanitize(row.pe(), DecimalColumn.RATIO, key, "pe_ratio"))
                .addValue("pb_ratio", DecimalSanitizer.sanitize(row.pb(), DecimalColumn.RATIO, key, "pb_ratio"));
        });
    }

    public int upsertBenchmarkPrices(List<DailyPriceRow> rows) {
        List<DailyPriceRow> known = retainKnown("benchmark_prices", rows, this::findExistingBenchmarkTickers);
        return writeInChunks("benchmark_prices", benchmarkPricesUpsert, known,
            row -> priceParams(row, row.ticker() + "/" + row.date()));
    }

    public int upsertIndexMembership(List<IndexMembershipRow> rows) {
        return writeInChunks("index_membership", membershipUpsert, rows, row -> new MapSqlParameterSource()
            .addValue("ticker", row.ticker())
            .addValue("date", row.date())
            .addValue("action", row.action())
            .addValue("name", row.name())
            .addValue("contra_ticker", row.contraTicker())
            .addValue("contra_name", row.contraName())
        );
    }

    public LocalDate fundamentalsWatermark() {
        return watermark("SELECT MAX(last_updated) FROM fundamentals");
    }

    public LocalDate dailyPricesWatermark() {
        return watermark("SELECT MAX(date) FROM daily_prices");
    }

    public LocalDate benchmarkPricesWatermark() {
        return watermark("SELECT MAX(date) FROM benchmark_prices");
    }

    public LocalDate indexMembershipWatermark() {
        return watermark("SELECT MAX(date) FROM index_membership");
    }

    public boolean companyExists(String ticker) {
        if (ticker == null || ticker.isBlank()) {
            return false;
        }
        Long count = jdbc.queryForObject(
            "SELECT COUNT(*) FROM companies WHERE ticker = :ticker",
            new MapSqlParameterSource("ticker", ticker.trim().toUpperCase(Locale.ROOT)),
            Long.class
        );
        return count != null && count > 0;
    }

    public Set<String> findExistingCompanyTickers(Collection<String> tickers) {
        return findExisting("companies", tickers);
    }

    public Set<String> findExistingBenchmarkTickers(Collection<String> tickers) {
        return findExisting("benchmarks", tickers);
    }

    public List<String> findActiveTickers() {
        return jdbc.getJdbcTemplate().queryForList(
            """
                SELECT ticker
                FROM companies
                WHERE active = TRUE
                ORDER BY ticker
                """,
            String.class
        );
    }

    public List<String> findBenchmarkTickers() {
        return jdbc.getJdbcTemplate().queryForList("SELECT ticker FROM benchmarks ORDER BY ticker", String.class);
    }

    private MapSqlParameterSource priceParams(DailyPriceRow row, String key) {
        return new MapSqlParameterSource()
            .addValue("ticker", row.ticker())
            .addValue("date", row.date())
            .addValue("open", DecimalSanitizer.sanitize(row.open(), DecimalColumn.PRICE, key, "open"))
            .addValue("high", DecimalSanitizer.sanitize(row.high(), DecimalColumn.PRICE, key, "high"))
            .addValue("low", DecimalSanitizer.sanitize(row.low(), DecimalColumn.PRICE, key, "low"))
            .addValue("close", DecimalSanitizer.sanitize(row.close(), DecimalColumn.PRICE, key, "close"))
            .addValue("volume", row.volume())
            .addValue("dividends", DecimalSanitizer.sanitize(row.dividends(), DecimalColumn.PRICE, key, "dividends"))
            .addValue("close_unadj", DecimalSanitizer.sanitize(row.closeUnadj(), DecimalColumn.PRICE, key, "close_unadj"))
            .addValue("last_updated", row.lastUpdated());
    }

    /**
     * Writes rows in chunks of {@code loader.db.batch-size}, one transaction per chunk. A failed
     * chunk is logged and skipped; only a run where every chunk failed raises.
     */
    private <T> int writeInChunks(
        String target,
        String sql,
        List<T> rows,
        Function<T, MapSqlParameterSource> binder
    ) {
        if (rows == null || rows.isEmpty()) {
            return 0;
        }
        int batchSize = properties.getDb().getBatchSize();
        int written = 0;
        int failedChunks = 0;
        RuntimeException lastError = null;
        for (int start = 0; start < rows.size(); start += batchSize) {
            int end = Math.min(rows.size(), start + batchSize);
            List<T> chunk = rows.subList(start, end);
            try {
                MapSqlParameterSource[] params = chunk.stream()
                    .map(binder)
                    .toArray(MapSqlParameterSource[]::new);
                Integer count = chunkTransaction.execute(status -> {
                    jdbc.batchUpdate(sql, params);
                    return params.length;
                });
                written += count == null ? 0 : count;
            } catch (RuntimeException e) {
                failedChunks++;
                lastError = e;
                log.warn("Error in {} batch {}-{}: {}", target, start, end, e.getMessage());
            }
        }
        if (lastError != null && written == 0) {
            throw new BatchWriteException(target, failedChunks, lastError);
        }
        if (failedChunks > 0) {
            log.warn("{} upsert wrote {} of {} rows; {} chunk(s) failed", target, written, rows.size(), failedChunks);
        }
        return written;
    }

    private <T extends MarketDataRow> List<T> retainKnown(
        String target,
        List<T> rows,
        Function<Collection<String>, Set<String>> lookup
    ) {
        if (rows == null || rows.isEmpty()) {
            return List.of();
        }
        Set<String> tickers = new LinkedHashSet<>();
        for (T row : rows) {
            tickers.add(row.ticker());
        }
        Set<String> existing = lookup.apply(tickers);
        List<T> known = new ArrayList<>(rows.size());
        Set<String> unknown = new LinkedHashSet<>();
        for (T row : rows) {
            if (existing.contains(row.ticker())) {
                known.add(row);
            } else {
                unknown.add(row.ticker());
            }
        }
        if (!unknown.isEmpty()) {
            log.warn("Skipping {} {} row(s) for {} unknown ticker(s): {}",
                rows.size() - known.size(), target, unknown.size(), sample(unknown));
        }
        return known;
    }

    private Set<String> findExisting(String table, Collection<String> tickers) {
        if (tickers == null || tickers.isEmpty()) {
            return Set.of();
        }
        List<String> values = new ArrayList<>(tickers);
        Set<String> existing = new LinkedHashSet<>();
        for (int i = 0; i < values.size(); i += LOOKUP_BATCH_SIZE) {
            int end = Math.min(values.size(), i + LOOKUP_BATCH_SIZE);
            jdbc.query(
                "SELECT ticker FROM " + table + " WHERE ticker IN (:tickers)",
                new MapSqlParameterSource("tickers", values.subList(i, end)),
                rs -> {
                    String ticker = rs.getString("ticker");
                    if (ticker != null) {
                        existing.add(ticker);
                    }
                }
            );
        }
        return existing;
    }

    private LocalDate watermark(String sql) {
        Date value = jdbc.getJdbcTemplate().queryForObject(sql, Date.class);
        return value == null ? LocalDate.EPOCH : value.toLocalDate();
    }

    private String upsertSql(String table, List<String> keys, List<String> columns) {
        String columnList = String.join(", ", columns);
        String valueList = ":" + String.join(", :", columns);
        if (!postgres) {
            return "MERGE INTO " + table + " (" + columnList + ", updated_at) KEY (" + String.join(", ", keys) + ")"
                + " VALUES (" + valueList + ", CURRENT_TIMESTAMP)";
        }
        StringBuilder updates = new StringBuilder();
        for (String column : columns) {
            if (keys.contains(column)) {
                continue;
            }
            updates.append(column).append(" = EXCLUDED.").append(column).append(", ");
        }
        updates.append("updated_at = CURRENT_TIMESTAMP");
        return "INSERT INTO " + table + " (" + columnList + ", updated_at) VALUES (" + valueList + ", CURRENT_TIMESTAMP)"
            + " ON CONFLICT (" + String.join(", ", keys) + ") DO UPDATE SET " + updates;
    }

    private static String sample(Collection<String> values) {
        List<String> sample = new ArrayList<>();
        for (String value : values) {
            if (sample.size() >= 10) {
                sample.add("...");
                break;
            }
            sample.add(value);
        }
        return String.join(",", sample);
    }

    private boolean detectPostgres(NamedParameterJdbcTemplate jdbcTemplate) {
        if (jdbcTemplate.getJdbcTemplate().getDataSource() == null) {
            return false;
        }
        try (Connection connection = jdbcTemplate.getJdbcTemplate().getDataSource().getConnection()) {
            DatabaseMetaData metaData = connection.getMetaData();
            String productName = metaData == null ? null : metaData.getDatabaseProductName();
            String url = metaData == null ? null : metaData.getURL();
            if (url != null && url.toLowerCase(Locale.ROOT).startsWith("jdbc:h2:")) {
                return false;
            }
            return productName != null && productName.toLowerCase(Locale.ROOT).contains("postgres");
        } catch (Exception e) {
            log.warn("Unable to detect database product; defaulting to MERGE upserts", e);
            return false;
        }
    }
}
