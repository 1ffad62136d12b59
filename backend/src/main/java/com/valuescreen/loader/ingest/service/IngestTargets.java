package com.valuescreen.loader.ingest.service;

import com.valuescreen.loader.ingest.model.DailyPriceRow;
import com.valuescreen.loader.ingest.model.FundamentalsRow;
import com.valuescreen.loader.ingest.model.IndexMembershipRow;
import com.valuescreen.loader.ingest.model.IngestTable;
import com.valuescreen.loader.ingest.model.TickerRow;
import com.valuescreen.loader.ingest.parse.DatatableParser;
import com.valuescreen.loader.ingest.persistence.MarketDataJdbcRepository;
import org.springframework.stereotype.Component;

@Component
public class IngestTargets {
    private final IngestTarget<TickerRow> tickers;
    private final IngestTarget<FundamentalsRow> fundamentals;
    private final IngestTarget<DailyPriceRow> dailyPrices;
    private final IngestTarget<DailyPriceRow> benchmarkPrices;
    private final IngestTarget<IndexMembershipRow> indexMembership;

    public IngestTargets(DatatableParser parser, MarketDataJdbcRepository repository) {
        this.tickers = IngestTarget.of("companies", IngestTable.TICKERS.datatable(),
            parser::parseTickers, repository::upsertCompanies);
        this.fundamentals = IngestTarget.of("fundamentals", IngestTable.FUNDAMENTALS.datatable(),
            parser::parseFundamentals, repository::upsertFundamentals);
        this.dailyPrices = IngestTarget.of("daily_prices", IngestTable.DAILY.datatable(),
            parser::parseDailyPrices, repository::upsertDailyPrices);
        this.benchmarkPrices = IngestTarget.of("benchmark_prices", IngestTable.BENCHMARKS.datatable(),
            parser::parseDailyPrices, repository::upsertBenchmarkPrices);
        this.indexMembership = IngestTarget.of("index_membership", IngestTable.INDEX_MEMBERSHIP.datatable(),
            parser::parseIndexMembership, repository::upsertIndexMembership);
    }

    public IngestTarget<TickerRow> tickers() {
        return tickers;
    }

    public IngestTarget<FundamentalsRow> fundamentals() {
        return fundamentals;
    }

    public IngestTarget<DailyPriceRow> dailyPrices() {
        return dailyPrices;
    }

    public IngestTarget<DailyPriceRow> benchmarkPrices() {
        return benchmarkPrices;
    }

    public IngestTarget<IndexMembershipRow> indexMembership() {
        return indexMembership;
    }
}
