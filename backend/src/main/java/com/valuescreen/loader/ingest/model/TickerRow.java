package com.valuescreen.loader.ingest.model;

import java.time.LocalDate;

public record TickerRow(
    String ticker,
    String name,
    String exchange,
    String sector,
    String industry,
    String scaleRevenue,
    boolean delisted,
    LocalDate lastUpdated
) implements MarketDataRow {
}
