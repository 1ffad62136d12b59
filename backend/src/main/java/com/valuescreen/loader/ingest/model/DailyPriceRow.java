package com.valuescreen.loader.ingest.model;

import java.math.BigDecimal;
import java.time.LocalDate;

public record DailyPriceRow(
    String ticker,
    LocalDate date,
    BigDecimal open,
    BigDecimal high,
    BigDecimal low,
    BigDecimal close,
    Long volume,
    BigDecimal dividends,
    BigDecimal closeUnadj,
    BigDecimal marketCap,
    BigDecimal ev,
    BigDecimal pe,
    BigDecimal pb,
    LocalDate lastUpdated
) implements MarketDataRow {
}
