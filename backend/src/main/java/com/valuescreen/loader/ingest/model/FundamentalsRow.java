package com.valuescreen.loader.ingest.model;

import java.math.BigDecimal;
import java.time.LocalDate;

public record FundamentalsRow(
    String ticker,
    String dimension,
    LocalDate calendarDate,
    LocalDate dateKey,
    LocalDate reportPeriod,
    LocalDate lastUpdated,
    BigDecimal revenue,
    BigDecimal netIncome,
    BigDecimal ebitda,
    BigDecimal fcf,
    BigDecimal roic,
    BigDecimal pe,
    BigDecimal evEbit,
    BigDecimal pb,
    BigDecimal debtToEquity,
    BigDecimal marketCap,
    BigDecimal ev,
    BigDecimal price
) implements MarketDataRow {
}
