package com.valuescreen.loader.ingest.model;

import java.time.LocalDate;

public record IndexMembershipRow(
    LocalDate date,
    String action,
    String ticker,
    String name,
    String contraTicker,
    String contraName
) implements MarketDataRow {
}
