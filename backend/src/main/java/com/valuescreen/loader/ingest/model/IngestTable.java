package com.valuescreen.loader.ingest.model;

import java.util.Locale;

public enum IngestTable {
    TICKERS("SHARADAR/TICKERS"),
    FUNDAMENTALS("SHARADAR/SF1"),
    DAILY("SHARADAR/DAILY"),
    BENCHMARKS("SHARADAR/DAILY"),
    INDEX_MEMBERSHIP("SHARADAR/SP500");

    private final String datatable;

    IngestTable(String datatable) {
        this.datatable = datatable;
    }

    public String datatable() {
        return datatable;
    }

    public String key() {
        return name().toLowerCase(Locale.ROOT).replace('_', '-');
    }

    public static IngestTable fromKey(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("table is required");
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT).replace('_', '-');
        if (normalized.equals("prices")) {
            return DAILY;
        }
        if (normalized.equals("sp500") || normalized.equals("membership")) {
            return INDEX_MEMBERSHIP;
        }
        for (IngestTable table : values()) {
            if (table.key().equals(normalized)) {
                return table;
            }
        }
        throw new IllegalArgumentException("unknown table: " + raw);
    }
}
