package com.valuescreen.loader.ingest.model;

public interface MarketDataRow {
    String ticker();
}
