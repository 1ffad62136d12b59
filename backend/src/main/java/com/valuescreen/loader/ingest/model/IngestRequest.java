package com.valuescreen.loader.ingest.model;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

public record IngestRequest(
    List<String> tickers,
    Boolean full,
    List<String> dimensions,
    Boolean sp500Only
) {
    public static IngestRequest defaults() {
        return new IngestRequest(null, null, null, null);
    }

    public List<String> normalizedTickers() {
        return normalize(tickers);
    }

    public List<String> normalizedDimensions() {
        return normalize(dimensions);
    }

    public boolean isFull() {
        return Boolean.TRUE.equals(full);
    }

    public boolean isSp500Only() {
        return Boolean.TRUE.equals(sp500Only);
    }

    /**
     * Splits comma-separated entries, trims, upper-cases and de-duplicates while keeping order.
     */
    public static List<String> normalize(List<String> values) {
        if (values == null || values.isEmpty()) {
            return List.of();
        }
        Set<String> normalized = new LinkedHashSet<>();
        for (String value : values) {
            if (value == null) {
                continue;
            }
            for (String part : value.split(",")) {
                String trimmed = part.trim();
                if (!trimmed.isEmpty()) {
                    normalized.add(trimmed.toUpperCase(Locale.ROOT));
                }
            }
        }
        return new ArrayList<>(normalized);
    }
}
