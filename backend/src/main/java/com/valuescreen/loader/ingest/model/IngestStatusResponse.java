package com.valuescreen.loader.ingest.model;

import java.time.Instant;
import java.util.Map;

public record IngestStatusResponse(
    Instant generatedAt,
    boolean dbConnectivity,
    Map<String, Long> counts,
    Map<String, String> lastUpdates,
    Map<String, Boolean> activeRuns
) {
}
