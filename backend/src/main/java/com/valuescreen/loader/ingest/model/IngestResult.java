package com.valuescreen.loader.ingest.model;

import java.time.Duration;

public record IngestResult(
    boolean success,
    String message,
    long count,
    Duration elapsed
) {
    public static IngestResult ok(String message, long count, Duration elapsed) {
        return new IngestResult(true, message, count, elapsed);
    }

    public static IngestResult failed(String message, long count, Duration elapsed) {
        return new IngestResult(false, message, count, elapsed);
    }
}
