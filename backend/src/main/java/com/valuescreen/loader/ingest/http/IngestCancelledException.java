package com.valuescreen.loader.ingest.http;

public class IngestCancelledException extends RuntimeException {
    public IngestCancelledException(String message) {
        super(message);
    }
}
