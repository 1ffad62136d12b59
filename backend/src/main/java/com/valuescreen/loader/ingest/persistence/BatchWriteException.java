package com.valuescreen.loader.ingest.persistence;

/**
 * Raised when every chunk of an upsert failed and nothing was written.
 */
public class BatchWriteException extends RuntimeException {
    private final String target;
    private final int failedChunks;

    public BatchWriteException(String target, int failedChunks, Throwable cause) {
        super("All " + failedChunks + " chunk(s) of " + target + " failed: "
            + (cause == null ? "unknown error" : cause.getMessage()), cause);
        this.target = target;
        this.failedChunks = failedChunks;
    }

    public String target() {
        return target;
    }

    public int failedChunks() {
        return failedChunks;
    }
}
