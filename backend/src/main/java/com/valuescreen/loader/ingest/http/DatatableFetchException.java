package com.valuescreen.loader.ingest.http;

/**
 * A page request that failed for good, either non-retryably or after its attempts ran out.
 * {@code reason} is a short code such as {@code http_500}, {@code timeout} or {@code decode_error}.
 */
public class DatatableFetchException extends RuntimeException {
    private final String reason;
    private final int statusCode;
    private final boolean retryable;

    public DatatableFetchException(String reason, int statusCode, boolean retryable, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
        this.statusCode = statusCode;
        this.retryable = retryable;
    }

    public DatatableFetchException(String reason, int statusCode, boolean retryable, String message) {
        this(reason, statusCode, retryable, message, null);
    }

    public String reason() {
        return reason;
    }

    public int statusCode() {
        return statusCode;
    }

    public boolean retryable() {
        return retryable;
    }
}
