package com.valuescreen.loader.ingest.http;

import java.util.List;

public record PageBatch<T>(List<T> rows, DatatableFetchException error) {
    public static <T> PageBatch<T> of(List<T> rows) {
        return new PageBatch<>(rows == null ? List.of() : List.copyOf(rows), null);
    }

    public static <T> PageBatch<T> failed(DatatableFetchException error) {
        return new PageBatch<>(List.of(), error);
    }

    public boolean isError() {
        return error != null;
    }
}
