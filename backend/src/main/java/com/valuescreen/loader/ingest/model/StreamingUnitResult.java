package com.valuescreen.loader.ingest.model;

import java.util.List;

public record StreamingUnitResult(
    String unit,
    long rowsWritten,
    String fetchError,
    List<String> writeErrors
) {
    public boolean hasErrors() {
        return fetchError != null || (writeErrors != null && !writeErrors.isEmpty());
    }

    /**
     * A unit failed only when nothing was written and something went wrong.
     */
    public boolean failed() {
        return rowsWritten == 0 && hasErrors();
    }

    public String firstError() {
        if (fetchError != null) {
            return fetchError;
        }
        if (writeErrors != null && !writeErrors.isEmpty()) {
            return writeErrors.get(0);
        }
        return null;
    }
}
