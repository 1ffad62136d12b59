package com.valuescreen.loader.ingest.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record ColumnarResponse(Datatable datatable, Meta meta) {

    public static ColumnarResponse of(List<Column> columns, List<List<Object>> data) {
        return new ColumnarResponse(new Datatable(columns, data), new Meta(null));
    }

    public List<Column> columns() {
        if (datatable == null || datatable.columns() == null) {
            return List.of();
        }
        return datatable.columns();
    }

    public List<List<Object>> data() {
        if (datatable == null || datatable.data() == null) {
            return List.of();
        }
        return datatable.data();
    }

    public String nextCursorId() {
        if (meta == null || meta.nextCursorId() == null || meta.nextCursorId().isBlank()) {
            return null;
        }
        return meta.nextCursorId();
    }

    public ColumnarResponse withColumns(List<Column> columns) {
        return new ColumnarResponse(new Datatable(columns, data()), meta);
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Datatable(List<Column> columns, List<List<Object>> data) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Column(String name, String type) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Meta(@JsonProperty("next_cursor_id") String nextCursorId) {
    }
}
