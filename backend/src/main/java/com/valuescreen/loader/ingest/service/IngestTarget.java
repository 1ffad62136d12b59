package com.valuescreen.loader.ingest.service;

import com.valuescreen.loader.ingest.model.ColumnarResponse;

import java.util.List;
import java.util.function.Function;
import java.util.function.ToIntFunction;

/**
 * Per-table capability pair used by the streaming pipeline: how to read a page and where to write it.
 */
public interface IngestTarget<T> {
    String name();

    String datatable();

    List<T> parse(ColumnarResponse response);

    int upsert(List<T> rows);

    static <T> IngestTarget<T> of(
        String name,
        String datatable,
        Function<ColumnarResponse, List<T>> parser,
        ToIntFunction<List<T>> writer
    ) {
        return new IngestTarget<>() {
            @Override
            public String name() {
                return name;
            }

            @Override
            public String datatable() {
                return datatable;
            }

            @Override
            public List<T> parse(ColumnarResponse response) {
                return parser.apply(response);
            }

            @Override
            public int upsert(List<T> rows) {
                return writer.applyAsInt(rows);
            }
        };
    }
}
