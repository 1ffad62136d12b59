package com.valuescreen.loader.ingest.parse;

import com.valuescreen.loader.ingest.model.ColumnarResponse;

import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Column name to position lookup, built once per response. Names are matched case-insensitively.
 */
public final class ColumnIndex {
    private final Map<String, Integer> positions;

    private ColumnIndex(Map<String, Integer> positions) {
        this.positions = positions;
    }

    public static ColumnIndex of(List<ColumnarResponse.Column> columns) {
        Map<String, Integer> positions = new HashMap<>();
        if (columns != null) {
            for (int i = 0; i < columns.size(); i++) {
                ColumnarResponse.Column column = columns.get(i);
                if (column == null || column.name() == null) {
                    continue;
                }
                positions.putIfAbsent(column.name().trim().toLowerCase(Locale.ROOT), i);
            }
        }
        return new ColumnIndex(positions);
    }

    /**
     * Returns the column position, or -1 when the column is absent.
     */
    public int indexOf(String name) {
        if (name == null) {
            return -1;
        }
        Integer position = positions.get(name.toLowerCase(Locale.ROOT));
        return position == null ? -1 : position;
    }

    public boolean has(String name) {
        return indexOf(name) >= 0;
    }

    public int size() {
        return positions.size();
    }
}
