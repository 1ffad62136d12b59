package com.valuescreen.loader.ingest.parse;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Locale;

/**
 * One positional data row viewed through a {@link ColumnIndex}. Every accessor returns
 * {@code null} for a missing column, a short row, a null cell or a value of the wrong shape.
 */
public final class ColumnarRow {
    private static final int DATE_LENGTH = 10;
    private static final DateTimeFormatter DATE_LAYOUT = DateTimeFormatter.ofPattern("yyyy-MM-dd");
    private static final DateTimeFormatter ISO_MILLIS_LAYOUT = DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss.SSS'Z'");
    private static final DateTimeFormatter SPACED_LAYOUT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private final ColumnIndex index;
    private final List<Object> values;

    public ColumnarRow(ColumnIndex index, List<Object> values) {
        this.index = index;
        this.values = values == null ? List.of() : values;
    }

    public Object raw(String column) {
        int position = index.indexOf(column);
        if (position < 0 || position >= values.size()) {
            return null;
        }
        return values.get(position);
    }

    public String string(String column) {
        Object value = raw(column);
        if (value == null) {
            return null;
        }
        if (value instanceof String s) {
            return s;
        }
        if (value instanceof BigDecimal decimal) {
            return decimal.toPlainString();
        }
        return String.valueOf(value);
    }

    public BigDecimal decimal(String column) {
        Object value = raw(column);
        if (value == null) {
            return null;
        }
        if (value instanceof BigDecimal decimal) {
            return decimal;
        }
        if (value instanceof BigInteger integer) {
            return new BigDecimal(integer);
        }
        if (value instanceof Double || value instanceof Float) {
            double d = ((Number) value).doubleValue();
            if (Double.isNaN(d) || Double.isInfinite(d)) {
                return null;
            }
            return BigDecimal.valueOf(d);
        }
        if (value instanceof Number number) {
            return BigDecimal.valueOf(number.longValue());
        }
        if (value instanceof String s) {
            String trimmed = s.trim();
            if (trimmed.isEmpty()) {
                return null;
            }
            try {
                return new BigDecimal(trimmed);
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }

    public Long longValue(String column) {
        Object value = raw(column);
        if (value == null) {
            return null;
        }
        if (value instanceof Long l) {
            return l;
        }
        if (value instanceof Integer || value instanceof Short || value instanceof Byte) {
            return ((Number) value).longValue();
        }
        BigDecimal decimal = value instanceof String ? decimal(column) : asDecimal(value);
        if (decimal == null) {
            return null;
        }
        try {
            return decimal.stripTrailingZeros().longValueExact();
        } catch (ArithmeticException e) {
            return null;
        }
    }

    /**
     * Absent or unrecognized values read as {@code false}.
     */
    public boolean bool(String column) {
        Object value = raw(column);
        if (value == null) {
            return false;
        }
        if (value instanceof Boolean b) {
            return b;
        }
        if (value instanceof Number number) {
            return number.doubleValue() != 0.0d;
        }
        if (value instanceof String s) {
            String normalized = s.trim().toLowerCase(Locale.ROOT);
            return normalized.equals("y")
                || normalized.equals("true")
                || normalized.equals("yes")
                || normalized.equals("1");
        }
        return false;
    }

    public LocalDate date(String column) {
        String value = string(column);
        if (value == null || value.isBlank()) {
            return null;
        }
        LocalDateTime parsed = parseDateOrTimestamp(value.trim());
        return parsed == null ? null : parsed.toLocalDate();
    }

    public LocalDateTime timestamp(String column) {
        String value = string(column);
        if (value == null || value.isBlank()) {
            return null;
        }
        return parseDateOrTimestamp(value.trim());
    }

    private static LocalDateTime parseDateOrTimestamp(String value) {
        try {
            if (value.length() == DATE_LENGTH) {
                return LocalDate.parse(value, DATE_LAYOUT).atStartOfDay();
            }
            if (value.indexOf('T') > 0) {
                return LocalDateTime.parse(value, ISO_MILLIS_LAYOUT);
            }
            return LocalDateTime.parse(value, SPACED_LAYOUT);
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    private static BigDecimal asDecimal(Object value) {
        if (value instanceof BigDecimal decimal) {
            return decimal;
        }
        if (value instanceof BigInteger integer) {
            return new BigDecimal(integer);
        }
        if (value instanceof Number number) {
            double d = number.doubleValue();
            if (Double.isNaN(d) || Double.isInfinite(d)) {
                return null;
            }
            return BigDecimal.valueOf(d);
        }
        return null;
    }
}
