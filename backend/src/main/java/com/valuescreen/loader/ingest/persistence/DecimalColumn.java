package com.valuescreen.loader.ingest.persistence;

import java.math.BigDecimal;

/**
 * Fixed-precision storage kinds. A value must stay strictly below {@code limit} in magnitude.
 */
public enum DecimalColumn {
    MONEY(2, BigDecimal.TEN.pow(16)),
    RATIO(4, BigDecimal.TEN.pow(14)),
    PRICE(6, BigDecimal.TEN.pow(12));

    private final int scale;
    private final BigDecimal limit;

    DecimalColumn(int scale, BigDecimal limit) {
        this.scale = scale;
        this.limit = limit;
    }

    public int scale() {
        return scale;
    }

    public BigDecimal limit() {
        return limit;
    }
}
