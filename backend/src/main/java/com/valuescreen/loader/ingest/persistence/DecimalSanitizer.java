package com.valuescreen.loader.ingest.persistence;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.math.RoundingMode;

public final class DecimalSanitizer {
    private static final Logger log = LoggerFactory.getLogger(DecimalSanitizer.class);

    private DecimalSanitizer() {
    }

    /**
     * Rounds to the column scale; a magnitude the column cannot hold becomes {@code null}.
     */
    public static BigDecimal sanitize(BigDecimal value, DecimalColumn column, String entityKey, String field) {
        if (value == null) {
            return null;
        }
        BigDecimal rounded = value.setScale(column.scale(), RoundingMode.HALF_UP);
        if (rounded.abs().compareTo(column.limit()) >= 0) {
            log.warn("Overflow: {}.{} = {} exceeds DECIMAL(18,{}); storing null",
                entityKey, field, value.toPlainString(), column.scale());
            return null;
        }
        return rounded;
    }
}
