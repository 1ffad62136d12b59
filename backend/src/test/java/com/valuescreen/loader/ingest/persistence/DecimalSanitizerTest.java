package com.valuescreen.loader.ingest.persistence;

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.assertj.core.api.Assertions.assertThat;

class DecimalSanitizerTest {

    @Test
    void roundsHalfUpToColumnScale() {
        assertThat(DecimalSanitizer.sanitize(new BigDecimal("1.005"), DecimalColumn.MONEY, "AAPL", "revenue"))
            .isEqualByComparingTo("1.01");
        assertThat(DecimalSanitizer.sanitize(new BigDecimal("0.123456789"), DecimalColumn.PRICE, "AAPL", "close"))
            .isEqualByComparingTo("0.123457");
        assertThat(DecimalSanitizer.sanitize(new BigDecimal("-3.14159"), DecimalColumn.RATIO, "AAPL", "pe"))
            .isEqualByComparingTo("-3.1416");
    }

    @Test
    void valuesAtOrBeyondColumnLimitBecomeNull() {
        assertThat(DecimalSanitizer.sanitize(new BigDecimal("1E17"), DecimalColumn.MONEY, "AAPL", "revenue")).isNull();
        assertThat(DecimalSanitizer.sanitize(new BigDecimal("1E16"), DecimalColumn.MONEY, "AAPL", "revenue")).isNull();
        assertThat(DecimalSanitizer.sanitize(new BigDecimal("-1E14"), DecimalColumn.RATIO, "AAPL", "pe")).isNull();
        assertThat(DecimalSanitizer.sanitize(new BigDecimal("999999999999.9999996"), DecimalColumn.PRICE, "AAPL", "close"))
            .isNull();
    }

    @Test
    void largestStorableValueIsKept() {
        assertThat(DecimalSanitizer.sanitize(new BigDecimal("9999999999999999.99"), DecimalColumn.MONEY, "AAPL", "revenue"))
            .isEqualByComparingTo("9999999999999999.99");
        assertThat(DecimalSanitizer.sanitize(null, DecimalColumn.MONEY, "AAPL", "revenue")).isNull();
    }
}
