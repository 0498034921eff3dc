package com.updownbacktest.backtester.domain;

import java.math.BigDecimal;

/**
 * Conversions between integer cents and decimal dollars.
 */
public final class Prices {

    public static final BigDecimal ONE_DOLLAR = new BigDecimal("1.00");

    private Prices() {
    }

    public static BigDecimal toDecimal(int cents) {
        return BigDecimal.valueOf(cents, 2);
    }

    public static double toUnit(int cents) {
        return cents / 100.0;
    }
}
