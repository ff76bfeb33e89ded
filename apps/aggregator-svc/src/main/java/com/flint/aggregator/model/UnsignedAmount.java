package com.flint.aggregator.model;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Non-negative provider figure such as a ledger, available or owed amount. Has no arithmetic; net
 * worth is summed from {@link DisplayBalance}.
 */
public record UnsignedAmount(BigDecimal value) {

    public static final UnsignedAmount ZERO = new UnsignedAmount(BigDecimal.ZERO);

    public UnsignedAmount {
        if (value == null) {
            throw new IllegalArgumentException("value must not be null");
        }
        if (value.signum() < 0) {
            throw new IllegalArgumentException("value must not be negative: " + value);
        }
        value = value.setScale(2, RoundingMode.HALF_UP);
    }

    public static UnsignedAmount of(BigDecimal value) {
        return new UnsignedAmount(value);
    }

    public boolean isZero() {
        return value.signum() == 0;
    }

    @Override
    public String toString() {
        return value.toPlainString();
    }
}
