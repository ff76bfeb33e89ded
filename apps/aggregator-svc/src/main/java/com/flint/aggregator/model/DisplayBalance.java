package com.flint.aggregator.model;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Collection;

/**
 * Signed contribution of one account to net worth: debt is negative, assets are non-negative.
 * The only balance type with addition.
 */
public record DisplayBalance(BigDecimal value) {

    public static final DisplayBalance ZERO = new DisplayBalance(BigDecimal.ZERO);

    public DisplayBalance {
        if (value == null) {
            throw new IllegalArgumentException("value must not be null");
        }
        value = value.setScale(2, RoundingMode.HALF_UP);
    }

    public static DisplayBalance asset(UnsignedAmount amount) {
        return new DisplayBalance(amount.value());
    }

    public static DisplayBalance debt(UnsignedAmount owed) {
        return new DisplayBalance(owed.value().negate());
    }

    public DisplayBalance plus(DisplayBalance other) {
        return new DisplayBalance(value.add(other.value));
    }

    public static DisplayBalance sum(Collection<Account> accounts) {
        return accounts.stream()
                .map(Account::displayBalance)
                .reduce(ZERO, DisplayBalance::plus);
    }

    @Override
    public String toString() {
        return value.toPlainString();
    }
}
