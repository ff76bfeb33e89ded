package com.flint.aggregator.service;

import java.math.BigDecimal;

/**
 * {@code debt} is the positive amount owed; {@code total} already has it subtracted.
 */
public record NetWorthBreakdown(
        BigDecimal total,
        BigDecimal bank,
        BigDecimal investment,
        BigDecimal crypto,
        BigDecimal debt
) {
}
