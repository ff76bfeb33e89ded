package com.flint.aggregator.model;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

/**
 * One row per user per calendar day. {@code debtBalance} is the positive amount owed;
 * {@code totalBalance} already has it subtracted.
 */
public record NetWorthSnapshot(
        UUID userId,
        LocalDate date,
        BigDecimal totalBalance,
        BigDecimal bankBalance,
        BigDecimal investmentBalance,
        BigDecimal cryptoBalance,
        BigDecimal debtBalance,
        Instant createdAt
) {
}
