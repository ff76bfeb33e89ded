package com.flint.aggregator.controller.dto;

import com.flint.aggregator.model.Account;
import com.flint.aggregator.model.UnsignedAmount;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.Optional;

public record AccountResponseDto(
        String id,
        String provider,
        String institution,
        String name,
        String accountType,
        String accountSubtype,
        String currency,
        String lastFour,
        BigDecimal displayBalance,
        BigDecimal ledger,
        BigDecimal available,
        BigDecimal owed,
        BigDecimal availableCredit,
        BigDecimal holdings,
        String status,
        Instant lastCheckedAt
) {

    public static AccountResponseDto from(Account account) {
        return new AccountResponseDto(
                account.id(),
                account.provider().key(),
                account.institution(),
                account.name(),
                account.accountType().name().toLowerCase(),
                account.accountSubtype(),
                account.currency(),
                account.lastFour(),
                account.displayBalance().value(),
                account.ledger().value(),
                account.available().value(),
                valueOf(account.owed()),
                valueOf(account.availableCredit()),
                valueOf(account.holdings()),
                account.status().name().toLowerCase(),
                account.lastCheckedAt()
        );
    }

    private static BigDecimal valueOf(Optional<UnsignedAmount> amount) {
        return amount.map(UnsignedAmount::value).orElse(null);
    }
}
