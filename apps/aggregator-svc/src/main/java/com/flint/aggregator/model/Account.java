package com.flint.aggregator.model;

import java.time.Instant;
import java.util.Optional;

/**
 * Canonical account shape shared by every provider.
 *
 * <p>For credit accounts {@code displayBalance == -owed}; for every other type it is the
 * non-negative available (or ledger) figure, and for investment accounts {@code cash + holdings}.
 * A successful re-fetch replaces the whole record.
 */
public record Account(
        String id,
        AccountProvider provider,
        String institution,
        String name,
        AccountType accountType,
        String accountSubtype,
        String currency,
        String lastFour,
        DisplayBalance displayBalance,
        UnsignedAmount ledger,
        UnsignedAmount available,
        Optional<UnsignedAmount> owed,
        Optional<UnsignedAmount> availableCredit,
        Optional<UnsignedAmount> holdings,
        ConnectionStatus status,
        Instant lastCheckedAt
) {

    public Account {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("id must be provided");
        }
        if (provider == null || accountType == null || status == null) {
            throw new IllegalArgumentException("provider, accountType and status must be provided");
        }
        owed = owed == null ? Optional.empty() : owed;
        availableCredit = availableCredit == null ? Optional.empty() : availableCredit;
        holdings = holdings == null ? Optional.empty() : holdings;
    }

    public boolean isCredit() {
        return accountType == AccountType.CREDIT;
    }

    public boolean isActive() {
        return status.isActive();
    }

    public Account withStatus(ConnectionStatus newStatus) {
        return new Account(id, provider, institution, name, accountType, accountSubtype, currency, lastFour,
                displayBalance, ledger, available, owed, availableCredit, holdings, newStatus, lastCheckedAt);
    }
}
