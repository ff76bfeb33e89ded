package com.flint.aggregator.normalize;

import java.util.List;

/**
 * Provider balance payload with numeric fields kept as the provider sent them (usually strings).
 * Bank balances use {@code ledger}/{@code available}; brokerage balances use {@code cash},
 * {@code total} and {@code positions}; wallets only {@code positions}.
 */
public record RawBalance(
        String ledger,
        String available,
        String cash,
        String total,
        List<RawPosition> positions
) {

    public RawBalance {
        positions = positions == null ? List.of() : List.copyOf(positions);
    }

    public static RawBalance bank(String ledger, String available) {
        return new RawBalance(ledger, available, null, null, List.of());
    }

    public static RawBalance investment(String cash, String total, List<RawPosition> positions) {
        return new RawBalance(null, null, cash, total, positions);
    }

    public static RawBalance wallet(List<RawPosition> positions) {
        return new RawBalance(null, null, null, null, positions);
    }

    public static RawBalance empty() {
        return new RawBalance(null, null, null, null, List.of());
    }
}
