package com.flint.aggregator.controller.dto;

import com.flint.aggregator.model.NetWorthSnapshot;
import java.math.BigDecimal;
import java.time.LocalDate;

public record SnapshotResponseDto(
        LocalDate date,
        BigDecimal totalBalance,
        BigDecimal bankBalance,
        BigDecimal investmentBalance,
        BigDecimal cryptoBalance,
        BigDecimal debtBalance
) {

    public static SnapshotResponseDto from(NetWorthSnapshot snapshot) {
        return new SnapshotResponseDto(
                snapshot.date(),
                snapshot.totalBalance(),
                snapshot.bankBalance(),
                snapshot.investmentBalance(),
                snapshot.cryptoBalance(),
                snapshot.debtBalance()
        );
    }
}
