package com.flint.aggregator.controller.dto;

import java.math.BigDecimal;
import java.util.List;

public record AccountsListResponseDto(
        String currency,
        BigDecimal netWorth,
        List<AccountResponseDto> accounts,
        String traceId
) {
}
