package com.flint.aggregator.controller.dto;

import java.util.List;

public record RefreshResponseDto(
        List<AccountResponseDto> accounts,
        List<ConnectionFailureDto> failures,
        String traceId
) {
}
