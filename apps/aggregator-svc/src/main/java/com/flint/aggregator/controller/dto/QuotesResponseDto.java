package com.flint.aggregator.controller.dto;

import java.util.List;

public record QuotesResponseDto(List<QuoteResponseDto> quotes, String traceId) {
}
