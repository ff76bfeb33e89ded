package com.flint.aggregator.controller.dto;

import com.flint.aggregator.model.PriceQuote;
import java.math.BigDecimal;
import java.time.Instant;

public record QuoteResponseDto(
        String symbol,
        BigDecimal price,
        BigDecimal change,
        BigDecimal changePercent,
        Long volume,
        BigDecimal marketCap,
        String source,
        Instant lastUpdated
) {

    public static QuoteResponseDto from(PriceQuote quote) {
        return new QuoteResponseDto(
                quote.symbol(),
                quote.price(),
                quote.change(),
                quote.changePercent(),
                quote.volume(),
                quote.marketCap(),
                quote.source(),
                quote.lastUpdated()
        );
    }
}
