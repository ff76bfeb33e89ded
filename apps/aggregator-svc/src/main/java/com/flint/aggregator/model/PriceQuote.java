package com.flint.aggregator.model;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Near-real-time quote for one symbol. A quote without {@code lastUpdated} means no source has
 * ever answered for the symbol; a zero price with a timestamp means the latest refresh failed.
 */
public record PriceQuote(
        String symbol,
        BigDecimal price,
        BigDecimal change,
        BigDecimal changePercent,
        Long volume,
        BigDecimal marketCap,
        String source,
        Instant lastUpdated
) {

    public static final String NO_SOURCE = "none";

    public static PriceQuote unavailable(String symbol, Instant lastUpdated) {
        return new PriceQuote(symbol, BigDecimal.ZERO, BigDecimal.ZERO, BigDecimal.ZERO, null, null, NO_SOURCE, lastUpdated);
    }

    public boolean hasData() {
        return !NO_SOURCE.equals(source);
    }
}
