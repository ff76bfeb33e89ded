package com.flint.aggregator.normalize;

/**
 * One holding as reported by a brokerage or wallet provider. {@code marketValue} wins over
 * {@code units * price} when both are present.
 */
public record RawPosition(String symbol, String units, String price, String marketValue) {
}
