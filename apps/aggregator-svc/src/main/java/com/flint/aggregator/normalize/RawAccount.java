package com.flint.aggregator.normalize;

/**
 * Provider account fields the normalizer reads, before any interpretation.
 */
public record RawAccount(
        String id,
        String name,
        String type,
        String subtype,
        String institution,
        String currency,
        String lastFour
) {
}
