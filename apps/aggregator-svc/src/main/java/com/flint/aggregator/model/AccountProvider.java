package com.flint.aggregator.model;

import java.util.Locale;

public enum AccountProvider {
    BANK,
    BROKERAGE,
    WALLET;

    /**
     * Parses the lower-case form used in URLs, e.g. {@code brokerage}.
     */
    public static AccountProvider fromKey(String key) {
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("provider must be provided");
        }
        try {
            return valueOf(key.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException("Unknown provider: " + key);
        }
    }

    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }
}
