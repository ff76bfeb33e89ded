package com.flint.aggregator.normalize;

import java.math.BigDecimal;
import java.util.Optional;

public final class DecimalParsing {

    private DecimalParsing() {
    }

    /**
     * Empty for null, blank or unparseable input. Accepts thousands separators and a leading currency sign.
     */
    public static Optional<BigDecimal> parse(String raw) {
        if (raw == null) {
            return Optional.empty();
        }
        String cleaned = raw.trim().replace(",", "").replace("$", "");
        if (cleaned.isEmpty()) {
            return Optional.empty();
        }
        try {
            return Optional.of(new BigDecimal(cleaned));
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }

    public static BigDecimal parseOrZero(String raw) {
        return parse(raw).orElse(BigDecimal.ZERO);
    }

    /**
     * True when a value was supplied but could not be read as a number.
     */
    public static boolean isMalformed(String raw) {
        return raw != null && !raw.isBlank() && parse(raw).isEmpty();
    }
}
