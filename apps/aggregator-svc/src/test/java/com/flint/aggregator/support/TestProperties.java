package com.flint.aggregator.support;

import com.flint.aggregator.config.FlintProperties;
import java.math.BigDecimal;
import java.time.Duration;
import java.util.Map;

public final class TestProperties {

    private TestProperties() {
    }

    public static FlintProperties defaults() {
        return withReferencePrices(Map.of());
    }

    public static FlintProperties withReferencePrices(Map<String, BigDecimal> referencePrices) {
        return new FlintProperties(
                new FlintProperties.Provider("http://localhost:1", "http://localhost:1/connect", "app", null, Duration.ofSeconds(1), true),
                new FlintProperties.Provider("http://localhost:1", null, "client", "secret", Duration.ofSeconds(1), true),
                null,
                null,
                new FlintProperties.Pricing(null, null, referencePrices),
                null,
                null,
                new FlintProperties.Retry(1, null, null, null)
        );
    }
}
