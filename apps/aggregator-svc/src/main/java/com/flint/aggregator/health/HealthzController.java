package com.flint.aggregator.health;

import com.flint.aggregator.pricing.PriceAggregator;
import java.util.Map;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Unauthenticated liveness check for load balancers.
 */
@RestController
public class HealthzController {

    private final PriceAggregator priceAggregator;

    public HealthzController(PriceAggregator priceAggregator) {
        this.priceAggregator = priceAggregator;
    }

    @GetMapping(path = "/healthz", produces = MediaType.APPLICATION_JSON_VALUE)
    public Map<String, Object> healthz() {
        return Map.of("status", "UP", "quotePolling", priceAggregator.isPolling());
    }
}
