package com.flint.aggregator.pricing;

import com.flint.aggregator.config.FlintProperties;
import com.flint.aggregator.model.PriceQuote;
import java.math.BigDecimal;
import java.time.Clock;
import java.util.Map;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

/**
 * Last resort: configured last-close prices. No change figures.
 */
@Component
public class ReferencePriceQuoteSource implements QuoteSource {

    static final String NAME = "reference";

    private final Map<String, BigDecimal> referencePrices;
    private final Clock clock;

    @Autowired
    public ReferencePriceQuoteSource(FlintProperties properties, Clock clock) {
        this(properties.pricing().referencePrices(), clock);
    }

    ReferencePriceQuoteSource(Map<String, BigDecimal> referencePrices, Clock clock) {
        this.referencePrices = referencePrices;
        this.clock = clock;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public int priority() {
        return 100;
    }

    @Override
    public Mono<PriceQuote> fetch(String symbol) {
        BigDecimal price = referencePrices.get(symbol);
        if (price == null || price.signum() <= 0) {
            return Mono.empty();
        }
        return Mono.just(new PriceQuote(symbol, price, BigDecimal.ZERO, BigDecimal.ZERO, null, null, NAME, clock.instant()));
    }
}
