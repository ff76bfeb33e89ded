package com.flint.aggregator.pricing;

import com.flint.aggregator.model.PriceQuote;
import reactor.core.publisher.Mono;

/**
 * One upstream quote provider. An empty result or an error both mean "did not answer".
 */
public interface QuoteSource {

    String name();

    /**
     * Lower values are preferred when several sources answer.
     */
    int priority();

    Mono<PriceQuote> fetch(String symbol);
}
