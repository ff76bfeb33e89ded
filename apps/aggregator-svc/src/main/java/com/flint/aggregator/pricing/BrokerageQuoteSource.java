package com.flint.aggregator.pricing;

import com.flint.aggregator.model.PriceQuote;
import com.flint.aggregator.provider.BrokerageProviderClient;
import java.math.BigDecimal;
import java.time.Clock;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

@Component
public class BrokerageQuoteSource implements QuoteSource {

    static final String NAME = "brokerage";

    private final BrokerageProviderClient client;
    private final Clock clock;

    public BrokerageQuoteSource(BrokerageProviderClient client, Clock clock) {
        this.client = client;
        this.clock = clock;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public int priority() {
        return 0;
    }

    @Override
    public Mono<PriceQuote> fetch(String symbol) {
        return client.getQuote(symbol).flatMap(quote -> {
            BigDecimal price = firstPositive(quote.lastTradePrice(), quote.askPrice(), quote.bidPrice());
            if (price == null) {
                return Mono.empty();
            }
            long volume = (quote.bidSize() != null ? quote.bidSize() : 0L) + (quote.askSize() != null ? quote.askSize() : 0L);
            // the brokerage does not report day change
            return Mono.just(new PriceQuote(symbol, price, BigDecimal.ZERO, BigDecimal.ZERO, volume, null, NAME, clock.instant()));
        });
    }

    private static BigDecimal firstPositive(BigDecimal... candidates) {
        for (BigDecimal candidate : candidates) {
            if (candidate != null && candidate.signum() > 0) {
                return candidate;
            }
        }
        return null;
    }
}
