package com.flint.aggregator.pricing;

import com.fasterxml.jackson.databind.JsonNode;
import com.flint.aggregator.config.FlintProperties;
import com.flint.aggregator.model.PriceQuote;
import com.flint.aggregator.normalize.DecimalParsing;
import java.math.BigDecimal;
import java.time.Clock;
import java.util.Optional;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

/**
 * Secondary market-data provider using the global-quote query endpoint. Answers nothing when no
 * endpoint or API key is configured.
 */
@Component
public class MarketDataQuoteSource implements QuoteSource {

    static final String NAME = "market_data";

    private final FlintProperties.MarketData settings;
    private final WebClient webClient;
    private final Clock clock;

    public MarketDataQuoteSource(FlintProperties properties, Clock clock) {
        this.settings = properties.marketData();
        this.clock = clock;
        this.webClient = settings.configured()
                ? WebClient.builder()
                        .baseUrl(settings.baseUrl())
                        .defaultHeader("Accept", MediaType.APPLICATION_JSON_VALUE)
                        .build()
                : null;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public int priority() {
        return 10;
    }

    @Override
    public Mono<PriceQuote> fetch(String symbol) {
        if (webClient == null) {
            return Mono.empty();
        }
        return webClient.get()
                .uri(b -> b.path("/query")
                        .queryParam("function", "GLOBAL_QUOTE")
                        .queryParam("symbol", symbol)
                        .queryParam("apikey", settings.apiKey())
                        .build())
                .retrieve()
                .bodyToMono(JsonNode.class)
                .timeout(settings.requestTimeout())
                .flatMap(body -> Mono.justOrEmpty(toQuote(symbol, body)));
    }

    Optional<PriceQuote> toQuote(String symbol, JsonNode body) {
        JsonNode quote = body.path("Global Quote");
        Optional<BigDecimal> price = DecimalParsing.parse(quote.path("05. price").asText(null));
        if (price.isEmpty() || price.get().signum() <= 0) {
            return Optional.empty();
        }
        String percent = quote.path("10. change percent").asText(null);
        BigDecimal changePercent = DecimalParsing.parseOrZero(percent != null ? percent.replace("%", "") : null);
        Long volume = DecimalParsing.parse(quote.path("06. volume").asText(null)).map(BigDecimal::longValue).orElse(null);
        return Optional.of(new PriceQuote(
                symbol,
                price.get(),
                DecimalParsing.parseOrZero(quote.path("09. change").asText(null)),
                changePercent,
                volume,
                null,
                NAME,
                clock.instant()
        ));
    }
}
