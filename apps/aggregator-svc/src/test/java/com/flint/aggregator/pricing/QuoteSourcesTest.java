package com.flint.aggregator.pricing;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flint.aggregator.model.PriceQuote;
import com.flint.aggregator.provider.BrokerageProviderClient;
import com.flint.aggregator.support.TestProperties;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;

class QuoteSourcesTest {

    private final Clock clock = Clock.fixed(Instant.parse("2024-06-03T14:30:00Z"), ZoneOffset.UTC);

    @Test
    void brokerageFallsBackToAskThenBid() {
        BrokerageProviderClient client = mock(BrokerageProviderClient.class);
        when(client.getQuote("AAPL")).thenReturn(Mono.just(
                new BrokerageProviderClient.BrokerageQuote("AAPL", null, new BigDecimal("189.90"), new BigDecimal("190.05"), 100L, 200L)));
        when(client.getQuote("VOID")).thenReturn(Mono.just(
                new BrokerageProviderClient.BrokerageQuote("VOID", BigDecimal.ZERO, null, null, null, null)));
        BrokerageQuoteSource source = new BrokerageQuoteSource(client, clock);

        PriceQuote quote = source.fetch("AAPL").block();

        assertThat(quote.price()).isEqualByComparingTo("190.05");
        assertThat(quote.volume()).isEqualTo(300L);
        assertThat(quote.source()).isEqualTo("brokerage");
        assertThat(source.fetch("VOID").blockOptional()).isEmpty();
    }

    @Test
    void marketDataParsesGlobalQuote() throws Exception {
        JsonNode body = new ObjectMapper().readTree("""
                {"Global Quote": {"01. symbol": "MSFT", "05. price": "415.2600", "06. volume": "18234123",
                                  "09. change": "-2.1400", "10. change percent": "-0.5127%"}}
                """);
        MarketDataQuoteSource source = new MarketDataQuoteSource(TestProperties.defaults(), clock);

        Optional<PriceQuote> quote = source.toQuote("MSFT", body);

        assertThat(quote).hasValueSatisfying(q -> {
            assertThat(q.price()).isEqualByComparingTo("415.26");
            assertThat(q.change()).isEqualByComparingTo("-2.14");
            assertThat(q.changePercent()).isEqualByComparingTo("-0.5127");
            assertThat(q.volume()).isEqualTo(18234123L);
            assertThat(q.lastUpdated()).isEqualTo(clock.instant());
        });
    }

    @Test
    void marketDataWithoutKeyOrPriceDoesNotAnswer() throws Exception {
        MarketDataQuoteSource source = new MarketDataQuoteSource(TestProperties.defaults(), clock);

        assertThat(source.fetch("MSFT").blockOptional()).isEmpty();
        assertThat(source.toQuote("MSFT", new ObjectMapper().readTree("{\"Note\":\"rate limited\"}"))).isEmpty();
    }

    @Test
    void referencePricesAnswerOnlyForKnownSymbols() {
        ReferencePriceQuoteSource source = new ReferencePriceQuoteSource(
                TestProperties.withReferencePrices(Map.of("spy", new BigDecimal("500.00"))), clock);

        assertThat(source.fetch("SPY").block().price()).isEqualByComparingTo("500.00");
        assertThat(source.fetch("QQQ").blockOptional()).isEmpty();
    }
}
