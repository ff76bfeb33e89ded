package com.flint.aggregator.provider;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.flint.aggregator.config.FlintProperties;
import com.flint.aggregator.connection.ProviderRetryPolicy;
import com.flint.aggregator.model.AccountProvider;
import com.flint.aggregator.normalize.RawAccount;
import com.flint.aggregator.normalize.RawBalance;
import com.flint.aggregator.normalize.RawPosition;
import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

/**
 * Brokerage-data aggregator client. The stored credential is {@code brokerageUserId:userSecret}.
 * Account balances are assembled from the cash and positions endpoints so the normalizer can value
 * the account as cash plus holdings.
 */
@Component
public class BrokerageProviderClient implements ProviderClient {
    private static final Logger log = LoggerFactory.getLogger(BrokerageProviderClient.class);

    private final WebClient webClient;
    private final FlintProperties.Provider settings;
    private final ProviderRetryPolicy retryPolicy;

    public BrokerageProviderClient(FlintProperties properties, ProviderRetryPolicy retryPolicy) {
        this.settings = properties.brokerage();
        this.retryPolicy = retryPolicy;
        var builder = WebClient.builder()
                .baseUrl(settings.baseUrl())
                .defaultHeader("Content-Type", MediaType.APPLICATION_JSON_VALUE)
                .defaultHeader("X-Client-Id", settings.clientId());
        if (settings.clientSecret() != null) {
            builder.defaultHeader("X-Client-Secret", settings.clientSecret());
        }
        this.webClient = builder.build();
    }

    @Override
    public AccountProvider provider() {
        return AccountProvider.BROKERAGE;
    }

    @Override
    public List<RawAccount> listAccounts(String credential) {
        Credential user = Credential.parse(credential);
        var call = webClient.get()
                .uri(b -> b.path("/accounts").queryParam("userId", user.userId()).queryParam("userSecret", user.userSecret()).build())
                .retrieve()
                .bodyToMono(new ParameterizedTypeReference<List<BrokerageAccount>>() {});
        List<BrokerageAccount> accounts = retryPolicy.apply(call, settings.requestTimeout(), "brokerage.accounts.list")
                .doOnError(e -> log.warn("Brokerage accounts list failed: {}", e.toString()))
                .block();
        if (accounts == null) {
            return List.of();
        }
        return accounts.stream().map(BrokerageAccount::toRaw).toList();
    }

    @Override
    public RawBalance getBalance(String credential, String accountId) {
        Credential user = Credential.parse(credential);
        Mono<List<CashBalance>> balances = retryPolicy.apply(webClient.get()
                        .uri(b -> b.path("/accounts/{id}/balances").queryParam("userId", user.userId())
                                .queryParam("userSecret", user.userSecret()).build(accountId))
                        .retrieve()
                        .bodyToMono(new ParameterizedTypeReference<List<CashBalance>>() {}),
                settings.requestTimeout(), "brokerage.accounts.balances");
        Mono<List<Position>> positions = retryPolicy.apply(webClient.get()
                        .uri(b -> b.path("/accounts/{id}/positions").queryParam("userId", user.userId())
                                .queryParam("userSecret", user.userSecret()).build(accountId))
                        .retrieve()
                        .bodyToMono(new ParameterizedTypeReference<List<Position>>() {}),
                settings.requestTimeout(), "brokerage.accounts.positions");
        var result = Mono.zip(balances.defaultIfEmpty(List.of()), positions.defaultIfEmpty(List.of()))
                .doOnError(e -> log.warn("Brokerage balance fetch failed for account {}: {}", accountId, e.toString()))
                .block();
        if (result == null) {
            return RawBalance.empty();
        }
        BigDecimal cash = result.getT1().stream()
                .map(CashBalance::cash)
                .filter(value -> value != null)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
        List<RawPosition> rawPositions = result.getT2().stream().map(Position::toRaw).toList();
        return RawBalance.investment(cash.toPlainString(), null, rawPositions);
    }

    /**
     * Live quote through the brokerage's market-data endpoint using the service credentials.
     * Empty when the brokerage does not know the symbol.
     */
    public Mono<BrokerageQuote> getQuote(String symbol) {
        return webClient.get()
                .uri(b -> b.path("/marketData/quotes").queryParam("symbols", symbol).build())
                .retrieve()
                .bodyToMono(new ParameterizedTypeReference<List<BrokerageQuote>>() {})
                .timeout(settings.requestTimeout())
                .flatMap(quotes -> quotes.isEmpty() ? Mono.empty() : Mono.just(quotes.get(0)));
    }

    @Override
    public LinkStart startLinkFlow(String userId, String callbackUrl) {
        var body = Map.of("userId", userId, "customRedirect", callbackUrl);
        var call = webClient.post().uri("/snapTrade/login")
                .bodyValue(body)
                .retrieve()
                .bodyToMono(LoginResponse.class);
        LoginResponse response = retryPolicy.apply(call, settings.requestTimeout(), "brokerage.login")
                .doOnError(e -> log.warn("Brokerage login link creation failed: {}", e.toString()))
                .block();
        if (response == null || response.redirectUri() == null) {
            throw new IllegalStateException("brokerage did not return a link URL");
        }
        return new LinkStart(response.redirectUri(), callbackUrl);
    }

    record Credential(String userId, String userSecret) {
        static Credential parse(String credential) {
            int separator = credential == null ? -1 : credential.indexOf(':');
            if (separator <= 0 || separator == credential.length() - 1) {
                throw new IllegalArgumentException("brokerage credential must be userId:userSecret");
            }
            return new Credential(credential.substring(0, separator), credential.substring(separator + 1));
        }
    }

    // --- Response DTOs --- //
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record BrokerageAccount(
            @JsonProperty("id") String id,
            @JsonProperty("name") String name,
            @JsonProperty("number") String number,
            @JsonProperty("institution_name") String institutionName,
            @JsonProperty("meta") Meta meta
    ) {
        @JsonIgnoreProperties(ignoreUnknown = true)
        public record Meta(@JsonProperty("type") String type, @JsonProperty("currency") String currency) {}

        RawAccount toRaw() {
            String lastFour = number != null && number.length() >= 4 ? number.substring(number.length() - 4) : number;
            return new RawAccount(id, name, meta != null ? meta.type() : null, null, institutionName,
                    meta != null ? meta.currency() : null, lastFour);
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record CashBalance(@JsonProperty("cash") BigDecimal cash, @JsonProperty("buying_power") BigDecimal buyingPower) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Position(
            @JsonProperty("symbol") String symbol,
            @JsonProperty("units") String units,
            @JsonProperty("price") String price,
            @JsonProperty("market_value") String marketValue
    ) {
        RawPosition toRaw() {
            return new RawPosition(symbol, units, price, marketValue);
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record BrokerageQuote(
            @JsonProperty("symbol") String symbol,
            @JsonProperty("last_trade_price") BigDecimal lastTradePrice,
            @JsonProperty("bid_price") BigDecimal bidPrice,
            @JsonProperty("ask_price") BigDecimal askPrice,
            @JsonProperty("bid_size") Long bidSize,
            @JsonProperty("ask_size") Long askSize
    ) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record LoginResponse(@JsonProperty("redirectURI") String redirectUri) {}
}
