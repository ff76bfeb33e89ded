package com.flint.aggregator.provider;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.flint.aggregator.config.FlintProperties;
import com.flint.aggregator.connection.ProviderRetryPolicy;
import com.flint.aggregator.model.AccountProvider;
import com.flint.aggregator.normalize.RawAccount;
import com.flint.aggregator.normalize.RawBalance;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.util.UriComponentsBuilder;

/**
 * Bank-data aggregator client (enrollment access token sent as HTTP Basic username).
 * Blocking calls; each one is bounded by the configured request timeout and retry policy.
 */
@Component
public class BankProviderClient implements ProviderClient {
    private static final Logger log = LoggerFactory.getLogger(BankProviderClient.class);

    private final WebClient webClient;
    private final FlintProperties.Provider settings;
    private final ProviderRetryPolicy retryPolicy;

    public BankProviderClient(FlintProperties properties, ProviderRetryPolicy retryPolicy) {
        this.settings = properties.bank();
        this.retryPolicy = retryPolicy;
        this.webClient = WebClient.builder()
                .baseUrl(settings.baseUrl())
                .defaultHeader("Accept", MediaType.APPLICATION_JSON_VALUE)
                .build();
    }

    @Override
    public AccountProvider provider() {
        return AccountProvider.BANK;
    }

    @Override
    public List<RawAccount> listAccounts(String accessToken) {
        var call = webClient.get().uri("/accounts")
                .headers(h -> h.setBasicAuth(accessToken, ""))
                .retrieve()
                .bodyToMono(new ParameterizedTypeReference<List<BankAccount>>() {});
        List<BankAccount> accounts = retryPolicy.apply(call, settings.requestTimeout(), "bank.accounts.list")
                .doOnError(e -> log.warn("Bank accounts list failed: {}", e.toString()))
                .block();
        if (accounts == null) {
            return List.of();
        }
        return accounts.stream().map(BankAccount::toRaw).toList();
    }

    @Override
    public RawBalance getBalance(String accessToken, String accountId) {
        var call = webClient.get().uri("/accounts/{id}/balances", accountId)
                .headers(h -> h.setBasicAuth(accessToken, ""))
                .retrieve()
                .bodyToMono(BankBalance.class);
        BankBalance balance = retryPolicy.apply(call, settings.requestTimeout(), "bank.accounts.balances")
                .doOnError(e -> log.warn("Bank balance fetch failed for account {}: {}", accountId, e.toString()))
                .block();
        return balance == null ? RawBalance.empty() : RawBalance.bank(balance.ledger(), balance.available());
    }

    @Override
    public LinkStart startLinkFlow(String userId, String callbackUrl) {
        if (!settings.hasConnectUrl()) {
            throw new IllegalStateException("bank connectUrl is not configured");
        }
        String url = UriComponentsBuilder.fromHttpUrl(settings.connectUrl())
                .queryParam("application_id", settings.clientId())
                .queryParam("user_id", userId)
                .queryParam("redirect_uri", callbackUrl)
                .encode()
                .toUriString();
        return new LinkStart(url, callbackUrl);
    }

    // --- Response DTOs --- //
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record BankAccount(
            @JsonProperty("id") String id,
            @JsonProperty("name") String name,
            @JsonProperty("type") String type,
            @JsonProperty("subtype") String subtype,
            @JsonProperty("status") String status,
            @JsonProperty("currency") String currency,
            @JsonProperty("last_four") String lastFour,
            @JsonProperty("institution") Institution institution
    ) {
        public record Institution(@JsonProperty("id") String id, @JsonProperty("name") String name) {}

        RawAccount toRaw() {
            return new RawAccount(id, name, type, subtype, institution != null ? institution.name() : null, currency, lastFour);
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record BankBalance(
            @JsonProperty("account_id") String accountId,
            @JsonProperty("ledger") String ledger,
            @JsonProperty("available") String available
    ) {}
}
