package com.flint.aggregator.provider;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.flint.aggregator.config.FlintProperties;
import com.flint.aggregator.connection.ProviderRetryPolicy;
import com.flint.aggregator.model.AccountProvider;
import com.flint.aggregator.normalize.RawAccount;
import com.flint.aggregator.normalize.RawBalance;
import com.flint.aggregator.normalize.RawPosition;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.util.UriComponentsBuilder;

/**
 * Optional crypto-wallet provider. The credential is the wallet address; one wallet is one account.
 */
@Component
@ConditionalOnProperty(prefix = "flint.wallet", name = "enabled", havingValue = "true")
public class WalletProviderClient implements ProviderClient {
    private static final Logger log = LoggerFactory.getLogger(WalletProviderClient.class);

    private final WebClient webClient;
    private final FlintProperties.Provider settings;
    private final ProviderRetryPolicy retryPolicy;

    public WalletProviderClient(FlintProperties properties, ProviderRetryPolicy retryPolicy) {
        this.settings = properties.wallet();
        this.retryPolicy = retryPolicy;
        this.webClient = WebClient.builder()
                .baseUrl(settings.baseUrl())
                .defaultHeader("Accept", MediaType.APPLICATION_JSON_VALUE)
                .defaultHeader("X-Api-Key", settings.clientId())
                .build();
    }

    @Override
    public AccountProvider provider() {
        return AccountProvider.WALLET;
    }

    @Override
    public List<RawAccount> listAccounts(String address) {
        String shortAddress = address.length() > 10
                ? address.substring(0, 6) + "..." + address.substring(address.length() - 4)
                : address;
        String lastFour = address.length() >= 4 ? address.substring(address.length() - 4) : address;
        return List.of(new RawAccount(address, "Wallet " + shortAddress, "crypto", "wallet", "Crypto Wallet", "USD", lastFour));
    }

    @Override
    public RawBalance getBalance(String address, String accountId) {
        var call = webClient.get().uri("/wallets/{address}/tokens", address)
                .retrieve()
                .bodyToMono(new ParameterizedTypeReference<List<TokenBalance>>() {});
        List<TokenBalance> tokens = retryPolicy.apply(call, settings.requestTimeout(), "wallet.tokens")
                .doOnError(e -> log.warn("Wallet token balances failed for {}: {}", accountId, e.toString()))
                .block();
        if (tokens == null) {
            return RawBalance.empty();
        }
        return RawBalance.wallet(tokens.stream().map(TokenBalance::toRaw).toList());
    }

    @Override
    public LinkStart startLinkFlow(String userId, String callbackUrl) {
        if (!settings.hasConnectUrl()) {
            throw new IllegalStateException("wallet connectUrl is not configured");
        }
        String url = UriComponentsBuilder.fromHttpUrl(settings.connectUrl())
                .queryParam("user_id", userId)
                .queryParam("redirect_uri", callbackUrl)
                .encode()
                .toUriString();
        return new LinkStart(url, callbackUrl);
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record TokenBalance(
            @JsonProperty("symbol") String symbol,
            @JsonProperty("balance") String balance,
            @JsonProperty("usd_price") String usdPrice,
            @JsonProperty("usd_value") String usdValue
    ) {
        RawPosition toRaw() {
            return new RawPosition(symbol, balance, usdPrice, usdValue);
        }
    }
}
