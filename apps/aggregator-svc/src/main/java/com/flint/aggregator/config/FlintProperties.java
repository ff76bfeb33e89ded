package com.flint.aggregator.config;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.ZoneId;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;

@ConfigurationProperties(prefix = "flint")
public record FlintProperties(
        Provider bank,
        Provider brokerage,
        Provider wallet,
        MarketData marketData,
        Pricing pricing,
        Link link,
        Snapshot snapshot,
        Retry retry
) {

    private static final Duration DEFAULT_REQUEST_TIMEOUT = Duration.ofSeconds(10);

    @ConstructorBinding
    public FlintProperties {
        if (bank == null) {
            throw new IllegalArgumentException("bank configuration must be provided");
        }
        if (brokerage == null) {
            throw new IllegalArgumentException("brokerage configuration must be provided");
        }
        // wallet and market data are optional; the remaining sections fall back to defaults
        if (pricing == null) {
            pricing = new Pricing(null, null, null);
        }
        if (link == null) {
            link = new Link(null, null, null, null);
        }
        if (snapshot == null) {
            snapshot = new Snapshot(null, null);
        }
        if (retry == null) {
            retry = new Retry(null, null, null, null);
        }
    }

    public Provider wallet() {
        return wallet != null ? wallet : new Provider(null, null, null, null, null, false);
    }

    public MarketData marketData() {
        return marketData != null ? marketData : new MarketData(null, null, null);
    }

    /**
     * Connection settings for one upstream account provider. {@code connectUrl} is the hosted
     * account-linking page; {@code requestTimeout} bounds every single call to the provider.
     */
    public record Provider(
            String baseUrl,
            String connectUrl,
            String clientId,
            String clientSecret,
            Duration requestTimeout,
            Boolean enabled
    ) {
        public Provider {
            boolean enabledValue = enabled == null || enabled;
            if (enabledValue) {
                if (baseUrl == null || baseUrl.isBlank()) {
                    throw new IllegalArgumentException("baseUrl must be provided");
                }
                if (clientId == null || clientId.isBlank()) {
                    throw new IllegalArgumentException("clientId must be provided");
                }
            }
            if (requestTimeout == null) {
                requestTimeout = DEFAULT_REQUEST_TIMEOUT;
            }
        }

        public boolean enabledFlag() {
            return enabled == null || enabled;
        }

        public boolean hasConnectUrl() {
            return connectUrl != null && !connectUrl.isBlank();
        }
    }

    public record MarketData(String baseUrl, String apiKey, Duration requestTimeout) {
        public MarketData {
            if (requestTimeout == null) {
                requestTimeout = DEFAULT_REQUEST_TIMEOUT;
            }
        }

        public boolean configured() {
            return baseUrl != null && !baseUrl.isBlank() && apiKey != null && !apiKey.isBlank();
        }
    }

    public record Pricing(Duration cacheTtl, Duration pollInterval, Map<String, BigDecimal> referencePrices) {
        public Pricing {
            if (cacheTtl == null) {
                cacheTtl = Duration.ofSeconds(1);
            }
            if (pollInterval == null) {
                pollInterval = Duration.ofSeconds(1);
            }
            if (cacheTtl.isNegative() || pollInterval.isZero() || pollInterval.isNegative()) {
                throw new IllegalArgumentException("cacheTtl must not be negative and pollInterval must be positive");
            }
            referencePrices = referencePrices == null ? Map.of() : referencePrices.entrySet().stream()
                    .collect(Collectors.toUnmodifiableMap(e -> e.getKey().toUpperCase(Locale.ROOT), Map.Entry::getValue));
        }
    }

    public record Link(Duration timeout, Duration popupPollInterval, String callbackScheme, String webOrigin) {
        public Link {
            if (timeout == null) {
                timeout = Duration.ofMinutes(10);
            }
            if (popupPollInterval == null) {
                popupPollInterval = Duration.ofMillis(500);
            }
            if (callbackScheme == null || callbackScheme.isBlank()) {
                callbackScheme = "flint";
            }
            if (webOrigin == null || webOrigin.isBlank()) {
                webOrigin = "http://localhost:5173";
            }
        }
    }

    public record Snapshot(String cron, String zone) {
        public Snapshot {
            if (cron == null || cron.isBlank()) {
                cron = "0 0 0 * * *";
            }
            if (zone == null || zone.isBlank()) {
                zone = "America/New_York";
            }
        }

        public ZoneId zoneId() {
            return ZoneId.of(zone);
        }
    }

    /**
     * Bounded retry for provider calls: at most {@code maxAttempts} attempts in total with exponential
     * backoff starting at {@code baseDelay}, capped at {@code maxDelay}, randomised by {@code jitterFactor}.
     */
    public record Retry(Integer maxAttempts, Duration baseDelay, Duration maxDelay, Double jitterFactor) {
        public Retry {
            if (maxAttempts == null) {
                maxAttempts = 3;
            }
            if (maxAttempts < 1) {
                throw new IllegalArgumentException("maxAttempts must be at least 1");
            }
            if (baseDelay == null) {
                baseDelay = Duration.ofSeconds(1);
            }
            if (maxDelay == null) {
                maxDelay = Duration.ofSeconds(10);
            }
            if (jitterFactor == null) {
                jitterFactor = 0.5d;
            }
            if (jitterFactor < 0 || jitterFactor > 1) {
                throw new IllegalArgumentException("jitterFactor must be between 0 and 1");
            }
        }
    }
}
