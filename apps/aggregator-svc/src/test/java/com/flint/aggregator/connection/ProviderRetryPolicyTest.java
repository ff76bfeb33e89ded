package com.flint.aggregator.connection;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.flint.aggregator.config.FlintProperties;
import com.flint.aggregator.model.AccountProvider;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;

class ProviderRetryPolicyTest {

    private final ConnectionErrorClassifier classifier = new ConnectionErrorClassifier();
    private final ProviderRetryPolicy policy = new ProviderRetryPolicy(
            new FlintProperties.Retry(3, Duration.ofMillis(1), Duration.ofMillis(5), 0.5d), classifier);

    @Test
    void transientFailuresAreRetriedUpToTheCap() {
        AtomicInteger attempts = new AtomicInteger();
        Mono<String> call = Mono.defer(() -> {
            attempts.incrementAndGet();
            return Mono.error(new ProviderException(AccountProvider.BANK, 503, null, "unavailable"));
        });

        assertThatThrownBy(() -> policy.apply(call, Duration.ofSeconds(1), "test").block())
                .isInstanceOf(ProviderException.class)
                .hasMessageContaining("unavailable");
        assertThat(attempts).hasValue(3);
    }

    @Test
    void authFailuresAreNotRetried() {
        AtomicInteger attempts = new AtomicInteger();
        Mono<String> call = Mono.defer(() -> {
            attempts.incrementAndGet();
            return Mono.error(new ProviderException(AccountProvider.BANK, 401, null, "expired"));
        });

        assertThatThrownBy(() -> policy.apply(call, Duration.ofSeconds(1), "test").block())
                .isInstanceOf(ProviderException.class);
        assertThat(attempts).hasValue(1);
    }

    @Test
    void recoversWhenALaterAttemptSucceeds() {
        AtomicInteger attempts = new AtomicInteger();
        Mono<String> call = Mono.defer(() -> attempts.incrementAndGet() < 2
                ? Mono.error(new ProviderException(AccountProvider.BANK, 429, null, "slow down"))
                : Mono.just("ok"));

        assertThat(policy.apply(call, Duration.ofSeconds(1), "test").block()).isEqualTo("ok");
        assertThat(attempts).hasValue(2);
    }

    @Test
    void singleAttemptConfigurationNeverRetries() {
        ProviderRetryPolicy noRetry = new ProviderRetryPolicy(
                new FlintProperties.Retry(1, Duration.ofMillis(1), Duration.ofMillis(5), 0d), classifier);
        AtomicInteger attempts = new AtomicInteger();
        Mono<String> call = Mono.defer(() -> {
            attempts.incrementAndGet();
            return Mono.error(new ProviderException(AccountProvider.BANK, 503, null, "unavailable"));
        });

        assertThatThrownBy(() -> noRetry.apply(call, Duration.ofSeconds(1), "test").block())
                .isInstanceOf(ProviderException.class);
        assertThat(attempts).hasValue(1);
    }
}
