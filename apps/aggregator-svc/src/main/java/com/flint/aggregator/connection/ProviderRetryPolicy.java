package com.flint.aggregator.connection;

import com.flint.aggregator.config.FlintProperties;
import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

/**
 * Bounded retry for provider calls. Each attempt is cut off at the provider's request timeout and
 * only failures whose verdict allows a retry are retried, up to {@code maxAttempts} attempts in total.
 * After that the last failure is rethrown unchanged so the caller can classify it.
 */
@Component
public class ProviderRetryPolicy {

    private static final Logger log = LoggerFactory.getLogger(ProviderRetryPolicy.class);

    private final FlintProperties.Retry settings;
    private final ConnectionErrorClassifier classifier;

    @Autowired
    public ProviderRetryPolicy(FlintProperties properties, ConnectionErrorClassifier classifier) {
        this(properties.retry(), classifier);
    }

    public ProviderRetryPolicy(FlintProperties.Retry settings, ConnectionErrorClassifier classifier) {
        this.settings = settings;
        this.classifier = classifier;
    }

    public <T> Mono<T> apply(Mono<T> call, Duration requestTimeout, String context) {
        return call.timeout(requestTimeout).retryWhen(retrySpec(context));
    }

    Retry retrySpec(String context) {
        if (settings.maxAttempts() <= 1) {
            return Retry.max(0);
        }
        return Retry.backoff(settings.maxAttempts() - 1L, settings.baseDelay())
                .maxBackoff(settings.maxDelay())
                .jitter(settings.jitterFactor())
                .filter(error -> classifier.classify(error).shouldRetry())
                .doBeforeRetry(signal -> log.warn("Provider call {} failed (attempt {}/{}), retrying: {}",
                        context, signal.totalRetries() + 1, settings.maxAttempts(), signal.failure().toString()))
                .onRetryExhaustedThrow((backoff, signal) -> signal.failure());
    }

    public int maxAttempts() {
        return settings.maxAttempts();
    }
}
