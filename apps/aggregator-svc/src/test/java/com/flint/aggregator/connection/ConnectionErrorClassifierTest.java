package com.flint.aggregator.connection;

import static org.assertj.core.api.Assertions.assertThat;

import com.flint.aggregator.model.AccountProvider;
import com.flint.aggregator.model.ConnectionStatus;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.TimeoutException;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.Exceptions;

class ConnectionErrorClassifierTest {

    private final ConnectionErrorClassifier classifier = new ConnectionErrorClassifier();

    @Test
    void rateLimitIsRetriedWithoutDisconnecting() {
        ConnectionVerdict verdict = classifier.classify(429, null);

        assertThat(verdict.kind()).isEqualTo(VerdictKind.TRANSIENT);
        assertThat(verdict.shouldRetry()).isTrue();
        assertThat(verdict.shouldMarkDisconnected()).isFalse();
        assertThat(verdict.isTransient()).isTrue();
    }

    @Test
    void unauthorizedDisconnectsWithoutRetry() {
        ConnectionVerdict verdict = classifier.classify(401, null);

        assertThat(verdict.shouldMarkDisconnected()).isTrue();
        assertThat(verdict.shouldRetry()).isFalse();
        assertThat(verdict.userMessage()).contains("reconnect");
        assertThat(verdict.applyTo(ConnectionStatus.CONNECTED)).isEqualTo(ConnectionStatus.AUTH_EXPIRED);
    }

    @Test
    void forbiddenOrRevokedMarksDisconnected() {
        assertThat(classifier.classify(403, null).applyTo(ConnectionStatus.CONNECTED)).isEqualTo(ConnectionStatus.DISCONNECTED);
        assertThat(classifier.classify(400, "access_revoked").applyTo(ConnectionStatus.CONNECTED)).isEqualTo(ConnectionStatus.DISCONNECTED);
        assertThat(classifier.classify(400, "AUTHORIZATION_EXPIRED").applyTo(ConnectionStatus.CONNECTED)).isEqualTo(ConnectionStatus.AUTH_EXPIRED);
    }

    @Test
    void transientRuleWinsOverAuthRule() {
        ConnectionVerdict verdict = classifier.classify(401, "RATE_LIMIT");

        assertThat(verdict.kind()).isEqualTo(VerdictKind.TRANSIENT);
        assertThat(verdict.shouldMarkDisconnected()).isFalse();
    }

    @Test
    void providerSpecificTemporaryCodesAreTransient() {
        assertThat(classifier.classify(502, "ENROLLMENT_TEMPORARY_ERROR").kind()).isEqualTo(VerdictKind.TRANSIENT);
    }

    @Test
    void notFoundIsTreatedAsNotYetSynced() {
        ConnectionVerdict verdict = classifier.classify(404, null);

        assertThat(verdict.kind()).isEqualTo(VerdictKind.TEMPORARILY_UNAVAILABLE);
        assertThat(verdict.shouldRetry()).isTrue();
        assertThat(verdict.shouldMarkDisconnected()).isFalse();
    }

    @Test
    void unknownErrorsRetryAndLeaveStatusAlone() {
        ConnectionVerdict verdict = classifier.classify(500, "SOMETHING_ODD");

        assertThat(verdict.kind()).isEqualTo(VerdictKind.UNKNOWN);
        assertThat(verdict.shouldRetry()).isTrue();
        assertThat(verdict.applyTo(ConnectionStatus.AUTH_EXPIRED)).isEqualTo(ConnectionStatus.AUTH_EXPIRED);
        assertThat(verdict.applyTo(ConnectionStatus.CONNECTED)).isEqualTo(ConnectionStatus.CONNECTED);
    }

    @Test
    void classificationIsDeterministic() {
        assertThat(classifier.classify(503, "timeout")).isEqualTo(classifier.classify(503, "TIMEOUT"));
    }

    @Test
    void readsStatusAndCodeFromWebClientErrors() {
        WebClientResponseException error = WebClientResponseException.create(
                400, "Bad Request", HttpHeaders.EMPTY,
                "{\"error\":{\"code\":\"INVALID_CREDENTIALS\",\"message\":\"bad token\"}}".getBytes(StandardCharsets.UTF_8),
                StandardCharsets.UTF_8);

        ConnectionVerdict verdict = classifier.classify(error);

        assertThat(verdict.shouldMarkDisconnected()).isTrue();
        assertThat(verdict.providerCode()).isEqualTo("INVALID_CREDENTIALS");
        assertThat(verdict.httpStatus()).isEqualTo(400);
    }

    @Test
    void unwrapsProviderExceptionsAndTimeouts() {
        ProviderException provider = new ProviderException(AccountProvider.BROKERAGE, 503, null, "down");

        assertThat(classifier.classify(provider).kind()).isEqualTo(VerdictKind.TRANSIENT);
        assertThat(classifier.classify(Exceptions.propagate(new TimeoutException("slow"))).httpStatus()).isEqualTo(408);
        assertThat(classifier.classify(new IllegalStateException("boom")).kind()).isEqualTo(VerdictKind.UNKNOWN);
    }
}
