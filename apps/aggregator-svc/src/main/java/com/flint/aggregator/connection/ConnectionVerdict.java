package com.flint.aggregator.connection;

import com.flint.aggregator.model.ConnectionStatus;

/**
 * Outcome of classifying one failed provider call. Never persisted. {@code httpStatus} and
 * {@code providerCode} are diagnostics only; behaviour is driven by {@link #kind()}.
 */
public record ConnectionVerdict(VerdictKind kind, int httpStatus, String providerCode) {

    public ConnectionVerdict {
        if (kind == null) {
            throw new IllegalArgumentException("kind must be provided");
        }
    }

    public boolean isTransient() {
        return kind.isTransient();
    }

    public boolean shouldRetry() {
        return kind.shouldRetry();
    }

    public boolean shouldMarkDisconnected() {
        return kind.shouldMarkDisconnected();
    }

    public String userMessage() {
        return kind.userMessage();
    }

    public String errorCode() {
        return kind.errorCode();
    }

    /**
     * Status an account should carry after this failure. Only an explicit auth failure changes it.
     */
    public ConnectionStatus applyTo(ConnectionStatus current) {
        if (!shouldMarkDisconnected()) {
            return current;
        }
        if (httpStatus == 401 || ConnectionErrorClassifier.AUTHORIZATION_EXPIRED.equals(providerCode)) {
            return ConnectionStatus.AUTH_EXPIRED;
        }
        return ConnectionStatus.DISCONNECTED;
    }
}
