package com.flint.aggregator.connection;

public enum VerdictKind {
    TRANSIENT(true, true, false,
            "Service temporarily unavailable. Please try again in a moment.", "TEMPORARY_ERROR"),
    AUTH_EXPIRED(false, false, true,
            "Account authorization expired. Please reconnect your account.", "AUTH_EXPIRED"),
    TEMPORARILY_UNAVAILABLE(true, true, false,
            "Account data temporarily unavailable. Please try again.", "TEMPORARY_UNAVAILABLE"),
    UNKNOWN(false, true, false,
            "Failed to load account details. Please try again.", "FETCH_FAILED");

    private final boolean transientError;
    private final boolean retry;
    private final boolean markDisconnected;
    private final String userMessage;
    private final String errorCode;

    VerdictKind(boolean transientError, boolean retry, boolean markDisconnected, String userMessage, String errorCode) {
        this.transientError = transientError;
        this.retry = retry;
        this.markDisconnected = markDisconnected;
        this.userMessage = userMessage;
        this.errorCode = errorCode;
    }

    public boolean isTransient() {
        return transientError;
    }

    public boolean shouldRetry() {
        return retry;
    }

    public boolean shouldMarkDisconnected() {
        return markDisconnected;
    }

    public String userMessage() {
        return userMessage;
    }

    public String errorCode() {
        return errorCode;
    }
}
