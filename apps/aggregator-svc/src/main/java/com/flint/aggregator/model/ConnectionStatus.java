package com.flint.aggregator.model;

public enum ConnectionStatus {
    CONNECTED,
    DISCONNECTED,
    AUTH_EXPIRED;

    public boolean isActive() {
        return this == CONNECTED;
    }
}
