package com.flint.aggregator.controller.dto;

import com.flint.aggregator.service.ConnectionFailure;

public record ConnectionFailureDto(
        String provider,
        String accountId,
        String code,
        String message,
        boolean retryable,
        boolean reconnectRequired
) {

    public static ConnectionFailureDto from(ConnectionFailure failure) {
        return new ConnectionFailureDto(
                failure.provider().key(),
                failure.accountId(),
                failure.verdict().errorCode(),
                failure.verdict().userMessage(),
                failure.verdict().shouldRetry(),
                failure.verdict().shouldMarkDisconnected()
        );
    }
}
