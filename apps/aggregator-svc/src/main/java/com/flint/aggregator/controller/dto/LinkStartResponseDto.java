package com.flint.aggregator.controller.dto;

public record LinkStartResponseDto(String provider, String transport, String url, String callbackUrl, String traceId) {
}
