package com.flint.aggregator.controller.dto;

public record SnapshotRunResponseDto(int success, int failed, String traceId) {
}
