package com.flint.aggregator.controller.dto;

import java.util.List;

public record SnapshotsResponseDto(int days, List<SnapshotResponseDto> snapshots, String traceId) {
}
