package com.flint.aggregator.snapshot;

public record SnapshotRunResult(int success, int failed) {

    public int total() {
        return success + failed;
    }
}
