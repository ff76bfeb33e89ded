package com.flint.aggregator.snapshot;

import com.flint.aggregator.service.ConnectionFailure;
import java.util.List;
import java.util.UUID;

/**
 * Raised instead of persisting a net worth built from a partial set of connections.
 */
public class SnapshotAggregationException extends RuntimeException {

    private final UUID userId;
    private final List<ConnectionFailure> failures;

    public SnapshotAggregationException(UUID userId, List<ConnectionFailure> failures) {
        super("Account refresh failed for " + failures.size() + " connection(s) of user " + userId);
        this.userId = userId;
        this.failures = List.copyOf(failures);
    }

    public UUID getUserId() {
        return userId;
    }

    public List<ConnectionFailure> getFailures() {
        return failures;
    }
}
