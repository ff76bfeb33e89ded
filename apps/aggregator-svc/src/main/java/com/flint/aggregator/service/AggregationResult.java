package com.flint.aggregator.service;

import com.flint.aggregator.model.Account;
import java.util.List;

public record AggregationResult(List<Account> accounts, List<ConnectionFailure> failures) {

    public AggregationResult {
        accounts = accounts == null ? List.of() : List.copyOf(accounts);
        failures = failures == null ? List.of() : List.copyOf(failures);
    }

    public boolean hasFailures() {
        return !failures.isEmpty();
    }
}
