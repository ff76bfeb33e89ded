package com.flint.aggregator.service;

import com.flint.aggregator.connection.ConnectionVerdict;
import com.flint.aggregator.model.AccountProvider;

/**
 * {@code accountId} is null when the whole connection failed rather than one account's balance.
 */
public record ConnectionFailure(String connectionId, AccountProvider provider, String accountId, ConnectionVerdict verdict) {
}
