package com.flint.aggregator.model;

import java.time.Instant;
import java.util.UUID;

/**
 * A user's link to one provider. {@code encryptedCredential} is the provider access token or user
 * secret, encrypted at rest.
 */
public record ProviderConnection(
        String id,
        UUID userId,
        AccountProvider provider,
        String encryptedCredential,
        boolean active,
        Instant linkedAt
) {

    public ProviderConnection deactivated() {
        return new ProviderConnection(id, userId, provider, encryptedCredential, false, linkedAt);
    }
}
