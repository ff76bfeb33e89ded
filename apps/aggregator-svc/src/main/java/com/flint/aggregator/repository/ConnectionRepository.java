package com.flint.aggregator.repository;

import com.flint.aggregator.model.ProviderConnection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface ConnectionRepository {

    ProviderConnection save(ProviderConnection connection);

    Optional<ProviderConnection> findById(String connectionId);

    List<ProviderConnection> findActiveByUserId(UUID userId);

    /**
     * Users with at least one active connection, in order of their earliest link.
     */
    List<UUID> findUserIdsWithActiveConnections();

    void deactivate(String connectionId);
}
