package com.flint.aggregator.repository;

import com.flint.aggregator.model.ProviderConnection;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;
import org.springframework.stereotype.Repository;

@Repository
public class InMemoryConnectionRepository implements ConnectionRepository {

    private final Map<String, ProviderConnection> storage = new ConcurrentHashMap<>();

    @Override
    public ProviderConnection save(ProviderConnection connection) {
        storage.put(connection.id(), connection);
        return connection;
    }

    @Override
    public Optional<ProviderConnection> findById(String connectionId) {
        return Optional.ofNullable(storage.get(connectionId));
    }

    @Override
    public List<ProviderConnection> findActiveByUserId(UUID userId) {
        return storage.values().stream()
                .filter(ProviderConnection::active)
                .filter(connection -> connection.userId().equals(userId))
                .sorted(Comparator.comparing(ProviderConnection::linkedAt))
                .collect(Collectors.toCollection(ArrayList::new));
    }

    @Override
    public List<UUID> findUserIdsWithActiveConnections() {
        return storage.values().stream()
                .filter(ProviderConnection::active)
                .sorted(Comparator.comparing(ProviderConnection::linkedAt))
                .map(ProviderConnection::userId)
                .distinct()
                .collect(Collectors.toCollection(ArrayList::new));
    }

    @Override
    public void deactivate(String connectionId) {
        storage.computeIfPresent(connectionId, (id, connection) -> connection.deactivated());
    }
}
