package com.flint.aggregator.repository;

import com.flint.aggregator.model.NetWorthSnapshot;
import java.time.LocalDate;
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
public class InMemorySnapshotRepository implements SnapshotRepository {

    private record Key(UUID userId, LocalDate date) {}

    private final Map<Key, NetWorthSnapshot> storage = new ConcurrentHashMap<>();

    @Override
    public NetWorthSnapshot upsertSnapshot(NetWorthSnapshot snapshot) {
        storage.put(new Key(snapshot.userId(), snapshot.date()), snapshot);
        return snapshot;
    }

    @Override
    public Optional<NetWorthSnapshot> findByUserIdAndDate(UUID userId, LocalDate date) {
        return Optional.ofNullable(storage.get(new Key(userId, date)));
    }

    @Override
    public List<NetWorthSnapshot> findByUserIdSince(UUID userId, LocalDate fromInclusive) {
        return storage.values().stream()
                .filter(snapshot -> snapshot.userId().equals(userId))
                .filter(snapshot -> !snapshot.date().isBefore(fromInclusive))
                .sorted(Comparator.comparing(NetWorthSnapshot::date))
                .collect(Collectors.toCollection(ArrayList::new));
    }
}
