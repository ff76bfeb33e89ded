package com.flint.aggregator.repository;

import com.flint.aggregator.model.NetWorthSnapshot;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface SnapshotRepository {

    /**
     * Keyed on {@code (userId, date)}; a same-day write overwrites the earlier row.
     */
    NetWorthSnapshot upsertSnapshot(NetWorthSnapshot snapshot);

    Optional<NetWorthSnapshot> findByUserIdAndDate(UUID userId, LocalDate date);

    /**
     * Oldest first.
     */
    List<NetWorthSnapshot> findByUserIdSince(UUID userId, LocalDate fromInclusive);
}
