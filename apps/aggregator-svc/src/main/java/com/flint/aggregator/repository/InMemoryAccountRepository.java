package com.flint.aggregator.repository;

import com.flint.aggregator.model.Account;
import com.flint.aggregator.model.ConnectionStatus;
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
public class InMemoryAccountRepository implements AccountRepository {

    private record Key(UUID userId, String accountId) {}

    private record Stored(String connectionId, Account account) {}

    private final Map<Key, Stored> storage = new ConcurrentHashMap<>();

    @Override
    public Account upsertAccount(UUID userId, String connectionId, Account account) {
        storage.put(new Key(userId, account.id()), new Stored(connectionId, account));
        return account;
    }

    @Override
    public List<Account> findByUserId(UUID userId) {
        return storage.entrySet().stream()
                .filter(entry -> entry.getKey().userId().equals(userId))
                .map(entry -> entry.getValue().account())
                .sorted(Comparator.comparing(Account::provider).thenComparing(Account::id))
                .collect(Collectors.toCollection(ArrayList::new));
    }

    @Override
    public Optional<Account> findById(UUID userId, String accountId) {
        return Optional.ofNullable(storage.get(new Key(userId, accountId))).map(Stored::account);
    }

    @Override
    public int updateStatus(UUID userId, String connectionId, ConnectionStatus status) {
        int changed = 0;
        for (Map.Entry<Key, Stored> entry : storage.entrySet()) {
            Stored stored = entry.getValue();
            if (!entry.getKey().userId().equals(userId) || !stored.connectionId().equals(connectionId)) {
                continue;
            }
            if (stored.account().status() != status) {
                entry.setValue(new Stored(connectionId, stored.account().withStatus(status)));
                changed++;
            }
        }
        return changed;
    }

    @Override
    public boolean remove(UUID userId, String accountId) {
        return storage.remove(new Key(userId, accountId)) != null;
    }
}
