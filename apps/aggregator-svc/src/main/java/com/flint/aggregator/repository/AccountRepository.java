package com.flint.aggregator.repository;

import com.flint.aggregator.model.Account;
import com.flint.aggregator.model.ConnectionStatus;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface AccountRepository {

    /**
     * Replaces the stored account with the same id for this user, whatever it held before.
     */
    Account upsertAccount(UUID userId, String connectionId, Account account);

    List<Account> findByUserId(UUID userId);

    Optional<Account> findById(UUID userId, String accountId);

    /**
     * @return number of accounts whose status changed
     */
    int updateStatus(UUID userId, String connectionId, ConnectionStatus status);

    boolean remove(UUID userId, String accountId);
}
