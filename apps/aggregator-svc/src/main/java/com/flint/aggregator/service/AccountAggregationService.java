package com.flint.aggregator.service;

import com.flint.aggregator.connection.ConnectionErrorClassifier;
import com.flint.aggregator.connection.ConnectionVerdict;
import com.flint.aggregator.connection.ProviderException;
import com.flint.aggregator.model.Account;
import com.flint.aggregator.model.AccountProvider;
import com.flint.aggregator.model.ConnectionStatus;
import com.flint.aggregator.model.ProviderConnection;
import com.flint.aggregator.normalize.ProviderAccountNormalizer;
import com.flint.aggregator.normalize.RawAccount;
import com.flint.aggregator.normalize.RawBalance;
import com.flint.aggregator.provider.ProviderClient;
import com.flint.aggregator.provider.ProviderClientRegistry;
import com.flint.aggregator.repository.AccountRepository;
import com.flint.aggregator.repository.ConnectionRepository;
import com.flint.aggregator.security.CredentialEncryptor;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

/**
 * Pulls every active provider connection of a user, normalises what comes back and replaces the
 * stored accounts. A failing connection never aborts the others. Only an auth-failure verdict changes
 * stored statuses; it also deactivates the connection until the user links it again.
 */
@Service
public class AccountAggregationService {

    private static final Logger log = LoggerFactory.getLogger(AccountAggregationService.class);
    private static final String INVALID_CREDENTIALS = "INVALID_CREDENTIALS";

    private final ConnectionRepository connectionRepository;
    private final AccountRepository accountRepository;
    private final ProviderClientRegistry clients;
    private final ProviderAccountNormalizer normalizer;
    private final ConnectionErrorClassifier classifier;
    private final CredentialEncryptor encryptor;
    private final Clock clock;

    @Autowired
    public AccountAggregationService(
            ConnectionRepository connectionRepository,
            AccountRepository accountRepository,
            ProviderClientRegistry clients,
            ProviderAccountNormalizer normalizer,
            ConnectionErrorClassifier classifier,
            CredentialEncryptor encryptor,
            Clock clock
    ) {
        this.connectionRepository = connectionRepository;
        this.accountRepository = accountRepository;
        this.clients = clients;
        this.normalizer = normalizer;
        this.classifier = classifier;
        this.encryptor = encryptor;
        this.clock = clock;
    }

    public AggregationResult refreshAccounts(UUID userId) {
        List<Account> refreshed = new ArrayList<>();
        List<ConnectionFailure> failures = new ArrayList<>();
        for (ProviderConnection connection : connectionRepository.findActiveByUserId(userId)) {
            Optional<ProviderClient> client = clients.find(connection.provider());
            if (client.isEmpty()) {
                log.warn("No client enabled for provider {}; skipping connection {}", connection.provider(), connection.id());
                continue;
            }
            try {
                refreshed.addAll(refreshConnection(userId, connection, client.get(), failures));
            } catch (RuntimeException e) {
                failures.add(recordFailure(userId, connection, null, e));
            }
        }
        log.debug("Refreshed {} account(s) for user {} with {} failure(s)", refreshed.size(), userId, failures.size());
        return new AggregationResult(refreshed, failures);
    }

    /**
     * Stores a freshly linked provider credential and pulls its accounts right away.
     */
    public AggregationResult linkConnection(UUID userId, AccountProvider provider, String credential) {
        clients.require(provider);
        ProviderConnection connection = new ProviderConnection(
                UUID.randomUUID().toString(),
                userId,
                provider,
                encryptor.encrypt(credential),
                true,
                clock.instant()
        );
        connectionRepository.save(connection);
        log.info("Linked {} connection {} for user {}", provider, connection.id(), userId);
        return refreshAccounts(userId);
    }

    public List<Account> activeAccounts(UUID userId) {
        return accountRepository.findByUserId(userId).stream()
                .filter(Account::isActive)
                .toList();
    }

    /**
     * Accounts kept for a reconnect prompt: everything that is no longer connected.
     */
    public List<Account> accountsNeedingReconnect(UUID userId) {
        return accountRepository.findByUserId(userId).stream()
                .filter(account -> !account.isActive())
                .toList();
    }

    public boolean removeAccount(UUID userId, String accountId) {
        boolean removed = accountRepository.remove(userId, accountId);
        if (removed) {
            log.info("Removed account {} for user {}", accountId, userId);
        }
        return removed;
    }

    private List<Account> refreshConnection(
            UUID userId,
            ProviderConnection connection,
            ProviderClient client,
            List<ConnectionFailure> failures
    ) {
        String credential = decryptCredential(connection);
        List<RawAccount> rawAccounts = client.listAccounts(credential);
        List<Account> accounts = new ArrayList<>();
        for (RawAccount rawAccount : rawAccounts) {
            try {
                RawBalance balance = client.getBalance(credential, rawAccount.id());
                List<String> malformed = normalizer.malformedFields(balance);
                if (!malformed.isEmpty()) {
                    log.warn("{} account {} reported unparseable {}; treated as zero",
                            connection.provider(), rawAccount.id(), malformed);
                }
                Account account = normalizer.normalize(connection.provider(), rawAccount, balance);
                accountRepository.upsertAccount(userId, connection.id(), account);
                accounts.add(account);
            } catch (RuntimeException e) {
                ConnectionFailure failure = recordFailure(userId, connection, rawAccount.id(), e);
                failures.add(failure);
                if (failure.verdict().shouldMarkDisconnected()) {
                    // the credential is dead for every remaining account too
                    break;
                }
            }
        }
        return accounts;
    }

    /**
     * A stored credential that no longer decrypts (the key changed or was never persisted) is as dead
     * as a revoked one: the user has to link the provider again.
     */
    private String decryptCredential(ProviderConnection connection) {
        try {
            return encryptor.decrypt(connection.encryptedCredential());
        } catch (RuntimeException e) {
            throw new ProviderException(connection.provider(), 401, INVALID_CREDENTIALS,
                    "Stored credential for connection " + connection.id() + " cannot be decrypted", e);
        }
    }

    private ConnectionFailure recordFailure(UUID userId, ProviderConnection connection, String accountId, RuntimeException error) {
        ConnectionVerdict verdict = classifier.classify(error);
        if (verdict.shouldMarkDisconnected()) {
            ConnectionStatus status = verdict.applyTo(ConnectionStatus.CONNECTED);
            int changed = accountRepository.updateStatus(userId, connection.id(), status);
            connectionRepository.deactivate(connection.id());
            log.warn("{} connection {} needs reconnect (status {}, code {}); {} account(s) marked {}",
                    connection.provider(), connection.id(), verdict.httpStatus(), verdict.providerCode(), changed, status);
        } else {
            log.warn("{} connection {} failed{} (status {}, code {}, {}); stored status unchanged",
                    connection.provider(), connection.id(), accountId != null ? " for account " + accountId : "",
                    verdict.httpStatus(), verdict.providerCode(), verdict.kind());
        }
        return new ConnectionFailure(connection.id(), connection.provider(), accountId, verdict);
    }
}
