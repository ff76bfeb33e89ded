package com.flint.aggregator.controller;

import com.flint.aggregator.controller.dto.AccountResponseDto;
import com.flint.aggregator.controller.dto.AccountsListResponseDto;
import com.flint.aggregator.controller.dto.ConnectionFailureDto;
import com.flint.aggregator.controller.dto.RefreshResponseDto;
import com.flint.aggregator.model.Account;
import com.flint.aggregator.model.DisplayBalance;
import com.flint.aggregator.security.CurrentUserProvider;
import com.flint.aggregator.security.RequestContextHolder;
import com.flint.aggregator.service.AccountAggregationService;
import com.flint.aggregator.service.AggregationResult;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.UUID;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/accounts")
public class AccountsController {

    private final AccountAggregationService aggregationService;
    private final CurrentUserProvider currentUserProvider;

    public AccountsController(AccountAggregationService aggregationService, CurrentUserProvider currentUserProvider) {
        this.aggregationService = aggregationService;
        this.currentUserProvider = currentUserProvider;
    }

    @GetMapping(produces = MediaType.APPLICATION_JSON_VALUE)
    public AccountsListResponseDto listAccounts() {
        UUID userId = currentUserProvider.requireCurrentUserId();
        return toListResponse(aggregationService.activeAccounts(userId));
    }

    @GetMapping(value = "/reconnect", produces = MediaType.APPLICATION_JSON_VALUE)
    public AccountsListResponseDto listAccountsNeedingReconnect() {
        UUID userId = currentUserProvider.requireCurrentUserId();
        return toListResponse(aggregationService.accountsNeedingReconnect(userId));
    }

    @PostMapping(value = "/refresh", produces = MediaType.APPLICATION_JSON_VALUE)
    public RefreshResponseDto refresh() {
        UUID userId = currentUserProvider.requireCurrentUserId();
        AggregationResult result = aggregationService.refreshAccounts(userId);
        return new RefreshResponseDto(
                result.accounts().stream().map(AccountResponseDto::from).toList(),
                result.failures().stream().map(ConnectionFailureDto::from).toList(),
                traceId()
        );
    }

    @DeleteMapping("/{accountId}")
    public ResponseEntity<Void> removeAccount(@PathVariable String accountId) {
        UUID userId = currentUserProvider.requireCurrentUserId();
        if (!aggregationService.removeAccount(userId, accountId)) {
            throw new NoSuchElementException("Account not found: " + accountId);
        }
        return ResponseEntity.noContent().build();
    }

    private static AccountsListResponseDto toListResponse(List<Account> accounts) {
        String currency = accounts.stream()
                .map(Account::currency)
                .findFirst()
                .orElse("USD");
        return new AccountsListResponseDto(
                currency,
                DisplayBalance.sum(accounts).value(),
                accounts.stream().map(AccountResponseDto::from).toList(),
                traceId()
        );
    }

    static String traceId() {
        return RequestContextHolder.traceId().orElse(null);
    }
}
