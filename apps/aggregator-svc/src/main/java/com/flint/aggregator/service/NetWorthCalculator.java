package com.flint.aggregator.service;

import com.flint.aggregator.model.Account;
import com.flint.aggregator.model.AccountType;
import com.flint.aggregator.model.DisplayBalance;
import java.util.Collection;
import java.util.List;
import org.springframework.stereotype.Component;

/**
 * Buckets connected accounts by type. Everything is summed through {@link DisplayBalance}, so credit
 * accounts reduce the total.
 */
@Component
public class NetWorthCalculator {

    public NetWorthBreakdown calculate(Collection<Account> accounts) {
        List<Account> active = accounts.stream().filter(Account::isActive).toList();
        return new NetWorthBreakdown(
                DisplayBalance.sum(active).value(),
                sumOf(active, AccountType.DEPOSITORY).value(),
                sumOf(active, AccountType.INVESTMENT).value(),
                sumOf(active, AccountType.CRYPTO).value(),
                sumOf(active, AccountType.CREDIT).value().negate()
        );
    }

    private static DisplayBalance sumOf(List<Account> accounts, AccountType type) {
        return DisplayBalance.sum(accounts.stream().filter(account -> account.accountType() == type).toList());
    }
}
