package com.flint.aggregator.normalize;

import com.flint.aggregator.model.Account;
import com.flint.aggregator.model.AccountProvider;
import com.flint.aggregator.model.AccountType;
import com.flint.aggregator.model.ConnectionStatus;
import com.flint.aggregator.model.DisplayBalance;
import com.flint.aggregator.model.UnsignedAmount;
import java.math.BigDecimal;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Maps one provider's raw account and balance into the canonical {@link Account}.
 *
 * <p>Total: missing or unparseable numbers count as zero and nothing here throws for malformed
 * optional fields. Callers that want to log bad input use {@link #malformedFields(RawBalance)}.
 *
 * <p>Credit accounts (type {@code credit} or subtype {@code credit_card}) arrive with the amount owed
 * as a positive ledger and the remaining credit as available. They map to {@code owed = |ledger|},
 * {@code availableCredit = available}, {@code displayBalance = -owed}. Investment and crypto accounts
 * are valued as {@code cash + holdings}; the provider's own total is kept as ledger only.
 */
@Component
public class ProviderAccountNormalizer {

    private static final String DEFAULT_CURRENCY = "USD";
    private static final String UNKNOWN_INSTITUTION = "Unknown";
    private static final String CREDIT_CARD_SUBTYPE = "credit_card";

    private final Clock clock;

    @Autowired
    public ProviderAccountNormalizer(Clock clock) {
        this.clock = clock;
    }

    public Account normalize(AccountProvider provider, RawAccount rawAccount, RawBalance rawBalance) {
        RawBalance balance = rawBalance != null ? rawBalance : RawBalance.empty();
        if (isCredit(rawAccount)) {
            return normalizeCredit(provider, rawAccount, balance);
        }
        AccountType type = AccountType.fromProvider(rawAccount.type(), provider);
        if (type == AccountType.DEPOSITORY && provider != AccountProvider.BANK) {
            // brokerage and wallet balances carry cash and positions only, never ledger or available
            type = AccountType.fromProvider(null, provider);
        }
        if (type == AccountType.INVESTMENT || type == AccountType.CRYPTO) {
            return normalizeHoldings(provider, rawAccount, balance, type);
        }
        return normalizeDepository(provider, rawAccount, balance, type);
    }

    /**
     * Names of numeric fields that were present but could not be parsed and were read as zero.
     */
    public List<String> malformedFields(RawBalance rawBalance) {
        List<String> fields = new ArrayList<>();
        if (rawBalance == null) {
            return fields;
        }
        if (DecimalParsing.isMalformed(rawBalance.ledger())) fields.add("ledger");
        if (DecimalParsing.isMalformed(rawBalance.available())) fields.add("available");
        if (DecimalParsing.isMalformed(rawBalance.cash())) fields.add("cash");
        if (DecimalParsing.isMalformed(rawBalance.total())) fields.add("total");
        for (RawPosition position : rawBalance.positions()) {
            String symbol = position.symbol() != null ? position.symbol() : "?";
            if (DecimalParsing.isMalformed(position.units())) fields.add("positions[" + symbol + "].units");
            if (DecimalParsing.isMalformed(position.price())) fields.add("positions[" + symbol + "].price");
            if (DecimalParsing.isMalformed(position.marketValue())) fields.add("positions[" + symbol + "].marketValue");
        }
        return fields;
    }

    static boolean isCredit(RawAccount rawAccount) {
        String type = lower(rawAccount.type());
        String subtype = lower(rawAccount.subtype());
        return "credit".equals(type) || CREDIT_CARD_SUBTYPE.equals(subtype);
    }

    private Account normalizeCredit(AccountProvider provider, RawAccount raw, RawBalance balance) {
        // some providers already send the debt negative; owed is always the magnitude
        UnsignedAmount owed = UnsignedAmount.of(DecimalParsing.parseOrZero(balance.ledger()).abs());
        UnsignedAmount availableCredit = nonNegative(DecimalParsing.parseOrZero(balance.available()));
        return new Account(
                raw.id(),
                provider,
                institution(raw),
                raw.name(),
                AccountType.CREDIT,
                raw.subtype() != null ? raw.subtype() : CREDIT_CARD_SUBTYPE,
                currency(raw),
                raw.lastFour(),
                DisplayBalance.debt(owed),
                owed,
                availableCredit,
                Optional.of(owed),
                Optional.of(availableCredit),
                Optional.empty(),
                ConnectionStatus.CONNECTED,
                clock.instant()
        );
    }

    private Account normalizeDepository(AccountProvider provider, RawAccount raw, RawBalance balance, AccountType type) {
        UnsignedAmount ledger = nonNegative(DecimalParsing.parseOrZero(balance.ledger()));
        Optional<BigDecimal> availableValue = DecimalParsing.parse(balance.available());
        UnsignedAmount available = nonNegative(availableValue.orElse(BigDecimal.ZERO));
        UnsignedAmount shown = availableValue.isPresent() ? available : ledger;
        return new Account(
                raw.id(),
                provider,
                institution(raw),
                raw.name(),
                type,
                raw.subtype(),
                currency(raw),
                raw.lastFour(),
                DisplayBalance.asset(shown),
                ledger,
                available,
                Optional.empty(),
                Optional.empty(),
                Optional.empty(),
                ConnectionStatus.CONNECTED,
                clock.instant()
        );
    }

    private Account normalizeHoldings(AccountProvider provider, RawAccount raw, RawBalance balance, AccountType type) {
        UnsignedAmount cash = nonNegative(DecimalParsing.parseOrZero(balance.cash()));
        UnsignedAmount holdings = nonNegative(holdingsValue(balance.positions()));
        UnsignedAmount value = UnsignedAmount.of(cash.value().add(holdings.value()));
        UnsignedAmount ledger = DecimalParsing.parse(balance.total())
                .map(ProviderAccountNormalizer::nonNegative)
                .orElse(value);
        return new Account(
                raw.id(),
                provider,
                institution(raw),
                raw.name(),
                type,
                raw.subtype(),
                currency(raw),
                raw.lastFour(),
                DisplayBalance.asset(value),
                ledger,
                cash,
                Optional.empty(),
                Optional.empty(),
                Optional.of(holdings),
                ConnectionStatus.CONNECTED,
                clock.instant()
        );
    }

    static BigDecimal holdingsValue(List<RawPosition> positions) {
        BigDecimal total = BigDecimal.ZERO;
        for (RawPosition position : positions) {
            Optional<BigDecimal> marketValue = DecimalParsing.parse(position.marketValue());
            if (marketValue.isPresent()) {
                total = total.add(marketValue.get());
            } else {
                total = total.add(DecimalParsing.parseOrZero(position.units())
                        .multiply(DecimalParsing.parseOrZero(position.price())));
            }
        }
        return total;
    }

    private static UnsignedAmount nonNegative(BigDecimal value) {
        return UnsignedAmount.of(value.signum() < 0 ? BigDecimal.ZERO : value);
    }

    private static String institution(RawAccount raw) {
        return raw.institution() != null && !raw.institution().isBlank() ? raw.institution() : UNKNOWN_INSTITUTION;
    }

    private static String currency(RawAccount raw) {
        return raw.currency() != null && !raw.currency().isBlank() ? raw.currency().toUpperCase(Locale.ROOT) : DEFAULT_CURRENCY;
    }

    private static String lower(String value) {
        return value == null ? null : value.trim().toLowerCase(Locale.ROOT);
    }
}
