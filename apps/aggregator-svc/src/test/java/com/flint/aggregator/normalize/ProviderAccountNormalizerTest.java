package com.flint.aggregator.normalize;

import static org.assertj.core.api.Assertions.assertThat;

import com.flint.aggregator.model.Account;
import com.flint.aggregator.model.AccountProvider;
import com.flint.aggregator.model.AccountType;
import com.flint.aggregator.model.ConnectionStatus;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import org.junit.jupiter.api.Test;

class ProviderAccountNormalizerTest {

    private final Clock clock = Clock.fixed(Instant.parse("2024-06-01T12:00:00Z"), ZoneOffset.UTC);
    private final ProviderAccountNormalizer normalizer = new ProviderAccountNormalizer(clock);

    @Test
    void creditCardOwedBecomesNegativeDisplayBalance() {
        RawAccount raw = new RawAccount("acc_cc", "Sapphire", "credit", "credit_card", "Chase", "usd", "4242");

        Account account = normalizer.normalize(AccountProvider.BANK, raw, RawBalance.bank("2711.01", "5288.99"));

        assertThat(account.accountType()).isEqualTo(AccountType.CREDIT);
        assertThat(account.owed()).hasValueSatisfying(owed -> assertThat(owed.value()).isEqualByComparingTo("2711.01"));
        assertThat(account.availableCredit()).hasValueSatisfying(credit -> assertThat(credit.value()).isEqualByComparingTo("5288.99"));
        assertThat(account.displayBalance().value()).isEqualByComparingTo("-2711.01");
        assertThat(account.currency()).isEqualTo("USD");
        assertThat(account.status()).isEqualTo(ConnectionStatus.CONNECTED);
        assertThat(account.lastCheckedAt()).isEqualTo(clock.instant());
    }

    @Test
    void creditDetectedBySubtypeAlone() {
        RawAccount raw = new RawAccount("acc_cc", "Card", "other", "credit_card", null, null, null);

        Account account = normalizer.normalize(AccountProvider.BANK, raw, RawBalance.bank("100.00", "900.00"));

        assertThat(account.isCredit()).isTrue();
        assertThat(account.displayBalance().value()).isEqualByComparingTo("-100.00");
        assertThat(account.institution()).isEqualTo("Unknown");
    }

    @Test
    void alreadyNegativeCreditLedgerIsNotDoubleNegated() {
        RawAccount raw = new RawAccount("acc_cc", "Card", "credit", null, "Amex", "USD", null);

        Account account = normalizer.normalize(AccountProvider.BANK, raw, RawBalance.bank("-450.25", "549.75"));

        assertThat(account.owed()).hasValueSatisfying(owed -> assertThat(owed.value()).isEqualByComparingTo("450.25"));
        assertThat(account.displayBalance().value()).isEqualByComparingTo("-450.25");
        assertThat(account.accountSubtype()).isEqualTo("credit_card");
    }

    @Test
    void depositoryPrefersAvailableOverLedger() {
        RawAccount raw = new RawAccount("acc_chk", "Checking", "depository", "checking", "Chase", "USD", "0001");

        Account account = normalizer.normalize(AccountProvider.BANK, raw, RawBalance.bank("1500.00", "1250.50"));

        assertThat(account.accountType()).isEqualTo(AccountType.DEPOSITORY);
        assertThat(account.displayBalance().value()).isEqualByComparingTo("1250.50");
        assertThat(account.ledger().value()).isEqualByComparingTo("1500.00");
        assertThat(account.owed()).isEmpty();
    }

    @Test
    void depositoryFallsBackToLedgerWhenAvailableMissingOrMalformed() {
        RawAccount raw = new RawAccount("acc_sav", "Savings", "depository", "savings", "Ally", "USD", null);

        Account missing = normalizer.normalize(AccountProvider.BANK, raw, RawBalance.bank("$2,000.00", null));
        Account malformed = normalizer.normalize(AccountProvider.BANK, raw, RawBalance.bank("2000.00", "n/a"));

        assertThat(missing.displayBalance().value()).isEqualByComparingTo("2000.00");
        assertThat(malformed.displayBalance().value()).isEqualByComparingTo("2000.00");
    }

    @Test
    void nonCreditBalancesNeverGoNegative() {
        RawAccount raw = new RawAccount("acc_chk", "Overdrawn", "depository", "checking", "Chase", "USD", null);

        Account account = normalizer.normalize(AccountProvider.BANK, raw, RawBalance.bank("-35.00", "-35.00"));

        assertThat(account.displayBalance().value().signum()).isZero();
    }

    @Test
    void missingBalanceFieldsDefaultToZero() {
        RawAccount raw = new RawAccount("acc_chk", "Checking", "depository", null, null, null, null);

        Account account = normalizer.normalize(AccountProvider.BANK, raw, null);

        assertThat(account.displayBalance().value()).isEqualByComparingTo(BigDecimal.ZERO);
        assertThat(account.available().isZero()).isTrue();
    }

    @Test
    void brokerageAccountIsValuedAsCashPlusHoldings() {
        RawAccount raw = new RawAccount("brk_1", "Individual", "margin", null, "Robinhood", "USD", null);
        RawBalance balance = RawBalance.investment("250.00", "1000.00", List.of(
                new RawPosition("AAPL", "10", "190.50", null),
                new RawPosition("VTI", "3", "250.00", "760.00")
        ));

        Account account = normalizer.normalize(AccountProvider.BROKERAGE, raw, balance);

        assertThat(account.accountType()).isEqualTo(AccountType.INVESTMENT);
        assertThat(account.holdings()).hasValueSatisfying(h -> assertThat(h.value()).isEqualByComparingTo("2665.00"));
        assertThat(account.displayBalance().value()).isEqualByComparingTo("2915.00");
        // provider total is kept as ledger but not used for display
        assertThat(account.ledger().value()).isEqualByComparingTo("1000.00");
        assertThat(account.available().value()).isEqualByComparingTo("250.00");
    }

    @Test
    void brokerageSavingsTypeStillValuedAsCashPlusHoldings() {
        RawAccount raw = new RawAccount("brk_2", "High Yield Cash", "savings", null, "Wealthsimple", "USD", null);
        RawBalance balance = RawBalance.investment("1000.00", null, List.of(new RawPosition("AAPL", "2", "100.00", null)));

        Account account = normalizer.normalize(AccountProvider.BROKERAGE, raw, balance);

        assertThat(account.accountType()).isEqualTo(AccountType.INVESTMENT);
        assertThat(account.displayBalance().value()).isEqualByComparingTo("1200.00");
    }

    @Test
    void walletCheckingTypeStillCrypto() {
        RawAccount raw = new RawAccount("0xdef", "Wallet", "checking", null, "Ethereum", "USD", null);

        Account account = normalizer.normalize(AccountProvider.WALLET, raw,
                RawBalance.wallet(List.of(new RawPosition("USDC", "50", "1.00", null))));

        assertThat(account.accountType()).isEqualTo(AccountType.CRYPTO);
        assertThat(account.displayBalance().value()).isEqualByComparingTo("50.00");
    }

    @Test
    void walletDefaultsToCrypto() {
        RawAccount raw = new RawAccount("0xabc", "Wallet", null, null, "Ethereum", "USD", null);

        Account account = normalizer.normalize(AccountProvider.WALLET, raw,
                RawBalance.wallet(List.of(new RawPosition("ETH", "1.5", null, "4500.00"))));

        assertThat(account.accountType()).isEqualTo(AccountType.CRYPTO);
        assertThat(account.displayBalance().value()).isEqualByComparingTo("4500.00");
    }

    @Test
    void malformedFieldsAreReportedButNotFatal() {
        RawBalance balance = new RawBalance("abc", "12.00", null, null, List.of(new RawPosition("AAPL", "ten", "1", null)));

        assertThat(normalizer.malformedFields(balance)).containsExactly("ledger", "positions[AAPL].units");
        assertThat(normalizer.malformedFields(RawBalance.bank(null, ""))).isEmpty();
    }
}
