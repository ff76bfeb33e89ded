package com.flint.aggregator.model;

import java.util.Locale;

public enum AccountType {
    DEPOSITORY,
    CREDIT,
    INVESTMENT,
    CRYPTO;

    /**
     * Maps a provider's free-form type string, falling back to the provider's natural type
     * when the value is missing or unrecognised.
     */
    public static AccountType fromProvider(String rawType, AccountProvider provider) {
        if (rawType != null && !rawType.isBlank()) {
            switch (rawType.trim().toLowerCase(Locale.ROOT)) {
                case "depository", "checking", "savings":
                    return DEPOSITORY;
                case "credit", "credit_card":
                    return CREDIT;
                case "investment", "brokerage", "margin", "tfsa", "rrsp", "ira":
                    return INVESTMENT;
                case "crypto", "wallet":
                    return CRYPTO;
                default:
                    break;
            }
        }
        return switch (provider) {
            case BANK -> DEPOSITORY;
            case BROKERAGE -> INVESTMENT;
            case WALLET -> CRYPTO;
        };
    }
}
