package com.flint.aggregator.connection;

import com.flint.aggregator.model.AccountProvider;

/**
 * Failure reported by a provider in a shape other than a raw HTTP error, for example an error
 * envelope inside a 200 response, or a stored credential for that provider that cannot be used.
 */
public class ProviderException extends RuntimeException {

    private final AccountProvider provider;
    private final int status;
    private final String providerCode;

    public ProviderException(AccountProvider provider, int status, String providerCode, String message) {
        super(message);
        this.provider = provider;
        this.status = status;
        this.providerCode = providerCode;
    }

    public ProviderException(AccountProvider provider, int status, String providerCode, String message, Throwable cause) {
        super(message, cause);
        this.provider = provider;
        this.status = status;
        this.providerCode = providerCode;
    }

    public AccountProvider getProvider() {
        return provider;
    }

    public int getStatus() {
        return status;
    }

    public String getProviderCode() {
        return providerCode;
    }
}
