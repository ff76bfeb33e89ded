package com.flint.aggregator.provider;

import com.flint.aggregator.model.AccountProvider;
import com.flint.aggregator.normalize.RawAccount;
import com.flint.aggregator.normalize.RawBalance;
import java.util.List;

/**
 * Narrow contract this service needs from an upstream account provider. Implementations bound every
 * call with the provider's request timeout and the shared retry policy, then let the last failure
 * propagate for classification.
 */
public interface ProviderClient {

    AccountProvider provider();

    List<RawAccount> listAccounts(String credential);

    RawBalance getBalance(String credential, String accountId);

    LinkStart startLinkFlow(String userId, String callbackUrl);
}
