package com.flint.aggregator.provider;

import com.flint.aggregator.model.AccountProvider;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.springframework.stereotype.Component;

@Component
public class ProviderClientRegistry {

    private final Map<AccountProvider, ProviderClient> clients = new EnumMap<>(AccountProvider.class);

    public ProviderClientRegistry(List<ProviderClient> clients) {
        for (ProviderClient client : clients) {
            this.clients.put(client.provider(), client);
        }
    }

    public Optional<ProviderClient> find(AccountProvider provider) {
        return Optional.ofNullable(clients.get(provider));
    }

    public ProviderClient require(AccountProvider provider) {
        return find(provider).orElseThrow(() -> new IllegalArgumentException("provider not configured: " + provider));
    }
}
