package com.authplatform.authsvc.domain.oauth;

import com.authplatform.authsvc.domain.port.IdentityProvider;
import com.authplatform.authsvc.domain.port.ProviderType;
import com.authplatform.authsvc.shared.exception.ProviderNotFoundException;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Identity providers by id, in registration order.
 */
public class IdentityProviderRegistry {

    private final Map<String, IdentityProvider> providers;

    public IdentityProviderRegistry(List<? extends IdentityProvider> providers) {
        Map<String, IdentityProvider> byId = new LinkedHashMap<>();
        for (IdentityProvider provider : providers) {
            if (byId.putIfAbsent(provider.id(), provider) != null) {
                throw new IllegalArgumentException("Duplicate identity provider id: " + provider.id());
            }
        }
        this.providers = Collections.unmodifiableMap(byId);
    }

    /**
     * Resolves an OAuth provider. Unknown ids and non-OAuth providers both fail.
     */
    public IdentityProvider resolve(String providerId) {
        IdentityProvider provider = providers.get(providerId);
        if (provider == null || provider.type() != ProviderType.OAUTH) {
            throw new ProviderNotFoundException(providerId);
        }
        return provider;
    }

    public Set<String> ids() {
        return providers.keySet();
    }
}
