package com.enterprise.qb.spring;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Named registry of {@link StatementProvider}s.
 */
public class StatementProviderRegistry {

    private final Map<String, StatementProvider> providers = new LinkedHashMap<>();

    public void register(String name, StatementProvider provider) {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(provider, "provider");
        if (providers.putIfAbsent(name, provider) != null) {
            throw new IllegalArgumentException("Provider already registered: " + name);
        }
    }

    public StatementProvider get(String name) {
        StatementProvider provider = providers.get(name);
        if (provider == null) {
            throw new IllegalArgumentException("No provider registered: " + name);
        }
        return provider;
    }

    public Map<String, StatementProvider> all() {
        return Collections.unmodifiableMap(providers);
    }
}
