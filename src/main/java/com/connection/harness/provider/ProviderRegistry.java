package com.connection.harness.provider;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registry of connection providers keyed by service type.
 * Holds at most one provider per service type; registering again replaces the previous provider.
 * Each manager owns its own registry instance.
 */
public class ProviderRegistry {
    private static final Logger log = LoggerFactory.getLogger(ProviderRegistry.class);

    private final Map<String, ConnectionProvider> providers = new ConcurrentHashMap<>();

    /**
     * Registers a provider for a service type.
     *
     * @return the provider previously registered for the service type, if any
     */
    public Optional<ConnectionProvider> register(String serviceType, ConnectionProvider provider) {
        if (serviceType == null || serviceType.isBlank()) {
            throw new IllegalArgumentException("serviceType must not be blank");
        }
        Objects.requireNonNull(provider, "provider");
        ConnectionProvider previous = providers.put(serviceType, provider);
        if (previous != null && previous != provider) {
            log.info("Replaced provider for service type {}: {} -> {}", serviceType, previous, provider);
        }
        return Optional.ofNullable(previous);
    }

    public Optional<ConnectionProvider> get(String serviceType) {
        if (serviceType == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(providers.get(serviceType));
    }

    public Optional<ConnectionProvider> unregister(String serviceType) {
        return Optional.ofNullable(providers.remove(serviceType));
    }

    /**
     * Returns a snapshot of all registered providers.
     */
    public Map<String, ConnectionProvider> getAll() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(providers));
    }

    public void clear() {
        providers.clear();
    }

    public int size() {
        return providers.size();
    }
}
