package com.connection.harness.config;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Loaded harness configuration: service settings keyed by service type.
 */
public record HarnessConfig(Map<String, ServiceSettings> services) {

    public HarnessConfig {
        services = services != null ? Collections.unmodifiableMap(new LinkedHashMap<>(services)) : Map.of();
    }

    public static HarnessConfig empty() {
        return new HarnessConfig(Map.of());
    }

    public Optional<ServiceSettings> service(String serviceType) {
        return Optional.ofNullable(services.get(serviceType));
    }

    public Set<String> serviceTypes() {
        return services.keySet();
    }

    /**
     * Returns a new config with the other config's services added.
     * A service type present in both is taken from {@code other}.
     */
    public HarnessConfig merge(HarnessConfig other) {
        Map<String, ServiceSettings> merged = new LinkedHashMap<>(services);
        merged.putAll(other.services());
        return new HarnessConfig(merged);
    }
}
