package com.connection.harness.config;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Settings for one named connection of a service.
 *
 * @param name       the connection id
 * @param enabled    whether the connection may be created
 * @param properties provider-specific properties (host, port, credentials, ...)
 */
public record ConnectionSettings(String name, boolean enabled, Map<String, Object> properties) {

    public ConnectionSettings {
        Objects.requireNonNull(name, "name");
        properties = properties != null ? Collections.unmodifiableMap(new LinkedHashMap<>(properties)) : Map.of();
    }

    public static ConnectionSettings of(String name, Map<String, Object> properties) {
        return new ConnectionSettings(name, true, properties);
    }

    public Optional<Object> get(String key) {
        return Optional.ofNullable(properties.get(key));
    }

    public String getString(String key, String defaultValue) {
        Object value = properties.get(key);
        return value != null ? value.toString() : defaultValue;
    }

    public int getInt(String key, int defaultValue) {
        Object value = properties.get(key);
        if (value == null) {
            return defaultValue;
        }
        if (value instanceof Number n) {
            return n.intValue();
        }
        try {
            return Integer.parseInt(value.toString().trim());
        } catch (NumberFormatException e) {
            throw new ConfigurationException(
                    "Property '" + key + "' of connection '" + name + "' is not an integer: " + value, e);
        }
    }

    public boolean getBoolean(String key, boolean defaultValue) {
        Object value = properties.get(key);
        if (value == null) {
            return defaultValue;
        }
        if (value instanceof Boolean b) {
            return b;
        }
        return Boolean.parseBoolean(value.toString().trim());
    }
}
