package com.frameforge.config;

import java.util.List;

/**
 * Read-only access to session configuration.
 *
 * <p>Values are strings; boolean settings are enabled only by the exact value
 * {@code "true"}. A key with no value yields {@code null}.
 */
@FunctionalInterface
public interface ConfigProvider {

    /**
     * Looks up several configuration values at once.
     *
     * @param keys the configuration keys
     * @return the values, positionally matching {@code keys}
     */
    List<String> getConfigs(String... keys);

    /**
     * Looks up a single configuration value.
     *
     * @param key the configuration key
     * @return the value, or null if not set
     */
    default String getConfig(String key) {
        return getConfigs(key).get(0);
    }
}
