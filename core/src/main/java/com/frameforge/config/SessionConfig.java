package com.frameforge.config;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Map-backed session configuration seeded with {@link ConfigDefaults}.
 *
 * <p>Safe for concurrent use; values set after an ingestion call started may or may not
 * be seen by it, since each call reads its settings once up front.
 */
public class SessionConfig implements ConfigProvider {

    private final Map<String, String> config;

    /**
     * Creates a configuration holding only the defaults.
     */
    public SessionConfig() {
        this(Collections.emptyMap());
    }

    /**
     * Creates a configuration with the defaults overridden by the given entries.
     *
     * @param overrides entries taking precedence over the defaults
     */
    public SessionConfig(Map<String, String> overrides) {
        this.config = new ConcurrentHashMap<>(ConfigDefaults.getDefaults());
        for (Map.Entry<String, String> entry : overrides.entrySet()) {
            set(entry.getKey(), entry.getValue());
        }
    }

    @Override
    public List<String> getConfigs(String... keys) {
        List<String> values = new ArrayList<>(keys.length);
        for (String key : keys) {
            values.add(config.get(key));
        }
        return values;
    }

    /**
     * Set configuration value.
     *
     * @param key Configuration key
     * @param value Configuration value
     * @return this configuration
     * @throws NullPointerException if the key or value is null
     */
    public SessionConfig set(String key, String value) {
        Objects.requireNonNull(key, "config key must not be null");
        Objects.requireNonNull(value, () -> "value of config '" + key + "' must not be null");
        config.put(key, value);
        return this;
    }

    /**
     * Get all configuration entries.
     *
     * @return copy of configuration map
     */
    public Map<String, String> getAll() {
        return new HashMap<>(config);
    }

    @Override
    public String toString() {
        return "SessionConfig(" + config.size() + " entries)";
    }
}
