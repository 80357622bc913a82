package win.ixuni.chunkledger.core.config;

import lombok.Data;

import java.util.HashMap;
import java.util.Map;

/**
 * Component configuration
 * <p>
 * Generic configuration for a tracker or an object store. Backend-specific settings
 * (endpoint, bucket, credentials...) live in {@link #properties}.
 */
@Data
public class ComponentConfig {

    /**
     * Instance name, used in logs
     */
    private String name;

    /**
     * Backend type (memory, s3, ...)
     */
    private String type;

    /**
     * Whether enabled
     */
    private boolean enabled = true;

    /**
     * Backend-specific configuration
     */
    private Map<String, Object> properties = new HashMap<>();

    public static ComponentConfig of(String name, String type) {
        ComponentConfig config = new ComponentConfig();
        config.setName(name);
        config.setType(type);
        return config;
    }

    /**
     * Fluent setter for a single property
     */
    public ComponentConfig with(String key, Object value) {
        properties.put(key, value);
        return this;
    }

    /**
     * Get a string configuration value
     */
    public String getString(String key, String defaultValue) {
        Object value = properties.get(key);
        return value != null ? value.toString() : defaultValue;
    }

    /**
     * Get an integer configuration value
     */
    public Integer getInt(String key, Integer defaultValue) {
        Object value = properties.get(key);
        if (value == null) {
            return defaultValue;
        }
        if (value instanceof Number) {
            return ((Number) value).intValue();
        }
        return Integer.parseInt(value.toString());
    }

    /**
     * Get a long integer configuration value
     */
    public Long getLong(String key, Long defaultValue) {
        Object value = properties.get(key);
        if (value == null) {
            return defaultValue;
        }
        if (value instanceof Number) {
            return ((Number) value).longValue();
        }
        return Long.parseLong(value.toString());
    }

    /**
     * Get a boolean configuration value
     */
    public Boolean getBoolean(String key, Boolean defaultValue) {
        Object value = properties.get(key);
        if (value == null) {
            return defaultValue;
        }
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        return Boolean.parseBoolean(value.toString());
    }
}
