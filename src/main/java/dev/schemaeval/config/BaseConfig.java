package dev.schemaeval.config;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import javax.annotation.Nullable;

/**
 * Resolves settings from explicit overrides first, then from environment variables, then from
 * the supplied default.
 */
abstract class BaseConfig {
    protected final Map<String, String> envOverrides;

    protected BaseConfig(Map<String, String> envOverrides) {
        this.envOverrides = Collections.unmodifiableMap(new HashMap<>(envOverrides));
    }

    @Nullable
    private String lookup(String key) {
        if (envOverrides.containsKey(key)) {
            return envOverrides.get(key);
        }
        return System.getenv(key);
    }

    protected String getRequiredConfig(String key) {
        var value = lookup(key);
        if (value == null || value.isBlank()) {
            throw new IllegalStateException("missing required config: " + key);
        }
        return value;
    }

    protected String getConfig(String key, String defaultValue) {
        return getConfig(key, defaultValue, String.class);
    }

    protected int getConfig(String key, int defaultValue) {
        return getConfig(key, defaultValue, Integer.class);
    }

    protected long getConfig(String key, long defaultValue) {
        return getConfig(key, defaultValue, Long.class);
    }

    protected double getConfig(String key, double defaultValue) {
        return getConfig(key, defaultValue, Double.class);
    }

    protected boolean getConfig(String key, boolean defaultValue) {
        return getConfig(key, defaultValue, Boolean.class);
    }

    @Nullable
    protected <T> T getConfig(String key, @Nullable T defaultValue, Class<T> type) {
        var raw = lookup(key);
        if (raw == null || raw.isBlank()) {
            return defaultValue;
        }
        raw = raw.trim();
        try {
            if (type == String.class) {
                return type.cast(raw);
            } else if (type == Integer.class) {
                return type.cast(Integer.parseInt(raw));
            } else if (type == Long.class) {
                return type.cast(Long.parseLong(raw));
            } else if (type == Double.class) {
                return type.cast(Double.parseDouble(raw));
            } else if (type == Boolean.class) {
                return type.cast(parseBoolean(key, raw));
            }
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(
                    "invalid value for %s: '%s' is not a %s"
                            .formatted(key, raw, type.getSimpleName()),
                    e);
        }
        throw new IllegalArgumentException("unsupported config type: " + type.getName());
    }

    private static boolean parseBoolean(String key, String raw) {
        if ("true".equalsIgnoreCase(raw)) {
            return true;
        } else if ("false".equalsIgnoreCase(raw)) {
            return false;
        }
        throw new IllegalArgumentException(
                "invalid value for %s: '%s' is not a boolean".formatted(key, raw));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        return envOverrides.equals(((BaseConfig) o).envOverrides);
    }

    @Override
    public int hashCode() {
        return Objects.hash(getClass(), envOverrides);
    }
}
