package dev.schemaeval.run;

import lombok.Getter;
import lombok.experimental.Accessors;

/** A run configuration was rejected. No run is created when this is thrown. */
@Getter
@Accessors(fluent = true)
public class ConfigException extends RuntimeException {
    public enum Reason {
        MISSING_PLACEHOLDER,
        NO_ITEMS,
        NO_MODELS,
        SCHEMA_NOT_APPROVED,
        INVALID_CONCURRENCY,
        DUPLICATE_MODEL,
        DUPLICATE_ITEM
    }

    private final Reason reason;

    public ConfigException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }
}
