package dev.schemaeval.run;

import java.util.HashSet;
import javax.annotation.Nonnull;

/** Synchronous preconditions checked before a run is created. The first failure wins. */
public final class ConfigValidator {
    private final String placeholder;

    public ConfigValidator(@Nonnull String placeholder) {
        this.placeholder = placeholder;
    }

    /**
     * @throws ConfigException describing the first precondition {@code config} violates
     */
    public void validate(@Nonnull RunConfig config) {
        if (config.promptTemplate() == null
                || config.promptTemplate().content() == null
                || !config.promptTemplate().content().contains(placeholder)) {
            throw new ConfigException(
                    ConfigException.Reason.MISSING_PLACEHOLDER,
                    "prompt template must contain " + placeholder);
        }
        if (config.items().isEmpty()) {
            throw new ConfigException(
                    ConfigException.Reason.NO_ITEMS, "at least one mock item is required");
        }
        if (config.models().isEmpty()) {
            throw new ConfigException(
                    ConfigException.Reason.NO_MODELS, "at least one target model is required");
        }
        if (config.schema() == null || !config.schema().isApproved()) {
            throw new ConfigException(
                    ConfigException.Reason.SCHEMA_NOT_APPROVED,
                    "schema %s is not approved"
                            .formatted(
                                    config.schema() == null
                                            ? "<none>"
                                            : "'%s' (%s)"
                                                    .formatted(
                                                            config.schema().name(),
                                                            config.schema().status())));
        }
        if (config.concurrency() != null && config.concurrency() < 1) {
            throw new ConfigException(
                    ConfigException.Reason.INVALID_CONCURRENCY,
                    "concurrency must be at least 1, got " + config.concurrency());
        }
        var models = new HashSet<String>();
        for (String model : config.models()) {
            if (!models.add(model)) {
                throw new ConfigException(
                        ConfigException.Reason.DUPLICATE_MODEL, "model listed twice: " + model);
            }
        }
        var itemIds = new HashSet<String>();
        for (MockItem item : config.items()) {
            if (!itemIds.add(item.id())) {
                throw new ConfigException(
                        ConfigException.Reason.DUPLICATE_ITEM, "item listed twice: " + item.id());
            }
        }
    }
}
