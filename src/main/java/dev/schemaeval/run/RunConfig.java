package dev.schemaeval.run;

import java.util.List;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import lombok.Builder;

/**
 * Everything needed to execute a run. Immutable once built.
 *
 * @param items mock inputs, evaluated in this order for every model
 * @param models target model ids, evaluated in this order
 * @param concurrency per-run cap on in-flight calls, null to use the configured default
 */
@Builder
public record RunConfig(
        @Nonnull String name,
        @Nonnull PromptTemplate promptTemplate,
        @Nonnull TargetSchema schema,
        @Nonnull List<MockItem> items,
        @Nonnull List<String> models,
        @Nullable Integer concurrency) {

    public RunConfig {
        name = name == null || name.isBlank() ? "untitled run" : name;
        items = items == null ? List.of() : List.copyOf(items);
        models = models == null ? List.of() : List.copyOf(models);
    }

    public int expectedTaskCount() {
        return items.size() * models.size();
    }
}
