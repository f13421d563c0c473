package dev.schemaeval.run;

import java.util.UUID;
import javax.annotation.Nonnull;

/** One (model, item) pair of a run, with its prompt already rendered. */
public record TestTask(
        @Nonnull UUID runId,
        @Nonnull String modelId,
        @Nonnull MockItem item,
        @Nonnull String renderedPrompt) {}
