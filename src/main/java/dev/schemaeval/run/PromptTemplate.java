package dev.schemaeval.run;

import javax.annotation.Nonnull;

/** The master prompt sent to every model. Must contain the input placeholder. */
public record PromptTemplate(@Nonnull String id, @Nonnull String content) {}
