package dev.schemaeval.run;

import com.fasterxml.jackson.databind.JsonNode;
import javax.annotation.Nonnull;

/** One curated input injected into the prompt in place of the placeholder. */
public record MockItem(@Nonnull String id, @Nonnull JsonNode content) {}
