package dev.schemaeval.completion;

import java.time.Duration;
import javax.annotation.Nonnull;

/**
 * A single prompt sent to a single model.
 *
 * @param timeout upper bound for the whole call, including reading the response
 */
public record CompletionRequest(
        @Nonnull String model,
        @Nonnull String prompt,
        double temperature,
        int maxTokens,
        @Nonnull Duration timeout) {}
