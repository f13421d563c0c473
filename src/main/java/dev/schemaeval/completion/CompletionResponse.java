package dev.schemaeval.completion;

import java.time.Duration;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * What the model said.
 *
 * @param text the generated text, null when the service returned no content
 * @param usage token usage when the service reports it
 * @param latency wall time of the call
 */
public record CompletionResponse(
        @Nullable String text, @Nullable TokenUsage usage, @Nonnull Duration latency) {}
