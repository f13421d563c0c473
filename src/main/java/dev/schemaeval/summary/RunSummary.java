package dev.schemaeval.summary;

import java.util.List;
import java.util.UUID;
import javax.annotation.Nonnull;

/** Per-model statistics of a run, models in alphabetical order. */
public record RunSummary(
        @Nonnull UUID runId,
        @Nonnull String runName,
        int overallTotalTests,
        @Nonnull List<ModelSummary> summaries) {

    public RunSummary {
        summaries = List.copyOf(summaries);
    }
}
