package dev.schemaeval.summary;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * How one model did across a run. Metrics without data are null rather than zero.
 *
 * @param compliancePercentage round(100 * compliant / total), null when there are no results
 * @param averageExecutionTimeMs mean over results with a recorded time
 * @param totalTokens sum over results that reported usage, null when none did
 */
public record ModelSummary(
        @Nonnull String modelId,
        int totalTasks,
        int successfulParses,
        int compliantCount,
        @Nullable Integer compliancePercentage,
        @Nullable Double averageExecutionTimeMs,
        @Nullable Long totalTokens) {}
