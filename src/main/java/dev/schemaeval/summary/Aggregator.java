package dev.schemaeval.summary;

import dev.schemaeval.run.TestResult;
import dev.schemaeval.run.TestRun;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import javax.annotation.Nonnull;

/** Computes run statistics from persisted results. Result order does not matter. */
public final class Aggregator {

    public RunSummary summarize(@Nonnull TestRun run, @Nonnull Collection<TestResult> results) {
        Map<String, List<TestResult>> byModel = new TreeMap<>();
        for (TestResult result : results) {
            byModel.computeIfAbsent(result.modelId(), k -> new ArrayList<>()).add(result);
        }
        var summaries = new ArrayList<ModelSummary>(byModel.size());
        for (var entry : byModel.entrySet()) {
            summaries.add(summarizeModel(entry.getKey(), entry.getValue()));
        }
        return new RunSummary(run.id(), run.name(), results.size(), summaries);
    }

    public ModelSummary summarizeModel(
            @Nonnull String modelId, @Nonnull Collection<TestResult> results) {
        int total = results.size();
        int parsed = 0;
        int compliant = 0;
        int timed = 0;
        double timeSum = 0;
        int withUsage = 0;
        long tokenSum = 0;
        for (TestResult result : results) {
            if (result.parseStatus()) {
                parsed++;
            }
            if (result.isCompliant()) {
                compliant++;
            }
            if (result.executionTimeMs() != null) {
                timed++;
                timeSum += result.executionTimeMs();
            }
            if (result.tokensUsed() != null) {
                withUsage++;
                tokenSum += result.tokensUsed();
            }
        }
        return new ModelSummary(
                modelId,
                total,
                parsed,
                compliant,
                total == 0 ? null : (int) Math.round(100.0 * compliant / total),
                timed == 0 ? null : timeSum / timed,
                withUsage == 0 ? null : tokenSum);
    }
}
