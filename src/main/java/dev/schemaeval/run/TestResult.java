package dev.schemaeval.run;

import com.fasterxml.jackson.databind.JsonNode;
import dev.schemaeval.schema.Violation;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * Outcome of one (model, item) task. Immutable.
 *
 * <p>An output that did not parse is never checked against the schema, so its compliance status
 * is {@link ComplianceStatus#NOT_APPLICABLE}. A parsed output passes exactly when it has no
 * violations.
 *
 * @param rawOutput exactly what the model returned, null when the call itself failed
 * @param executionTimeMs wall time of the model call, null when the call did not return
 * @param tokensUsed total tokens reported by the service, null when not reported
 * @param errorMessage why the task did not produce a compliant output, if it failed outright
 */
public record TestResult(
        @Nonnull UUID runId,
        @Nonnull String modelId,
        @Nonnull String itemId,
        @Nonnull JsonNode inputData,
        @Nullable String rawOutput,
        boolean parseStatus,
        @Nonnull ComplianceStatus complianceStatus,
        @Nonnull List<Violation> violations,
        @Nullable Double executionTimeMs,
        @Nullable Long tokensUsed,
        @Nullable String errorMessage,
        @Nonnull Instant recordedAt) {

    public TestResult {
        violations = violations == null ? List.of() : List.copyOf(violations);
        if (!parseStatus && complianceStatus != ComplianceStatus.NOT_APPLICABLE) {
            throw new IllegalArgumentException(
                    "unparsed output must be NOT_APPLICABLE, was " + complianceStatus);
        }
        if (parseStatus && complianceStatus == ComplianceStatus.NOT_APPLICABLE) {
            throw new IllegalArgumentException("parsed output must be PASS or FAIL");
        }
        if (complianceStatus == ComplianceStatus.PASS && !violations.isEmpty()) {
            throw new IllegalArgumentException("a passing result cannot carry violations");
        }
        if (complianceStatus == ComplianceStatus.FAIL && violations.isEmpty()) {
            throw new IllegalArgumentException("a failing result needs at least one violation");
        }
    }

    /** A model answered and its output was validated against the schema. */
    public static TestResult validated(
            TestTask task,
            String rawOutput,
            List<Violation> violations,
            @Nullable Double executionTimeMs,
            @Nullable Long tokensUsed,
            Instant recordedAt) {
        return new TestResult(
                task.runId(),
                task.modelId(),
                task.item().id(),
                task.item().content(),
                rawOutput,
                true,
                violations.isEmpty() ? ComplianceStatus.PASS : ComplianceStatus.FAIL,
                violations,
                executionTimeMs,
                tokensUsed,
                null,
                recordedAt);
    }

    /** A model answered but the answer is not JSON. */
    public static TestResult unparseable(
            TestTask task,
            @Nullable String rawOutput,
            Violation parseError,
            @Nullable Double executionTimeMs,
            @Nullable Long tokensUsed,
            Instant recordedAt) {
        return new TestResult(
                task.runId(),
                task.modelId(),
                task.item().id(),
                task.item().content(),
                rawOutput,
                false,
                ComplianceStatus.NOT_APPLICABLE,
                List.of(parseError),
                executionTimeMs,
                tokensUsed,
                parseError.message(),
                recordedAt);
    }

    /** The task failed before any output could be judged: timeout, transport or service error. */
    public static TestResult failed(
            TestTask task,
            String errorMessage,
            @Nullable Double executionTimeMs,
            Instant recordedAt) {
        return new TestResult(
                task.runId(),
                task.modelId(),
                task.item().id(),
                task.item().content(),
                null,
                false,
                ComplianceStatus.NOT_APPLICABLE,
                List.of(),
                executionTimeMs,
                null,
                errorMessage,
                recordedAt);
    }

    public boolean isCompliant() {
        return complianceStatus == ComplianceStatus.PASS;
    }
}
