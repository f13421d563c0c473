package dev.schemaeval.summary;

import static dev.schemaeval.TestHarness.json;
import static dev.schemaeval.TestHarness.runConfig;
import static org.junit.jupiter.api.Assertions.*;

import dev.schemaeval.run.MockItem;
import dev.schemaeval.run.TestResult;
import dev.schemaeval.run.TestRun;
import dev.schemaeval.run.TestTask;
import dev.schemaeval.schema.RuleKind;
import dev.schemaeval.schema.Violation;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.Test;

class AggregatorTest {
    private static final Instant NOW = Instant.parse("2024-05-01T10:00:00Z");
    private static final TestRun RUN =
            TestRun.pending(UUID.randomUUID(), runConfig(List.of("b-model", "a-model"), 3), NOW);

    private final Aggregator aggregator = new Aggregator();

    private static TestTask task(String model, String item) {
        return new TestTask(RUN.id(), model, new MockItem(item, json("{}")), "p");
    }

    private static TestResult pass(String model, String item, double ms, Long tokens) {
        return TestResult.validated(task(model, item), "{}", List.of(), ms, tokens, NOW);
    }

    private static TestResult fail(String model, String item, double ms, Long tokens) {
        var violation =
                new Violation("expected integer but found string", List.of("age"), RuleKind.TYPE);
        return TestResult.validated(task(model, item), "{}", List.of(violation), ms, tokens, NOW);
    }

    private static TestResult unparseable(String model, String item) {
        return TestResult.unparseable(
                task(model, item), "nope", Violation.parseError("bad"), 5.0, null, NOW);
    }

    private static TestResult timedOut(String model, String item) {
        return TestResult.failed(task(model, item), "timed out after 100 ms", null, NOW);
    }

    @Test
    void summarizesPerModelInAlphabeticalOrder() {
        var results =
                List.of(
                        pass("b-model", "item-1", 100, 10L),
                        fail("b-model", "item-2", 200, 20L),
                        unparseable("b-model", "item-3"),
                        pass("a-model", "item-1", 50, null),
                        timedOut("a-model", "item-2"),
                        timedOut("a-model", "item-3"));
        var summary = aggregator.summarize(RUN, results);

        assertEquals(RUN.id(), summary.runId());
        assertEquals("unit test run", summary.runName());
        assertEquals(6, summary.overallTotalTests());
        assertEquals(
                List.of("a-model", "b-model"),
                summary.summaries().stream().map(ModelSummary::modelId).toList());

        var a = summary.summaries().get(0);
        assertEquals(new ModelSummary("a-model", 3, 1, 1, 33, 50.0, null), a);

        var b = summary.summaries().get(1);
        assertEquals(3, b.totalTasks());
        assertEquals(2, b.successfulParses());
        assertEquals(1, b.compliantCount());
        assertEquals(33, b.compliancePercentage());
        assertEquals(305.0 / 3, b.averageExecutionTimeMs(), 1e-9);
        assertEquals(30L, b.totalTokens());
    }

    @Test
    void percentageRoundsHalfUp() {
        var results = List.of(pass("m", "1", 1, 1L), pass("m", "2", 1, 1L), fail("m", "3", 1, 1L));
        assertEquals(67, aggregator.summarizeModel("m", results).compliancePercentage());

        var half = List.of(pass("m", "1", 1, 1L), fail("m", "2", 1, 1L));
        assertEquals(50, aggregator.summarizeModel("m", half).compliancePercentage());

        var eighth = new ArrayList<TestResult>();
        eighth.add(pass("m", "0", 1, 1L));
        for (int i = 1; i < 8; i++) {
            eighth.add(fail("m", String.valueOf(i), 1, 1L));
        }
        // 12.5% rounds to 13
        assertEquals(13, aggregator.summarizeModel("m", eighth).compliancePercentage());
    }

    @Test
    void noDataIsNotZero() {
        var empty = aggregator.summarizeModel("m", List.of());
        assertEquals(0, empty.totalTasks());
        assertNull(empty.compliancePercentage());
        assertNull(empty.averageExecutionTimeMs());
        assertNull(empty.totalTokens());

        var allTimedOut = aggregator.summarizeModel("m", List.of(timedOut("m", "1")));
        assertEquals(0, allTimedOut.compliancePercentage());
        assertNull(allTimedOut.averageExecutionTimeMs());
        assertNull(allTimedOut.totalTokens());
    }

    @Test
    void resultOrderDoesNotMatter() {
        var results =
                new ArrayList<>(
                        List.of(
                                pass("b-model", "item-1", 100, 10L),
                                fail("a-model", "item-2", 200, 20L),
                                unparseable("b-model", "item-3"),
                                timedOut("a-model", "item-1")));
        var expected = aggregator.summarize(RUN, results);
        Collections.reverse(results);
        assertEquals(expected, aggregator.summarize(RUN, results));
        Collections.swap(results, 0, 2);
        assertEquals(expected, aggregator.summarize(RUN, results));
    }
}
