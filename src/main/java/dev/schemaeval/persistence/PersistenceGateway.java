package dev.schemaeval.persistence;

import dev.schemaeval.run.RunConfig;
import dev.schemaeval.run.RunStatus;
import dev.schemaeval.run.TestResult;
import dev.schemaeval.run.TestRun;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import lombok.extern.slf4j.Slf4j;

/**
 * Storage for runs and their results. Results are append-only and safe to write from several
 * threads at once.
 */
public interface PersistenceGateway {

    /** Creates a new run in {@link RunStatus#PENDING}. */
    TestRun createRun(@Nonnull RunConfig config);

    /**
     * Appends one result to its run.
     *
     * @throws PersistenceException if the run is unknown or already holds a result for the same
     *     (model, item) pair
     */
    void appendResult(@Nonnull TestResult result);

    /**
     * Moves a run to {@code status}. Repeating the current status is a no-op.
     *
     * @throws IllegalStateException if the transition would move the run backwards
     * @throws PersistenceException if the run is unknown
     */
    TestRun setRunStatus(
            @Nonnull UUID runId,
            @Nonnull RunStatus status,
            @Nonnull Instant at,
            @Nullable String failureReason);

    Optional<TestRun> getRun(@Nonnull UUID runId);

    /** All runs, newest first. */
    List<TestRun> listRuns();

    /** Results of a run in the order they were recorded. Empty for unknown runs. */
    List<TestResult> listResults(@Nonnull UUID runId);

    static PersistenceGateway inMemory() {
        return new InMemoryImpl(Clock.systemUTC());
    }

    @Slf4j
    class InMemoryImpl implements PersistenceGateway {
        private final Clock clock;
        private final Map<UUID, TestRun> runs = new ConcurrentHashMap<>();
        private final Map<UUID, List<TestResult>> results = new ConcurrentHashMap<>();
        private final Map<UUID, Set<String>> recordedPairs = new ConcurrentHashMap<>();

        public InMemoryImpl(Clock clock) {
            this.clock = clock;
        }

        @Override
        public TestRun createRun(@Nonnull RunConfig config) {
            var run = TestRun.pending(UUID.randomUUID(), config, clock.instant());
            results.put(run.id(), Collections.synchronizedList(new ArrayList<>()));
            recordedPairs.put(run.id(), ConcurrentHashMap.newKeySet());
            runs.put(run.id(), run);
            log.debug("created run {} ({})", run.id(), run.name());
            return run;
        }

        @Override
        public void appendResult(@Nonnull TestResult result) {
            var pairs = recordedPairs.get(result.runId());
            if (pairs == null) {
                throw new PersistenceException("unknown run " + result.runId());
            }
            if (!pairs.add(pairKey(result.modelId(), result.itemId()))) {
                throw new PersistenceException(
                        "run %s already has a result for model %s, item %s"
                                .formatted(result.runId(), result.modelId(), result.itemId()));
            }
            results.get(result.runId()).add(result);
        }

        @Override
        public TestRun setRunStatus(
                @Nonnull UUID runId,
                @Nonnull RunStatus status,
                @Nonnull Instant at,
                @Nullable String failureReason) {
            var updated =
                    runs.computeIfPresent(
                            runId,
                            (id, current) ->
                                    current.status() == status
                                            ? current
                                            : current.transitionTo(status, at, failureReason));
            if (updated == null) {
                throw new PersistenceException("unknown run " + runId);
            }
            return updated;
        }

        @Override
        public Optional<TestRun> getRun(@Nonnull UUID runId) {
            return Optional.ofNullable(runs.get(runId));
        }

        @Override
        public List<TestRun> listRuns() {
            return runs.values().stream()
                    .sorted(Comparator.comparing(TestRun::createdAt).reversed())
                    .toList();
        }

        @Override
        public List<TestResult> listResults(@Nonnull UUID runId) {
            var runResults = results.get(runId);
            if (runResults == null) {
                return List.of();
            }
            synchronized (runResults) {
                return List.copyOf(runResults);
            }
        }

        private static String pairKey(String modelId, String itemId) {
            return modelId + '\u0000' + itemId;
        }
    }
}
