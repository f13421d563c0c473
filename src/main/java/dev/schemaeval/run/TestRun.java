package dev.schemaeval.run;

import java.time.Instant;
import java.util.UUID;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/** A run and where it is in its lifecycle. Instances are snapshots; transitions yield copies. */
public record TestRun(
        @Nonnull UUID id,
        @Nonnull String name,
        @Nonnull RunConfig config,
        @Nonnull RunStatus status,
        @Nonnull Instant createdAt,
        @Nullable Instant startedAt,
        @Nullable Instant completedAt,
        int expectedTaskCount,
        @Nullable String failureReason) {

    public static TestRun pending(UUID id, RunConfig config, Instant createdAt) {
        return new TestRun(
                id,
                config.name(),
                config,
                RunStatus.PENDING,
                createdAt,
                null,
                null,
                config.expectedTaskCount(),
                null);
    }

    /**
     * Copy of this run in {@code next} status.
     *
     * @throws IllegalStateException if the transition would move backwards
     */
    public TestRun transitionTo(
            @Nonnull RunStatus next, @Nonnull Instant at, @Nullable String reason) {
        if (!status.canTransitionTo(next)) {
            throw new IllegalStateException(
                    "run %s cannot move from %s to %s".formatted(id, status, next));
        }
        return new TestRun(
                id,
                name,
                config,
                next,
                createdAt,
                next == RunStatus.RUNNING ? at : startedAt,
                next.isTerminal() ? at : completedAt,
                expectedTaskCount,
                next == RunStatus.FAILED ? reason : failureReason);
    }
}
