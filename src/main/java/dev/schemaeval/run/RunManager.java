package dev.schemaeval.run;

import dev.schemaeval.completion.CompletionClient;
import dev.schemaeval.completion.CompletionException;
import dev.schemaeval.persistence.PersistenceException;
import dev.schemaeval.persistence.PersistenceGateway;
import dev.schemaeval.summary.Aggregator;
import dev.schemaeval.summary.RunSummary;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Context;
import java.time.Clock;
import java.time.Duration;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import lombok.extern.slf4j.Slf4j;

/**
 * Owns the lifecycle of test runs: PENDING → RUNNING → COMPLETED or FAILED.
 *
 * <p>{@link #startRun} validates and records a run, then returns while the run executes on a
 * background thread. That thread is the only writer of run status and the only consumer of the
 * run's outcome queue. A run completes when every task was attempted, however the individual
 * tasks fared. It fails when it could not execute: the completion service was unreachable, the
 * store rejected a write, or it was cancelled before every task was attempted.
 */
@Slf4j
public final class RunManager implements AutoCloseable {
    public static final String CANCELLED = "cancelled";

    private static final long POLL_MILLIS = 50;

    private final PersistenceGateway persistence;
    private final CompletionClient client;
    private final TaskOrchestrator orchestrator;
    private final ConfigValidator configValidator;
    private final Aggregator aggregator = new Aggregator();
    private final Tracer tracer;
    private final Clock clock;
    private final int defaultConcurrency;
    private final boolean preflightCheck;

    private final ExecutorService runExecutor =
            Executors.newCachedThreadPool(
                    runnable -> {
                        var thread = new Thread(runnable, "schemaeval-run");
                        thread.setDaemon(true);
                        return thread;
                    });
    private final Map<UUID, ActiveRun> activeRuns = new ConcurrentHashMap<>();

    private record ActiveRun(CancellationToken token, CompletableFuture<TestRun> done) {}

    public RunManager(
            @Nonnull PersistenceGateway persistence,
            @Nonnull CompletionClient client,
            @Nonnull TaskOrchestrator orchestrator,
            @Nonnull ConfigValidator configValidator,
            @Nonnull Tracer tracer,
            @Nonnull Clock clock,
            int defaultConcurrency,
            boolean preflightCheck) {
        this.persistence = persistence;
        this.client = client;
        this.orchestrator = orchestrator;
        this.configValidator = configValidator;
        this.tracer = tracer;
        this.clock = clock;
        this.defaultConcurrency = defaultConcurrency;
        this.preflightCheck = preflightCheck;
    }

    /**
     * Validate {@code config}, record a new run and begin executing it in the background.
     *
     * @return the run as created, still PENDING
     * @throws ConfigException if the configuration is rejected. No run is created.
     * @throws RunSystemException if the run could not be recorded
     */
    public TestRun startRun(@Nonnull RunConfig config) {
        configValidator.validate(config);
        TestRun run;
        try {
            run = persistence.createRun(config);
        } catch (PersistenceException e) {
            throw new RunSystemException("unable to create run: " + e.getMessage(), e);
        }
        log.info(
                "starting run {} '{}': {} models x {} items",
                run.id(),
                run.name(),
                config.models().size(),
                config.items().size());
        var active = new ActiveRun(new CancellationToken(), new CompletableFuture<>());
        activeRuns.put(run.id(), active);
        runExecutor.execute(
                () -> {
                    // deregister before completing so a finished run cannot be cancelled
                    try {
                        var finished = execute(run, active.token());
                        activeRuns.remove(run.id());
                        active.done().complete(finished);
                    } catch (RuntimeException e) {
                        activeRuns.remove(run.id());
                        active.done().completeExceptionally(e);
                    }
                });
        return run;
    }

    /** Run metadata, its results so far and progress. */
    public Optional<RunView> getRun(@Nonnull UUID runId) {
        return persistence
                .getRun(runId)
                .map(
                        run -> {
                            var results = persistence.listResults(runId);
                            return new RunView(run, results, results.size());
                        });
    }

    /** Aggregates whatever results the run has recorded so far. */
    public Optional<RunSummary> getSummary(@Nonnull UUID runId) {
        return persistence
                .getRun(runId)
                .map(run -> aggregator.summarize(run, persistence.listResults(runId)));
    }

    /**
     * Signal cancellation. Tasks not yet dispatched will not run.
     *
     * @return true if the run was still executing and is now cancelling
     */
    public boolean cancelRun(@Nonnull UUID runId) {
        var active = activeRuns.get(runId);
        if (active == null) {
            return false;
        }
        boolean flipped = active.token().cancel();
        if (flipped) {
            log.info("cancellation requested for run {}", runId);
        }
        return flipped;
    }

    public List<TestRun> listRuns() {
        return persistence.listRuns();
    }

    /**
     * Block until the run reaches a terminal status or {@code timeout} elapses.
     *
     * @return the run as last recorded
     */
    public Optional<TestRun> awaitRun(@Nonnull UUID runId, @Nonnull Duration timeout)
            throws InterruptedException {
        var active = activeRuns.get(runId);
        if (active != null) {
            try {
                active.done().get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            } catch (ExecutionException e) {
                log.debug("run {} ended exceptionally", runId, e.getCause());
            } catch (TimeoutException e) {
                log.debug("run {} still executing after {}", runId, timeout);
            }
        }
        return persistence.getRun(runId);
    }

    private TestRun execute(TestRun run, CancellationToken token) {
        var config = run.config();
        var runSpan =
                tracer.spanBuilder("test_run")
                        .setAttribute("schemaeval.run_id", run.id().toString())
                        .setAttribute("schemaeval.run_name", run.name())
                        .setAttribute("schemaeval.expected_tasks", (long) run.expectedTaskCount())
                        .startSpan();
        try (var unused = runSpan.makeCurrent()) {
            if (preflightCheck) {
                var reason = preflight(config.models());
                if (reason != null) {
                    return fail(run, runSpan, reason);
                }
            }
            if (token.isCancelled()) {
                return fail(run, runSpan, CANCELLED);
            }
            persistence.setRunStatus(run.id(), RunStatus.RUNNING, clock.instant(), null);
            log.info("run {} is running", run.id());

            var tasks = orchestrator.buildTasks(run.id(), config);
            int concurrency =
                    config.concurrency() == null ? defaultConcurrency : config.concurrency();
            var orchestration =
                    orchestrator.start(
                            tasks,
                            config.schema().content(),
                            concurrency,
                            token,
                            Context.current().with(runSpan));
            int recorded = drain(orchestration, token);
            var report = orchestration.completion().join();

            if (report.cancelled()) {
                return fail(
                        run,
                        runSpan,
                        "%s after %d of %d tasks"
                                .formatted(CANCELLED, report.dispatched(), report.expected()));
            }
            if (recorded != run.expectedTaskCount()) {
                return fail(
                        run,
                        runSpan,
                        "recorded %d results, expected %d"
                                .formatted(recorded, run.expectedTaskCount()));
            }
            var completed =
                    persistence.setRunStatus(
                            run.id(), RunStatus.COMPLETED, clock.instant(), null);
            log.info("run {} completed with {} results", run.id(), recorded);
            return completed;
        } catch (PersistenceException e) {
            token.cancel();
            return fail(run, runSpan, "persistence failure: " + e.getMessage(), e);
        } catch (RuntimeException e) {
            token.cancel();
            return fail(run, runSpan, "orchestration error: " + e, e);
        } finally {
            runSpan.end();
        }
    }

    /** @return why the run cannot proceed, or null when it can */
    @Nullable
    private String preflight(List<String> models) {
        List<String> available;
        try {
            available = client.listModels();
        } catch (CompletionException e) {
            log.error("completion service preflight failed", e);
            return "completion service unreachable: " + e.getMessage();
        }
        var known = new HashSet<>(available);
        for (String model : models) {
            if (!known.contains(model)) {
                log.warn("model {} is not listed by the completion service", model);
            }
        }
        return null;
    }

    /** Persist outcomes until the orchestration is done and its queue is empty. */
    private int drain(TaskOrchestrator.Orchestration orchestration, CancellationToken token) {
        int recorded = 0;
        while (true) {
            TestResult result;
            try {
                result = orchestration.outcomes().poll(POLL_MILLIS, TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                token.cancel();
                Thread.currentThread().interrupt();
                throw new RunSystemException("interrupted while recording results", e);
            }
            if (result != null) {
                persistence.appendResult(result);
                recorded++;
            } else if (orchestration.completion().isDone()
                    && orchestration.outcomes().isEmpty()) {
                return recorded;
            }
        }
    }

    private TestRun fail(TestRun run, Span runSpan, String reason) {
        return fail(run, runSpan, reason, null);
    }

    private TestRun fail(TestRun run, Span runSpan, String reason, @Nullable Throwable cause) {
        if (cause == null) {
            log.error("run {} failed: {}", run.id(), reason);
        } else {
            log.error("run {} failed: {}", run.id(), reason, cause);
            runSpan.recordException(cause);
        }
        runSpan.setStatus(StatusCode.ERROR, reason);
        try {
            return persistence.setRunStatus(run.id(), RunStatus.FAILED, clock.instant(), reason);
        } catch (RuntimeException e) {
            log.error("unable to record failure of run {}", run.id(), e);
            return run.transitionTo(RunStatus.FAILED, clock.instant(), reason);
        }
    }

    @Override
    public void close() {
        activeRuns.values().forEach(active -> active.token().cancel());
        runExecutor.shutdown();
        try {
            if (!runExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                runExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            runExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        orchestrator.close();
    }

    /**
     * A run with its recorded results.
     *
     * @param completedTasks results recorded so far, out of {@code run.expectedTaskCount()}
     */
    public record RunView(TestRun run, List<TestResult> results, int completedTasks) {}
}
