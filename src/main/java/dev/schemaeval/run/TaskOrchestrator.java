package dev.schemaeval.run;

import com.fasterxml.jackson.databind.JsonNode;
import dev.schemaeval.completion.CompletionClient;
import dev.schemaeval.completion.CompletionException;
import dev.schemaeval.completion.CompletionRequest;
import dev.schemaeval.completion.CompletionResponse;
import dev.schemaeval.prompt.PromptRenderer;
import dev.schemaeval.schema.OutputParser;
import dev.schemaeval.schema.SchemaValidator;
import dev.schemaeval.schema.Violation;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Context;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.Semaphore;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import lombok.Getter;
import lombok.experimental.Accessors;
import lombok.extern.slf4j.Slf4j;

/**
 * Executes the model × item task set of a run with a bounded number of calls in flight.
 *
 * <p>Every dispatched task produces exactly one {@link TestResult} on the orchestration's outcome
 * queue, whatever happens inside it. A task is never retried. Cancellation is checked before each
 * dispatch: tasks already running finish or hit their timeout, tasks not yet dispatched produce
 * nothing.
 *
 * <p>A task that times out reports its result at the deadline, but keeps its slot until the
 * model call actually returns. A client that ignores interrupts therefore never sees more than
 * {@code concurrency} calls of one run at a time.
 */
@Slf4j
public final class TaskOrchestrator implements AutoCloseable {
    private final CompletionClient client;
    private final PromptRenderer renderer;
    private final OutputParser parser = new OutputParser();
    private final SchemaValidator validator = new SchemaValidator();
    private final Tracer tracer;
    private final Clock clock;
    private final double temperature;
    private final int maxTokens;
    private final Duration taskTimeout;

    private final ExecutorService dispatchExecutor =
            Executors.newCachedThreadPool(daemonThreads("schemaeval-dispatch"));

    // model calls run here so a worker can stop waiting on a call that overruns its timeout
    private final ExecutorService callExecutor =
            Executors.newCachedThreadPool(daemonThreads("schemaeval-call"));

    public TaskOrchestrator(
            @Nonnull CompletionClient client,
            @Nonnull PromptRenderer renderer,
            @Nonnull Tracer tracer,
            @Nonnull Clock clock,
            double temperature,
            int maxTokens,
            @Nonnull Duration taskTimeout) {
        this.client = client;
        this.renderer = renderer;
        this.tracer = tracer;
        this.clock = clock;
        this.temperature = temperature;
        this.maxTokens = maxTokens;
        this.taskTimeout = taskTimeout;
    }

    /** Models in the outer loop, items in the inner loop, both in configured order. */
    public List<TestTask> buildTasks(@Nonnull UUID runId, @Nonnull RunConfig config) {
        var template = config.promptTemplate().content();
        var tasks = new ArrayList<TestTask>(config.expectedTaskCount());
        for (String model : config.models()) {
            for (MockItem item : config.items()) {
                var prompt = renderer.render(template, item.content());
                tasks.add(new TestTask(runId, model, item, prompt));
            }
        }
        return tasks;
    }

    /**
     * Start executing {@code tasks} in the background.
     *
     * @param concurrency maximum number of tasks in flight
     * @param parent context the task spans are parented on
     */
    public Orchestration start(
            @Nonnull List<TestTask> tasks,
            @Nonnull JsonNode schema,
            int concurrency,
            @Nonnull CancellationToken token,
            @Nonnull Context parent) {
        if (concurrency < 1) {
            throw new IllegalArgumentException(
                    "concurrency must be at least 1, got " + concurrency);
        }
        var orchestration = new Orchestration();
        dispatchExecutor.execute(
                () -> dispatch(tasks, schema, concurrency, token, parent, orchestration));
        return orchestration;
    }

    private void dispatch(
            List<TestTask> tasks,
            JsonNode schema,
            int concurrency,
            CancellationToken token,
            Context parent,
            Orchestration orchestration) {
        var workers = Executors.newFixedThreadPool(concurrency, daemonThreads("schemaeval-worker"));
        var permits = new Semaphore(concurrency);
        int dispatched = 0;
        boolean cancelled = false;
        try {
            for (TestTask task : tasks) {
                if (token.isCancelled()) {
                    cancelled = true;
                    break;
                }
                permits.acquire();
                // cancellation may have arrived while waiting for a free slot
                if (token.isCancelled()) {
                    permits.release();
                    cancelled = true;
                    break;
                }
                dispatched++;
                workers.execute(
                        () -> {
                            var call = new Call();
                            try {
                                orchestration.outcomes.add(runTask(task, schema, parent, call));
                            } finally {
                                call.ended.whenComplete((unused, error) -> permits.release());
                            }
                        });
            }
            // wait for every call to return, including ones whose task already timed out
            permits.acquire(concurrency);
            permits.release(concurrency);
            if (cancelled) {
                log.info("cancelled after dispatching {} of {} tasks", dispatched, tasks.size());
            }
            orchestration.completion.complete(
                    new OrchestrationReport(tasks.size(), dispatched, cancelled));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            orchestration.completion.completeExceptionally(e);
        } catch (RuntimeException e) {
            log.error("task dispatch failed", e);
            orchestration.completion.completeExceptionally(e);
        } finally {
            workers.shutdown();
        }
    }

    /** Run one task. Never throws: every failure becomes a result. */
    TestResult runTask(TestTask task, JsonNode schema, Context parent, Call call) {
        var span =
                tracer.spanBuilder("task")
                        .setParent(parent)
                        .setAttribute("schemaeval.run_id", task.runId().toString())
                        .setAttribute("schemaeval.model_id", task.modelId())
                        .setAttribute("schemaeval.item_id", task.item().id())
                        .startSpan();
        try (var unused = span.makeCurrent()) {
            var result = execute(task, schema, call);
            span.setAttribute("schemaeval.parse_status", result.parseStatus());
            span.setAttribute("schemaeval.compliance_status", result.complianceStatus().name());
            if (result.rawOutput() == null && result.errorMessage() != null) {
                span.setStatus(StatusCode.ERROR, result.errorMessage());
            }
            log.debug(
                    "task {}/{} -> parsed={} compliance={} violations={}",
                    task.modelId(),
                    task.item().id(),
                    result.parseStatus(),
                    result.complianceStatus(),
                    result.violations().size());
            return result;
        } catch (RuntimeException e) {
            log.warn("task {}/{} failed unexpectedly", task.modelId(), task.item().id(), e);
            span.setStatus(StatusCode.ERROR, String.valueOf(e.getMessage()));
            span.recordException(e);
            call.abandon();
            return TestResult.failed(task, "unexpected error: " + e, null, clock.instant());
        } finally {
            span.end();
        }
    }

    private TestResult execute(TestTask task, JsonNode schema, Call call) {
        var request =
                new CompletionRequest(
                        task.modelId(), task.renderedPrompt(), temperature, maxTokens, taskTimeout);
        long start = System.nanoTime();
        try {
            callExecutor.execute(() -> call.run(() -> client.complete(request)));
        } catch (RejectedExecutionException e) {
            call.abandon();
            return TestResult.failed(
                    task, "model call rejected: orchestrator is closed", null, clock.instant());
        }
        CompletionResponse response;
        try {
            response = call.response.get(taskTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            call.interrupt();
            return TestResult.failed(
                    task,
                    "timed out after %d ms".formatted(taskTimeout.toMillis()),
                    null,
                    clock.instant());
        } catch (ExecutionException e) {
            return TestResult.failed(task, describeFailure(e.getCause()), null, clock.instant());
        } catch (InterruptedException e) {
            call.interrupt();
            Thread.currentThread().interrupt();
            return TestResult.failed(task, "interrupted", null, clock.instant());
        }
        double executionTimeMs = (System.nanoTime() - start) / 1_000_000.0;
        Long tokens = response.usage() == null ? null : response.usage().total();

        var text = response.text();
        if (text == null || text.isBlank()) {
            return TestResult.unparseable(
                    task,
                    text,
                    Violation.parseError("model returned no content"),
                    executionTimeMs,
                    tokens,
                    clock.instant());
        }
        var parsed = parser.parse(text);
        if (!parsed.isParsed()) {
            return TestResult.unparseable(
                    task, text, parsed.parseError(), executionTimeMs, tokens, clock.instant());
        }
        List<Violation> violations = validator.validate(parsed.document(), schema);
        return TestResult.validated(
                task, text, violations, executionTimeMs, tokens, clock.instant());
    }

    private static String describeFailure(Throwable cause) {
        if (cause instanceof CompletionException) {
            var ce = (CompletionException) cause;
            return "%s: %s".formatted(ce.kind().name().toLowerCase(), ce.getMessage());
        }
        return "completion call failed: " + cause;
    }

    @Override
    public void close() {
        dispatchExecutor.shutdownNow();
        callExecutor.shutdownNow();
    }

    private static ThreadFactory daemonThreads(String prefix) {
        var counter = new AtomicInteger();
        return runnable -> {
            var thread = new Thread(runnable, prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    /** One model call. {@code ended} completes once the call has returned, however late. */
    static final class Call {
        private final CompletableFuture<CompletionResponse> response = new CompletableFuture<>();
        private final CompletableFuture<Void> ended = new CompletableFuture<>();
        private @Nullable Thread runner;
        private boolean abandoned;

        void run(Supplier<CompletionResponse> body) {
            synchronized (this) {
                if (abandoned) {
                    ended.complete(null);
                    return;
                }
                runner = Thread.currentThread();
            }
            try {
                response.complete(body.get());
            } catch (RuntimeException e) {
                response.completeExceptionally(e);
            } finally {
                synchronized (this) {
                    runner = null;
                    // an interrupt meant for this call must not reach the pool thread's next task
                    Thread.interrupted();
                }
                ended.complete(null);
            }
        }

        /** Interrupt the call if it is running, or skip it if it has not started yet. */
        synchronized void interrupt() {
            abandoned = true;
            if (runner != null) {
                runner.interrupt();
            }
        }

        /** The call was never submitted. */
        void abandon() {
            ended.complete(null);
        }
    }

    /**
     * How dispatch ended.
     *
     * @param expected tasks handed to the orchestrator
     * @param dispatched tasks actually started, each of which produced one result
     * @param cancelled whether dispatch stopped because of cancellation
     */
    public record OrchestrationReport(int expected, int dispatched, boolean cancelled) {
        public boolean allAttempted() {
            return dispatched == expected;
        }
    }

    /** Handle on a running task set. */
    @Getter
    @Accessors(fluent = true)
    public static final class Orchestration {
        /** One result per dispatched task, in completion order. */
        private final BlockingQueue<TestResult> outcomes = new LinkedBlockingQueue<>();

        /** Completes once dispatch has ended and every dispatched task has queued its result. */
        private final CompletableFuture<OrchestrationReport> completion =
                new CompletableFuture<>();
    }
}
