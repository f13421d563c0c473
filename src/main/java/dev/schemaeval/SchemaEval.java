package dev.schemaeval;

import dev.schemaeval.completion.CompletionClient;
import dev.schemaeval.config.SchemaEvalConfig;
import dev.schemaeval.persistence.PersistenceGateway;
import dev.schemaeval.prompt.PromptRenderer;
import dev.schemaeval.run.ConfigValidator;
import dev.schemaeval.run.RunManager;
import dev.schemaeval.run.TaskOrchestrator;
import dev.schemaeval.server.EngineServer;
import io.opentelemetry.api.OpenTelemetry;
import java.time.Clock;
import javax.annotation.Nonnull;
import lombok.Getter;
import lombok.experimental.Accessors;
import lombok.extern.slf4j.Slf4j;

/**
 * Main entry point of the evaluation engine. Wires configuration, the completion client, the
 * result store and tracing into a {@link RunManager}.
 *
 * @see SchemaEvalConfig
 * @see #serverBuilder()
 */
@Slf4j
public class SchemaEval implements AutoCloseable {
    public static final String INSTRUMENTATION_NAME = "dev.schemaeval";

    /** Engine backed by the HTTP completion client, an in-memory store and no tracing. */
    public static SchemaEval of(SchemaEvalConfig config) {
        return of(
                config,
                CompletionClient.of(config),
                PersistenceGateway.inMemory(),
                OpenTelemetry.noop());
    }

    public static SchemaEval of(
            @Nonnull SchemaEvalConfig config,
            @Nonnull CompletionClient completionClient,
            @Nonnull PersistenceGateway persistence,
            @Nonnull OpenTelemetry openTelemetry) {
        return new SchemaEval(
                config, completionClient, persistence, openTelemetry, Clock.systemUTC());
    }

    @Getter
    @Accessors(fluent = true)
    private final SchemaEvalConfig config;

    @Getter
    @Accessors(fluent = true)
    private final CompletionClient completionClient;

    @Getter
    @Accessors(fluent = true)
    private final PersistenceGateway persistence;

    @Getter
    @Accessors(fluent = true)
    private final RunManager runManager;

    private SchemaEval(
            SchemaEvalConfig config,
            CompletionClient completionClient,
            PersistenceGateway persistence,
            OpenTelemetry openTelemetry,
            Clock clock) {
        this.config = config;
        this.completionClient = completionClient;
        this.persistence = persistence;
        var tracer = openTelemetry.getTracer(INSTRUMENTATION_NAME);
        var orchestrator =
                new TaskOrchestrator(
                        completionClient,
                        new PromptRenderer(config.promptPlaceholder()),
                        tracer,
                        clock,
                        config.temperature(),
                        config.maxTokens(),
                        config.taskTimeout());
        this.runManager =
                new RunManager(
                        persistence,
                        completionClient,
                        orchestrator,
                        new ConfigValidator(config.promptPlaceholder()),
                        tracer,
                        clock,
                        config.concurrency(),
                        config.preflightCheck());
        log.debug(
                "engine ready: llm service {}, concurrency {}, task timeout {}",
                config.llmServiceUrl(),
                config.concurrency(),
                config.taskTimeout());
    }

    /** Server builder preconfigured with this engine and the configured host and port. */
    public EngineServer.Builder serverBuilder() {
        return EngineServer.builder()
                .runManager(runManager)
                .host(config.serverHost())
                .port(config.serverPort());
    }

    @Override
    public void close() {
        runManager.close();
    }
}
