package dev.schemaeval.config;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import lombok.Getter;
import lombok.experimental.Accessors;

/**
 * Configuration for the evaluation engine with sane defaults.
 *
 * <p>Most deployments configure the engine through envars. Any envar can also be overridden
 * during construction, either with {@link #of(String...)} key-value pairs or with the {@link
 * Builder}.
 */
@Getter
@Accessors(fluent = true)
public final class SchemaEvalConfig extends BaseConfig {
    /** Base url of the OpenAI-compatible completion service (e.g. a LiteLLM proxy). */
    private final String llmServiceUrl =
            getConfig("SCHEMAEVAL_LLM_SERVICE_URL", "http://localhost:4000");

    private final Optional<String> llmServiceApiKey =
            Optional.ofNullable(getConfig("SCHEMAEVAL_LLM_SERVICE_API_KEY", null, String.class));

    /** Default cap on tasks in flight against the completion service for a single run. */
    private final int concurrency = getConfig("SCHEMAEVAL_CONCURRENCY", 5);

    private final Duration taskTimeout =
            Duration.ofMillis(getConfig("SCHEMAEVAL_TASK_TIMEOUT_MS", 60_000L));
    private final double temperature = getConfig("SCHEMAEVAL_TEMPERATURE", 0.5);
    private final int maxTokens = getConfig("SCHEMAEVAL_MAX_TOKENS", 1024);
    private final String promptPlaceholder =
            getConfig("SCHEMAEVAL_PROMPT_PLACEHOLDER", "{{INPUT_DATA}}");

    /** Check the completion service before dispatching a run's tasks. */
    private final boolean preflightCheck = getConfig("SCHEMAEVAL_PREFLIGHT_CHECK", true);

    private final String serverHost = getConfig("SCHEMAEVAL_SERVER_HOST", "localhost");
    private final int serverPort = getConfig("SCHEMAEVAL_SERVER_PORT", 8300);

    public static SchemaEvalConfig fromEnvironment() {
        return of();
    }

    public static SchemaEvalConfig of(String... envOverrides) {
        if (envOverrides.length % 2 != 0) {
            throw new IllegalArgumentException(
                    "config overrides require key-value pairs. Found dangling key: %s"
                            .formatted(envOverrides[envOverrides.length - 1]));
        }
        var overridesMap = new HashMap<String, String>();
        for (int i = 0; i < envOverrides.length - 1; i = i + 2) {
            overridesMap.put(envOverrides[i], envOverrides[i + 1]);
        }
        return new SchemaEvalConfig(overridesMap);
    }

    private SchemaEvalConfig(Map<String, String> envOverrides) {
        super(envOverrides);
        if (concurrency < 1) {
            throw new IllegalArgumentException(
                    "SCHEMAEVAL_CONCURRENCY must be at least 1, got " + concurrency);
        }
        if (taskTimeout.isNegative() || taskTimeout.isZero()) {
            throw new IllegalArgumentException(
                    "SCHEMAEVAL_TASK_TIMEOUT_MS must be positive, got " + taskTimeout.toMillis());
        }
        if (promptPlaceholder.isBlank()) {
            throw new IllegalArgumentException("SCHEMAEVAL_PROMPT_PLACEHOLDER must not be blank");
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private final Map<String, String> envOverrides = new HashMap<>();

        public Builder llmServiceUrl(String value) {
            envOverrides.put("SCHEMAEVAL_LLM_SERVICE_URL", value);
            return this;
        }

        public Builder llmServiceApiKey(String value) {
            envOverrides.put("SCHEMAEVAL_LLM_SERVICE_API_KEY", value);
            return this;
        }

        public Builder concurrency(int value) {
            envOverrides.put("SCHEMAEVAL_CONCURRENCY", String.valueOf(value));
            return this;
        }

        public Builder taskTimeout(Duration value) {
            envOverrides.put("SCHEMAEVAL_TASK_TIMEOUT_MS", String.valueOf(value.toMillis()));
            return this;
        }

        public Builder temperature(double value) {
            envOverrides.put("SCHEMAEVAL_TEMPERATURE", String.valueOf(value));
            return this;
        }

        public Builder maxTokens(int value) {
            envOverrides.put("SCHEMAEVAL_MAX_TOKENS", String.valueOf(value));
            return this;
        }

        public Builder promptPlaceholder(String value) {
            envOverrides.put("SCHEMAEVAL_PROMPT_PLACEHOLDER", value);
            return this;
        }

        public Builder preflightCheck(boolean value) {
            envOverrides.put("SCHEMAEVAL_PREFLIGHT_CHECK", String.valueOf(value));
            return this;
        }

        public Builder serverHost(String value) {
            envOverrides.put("SCHEMAEVAL_SERVER_HOST", value);
            return this;
        }

        public Builder serverPort(int value) {
            envOverrides.put("SCHEMAEVAL_SERVER_PORT", String.valueOf(value));
            return this;
        }

        public SchemaEvalConfig build() {
            return new SchemaEvalConfig(envOverrides);
        }
    }
}
