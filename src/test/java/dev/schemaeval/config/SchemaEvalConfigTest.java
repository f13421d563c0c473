package dev.schemaeval.config;

import static org.junit.jupiter.api.Assertions.*;

import java.lang.reflect.Field;
import java.lang.reflect.Method;
import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;
import org.junit.jupiter.api.Test;

class SchemaEvalConfigTest {
    @Test
    void defaults() {
        var config = SchemaEvalConfig.of();
        assertEquals(5, config.concurrency());
        assertEquals(Duration.ofSeconds(60), config.taskTimeout());
        assertEquals(0.5, config.temperature());
        assertEquals(1024, config.maxTokens());
        assertEquals("{{INPUT_DATA}}", config.promptPlaceholder());
        assertTrue(config.preflightCheck());
    }

    @Test
    void overridesTakePrecedence() {
        var config =
                SchemaEvalConfig.of(
                        "SCHEMAEVAL_LLM_SERVICE_URL", "http://llm.internal:4000",
                        "SCHEMAEVAL_LLM_SERVICE_API_KEY", "sk-test",
                        "SCHEMAEVAL_CONCURRENCY", "12",
                        "SCHEMAEVAL_TASK_TIMEOUT_MS", "1500",
                        "SCHEMAEVAL_PREFLIGHT_CHECK", "FALSE");
        assertEquals("http://llm.internal:4000", config.llmServiceUrl());
        assertEquals("sk-test", config.llmServiceApiKey().orElseThrow());
        assertEquals(12, config.concurrency());
        assertEquals(Duration.ofMillis(1500), config.taskTimeout());
        assertFalse(config.preflightCheck());
    }

    @Test
    void danglingKeyIsRejected() {
        var e =
                assertThrows(
                        IllegalArgumentException.class,
                        () -> SchemaEvalConfig.of("SCHEMAEVAL_CONCURRENCY"));
        assertTrue(e.getMessage().contains("SCHEMAEVAL_CONCURRENCY"));
    }

    @Test
    void invalidValuesAreRejected() {
        assertThrows(
                IllegalArgumentException.class,
                () -> SchemaEvalConfig.of("SCHEMAEVAL_CONCURRENCY", "0"));
        assertThrows(
                IllegalArgumentException.class,
                () -> SchemaEvalConfig.of("SCHEMAEVAL_CONCURRENCY", "five"));
        assertThrows(
                IllegalArgumentException.class,
                () -> SchemaEvalConfig.of("SCHEMAEVAL_TASK_TIMEOUT_MS", "-1"));
        assertThrows(
                IllegalArgumentException.class,
                () -> SchemaEvalConfig.of("SCHEMAEVAL_PREFLIGHT_CHECK", "maybe"));
    }

    @Test
    public void testBuilderEqualsEnv() {
        var fromEnv =
                SchemaEvalConfig.of(
                        "SCHEMAEVAL_LLM_SERVICE_URL", "http://localhost:9999",
                        "SCHEMAEVAL_CONCURRENCY", "3");
        var fromBuilder =
                SchemaEvalConfig.builder()
                        .llmServiceUrl("http://localhost:9999")
                        .concurrency(3)
                        .build();
        var otherBuilder =
                SchemaEvalConfig.builder()
                        .llmServiceUrl("http://localhost:9999")
                        .concurrency(4)
                        .build();
        assertEquals(fromEnv, fromBuilder);
        assertNotEquals(fromEnv, otherBuilder);
    }

    @Test
    public void testBuilderHasMethodForEveryField() {
        List<String> fieldsToSkip = List.of("envOverrides");
        Field[] configFields = SchemaEvalConfig.class.getDeclaredFields();

        Method[] builderMethods = SchemaEvalConfig.Builder.class.getDeclaredMethods();
        Set<String> builderMethodNames =
                Arrays.stream(builderMethods).map(Method::getName).collect(Collectors.toSet());

        for (Field field : configFields) {
            String configFieldName = field.getName();
            if (fieldsToSkip.contains(configFieldName) || field.isSynthetic()) {
                continue;
            }
            assertTrue(
                    builderMethodNames.contains(configFieldName),
                    "Builder is missing method for field: " + configFieldName);
        }
    }
}
