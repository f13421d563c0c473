package dev.schemaeval.completion;

import com.fasterxml.jackson.databind.ObjectMapper;
import dev.schemaeval.config.SchemaEvalConfig;
import dev.schemaeval.json.SchemaEvalJsonMapper;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeSet;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.atomic.AtomicInteger;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import lombok.extern.slf4j.Slf4j;

/**
 * Client for an OpenAI-compatible completion service. The engine only needs a single-turn
 * completion and the list of models the service can route to.
 */
public interface CompletionClient {

    /**
     * Send one prompt to one model. Implementations never retry.
     *
     * @throws CompletionException if no response could be obtained
     */
    CompletionResponse complete(@Nonnull CompletionRequest request);

    /**
     * Model ids the service currently serves. Doubles as a reachability check.
     *
     * @throws CompletionException if the service cannot be reached
     */
    List<String> listModels();

    static CompletionClient of(SchemaEvalConfig config) {
        return new HttpImpl(config);
    }

    @Slf4j
    class HttpImpl implements CompletionClient {
        private static final Duration CONNECT_TIMEOUT = Duration.ofSeconds(10);

        private final SchemaEvalConfig config;
        private final HttpClient httpClient;
        private final ObjectMapper objectMapper = SchemaEvalJsonMapper.get();

        HttpImpl(SchemaEvalConfig config) {
            this(config, HttpClient.newBuilder().connectTimeout(CONNECT_TIMEOUT).build());
        }

        HttpImpl(SchemaEvalConfig config, HttpClient httpClient) {
            this.config = config;
            this.httpClient = httpClient;
        }

        @Override
        public CompletionResponse complete(@Nonnull CompletionRequest request) {
            var body =
                    new ChatCompletionRequest(
                            request.model(),
                            List.of(new ChatMessage("user", request.prompt())),
                            request.temperature(),
                            request.maxTokens());
            HttpRequest httpRequest;
            try {
                httpRequest =
                        requestBuilder("/v1/chat/completions", request.timeout())
                                .header("Content-Type", "application/json")
                                .POST(
                                        HttpRequest.BodyPublishers.ofString(
                                                objectMapper.writeValueAsString(body)))
                                .build();
            } catch (IOException e) {
                throw new CompletionException(
                        CompletionException.Kind.SERVICE, "Failed to serialize request body", e);
            }

            long start = System.nanoTime();
            var response = send(httpRequest, ChatCompletionResponse.class);
            var latency = Duration.ofNanos(System.nanoTime() - start);

            String text = null;
            if (response.choices() != null && !response.choices().isEmpty()) {
                var message = response.choices().get(0).message();
                text = message == null ? null : message.content();
            }
            TokenUsage usage = null;
            if (response.usage() != null) {
                usage =
                        new TokenUsage(
                                response.usage().promptTokens(),
                                response.usage().completionTokens(),
                                response.usage().totalTokens());
            }
            return new CompletionResponse(text, usage, latency);
        }

        @Override
        public List<String> listModels() {
            var request = requestBuilder("/v1/models", CONNECT_TIMEOUT).GET().build();
            var models = send(request, ModelList.class);
            if (models.data() == null) {
                return List.of();
            }
            return models.data().stream().map(ModelEntry::id).toList();
        }

        private HttpRequest.Builder requestBuilder(String path, Duration timeout) {
            var builder =
                    HttpRequest.newBuilder()
                            .uri(URI.create(stripTrailingSlash(config.llmServiceUrl()) + path))
                            .header("Accept", "application/json")
                            .timeout(timeout);
            config.llmServiceApiKey()
                    .ifPresent(key -> builder.header("Authorization", "Bearer " + key));
            return builder;
        }

        private <T> T send(HttpRequest request, Class<T> responseType) {
            log.debug("Completion request: {} {}", request.method(), request.uri());
            CompletableFuture<HttpResponse<String>> future =
                    httpClient.sendAsync(request, HttpResponse.BodyHandlers.ofString());
            HttpResponse<String> response;
            try {
                response = future.get();
            } catch (InterruptedException e) {
                future.cancel(true);
                Thread.currentThread().interrupt();
                throw new CompletionException(
                        CompletionException.Kind.TRANSPORT, "interrupted waiting for response", e);
            } catch (ExecutionException e) {
                throw classify(request, e.getCause() == null ? e : e.getCause());
            }
            return handleResponse(response, responseType);
        }

        private <T> T handleResponse(HttpResponse<String> response, Class<T> responseType) {
            int status = response.statusCode();
            log.debug("Completion response: {} - {}", status, response.body());
            if (status == 429) {
                throw new CompletionException(
                        CompletionException.Kind.RATE_LIMITED,
                        status,
                        "rate limited by completion service: " + response.body(),
                        null);
            }
            if (status < 200 || status >= 300) {
                log.warn("Completion request failed with status {}: {}", status, response.body());
                throw new CompletionException(
                        CompletionException.Kind.SERVICE,
                        status,
                        "completion service returned status %d: %s"
                                .formatted(status, response.body()),
                        null);
            }
            try {
                return objectMapper.readValue(response.body(), responseType);
            } catch (IOException e) {
                throw new CompletionException(
                        CompletionException.Kind.SERVICE,
                        status,
                        "Failed to parse response body",
                        e);
            }
        }

        private static CompletionException classify(HttpRequest request, Throwable cause) {
            if (cause instanceof HttpTimeoutException) {
                return new CompletionException(
                        CompletionException.Kind.TIMEOUT,
                        "request to %s timed out after %d ms"
                                .formatted(
                                        request.uri(),
                                        request.timeout().map(Duration::toMillis).orElse(-1L)),
                        cause);
            }
            if (cause instanceof IOException) {
                return new CompletionException(
                        CompletionException.Kind.TRANSPORT,
                        "unable to reach %s: %s".formatted(request.uri(), cause),
                        cause);
            }
            if (cause instanceof CompletionException) {
                return (CompletionException) cause;
            }
            return new CompletionException(
                    CompletionException.Kind.SERVICE, "completion call failed: " + cause, cause);
        }

        private static String stripTrailingSlash(String url) {
            return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
        }
    }

    /** Implementation for test doubling */
    class InMemoryImpl implements CompletionClient {
        /** Produces the response for one call. May block, sleep or throw. */
        @FunctionalInterface
        public interface Responder {
            CompletionResponse respond(CompletionRequest request) throws Exception;
        }

        private final Map<String, Responder> responders = new ConcurrentHashMap<>();
        private final Map<String, AtomicInteger> callCounts = new ConcurrentHashMap<>();
        private final List<CompletionRequest> requests =
                Collections.synchronizedList(new ArrayList<>());
        private volatile boolean reachable = true;

        public InMemoryImpl respond(String model, Responder responder) {
            responders.put(model, responder);
            return this;
        }

        /** Always answer {@code model} with {@code text}, reporting {@code tokens} total tokens. */
        public InMemoryImpl respondWith(String model, @Nullable String text, long tokens) {
            return respond(
                    model,
                    request ->
                            new CompletionResponse(
                                    text,
                                    new TokenUsage(null, null, tokens),
                                    Duration.ofMillis(1)));
        }

        public InMemoryImpl setReachable(boolean reachable) {
            this.reachable = reachable;
            return this;
        }

        public int callCount(String model) {
            return Optional.ofNullable(callCounts.get(model)).map(AtomicInteger::get).orElse(0);
        }

        public List<CompletionRequest> requests() {
            synchronized (requests) {
                return List.copyOf(requests);
            }
        }

        @Override
        public CompletionResponse complete(@Nonnull CompletionRequest request) {
            requests.add(request);
            callCounts.computeIfAbsent(request.model(), k -> new AtomicInteger()).incrementAndGet();
            if (!reachable) {
                throw new CompletionException(
                        CompletionException.Kind.TRANSPORT, "completion service unreachable");
            }
            var responder = responders.get(request.model());
            if (responder == null) {
                throw new CompletionException(
                        CompletionException.Kind.SERVICE,
                        404,
                        "unknown model " + request.model(),
                        null);
            }
            try {
                return responder.respond(request);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new CompletionException(
                        CompletionException.Kind.TRANSPORT, "interrupted", e);
            } catch (RuntimeException e) {
                throw e;
            } catch (Exception e) {
                throw new CompletionException(
                        CompletionException.Kind.SERVICE, e.getMessage(), e);
            }
        }

        @Override
        public List<String> listModels() {
            if (!reachable) {
                throw new CompletionException(
                        CompletionException.Kind.TRANSPORT, "completion service unreachable");
            }
            return List.copyOf(new TreeSet<>(responders.keySet()));
        }
    }

    record ChatMessage(String role, String content) {}

    record ChatCompletionRequest(
            String model, List<ChatMessage> messages, double temperature, int maxTokens) {}

    record ChatCompletionResponse(List<Choice> choices, @Nullable Usage usage) {}

    record Choice(ChatMessage message) {}

    record Usage(
            @Nullable Long promptTokens,
            @Nullable Long completionTokens,
            @Nullable Long totalTokens) {}

    record ModelList(List<ModelEntry> data) {}

    record ModelEntry(String id) {}
}
