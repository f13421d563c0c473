package dev.schemaeval.completion;

import static com.github.tomakehurst.wiremock.client.WireMock.*;
import static com.github.tomakehurst.wiremock.core.WireMockConfiguration.wireMockConfig;
import static org.junit.jupiter.api.Assertions.*;

import com.github.tomakehurst.wiremock.junit5.WireMockExtension;
import dev.schemaeval.config.SchemaEvalConfig;
import java.time.Duration;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.RegisterExtension;

public class CompletionClientTest {

    @RegisterExtension
    static WireMockExtension wireMock =
            WireMockExtension.newInstance().options(wireMockConfig().dynamicPort()).build();

    private CompletionClient client;

    @BeforeEach
    void beforeEach() {
        wireMock.resetAll();
        var config =
                SchemaEvalConfig.builder()
                        .llmServiceUrl("http://localhost:" + wireMock.getPort() + "/")
                        .llmServiceApiKey("sk-test")
                        .build();
        client = CompletionClient.of(config);
    }

    private static CompletionRequest request(Duration timeout) {
        return new CompletionRequest("gpt-4o-mini", "Say {\"ok\": true}", 0.5, 1024, timeout);
    }

    @Test
    void completesChat() {
        wireMock.stubFor(
                post(urlEqualTo("/v1/chat/completions"))
                        .withHeader("Authorization", equalTo("Bearer sk-test"))
                        .withRequestBody(matchingJsonPath("$.model", equalTo("gpt-4o-mini")))
                        .withRequestBody(matchingJsonPath("$.messages[0].role", equalTo("user")))
                        .withRequestBody(
                                matchingJsonPath(
                                        "$.messages[0].content", equalTo("Say {\"ok\": true}")))
                        .withRequestBody(matchingJsonPath("$.max_tokens", equalTo("1024")))
                        .withRequestBody(matchingJsonPath("$.temperature", equalTo("0.5")))
                        .willReturn(
                                aResponse()
                                        .withStatus(200)
                                        .withHeader("Content-Type", "application/json")
                                        .withBody(
                                                """
                                {
                                  "id": "chatcmpl-1",
                                  "object": "chat.completion",
                                  "choices": [
                                    {
                                      "index": 0,
                                      "message": {"role": "assistant", "content": "{\\"ok\\": true}"},
                                      "finish_reason": "stop"
                                    }
                                  ],
                                  "usage": {"prompt_tokens": 12, "completion_tokens": 5, "total_tokens": 17}
                                }
                                """)));

        var response = client.complete(request(Duration.ofSeconds(5)));
        assertEquals("{\"ok\": true}", response.text());
        assertEquals(17L, response.usage().total());
        assertEquals(12L, response.usage().promptTokens());
        assertFalse(response.latency().isNegative());
    }

    @Test
    void missingContentAndUsageAreNull() {
        wireMock.stubFor(
                post(urlEqualTo("/v1/chat/completions"))
                        .willReturn(
                                okJson(
                                        "{\"choices\": [{\"message\": {\"role\": \"assistant\","
                                                + " \"content\": null}}]}")));
        var response = client.complete(request(Duration.ofSeconds(5)));
        assertNull(response.text());
        assertNull(response.usage());
    }

    @Test
    void rateLimitIsClassified() {
        wireMock.stubFor(
                post(urlEqualTo("/v1/chat/completions"))
                        .willReturn(aResponse().withStatus(429).withBody("slow down")));
        var e =
                assertThrows(
                        CompletionException.class,
                        () -> client.complete(request(Duration.ofSeconds(5))));
        assertEquals(CompletionException.Kind.RATE_LIMITED, e.kind());
        assertEquals(429, e.statusCode());
    }

    @Test
    void serverErrorIsClassified() {
        wireMock.stubFor(
                post(urlEqualTo("/v1/chat/completions"))
                        .willReturn(aResponse().withStatus(500).withBody("boom")));
        var e =
                assertThrows(
                        CompletionException.class,
                        () -> client.complete(request(Duration.ofSeconds(5))));
        assertEquals(CompletionException.Kind.SERVICE, e.kind());
        assertEquals(500, e.statusCode());
        assertTrue(e.getMessage().contains("boom"));
    }

    @Test
    void unparseableBodyIsAServiceError() {
        wireMock.stubFor(
                post(urlEqualTo("/v1/chat/completions"))
                        .willReturn(aResponse().withStatus(200).withBody("<html>")));
        var e =
                assertThrows(
                        CompletionException.class,
                        () -> client.complete(request(Duration.ofSeconds(5))));
        assertEquals(CompletionException.Kind.SERVICE, e.kind());
    }

    @Test
    void slowResponseTimesOut() {
        wireMock.stubFor(
                post(urlEqualTo("/v1/chat/completions"))
                        .willReturn(okJson("{\"choices\": []}").withFixedDelay(2_000)));
        var e =
                assertThrows(
                        CompletionException.class,
                        () -> client.complete(request(Duration.ofMillis(200))));
        assertEquals(CompletionException.Kind.TIMEOUT, e.kind());
    }

    @Test
    void unreachableServiceIsATransportError() {
        var config = SchemaEvalConfig.builder().llmServiceUrl("http://localhost:1").build();
        var unreachable = CompletionClient.of(config);
        var e = assertThrows(CompletionException.class, unreachable::listModels);
        assertEquals(CompletionException.Kind.TRANSPORT, e.kind());
    }

    @Test
    void listsModels() {
        wireMock.stubFor(
                get(urlEqualTo("/v1/models"))
                        .withHeader("Authorization", equalTo("Bearer sk-test"))
                        .willReturn(
                                okJson(
                                        """
                                        {"object": "list", "data": [
                                          {"id": "gpt-4o-mini", "object": "model"},
                                          {"id": "claude-3-haiku", "object": "model"}
                                        ]}
                                        """)));
        assertEquals(List.of("gpt-4o-mini", "claude-3-haiku"), client.listModels());
    }

    @Test
    void noAuthorizationHeaderWithoutApiKey() {
        wireMock.stubFor(
                get(urlEqualTo("/v1/models"))
                        .withHeader("Authorization", absent())
                        .willReturn(okJson("{\"data\": []}")));
        var config =
                SchemaEvalConfig.builder()
                        .llmServiceUrl("http://localhost:" + wireMock.getPort())
                        .build();
        assertEquals(List.of(), CompletionClient.of(config).listModels());
    }

    @Test
    void inMemoryClientCountsCallsAndHonorsReachability() {
        var inMemory = new CompletionClient.InMemoryImpl().respondWith("m1", "{}", 3);
        var request = new CompletionRequest("m1", "p", 0, 1, Duration.ofSeconds(1));
        assertEquals("{}", inMemory.complete(request).text());
        assertEquals(1, inMemory.callCount("m1"));
        assertEquals(List.of("m1"), inMemory.listModels());

        var unknown =
                assertThrows(
                        CompletionException.class,
                        () ->
                                inMemory.complete(
                                        new CompletionRequest(
                                                "m2", "p", 0, 1, Duration.ofSeconds(1))));
        assertEquals(CompletionException.Kind.SERVICE, unknown.kind());

        inMemory.setReachable(false);
        assertEquals(
                CompletionException.Kind.TRANSPORT,
                assertThrows(CompletionException.class, inMemory::listModels).kind());
    }
}
