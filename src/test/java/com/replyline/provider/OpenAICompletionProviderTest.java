package com.replyline.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.replyline.config.JacksonConfiguration;
import com.replyline.config.ReplylineProperties;
import com.replyline.exception.CompletionProviderException;
import com.replyline.model.StreamRequest;
import com.replyline.model.TokenDelta;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for OpenAICompletionProvider.
 */
class OpenAICompletionProviderTest {

    private final ObjectMapper objectMapper = new JacksonConfiguration().objectMapper();
    private ReplylineProperties properties;

    @BeforeEach
    void setUp() {
        properties = new ReplylineProperties();
        properties.getProxy().setMaxRetries(0);

        ReplylineProperties.ProviderConfig config = new ReplylineProperties.ProviderConfig();
        config.setBaseUrl("http://openai.test/v1");
        config.setApiKey("sk-test");
        config.setMaxTokens(256);
        properties.getProviders().put("openai", config);
    }

    @Test
    void testSupportsModels() {
        OpenAICompletionProvider provider = provider(WebClient.create());

        assertTrue(provider.supports("gpt-4o"));
        assertTrue(provider.supports("o1-mini"));
        assertTrue(provider.supports("gpt-3.5-turbo"));
        assertFalse(provider.supports("claude-3-opus"));
        assertFalse(provider.supports(null));
    }

    @Test
    void testBuildRequestBody() {
        JsonNode body = provider(WebClient.create()).buildRequestBody(StreamRequest.builder()
                .model("gpt-4o")
                .prompt("What is my next task?")
                .systemContext("You are a project agent.")
                .build());

        assertEquals("gpt-4o", body.path("model").asText());
        assertTrue(body.path("stream").asBoolean());
        assertEquals(256, body.path("max_tokens").asInt());
        assertEquals("system", body.path("messages").path(0).path("role").asText());
        assertEquals("user", body.path("messages").path(1).path("role").asText());
        assertEquals("What is my next task?", body.path("messages").path(1).path("content").asText());
    }

    @Test
    void testParseChunk() {
        OpenAICompletionProvider provider = provider(WebClient.create());

        StepVerifier.create(provider.parseChunk("{\"choices\":[{\"delta\":{\"content\":\"Hel\"}}]}"))
                .expectNext(TokenDelta.of("Hel"))
                .verifyComplete();
        StepVerifier.create(provider.parseChunk("{\"choices\":[{\"delta\":{},\"finish_reason\":\"stop\"}]}"))
                .assertNext(delta -> assertEquals("stop", delta.getFinishReason()))
                .verifyComplete();
        StepVerifier.create(provider.parseChunk("{\"choices\":[{\"delta\":{\"role\":\"assistant\"}}]}"))
                .verifyComplete();
        StepVerifier.create(provider.parseChunk("not json"))
                .verifyComplete();
    }

    @Test
    void testStreamsUntilDone() {
        String body = "data: {\"choices\":[{\"delta\":{\"content\":\"Hello\"}}]}\n\n"
                + "data: {\"choices\":[{\"delta\":{\"content\":\" there\"}}]}\n\n"
                + "data: [DONE]\n\n";
        AtomicReference<ClientRequest> sent = new AtomicReference<>();
        OpenAICompletionProvider provider = provider(stubbed(HttpStatus.OK, body, sent));

        StepVerifier.create(provider.streamCompletion(StreamRequest.builder().model("gpt-4o").prompt("hi").build()))
                .expectNext(TokenDelta.of("Hello"), TokenDelta.of(" there"))
                .verifyComplete();

        assertEquals("http://openai.test/v1/chat/completions", sent.get().url().toString());
        assertEquals("Bearer sk-test", sent.get().headers().getFirst(HttpHeaders.AUTHORIZATION));
    }

    @Test
    void testHttpErrorBecomesProviderError() {
        OpenAICompletionProvider provider = provider(stubbed(HttpStatus.BAD_REQUEST, "", new AtomicReference<>()));

        StepVerifier.create(provider.streamCompletion(StreamRequest.builder().model("gpt-4o").prompt("hi").build()))
                .expectErrorSatisfies(error -> {
                    assertInstanceOf(CompletionProviderException.class, error);
                    assertEquals(CompletionProviderException.PROVIDER_ERROR,
                            ((CompletionProviderException) error).getCode());
                })
                .verify();
    }

    @Test
    void testDisabledProvider() {
        properties.getProviders().get("openai").setEnabled(false);

        StepVerifier.create(provider(WebClient.create()).streamCompletion(StreamRequest.builder().model("gpt-4o").build()))
                .expectErrorSatisfies(error -> assertEquals(CompletionProviderException.NO_PROVIDER,
                        ((CompletionProviderException) error).getCode()))
                .verify();
    }

    private OpenAICompletionProvider provider(WebClient webClient) {
        return new OpenAICompletionProvider(webClient, properties, objectMapper);
    }

    static WebClient stubbed(HttpStatus status, String body, AtomicReference<ClientRequest> sent) {
        return WebClient.builder()
                .exchangeFunction(request -> {
                    sent.set(request);
                    return Mono.just(ClientResponse.create(status)
                            .header(HttpHeaders.CONTENT_TYPE, MediaType.TEXT_EVENT_STREAM_VALUE)
                            .body(body)
                            .build());
                })
                .build();
    }
}
