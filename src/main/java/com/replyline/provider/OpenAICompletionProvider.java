package com.replyline.provider;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.replyline.config.ReplylineProperties;
import com.replyline.model.StreamRequest;
import com.replyline.model.TokenDelta;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * OpenAI-compatible streaming provider (chat completions with {@code stream: true}).
 */
@Slf4j
@Component
public class OpenAICompletionProvider extends AbstractCompletionProvider {

    private static final String DONE = "[DONE]";

    private final ObjectMapper objectMapper;

    public OpenAICompletionProvider(
            WebClient webClient,
            ReplylineProperties properties,
            ObjectMapper objectMapper) {
        super(webClient, properties, "openai");
        this.objectMapper = objectMapper;
    }

    @Override
    public String getName() {
        return "openai";
    }

    @Override
    public boolean supports(String model) {
        if (model == null) {
            return false;
        }

        String lowerModel = model.toLowerCase();
        return lowerModel.startsWith("gpt-") ||
                lowerModel.startsWith("o1") ||
                lowerModel.startsWith("o3") ||
                lowerModel.contains("turbo");
    }

    @Override
    protected Flux<TokenDelta> openStream(StreamRequest request) {
        String endpoint = config.getBaseUrl() + "/chat/completions";

        return webClient.post()
                .uri(endpoint)
                .header(HttpHeaders.AUTHORIZATION, "Bearer " + config.getApiKey())
                .contentType(MediaType.APPLICATION_JSON)
                .accept(MediaType.TEXT_EVENT_STREAM)
                .bodyValue(buildRequestBody(request).toString())
                .retrieve()
                .bodyToFlux(SSE_TYPE)
                .mapNotNull(ServerSentEvent::data)
                .takeWhile(data -> !DONE.equals(data.trim()))
                .concatMap(this::parseChunk);
    }

    /**
     * Build the chat completions body: optional system message, then the user prompt.
     */
    ObjectNode buildRequestBody(StreamRequest request) {
        ObjectNode body = objectMapper.createObjectNode();
        body.put("model", request.getModel());
        body.put("stream", true);
        body.put("max_tokens", config.getMaxTokens());

        ArrayNode messages = body.putArray("messages");
        if (request.getSystemContext() != null && !request.getSystemContext().isEmpty()) {
            messages.addObject()
                    .put("role", "system")
                    .put("content", request.getSystemContext());
        }
        messages.addObject()
                .put("role", "user")
                .put("content", request.getPrompt());

        return body;
    }

    /**
     * Parse one {@code chat.completion.chunk}; chunks without text or finish reason are dropped.
     */
    Mono<TokenDelta> parseChunk(String data) {
        try {
            JsonNode choice = objectMapper.readTree(data).path("choices").path(0);
            String content = choice.path("delta").path("content").asText(null);
            String finishReason = choice.path("finish_reason").asText(null);

            if (content == null && finishReason == null) {
                return Mono.empty();
            }
            return Mono.just(TokenDelta.builder()
                    .content(content)
                    .finishReason(finishReason)
                    .build());

        } catch (JsonProcessingException e) {
            log.warn("Skipping unparseable OpenAI chunk: {}", e.getMessage());
            return Mono.empty();
        }
    }
}
