package com.replyline.provider;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.replyline.config.ReplylineProperties;
import com.replyline.exception.CompletionProviderException;
import com.replyline.model.StreamRequest;
import com.replyline.model.TokenDelta;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Anthropic (Claude) streaming provider on the Messages API.
 */
@Slf4j
@Component
public class AnthropicCompletionProvider extends AbstractCompletionProvider {

    private static final String ANTHROPIC_VERSION = "2023-06-01";

    private final ObjectMapper objectMapper;

    public AnthropicCompletionProvider(
            WebClient webClient,
            ReplylineProperties properties,
            ObjectMapper objectMapper) {
        super(webClient, properties, "anthropic");
        this.objectMapper = objectMapper;
    }

    @Override
    public String getName() {
        return "anthropic";
    }

    @Override
    public boolean supports(String model) {
        if (model == null) {
            return false;
        }

        return model.toLowerCase().startsWith("claude");
    }

    @Override
    protected Flux<TokenDelta> openStream(StreamRequest request) {
        String endpoint = config.getBaseUrl() + "/v1/messages";

        return webClient.post()
                .uri(endpoint)
                .header("x-api-key", config.getApiKey())
                .header("anthropic-version", ANTHROPIC_VERSION)
                .contentType(MediaType.APPLICATION_JSON)
                .accept(MediaType.TEXT_EVENT_STREAM)
                .bodyValue(buildRequestBody(request).toString())
                .retrieve()
                .bodyToFlux(SSE_TYPE)
                .takeWhile(event -> !"message_stop".equals(event.event()))
                .concatMap(this::parseEvent);
    }

    ObjectNode buildRequestBody(StreamRequest request) {
        ObjectNode body = objectMapper.createObjectNode();
        body.put("model", request.getModel());
        body.put("stream", true);
        body.put("max_tokens", config.getMaxTokens());

        if (request.getSystemContext() != null && !request.getSystemContext().isEmpty()) {
            body.put("system", request.getSystemContext());
        }

        body.putArray("messages").addObject()
                .put("role", "user")
                .put("content", request.getPrompt());

        return body;
    }

    /**
     * Map one stream event. Text deltas become tokens, the message delta carries the stop reason,
     * an error event fails the stream; everything else is dropped.
     */
    Mono<TokenDelta> parseEvent(ServerSentEvent<String> event) {
        if (event.data() == null) {
            return Mono.empty();
        }

        try {
            JsonNode payload = objectMapper.readTree(event.data());
            String type = event.event() != null ? event.event() : payload.path("type").asText();

            switch (type) {
                case "content_block_delta" -> {
                    String text = payload.path("delta").path("text").asText(null);
                    return text != null ? Mono.just(TokenDelta.of(text)) : Mono.empty();
                }
                case "message_delta" -> {
                    String stopReason = payload.path("delta").path("stop_reason").asText(null);
                    return stopReason != null
                            ? Mono.just(TokenDelta.builder().finishReason(mapStopReason(stopReason)).build())
                            : Mono.empty();
                }
                case "error" -> {
                    return Mono.error(new CompletionProviderException(CompletionProviderException.PROVIDER_ERROR,
                            "Anthropic stream error: " + payload.path("error").path("message").asText("unknown")));
                }
                default -> {
                    return Mono.empty();
                }
            }

        } catch (JsonProcessingException e) {
            log.warn("Skipping unparseable Anthropic event: {}", e.getMessage());
            return Mono.empty();
        }
    }

    /**
     * Map Claude stop reasons to OpenAI finish reasons.
     */
    private String mapStopReason(String claudeStopReason) {
        return switch (claudeStopReason) {
            case "max_tokens" -> "length";
            default -> "stop";
        };
    }
}
