package com.replyline.controller;

import com.replyline.model.StreamEvent;
import com.replyline.model.dto.ChatRequest;
import com.replyline.model.dto.DispatchResult;
import com.replyline.service.AgentResponsePipeline;
import com.replyline.transport.SseClientTransport;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Agent chat endpoints: a Server-Sent Events stream and a non-streaming dispatch.
 */
@Slf4j
@RestController
@RequestMapping("/v1/agents/{agentId}/chat")
public class ChatController {

    private final AgentResponsePipeline pipeline;

    public ChatController(AgentResponsePipeline pipeline) {
        this.pipeline = pipeline;
    }

    /**
     * Stream an answer as start / chunk / end (or error) events.
     * Closing the connection aborts the stream.
     */
    @PostMapping(value = "/stream",
                 consumes = MediaType.APPLICATION_JSON_VALUE,
                 produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public Mono<ResponseEntity<Flux<ServerSentEvent<StreamEvent>>>> streamChat(
            @PathVariable String agentId,
            @RequestBody ChatRequest request) {

        log.info("Received stream request for agent: {}, model: {}", agentId, request.getModel());

        if (request.getMessage() == null || request.getMessage().isBlank()) {
            return Mono.error(new IllegalArgumentException("Message cannot be empty"));
        }

        SseClientTransport transport = new SseClientTransport();

        pipeline.streamChat(agentId, request, transport)
                .doFinally(signal -> transport.complete())
                .subscribe(
                        end -> log.debug("Stream {} delivered to agent {} client", end.getMessageId(), agentId),
                        error -> log.debug("Stream for agent {} ended with error: {}", agentId, error.getMessage()));

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.TEXT_EVENT_STREAM);
        headers.setCacheControl("no-cache");
        headers.setConnection("keep-alive");

        return Mono.just(ResponseEntity.ok()
                .headers(headers)
                .body(transport.events()));
    }

    /**
     * Answer without streaming. Queued requests return 202 with the job id.
     */
    @PostMapping(value = "/dispatch", consumes = MediaType.APPLICATION_JSON_VALUE)
    public Mono<ResponseEntity<DispatchResult>> dispatch(
            @PathVariable String agentId,
            @RequestBody ChatRequest request) {

        log.info("Received dispatch request for agent: {}, type: {}", agentId, request.getType());

        return pipeline.dispatch(agentId, request)
                .map(result -> {
                    HttpStatus status = result.getJobId() != null ? HttpStatus.ACCEPTED : HttpStatus.OK;

                    HttpHeaders headers = new HttpHeaders();
                    if (result.getFromCache() != null) {
                        headers.add("x-cache-hit", String.valueOf(result.getFromCache()));
                    }

                    return ResponseEntity.status(status)
                            .headers(headers)
                            .body(result);
                });
    }
}
