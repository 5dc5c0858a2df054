package com.replyline.service;

import com.replyline.config.ReplylineProperties;
import com.replyline.exception.StreamAbortedException;
import com.replyline.model.CacheCategory;
import com.replyline.model.CacheContext;
import com.replyline.model.CacheOrFetchResult;
import com.replyline.model.CachedResponse;
import com.replyline.model.DispatchRequest;
import com.replyline.model.FetchResponse;
import com.replyline.model.MetricLabels;
import com.replyline.model.QueuedJob;
import com.replyline.model.RequestType;
import com.replyline.model.StreamEvent;
import com.replyline.model.StreamRequest;
import com.replyline.model.TokenDelta;
import com.replyline.model.dto.ChatRequest;
import com.replyline.model.dto.DispatchResult;
import com.replyline.provider.CompletionService;
import com.replyline.transport.ClientTransport;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Collectors;

/**
 * Entry point for agent chat requests.
 *
 * Flow:
 * 1. Look the question up in the response cache
 * 2. On a miss, interactive requests are answered now (streamed or collected)
 * 3. Everything else is queued by priority and answered by the background worker
 * 4. Fresh answers are written back to the cache
 */
@Slf4j
@Service
public class AgentResponsePipeline {

    static final String PAYLOAD_MESSAGE = "message";
    static final String PAYLOAD_PROJECT_ID = "projectId";
    static final String PAYLOAD_CONVERSATION_ID = "conversationId";
    static final String PAYLOAD_MODEL = "model";
    static final String PAYLOAD_SYSTEM_CONTEXT = "systemContext";

    private static final String EMPTY_MESSAGE = "Message cannot be empty";

    private final AgentResponseCacheService cacheService;
    private final PriorityDispatchService dispatchService;
    private final StreamingService streamingService;
    private final CompletionService completionService;
    private final ChatMetricsService metricsService;
    private final Clock clock;
    private final ReplylineProperties properties;

    public AgentResponsePipeline(
            AgentResponseCacheService cacheService,
            PriorityDispatchService dispatchService,
            StreamingService streamingService,
            CompletionService completionService,
            ChatMetricsService metricsService,
            Clock clock,
            ReplylineProperties properties) {
        this.cacheService = cacheService;
        this.dispatchService = dispatchService;
        this.streamingService = streamingService;
        this.completionService = completionService;
        this.metricsService = metricsService;
        this.clock = clock;
        this.properties = properties;
    }

    /**
     * Answer a chat message as a stream of events.
     * A cached answer (or one fetched by a concurrent identical request) is replayed;
     * otherwise the completion is streamed live and cached when it finishes.
     *
     * @return the end event of the delivered stream
     */
    public Mono<StreamEvent> streamChat(String agentId, ChatRequest request, ClientTransport transport) {
        if (isEmpty(request)) {
            return Mono.error(new IllegalArgumentException(EMPTY_MESSAGE));
        }

        return streamOrJoin(agentId, request, transport, true);
    }

    private Mono<StreamEvent> streamOrJoin(
            String agentId,
            ChatRequest request,
            ClientTransport transport,
            boolean retryOnLeaderAbort) {

        StreamRequest streamRequest = toStreamRequest(agentId, request);
        AtomicBoolean streamedHere = new AtomicBoolean();
        AtomicBoolean replaying = new AtomicBoolean();
        AtomicReference<StreamEvent> liveEnd = new AtomicReference<>();

        return cacheService.cacheOrFetch(request.getMessage(), cacheContext(agentId, request), () -> {
                    streamedHere.set(true);
                    return streamingService.streamResponse(streamRequest, transport)
                            .doOnNext(liveEnd::set)
                            .map(end -> FetchResponse.builder()
                                    .response(end.getFullResponse())
                                    .responseTimeMs(end.getTotalTimeMs())
                                    .modelUsed(streamRequest.getModel())
                                    .build());
                })
                .flatMap(result -> {
                    if (streamedHere.get() && liveEnd.get() != null) {
                        return Mono.just(liveEnd.get());
                    }
                    log.debug("Replaying {} answer for agent {}", result.isFromCache() ? "cached" : "shared", agentId);
                    replaying.set(true);
                    return streamingService.replayCached(agentId, result.getResponse(), transport);
                })
                .onErrorResume(error -> {
                    if (streamedHere.get() || replaying.get()) {
                        return Mono.error(error);
                    }
                    // joined another request's fetch; its failure belongs to that session
                    if (retryOnLeaderAbort && error instanceof StreamAbortedException && transport.isConnected()) {
                        log.info("Shared stream for agent {} was aborted by its client, fetching again", agentId);
                        return streamOrJoin(agentId, request, transport, false);
                    }
                    return streamingService.reportFailure(agentId, error, transport);
                });
    }

    /**
     * Answer a chat message without streaming.
     * Interactive requests are answered now; other types are answered from cache or queued.
     */
    public Mono<DispatchResult> dispatch(String agentId, ChatRequest request) {
        if (isEmpty(request)) {
            return Mono.error(new IllegalArgumentException(EMPTY_MESSAGE));
        }

        RequestType type = request.getType() != null ? request.getType() : RequestType.DIRECT_CHAT;

        if (type.isInteractive()) {
            return answer(agentId, request, type.getValue())
                    .map(result -> DispatchResult.builder()
                            .response(result.getResponse())
                            .fromCache(result.isFromCache())
                            .category(result.getCategory())
                            .responseTimeMs(result.getResponseTimeMs())
                            .build());
        }

        return Mono.fromCallable(() -> {
            String key = cacheService.generateKey(request.getMessage(), cacheContext(agentId, request));
            CacheCategory category = cacheService.detectCategory(request.getMessage());

            Optional<CachedResponse> cached = cacheService.get(key);
            metricsService.recordCacheHit(cached.isPresent(), category.getValue());

            if (cached.isPresent()) {
                return DispatchResult.builder()
                        .response(cached.get().getResponse())
                        .fromCache(true)
                        .category(category)
                        .build();
            }

            DispatchRequest dispatchRequest = toDispatchRequest(agentId, request, type);
            String jobId = dispatchService.enqueue(dispatchRequest, request.getPriority());

            return DispatchResult.builder()
                    .jobId(jobId)
                    .priority(dispatchRequest.getComputedPriority())
                    .build();
        });
    }

    /**
     * Answer a queued job; used by the background worker.
     */
    public Mono<CacheOrFetchResult> processQueued(QueuedJob job) {
        DispatchRequest request = job.getPayload();
        Map<String, Object> payload = request.getPayload() != null ? request.getPayload() : Map.of();

        ChatRequest chatRequest = ChatRequest.builder()
                .message(stringValue(payload.get(PAYLOAD_MESSAGE)))
                .projectId(stringValue(payload.get(PAYLOAD_PROJECT_ID)))
                .conversationId(stringValue(payload.get(PAYLOAD_CONVERSATION_ID)))
                .model(stringValue(payload.get(PAYLOAD_MODEL)))
                .systemContext(stringValue(payload.get(PAYLOAD_SYSTEM_CONTEXT)))
                .workspaceId(request.getWorkspaceId())
                .requesterId(request.getRequesterId())
                .type(request.getType())
                .build();

        if (isEmpty(chatRequest)) {
            return Mono.error(new IllegalArgumentException("Job " + job.getId() + " has no message"));
        }
        return answer(request.getAgentId(), chatRequest, job.getName());
    }

    private Mono<CacheOrFetchResult> answer(String agentId, ChatRequest request, String requestType) {
        StreamRequest streamRequest = toStreamRequest(agentId, request);

        return Mono.defer(() -> {
            long startTime = clock.millis();

            return cacheService.cacheOrFetch(request.getMessage(), cacheContext(agentId, request),
                            () -> collectCompletion(streamRequest))
                    .doOnNext(result -> metricsService.recordResponseTime(clock.millis() - startTime,
                            MetricLabels.builder()
                                    .requestType(requestType)
                                    .cacheHit(Boolean.toString(result.isFromCache()))
                                    .model(streamRequest.getModel())
                                    .build()));
        });
    }

    /**
     * Run a completion to the end and return the full text.
     */
    private Mono<FetchResponse> collectCompletion(StreamRequest request) {
        return completionService.streamCompletion(request)
                .filter(TokenDelta::hasContent)
                .map(TokenDelta::getContent)
                .collect(Collectors.joining())
                .map(text -> FetchResponse.builder()
                        .response(text)
                        .modelUsed(request.getModel())
                        .build());
    }

    private StreamRequest toStreamRequest(String agentId, ChatRequest request) {
        return StreamRequest.builder()
                .agentId(agentId)
                .workspaceId(request.getWorkspaceId())
                .conversationId(request.getConversationId())
                .requesterId(request.getRequesterId())
                .model(request.getModel() != null ? request.getModel() : properties.getQueue().getWorker().getDefaultModel())
                .prompt(request.getMessage())
                .systemContext(request.getSystemContext())
                .build();
    }

    private DispatchRequest toDispatchRequest(String agentId, ChatRequest request, RequestType type) {
        Map<String, Object> payload = new HashMap<>();
        payload.put(PAYLOAD_MESSAGE, request.getMessage());
        putIfPresent(payload, PAYLOAD_PROJECT_ID, request.getProjectId());
        putIfPresent(payload, PAYLOAD_CONVERSATION_ID, request.getConversationId());
        putIfPresent(payload, PAYLOAD_MODEL, request.getModel());
        putIfPresent(payload, PAYLOAD_SYSTEM_CONTEXT, request.getSystemContext());

        return DispatchRequest.builder()
                .id(UUID.randomUUID().toString())
                .type(type)
                .workspaceId(request.getWorkspaceId())
                .agentId(agentId)
                .requesterId(request.getRequesterId())
                .payload(payload)
                .createdAt(clock.instant())
                .build();
    }

    private static CacheContext cacheContext(String agentId, ChatRequest request) {
        return CacheContext.builder()
                .agentId(agentId)
                .projectId(request.getProjectId())
                .workspaceId(request.getWorkspaceId())
                .build();
    }

    private static boolean isEmpty(ChatRequest request) {
        return request == null || request.getMessage() == null || request.getMessage().isBlank();
    }

    private static void putIfPresent(Map<String, Object> payload, String key, String value) {
        if (value != null) {
            payload.put(key, value);
        }
    }

    private static String stringValue(Object value) {
        return value != null ? value.toString() : null;
    }
}
