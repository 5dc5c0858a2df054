package com.replyline.service;

import com.replyline.config.ReplylineProperties;
import com.replyline.exception.StreamAbortedException;
import com.replyline.exception.StreamDeliveryException;
import com.replyline.model.ChatMessageRecord;
import com.replyline.model.MetricLabels;
import com.replyline.model.StreamEvent;
import com.replyline.model.StreamRequest;
import com.replyline.model.StreamSession;
import com.replyline.model.TokenDelta;
import com.replyline.persistence.MessageStore;
import com.replyline.provider.CompletionService;
import com.replyline.transport.ClientTransport;
import com.replyline.transport.EventPublisher;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.TimeoutException;
import java.util.function.Function;

/**
 * Delivers agent answers token by token.
 *
 * Each invocation owns one {@link StreamSession}: start, chunks in index order, then exactly one
 * of end or error. Every event goes to the client while it is connected and is always broadcast
 * on the agent's channel. A client disconnect aborts the session; the upstream is cancelled and
 * no further chunks are emitted.
 */
@Slf4j
@Service
public class StreamingService {

    static final String ERROR_STREAM_ABORTED = "stream_aborted";
    static final String ERROR_STREAM_FAILED = "stream_error";

    static final String ABORT_CLIENT_DISCONNECTED = "aborted by client";
    static final String ABORT_FIRST_CHUNK_DEADLINE = "aborted: no first chunk before the deadline";
    static final String ABORT_CHUNK_GAP_DEADLINE = "aborted: next chunk did not arrive before the deadline";
    static final String ABORT_TOTAL_DEADLINE = "aborted: total stream deadline exceeded";

    private final CompletionService completionService;
    private final MessageStore messageStore;
    private final EventPublisher eventPublisher;
    private final ChatMetricsService metricsService;
    private final Clock clock;
    private final ReplylineProperties.StreamConfig config;

    public StreamingService(
            CompletionService completionService,
            MessageStore messageStore,
            EventPublisher eventPublisher,
            ChatMetricsService metricsService,
            Clock clock,
            ReplylineProperties properties) {
        this.completionService = completionService;
        this.messageStore = messageStore;
        this.eventPublisher = eventPublisher;
        this.metricsService = metricsService;
        this.clock = clock;
        this.config = properties.getStream();
    }

    /**
     * Stream a fresh completion to the client.
     *
     * @return the end event; errors with {@link StreamAbortedException} on disconnect or deadline,
     * or with the upstream failure
     */
    public Mono<StreamEvent> streamResponse(StreamRequest request, ClientTransport transport) {
        MetricLabels labels = MetricLabels.builder()
                .requestType("stream")
                .cacheHit("false")
                .model(request.getModel())
                .build();

        return deliver(request.getAgentId(), transport, labels, session -> {
            Flux<TokenDelta> tokens = completionService.streamCompletion(request);
            return config.isEnforceTimeouts() ? applyDeadlines(tokens, session) : tokens;
        }, session -> messageStore.storeMessage(ChatMessageRecord.builder()
                .messageId(session.getMessageId())
                .conversationId(request.getConversationId())
                .workspaceId(request.getWorkspaceId())
                .agentId(request.getAgentId())
                .role("assistant")
                .content(session.joined())
                .model(request.getModel())
                .responseTimeMs(clock.millis() - session.getStartedAt())
                .build()).then());
    }

    /**
     * Replay a cached answer through the same event protocol.
     * Chunking is deterministic: the same answer always yields the same chunks.
     */
    public Mono<StreamEvent> replayCached(String agentId, String response, ClientTransport transport) {
        MetricLabels labels = MetricLabels.builder()
                .requestType("replay")
                .cacheHit("true")
                .build();

        return deliver(agentId, transport, labels,
                session -> Flux.fromIterable(splitContentDeterministically(response)).map(TokenDelta::of),
                session -> Mono.empty());
    }

    /**
     * Report a failure that happened outside this client's own stream, such as a shared fetch
     * that failed for another request. The client still gets its own start and error events.
     */
    public Mono<StreamEvent> reportFailure(String agentId, Throwable error, ClientTransport transport) {
        MetricLabels labels = MetricLabels.builder()
                .requestType("stream")
                .cacheHit("false")
                .build();

        return deliver(agentId, transport, labels, session -> Flux.error(error), session -> Mono.empty());
    }

    /**
     * Split content into chunks, extending a chunk to the next word boundary when one is close.
     */
    List<String> splitContentDeterministically(String content) {
        List<String> chunks = new ArrayList<>();

        if (content == null || content.isEmpty()) {
            return chunks;
        }

        int chunkSize = Math.max(1, config.getReplayChunkSize());
        int pos = 0;
        while (pos < content.length()) {
            int endPos = Math.min(pos + chunkSize, content.length());

            if (endPos < content.length()) {
                for (int i = endPos; i < Math.min(endPos + 3, content.length()); i++) {
                    if (Character.isWhitespace(content.charAt(i))) {
                        endPos = i + 1;
                        break;
                    }
                }
            }

            chunks.add(content.substring(pos, endPos));
            pos = endPos;
        }

        return chunks;
    }

    private Mono<StreamEvent> deliver(
            String agentId,
            ClientTransport transport,
            MetricLabels labels,
            Function<StreamSession, Flux<TokenDelta>> tokenSource,
            Function<StreamSession, Mono<Void>> persist) {

        return Mono.defer(() -> {
            StreamSession session = new StreamSession(UUID.randomUUID().toString(), clock.millis());
            String channel = config.getBroadcastChannelPrefix() + agentId;
            Sinks.One<Boolean> abortSignal = Sinks.one();

            emit(transport, channel, StreamEvent.start(session.getMessageId(), agentId, clock.instant()));

            return Mono.using(
                    () -> transport.onDisconnect(() -> {
                        session.abort(ABORT_CLIENT_DISCONNECTED);
                        abortSignal.tryEmitValue(Boolean.TRUE);
                    }),
                    hook -> tokenSource.apply(session)
                            .takeUntilOther(abortSignal.asMono())
                            .<TokenDelta>handle((delta, sink) -> {
                                if (session.isAborted()) {
                                    sink.error(aborted(session));
                                } else {
                                    sink.next(delta);
                                }
                            })
                            .filter(TokenDelta::hasContent)
                            .doOnNext(delta -> deliverChunk(session, delta.getContent(), transport, channel))
                            .then(Mono.defer(() -> finish(session, transport, channel, labels, persist)))
                            .onErrorResume(error -> fail(session, error, transport, channel)),
                    Disposable::dispose);
        });
    }

    private void deliverChunk(StreamSession session, String content, ClientTransport transport, String channel) {
        int index = session.getChunkCount();
        long latency = session.append(content, clock.millis());

        emit(transport, channel, StreamEvent.chunk(session.getMessageId(), content, index));
        metricsService.recordStreamChunk(latency, index);
    }

    private Mono<StreamEvent> finish(
            StreamSession session,
            ClientTransport transport,
            String channel,
            MetricLabels labels,
            Function<StreamSession, Mono<Void>> persist) {

        if (session.isAborted()) {
            return Mono.error(aborted(session));
        }

        return persist.apply(session).then(Mono.fromSupplier(() -> {
            long totalTime = clock.millis() - session.getStartedAt();
            StreamEvent end = StreamEvent.end(session.getMessageId(), session.getChunkCount(), totalTime, session.joined());

            emit(transport, channel, end);
            metricsService.recordResponseTime(totalTime, labels);

            Long firstChunkAt = session.getFirstChunkAt();
            log.info("Stream {} completed: {} chunks in {}ms, first chunk after {}ms", session.getMessageId(),
                    session.getChunkCount(), totalTime, firstChunkAt != null ? firstChunkAt - session.getStartedAt() : -1);
            return end;
        }));
    }

    private Mono<StreamEvent> fail(StreamSession session, Throwable error, ClientTransport transport, String channel) {
        boolean abort = error instanceof StreamAbortedException;
        String code = error instanceof StreamDeliveryException delivery
                ? delivery.getCode()
                : StreamDeliveryException.STREAM_ERROR;
        String partial = session.joined();

        if (abort) {
            log.info("Stream {} aborted after {} chunks: {}", session.getMessageId(), session.getChunkCount(), error.getMessage());
        } else {
            log.error("Stream {} failed after {} chunks: {}", session.getMessageId(), session.getChunkCount(), error.getMessage(), error);
        }

        emit(transport, channel, StreamEvent.error(session.getMessageId(), error.getMessage(), code, partial));
        metricsService.recordError(abort ? ERROR_STREAM_ABORTED : ERROR_STREAM_FAILED);

        return Mono.error(error);
    }

    /**
     * First-chunk and between-chunk timeouts plus a total ceiling. Expiry aborts the session.
     */
    private Flux<TokenDelta> applyDeadlines(Flux<TokenDelta> tokens, StreamSession session) {
        return tokens
                .timeout(Mono.delay(config.getFirstChunkTimeout()), delta -> Mono.delay(config.getBetweenChunksTimeout()))
                .onErrorMap(TimeoutException.class, e -> {
                    session.abort(session.getChunkCount() == 0 ? ABORT_FIRST_CHUNK_DEADLINE : ABORT_CHUNK_GAP_DEADLINE);
                    return new StreamAbortedException(abortMessage(session), e);
                })
                .takeUntilOther(Mono.delay(config.getTotalTimeout())
                        .doOnNext(tick -> session.abort(ABORT_TOTAL_DEADLINE)));
    }

    private void emit(ClientTransport transport, String channel, StreamEvent event) {
        if (transport.isConnected()) {
            transport.send(event);
        }

        Map<String, Object> broadcast = new LinkedHashMap<>();
        broadcast.put("type", event.getType().getValue());
        broadcast.put("data", event);
        eventPublisher.publish(channel, broadcast);
    }

    private static StreamAbortedException aborted(StreamSession session) {
        return new StreamAbortedException(abortMessage(session));
    }

    private static String abortMessage(StreamSession session) {
        return "Stream " + session.getMessageId() + " " + session.getAbortReason();
    }
}
