package com.replyline.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.replyline.config.JacksonConfiguration;
import com.replyline.config.ReplylineProperties;
import com.replyline.exception.CompletionProviderException;
import com.replyline.exception.StreamAbortedException;
import com.replyline.model.CacheContext;
import com.replyline.model.CacheOrFetchResult;
import com.replyline.model.QueuedJob;
import com.replyline.model.RequestType;
import com.replyline.model.StoredMessage;
import com.replyline.model.StreamEvent;
import com.replyline.model.StreamEventType;
import com.replyline.model.TokenDelta;
import com.replyline.model.dto.ChatRequest;
import com.replyline.model.dto.DispatchResult;
import com.replyline.persistence.MessageStore;
import com.replyline.provider.CompletionService;
import com.replyline.queue.RedisJobQueueEngine;
import com.replyline.support.InMemoryKeyValueStore;
import com.replyline.support.MutableClock;
import com.replyline.support.RecordingClientTransport;
import com.replyline.transport.EventPublisher;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Tests for AgentResponsePipeline wired to in-memory storage and a scripted provider.
 */
class AgentResponsePipelineTest {

    private CompletionService completionService;
    private AgentResponseCacheService cacheService;
    private RedisJobQueueEngine queueEngine;
    private AgentResponsePipeline pipeline;

    @BeforeEach
    void setUp() {
        MutableClock clock = new MutableClock(Instant.parse("2024-05-01T12:00:00Z"));
        InMemoryKeyValueStore store = new InMemoryKeyValueStore(clock);
        ObjectMapper objectMapper = new JacksonConfiguration().objectMapper();
        ReplylineProperties properties = new ReplylineProperties();
        ChatMetricsService metricsService = mock(ChatMetricsService.class);

        completionService = mock(CompletionService.class);
        MessageStore messageStore = mock(MessageStore.class);
        when(messageStore.storeMessage(any())).thenReturn(Mono.just(new StoredMessage()));

        cacheService = new AgentResponseCacheService(store, metricsService, objectMapper, clock, properties);
        queueEngine = new RedisJobQueueEngine(store, objectMapper, clock, properties);
        PriorityDispatchService dispatchService = new PriorityDispatchService(queueEngine, metricsService, clock, properties);
        StreamingService streamingService = new StreamingService(completionService, messageStore,
                mock(EventPublisher.class), metricsService, clock, properties);

        pipeline = new AgentResponsePipeline(cacheService, dispatchService, streamingService,
                completionService, metricsService, clock, properties);
    }

    @Test
    void testStreamedAnswerIsCachedAndReplayed() {
        answerWith("You have ", "two stories ", "in progress.");

        RecordingClientTransport live = new RecordingClientTransport();
        StepVerifier.create(pipeline.streamChat("agent-1", chat("What is in progress?"), live))
                .assertNext(end -> assertEquals("You have two stories in progress.", end.getFullResponse()))
                .verifyComplete();

        RecordingClientTransport replay = new RecordingClientTransport();
        StepVerifier.create(pipeline.streamChat("agent-1", chat("what is in progress?"), replay))
                .assertNext(end -> assertEquals("You have two stories in progress.", end.getFullResponse()))
                .verifyComplete();

        verify(completionService, times(1)).streamCompletion(any());
        assertEquals(List.of("You have ", "two stories ", "in progress."), chunks(live));
        assertEquals("You have two stories in progress.", String.join("", chunks(replay)));
        assertEquals(StreamEventType.START, replay.getEvents().get(0).getType());
        assertEquals(StreamEventType.END, replay.getEvents().get(replay.getEvents().size() - 1).getType());
    }

    @Test
    void testAbortedStreamIsNotCached() {
        answerWith("Partial", " answer");
        RecordingClientTransport transport = new RecordingClientTransport();
        transport.disconnectAfter(event -> event.getType() == StreamEventType.CHUNK);

        StepVerifier.create(pipeline.streamChat("agent-1", chat("sprint status"), transport))
                .expectError(StreamAbortedException.class)
                .verify(Duration.ofSeconds(5));

        String key = cacheService.generateKey("sprint status", CacheContext.builder().agentId("agent-1").build());
        assertTrue(cacheService.get(key).isEmpty());
        assertEquals(0, cacheService.inFlightCount());
    }

    @Test
    void testJoinedRequestSurvivesLeaderDisconnect() {
        Sinks.Many<TokenDelta> leaderTokens = Sinks.many().unicast().onBackpressureBuffer();
        when(completionService.streamCompletion(any()))
                .thenReturn(leaderTokens.asFlux(), Flux.just(TokenDelta.of("Hello"), TokenDelta.of(" world!")));

        RecordingClientTransport leader = new RecordingClientTransport();
        leader.disconnectAfter(event -> event.getType() == StreamEventType.CHUNK);
        RecordingClientTransport follower = new RecordingClientTransport();
        AtomicReference<Throwable> leaderError = new AtomicReference<>();
        AtomicReference<Throwable> followerError = new AtomicReference<>();
        AtomicReference<StreamEvent> followerEnd = new AtomicReference<>();

        pipeline.streamChat("agent-1", chat("sprint status"), leader).subscribe(end -> { }, leaderError::set);
        pipeline.streamChat("agent-1", chat("sprint status"), follower).subscribe(followerEnd::set, followerError::set);
        assertEquals(1, cacheService.inFlightCount());

        leaderTokens.tryEmitNext(TokenDelta.of("Hello"));

        assertInstanceOf(StreamAbortedException.class, leaderError.get());
        assertNull(followerError.get());
        assertNotNull(followerEnd.get());
        assertEquals("Hello world!", followerEnd.get().getFullResponse());
        assertEquals(StreamEventType.START, follower.getEvents().get(0).getType());
        assertTrue(follower.eventsOfType(StreamEventType.ERROR).isEmpty());
        assertEquals(List.of("Hello", " world!"), chunks(follower));
        verify(completionService, times(2)).streamCompletion(any());

        String key = cacheService.generateKey("sprint status", CacheContext.builder().agentId("agent-1").build());
        assertEquals("Hello world!", cacheService.get(key).orElseThrow().getResponse());
    }

    @Test
    void testJoinedRequestGetsItsOwnErrorWhenSharedFetchFails() {
        Sinks.Many<TokenDelta> leaderTokens = Sinks.many().unicast().onBackpressureBuffer();
        when(completionService.streamCompletion(any())).thenReturn(leaderTokens.asFlux());

        RecordingClientTransport leader = new RecordingClientTransport();
        RecordingClientTransport follower = new RecordingClientTransport();
        AtomicReference<Throwable> leaderError = new AtomicReference<>();
        AtomicReference<Throwable> followerError = new AtomicReference<>();

        pipeline.streamChat("agent-1", chat("sprint status"), leader).subscribe(end -> { }, leaderError::set);
        pipeline.streamChat("agent-1", chat("sprint status"), follower).subscribe(end -> { }, followerError::set);

        leaderTokens.tryEmitError(new CompletionProviderException(CompletionProviderException.PROVIDER_ERROR, "upstream 500"));

        assertInstanceOf(CompletionProviderException.class, leaderError.get());
        assertInstanceOf(CompletionProviderException.class, followerError.get());
        assertEquals(StreamEventType.START, follower.getEvents().get(0).getType());
        List<StreamEvent> errors = follower.eventsOfType(StreamEventType.ERROR);
        assertEquals(1, errors.size());
        assertEquals(CompletionProviderException.PROVIDER_ERROR, errors.get(0).getCode());
        assertEquals(1, leader.eventsOfType(StreamEventType.ERROR).size());
        verify(completionService, times(1)).streamCompletion(any());
    }

    @Test
    void testEmptyMessageIsRejected() {
        StepVerifier.create(pipeline.streamChat("agent-1", chat("   "), new RecordingClientTransport()))
                .expectError(IllegalArgumentException.class)
                .verify();
        StepVerifier.create(pipeline.dispatch("agent-1", chat(null)))
                .expectError(IllegalArgumentException.class)
                .verify();

        verify(completionService, never()).streamCompletion(any());
    }

    @Test
    void testDirectChatIsAnsweredImmediately() {
        answerWith("Hello", "!");

        DispatchResult first = pipeline.dispatch("agent-1", chat("hi there")).block();
        DispatchResult second = pipeline.dispatch("agent-1", chat("Hi there")).block();

        assertNotNull(first);
        assertEquals("Hello!", first.getResponse());
        assertFalse(first.getFromCache());
        assertNull(first.getJobId());
        assertNotNull(second);
        assertTrue(second.getFromCache());
        verify(completionService, times(1)).streamCompletion(any());
    }

    @Test
    void testBackgroundRequestIsQueued() {
        ChatRequest request = chat("Compile the weekly report");
        request.setType(RequestType.BULK_REPORT);
        request.setProjectId("p1");

        DispatchResult result = pipeline.dispatch("agent-1", request).block();

        assertNotNull(result);
        assertNotNull(result.getJobId());
        assertEquals(80, result.getPriority());
        assertNull(result.getResponse());

        QueuedJob job = queueEngine.getJob(result.getJobId()).orElseThrow();
        assertEquals("bulk_report", job.getName());
        assertEquals("Compile the weekly report", job.getPayload().getPayload().get("message"));
        assertEquals("p1", job.getPayload().getPayload().get("projectId"));
        verify(completionService, never()).streamCompletion(any());
    }

    @Test
    void testQueuedRequestServedFromCacheWhenAlreadyAnswered() {
        answerWith("Report ready");
        pipeline.dispatch("agent-1", chat("weekly report")).block();

        ChatRequest request = chat("weekly report");
        request.setType(RequestType.BULK_REPORT);
        DispatchResult result = pipeline.dispatch("agent-1", request).block();

        assertNotNull(result);
        assertTrue(result.getFromCache());
        assertEquals("Report ready", result.getResponse());
        assertNull(result.getJobId());
        assertTrue(queueEngine.listPending().isEmpty());
    }

    @Test
    void testProcessQueuedAnswersAndCaches() {
        answerWith("Three ", "tasks done");
        ChatRequest request = chat("what got done this week");
        request.setType(RequestType.TASK_UPDATE);
        pipeline.dispatch("agent-1", request).block();
        QueuedJob job = queueEngine.claimNext().orElseThrow();

        CacheOrFetchResult result = pipeline.processQueued(job).block();

        assertNotNull(result);
        assertEquals("Three tasks done", result.getResponse());
        assertFalse(result.isFromCache());

        DispatchResult again = pipeline.dispatch("agent-1", request).block();
        assertNotNull(again);
        assertTrue(again.getFromCache());
    }

    private void answerWith(String... tokens) {
        when(completionService.streamCompletion(any())).thenReturn(Flux.fromArray(tokens).map(TokenDelta::of));
    }

    private static ChatRequest chat(String message) {
        ChatRequest request = new ChatRequest();
        request.setMessage(message);
        return request;
    }

    private static List<String> chunks(RecordingClientTransport transport) {
        return transport.eventsOfType(StreamEventType.CHUNK).stream().map(StreamEvent::getChunk).toList();
    }
}
