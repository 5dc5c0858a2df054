package com.replyline.service;

import com.replyline.config.ReplylineProperties;
import com.replyline.exception.CompletionProviderException;
import com.replyline.exception.StreamAbortedException;
import com.replyline.model.ChatMessageRecord;
import com.replyline.model.StoredMessage;
import com.replyline.model.StreamEvent;
import com.replyline.model.StreamEventType;
import com.replyline.model.StreamRequest;
import com.replyline.model.TokenDelta;
import com.replyline.persistence.MessageStore;
import com.replyline.provider.CompletionService;
import com.replyline.support.MutableClock;
import com.replyline.support.RecordingClientTransport;
import com.replyline.transport.EventPublisher;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.atLeastOnce;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Tests for StreamingService.
 */
class StreamingServiceTest {

    private static final String CHANNEL = "agent-stream:agent-1";

    private CompletionService completionService;
    private MessageStore messageStore;
    private EventPublisher eventPublisher;
    private ChatMetricsService metricsService;
    private ReplylineProperties properties;
    private StreamingService streamingService;
    private RecordingClientTransport transport;

    @BeforeEach
    void setUp() {
        completionService = mock(CompletionService.class);
        messageStore = mock(MessageStore.class);
        eventPublisher = mock(EventPublisher.class);
        metricsService = mock(ChatMetricsService.class);
        properties = new ReplylineProperties();
        streamingService = new StreamingService(completionService, messageStore, eventPublisher, metricsService,
                new MutableClock(Instant.parse("2024-05-01T12:00:00Z")), properties);
        transport = new RecordingClientTransport();

        when(messageStore.storeMessage(any())).thenReturn(Mono.just(StoredMessage.builder().id("m-1").build()));
    }

    @Test
    void testStreamsChunksInOrderThenEnd() {
        tokens(Flux.just("Hello", " world", "!").map(TokenDelta::of));

        StepVerifier.create(streamingService.streamResponse(request(), transport))
                .assertNext(end -> {
                    assertEquals(StreamEventType.END, end.getType());
                    assertEquals("Hello world!", end.getFullResponse());
                    assertEquals(3, end.getTotalChunks());
                })
                .verifyComplete();

        List<StreamEvent> events = transport.getEvents();
        assertEquals(5, events.size());
        assertEquals(StreamEventType.START, events.get(0).getType());
        assertEquals("agent-1", events.get(0).getAgentId());
        assertEquals(StreamEventType.END, events.get(4).getType());

        List<StreamEvent> chunks = transport.eventsOfType(StreamEventType.CHUNK);
        assertEquals(List.of("Hello", " world", "!"), chunks.stream().map(StreamEvent::getChunk).toList());
        assertEquals(List.of(0, 1, 2), chunks.stream().map(StreamEvent::getIndex).toList());
        for (StreamEvent event : events) {
            assertEquals(events.get(0).getMessageId(), event.getMessageId());
        }

        verify(eventPublisher, times(5)).publish(eq(CHANNEL), any());
        verify(metricsService, times(3)).recordStreamChunk(anyLong(), anyInt());
        verify(metricsService).recordResponseTime(anyLong(), any());
    }

    @Test
    void testCompletedMessageIsPersisted() {
        tokens(Flux.just("Done", ".").map(TokenDelta::of));

        streamingService.streamResponse(request(), transport).block();

        ArgumentCaptor<ChatMessageRecord> captor = ArgumentCaptor.forClass(ChatMessageRecord.class);
        verify(messageStore).storeMessage(captor.capture());
        assertEquals("Done.", captor.getValue().getContent());
        assertEquals("assistant", captor.getValue().getRole());
        assertEquals("conv-1", captor.getValue().getConversationId());
        assertEquals("agent-1", captor.getValue().getAgentId());
        assertEquals(transport.getEvents().get(0).getMessageId(), captor.getValue().getMessageId());
    }

    @Test
    void testEmptyDeltasAreSkipped() {
        tokens(Flux.just(TokenDelta.of(""), TokenDelta.builder().finishReason("stop").build(), TokenDelta.of("A")));

        StepVerifier.create(streamingService.streamResponse(request(), transport))
                .assertNext(end -> assertEquals(1, end.getTotalChunks()))
                .verifyComplete();

        assertEquals(0, transport.eventsOfType(StreamEventType.CHUNK).get(0).getIndex());
    }

    @Test
    void testDisconnectAbortsStream() {
        tokens(Flux.just("Hello", " world", "!").map(TokenDelta::of));
        transport.disconnectAfter(event -> event.getType() == StreamEventType.CHUNK);

        StepVerifier.create(streamingService.streamResponse(request(), transport))
                .expectError(StreamAbortedException.class)
                .verify(Duration.ofSeconds(5));

        assertEquals(1, transport.eventsOfType(StreamEventType.CHUNK).size());
        assertTrue(transport.eventsOfType(StreamEventType.END).isEmpty());
        assertTrue(transport.eventsOfType(StreamEventType.ERROR).isEmpty());

        StreamEvent error = broadcastOfType(StreamEventType.ERROR);
        assertEquals(StreamAbortedException.STREAM_ABORTED, error.getCode());
        assertEquals("Hello", error.getPartialResponse());

        verify(messageStore, never()).storeMessage(any());
        verify(metricsService).recordError(StreamingService.ERROR_STREAM_ABORTED);
    }

    @Test
    void testAlreadyDisconnectedClientAbortsImmediately() {
        tokens(Flux.just("never", "sent").map(TokenDelta::of));
        transport.disconnect();

        StepVerifier.create(streamingService.streamResponse(request(), transport))
                .expectError(StreamAbortedException.class)
                .verify(Duration.ofSeconds(5));

        assertTrue(transport.getEvents().isEmpty());
        StreamEvent error = broadcastOfType(StreamEventType.ERROR);
        assertEquals("", error.getPartialResponse());
        assertTrue(error.getError().endsWith(StreamingService.ABORT_CLIENT_DISCONNECTED));
    }

    @Test
    void testProviderErrorIsReportedWithPartialResponse() {
        tokens(Flux.concat(
                Flux.just(TokenDelta.of("Hel")),
                Flux.error(new CompletionProviderException(CompletionProviderException.PROVIDER_ERROR, "upstream 500"))));

        StepVerifier.create(streamingService.streamResponse(request(), transport))
                .expectError(CompletionProviderException.class)
                .verify(Duration.ofSeconds(5));

        List<StreamEvent> errors = transport.eventsOfType(StreamEventType.ERROR);
        assertEquals(1, errors.size());
        assertEquals(CompletionProviderException.PROVIDER_ERROR, errors.get(0).getCode());
        assertEquals("upstream 500", errors.get(0).getError());
        assertEquals("Hel", errors.get(0).getPartialResponse());
        verify(metricsService).recordError(StreamingService.ERROR_STREAM_FAILED);
    }

    @Test
    void testUnexpectedErrorUsesGenericCode() {
        tokens(Flux.error(new IllegalStateException("boom")));

        StepVerifier.create(streamingService.streamResponse(request(), transport))
                .expectError(IllegalStateException.class)
                .verify(Duration.ofSeconds(5));

        StreamEvent error = transport.eventsOfType(StreamEventType.ERROR).get(0);
        assertEquals("STREAM_ERROR", error.getCode());
        assertEquals("", error.getPartialResponse());
    }

    @Test
    void testFirstChunkDeadlineAbortsStream() {
        properties.getStream().setEnforceTimeouts(true);
        properties.getStream().setFirstChunkTimeout(Duration.ofMillis(50));
        tokens(Flux.never());

        StepVerifier.create(streamingService.streamResponse(request(), transport))
                .expectError(StreamAbortedException.class)
                .verify(Duration.ofSeconds(5));

        StreamEvent error = transport.eventsOfType(StreamEventType.ERROR).get(0);
        assertEquals(StreamAbortedException.STREAM_ABORTED, error.getCode());
        assertEquals("", error.getPartialResponse());
        assertTrue(error.getError().endsWith(StreamingService.ABORT_FIRST_CHUNK_DEADLINE));
    }

    @Test
    void testChunkGapDeadlineAbortsStream() throws InterruptedException {
        properties.getStream().setEnforceTimeouts(true);
        properties.getStream().setFirstChunkTimeout(Duration.ofSeconds(5));
        properties.getStream().setBetweenChunksTimeout(Duration.ofMillis(50));
        properties.getStream().setTotalTimeout(Duration.ofSeconds(30));
        tokens(Flux.concat(
                Flux.just("Hel", "lo").map(TokenDelta::of),
                Flux.just(TokenDelta.of(" late")).delayElements(Duration.ofMillis(500))));

        StepVerifier.create(streamingService.streamResponse(request(), transport))
                .expectError(StreamAbortedException.class)
                .verify(Duration.ofSeconds(5));
        Thread.sleep(700);

        StreamEvent error = transport.eventsOfType(StreamEventType.ERROR).get(0);
        assertEquals(StreamAbortedException.STREAM_ABORTED, error.getCode());
        assertEquals("Hello", error.getPartialResponse());
        assertTrue(error.getError().endsWith(StreamingService.ABORT_CHUNK_GAP_DEADLINE));
        assertEquals(2, transport.eventsOfType(StreamEventType.CHUNK).size());
        assertTrue(transport.eventsOfType(StreamEventType.END).isEmpty());
        verify(messageStore, never()).storeMessage(any());
    }

    @Test
    void testTotalDeadlineAbortsStream() throws InterruptedException {
        properties.getStream().setEnforceTimeouts(true);
        properties.getStream().setFirstChunkTimeout(Duration.ofSeconds(5));
        properties.getStream().setBetweenChunksTimeout(Duration.ofSeconds(5));
        properties.getStream().setTotalTimeout(Duration.ofMillis(200));
        tokens(Flux.interval(Duration.ofMillis(20)).map(i -> TokenDelta.of("t" + i + " ")));

        StepVerifier.create(streamingService.streamResponse(request(), transport))
                .expectError(StreamAbortedException.class)
                .verify(Duration.ofSeconds(5));

        int chunksAtAbort = transport.eventsOfType(StreamEventType.CHUNK).size();
        Thread.sleep(200);

        StreamEvent error = transport.eventsOfType(StreamEventType.ERROR).get(0);
        String delivered = transport.eventsOfType(StreamEventType.CHUNK).stream()
                .map(StreamEvent::getChunk)
                .reduce("", String::concat);
        assertEquals(StreamAbortedException.STREAM_ABORTED, error.getCode());
        assertEquals(delivered, error.getPartialResponse());
        assertTrue(error.getError().endsWith(StreamingService.ABORT_TOTAL_DEADLINE));
        assertTrue(chunksAtAbort > 0);
        assertEquals(chunksAtAbort, transport.eventsOfType(StreamEventType.CHUNK).size());
        verify(messageStore, never()).storeMessage(any());
    }

    @Test
    void testReportFailureSendsStartAndError() {
        StepVerifier.create(streamingService.reportFailure("agent-1",
                        new CompletionProviderException(CompletionProviderException.CIRCUIT_OPEN, "circuit open"), transport))
                .expectError(CompletionProviderException.class)
                .verify(Duration.ofSeconds(5));

        assertEquals(StreamEventType.START, transport.getEvents().get(0).getType());
        StreamEvent error = transport.eventsOfType(StreamEventType.ERROR).get(0);
        assertEquals(CompletionProviderException.CIRCUIT_OPEN, error.getCode());
        assertEquals("", error.getPartialResponse());
        verify(completionService, never()).streamCompletion(any());
    }

    @Test
    void testReplayCachedUsesSameProtocolWithoutPersisting() {
        String answer = "You have three stories in progress.";

        StepVerifier.create(streamingService.replayCached("agent-1", answer, transport))
                .assertNext(end -> assertEquals(answer, end.getFullResponse()))
                .verifyComplete();

        List<StreamEvent> chunks = transport.eventsOfType(StreamEventType.CHUNK);
        assertEquals(streamingService.splitContentDeterministically(answer).size(), chunks.size());
        assertEquals(StreamEventType.START, transport.getEvents().get(0).getType());
        verify(messageStore, never()).storeMessage(any());
        verify(completionService, never()).streamCompletion(any());
        verify(eventPublisher, atLeastOnce()).publish(anyString(), any());
    }

    @Test
    void testSplitContentDeterministically() {
        assertEquals(List.of("abcdefgh ", "ijk"), streamingService.splitContentDeterministically("abcdefgh ijk"));
        assertEquals(List.of("abcdefghi ", "jk"), streamingService.splitContentDeterministically("abcdefghi jk"));
        assertEquals(List.of("abcdefgh", "ijklmnop"), streamingService.splitContentDeterministically("abcdefghijklmnop"));
        assertTrue(streamingService.splitContentDeterministically("").isEmpty());
        assertTrue(streamingService.splitContentDeterministically(null).isEmpty());

        String text = "The sprint ends on Friday, two stories remain open.";
        List<String> chunks = streamingService.splitContentDeterministically(text);
        assertEquals(text, String.join("", chunks));
        assertEquals(chunks, streamingService.splitContentDeterministically(text));
    }

    private void tokens(Flux<TokenDelta> flux) {
        when(completionService.streamCompletion(any())).thenReturn(flux);
    }

    private static StreamRequest request() {
        return StreamRequest.builder()
                .agentId("agent-1")
                .conversationId("conv-1")
                .model("claude-3-5-sonnet-latest")
                .prompt("Say hello")
                .build();
    }

    @SuppressWarnings("unchecked")
    private StreamEvent broadcastOfType(StreamEventType type) {
        ArgumentCaptor<Object> captor = ArgumentCaptor.forClass(Object.class);
        verify(eventPublisher, atLeastOnce()).publish(eq(CHANNEL), captor.capture());
        return captor.getAllValues().stream()
                .map(payload -> (Map<String, Object>) payload)
                .filter(payload -> type.getValue().equals(payload.get("type")))
                .map(payload -> (StreamEvent) payload.get("data"))
                .findFirst()
                .orElseThrow();
    }
}
