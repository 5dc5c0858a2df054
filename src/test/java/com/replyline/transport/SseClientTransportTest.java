package com.replyline.transport;

import com.replyline.model.StreamEvent;
import org.junit.jupiter.api.Test;
import reactor.core.Disposable;
import reactor.test.StepVerifier;

import java.time.Instant;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for SseClientTransport.
 */
class SseClientTransportTest {

    @Test
    void testEventsAreNamedByType() {
        SseClientTransport transport = new SseClientTransport();

        transport.send(StreamEvent.start("m-1", "agent-1", Instant.EPOCH));
        transport.send(StreamEvent.chunk("m-1", "Hi", 0));
        transport.complete();

        StepVerifier.create(transport.events())
                .assertNext(sse -> {
                    assertEquals("start", sse.event());
                    assertEquals("agent-1", sse.data().getAgentId());
                })
                .assertNext(sse -> {
                    assertEquals("chunk", sse.event());
                    assertEquals("Hi", sse.data().getChunk());
                })
                .verifyComplete();
    }

    @Test
    void testDisconnectRunsCallbacksOnce() {
        SseClientTransport transport = new SseClientTransport();
        AtomicInteger calls = new AtomicInteger();
        transport.onDisconnect(calls::incrementAndGet);

        transport.disconnect();
        transport.disconnect();

        assertFalse(transport.isConnected());
        assertEquals(1, calls.get());
    }

    @Test
    void testDisposedCallbackIsNotRun() {
        SseClientTransport transport = new SseClientTransport();
        AtomicInteger calls = new AtomicInteger();
        Disposable hook = transport.onDisconnect(calls::incrementAndGet);

        hook.dispose();
        transport.disconnect();

        assertEquals(0, calls.get());
    }

    @Test
    void testCallbackRegisteredAfterDisconnectRunsImmediately() {
        SseClientTransport transport = new SseClientTransport();
        transport.disconnect();
        AtomicInteger calls = new AtomicInteger();

        transport.onDisconnect(calls::incrementAndGet);

        assertEquals(1, calls.get());
    }

    @Test
    void testCancellingResponseCountsAsDisconnect() {
        SseClientTransport transport = new SseClientTransport();
        AtomicInteger calls = new AtomicInteger();
        transport.onDisconnect(calls::incrementAndGet);

        transport.events().subscribe().dispose();

        assertFalse(transport.isConnected());
        assertEquals(1, calls.get());
    }

    @Test
    void testEventsAfterDisconnectAreDropped() {
        SseClientTransport transport = new SseClientTransport();
        transport.send(StreamEvent.chunk("m-1", "kept", 0));
        transport.disconnect();
        transport.send(StreamEvent.chunk("m-1", "dropped", 1));

        StepVerifier.create(transport.events())
                .assertNext(sse -> assertEquals("kept", sse.data().getChunk()))
                .verifyComplete();
    }

    @Test
    void testNormalCompletionDoesNotRunDisconnectCallbacks() {
        SseClientTransport transport = new SseClientTransport();
        AtomicInteger calls = new AtomicInteger();
        transport.onDisconnect(calls::incrementAndGet);

        transport.complete();

        assertFalse(transport.isConnected());
        assertEquals(0, calls.get());
    }
}
