package com.replyline.transport;

import com.replyline.model.StreamEvent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.codec.ServerSentEvent;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Server-Sent Events transport for one WebFlux response.
 * The SSE event name is the stream event type. Cancelling the response flux counts as a disconnect.
 */
@Slf4j
public class SseClientTransport implements ClientTransport {

    private final Sinks.Many<ServerSentEvent<StreamEvent>> sink = Sinks.many().unicast().onBackpressureBuffer();
    private final AtomicBoolean connected = new AtomicBoolean(true);
    private final List<Runnable> disconnectCallbacks = new CopyOnWriteArrayList<>();

    /**
     * Events for the HTTP response body.
     */
    public Flux<ServerSentEvent<StreamEvent>> events() {
        return sink.asFlux().doOnCancel(this::disconnect);
    }

    @Override
    public boolean isConnected() {
        return connected.get();
    }

    @Override
    public synchronized void send(StreamEvent event) {
        if (!connected.get()) {
            return;
        }

        ServerSentEvent<StreamEvent> sse = ServerSentEvent.builder(event)
                .event(event.getType().getValue())
                .build();

        Sinks.EmitResult result = sink.tryEmitNext(sse);
        if (result.isFailure()) {
            log.debug("Dropped {} event for message {}: {}", event.getType().getValue(), event.getMessageId(), result);
        }
    }

    @Override
    public Disposable onDisconnect(Runnable callback) {
        if (!connected.get()) {
            callback.run();
            return () -> { };
        }

        disconnectCallbacks.add(callback);
        return () -> disconnectCallbacks.remove(callback);
    }

    /**
     * The client went away: run the disconnect callbacks and stop accepting events.
     */
    public void disconnect() {
        if (connected.compareAndSet(true, false)) {
            log.debug("Client disconnected");
            disconnectCallbacks.forEach(Runnable::run);
            disconnectCallbacks.clear();
            sink.tryEmitComplete();
        }
    }

    /**
     * The server finished the response normally.
     */
    public synchronized void complete() {
        if (connected.compareAndSet(true, false)) {
            disconnectCallbacks.clear();
            sink.tryEmitComplete();
        }
    }
}
