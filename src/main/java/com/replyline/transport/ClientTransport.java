package com.replyline.transport;

import com.replyline.model.StreamEvent;
import reactor.core.Disposable;

/**
 * Connection to the client receiving a streamed answer.
 */
public interface ClientTransport {

    boolean isConnected();

    /**
     * Deliver an event. Events sent after a disconnect are dropped.
     */
    void send(StreamEvent event);

    /**
     * Register a callback run once when the client goes away.
     * Runs immediately if the client is already gone.
     *
     * @return handle that unregisters the callback
     */
    Disposable onDisconnect(Runnable callback);
}
