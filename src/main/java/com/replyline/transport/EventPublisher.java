package com.replyline.transport;

/**
 * Fan-out of stream events to other listeners of an agent (other instances, dashboards).
 * Fire-and-forget: publishing never fails the caller.
 */
public interface EventPublisher {

    void publish(String channel, Object payload);
}
