package com.replyline.model;

import java.util.ArrayList;
import java.util.List;

/**
 * Per-invocation state of one streamed answer. Never shared between invocations;
 * only the abort flag is written from another thread (the disconnect hook).
 */
public class StreamSession {

    private final String messageId;
    private final long startedAt;
    private final List<String> chunks = new ArrayList<>();
    private volatile String abortReason;
    private Long firstChunkAt;
    private long lastChunkAt;

    public StreamSession(String messageId, long startedAt) {
        this.messageId = messageId;
        this.startedAt = startedAt;
        this.lastChunkAt = startedAt;
    }

    /**
     * Append a chunk.
     *
     * @return latency since the previous chunk (or since start for the first one)
     */
    public long append(String chunk, long now) {
        long latency = now - lastChunkAt;
        if (firstChunkAt == null) {
            firstChunkAt = now;
        }
        lastChunkAt = now;
        chunks.add(chunk);
        return latency;
    }

    /**
     * Mark the session aborted. The first reason wins.
     */
    public synchronized void abort(String reason) {
        if (abortReason == null) {
            abortReason = reason;
        }
    }

    public boolean isAborted() {
        return abortReason != null;
    }

    public String getAbortReason() {
        return abortReason;
    }

    public String getMessageId() {
        return messageId;
    }

    public long getStartedAt() {
        return startedAt;
    }

    public Long getFirstChunkAt() {
        return firstChunkAt;
    }

    public int getChunkCount() {
        return chunks.size();
    }

    public String joined() {
        return String.join("", chunks);
    }
}
