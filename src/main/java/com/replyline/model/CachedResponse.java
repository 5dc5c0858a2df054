package com.replyline.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;
import java.time.Instant;

/**
 * Cached agent answer as stored in Redis.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CachedResponse implements Serializable {

    private static final long serialVersionUID = 1L;

    /**
     * The answer text.
     */
    private String response;

    /**
     * Agent that produced the answer.
     */
    private String agentId;

    private Instant cachedAt;

    /**
     * Always cachedAt + TTL of the category.
     */
    private Instant expiresAt;

    private long hitCount;

    private CacheMetadata metadata;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class CacheMetadata implements Serializable {

        private static final long serialVersionUID = 1L;

        /**
         * Query as the user typed it (not normalized).
         */
        private String originalQuery;

        /**
         * Upstream latency of the fetch that produced this entry.
         */
        private long responseTimeMs;

        private String modelUsed;

        private CacheCategory category;
    }
}
