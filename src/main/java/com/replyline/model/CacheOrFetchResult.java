package com.replyline.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Result of a cache-through lookup.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CacheOrFetchResult {
    private String response;
    private boolean fromCache;
    private CacheCategory category;
    private long responseTimeMs;
}
