package com.replyline.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * What an upstream fetch hands back to the cache.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FetchResponse {
    private String response;
    private long responseTimeMs;  // 0 = measure around the fetch
    private String modelUsed;
}
