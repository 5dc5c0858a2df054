package com.replyline.model.dto;

import com.replyline.model.CacheCategory;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.EnumMap;
import java.util.Map;

/**
 * Response cache statistics for the operations dashboard.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CacheStatistics {

    private long totalHits;

    private long totalMisses;

    /**
     * Hit rate (0.0-1.0).
     */
    private double hitRate;

    /**
     * Entries written per category since the counters were last reset.
     */
    private Map<CacheCategory, Long> entriesByCategory;

    /**
     * Average upstream latency of fetches that populated the cache, in ms.
     */
    private double avgResponseTime;

    public static CacheStatistics empty() {
        Map<CacheCategory, Long> byCategory = new EnumMap<>(CacheCategory.class);
        for (CacheCategory category : CacheCategory.values()) {
            byCategory.put(category, 0L);
        }
        return CacheStatistics.builder()
                .entriesByCategory(byCategory)
                .build();
    }
}
