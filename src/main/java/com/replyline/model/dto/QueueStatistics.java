package com.replyline.model.dto;

import com.replyline.model.PriorityLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * Dispatch queue statistics.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class QueueStatistics {
    private long totalPending;
    private Map<PriorityLevel, Long> byPriorityTier;
    private double averageWaitTimeMs;
    private double processingRate;  // completions per second
    private double estimatedWaitMs;
}
