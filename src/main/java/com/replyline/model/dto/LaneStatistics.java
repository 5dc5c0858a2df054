package com.replyline.model.dto;

import com.replyline.model.PriorityLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Configuration and current load of one priority lane.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LaneStatistics {
    private PriorityLevel tier;
    private int priority;
    private int weight;
    private int maxConcurrency;
    private long pending;
}
