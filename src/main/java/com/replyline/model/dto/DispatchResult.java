package com.replyline.model.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.replyline.model.CacheCategory;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Outcome of a non-streaming chat request: either an answer or a queued job.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class DispatchResult {

    // answered
    private String response;
    private Boolean fromCache;
    private CacheCategory category;
    private Long responseTimeMs;

    // queued
    private String jobId;
    private Integer priority;
}
