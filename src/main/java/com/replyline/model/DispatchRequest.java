package com.replyline.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Map;

/**
 * Request submitted to the priority dispatch queue.
 * Immutable after creation except for {@link #computedPriority}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DispatchRequest {

    private String id;

    /**
     * {@code null} when the caller sent a type we don't know.
     */
    private RequestType type;

    private String workspaceId;
    private String agentId;
    private String requesterId;

    /**
     * Message text, project id, model and other job inputs.
     */
    private Map<String, Object> payload;

    private Instant createdAt;

    private Integer computedPriority;
}
