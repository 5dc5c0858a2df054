package com.replyline.model.dto;

import com.replyline.model.RequestType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Inbound chat message for an agent.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ChatRequest {

    private String message;

    private String projectId;
    private String workspaceId;
    private String conversationId;
    private String requesterId;

    /**
     * Model to answer with; the configured default when absent.
     */
    private String model;

    private String systemContext;

    /**
     * Defaults to direct_chat.
     */
    private RequestType type;

    /**
     * Explicit queue priority (1-100), overrides the computed one.
     */
    private Integer priority;
}
