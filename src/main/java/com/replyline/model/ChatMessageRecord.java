package com.replyline.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Final assistant message handed to the message store.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ChatMessageRecord {
    private String messageId;
    private String conversationId;
    private String workspaceId;
    private String agentId;
    private String role;
    private String content;
    private String model;
    private long responseTimeMs;
}
