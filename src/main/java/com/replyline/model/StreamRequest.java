package com.replyline.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Input for one streamed completion.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class StreamRequest {
    private String agentId;
    private String workspaceId;
    private String conversationId;
    private String requesterId;
    private String model;
    private String prompt;
    private String systemContext;
}
