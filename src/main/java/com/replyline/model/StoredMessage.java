package com.replyline.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Message as persisted, with its store-assigned id.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StoredMessage {
    private String id;
    private String messageId;
    private String conversationId;
    private String content;
    private Instant createdAt;
}
