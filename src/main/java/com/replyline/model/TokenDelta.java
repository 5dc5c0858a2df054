package com.replyline.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Incremental text from a completion provider stream.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TokenDelta {

    private String content;

    /**
     * Provider finish reason on the final delta, null otherwise.
     */
    private String finishReason;

    public static TokenDelta of(String content) {
        return TokenDelta.builder().content(content).build();
    }

    public boolean hasContent() {
        return content != null && !content.isEmpty();
    }
}
