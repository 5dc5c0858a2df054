package com.replyline.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Scope a cached answer belongs to.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CacheContext {

    /**
     * Owning agent; always part of the key.
     */
    private String agentId;

    /**
     * Project the question is about, if any.
     */
    private String projectId;

    /**
     * Workspace (tenant) scope, if any.
     */
    private String workspaceId;
}
