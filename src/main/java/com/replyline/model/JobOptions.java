package com.replyline.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Submission options for the queue engine.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class JobOptions {
    private int priority;
    private boolean lifo;
    private String jobId;
}
