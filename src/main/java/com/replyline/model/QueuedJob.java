package com.replyline.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;
import java.time.Instant;

/**
 * A job as tracked by the queue engine.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class QueuedJob {

    private String id;

    /**
     * Request type wire value the job was submitted under.
     */
    private String name;

    private DispatchRequest payload;

    private int priority;
    private boolean lifo;

    private JobState state;
    private int attempts;

    private Instant submittedAt;
    private Instant processedAt;
    private Instant finishedAt;

    private String failedReason;

    /**
     * Time spent waiting before a worker picked the job up, or null if not started.
     */
    public Duration waitTime() {
        if (submittedAt == null || processedAt == null) {
            return null;
        }
        return Duration.between(submittedAt, processedAt);
    }
}
