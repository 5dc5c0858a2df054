package com.replyline.model;

/**
 * Lifecycle of a job inside the queue engine.
 */
public enum JobState {
    WAITING,
    ACTIVE,
    COMPLETED,
    FAILED
}
