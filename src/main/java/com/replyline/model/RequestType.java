package com.replyline.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Kind of work a dispatch request carries; decides its base priority tier.
 */
public enum RequestType {

    SYSTEM_CHECK("system_check", PriorityLevel.CRITICAL),
    DIRECT_CHAT("direct_chat", PriorityLevel.HIGH),
    STATUS_QUERY("status_query", PriorityLevel.HIGH),
    TASK_UPDATE("task_update", PriorityLevel.NORMAL),
    BULK_REPORT("bulk_report", PriorityLevel.LOW),
    BACKGROUND_TASK("background_task", PriorityLevel.BATCH);

    private final String value;
    private final PriorityLevel basePriority;

    RequestType(String value, PriorityLevel basePriority) {
        this.value = value;
        this.basePriority = basePriority;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public PriorityLevel getBasePriority() {
        return basePriority;
    }

    /**
     * Interactive requests are streamed straight to the caller instead of being queued.
     */
    public boolean isInteractive() {
        return this == DIRECT_CHAT;
    }

    /**
     * Resolve a wire value; unknown values map to {@code null}.
     */
    @JsonCreator
    public static RequestType fromValue(String value) {
        if (value == null) {
            return null;
        }
        for (RequestType type : values()) {
            if (type.value.equalsIgnoreCase(value) || type.name().equalsIgnoreCase(value)) {
                return type;
            }
        }
        return null;
    }
}
