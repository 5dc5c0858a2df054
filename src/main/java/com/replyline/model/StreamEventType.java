package com.replyline.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Event names of the streaming protocol.
 */
public enum StreamEventType {
    START("start"),
    CHUNK("chunk"),
    END("end"),
    ERROR("error");

    private final String value;

    StreamEventType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
