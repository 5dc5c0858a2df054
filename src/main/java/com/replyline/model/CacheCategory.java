package com.replyline.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.time.Duration;
import java.util.List;

/**
 * Coarse classification of a cached query, selecting its TTL.
 * Keyword patterns are matched against the lowercased query in declaration order.
 */
public enum CacheCategory {

    /**
     * Agent status queries, stale quickly.
     */
    STATUS("status", Duration.ofSeconds(30),
            List.of("status", "working on", "progress", "what are you doing", "current task", "busy")),

    /**
     * Help and explanation queries, stable for a long time.
     */
    HELP("help", Duration.ofSeconds(3600),
            List.of("how to", "how do i", "how can i", "what is", "explain", "help", "guide", "documentation")),

    /**
     * Project data queries (stories, tasks, epics).
     */
    PROJECT("project", Duration.ofSeconds(120),
            List.of("story", "stories", "task", "epic", "sprint", "project", "backlog", "pending"));

    private final String value;
    private final Duration ttl;
    private final List<String> patterns;

    CacheCategory(String value, Duration ttl, List<String> patterns) {
        this.value = value;
        this.ttl = ttl;
        this.patterns = patterns;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public Duration getTtl() {
        return ttl;
    }

    public boolean matches(String lowerQuery) {
        for (String pattern : patterns) {
            if (lowerQuery.contains(pattern)) {
                return true;
            }
        }
        return false;
    }

    @JsonCreator
    public static CacheCategory fromValue(String value) {
        for (CacheCategory category : values()) {
            if (category.value.equalsIgnoreCase(value)) {
                return category;
            }
        }
        return PROJECT;
    }
}
