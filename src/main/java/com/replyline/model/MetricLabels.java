package com.replyline.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Labels attached to a response-time observation.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MetricLabels {

    private String agentType;
    private String requestType;
    private String cacheHit;
    private String model;

    public Map<String, String> asMap() {
        Map<String, String> labels = new LinkedHashMap<>();
        if (agentType != null) labels.put("agentType", agentType);
        if (requestType != null) labels.put("requestType", requestType);
        if (cacheHit != null) labels.put("cacheHit", cacheHit);
        if (model != null) labels.put("model", model);
        return labels;
    }

    /**
     * Stable key suffix, e.g. {@code agentType=dev,cacheHit=false}.
     */
    public String toKeySuffix() {
        String joined = asMap().entrySet().stream()
                .map(e -> e.getKey() + "=" + e.getValue())
                .collect(Collectors.joining(","));
        return joined.isEmpty() ? "unlabeled" : joined;
    }
}
