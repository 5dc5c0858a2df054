package com.replyline.model.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Point-in-time view of pipeline health.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MetricsSummary {

    private ResponseTime responseTime;
    private Throughput throughput;
    private Cache cache;
    private Queue queue;

    public static MetricsSummary empty() {
        return MetricsSummary.builder()
                .responseTime(new ResponseTime())
                .throughput(new Throughput())
                .cache(new Cache())
                .queue(new Queue())
                .build();
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ResponseTime {
        private double p50;
        private double p90;
        private double p99;
        private double avg;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Throughput {
        private double requestsPerSecond;
        private long totalRequests;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Cache {
        private double hitRate;
        private long totalHits;
        private long totalMisses;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Queue {
        private long currentDepth;
        private double avgWaitTime;
        private double processingRate;
    }
}
