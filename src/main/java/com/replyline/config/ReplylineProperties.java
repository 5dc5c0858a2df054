package com.replyline.config;

import com.replyline.model.PriorityLevel;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.Map;

/**
 * Configuration properties for Replyline.
 */
@Data
@Component
@ConfigurationProperties(prefix = "replyline")
public class ReplylineProperties {

    private Map<String, ProviderConfig> providers = new HashMap<>();
    private CacheConfig cache = new CacheConfig();
    private QueueConfig queue = new QueueConfig();
    private StreamConfig stream = new StreamConfig();
    private MetricsConfig metrics = new MetricsConfig();
    private CircuitBreakerConfig circuitBreaker = new CircuitBreakerConfig();
    private ProxyConfig proxy = new ProxyConfig();

    @Data
    public static class ProviderConfig {
        private boolean enabled = true;
        private String baseUrl;
        private String apiKey;
        private int maxTokens = 1024;
    }

    @Data
    public static class CacheConfig {
        private boolean enabled = true;
        private String keyPrefix = "agent_response:";
    }

    @Data
    public static class QueueConfig {
        private String keyPrefix = "dispatch:";
        private int maxAttempts = 3;
        private int completedSampleSize = 100;
        private int completedRetention = 1000;
        private Duration processingRateWindow = Duration.ofSeconds(60);
        private Map<PriorityLevel, LaneConfig> lanes = defaultLanes();
        private WorkerConfig worker = new WorkerConfig();

        private static Map<PriorityLevel, LaneConfig> defaultLanes() {
            Map<PriorityLevel, LaneConfig> lanes = new EnumMap<>(PriorityLevel.class);
            lanes.put(PriorityLevel.CRITICAL, new LaneConfig(10, 5));
            lanes.put(PriorityLevel.HIGH, new LaneConfig(5, 10));
            lanes.put(PriorityLevel.NORMAL, new LaneConfig(3, 10));
            lanes.put(PriorityLevel.LOW, new LaneConfig(2, 5));
            lanes.put(PriorityLevel.BATCH, new LaneConfig(1, 2));
            return lanes;
        }
    }

    @Data
    public static class LaneConfig {
        private int weight;
        private int maxConcurrency;

        public LaneConfig() {
        }

        public LaneConfig(int weight, int maxConcurrency) {
            this.weight = weight;
            this.maxConcurrency = maxConcurrency;
        }
    }

    @Data
    public static class WorkerConfig {
        private boolean enabled = true;
        private String defaultModel = "claude-3-5-sonnet-latest";
        private long pollIntervalMs = 500;
        private int maxJobsPerPoll = 10;
    }

    @Data
    public static class StreamConfig {
        private String broadcastChannelPrefix = "agent-stream:";
        private boolean enforceTimeouts = false;
        private Duration firstChunkTimeout = Duration.ofSeconds(3);
        private Duration betweenChunksTimeout = Duration.ofSeconds(5);
        private Duration totalTimeout = Duration.ofSeconds(60);
        private int replayChunkSize = 8;
    }

    @Data
    public static class MetricsConfig {
        private String keyPrefix = "chat_metrics:";
        private Duration retention = Duration.ofHours(1);
        private Duration counterTtl = Duration.ofDays(7);
        private long responseTimeP99ThresholdMs = 3000;
        private double cacheHitRateLowThreshold = 0.30;
        private long queueDepthHighThreshold = 100;
    }

    @Data
    public static class CircuitBreakerConfig {
        private boolean enabled = true;
        private int failureThreshold = 5;
        private Duration resetTimeout = Duration.ofSeconds(30);
        private int halfOpenMaxRequests = 3;
    }

    @Data
    public static class ProxyConfig {
        private Duration timeout = Duration.ofSeconds(60);
        private Duration connectTimeout = Duration.ofSeconds(5);
        private int maxRetries = 3;
    }
}
