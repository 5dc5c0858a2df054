package com.replyline.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.replyline.config.ReplylineProperties;
import com.replyline.model.MetricLabels;
import com.replyline.model.TimeSeriesPoint;
import com.replyline.model.dto.AlertStatus;
import com.replyline.model.dto.MetricsSummary;
import com.replyline.model.dto.TimeSeriesData;
import com.replyline.repository.KeyValueStore;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Performance metrics for the agent response pipeline.
 *
 * Counters and raw samples live in the key-value store so every instance sees the same numbers;
 * the same observations are mirrored to Micrometer for Prometheus scraping.
 * Recording never throws: a store failure skips the observation with a warning.
 */
@Slf4j
@Service
public class ChatMetricsService {

    /**
     * Cumulative histogram boundaries for response time (ms).
     */
    public static final long[] RESPONSE_TIME_BUCKETS = {100, 250, 500, 1000, 2000, 3000, 5000};

    /**
     * Cumulative histogram boundaries for stream chunk latency (ms).
     */
    public static final long[] STREAM_LATENCY_BUCKETS = {50, 100, 250, 500, 1000, 2000};

    public static final String ALERT_RESPONSE_TIME_P99 = "response_time_p99";
    public static final String ALERT_CACHE_HIT_RATE_LOW = "cache_hit_rate_low";
    public static final String ALERT_QUEUE_DEPTH_HIGH = "queue_depth_high";

    private static final String METER_PREFIX = "replyline";
    private static final long PROCESSING_RATE_WINDOW_MS = 60_000;

    private final KeyValueStore store;
    private final MeterRegistry meterRegistry;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final ReplylineProperties.MetricsConfig config;

    private final String responseTimesKey;
    private final String requestCountKey;
    private final String cacheStatsKey;
    private final String queueDepthKey;
    private final String queueWaitKey;
    private final String streamLatencyKey;
    private final String errorCountKey;

    private final Map<String, AtomicLong> queueDepthGauges = new ConcurrentHashMap<>();

    public ChatMetricsService(
            KeyValueStore store,
            MeterRegistry meterRegistry,
            ObjectMapper objectMapper,
            Clock clock,
            ReplylineProperties properties) {
        this.store = store;
        this.meterRegistry = meterRegistry;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.config = properties.getMetrics();

        String prefix = config.getKeyPrefix();
        this.responseTimesKey = prefix + "response_time";
        this.requestCountKey = prefix + "request_count";
        this.cacheStatsKey = prefix + "cache";
        this.queueDepthKey = prefix + "queue_depth";
        this.queueWaitKey = prefix + "queue_wait";
        this.streamLatencyKey = prefix + "stream_latency";
        this.errorCountKey = prefix + "errors";
    }

    /**
     * Record an end-to-end response time.
     * Every bucket whose boundary is >= the value is incremented (cumulative histogram).
     */
    public void recordResponseTime(long timeMs, MetricLabels labels) {
        MetricLabels effective = labels != null ? labels : new MetricLabels();

        Timer.builder(METER_PREFIX + ".response.time")
                .description("Agent response time")
                .tag("agentType", tagValue(effective.getAgentType()))
                .tag("requestType", tagValue(effective.getRequestType()))
                .tag("cacheHit", tagValue(effective.getCacheHit()))
                .tag("model", tagValue(effective.getModel()))
                .register(meterRegistry)
                .record(timeMs, TimeUnit.MILLISECONDS);

        try {
            String labelSuffix = effective.toKeySuffix();
            for (long bucket : RESPONSE_TIME_BUCKETS) {
                if (timeMs <= bucket) {
                    store.incrementCounter(responseTimesKey + ":bucket:" + bucket + ":" + labelSuffix, 1);
                }
            }

            appendToTimeSeries(responseTimesKey + ":raw", timeMs);

            store.incrementCounter(requestCountKey + ":" + labelSuffix, 1);
            store.incrementCounter(requestCountKey + ":total", 1);
        } catch (Exception e) {
            log.warn("Failed to record response time: {}", e.getMessage());
        }
    }

    /**
     * Record a cache hit or miss for a category.
     */
    public void recordCacheHit(boolean hit, String category) {
        String result = hit ? "hits" : "misses";

        Counter.builder(METER_PREFIX + ".cache.requests")
                .tag("result", hit ? "hit" : "miss")
                .tag("category", category)
                .register(meterRegistry)
                .increment();

        try {
            store.incrementCounter(cacheStatsKey + ":" + result + ":" + category, 1);
            store.incrementCounter(cacheStatsKey + ":" + result + ":total", 1);
        } catch (Exception e) {
            log.warn("Failed to record cache {}: {}", hit ? "hit" : "miss", e.getMessage());
        }
    }

    /**
     * Record the current queue depth of a tier ("total" for the whole queue).
     */
    public void recordQueueDepth(long depth, String tier) {
        queueDepthGauges.computeIfAbsent(tier, t -> meterRegistry.gauge(
                METER_PREFIX + ".queue.depth",
                Tags.of("tier", t),
                new AtomicLong())).set(depth);

        try {
            store.set(queueDepthKey + ":" + tier, Long.toString(depth), config.getCounterTtl());
            if ("total".equals(tier)) {
                appendToTimeSeries(queueDepthKey + ":history", depth);
            }
        } catch (Exception e) {
            log.warn("Failed to record queue depth: {}", e.getMessage());
        }
    }

    /**
     * Record how long a job waited in the queue before a worker started it.
     */
    public void recordQueueWaitTime(long waitMs) {
        try {
            appendToTimeSeries(queueWaitKey + ":raw", waitMs);
        } catch (Exception e) {
            log.warn("Failed to record queue wait time: {}", e.getMessage());
        }
    }

    /**
     * Record latency of one streamed chunk. The first chunk (time to first token) is tracked separately.
     */
    public void recordStreamChunk(long latencyMs, int chunkIndex) {
        DistributionSummary.builder(METER_PREFIX + ".stream.chunk.latency")
                .baseUnit("milliseconds")
                .tag("position", chunkIndex == 0 ? "first" : "subsequent")
                .register(meterRegistry)
                .record(latencyMs);

        try {
            if (chunkIndex == 0) {
                store.incrementCounter(streamLatencyKey + ":first_chunk", latencyMs);
                store.incrementCounter(streamLatencyKey + ":first_chunk:count", 1);
            }

            for (long bucket : STREAM_LATENCY_BUCKETS) {
                if (latencyMs <= bucket) {
                    store.incrementCounter(streamLatencyKey + ":bucket:" + bucket, 1);
                }
            }
        } catch (Exception e) {
            log.warn("Failed to record stream chunk: {}", e.getMessage());
        }
    }

    /**
     * Record an error by type.
     */
    public void recordError(String type) {
        Counter.builder(METER_PREFIX + ".errors")
                .tag("type", type)
                .register(meterRegistry)
                .increment();

        try {
            store.incrementCounter(errorCountKey + ":" + type, 1);
            store.incrementCounter(errorCountKey + ":total", 1);
        } catch (Exception e) {
            log.warn("Failed to record error: {}", e.getMessage());
        }
    }

    /**
     * Aggregate the current metrics window.
     */
    public MetricsSummary getMetrics() {
        try {
            long now = clock.millis();
            long windowStart = now - config.getRetention().toMillis();

            List<TimeSeriesPoint> responseTimes = readTimeSeries(responseTimesKey + ":raw", windowStart, now);
            List<Double> values = new ArrayList<>(responseTimes.size());
            for (TimeSeriesPoint point : responseTimes) {
                values.add(point.getValue());
            }
            values.sort(Double::compareTo);

            MetricsSummary.ResponseTime responseTime = MetricsSummary.ResponseTime.builder()
                    .p50(calculatePercentile(values, 50))
                    .p90(calculatePercentile(values, 90))
                    .p99(calculatePercentile(values, 99))
                    .avg(average(values))
                    .build();

            long hits = readLong(cacheStatsKey + ":hits:total");
            long misses = readLong(cacheStatsKey + ":misses:total");
            long lookups = hits + misses;

            MetricsSummary.Cache cache = MetricsSummary.Cache.builder()
                    .hitRate(lookups > 0 ? (double) hits / lookups : 0)
                    .totalHits(hits)
                    .totalMisses(misses)
                    .build();

            List<TimeSeriesPoint> waits = readTimeSeries(queueWaitKey + ":raw", windowStart, now);
            double avgWait = waits.stream().mapToDouble(TimeSeriesPoint::getValue).average().orElse(0);

            MetricsSummary.Queue queue = MetricsSummary.Queue.builder()
                    .currentDepth(readLong(queueDepthKey + ":total"))
                    .avgWaitTime(avgWait)
                    .processingRate(calculateProcessingRate(responseTimes, now))
                    .build();

            MetricsSummary.Throughput throughput = MetricsSummary.Throughput.builder()
                    .requestsPerSecond(calculateThroughput(responseTimes))
                    .totalRequests(readLong(requestCountKey + ":total"))
                    .build();

            return MetricsSummary.builder()
                    .responseTime(responseTime)
                    .throughput(throughput)
                    .cache(cache)
                    .queue(queue)
                    .build();

        } catch (Exception e) {
            log.error("Failed to get metrics: {}", e.getMessage());
            return MetricsSummary.empty();
        }
    }

    /**
     * Response-time samples between start and end (inclusive).
     */
    public List<TimeSeriesData> getHistoricalMetrics(Instant start, Instant end) {
        try {
            List<TimeSeriesPoint> points = readTimeSeries(
                    responseTimesKey + ":raw", start.toEpochMilli(), end.toEpochMilli());
            return List.of(TimeSeriesData.builder()
                    .metric("response_time")
                    .data(points)
                    .build());
        } catch (Exception e) {
            log.error("Failed to get historical metrics: {}", e.getMessage());
            return List.of();
        }
    }

    /**
     * Evaluate alert thresholds against the current metrics.
     */
    public List<AlertStatus> getAlertStatus() {
        return evaluateAlerts(getMetrics());
    }

    /**
     * Evaluate alert thresholds against a summary. One entry per alert, firing or resolved.
     */
    public List<AlertStatus> evaluateAlerts(MetricsSummary metrics) {
        Instant now = clock.instant();
        List<AlertStatus> alerts = new ArrayList<>(3);

        double p99 = metrics.getResponseTime().getP99();
        double p99Threshold = config.getResponseTimeP99ThresholdMs();
        alerts.add(p99 > p99Threshold
                ? firing(ALERT_RESPONSE_TIME_P99, "critical", p99, p99Threshold, now,
                        String.format("P99 response time (%.0fms) exceeds threshold (%.0fms)", p99, p99Threshold))
                : resolved(ALERT_RESPONSE_TIME_P99, "critical", p99, p99Threshold,
                        "P99 response time is within threshold"));

        double hitRate = metrics.getCache().getHitRate();
        double hitRateThreshold = config.getCacheHitRateLowThreshold();
        alerts.add(hitRate < hitRateThreshold
                ? firing(ALERT_CACHE_HIT_RATE_LOW, "warning", hitRate, hitRateThreshold, now,
                        String.format("Cache hit rate (%.1f%%) is below threshold (%.1f%%)",
                                hitRate * 100, hitRateThreshold * 100))
                : resolved(ALERT_CACHE_HIT_RATE_LOW, "warning", hitRate, hitRateThreshold,
                        "Cache hit rate is within threshold"));

        double depth = metrics.getQueue().getCurrentDepth();
        double depthThreshold = config.getQueueDepthHighThreshold();
        alerts.add(depth > depthThreshold
                ? firing(ALERT_QUEUE_DEPTH_HIGH, "warning", depth, depthThreshold, now,
                        String.format("Queue depth (%.0f) exceeds threshold (%.0f)", depth, depthThreshold))
                : resolved(ALERT_QUEUE_DEPTH_HIGH, "warning", depth, depthThreshold,
                        "Queue depth is within threshold"));

        return alerts;
    }

    /**
     * Nearest-rank percentile: index = ceil(p/100 * n) - 1, clamped to [0, n-1]; 0 for no samples.
     */
    public double calculatePercentile(List<Double> sortedValues, double percentile) {
        if (sortedValues == null || sortedValues.isEmpty()) {
            return 0;
        }
        int n = sortedValues.size();
        int index = (int) Math.ceil(percentile * n / 100.0) - 1;
        index = Math.max(0, Math.min(n - 1, index));
        return sortedValues.get(index);
    }

    private AlertStatus firing(String name, String severity, double value, double threshold,
                               Instant now, String message) {
        return AlertStatus.builder()
                .name(name)
                .severity(severity)
                .status(AlertStatus.FIRING)
                .message(message)
                .value(value)
                .threshold(threshold)
                .triggeredAt(now)
                .build();
    }

    private AlertStatus resolved(String name, String severity, double value, double threshold, String message) {
        return AlertStatus.builder()
                .name(name)
                .severity(severity)
                .status(AlertStatus.RESOLVED)
                .message(message)
                .value(value)
                .threshold(threshold)
                .build();
    }

    /**
     * Append a sample and drop everything older than the retention window.
     */
    private void appendToTimeSeries(String key, double value) throws JsonProcessingException {
        Instant now = clock.instant();
        TimeSeriesPoint point = TimeSeriesPoint.builder()
                .timestamp(now)
                .value(value)
                .nonce(UUID.randomUUID().toString().substring(0, 8))
                .build();

        store.appendToOrderedSeries(key, now.toEpochMilli(), objectMapper.writeValueAsString(point));
        store.pruneOrderedSeriesBelow(key, now.toEpochMilli() - config.getRetention().toMillis());
    }

    private List<TimeSeriesPoint> readTimeSeries(String key, long from, long to) {
        List<String> members = store.queryOrderedSeriesByRange(key, from, to);
        List<TimeSeriesPoint> points = new ArrayList<>(members.size());
        for (String member : members) {
            try {
                points.add(objectMapper.readValue(member, TimeSeriesPoint.class));
            } catch (JsonProcessingException e) {
                log.debug("Skipping unreadable sample in {}: {}", key, e.getMessage());
            }
        }
        return points;
    }

    // Prometheus requires the same tag keys on every series of a meter
    private static String tagValue(String value) {
        return value != null ? value : "none";
    }

    private long readLong(String key) {
        return store.get(key).map(Long::parseLong).orElse(0L);
    }

    private double average(List<Double> values) {
        return values.stream().mapToDouble(Double::doubleValue).average().orElse(0);
    }

    /**
     * Samples per second between the first and last sample of the window.
     */
    private double calculateThroughput(List<TimeSeriesPoint> points) {
        if (points.size() < 2) {
            return 0;
        }
        long first = points.get(0).getTimestamp().toEpochMilli();
        long last = points.get(points.size() - 1).getTimestamp().toEpochMilli();
        double seconds = (last - first) / 1000.0;
        return seconds > 0 ? points.size() / seconds : 0;
    }

    /**
     * Completions per second over the last minute.
     */
    private double calculateProcessingRate(List<TimeSeriesPoint> points, long now) {
        long cutoff = now - PROCESSING_RATE_WINDOW_MS;
        long recent = points.stream()
                .filter(p -> p.getTimestamp().toEpochMilli() > cutoff)
                .count();
        return recent / (PROCESSING_RATE_WINDOW_MS / 1000.0);
    }
}
