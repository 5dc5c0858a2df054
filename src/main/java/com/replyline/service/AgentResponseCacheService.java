package com.replyline.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.replyline.config.ReplylineProperties;
import com.replyline.model.CacheCategory;
import com.replyline.model.CacheContext;
import com.replyline.model.CacheOrFetchResult;
import com.replyline.model.CachedResponse;
import com.replyline.model.FetchResponse;
import com.replyline.model.dto.CacheStatistics;
import com.replyline.repository.KeyValueStore;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.codec.digest.DigestUtils;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;
import java.util.regex.Pattern;

/**
 * Redis response cache for agent answers.
 *
 * Flow:
 * 1. Derive a key from the normalized query and its scope
 * 2. Return the cached answer on a hit
 * 3. On a miss, join an in-flight fetch for the same key or start one
 * 4. Store the fetched answer under the TTL of its category
 *
 * Cache failures never break requests: reads degrade to a miss, writes are dropped.
 */
@Slf4j
@Service
public class AgentResponseCacheService {

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final int KEY_HASH_LENGTH = 16;
    private static final int LOG_QUERY_LENGTH = 50;

    private final KeyValueStore store;
    private final ChatMetricsService metricsService;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final ReplylineProperties properties;

    private final String keyPrefix;
    private final String statsKey;

    /**
     * Fetches currently running, one per cache key.
     */
    private final Map<String, Mono<CacheOrFetchResult>> inFlightFetches = new ConcurrentHashMap<>();

    public AgentResponseCacheService(
            KeyValueStore store,
            ChatMetricsService metricsService,
            ObjectMapper objectMapper,
            Clock clock,
            ReplylineProperties properties) {
        this.store = store;
        this.metricsService = metricsService;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.properties = properties;
        this.keyPrefix = properties.getCache().getKeyPrefix();
        this.statsKey = keyPrefix + "stats";
    }

    /**
     * Build the cache key for a query.
     *
     * @param query   user query, normalized before hashing
     * @param context scope of the answer
     * @return {@code agent_response:{agentId}:{hash}}
     */
    public String generateKey(String query, CacheContext context) {
        if (context == null || context.getAgentId() == null || context.getAgentId().isBlank()) {
            throw new IllegalArgumentException("agentId is required to build a cache key");
        }

        StringBuilder content = new StringBuilder(normalize(query))
                .append(':').append(context.getAgentId());

        if (context.getProjectId() != null && !context.getProjectId().isEmpty()) {
            content.append(":p=").append(context.getProjectId());
        }
        if (context.getWorkspaceId() != null && !context.getWorkspaceId().isEmpty()) {
            content.append(":w=").append(context.getWorkspaceId());
        }

        String hash = DigestUtils.sha256Hex(content.toString()).substring(0, KEY_HASH_LENGTH);
        return keyPrefix + context.getAgentId() + ":" + hash;
    }

    /**
     * Classify a query. STATUS patterns are checked first, then HELP, then PROJECT.
     */
    public CacheCategory detectCategory(String query) {
        String lowerQuery = query == null ? "" : query.toLowerCase();

        for (CacheCategory category : CacheCategory.values()) {
            if (category.matches(lowerQuery)) {
                return category;
            }
        }
        return CacheCategory.PROJECT;
    }

    public Duration getTtl(CacheCategory category) {
        return category.getTtl();
    }

    /**
     * Read a cached answer. A miss (or an unreachable store) returns empty.
     */
    public Optional<CachedResponse> get(String key) {
        if (!properties.getCache().isEnabled()) {
            return Optional.empty();
        }

        try {
            Optional<String> json = store.get(key);

            if (json.isEmpty()) {
                recordMiss();
                return Optional.empty();
            }

            CachedResponse cached = objectMapper.readValue(json.get(), CachedResponse.class);
            store.get(key + ":hits").map(Long::parseLong).ifPresent(cached::setHitCount);

            incrementHitCount(key);

            log.debug("Cache hit: key={}, hit_count={}", key, cached.getHitCount());
            return Optional.of(cached);

        } catch (Exception e) {
            log.warn("Cache get error: key={}, {}", key, e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Store an answer. Best effort.
     */
    public void set(String key, CachedResponse response, Duration ttl) {
        if (!properties.getCache().isEnabled()) {
            return;
        }

        try {
            store.set(key, objectMapper.writeValueAsString(response), ttl);
            log.debug("Cached response: key={}, ttl={}", key, ttl);
        } catch (Exception e) {
            log.warn("Cache set error: key={}, {}", key, e.getMessage());
        }
    }

    /**
     * Delete every key matching a glob pattern.
     *
     * @return number of deleted keys, 0 on failure
     */
    public long invalidate(String pattern) {
        try {
            Set<String> keys = store.keysMatching(pattern);
            if (keys.isEmpty()) {
                return 0;
            }

            store.delete(keys);
            log.info("Invalidated {} cache entries matching: {}", keys.size(), pattern);
            return keys.size();

        } catch (Exception e) {
            log.warn("Cache invalidation error: pattern={}, {}", pattern, e.getMessage());
            return 0;
        }
    }

    public long invalidateAgentCache(String agentId) {
        return invalidate(keyPrefix + agentId + ":*");
    }

    /**
     * Drop entries whose original query mentions the project.
     * The project id is hashed into the key, so every entry has to be read.
     */
    public long invalidateProjectCache(String projectId) {
        try {
            long invalidated = 0;

            for (String key : store.keysMatching(keyPrefix + "*")) {
                Optional<CachedResponse> entry = readEntry(key);
                if (entry.isEmpty() || entry.get().getMetadata() == null) {
                    continue;
                }

                String originalQuery = entry.get().getMetadata().getOriginalQuery();
                if (originalQuery != null && originalQuery.contains(projectId)) {
                    store.delete(List.of(key, key + ":hits"));
                    invalidated++;
                }
            }

            log.info("Invalidated {} cache entries for project: {}", invalidated, projectId);
            return invalidated;

        } catch (Exception e) {
            log.warn("Failed to invalidate project cache: projectId={}, {}", projectId, e.getMessage());
            return 0;
        }
    }

    /**
     * Remove every entry and counter under the cache prefix.
     */
    public long clearAll() {
        return invalidate(keyPrefix + "*");
    }

    public CacheStatistics getStats() {
        try {
            long hits = readCounter(statsKey + ":hits");
            long misses = readCounter(statsKey + ":misses");
            long lookups = hits + misses;

            Map<CacheCategory, Long> byCategory = new EnumMap<>(CacheCategory.class);
            for (CacheCategory category : CacheCategory.values()) {
                byCategory.put(category, readCounter(statsKey + ":entries:" + category.getValue()));
            }

            long responseTimeSum = readCounter(statsKey + ":response_time:sum");
            long responseTimeCount = readCounter(statsKey + ":response_time:count");

            return CacheStatistics.builder()
                    .totalHits(hits)
                    .totalMisses(misses)
                    .hitRate(lookups > 0 ? (double) hits / lookups : 0)
                    .entriesByCategory(byCategory)
                    .avgResponseTime(responseTimeCount > 0 ? (double) responseTimeSum / responseTimeCount : 0)
                    .build();

        } catch (Exception e) {
            log.warn("Failed to get cache stats: {}", e.getMessage());
            return CacheStatistics.empty();
        }
    }

    /**
     * Cache-through lookup. Concurrent misses on the same key share a single upstream fetch.
     *
     * @param query   user query
     * @param context scope of the answer
     * @param fetchFn upstream fetch, subscribed at most once per key while it runs
     * @return cached or freshly fetched answer
     */
    public Mono<CacheOrFetchResult> cacheOrFetch(
            String query,
            CacheContext context,
            Supplier<Mono<FetchResponse>> fetchFn) {

        return Mono.defer(() -> {
            String key = generateKey(query, context);
            CacheCategory category = detectCategory(query);

            Optional<CachedResponse> cached = get(key);
            if (cached.isPresent()) {
                metricsService.recordCacheHit(true, category.getValue());
                log.debug("Cache hit for query: {}...", abbreviate(query));

                CachedResponse.CacheMetadata metadata = cached.get().getMetadata();
                return Mono.just(CacheOrFetchResult.builder()
                        .response(cached.get().getResponse())
                        .fromCache(true)
                        .category(category)
                        .responseTimeMs(metadata != null ? metadata.getResponseTimeMs() : 0)
                        .build());
            }

            metricsService.recordCacheHit(false, category.getValue());

            Mono<CacheOrFetchResult> running = inFlightFetches.get(key);
            if (running != null) {
                log.debug("Waiting for in-flight fetch: {}...", abbreviate(query));
                return running;
            }

            log.debug("Cache miss for query: {}...", abbreviate(query));
            return inFlightFetches.computeIfAbsent(key, k -> performFetch(k, category, query, context, fetchFn)
                    .doOnSuccess(result -> inFlightFetches.remove(k))
                    .doOnError(error -> inFlightFetches.remove(k))
                    .doOnCancel(() -> inFlightFetches.remove(k))
                    .cache());
        });
    }

    /**
     * Number of fetches currently running.
     */
    public int inFlightCount() {
        return inFlightFetches.size();
    }

    private Mono<CacheOrFetchResult> performFetch(
            String key,
            CacheCategory category,
            String query,
            CacheContext context,
            Supplier<Mono<FetchResponse>> fetchFn) {

        return Mono.defer(() -> {
            long startTime = clock.millis();

            return fetchFn.get().map(fetched -> {
                long responseTime = fetched.getResponseTimeMs() > 0
                        ? fetched.getResponseTimeMs()
                        : clock.millis() - startTime;

                Duration ttl = getTtl(category);
                Instant now = clock.instant();

                CachedResponse entry = CachedResponse.builder()
                        .response(fetched.getResponse())
                        .agentId(context.getAgentId())
                        .cachedAt(now)
                        .expiresAt(now.plus(ttl))
                        .hitCount(0)
                        .metadata(CachedResponse.CacheMetadata.builder()
                                .originalQuery(query)
                                .responseTimeMs(responseTime)
                                .modelUsed(fetched.getModelUsed())
                                .category(category)
                                .build())
                        .build();

                set(key, entry, ttl);
                recordEntryStats(category, responseTime);

                return CacheOrFetchResult.builder()
                        .response(fetched.getResponse())
                        .fromCache(false)
                        .category(category)
                        .responseTimeMs(responseTime)
                        .build();
            });
        });
    }

    private Optional<CachedResponse> readEntry(String key) {
        try {
            Optional<String> json = store.get(key);
            if (json.isEmpty()) {
                return Optional.empty();
            }
            return Optional.of(objectMapper.readValue(json.get(), CachedResponse.class));
        } catch (Exception e) {
            // counters and stats share the prefix
            return Optional.empty();
        }
    }

    /**
     * Increment the entry and global hit counters without blocking the read.
     */
    private void incrementHitCount(String key) {
        CompletableFuture.runAsync(() -> {
            try {
                store.incrementCounter(key + ":hits", 1);
                store.incrementCounter(statsKey + ":hits", 1);
            } catch (Exception e) {
                log.warn("Failed to increment hit count for {}: {}", key, e.getMessage());
            }
        });
    }

    private void recordMiss() {
        try {
            store.incrementCounter(statsKey + ":misses", 1);
        } catch (Exception e) {
            log.warn("Failed to record cache miss: {}", e.getMessage());
        }
    }

    private void recordEntryStats(CacheCategory category, long responseTimeMs) {
        try {
            store.incrementCounter(statsKey + ":entries:" + category.getValue(), 1);
            store.incrementCounter(statsKey + ":response_time:sum", responseTimeMs);
            store.incrementCounter(statsKey + ":response_time:count", 1);
        } catch (Exception e) {
            log.warn("Failed to record cache entry stats: {}", e.getMessage());
        }
    }

    private long readCounter(String key) {
        return store.get(key).map(Long::parseLong).orElse(0L);
    }

    private static String normalize(String query) {
        return WHITESPACE.matcher(query == null ? "" : query.toLowerCase().trim()).replaceAll(" ");
    }

    private static String abbreviate(String query) {
        return query.length() > LOG_QUERY_LENGTH ? query.substring(0, LOG_QUERY_LENGTH) : query;
    }
}
