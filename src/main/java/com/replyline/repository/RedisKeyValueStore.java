package com.replyline.repository;

import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.Cursor;
import org.springframework.data.redis.core.ScanOptions;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ZSetOperations;
import org.springframework.stereotype.Repository;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Redis-backed {@link KeyValueStore}.
 * Values are plain strings (JSON or numbers); ordered series are sorted sets scored by timestamp.
 */
@Slf4j
@Repository
public class RedisKeyValueStore implements KeyValueStore {

    private static final long SCAN_BATCH = 500;

    private final StringRedisTemplate redisTemplate;

    public RedisKeyValueStore(StringRedisTemplate redisTemplate) {
        this.redisTemplate = redisTemplate;
    }

    @Override
    public Optional<String> get(String key) {
        return Optional.ofNullable(redisTemplate.opsForValue().get(key));
    }

    @Override
    public void set(String key, String value, Duration ttl) {
        if (ttl == null || ttl.isZero() || ttl.isNegative()) {
            redisTemplate.opsForValue().set(key, value);
        } else {
            redisTemplate.opsForValue().set(key, value, ttl);
        }
        log.trace("SET {} ttl={}", key, ttl);
    }

    @Override
    public long delete(Collection<String> keys) {
        if (keys == null || keys.isEmpty()) {
            return 0;
        }
        Long removed = redisTemplate.delete(keys);
        return removed != null ? removed : 0;
    }

    /**
     * Uses SCAN rather than KEYS so large keyspaces don't block the server.
     */
    @Override
    public Set<String> keysMatching(String pattern) {
        Set<String> keys = new HashSet<>();
        ScanOptions options = ScanOptions.scanOptions().match(pattern).count(SCAN_BATCH).build();
        try (Cursor<String> cursor = redisTemplate.scan(options)) {
            cursor.forEachRemaining(keys::add);
        }
        return keys;
    }

    @Override
    public long incrementCounter(String key, long delta) {
        Long value = redisTemplate.opsForValue().increment(key, delta);
        return value != null ? value : 0;
    }

    @Override
    public void appendToOrderedSeries(String key, double score, String member) {
        redisTemplate.opsForZSet().add(key, member, score);
    }

    @Override
    public List<String> queryOrderedSeriesByRange(String key, double min, double max) {
        Set<String> members = redisTemplate.opsForZSet().rangeByScore(key, min, max);
        return members != null ? new ArrayList<>(members) : List.of();
    }

    @Override
    public long pruneOrderedSeriesBelow(String key, double maxScore) {
        Long removed = redisTemplate.opsForZSet()
                .removeRangeByScore(key, Double.NEGATIVE_INFINITY, Math.nextDown(maxScore));
        return removed != null ? removed : 0;
    }

    @Override
    public Optional<String> popLowestFromOrderedSeries(String key) {
        ZSetOperations.TypedTuple<String> popped = redisTemplate.opsForZSet().popMin(key);
        return popped != null ? Optional.ofNullable(popped.getValue()) : Optional.empty();
    }

    @Override
    public boolean removeFromOrderedSeries(String key, String member) {
        Long removed = redisTemplate.opsForZSet().remove(key, member);
        return removed != null && removed > 0;
    }

    @Override
    public List<String> rangeOrderedSeries(String key, long start, long stop) {
        Set<String> members = redisTemplate.opsForZSet().range(key, start, stop);
        return members != null ? new ArrayList<>(members) : List.of();
    }

    @Override
    public List<String> reverseRangeOrderedSeries(String key, long start, long stop) {
        Set<String> members = redisTemplate.opsForZSet().reverseRange(key, start, stop);
        return members != null ? new ArrayList<>(members) : List.of();
    }

    @Override
    public long countOrderedSeriesByRange(String key, double min, double max) {
        Long count = redisTemplate.opsForZSet().count(key, min, max);
        return count != null ? count : 0;
    }

    @Override
    public long orderedSeriesSize(String key) {
        Long size = redisTemplate.opsForZSet().zCard(key);
        return size != null ? size : 0;
    }

    @Override
    public List<String> trimOrderedSeriesToHighest(String key, long keep) {
        long size = orderedSeriesSize(key);
        if (size <= keep) {
            return List.of();
        }
        List<String> evicted = rangeOrderedSeries(key, 0, size - keep - 1);
        if (!evicted.isEmpty()) {
            redisTemplate.opsForZSet().remove(key, evicted.toArray());
        }
        return evicted;
    }
}
