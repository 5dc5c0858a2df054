package com.replyline.repository;

import java.time.Duration;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Key-value store with TTLs, counters, pattern scans and score-ordered series.
 * Implementations throw unchecked exceptions on infrastructure failure; callers decide whether to degrade.
 */
public interface KeyValueStore {

    Optional<String> get(String key);

    /**
     * Store a value; a null or non-positive ttl stores without expiry.
     */
    void set(String key, String value, Duration ttl);

    /**
     * @return number of keys removed
     */
    long delete(Collection<String> keys);

    /**
     * Keys matching a glob pattern ({@code *}, {@code ?}).
     */
    Set<String> keysMatching(String pattern);

    /**
     * @return the value after the increment
     */
    long incrementCounter(String key, long delta);

    void appendToOrderedSeries(String key, double score, String member);

    /**
     * Members with min <= score <= max, in ascending score order.
     */
    List<String> queryOrderedSeriesByRange(String key, double min, double max);

    /**
     * Remove members with score strictly below maxScore.
     *
     * @return number of members removed
     */
    long pruneOrderedSeriesBelow(String key, double maxScore);

    /**
     * Remove and return the member with the lowest score.
     */
    Optional<String> popLowestFromOrderedSeries(String key);

    /**
     * @return true if the member was present
     */
    boolean removeFromOrderedSeries(String key, String member);

    /**
     * Members by rank, ascending score. Negative indexes count from the end.
     */
    List<String> rangeOrderedSeries(String key, long start, long stop);

    /**
     * Members by rank, descending score.
     */
    List<String> reverseRangeOrderedSeries(String key, long start, long stop);

    long orderedSeriesSize(String key);

    /**
     * Number of members scored within {@code [min, max]}.
     */
    long countOrderedSeriesByRange(String key, double min, double max);

    /**
     * Keep only the {@code keep} highest-scored members.
     *
     * @return the members removed
     */
    List<String> trimOrderedSeriesToHighest(String key, long keep);
}
