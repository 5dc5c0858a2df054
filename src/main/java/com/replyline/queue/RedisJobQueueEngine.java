package com.replyline.queue;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.replyline.config.ReplylineProperties;
import com.replyline.model.DispatchRequest;
import com.replyline.model.JobOptions;
import com.replyline.model.JobState;
import com.replyline.model.QueuedJob;
import com.replyline.repository.KeyValueStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.UncheckedIOException;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Redis job queue.
 *
 * Layout under the queue prefix:
 * - job:{id}   job JSON
 * - pending    sorted set of waiting job ids, scored by priority then submission time
 * - active     sorted set of claimed job ids, scored by claim time
 * - completed  sorted set of finished job ids, scored by finish time, bounded
 * - failed     sorted set of jobs that used up their attempts, bounded
 */
@Slf4j
@Component
public class RedisJobQueueEngine implements JobQueueEngine {

    /**
     * Priority band width; epoch millis stay below it for centuries.
     */
    private static final long PRIORITY_BAND = 10_000_000_000_000L;

    private final KeyValueStore store;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final ReplylineProperties.QueueConfig config;

    private final String pendingKey;
    private final String activeKey;
    private final String completedKey;
    private final String completionLogKey;
    private final String failedKey;

    public RedisJobQueueEngine(
            KeyValueStore store,
            ObjectMapper objectMapper,
            Clock clock,
            ReplylineProperties properties) {
        this.store = store;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.config = properties.getQueue();

        String prefix = config.getKeyPrefix();
        this.pendingKey = prefix + "pending";
        this.activeKey = prefix + "active";
        this.completedKey = prefix + "completed";
        this.completionLogKey = prefix + "completion-log";
        this.failedKey = prefix + "failed";
    }

    @Override
    public QueuedJob submit(String name, DispatchRequest payload, JobOptions options) {
        String jobId = options.getJobId() != null ? options.getJobId() : UUID.randomUUID().toString();

        QueuedJob job = QueuedJob.builder()
                .id(jobId)
                .name(name)
                .payload(payload)
                .priority(options.getPriority())
                .lifo(options.isLifo())
                .state(JobState.WAITING)
                .attempts(0)
                .submittedAt(clock.instant())
                .build();

        save(job);
        store.appendToOrderedSeries(pendingKey, pendingScore(job.getPriority(), job.isLifo(), clock.millis()), jobId);

        log.debug("Submitted job {} ({}) at priority {}{}", jobId, name, job.getPriority(), job.isLifo() ? " LIFO" : "");
        return job;
    }

    @Override
    public List<QueuedJob> listPending() {
        return loadAll(store.rangeOrderedSeries(pendingKey, 0, -1));
    }

    @Override
    public List<QueuedJob> listCompleted(int limit) {
        if (limit <= 0) {
            return List.of();
        }
        return loadAll(store.reverseRangeOrderedSeries(completedKey, 0, limit - 1L));
    }

    @Override
    public long countCompletedSince(Instant since) {
        return store.countOrderedSeriesByRange(completionLogKey, since.toEpochMilli(), Double.POSITIVE_INFINITY);
    }

    @Override
    public Optional<QueuedJob> getJob(String jobId) {
        return store.get(jobKey(jobId)).map(this::read);
    }

    @Override
    public boolean remove(String jobId) {
        if (!store.removeFromOrderedSeries(pendingKey, jobId)) {
            return false;
        }
        store.delete(List.of(jobKey(jobId)));
        log.debug("Removed waiting job {}", jobId);
        return true;
    }

    @Override
    public Optional<QueuedJob> claimNext() {
        while (true) {
            Optional<String> next = store.popLowestFromOrderedSeries(pendingKey);
            if (next.isEmpty()) {
                return Optional.empty();
            }

            Optional<QueuedJob> found = getJob(next.get());
            if (found.isEmpty()) {
                log.warn("Dropping pending id {} with no job record", next.get());
                continue;
            }

            Instant now = clock.instant();
            QueuedJob job = found.get().toBuilder()
                    .state(JobState.ACTIVE)
                    .attempts(found.get().getAttempts() + 1)
                    .processedAt(now)
                    .build();

            save(job);
            store.appendToOrderedSeries(activeKey, now.toEpochMilli(), job.getId());
            return Optional.of(job);
        }
    }

    @Override
    public void complete(String jobId) {
        Optional<QueuedJob> found = getJob(jobId);
        if (found.isEmpty()) {
            log.warn("Cannot complete unknown job {}", jobId);
            return;
        }

        Instant now = clock.instant();
        QueuedJob job = found.get().toBuilder()
                .state(JobState.COMPLETED)
                .finishedAt(now)
                .failedReason(null)
                .build();

        store.removeFromOrderedSeries(activeKey, jobId);
        save(job);
        store.appendToOrderedSeries(completedKey, now.toEpochMilli(), jobId);
        evict(completedKey);

        // independent of completed retention; only the rate window is kept
        store.appendToOrderedSeries(completionLogKey, now.toEpochMilli(), jobId);
        store.pruneOrderedSeriesBelow(completionLogKey,
                now.minus(config.getProcessingRateWindow()).toEpochMilli());
    }

    @Override
    public QueuedJob fail(String jobId, String reason) {
        QueuedJob current = getJob(jobId)
                .orElseThrow(() -> new IllegalArgumentException("Unknown job: " + jobId));

        store.removeFromOrderedSeries(activeKey, jobId);

        if (current.getAttempts() < config.getMaxAttempts()) {
            QueuedJob retry = current.toBuilder()
                    .state(JobState.WAITING)
                    .failedReason(reason)
                    .build();
            save(retry);
            store.appendToOrderedSeries(pendingKey, pendingScore(retry.getPriority(), retry.isLifo(), clock.millis()), jobId);

            log.warn("Job {} failed (attempt {}/{}), retrying: {}",
                    jobId, current.getAttempts(), config.getMaxAttempts(), reason);
            return retry;
        }

        Instant now = clock.instant();
        QueuedJob failed = current.toBuilder()
                .state(JobState.FAILED)
                .finishedAt(now)
                .failedReason(reason)
                .build();
        save(failed);
        store.appendToOrderedSeries(failedKey, now.toEpochMilli(), jobId);
        evict(failedKey);

        log.error("Job {} failed after {} attempts: {}", jobId, current.getAttempts(), reason);
        return failed;
    }

    /**
     * Lower score is served first: priority band, then age (FIFO) or inverted age (LIFO).
     */
    static double pendingScore(int priority, boolean lifo, long submittedAtMillis) {
        long order = lifo ? PRIORITY_BAND - 1 - submittedAtMillis : submittedAtMillis;
        return (double) (priority * PRIORITY_BAND + order);
    }

    private void evict(String finishedKey) {
        List<String> evicted = store.trimOrderedSeriesToHighest(finishedKey, config.getCompletedRetention());
        if (!evicted.isEmpty()) {
            List<String> keys = new ArrayList<>(evicted.size());
            for (String id : evicted) {
                keys.add(jobKey(id));
            }
            store.delete(keys);
        }
    }

    private List<QueuedJob> loadAll(List<String> jobIds) {
        List<QueuedJob> jobs = new ArrayList<>(jobIds.size());
        for (String jobId : jobIds) {
            getJob(jobId).ifPresent(jobs::add);
        }
        return jobs;
    }

    private void save(QueuedJob job) {
        try {
            store.set(jobKey(job.getId()), objectMapper.writeValueAsString(job), null);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Failed to serialize job " + job.getId(), e);
        }
    }

    private QueuedJob read(String json) {
        try {
            return objectMapper.readValue(json, QueuedJob.class);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Failed to deserialize job", e);
        }
    }

    private String jobKey(String jobId) {
        return config.getKeyPrefix() + "job:" + jobId;
    }
}
