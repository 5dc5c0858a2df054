package com.replyline.service;

import com.replyline.config.ReplylineProperties;
import com.replyline.model.DispatchRequest;
import com.replyline.model.JobOptions;
import com.replyline.model.JobState;
import com.replyline.model.PriorityLevel;
import com.replyline.model.QueuedJob;
import com.replyline.model.RequestType;
import com.replyline.model.dto.LaneStatistics;
import com.replyline.model.dto.QueueStatistics;
import com.replyline.queue.JobQueueEngine;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Priority scheduling of agent requests.
 *
 * Priority is derived from the request type, then lowered (made more urgent) by age
 * and for VIP requesters. Jobs are handed to the {@link JobQueueEngine}; one lane per
 * priority tier is reported for fairness monitoring.
 */
@Slf4j
@Service
public class PriorityDispatchService {

    /**
     * Maximum priority boost from waiting, one point per second.
     */
    static final int MAX_AGE_BOOST = 30;

    static final int VIP_BOOST = 20;

    private static final ReplylineProperties.LaneConfig DEFAULT_LANE = new ReplylineProperties.LaneConfig(1, 1);

    private final JobQueueEngine queueEngine;
    private final ChatMetricsService metricsService;
    private final Clock clock;
    private final ReplylineProperties.QueueConfig config;

    private final Set<String> vipUsers = ConcurrentHashMap.newKeySet();

    public PriorityDispatchService(
            JobQueueEngine queueEngine,
            ChatMetricsService metricsService,
            Clock clock,
            ReplylineProperties properties) {
        this.queueEngine = queueEngine;
        this.metricsService = metricsService;
        this.clock = clock;
        this.config = properties.getQueue();
    }

    /**
     * Base priority of a request from its type. Unknown types are NORMAL.
     */
    public int calculatePriority(DispatchRequest request) {
        RequestType type = request.getType();
        if (type == null) {
            return PriorityLevel.NORMAL.getValue();
        }
        return type.getBasePriority().getValue();
    }

    /**
     * Lower the base priority by one point per second of age (up to 30) and by 20 for VIP requesters.
     * The result is clamped to [1, 100] and never above the base.
     */
    public int applyDynamicPriority(DispatchRequest request, int basePriority) {
        int priority = basePriority;

        if (request.getCreatedAt() != null) {
            long ageSeconds = Duration.between(request.getCreatedAt(), clock.instant()).getSeconds();
            priority -= (int) Math.max(0, Math.min(ageSeconds, MAX_AGE_BOOST));
        }

        if (request.getRequesterId() != null && isVipUser(request.getRequesterId())) {
            priority -= VIP_BOOST;
        }

        return PriorityLevel.clamp(Math.min(priority, basePriority));
    }

    public void addVipUser(String userId) {
        vipUsers.add(userId);
        log.info("Added VIP user: {}", userId);
    }

    public void removeVipUser(String userId) {
        vipUsers.remove(userId);
        log.info("Removed VIP user: {}", userId);
    }

    public boolean isVipUser(String userId) {
        return vipUsers.contains(userId);
    }

    /**
     * Queue a request.
     *
     * @param request          the request; its computed priority is set
     * @param overridePriority explicit priority, wins over the computed one when non-null
     * @return job id
     */
    public String enqueue(DispatchRequest request, Integer overridePriority) {
        int basePriority = calculatePriority(request);
        int priority = overridePriority != null
                ? PriorityLevel.clamp(overridePriority)
                : applyDynamicPriority(request, basePriority);
        boolean lifo = basePriority == PriorityLevel.CRITICAL.getValue();

        if (request.getId() == null) {
            request.setId(UUID.randomUUID().toString());
        }
        request.setComputedPriority(priority);

        QueuedJob job = queueEngine.submit(jobName(request), request, JobOptions.builder()
                .priority(priority)
                .lifo(lifo)
                .jobId(request.getId())
                .build());

        log.info("Enqueued request {} ({}) with priority {}", request.getId(), jobName(request), priority);

        recordQueueDepth();
        return job.getId();
    }

    /**
     * Move a waiting job to a new priority.
     *
     * @return false if the job is no longer waiting
     */
    public boolean requeue(String jobId, int newPriority) {
        Optional<QueuedJob> job = queueEngine.getJob(jobId);
        if (job.isEmpty() || job.get().getState() != JobState.WAITING) {
            log.warn("Cannot requeue job {}: not waiting", jobId);
            return false;
        }

        if (!queueEngine.remove(jobId)) {
            log.warn("Cannot requeue job {}: claimed before it could be removed", jobId);
            return false;
        }

        int priority = PriorityLevel.clamp(newPriority);
        DispatchRequest payload = job.get().getPayload();
        if (payload != null) {
            payload.setComputedPriority(priority);
        }

        queueEngine.submit(job.get().getName(), payload, JobOptions.builder()
                .priority(priority)
                .lifo(job.get().isLifo())
                .jobId(jobId)
                .build());

        log.info("Requeued job {} from priority {} to {}", jobId, job.get().getPriority(), priority);
        return true;
    }

    public QueueStatistics getQueueStats() {
        List<QueuedJob> pending = queueEngine.listPending();
        List<QueuedJob> completed = queueEngine.listCompleted(config.getCompletedSampleSize());

        double averageWait = completed.stream()
                .map(QueuedJob::waitTime)
                .filter(wait -> wait != null)
                .mapToLong(Duration::toMillis)
                .average()
                .orElse(0);

        double processingRate = processingRate();
        double estimatedWait = processingRate > 0 ? pending.size() / processingRate * 1000 : 0;

        return QueueStatistics.builder()
                .totalPending(pending.size())
                .byPriorityTier(countByTier(pending))
                .averageWaitTimeMs(averageWait)
                .processingRate(processingRate)
                .estimatedWaitMs(estimatedWait)
                .build();
    }

    /**
     * Per-tier lane configuration and current pending count. Informational.
     */
    public List<LaneStatistics> getLaneStats() {
        Map<PriorityLevel, Long> pending = countByTier(queueEngine.listPending());
        List<LaneStatistics> lanes = new ArrayList<>(PriorityLevel.values().length);

        for (PriorityLevel tier : PriorityLevel.values()) {
            ReplylineProperties.LaneConfig lane = config.getLanes().getOrDefault(tier, DEFAULT_LANE);
            lanes.add(LaneStatistics.builder()
                    .tier(tier)
                    .priority(tier.getValue())
                    .weight(lane.getWeight())
                    .maxConcurrency(lane.getMaxConcurrency())
                    .pending(pending.get(tier))
                    .build());
        }
        return lanes;
    }

    /**
     * Completions per second over the configured window.
     */
    private double processingRate() {
        Duration window = config.getProcessingRateWindow();
        long recent = queueEngine.countCompletedSince(clock.instant().minus(window));

        return recent / (double) window.getSeconds();
    }

    private Map<PriorityLevel, Long> countByTier(List<QueuedJob> jobs) {
        Map<PriorityLevel, Long> byTier = new EnumMap<>(PriorityLevel.class);
        for (PriorityLevel tier : PriorityLevel.values()) {
            byTier.put(tier, 0L);
        }
        for (QueuedJob job : jobs) {
            byTier.merge(PriorityLevel.forValue(job.getPriority()), 1L, Long::sum);
        }
        return byTier;
    }

    private void recordQueueDepth() {
        try {
            Map<PriorityLevel, Long> byTier = countByTier(queueEngine.listPending());
            long total = 0;
            for (Map.Entry<PriorityLevel, Long> tier : byTier.entrySet()) {
                metricsService.recordQueueDepth(tier.getValue(), tier.getKey().name().toLowerCase());
                total += tier.getValue();
            }
            metricsService.recordQueueDepth(total, "total");
        } catch (Exception e) {
            log.warn("Failed to record queue depth: {}", e.getMessage());
        }
    }

    private static String jobName(DispatchRequest request) {
        return request.getType() != null ? request.getType().getValue() : "unknown";
    }
}
