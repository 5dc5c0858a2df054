package com.replyline.service;

import com.replyline.config.ReplylineProperties;
import com.replyline.model.CacheOrFetchResult;
import com.replyline.model.QueuedJob;
import com.replyline.queue.JobQueueEngine;
import com.replyline.transport.EventPublisher;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Background worker draining the dispatch queue.
 * Each poll claims jobs in priority order and answers them through the pipeline.
 */
@Slf4j
@Component
@ConditionalOnProperty(prefix = "replyline.queue.worker", name = "enabled", havingValue = "true", matchIfMissing = true)
public class DispatchJobProcessor {

    static final String EVENT_JOB_COMPLETED = "job_completed";
    static final String EVENT_JOB_FAILED = "job_failed";

    private final JobQueueEngine queueEngine;
    private final AgentResponsePipeline pipeline;
    private final ChatMetricsService metricsService;
    private final EventPublisher eventPublisher;
    private final ReplylineProperties properties;

    public DispatchJobProcessor(
            JobQueueEngine queueEngine,
            AgentResponsePipeline pipeline,
            ChatMetricsService metricsService,
            EventPublisher eventPublisher,
            ReplylineProperties properties) {
        this.queueEngine = queueEngine;
        this.pipeline = pipeline;
        this.metricsService = metricsService;
        this.eventPublisher = eventPublisher;
        this.properties = properties;
    }

    @Scheduled(fixedDelayString = "${replyline.queue.worker.poll-interval-ms:500}")
    public void poll() {
        int maxJobs = properties.getQueue().getWorker().getMaxJobsPerPoll();

        for (int processed = 0; processed < maxJobs; processed++) {
            Optional<QueuedJob> next;
            try {
                next = queueEngine.claimNext();
            } catch (Exception e) {
                log.warn("Failed to claim next job: {}", e.getMessage());
                return;
            }

            // a failed job goes back to pending; retry it on the next tick
            if (next.isEmpty() || !process(next.get())) {
                return;
            }
        }
    }

    /**
     * Answer one claimed job, then complete or fail it.
     *
     * @return false if the job failed
     */
    boolean process(QueuedJob job) {
        Duration waitTime = job.waitTime();
        if (waitTime != null) {
            metricsService.recordQueueWaitTime(waitTime.toMillis());
        }

        String agentId = job.getPayload() != null ? job.getPayload().getAgentId() : null;
        log.debug("Processing job {} ({}) for agent {}, attempt {}", job.getId(), job.getName(), agentId, job.getAttempts());

        try {
            CacheOrFetchResult result = pipeline.processQueued(job)
                    .block(properties.getProxy().getTimeout());

            queueEngine.complete(job.getId());

            Map<String, Object> notice = new LinkedHashMap<>();
            notice.put("type", EVENT_JOB_COMPLETED);
            notice.put("jobId", job.getId());
            notice.put("response", result != null ? result.getResponse() : null);
            notice.put("fromCache", result != null && result.isFromCache());
            publish(agentId, notice);

            log.info("Completed job {} for agent {}", job.getId(), agentId);
            return true;

        } catch (Exception e) {
            log.error("Job {} failed: {}", job.getId(), e.getMessage());
            metricsService.recordError("job_failed");

            QueuedJob failed = queueEngine.fail(job.getId(), e.getMessage());

            Map<String, Object> notice = new LinkedHashMap<>();
            notice.put("type", EVENT_JOB_FAILED);
            notice.put("jobId", job.getId());
            notice.put("state", failed.getState());
            notice.put("error", e.getMessage());
            publish(agentId, notice);
            return false;
        }
    }

    private void publish(String agentId, Map<String, Object> notice) {
        if (agentId != null) {
            eventPublisher.publish(properties.getStream().getBroadcastChannelPrefix() + agentId, notice);
        }
    }
}
