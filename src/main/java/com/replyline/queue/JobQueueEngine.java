package com.replyline.queue;

import com.replyline.model.DispatchRequest;
import com.replyline.model.JobOptions;
import com.replyline.model.QueuedJob;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Priority job queue backing the dispatch service.
 * Waiting jobs are served by ascending priority value, then by submission order
 * (newest first for LIFO jobs).
 */
public interface JobQueueEngine {

    QueuedJob submit(String name, DispatchRequest payload, JobOptions options);

    /**
     * Waiting jobs in the order they will be served.
     */
    List<QueuedJob> listPending();

    /**
     * Most recently completed jobs first.
     */
    List<QueuedJob> listCompleted(int limit);

    /**
     * Completions at or after {@code since}, counted over the processing-rate window.
     */
    long countCompletedSince(Instant since);

    Optional<QueuedJob> getJob(String jobId);

    /**
     * Remove a waiting job.
     *
     * @return false if the job is not waiting (already claimed, finished or unknown)
     */
    boolean remove(String jobId);

    /**
     * Take the most urgent waiting job and mark it active.
     */
    Optional<QueuedJob> claimNext();

    void complete(String jobId);

    /**
     * Record a failed attempt. The job goes back to waiting until its attempts are used up.
     *
     * @return the job's state after the failure
     */
    QueuedJob fail(String jobId, String reason);
}
