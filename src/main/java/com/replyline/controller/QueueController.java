package com.replyline.controller;

import com.replyline.model.dto.LaneStatistics;
import com.replyline.model.dto.QueueStatistics;
import com.replyline.service.PriorityDispatchService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

/**
 * Dispatch queue inspection and management.
 */
@Slf4j
@RestController
@RequestMapping("/v1/queue")
public class QueueController {

    private final PriorityDispatchService dispatchService;

    public QueueController(PriorityDispatchService dispatchService) {
        this.dispatchService = dispatchService;
    }

    @GetMapping("/stats")
    public ResponseEntity<QueueStatistics> getStats() {
        return ResponseEntity.ok(dispatchService.getQueueStats());
    }

    @GetMapping("/lanes")
    public ResponseEntity<List<LaneStatistics>> getLanes() {
        return ResponseEntity.ok(dispatchService.getLaneStats());
    }

    /**
     * Move a waiting job to a new priority. 409 when the job is no longer waiting.
     */
    @PostMapping("/jobs/{jobId}/requeue")
    public ResponseEntity<Map<String, Object>> requeue(
            @PathVariable String jobId,
            @RequestParam int priority) {

        boolean requeued = dispatchService.requeue(jobId, priority);

        return ResponseEntity.status(requeued ? HttpStatus.OK : HttpStatus.CONFLICT)
                .body(Map.of(
                        "jobId", jobId,
                        "requeued", requeued
                ));
    }

    @GetMapping("/vip/{userId}")
    public ResponseEntity<Map<String, Object>> isVip(@PathVariable String userId) {
        return ResponseEntity.ok(Map.of("userId", userId, "vip", dispatchService.isVipUser(userId)));
    }

    @PutMapping("/vip/{userId}")
    public ResponseEntity<Map<String, Object>> addVip(@PathVariable String userId) {
        dispatchService.addVipUser(userId);
        return ResponseEntity.ok(Map.of("userId", userId, "vip", true));
    }

    @DeleteMapping("/vip/{userId}")
    public ResponseEntity<Map<String, Object>> removeVip(@PathVariable String userId) {
        dispatchService.removeVipUser(userId);
        return ResponseEntity.ok(Map.of("userId", userId, "vip", false));
    }
}
