package com.replyline.controller;

import com.replyline.model.dto.CacheStatistics;
import com.replyline.service.AgentResponseCacheService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

/**
 * Response cache management controller.
 */
@Slf4j
@RestController
@RequestMapping("/v1/cache")
public class CacheController {

    private final AgentResponseCacheService cacheService;

    public CacheController(AgentResponseCacheService cacheService) {
        this.cacheService = cacheService;
    }

    /**
     * Get cache statistics.
     */
    @GetMapping("/stats")
    public ResponseEntity<CacheStatistics> getStats() {
        return ResponseEntity.ok(cacheService.getStats());
    }

    /**
     * Drop every cached answer of an agent.
     */
    @DeleteMapping("/agents/{agentId}")
    public ResponseEntity<Map<String, Object>> invalidateAgent(@PathVariable String agentId) {
        log.info("Cache invalidation requested for agent: {}", agentId);
        long invalidated = cacheService.invalidateAgentCache(agentId);

        return ResponseEntity.ok(Map.of(
                "status", "success",
                "invalidated", invalidated
        ));
    }

    /**
     * Drop cached answers whose question mentions a project.
     */
    @DeleteMapping("/projects/{projectId}")
    public ResponseEntity<Map<String, Object>> invalidateProject(@PathVariable String projectId) {
        log.info("Cache invalidation requested for project: {}", projectId);
        long invalidated = cacheService.invalidateProjectCache(projectId);

        return ResponseEntity.ok(Map.of(
                "status", "success",
                "invalidated", invalidated
        ));
    }

    /**
     * Clear the whole response cache.
     */
    @PostMapping("/clear")
    public ResponseEntity<Map<String, Object>> clearCache() {
        log.info("Cache clear requested");
        long invalidated = cacheService.clearAll();

        return ResponseEntity.ok(Map.of(
                "status", "success",
                "invalidated", invalidated
        ));
    }
}
