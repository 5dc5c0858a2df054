package com.replyline.controller;

import com.replyline.model.dto.AlertStatus;
import com.replyline.model.dto.MetricsSummary;
import com.replyline.model.dto.TimeSeriesData;
import com.replyline.service.ChatMetricsService;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Pipeline performance metrics and alert states.
 */
@RestController
@RequestMapping("/v1/metrics")
public class MetricsController {

    private static final Duration DEFAULT_HISTORY = Duration.ofHours(1);

    private final ChatMetricsService metricsService;
    private final Clock clock;

    public MetricsController(ChatMetricsService metricsService, Clock clock) {
        this.metricsService = metricsService;
        this.clock = clock;
    }

    @GetMapping
    public ResponseEntity<MetricsSummary> getMetrics() {
        return ResponseEntity.ok(metricsService.getMetrics());
    }

    @GetMapping("/alerts")
    public ResponseEntity<List<AlertStatus>> getAlerts() {
        return ResponseEntity.ok(metricsService.getAlertStatus());
    }

    /**
     * Response-time samples in a range, the last hour by default.
     */
    @GetMapping("/history")
    public ResponseEntity<List<TimeSeriesData>> getHistory(
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant start,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant end) {

        Instant to = end != null ? end : clock.instant();
        Instant from = start != null ? start : to.minus(DEFAULT_HISTORY);

        if (from.isAfter(to)) {
            throw new IllegalArgumentException("start must not be after end");
        }

        return ResponseEntity.ok(metricsService.getHistoricalMetrics(from, to));
    }
}
