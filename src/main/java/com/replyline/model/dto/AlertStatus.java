package com.replyline.model.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Current state of one threshold alert. Recomputed on every read.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AlertStatus {

    public static final String FIRING = "firing";
    public static final String RESOLVED = "resolved";

    private String name;
    private String severity;  // "critical" or "warning"
    private String status;
    private String message;
    private double value;
    private double threshold;
    private Instant triggeredAt;  // only when firing
}
