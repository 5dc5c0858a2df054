package com.replyline.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * One sample of a metric series.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TimeSeriesPoint {
    private Instant timestamp;
    private double value;

    /**
     * Disambiguates equal samples written in the same millisecond (sorted-set members must be unique).
     */
    private String nonce;
}
