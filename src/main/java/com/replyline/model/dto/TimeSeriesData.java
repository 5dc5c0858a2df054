package com.replyline.model.dto;

import com.replyline.model.TimeSeriesPoint;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Samples of one metric over a time range.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TimeSeriesData {
    private String metric;
    private List<TimeSeriesPoint> data;
}
