package com.marketing.anomaly.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Statistical summary and bucketed series of a metric's recent history")
public class Baseline {

    @Schema(description = "Metric name", example = "revenue")
    private String metric;

    @Schema(description = "Lookback window in days", example = "30")
    private int period;

    @Schema(description = "Bucket granularity", example = "daily")
    private Aggregation aggregation;

    @Schema(description = "Number of buckets; equals values.size() and timestamps.size()", example = "30")
    private int dataPoints;

    private Statistics statistics;

    @Schema(description = "Bucket totals, ascending by timestamp")
    @Builder.Default
    private List<Double> values = new ArrayList<>();

    @Schema(description = "Bucket start times in epoch milliseconds, parallel to values")
    @Builder.Default
    private List<Long> timestamps = new ArrayList<>();

    @Schema(description = "Computation time in epoch milliseconds", example = "1739886764000")
    private long calculatedAt;

    @Schema(description = "True when the series is synthetic because no history exists yet", example = "false")
    @JsonProperty("isMock")
    private boolean mock;
}
