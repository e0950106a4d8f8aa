package com.marketing.anomaly.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Samples surrounding an anomaly, with correlated metrics for investigation")
public class AnomalyContext {

    @Schema(example = "revenue")
    private String metric;

    @Schema(description = "Anomaly timestamp in epoch milliseconds", example = "1739836800000")
    private long anomalyTimestamp;

    @Schema(description = "Days on each side of the anomaly", example = "7")
    private int windowDays;

    @Schema(description = "Target metric samples in the window, ascending")
    @Builder.Default
    private List<MetricSample> contextData = new ArrayList<>();

    @Schema(description = "Related metric values keyed by ISO date, then metric name")
    @Builder.Default
    private Map<String, Map<String, Double>> relatedMetrics = new TreeMap<>();

    @Builder.Default
    private List<MetricSample> beforeAnomaly = new ArrayList<>();

    @Builder.Default
    private List<MetricSample> afterAnomaly = new ArrayList<>();

    private TrendSummary trend;

    @Schema(description = "Set when the time-series store could not be read")
    private String error;

    @Schema(description = "Retrieval time in epoch milliseconds", example = "1739886764000")
    private long retrievedAt;
}
