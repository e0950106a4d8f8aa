package com.marketing.anomaly.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Anomalies detected in one metric's baseline series")
public class AnomalyDetectionResult {

    @Schema(example = "revenue")
    private String metric;

    @Schema(example = "zscore")
    private DetectionMethod method;

    @Schema(example = "2.0")
    private double threshold;

    @Schema(description = "Lookback window in days", example = "30")
    private int period;

    @Schema(description = "Number of flagged points before truncation", example = "3")
    private int totalAnomalies;

    @Schema(description = "Top anomalies by severity score, descending (truncated)")
    @Builder.Default
    private List<Anomaly> anomalies = new ArrayList<>();

    @Schema(description = "Flagged points per severity tier, before truncation")
    @Builder.Default
    private Map<SeverityLevel, Integer> severityCounts = new EnumMap<>(SeverityLevel.class);

    private Statistics statistics;

    @Schema(description = "True when detection ran against a synthetic baseline", example = "false")
    private boolean mockBaseline;

    @Schema(description = "Detection time in epoch milliseconds", example = "1739886764000")
    private long detectedAt;

    public int countFor(SeverityLevel level) {
        if (severityCounts == null) return 0;
        return severityCounts.getOrDefault(level, 0);
    }
}
