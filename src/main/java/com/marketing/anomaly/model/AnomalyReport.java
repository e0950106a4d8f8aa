package com.marketing.anomaly.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Anomaly detection results, alerts and narrative findings across several metrics")
public class AnomalyReport {

    @Schema(description = "Generation time in epoch milliseconds", example = "1739886764000")
    private long generatedAt;

    @Schema(description = "Lookback window in days", example = "30")
    private int period;

    @Schema(description = "Metrics requested for the report")
    @Builder.Default
    private List<String> metrics = new ArrayList<>();

    @Builder.Default
    private ReportSummary summary = new ReportSummary();

    @Schema(description = "Detection result per metric; metrics whose detection failed are absent")
    @Builder.Default
    private Map<String, AnomalyDetectionResult> anomaliesByMetric = new LinkedHashMap<>();

    @Builder.Default
    private List<Alert> alerts = new ArrayList<>();

    @Builder.Default
    private List<ReportInsight> insights = new ArrayList<>();

    @Builder.Default
    private List<ReportRecommendation> recommendations = new ArrayList<>();

    @Schema(description = "Metrics whose detection failed and were left out of the report")
    @Builder.Default
    private List<String> failedMetrics = new ArrayList<>();
}
