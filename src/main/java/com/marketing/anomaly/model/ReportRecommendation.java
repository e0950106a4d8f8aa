package com.marketing.anomaly.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Suggested follow-up action derived from an anomaly report")
public class ReportRecommendation {

    @Schema(example = "Investigate critical anomalies immediately")
    private String action;

    @Schema(example = "high")
    private SeverityLevel priority;

    @Schema(example = "high")
    private String impact;

    @Schema(example = "medium")
    private String effort;

    @Schema(description = "Target metric, or 'all'", example = "all")
    private String metric;
}
