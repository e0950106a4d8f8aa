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
@Schema(description = "Narrative observation derived from an anomaly report")
public class ReportInsight {

    @Schema(example = "high")
    private SeverityLevel priority;

    @Schema(description = "Metric the insight refers to, null for cross-metric insights", example = "revenue")
    private String metric;

    @Schema(example = "revenue has the most anomalies (4 in 30 days)")
    private String message;

    @Schema(example = "high", allowableValues = {"high", "critical", "positive"})
    private String impact;
}
