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
@Schema(description = "Alert raised for one anomaly. acknowledged/resolved are maintained by the consuming alert tracker.")
public class Alert {

    @Schema(description = "Opaque alert identifier", example = "4f2c1d9e-7a34-4a4e-9d07-6c0c1b1f8a21")
    private String id;

    @Schema(example = "revenue")
    private String metric;

    @Schema(example = "high")
    private SeverityLevel severity;

    @Schema(description = "Absolute severity score", example = "3.42")
    private double score;

    @Schema(description = "Observed value", example = "1250.0")
    private double value;

    @Schema(description = "Interquartile band of the baseline", example = "450.00 - 560.00")
    private String expectedRange;

    @Schema(description = "Percent deviation from the baseline mean", example = "148.5")
    private double deviationPercent;

    @Schema(example = "zscore")
    private DetectionMethod method;

    @Schema(description = "Anomaly timestamp in epoch milliseconds", example = "1739836800000")
    private long timestamp;

    @Schema(example = "Revenue is unusually high: 148.5% above normal (score: 3.42)")
    private String message;

    private String recommendation;

    private boolean acknowledged;

    private boolean resolved;

    @Schema(description = "Creation time in epoch milliseconds", example = "1739886764000")
    private long createdAt;
}
