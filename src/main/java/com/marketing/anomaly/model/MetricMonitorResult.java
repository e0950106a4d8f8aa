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
@Schema(description = "Latest value of a metric compared against its baseline")
public class MetricMonitorResult {

    @Schema(example = "revenue")
    private String metric;

    @Schema(description = "Baseline statistics")
    private Statistics baseline;

    @Schema(description = "Most recent stored value (0 if unavailable)", example = "512.4")
    private double currentValue;

    private Deviation deviation;

    @Schema(description = "True when the z-score, IQR fence or percent deviation rule fires", example = "false")
    private boolean anomaly;

    @Schema(description = "True when the baseline is synthetic", example = "false")
    private boolean mockBaseline;

    @Schema(description = "Check time in epoch milliseconds", example = "1739886764000")
    private long timestamp;
}
