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
@Schema(description = "A single observation of a business metric, read from the time-series store")
public class MetricSample {

    @Schema(description = "Metric name", example = "revenue")
    private String metric;

    @Schema(description = "Observation timestamp in epoch milliseconds", example = "1739886764000")
    private long timestamp;

    @Schema(description = "Observed value", example = "512.40")
    private double value;
}
