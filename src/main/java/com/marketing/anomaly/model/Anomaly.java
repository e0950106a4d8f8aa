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
@Schema(description = "A baseline point flagged by a detection method")
public class Anomaly {

    @Schema(description = "Bucket timestamp in epoch milliseconds", example = "1739836800000")
    private long timestamp;

    @Schema(description = "Bucket value", example = "50.0")
    private double value;

    @Schema(description = "Signed method score, rounded to 2 decimals", example = "2.45")
    private double score;

    @Schema(description = "Method that flagged the point", example = "zscore")
    private DetectionMethod method;

    private Severity severity;

    @Schema(description = "Baseline statistics the point was judged against")
    private Statistics baseline;

    private Deviation deviation;
}
