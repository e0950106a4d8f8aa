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
@Schema(description = "Descriptive statistics over a metric series. All fields are zero for an empty series.")
public class Statistics {

    private double mean;
    private double median;

    @Schema(description = "Population standard deviation")
    private double stdDev;

    @Schema(description = "Population variance")
    private double variance;

    private double min;
    private double max;

    @Schema(description = "Nearest-rank 25th percentile (sorted[floor(n * 0.25)])")
    private double percentile25;

    @Schema(description = "Nearest-rank 75th percentile (sorted[floor(n * 0.75)])")
    private double percentile75;

    @Schema(description = "stdDev / mean * 100, or 0 when mean <= 0")
    private double coefficientOfVariation;

    @Schema(description = "max - min")
    private double range;

    @Schema(description = "percentile75 - percentile25")
    private double iqr;

    public static Statistics empty() {
        return new Statistics();
    }
}
