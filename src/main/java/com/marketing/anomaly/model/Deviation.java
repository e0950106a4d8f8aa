package com.marketing.anomaly.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.Getter;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "How a single value deviates from a baseline. Numeric fields are rounded to 2 decimals.")
public class Deviation {

    @Schema(example = "2.45")
    @Getter(onMethod_ = @JsonProperty("zScore"))
    private double zScore;

    @Schema(description = "Percent above (+) or below (-) the baseline mean", example = "218.18")
    private double percentDifference;

    @Schema(description = "Outside the Tukey fence [p25 - 1.5*iqr, p75 + 1.5*iqr]", example = "true")
    @JsonProperty("isOutlier")
    private boolean outlier;

    private double distanceFromMean;
    private double distanceFromMedian;
    private double lowerBound;
    private double upperBound;

    public static Deviation none() {
        return new Deviation();
    }
}
