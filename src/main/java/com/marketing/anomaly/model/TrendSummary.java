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
@Schema(description = "First-to-last change of a metric across a context window")
public class TrendSummary {

    @Schema(example = "increasing")
    private TrendDirection direction;

    @Schema(description = "Percent change from the first to the last value", example = "12.5")
    private double change;

    private Double firstValue;

    private Double lastValue;

    public static TrendSummary unknown() {
        return TrendSummary.builder()
                .direction(TrendDirection.UNKNOWN)
                .change(0.0)
                .build();
    }
}
