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
@Schema(description = "Severity tier derived from a dimensionless anomaly score")
public class Severity {

    @Schema(description = "Tier: low (<2), medium (2-3), high (3-4), critical (>=4)", example = "high")
    private SeverityLevel level;

    @Schema(description = "Absolute anomaly score the tier was derived from", example = "3.42")
    private double score;

    @Schema(description = "Display color for the tier", example = "#ff6b6b")
    private String colorHint;

    /**
     * Classify a signed score. The tier depends only on |score|.
     */
    public static Severity classify(double score) {
        SeverityLevel level = SeverityLevel.fromScore(score);
        return Severity.builder()
                .level(level)
                .score(Math.abs(score))
                .colorHint(level.getColorHint())
                .build();
    }
}
