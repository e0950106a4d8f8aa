package com.marketing.anomaly.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Detection results to turn into alerts")
public class AlertGenerationRequest {

    @Schema(description = "Results previously returned by the detect endpoint")
    @Builder.Default
    private List<AnomalyDetectionResult> anomalyResults = new ArrayList<>();

    @Schema(description = "Lowest severity that raises an alert (defaults to medium)", example = "high",
            allowableValues = {"low", "medium", "high", "critical"})
    private String minSeverity;
}
