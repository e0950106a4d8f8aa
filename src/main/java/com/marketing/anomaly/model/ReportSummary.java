package com.marketing.anomaly.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ReportSummary {
    private int totalAnomalies;
    private int criticalCount;
    private int highCount;
    private int mediumCount;
    private int lowCount;

    public void add(AnomalyDetectionResult result) {
        totalAnomalies += result.getTotalAnomalies();
        criticalCount += result.countFor(SeverityLevel.CRITICAL);
        highCount += result.countFor(SeverityLevel.HIGH);
        mediumCount += result.countFor(SeverityLevel.MEDIUM);
        lowCount += result.countFor(SeverityLevel.LOW);
    }
}
