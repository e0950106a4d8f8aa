package com.marketing.anomaly.engine;

import com.marketing.anomaly.config.AnomalyDetectionConfig;
import com.marketing.anomaly.model.Deviation;
import com.marketing.anomaly.model.Statistics;
import org.springframework.stereotype.Component;

import static com.marketing.anomaly.engine.StatisticsCalculator.round2;

/**
 * Compares a single value against baseline statistics.
 */
@Component
public class DeviationAnalyzer {

    private final double fenceMultiplier;

    public DeviationAnalyzer(AnomalyDetectionConfig config) {
        this.fenceMultiplier = config.getDetection().getOutlierFenceMultiplier();
    }

    public Deviation analyze(double value, Statistics statistics) {
        if (statistics == null) {
            return Deviation.none();
        }

        double zScore = statistics.getStdDev() > 0
                ? (value - statistics.getMean()) / statistics.getStdDev()
                : 0.0;
        double percentDifference = statistics.getMean() > 0
                ? ((value - statistics.getMean()) / statistics.getMean()) * 100.0
                : 0.0;

        // Tukey fence
        double lowerBound = statistics.getPercentile25() - fenceMultiplier * statistics.getIqr();
        double upperBound = statistics.getPercentile75() + fenceMultiplier * statistics.getIqr();

        return Deviation.builder()
                .zScore(round2(zScore))
                .percentDifference(round2(percentDifference))
                .outlier(value < lowerBound || value > upperBound)
                .distanceFromMean(round2(value - statistics.getMean()))
                .distanceFromMedian(round2(value - statistics.getMedian()))
                .lowerBound(round2(lowerBound))
                .upperBound(round2(upperBound))
                .build();
    }
}
