package com.marketing.anomaly.engine.detectors;

import com.marketing.anomaly.engine.PointDetector;
import com.marketing.anomaly.engine.PointScore;
import com.marketing.anomaly.engine.SeriesContext;
import com.marketing.anomaly.model.DetectionMethod;
import com.marketing.anomaly.model.Statistics;
import org.springframework.stereotype.Component;

/**
 * Flags points more than {@code threshold} standard deviations from the series mean.
 * A zero-variance series scores 0 everywhere.
 */
@Component
public class ZScoreDetector implements PointDetector {

    @Override
    public DetectionMethod getSupportedMethod() {
        return DetectionMethod.Z_SCORE;
    }

    @Override
    public PointScore score(SeriesContext series, int index, double threshold) {
        Statistics stats = series.getStatistics();
        if (stats.getStdDev() <= 0) {
            return PointScore.notScored();
        }
        double score = (series.getValues().get(index) - stats.getMean()) / stats.getStdDev();
        return new PointScore(score, Math.abs(score) > threshold);
    }
}
