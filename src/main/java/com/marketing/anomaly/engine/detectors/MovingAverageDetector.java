package com.marketing.anomaly.engine.detectors;

import com.marketing.anomaly.config.AnomalyDetectionConfig;
import com.marketing.anomaly.engine.PointDetector;
import com.marketing.anomaly.engine.PointScore;
import com.marketing.anomaly.engine.SeriesContext;
import com.marketing.anomaly.model.DetectionMethod;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Z-score of each point against the mean and population standard deviation of the preceding
 * window (7 buckets by default). Points without a full window of history are never flagged.
 */
@Component
public class MovingAverageDetector implements PointDetector {

    private final int window;

    public MovingAverageDetector(AnomalyDetectionConfig config) {
        this.window = config.getDetection().getMovingAverageWindow();
    }

    @Override
    public DetectionMethod getSupportedMethod() {
        return DetectionMethod.MOVING_AVERAGE;
    }

    @Override
    public PointScore score(SeriesContext series, int index, double threshold) {
        if (index < window) {
            return PointScore.notScored();
        }

        List<Double> recent = series.getValues().subList(index - window, index);
        double sum = 0.0;
        for (double v : recent) {
            sum += v;
        }
        double windowMean = sum / window;

        double sumSquaredDiffs = 0.0;
        for (double v : recent) {
            double diff = v - windowMean;
            sumSquaredDiffs += diff * diff;
        }
        double windowStdDev = Math.sqrt(sumSquaredDiffs / window);

        if (windowStdDev <= 0) {
            return PointScore.notScored();
        }
        double score = (series.getValues().get(index) - windowMean) / windowStdDev;
        return new PointScore(score, Math.abs(score) > threshold);
    }
}
