package com.marketing.anomaly.engine.detectors;

import com.marketing.anomaly.engine.PointDetector;
import com.marketing.anomaly.engine.PointScore;
import com.marketing.anomaly.engine.SeriesContext;
import com.marketing.anomaly.model.DetectionMethod;
import org.springframework.stereotype.Component;

/**
 * Robust z-score around the median: (x - median) / (MAD * 1.4826), where MAD is the mean
 * absolute deviation from the median. Published under the method name "isolation".
 */
@Component
public class ModifiedZScoreDetector implements PointDetector {

    // Scales MAD to a standard-deviation-equivalent under normality
    static final double MAD_SCALE = 1.4826;

    @Override
    public DetectionMethod getSupportedMethod() {
        return DetectionMethod.MODIFIED_Z_SCORE;
    }

    @Override
    public PointScore score(SeriesContext series, int index, double threshold) {
        double mad = series.getMeanAbsoluteDeviation();
        if (mad <= 0) {
            return PointScore.notScored();
        }
        double median = series.getStatistics().getMedian();
        double score = (series.getValues().get(index) - median) / (mad * MAD_SCALE);
        return new PointScore(score, Math.abs(score) > threshold);
    }
}
