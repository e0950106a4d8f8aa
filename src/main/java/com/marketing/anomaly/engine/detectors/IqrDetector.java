package com.marketing.anomaly.engine.detectors;

import com.marketing.anomaly.engine.PointDetector;
import com.marketing.anomaly.engine.PointScore;
import com.marketing.anomaly.engine.SeriesContext;
import com.marketing.anomaly.model.DetectionMethod;
import com.marketing.anomaly.model.Statistics;
import org.springframework.stereotype.Component;

/**
 * Tukey fences with a caller-supplied multiplier: [p25 - t*iqr, p75 + t*iqr].
 * Score is the signed distance past the violated fence in IQR units; inside the fences the
 * distance to the upper fence is reported (negative) without flagging.
 */
@Component
public class IqrDetector implements PointDetector {

    @Override
    public DetectionMethod getSupportedMethod() {
        return DetectionMethod.IQR;
    }

    @Override
    public PointScore score(SeriesContext series, int index, double threshold) {
        Statistics stats = series.getStatistics();
        double value = series.getValues().get(index);
        double iqr = stats.getIqr();
        double lowerBound = stats.getPercentile25() - threshold * iqr;
        double upperBound = stats.getPercentile75() + threshold * iqr;

        boolean anomalous = value < lowerBound || value > upperBound;
        if (iqr <= 0) {
            // Flat middle half: fences collapse, nothing to normalize by
            return new PointScore(0.0, anomalous);
        }
        double score = value < lowerBound
                ? (value - lowerBound) / iqr
                : (value - upperBound) / iqr;
        return new PointScore(score, anomalous);
    }
}
