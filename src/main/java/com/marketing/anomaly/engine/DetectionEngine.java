package com.marketing.anomaly.engine;

import com.marketing.anomaly.model.Anomaly;
import com.marketing.anomaly.model.DetectionMethod;
import com.marketing.anomaly.model.Severity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import static com.marketing.anomaly.engine.StatisticsCalculator.round2;

/**
 * Walks every point of a series and collects the ones the selected method flags.
 * Uses the Strategy pattern: each DetectionMethod is handled by a registered PointDetector.
 */
@Component
public class DetectionEngine {

    private static final Logger log = LoggerFactory.getLogger(DetectionEngine.class);

    private final Map<DetectionMethod, PointDetector> detectorMap;
    private final DeviationAnalyzer deviationAnalyzer;

    public DetectionEngine(List<PointDetector> detectors, DeviationAnalyzer deviationAnalyzer) {
        this.detectorMap = new EnumMap<>(DetectionMethod.class);
        this.deviationAnalyzer = deviationAnalyzer;

        for (PointDetector detector : detectors) {
            detectorMap.put(detector.getSupportedMethod(), detector);
            log.info("Registered point detector: {} -> {}",
                    detector.getSupportedMethod(), detector.getClass().getSimpleName());
        }
    }

    /**
     * Score every point of the series and return the flagged ones in series order.
     *
     * @throws IllegalArgumentException if no detector is registered for the method
     */
    public List<Anomaly> scan(SeriesContext series, DetectionMethod method, double threshold) {
        PointDetector detector = detectorMap.get(method);
        if (detector == null) {
            throw new IllegalArgumentException("No detector registered for method: " + method);
        }

        List<Anomaly> anomalies = new ArrayList<>();
        List<Double> values = series.getValues();
        for (int i = 0; i < values.size(); i++) {
            PointScore pointScore = detector.score(series, i, threshold);
            if (!pointScore.anomalous()) continue;

            double value = values.get(i);
            anomalies.add(Anomaly.builder()
                    .timestamp(series.getTimestamps().get(i))
                    .value(value)
                    .score(round2(pointScore.score()))
                    .method(method)
                    .severity(Severity.classify(pointScore.score()))
                    .baseline(series.getStatistics())
                    .deviation(deviationAnalyzer.analyze(value, series.getStatistics()))
                    .build());
        }

        log.debug("{} flagged {} of {} points (threshold={})",
                method, anomalies.size(), values.size(), threshold);
        return anomalies;
    }
}
