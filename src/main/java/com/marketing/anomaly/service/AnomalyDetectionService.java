package com.marketing.anomaly.service;

import com.marketing.anomaly.config.AnomalyDetectionConfig;
import com.marketing.anomaly.config.MetricsConfig;
import com.marketing.anomaly.engine.DetectionEngine;
import com.marketing.anomaly.engine.SeriesContext;
import com.marketing.anomaly.engine.StatisticsCalculator;
import com.marketing.anomaly.model.Aggregation;
import com.marketing.anomaly.model.Anomaly;
import com.marketing.anomaly.model.AnomalyDetectionResult;
import com.marketing.anomaly.model.Baseline;
import com.marketing.anomaly.model.DetectionMethod;
import com.marketing.anomaly.model.SeverityLevel;
import io.micrometer.observation.annotation.Observed;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

@Service
public class AnomalyDetectionService {

    private static final Logger log = LoggerFactory.getLogger(AnomalyDetectionService.class);

    private final BaselineService baselineService;
    private final DetectionEngine detectionEngine;
    private final StatisticsCalculator statisticsCalculator;
    private final AnomalyDetectionConfig config;
    private final MetricsConfig metricsConfig;
    private final Clock clock;

    public AnomalyDetectionService(BaselineService baselineService,
                                   DetectionEngine detectionEngine,
                                   StatisticsCalculator statisticsCalculator,
                                   AnomalyDetectionConfig config,
                                   MetricsConfig metricsConfig,
                                   Clock clock) {
        this.baselineService = baselineService;
        this.detectionEngine = detectionEngine;
        this.statisticsCalculator = statisticsCalculator;
        this.config = config;
        this.metricsConfig = metricsConfig;
        this.clock = clock;
    }

    /**
     * Detect anomalies in the daily baseline of a metric.
     *
     * The returned list is sorted by severity score descending and truncated to the configured
     * maximum; totalAnomalies and severityCounts cover every flagged point.
     */
    @Observed(name = "anomaly.detect", contextualName = "detect-anomalies")
    public AnomalyDetectionResult detect(String metric, int periodDays, DetectionMethod method, double threshold) {
        Baseline baseline = baselineService.calculateBaseline(metric, periodDays, Aggregation.DAILY);

        SeriesContext series = SeriesContext.builder()
                .values(baseline.getValues())
                .timestamps(baseline.getTimestamps())
                .statistics(baseline.getStatistics())
                .meanAbsoluteDeviation(statisticsCalculator.meanAbsoluteDeviation(
                        baseline.getValues(), baseline.getStatistics().getMedian()))
                .build();

        List<Anomaly> anomalies = new ArrayList<>(detectionEngine.scan(series, method, threshold));
        anomalies.sort(Comparator.comparingDouble((Anomaly a) -> a.getSeverity().getScore()).reversed());

        Map<SeverityLevel, Integer> severityCounts = new EnumMap<>(SeverityLevel.class);
        for (Anomaly anomaly : anomalies) {
            severityCounts.merge(anomaly.getSeverity().getLevel(), 1, Integer::sum);
        }

        int limit = config.getDetection().getMaxAnomaliesReturned();
        List<Anomaly> top = anomalies.size() > limit
                ? new ArrayList<>(anomalies.subList(0, limit))
                : anomalies;

        metricsConfig.recordDetection(method.getValue(), anomalies.size());
        log.info("Detected {} anomalies in {} ({} days, method={}, threshold={}{})",
                anomalies.size(), metric, periodDays, method.getValue(), threshold,
                baseline.isMock() ? ", synthetic baseline" : "");

        return AnomalyDetectionResult.builder()
                .metric(metric)
                .method(method)
                .threshold(threshold)
                .period(periodDays)
                .totalAnomalies(anomalies.size())
                .anomalies(top)
                .severityCounts(severityCounts)
                .statistics(baseline.getStatistics())
                .mockBaseline(baseline.isMock())
                .detectedAt(clock.millis())
                .build();
    }
}
