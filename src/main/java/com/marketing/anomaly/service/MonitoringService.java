package com.marketing.anomaly.service;

import com.marketing.anomaly.config.AnomalyDetectionConfig;
import com.marketing.anomaly.engine.DeviationAnalyzer;
import com.marketing.anomaly.exception.MetricSourceException;
import com.marketing.anomaly.model.Aggregation;
import com.marketing.anomaly.model.Baseline;
import com.marketing.anomaly.model.Deviation;
import com.marketing.anomaly.model.MetricMonitorResult;
import com.marketing.anomaly.model.MetricSample;
import com.marketing.anomaly.repository.MetricSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

/**
 * Compares each metric's most recent value with its baseline.
 */
@Service
public class MonitoringService {

    private static final Logger log = LoggerFactory.getLogger(MonitoringService.class);

    private final BaselineService baselineService;
    private final DeviationAnalyzer deviationAnalyzer;
    private final MetricSource metricSource;
    private final AnomalyDetectionConfig config;
    private final Clock clock;

    public MonitoringService(BaselineService baselineService,
                             DeviationAnalyzer deviationAnalyzer,
                             MetricSource metricSource,
                             AnomalyDetectionConfig config,
                             Clock clock) {
        this.baselineService = baselineService;
        this.deviationAnalyzer = deviationAnalyzer;
        this.metricSource = metricSource;
        this.config = config;
        this.clock = clock;
    }

    public List<MetricMonitorResult> monitorMetrics(List<String> metrics, int periodDays) {
        List<MetricMonitorResult> results = new ArrayList<>();

        for (String metric : metrics) {
            try {
                Baseline baseline = baselineService.calculateBaseline(metric, periodDays, Aggregation.DAILY);
                double latestValue = getLatestMetricValue(metric);
                Deviation deviation = deviationAnalyzer.analyze(latestValue, baseline.getStatistics());

                results.add(MetricMonitorResult.builder()
                        .metric(metric)
                        .baseline(baseline.getStatistics())
                        .currentValue(latestValue)
                        .deviation(deviation)
                        .anomaly(isAnomaly(deviation))
                        .mockBaseline(baseline.isMock())
                        .timestamp(clock.millis())
                        .build());
            } catch (RuntimeException e) {
                // One metric must not abort the others
                log.error("Error monitoring metric {}: {}", metric, e.getMessage(), e);
            }
        }

        return results;
    }

    /**
     * Latest stored value of a metric; 0 when the metric has no samples or the store fails.
     */
    public double getLatestMetricValue(String metric) {
        try {
            MetricSample latest = metricSource.latest(metric);
            return latest != null ? latest.getValue() : 0.0;
        } catch (MetricSourceException e) {
            log.error("Error getting latest value for {}: {}", metric, e.getMessage(), e);
            return 0.0;
        }
    }

    /**
     * A current value is anomalous when any of the z-score, Tukey fence or percent-deviation
     * rules fires.
     */
    public boolean isAnomaly(Deviation deviation) {
        AnomalyDetectionConfig.Monitor monitor = config.getMonitor();
        if (Math.abs(deviation.getZScore()) > monitor.getStandardScoreThreshold()) {
            return true;
        }
        if (deviation.isOutlier()) {
            return true;
        }
        return Math.abs(deviation.getPercentDifference()) > monitor.getPercentDeviationThreshold();
    }
}
