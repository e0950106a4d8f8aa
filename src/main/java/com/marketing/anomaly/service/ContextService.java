package com.marketing.anomaly.service;

import com.marketing.anomaly.config.AnomalyDetectionConfig;
import com.marketing.anomaly.exception.MetricSourceException;
import com.marketing.anomaly.model.AnomalyContext;
import com.marketing.anomaly.model.MetricSample;
import com.marketing.anomaly.model.TrendDirection;
import com.marketing.anomaly.model.TrendSummary;
import com.marketing.anomaly.repository.MetricSource;
import io.micrometer.observation.annotation.Observed;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

import static com.marketing.anomaly.engine.StatisticsCalculator.round2;

/**
 * Gathers the samples around an anomaly, plus correlated metrics, for investigation.
 */
@Service
public class ContextService {

    private static final Logger log = LoggerFactory.getLogger(ContextService.class);

    private final MetricSource metricSource;
    private final AnomalyDetectionConfig config;
    private final Clock clock;
    private final DateTimeFormatter dateKeyFormat;

    public ContextService(MetricSource metricSource, AnomalyDetectionConfig config, Clock clock) {
        this.metricSource = metricSource;
        this.config = config;
        this.clock = clock;
        this.dateKeyFormat = DateTimeFormatter.ISO_LOCAL_DATE.withZone(ZoneId.of(config.getZoneId()));
    }

    @Observed(name = "anomaly.context", contextualName = "anomaly-context")
    public AnomalyContext getContext(String metric, long anomalyTimestamp, int windowDays) {
        long windowMillis = TimeUnit.DAYS.toMillis(windowDays);
        long from = anomalyTimestamp - windowMillis;
        long to = anomalyTimestamp + windowMillis;

        try {
            List<MetricSample> contextData = metricSource.query(metric, from, to);

            Map<String, Map<String, Double>> relatedByDate = new TreeMap<>();
            for (String related : config.getContext().getRelatedMetrics()) {
                if (related.equals(metric)) continue;
                for (MetricSample sample : metricSource.query(related, from, to)) {
                    String dateKey = dateKeyFormat.format(Instant.ofEpochMilli(sample.getTimestamp()));
                    // samples arrive ascending, so the latest of the day wins
                    relatedByDate.computeIfAbsent(dateKey, k -> new TreeMap<>())
                            .put(related, sample.getValue());
                }
            }

            return AnomalyContext.builder()
                    .metric(metric)
                    .anomalyTimestamp(anomalyTimestamp)
                    .windowDays(windowDays)
                    .contextData(contextData)
                    .relatedMetrics(relatedByDate)
                    .beforeAnomaly(contextData.stream()
                            .filter(s -> s.getTimestamp() < anomalyTimestamp)
                            .collect(Collectors.toList()))
                    .afterAnomaly(contextData.stream()
                            .filter(s -> s.getTimestamp() > anomalyTimestamp)
                            .collect(Collectors.toList()))
                    .trend(calculateTrend(contextData))
                    .retrievedAt(clock.millis())
                    .build();

        } catch (MetricSourceException e) {
            log.error("Error getting context for {} around {}: {}", metric, anomalyTimestamp, e.getMessage(), e);
            return AnomalyContext.builder()
                    .metric(metric)
                    .anomalyTimestamp(anomalyTimestamp)
                    .windowDays(windowDays)
                    .trend(TrendSummary.unknown())
                    .error(e.getMessage())
                    .retrievedAt(clock.millis())
                    .build();
        }
    }

    /**
     * First-to-last percent change across the samples. Fewer than two samples give UNKNOWN.
     */
    public TrendSummary calculateTrend(List<MetricSample> data) {
        if (data.size() < 2) {
            return TrendSummary.unknown();
        }

        double firstValue = data.get(0).getValue();
        double lastValue = data.get(data.size() - 1).getValue();
        double change = firstValue != 0 ? ((lastValue - firstValue) / firstValue) * 100.0 : 0.0;

        double band = config.getContext().getTrendThresholdPct();
        TrendDirection direction = TrendDirection.STABLE;
        if (change > band) {
            direction = TrendDirection.INCREASING;
        } else if (change < -band) {
            direction = TrendDirection.DECREASING;
        }

        return TrendSummary.builder()
                .direction(direction)
                .change(round2(change))
                .firstValue(firstValue)
                .lastValue(lastValue)
                .build();
    }
}
