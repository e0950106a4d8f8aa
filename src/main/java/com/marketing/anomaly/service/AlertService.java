package com.marketing.anomaly.service;

import com.marketing.anomaly.config.AnomalyDetectionConfig;
import com.marketing.anomaly.config.MetricsConfig;
import com.marketing.anomaly.model.Alert;
import com.marketing.anomaly.model.Anomaly;
import com.marketing.anomaly.model.AnomalyDetectionResult;
import com.marketing.anomaly.model.SeverityLevel;
import com.marketing.anomaly.model.Statistics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;

/**
 * Turns detected anomalies into alerts with a readable message and a remediation hint.
 */
@Service
public class AlertService {

    private static final Logger log = LoggerFactory.getLogger(AlertService.class);

    static final String DEFAULT_RECOMMENDATION =
            "Investigate the cause of this anomaly and take corrective action if needed.";

    // metric:direction -> recommendation
    private static final Map<String, String> RECOMMENDATIONS = Map.of(
            "revenue:low", "Review recent campaigns, check conversion rates, and consider increasing ad spend.",
            "revenue:high", "Investigate what drove the increase and consider doubling down on successful strategies.",
            "spend:high", "Check if campaigns are overspending; consider pausing low-performing ads.",
            "views:low", "Review content quality, posting times, and hashtag strategy.",
            "engagement_rate:low", "Analyze content performance and A/B test new formats or hooks.",
            "conversions:low", "Review app store listing, pricing, and conversion funnel.");

    private final AnomalyDetectionConfig config;
    private final MetricsConfig metricsConfig;
    private final Clock clock;

    public AlertService(AnomalyDetectionConfig config, MetricsConfig metricsConfig, Clock clock) {
        this.config = config;
        this.metricsConfig = metricsConfig;
        this.clock = clock;
    }

    /**
     * Build alerts for every anomaly at or above {@code minSeverity}, most severe first.
     */
    public List<Alert> generateAlerts(List<AnomalyDetectionResult> results, SeverityLevel minSeverity) {
        List<Alert> alerts = new ArrayList<>();
        long now = clock.millis();

        for (AnomalyDetectionResult result : results) {
            if (result.getAnomalies() == null) continue;
            for (Anomaly anomaly : result.getAnomalies()) {
                if (anomaly.getSeverity() == null) continue;
                SeverityLevel level = anomaly.getSeverity().getLevel();
                if (!level.isAtLeast(minSeverity)) continue;

                alerts.add(Alert.builder()
                        .id(UUID.randomUUID().toString())
                        .metric(result.getMetric())
                        .severity(level)
                        .score(anomaly.getSeverity().getScore())
                        .value(anomaly.getValue())
                        .expectedRange(expectedRange(anomaly.getBaseline()))
                        .deviationPercent(percentDifference(anomaly))
                        .method(anomaly.getMethod())
                        .timestamp(anomaly.getTimestamp())
                        .message(buildMessage(result.getMetric(), anomaly))
                        .recommendation(recommendationFor(result.getMetric(), anomaly))
                        .acknowledged(false)
                        .resolved(false)
                        .createdAt(now)
                        .build());
                metricsConfig.recordAlert(level.getValue());
            }
        }

        // List.sort is stable: equal tiers keep detection order
        alerts.sort(Comparator.comparingInt((Alert a) -> a.getSeverity().getRank()).reversed());

        log.info("Generated {} alerts at or above {} from {} detection results",
                alerts.size(), minSeverity.getValue(), results.size());
        return alerts;
    }

    String buildMessage(String metric, Anomaly anomaly) {
        boolean high = isHigh(anomaly);
        String percent = String.format(Locale.ROOT, "%.1f",
                Math.abs(percentDifference(anomaly)));
        return String.format(Locale.ROOT, "%s is unusually %s: %s%% %s normal (score: %s)",
                config.displayNameFor(metric),
                high ? "high" : "low",
                percent,
                high ? "above" : "below",
                anomaly.getScore());
    }

    String recommendationFor(String metric, Anomaly anomaly) {
        String direction = isHigh(anomaly) ? "high" : "low";
        return RECOMMENDATIONS.getOrDefault(metric + ":" + direction, DEFAULT_RECOMMENDATION);
    }

    /**
     * Direction follows the percent deviation; when that is zero (non-positive baseline mean)
     * the sign of the method score decides.
     */
    private boolean isHigh(Anomaly anomaly) {
        double percent = percentDifference(anomaly);
        if (percent != 0) {
            return percent > 0;
        }
        return anomaly.getScore() >= 0;
    }

    private static double percentDifference(Anomaly anomaly) {
        return anomaly.getDeviation() != null ? anomaly.getDeviation().getPercentDifference() : 0.0;
    }

    private String expectedRange(Statistics baseline) {
        if (baseline == null) {
            return "n/a";
        }
        return String.format(Locale.ROOT, "%.2f - %.2f",
                baseline.getPercentile25(), baseline.getPercentile75());
    }
}
