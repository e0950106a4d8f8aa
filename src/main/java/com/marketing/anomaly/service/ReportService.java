package com.marketing.anomaly.service;

import com.marketing.anomaly.config.AnomalyDetectionConfig;
import com.marketing.anomaly.config.MetricsConfig;
import com.marketing.anomaly.model.Alert;
import com.marketing.anomaly.model.AnomalyDetectionResult;
import com.marketing.anomaly.model.AnomalyReport;
import com.marketing.anomaly.model.DetectionMethod;
import com.marketing.anomaly.model.ReportInsight;
import com.marketing.anomaly.model.ReportRecommendation;
import com.marketing.anomaly.model.ReportSummary;
import com.marketing.anomaly.model.SeverityLevel;
import io.micrometer.observation.annotation.Observed;
import io.micrometer.tracing.Span;
import io.micrometer.tracing.Tracer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Runs detection across several metrics and summarizes the outcome.
 * Report detection always uses the configured report method and threshold (zscore, 2.0);
 * other methods are only available through single-metric detection.
 */
@Service
public class ReportService {

    private static final Logger log = LoggerFactory.getLogger(ReportService.class);

    private final AnomalyDetectionService detectionService;
    private final AlertService alertService;
    private final AnomalyDetectionConfig config;
    private final MetricsConfig metricsConfig;
    private final Tracer tracer;
    private final Clock clock;

    public ReportService(AnomalyDetectionService detectionService,
                         AlertService alertService,
                         AnomalyDetectionConfig config,
                         MetricsConfig metricsConfig,
                         Tracer tracer,
                         Clock clock) {
        this.detectionService = detectionService;
        this.alertService = alertService;
        this.config = config;
        this.metricsConfig = metricsConfig;
        this.tracer = tracer;
        this.clock = clock;
    }

    @Observed(name = "anomaly.report", contextualName = "build-anomaly-report")
    public AnomalyReport buildReport(List<String> metrics, int periodDays) {
        AnomalyDetectionConfig.Report reportConfig = config.getReport();
        DetectionMethod method = DetectionMethod.fromValue(reportConfig.getMethod());
        if (method == null) {
            throw new IllegalStateException("Unknown report detection method: " + reportConfig.getMethod());
        }
        SeverityLevel minSeverity = SeverityLevel.fromValue(reportConfig.getMinSeverity());
        if (minSeverity == null) {
            throw new IllegalStateException("Unknown report alert severity: " + reportConfig.getMinSeverity());
        }

        ReportSummary summary = new ReportSummary();
        Map<String, AnomalyDetectionResult> byMetric = new LinkedHashMap<>();
        List<String> failedMetrics = new ArrayList<>();

        for (String metric : metrics) {
            Span metricSpan = tracer.nextSpan()
                    .name("report.detect")
                    .tag("metric", metric)
                    .tag("method", method.getValue())
                    .start();

            try (Tracer.SpanInScope ws = tracer.withSpan(metricSpan)) {
                AnomalyDetectionResult result = detectionService.detect(
                        metric, periodDays, method, reportConfig.getThreshold());
                byMetric.put(metric, result);
                summary.add(result);
                metricSpan.tag("anomalies", String.valueOf(result.getTotalAnomalies()));
            } catch (Exception e) {
                metricSpan.error(e);
                failedMetrics.add(metric);
                metricsConfig.recordReportFailure(metric);
                // Don't let one bad metric block the entire report
                log.error("Error detecting anomalies for {} in report: {}", metric, e.getMessage(), e);
            } finally {
                metricSpan.end();
            }
        }

        List<Alert> alerts = alertService.generateAlerts(new ArrayList<>(byMetric.values()), minSeverity);

        AnomalyReport report = AnomalyReport.builder()
                .generatedAt(clock.millis())
                .period(periodDays)
                .metrics(new ArrayList<>(metrics))
                .summary(summary)
                .anomaliesByMetric(byMetric)
                .alerts(alerts)
                .failedMetrics(failedMetrics)
                .build();
        report.setInsights(generateInsights(report));
        report.setRecommendations(generateRecommendations(report));

        log.info("Anomaly report over {} metrics ({} days): {} anomalies, {} alerts, {} failed",
                metrics.size(), periodDays, summary.getTotalAnomalies(), alerts.size(), failedMetrics.size());
        return report;
    }

    List<ReportInsight> generateInsights(AnomalyReport report) {
        List<ReportInsight> insights = new ArrayList<>();

        // Metric with the most anomalies; first one wins ties
        String worstMetric = null;
        int maxAnomalies = 0;
        for (Map.Entry<String, AnomalyDetectionResult> entry : report.getAnomaliesByMetric().entrySet()) {
            if (entry.getValue().getTotalAnomalies() > maxAnomalies) {
                maxAnomalies = entry.getValue().getTotalAnomalies();
                worstMetric = entry.getKey();
            }
        }
        if (worstMetric != null) {
            insights.add(ReportInsight.builder()
                    .priority(SeverityLevel.HIGH)
                    .metric(worstMetric)
                    .message(String.format(Locale.ROOT, "%s has the most anomalies (%d in %d days)",
                            worstMetric, maxAnomalies, report.getPeriod()))
                    .impact("high")
                    .build());
        }

        long unacknowledgedCritical = report.getAlerts().stream()
                .filter(a -> a.getSeverity() == SeverityLevel.CRITICAL && !a.isAcknowledged())
                .count();
        if (unacknowledgedCritical > 0) {
            insights.add(ReportInsight.builder()
                    .priority(SeverityLevel.CRITICAL)
                    .message(String.format(Locale.ROOT, "%d unacknowledged critical anomalies require immediate attention",
                            unacknowledgedCritical))
                    .impact("critical")
                    .build());
        }

        double positiveBand = config.getReport().getPositiveDeviationPct();
        long positive = report.getAlerts().stream()
                .filter(a -> a.getDeviationPercent() > positiveBand && a.getSeverity() != SeverityLevel.CRITICAL)
                .count();
        if (positive > 0) {
            insights.add(ReportInsight.builder()
                    .priority(SeverityLevel.MEDIUM)
                    .message(String.format(Locale.ROOT, "%d positive anomalies detected - investigate what's working", positive))
                    .impact("positive")
                    .build());
        }

        return insights;
    }

    List<ReportRecommendation> generateRecommendations(AnomalyReport report) {
        List<ReportRecommendation> recommendations = new ArrayList<>();

        if (report.getSummary().getCriticalCount() > 0) {
            recommendations.add(ReportRecommendation.builder()
                    .action("Investigate critical anomalies immediately")
                    .priority(SeverityLevel.HIGH)
                    .impact("high")
                    .effort("medium")
                    .metric("all")
                    .build());
        }

        if (hasAnomalies(report, "revenue")) {
            recommendations.add(ReportRecommendation.builder()
                    .action("Review revenue anomalies and adjust marketing strategy")
                    .priority(SeverityLevel.HIGH)
                    .impact("high")
                    .effort("medium")
                    .metric("revenue")
                    .build());
        }

        if (hasAnomalies(report, "engagement_rate")) {
            recommendations.add(ReportRecommendation.builder()
                    .action("A/B test new content formats to improve engagement")
                    .priority(SeverityLevel.MEDIUM)
                    .impact("medium")
                    .effort("low")
                    .metric("engagement_rate")
                    .build());
        }

        return recommendations;
    }

    private boolean hasAnomalies(AnomalyReport report, String metric) {
        AnomalyDetectionResult result = report.getAnomaliesByMetric().get(metric);
        return result != null && result.getTotalAnomalies() > 0;
    }
}
