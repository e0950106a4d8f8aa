package com.marketing.anomaly.controller;

import com.marketing.anomaly.config.AnomalyDetectionConfig;
import com.marketing.anomaly.model.Aggregation;
import com.marketing.anomaly.model.Alert;
import com.marketing.anomaly.model.AlertGenerationRequest;
import com.marketing.anomaly.model.AnomalyContext;
import com.marketing.anomaly.model.AnomalyDetectionResult;
import com.marketing.anomaly.model.AnomalyReport;
import com.marketing.anomaly.model.Baseline;
import com.marketing.anomaly.model.DetectionMethod;
import com.marketing.anomaly.model.MetricMonitorResult;
import com.marketing.anomaly.model.SeverityLevel;
import com.marketing.anomaly.service.AlertService;
import com.marketing.anomaly.service.AnomalyDetectionService;
import com.marketing.anomaly.service.BaselineService;
import com.marketing.anomaly.service.ContextService;
import com.marketing.anomaly.service.MonitoringService;
import com.marketing.anomaly.service.ReportService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.ArraySchema;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

@RestController
@RequestMapping("/api/v1/anomalies")
@Tag(name = "Anomaly Detection", description = "Metric baselines, anomaly detection, alerts, context and reports")
public class AnomalyDetectionController {

    private final BaselineService baselineService;
    private final AnomalyDetectionService detectionService;
    private final AlertService alertService;
    private final ContextService contextService;
    private final ReportService reportService;
    private final MonitoringService monitoringService;
    private final AnomalyDetectionConfig config;

    public AnomalyDetectionController(BaselineService baselineService,
                                      AnomalyDetectionService detectionService,
                                      AlertService alertService,
                                      ContextService contextService,
                                      ReportService reportService,
                                      MonitoringService monitoringService,
                                      AnomalyDetectionConfig config) {
        this.baselineService = baselineService;
        this.detectionService = detectionService;
        this.alertService = alertService;
        this.contextService = contextService;
        this.reportService = reportService;
        this.monitoringService = monitoringService;
        this.config = config;
    }

    @Operation(summary = "Calculate a metric baseline",
            description = "Buckets the metric's recent history and returns its statistics. Cached for 5 minutes. " +
                    "Returns a synthetic baseline (isMock=true) when the metric has no history.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", content = @Content(schema = @Schema(implementation = Baseline.class))),
            @ApiResponse(responseCode = "400", description = "Invalid parameter")
    })
    @GetMapping("/baseline")
    public ResponseEntity<?> getBaseline(
            @Parameter(description = "Metric name", example = "revenue")
            @RequestParam(defaultValue = "revenue") String metric,
            @Parameter(description = "Lookback window in days", example = "30")
            @RequestParam(required = false) Integer period,
            @Parameter(description = "Bucket granularity: hourly or daily", example = "daily")
            @RequestParam(required = false) String aggregation) {
        int periodDays = period != null ? period : config.getDefaults().getPeriodDays();
        if (!isValidPeriod(periodDays)) return periodOutOfRange();

        Aggregation agg = Aggregation.fromValue(
                aggregation != null ? aggregation : config.getDefaults().getAggregation());
        if (agg == null) return badRequest("aggregation must be one of: hourly, daily", "aggregation");

        Baseline baseline = baselineService.calculateBaseline(metric, periodDays, agg);
        return ResponseEntity.ok(baseline);
    }

    @Operation(summary = "Monitor latest values against baselines",
            description = "Compares each metric's most recent value with its baseline.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", content = @Content(array = @ArraySchema(schema = @Schema(implementation = MetricMonitorResult.class)))),
            @ApiResponse(responseCode = "400", description = "Invalid parameter")
    })
    @GetMapping("/monitor")
    public ResponseEntity<?> monitor(
            @Parameter(description = "Comma-separated metric names", example = "revenue,views")
            @RequestParam(required = false) String metrics,
            @Parameter(description = "Lookback window in days", example = "30")
            @RequestParam(required = false) Integer period) {
        int periodDays = period != null ? period : config.getDefaults().getPeriodDays();
        if (!isValidPeriod(periodDays)) return periodOutOfRange();

        List<MetricMonitorResult> results = monitoringService.monitorMetrics(
                parseMetrics(metrics, config.getMonitor().getDefaultMetrics()), periodDays);
        return ResponseEntity.ok(results);
    }

    @Operation(summary = "Detect anomalies in a metric",
            description = "Scores every bucket of the metric's daily baseline with the selected method " +
                    "(zscore, iqr, isolation, movingaverage). Returns the top 20 by severity.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", content = @Content(schema = @Schema(implementation = AnomalyDetectionResult.class))),
            @ApiResponse(responseCode = "400", description = "Invalid parameter")
    })
    @GetMapping("/detect")
    public ResponseEntity<?> detect(
            @Parameter(description = "Metric name", example = "revenue")
            @RequestParam(required = false) String metric,
            @Parameter(description = "Lookback window in days", example = "30")
            @RequestParam(required = false) Integer period,
            @Parameter(description = "Detection method", example = "zscore")
            @RequestParam(required = false) String method,
            @Parameter(description = "Method sensitivity (sigmas, or IQR fence multiplier)", example = "2.0")
            @RequestParam(required = false) Double threshold) {
        return runDetection(metric, period, method, threshold);
    }

    @Operation(summary = "Detect anomalies in a metric (JSON body)",
            description = "Same as GET /detect with parameters in the request body.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", content = @Content(schema = @Schema(implementation = AnomalyDetectionResult.class))),
            @ApiResponse(responseCode = "400", description = "Invalid parameter")
    })
    @PostMapping("/detect")
    public ResponseEntity<?> detectWithBody(@RequestBody Map<String, Object> body) {
        Object metric = body.get("metric");
        Object method = body.get("method");
        return runDetection(
                metric != null ? metric.toString() : null,
                toInteger(body, "period"),
                method != null ? method.toString() : null,
                toDouble(body, "threshold"));
    }

    @Operation(summary = "Generate alerts from detection results",
            description = "Raises an alert for every anomaly at or above minSeverity, most severe first.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", content = @Content(array = @ArraySchema(schema = @Schema(implementation = Alert.class)))),
            @ApiResponse(responseCode = "400", description = "Invalid parameter")
    })
    @PostMapping("/alerts")
    public ResponseEntity<?> generateAlerts(@RequestBody AlertGenerationRequest request) {
        if (request.getAnomalyResults() == null) {
            return badRequest("anomalyResults is required", "anomalyResults");
        }
        SeverityLevel minSeverity = SeverityLevel.fromValue(
                request.getMinSeverity() != null ? request.getMinSeverity() : config.getDefaults().getMinSeverity());
        if (minSeverity == null) {
            return badRequest("minSeverity must be one of: low, medium, high, critical", "minSeverity");
        }

        List<Alert> alerts = alertService.generateAlerts(request.getAnomalyResults(), minSeverity);
        return ResponseEntity.ok(alerts);
    }

    @Operation(summary = "Get context around an anomaly",
            description = "Returns the metric's samples within +/- period days of the anomaly, related metrics by date, " +
                    "and the trend across the window.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", content = @Content(schema = @Schema(implementation = AnomalyContext.class))),
            @ApiResponse(responseCode = "400", description = "Invalid parameter")
    })
    @GetMapping("/context/{metric}")
    public ResponseEntity<?> getContext(
            @Parameter(description = "Metric name", example = "revenue")
            @PathVariable String metric,
            @Parameter(description = "Anomaly timestamp in epoch milliseconds", example = "1739836800000")
            @RequestParam(required = false) Long timestamp,
            @Parameter(description = "Days on each side of the anomaly", example = "7")
            @RequestParam(required = false) Integer period) {
        if (timestamp == null) return badRequest("timestamp is required", "timestamp");
        int windowDays = period != null ? period : config.getContext().getDefaultWindowDays();
        if (!isValidPeriod(windowDays)) return periodOutOfRange();

        AnomalyContext context = contextService.getContext(metric, timestamp, windowDays);
        return ResponseEntity.ok(context);
    }

    @Operation(summary = "Build an anomaly report",
            description = "Runs z-score detection (threshold 2) over each metric and aggregates counts, " +
                    "alerts (medium and above), insights and recommendations.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", content = @Content(schema = @Schema(implementation = AnomalyReport.class))),
            @ApiResponse(responseCode = "400", description = "Invalid parameter")
    })
    @GetMapping("/report")
    public ResponseEntity<?> getReport(
            @Parameter(description = "Comma-separated metric names", example = "revenue,views,engagement_rate")
            @RequestParam(required = false) String metrics,
            @Parameter(description = "Lookback window in days", example = "30")
            @RequestParam(required = false) Integer period) {
        int periodDays = period != null ? period : config.getDefaults().getPeriodDays();
        if (!isValidPeriod(periodDays)) return periodOutOfRange();

        AnomalyReport report = reportService.buildReport(
                parseMetrics(metrics, config.getReport().getDefaultMetrics()), periodDays);
        return ResponseEntity.ok(report);
    }

    @Operation(summary = "Get a short anomaly summary",
            description = "Severity counts from the default report metrics.")
    @GetMapping("/summary")
    public ResponseEntity<?> getSummary(
            @Parameter(description = "Lookback window in days", example = "30")
            @RequestParam(required = false) Integer period) {
        int periodDays = period != null ? period : config.getDefaults().getPeriodDays();
        if (!isValidPeriod(periodDays)) return periodOutOfRange();

        AnomalyReport report = reportService.buildReport(config.getReport().getDefaultMetrics(), periodDays);
        long unacknowledgedCritical = report.getAlerts().stream()
                .filter(a -> a.getSeverity() == SeverityLevel.CRITICAL && !a.isAcknowledged())
                .count();

        Map<String, Object> response = new LinkedHashMap<>();
        response.put("period", report.getPeriod());
        response.put("totalAnomalies", report.getSummary().getTotalAnomalies());
        response.put("criticalCount", report.getSummary().getCriticalCount());
        response.put("highCount", report.getSummary().getHighCount());
        response.put("mediumCount", report.getSummary().getMediumCount());
        response.put("lowCount", report.getSummary().getLowCount());
        response.put("metricsAnalyzed", report.getMetrics().size());
        response.put("unacknowledgedCritical", unacknowledgedCritical);
        response.put("generatedAt", report.getGeneratedAt());
        return ResponseEntity.ok(response);
    }

    @Operation(summary = "List known metrics")
    @GetMapping("/metrics")
    public ResponseEntity<List<Map<String, Object>>> getMetrics() {
        List<Map<String, Object>> metrics = config.getMetrics().entrySet().stream()
                .map(entry -> {
                    Map<String, Object> info = new LinkedHashMap<>();
                    info.put("name", entry.getKey());
                    info.put("displayName", entry.getValue().getDisplayName());
                    info.put("description", entry.getValue().getDescription());
                    return info;
                })
                .collect(Collectors.toList());
        return ResponseEntity.ok(metrics);
    }

    @Operation(summary = "List detection methods")
    @GetMapping("/methods")
    public ResponseEntity<List<Map<String, Object>>> getMethods() {
        List<Map<String, Object>> methods = Arrays.stream(DetectionMethod.values())
                .map(method -> {
                    Map<String, Object> info = new LinkedHashMap<>();
                    info.put("name", method.getValue());
                    info.put("displayName", method.getDisplayName());
                    info.put("description", method.getDescription());
                    return info;
                })
                .collect(Collectors.toList());
        return ResponseEntity.ok(methods);
    }

    @Operation(summary = "Clear the baseline cache")
    @PostMapping("/cache/clear")
    public ResponseEntity<Map<String, Object>> clearCache() {
        baselineService.clearCache();
        return ResponseEntity.ok(Map.of("message", "Cache cleared successfully"));
    }

    private ResponseEntity<?> runDetection(String metric, Integer period, String method, Double threshold) {
        if (metric == null || metric.isBlank()) return badRequest("metric is required", "metric");

        int periodDays = period != null ? period : config.getDefaults().getPeriodDays();
        if (!isValidPeriod(periodDays)) return periodOutOfRange();

        DetectionMethod detectionMethod = DetectionMethod.fromValue(
                method != null ? method : config.getDefaults().getMethod());
        if (detectionMethod == null) {
            return badRequest("method must be one of: zscore, iqr, isolation, movingaverage", "method");
        }

        double sensitivity = threshold != null ? threshold : config.getDefaults().getThreshold();
        if (sensitivity < 0) return badRequest("threshold must be >= 0", "threshold");

        AnomalyDetectionResult result = detectionService.detect(metric, periodDays, detectionMethod, sensitivity);
        return ResponseEntity.ok(result);
    }

    private List<String> parseMetrics(String csv, List<String> defaults) {
        if (csv == null || csv.isBlank()) {
            return new ArrayList<>(defaults);
        }
        return Arrays.stream(csv.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .distinct()
                .collect(Collectors.toList());
    }

    private boolean isValidPeriod(int days) {
        return days > 0 && days <= config.getDefaults().getMaxPeriodDays();
    }

    private ResponseEntity<Map<String, String>> periodOutOfRange() {
        return badRequest("period must be between 1 and " + config.getDefaults().getMaxPeriodDays(), "period");
    }

    private ResponseEntity<Map<String, String>> badRequest(String error, String field) {
        return ResponseEntity.badRequest().body(Map.of("error", error, "field", field));
    }

    private Integer toInteger(Map<String, Object> body, String key) {
        Object v = body.get(key);
        if (v == null) return null;
        if (v instanceof Number n) return n.intValue();
        try { return Integer.parseInt(v.toString()); } catch (NumberFormatException e) { return null; }
    }

    private Double toDouble(Map<String, Object> body, String key) {
        Object v = body.get(key);
        if (v == null) return null;
        if (v instanceof Number n) return n.doubleValue();
        try { return Double.parseDouble(v.toString()); } catch (NumberFormatException e) { return null; }
    }
}
