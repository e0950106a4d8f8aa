package com.marketing.anomaly.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Data
@Configuration
@ConfigurationProperties(prefix = "anomaly")
public class AnomalyDetectionConfig {

    // Zone used to cut samples into calendar-day / hour buckets and to key context dates
    private String zoneId = "UTC";

    private Cache cache = new Cache();

    // Call-site defaults applied at the HTTP boundary. The engine itself takes explicit arguments.
    private Defaults defaults = new Defaults();

    private Detection detection = new Detection();

    private Report report = new Report();

    private Context context = new Context();

    private Monitor monitor = new Monitor();

    // Known metrics: display names for alert messages and synthetic baseline parameters.
    // Metrics missing from the catalog fall back to syntheticDefaults.
    private Map<String, MetricDefinition> metrics = defaultMetricCatalog();

    private MetricDefinition syntheticDefaults = new MetricDefinition(null, null, 100.0, 20.0);

    /**
     * Catalog entry for a metric, or a definition built from the synthetic defaults when the
     * metric is not configured.
     */
    public MetricDefinition definitionFor(String metric) {
        MetricDefinition definition = metrics.get(metric);
        if (definition != null) {
            return definition;
        }
        return new MetricDefinition(metric, null,
                syntheticDefaults.getSyntheticBaseValue(), syntheticDefaults.getSyntheticVariance());
    }

    public String displayNameFor(String metric) {
        MetricDefinition definition = metrics.get(metric);
        if (definition == null || definition.getDisplayName() == null) {
            return metric;
        }
        return definition.getDisplayName();
    }

    @Data
    public static class Cache {
        private long ttlMinutes = 5;
        private int evictionIntervalMinutes = 10;
    }

    @Data
    public static class Defaults {
        private int periodDays = 30;
        // Upper bound on any requested lookback or context window
        private int maxPeriodDays = 365;
        private String aggregation = "daily";
        private String method = "zscore";
        private double threshold = 2.0;
        private String minSeverity = "medium";
    }

    @Data
    public static class Detection {
        // Presentation limit on returned anomalies; totals always reflect the full count
        private int maxAnomaliesReturned = 20;
        private int movingAverageWindow = 7;
        // Tukey multiplier used by the deviation analyzer's outlier fence
        private double outlierFenceMultiplier = 1.5;
    }

    @Data
    public static class Report {
        private List<String> defaultMetrics = List.of("revenue", "views", "engagement_rate");
        private String method = "zscore";
        private double threshold = 2.0;
        private String minSeverity = "medium";
        // Alerts deviating more than this (and not critical) are reported as opportunities
        private double positiveDeviationPct = 50.0;
    }

    @Data
    public static class Context {
        private int defaultWindowDays = 7;
        private List<String> relatedMetrics = List.of("views", "engagement_rate", "conversions", "spend");
        private double trendThresholdPct = 5.0;
    }

    @Data
    public static class Monitor {
        private List<String> defaultMetrics = List.of("revenue", "views", "engagement_rate");
        private double standardScoreThreshold = 2.0;
        private double percentDeviationThreshold = 50.0;
    }

    @Data
    public static class MetricDefinition {
        private String displayName;
        private String description;
        private double syntheticBaseValue;
        private double syntheticVariance;

        public MetricDefinition() {
        }

        public MetricDefinition(String displayName, String description,
                                double syntheticBaseValue, double syntheticVariance) {
            this.displayName = displayName;
            this.description = description;
            this.syntheticBaseValue = syntheticBaseValue;
            this.syntheticVariance = syntheticVariance;
        }
    }

    private static Map<String, MetricDefinition> defaultMetricCatalog() {
        Map<String, MetricDefinition> catalog = new LinkedHashMap<>();
        catalog.put("revenue", new MetricDefinition("Revenue", "Total revenue", 500, 100));
        catalog.put("views", new MetricDefinition("Views", "Content views", 10000, 2000));
        catalog.put("engagement_rate", new MetricDefinition("Engagement Rate", "Engagement percentage", 5, 1));
        catalog.put("conversions", new MetricDefinition("Conversions", "Number of conversions", 50, 15));
        catalog.put("ctr", new MetricDefinition("Click-Through Rate", "CTR percentage", 2, 0.5));
        catalog.put("spend", new MetricDefinition("Ad Spend", "Advertising spend", 200, 50));
        return catalog;
    }
}
