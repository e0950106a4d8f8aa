package com.marketing.anomaly.config;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicInteger;

@Component
public class MetricsConfig {

    private final MeterRegistry registry;
    private final AtomicInteger cachedBaselineCount;

    public MetricsConfig(MeterRegistry registry) {
        this.registry = registry;
        this.cachedBaselineCount = registry.gauge("baseline.cache.size", new AtomicInteger(0));
    }

    public void recordDetection(String method, int anomalyCount) {
        Counter.builder("detection.count")
                .tag("method", method)
                .register(registry)
                .increment();

        DistributionSummary.builder("detection.anomalies")
                .tag("method", method)
                .register(registry)
                .record(anomalyCount);
    }

    public void recordBaselineCacheLookup(boolean hit) {
        Counter.builder("baseline.cache.lookup")
                .tag("result", hit ? "hit" : "miss")
                .register(registry)
                .increment();
    }

    public void recordSyntheticBaseline(String metric, String reason) {
        Counter.builder("baseline.synthetic.count")
                .tag("metric", metric)
                .tag("reason", reason)
                .register(registry)
                .increment();
    }

    public void recordAlert(String severity) {
        Counter.builder("alert.generated.count")
                .tag("severity", severity)
                .register(registry)
                .increment();
    }

    public void recordReportFailure(String metric) {
        Counter.builder("report.metric.failure.count")
                .tag("metric", metric)
                .register(registry)
                .increment();
    }

    public void updateCachedBaselineCount(int count) {
        cachedBaselineCount.set(count);
    }
}
