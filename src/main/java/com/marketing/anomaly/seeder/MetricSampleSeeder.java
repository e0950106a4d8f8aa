package com.marketing.anomaly.seeder;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.Bin;
import com.aerospike.client.Key;
import com.aerospike.client.policy.WritePolicy;
import com.marketing.anomaly.config.AerospikeConfig;
import com.marketing.anomaly.config.AnomalyDetectionConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.CommandLineRunner;
import org.springframework.context.annotation.Profile;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.time.DayOfWeek;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;
import java.util.Random;

/**
 * Seeds Aerospike with hourly marketing metric samples for local testing.
 * Only runs when the "seed" Spring profile is active.
 *
 * Run with:  mvn spring-boot:run -Dspring-boot.run.profiles=seed
 *
 * Every metric in the catalog gets 60 days of hourly samples around its synthetic base value,
 * with a daytime peak and weekend dip. Revenue and views get a spike and a drop injected
 * in the last 2 days so the detectors have something to find.
 */
@Component
@Profile("seed")
@Order(1)
public class MetricSampleSeeder implements CommandLineRunner {

    private static final Logger log = LoggerFactory.getLogger(MetricSampleSeeder.class);

    private static final int DAYS = 60;
    private static final int HOURS_PER_DAY = 24;

    private final AerospikeClient client;
    private final String namespace;
    private final WritePolicy writePolicy;
    private final AnomalyDetectionConfig config;
    private final Random random = new Random(42); // fixed seed for reproducibility

    public MetricSampleSeeder(AerospikeClient client,
                              @Qualifier("aerospikeNamespace") String namespace,
                              WritePolicy writePolicy,
                              AnomalyDetectionConfig config) {
        this.client = client;
        this.namespace = namespace;
        this.writePolicy = writePolicy;
        this.config = config;
    }

    @Override
    public void run(String... args) throws Exception {
        log.info("=== Starting metric sample seeding ===");

        Instant end = Instant.now().truncatedTo(ChronoUnit.HOURS);
        Instant start = end.minus(DAYS, ChronoUnit.DAYS);
        int total = 0;

        for (String metric : config.getMetrics().keySet()) {
            total += seedMetric(metric, start, end);
        }

        log.info("=== Metric sample seeding complete: {} samples ===", total);
    }

    private int seedMetric(String metric, Instant start, Instant end) {
        AnomalyDetectionConfig.MetricDefinition definition = config.definitionFor(metric);
        // Hourly share of the daily figure
        double hourlyBase = definition.getSyntheticBaseValue() / HOURS_PER_DAY;
        double hourlyNoise = definition.getSyntheticVariance() / HOURS_PER_DAY;

        boolean injectAnomalies = "revenue".equals(metric) || "views".equals(metric);
        long anomalyStartMillis = end.minus(2, ChronoUnit.DAYS).toEpochMilli();

        int count = 0;
        for (Instant ts = start; ts.isBefore(end); ts = ts.plus(1, ChronoUnit.HOURS)) {
            int hour = ts.atZone(ZoneOffset.UTC).getHour();
            DayOfWeek day = ts.atZone(ZoneOffset.UTC).getDayOfWeek();

            // Peak mid-afternoon, trough overnight
            double diurnal = 1.0 + 0.5 * Math.sin((hour - 9) * Math.PI / 12);
            double weekly = (day == DayOfWeek.SATURDAY || day == DayOfWeek.SUNDAY) ? 0.7 : 1.0;
            double value = hourlyBase * diurnal * weekly + random.nextGaussian() * hourlyNoise;

            long millis = ts.toEpochMilli();
            if (injectAnomalies && millis >= anomalyStartMillis) {
                // Day -2 spikes, day -1 collapses
                value *= millis < anomalyStartMillis + ChronoUnit.DAYS.getDuration().toMillis() ? 4.0 : 0.2;
            }

            writeSample(metric, millis, Math.max(0, Math.round(value * 100.0) / 100.0));
            count++;
        }

        log.info("  {} - {} hourly samples seeded{}", metric, count, injectAnomalies ? " (with injected anomalies)" : "");
        return count;
    }

    private void writeSample(String metric, long timestamp, double value) {
        Key key = new Key(namespace, AerospikeConfig.SET_METRIC_SAMPLES, metric + ":" + timestamp);
        client.put(writePolicy, key,
                new Bin("metric", metric),
                new Bin("timestamp", timestamp),
                new Bin("value", value));
    }
}
