package com.marketing.anomaly.service;

import com.marketing.anomaly.config.AnomalyDetectionConfig;
import com.marketing.anomaly.config.MetricsConfig;
import com.marketing.anomaly.engine.StatisticsCalculator;
import com.marketing.anomaly.exception.MetricSourceException;
import com.marketing.anomaly.model.Aggregation;
import com.marketing.anomaly.model.Baseline;
import com.marketing.anomaly.model.MetricSample;
import com.marketing.anomaly.repository.BaselineCache;
import com.marketing.anomaly.repository.MetricSource;
import io.micrometer.observation.annotation.Observed;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Random;
import java.util.TreeMap;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

import static com.marketing.anomaly.engine.StatisticsCalculator.round2;

@Service
public class BaselineService {

    private static final Logger log = LoggerFactory.getLogger(BaselineService.class);

    private final MetricSource metricSource;
    private final BaselineCache baselineCache;
    private final StatisticsCalculator statisticsCalculator;
    private final AnomalyDetectionConfig config;
    private final MetricsConfig metricsConfig;
    private final Clock clock;
    private final ZoneId zone;
    private final Random random = new Random();

    public BaselineService(MetricSource metricSource,
                           BaselineCache baselineCache,
                           StatisticsCalculator statisticsCalculator,
                           AnomalyDetectionConfig config,
                           MetricsConfig metricsConfig,
                           Clock clock) {
        this.metricSource = metricSource;
        this.baselineCache = baselineCache;
        this.statisticsCalculator = statisticsCalculator;
        this.config = config;
        this.metricsConfig = metricsConfig;
        this.clock = clock;
        this.zone = ZoneId.of(config.getZoneId());
    }

    /**
     * Baseline for a metric over the last {@code periodDays}, served from cache while fresh.
     * Falls back to a synthetic baseline (flagged mock) when the metric has no history or the
     * store cannot be read; the latter is not cached so the next call retries the store.
     */
    @Observed(name = "baseline.calculate", contextualName = "calculate-baseline")
    public Baseline calculateBaseline(String metric, int periodDays, Aggregation aggregation) {
        BaselineCache.Key key = new BaselineCache.Key(metric, periodDays, aggregation);

        Optional<Baseline> cached = baselineCache.get(key);
        metricsConfig.recordBaselineCacheLookup(cached.isPresent());
        if (cached.isPresent()) {
            return cached.get();
        }

        Baseline baseline;
        try {
            baseline = withSyntheticFallback(metric, periodDays,
                    () -> computeBaseline(metric, periodDays, aggregation));
        } catch (MetricSourceException e) {
            log.error("Baseline read failed for {} ({} days, {}), serving synthetic baseline: {}",
                    metric, periodDays, aggregation.getValue(), e.getMessage(), e);
            metricsConfig.recordSyntheticBaseline(metric, "source_failure");
            return generateSyntheticBaseline(metric, periodDays);
        }

        baselineCache.put(key, baseline);
        metricsConfig.updateCachedBaselineCount(baselineCache.size());
        return baseline;
    }

    /**
     * Baseline computed from stored samples only. Empty when the metric has no samples in the
     * window; never fabricates data.
     *
     * @throws MetricSourceException if the store cannot be read
     */
    public Optional<Baseline> computeBaseline(String metric, int periodDays, Aggregation aggregation) {
        long now = clock.millis();
        long from = now - TimeUnit.DAYS.toMillis(periodDays);
        List<MetricSample> samples = metricSource.query(metric, from, now);

        // bucket start (epoch ms) -> summed value, ascending
        Map<Long, Double> buckets = new TreeMap<>();
        for (MetricSample sample : samples) {
            if (sample.getTimestamp() < from) continue;
            buckets.merge(bucketStart(sample.getTimestamp(), aggregation), sample.getValue(), Double::sum);
        }

        if (buckets.isEmpty()) {
            log.info("No samples for {} in the last {} days", metric, periodDays);
            return Optional.empty();
        }

        // Baselines are shared through the cache, so the series is published read-only
        List<Double> values = List.copyOf(buckets.values());
        List<Long> timestamps = List.copyOf(buckets.keySet());

        return Optional.of(Baseline.builder()
                .metric(metric)
                .period(periodDays)
                .aggregation(aggregation)
                .dataPoints(values.size())
                .statistics(statisticsCalculator.calculate(values))
                .values(values)
                .timestamps(timestamps)
                .calculatedAt(now)
                .mock(false)
                .build());
    }

    /**
     * Run a baseline computation and substitute a synthetic baseline when it yields nothing.
     */
    public Baseline withSyntheticFallback(String metric, int periodDays,
                                          Supplier<Optional<Baseline>> computation) {
        return computation.get().orElseGet(() -> {
            metricsConfig.recordSyntheticBaseline(metric, "no_data");
            return generateSyntheticBaseline(metric, periodDays);
        });
    }

    /**
     * Daily synthetic series of {@code periodDays} points ending yesterday: the metric's declared
     * base value with a weekly sine wave and uniform noise, clamped at zero.
     */
    public Baseline generateSyntheticBaseline(String metric, int periodDays) {
        AnomalyDetectionConfig.MetricDefinition definition = config.definitionFor(metric);
        double baseValue = definition.getSyntheticBaseValue();
        double variance = definition.getSyntheticVariance();

        Instant now = clock.instant();
        List<Double> values = new ArrayList<>(periodDays);
        List<Long> timestamps = new ArrayList<>(periodDays);
        for (int i = 0; i < periodDays; i++) {
            double trend = Math.sin(i / 7.0) * (variance * 0.3);
            double noise = (random.nextDouble() - 0.5) * variance * 0.5;
            values.add(Math.max(0.0, round2(baseValue + trend + noise)));
            timestamps.add(now.minus(periodDays - i, ChronoUnit.DAYS).toEpochMilli());
        }

        log.warn("Serving synthetic baseline for {} ({} days): base={}, variance={}",
                metric, periodDays, baseValue, variance);

        return Baseline.builder()
                .metric(metric)
                .period(periodDays)
                .aggregation(Aggregation.DAILY)
                .dataPoints(periodDays)
                .statistics(statisticsCalculator.calculate(values))
                .values(List.copyOf(values))
                .timestamps(List.copyOf(timestamps))
                .calculatedAt(now.toEpochMilli())
                .mock(true)
                .build();
    }

    public void clearCache() {
        int size = baselineCache.size();
        baselineCache.clear();
        metricsConfig.updateCachedBaselineCount(0);
        log.info("Baseline cache cleared ({} entries dropped)", size);
    }

    @Scheduled(fixedRateString = "${anomaly.cache.eviction-interval-minutes:10}",
               timeUnit = TimeUnit.MINUTES,
               initialDelayString = "${anomaly.cache.eviction-interval-minutes:10}")
    public void evictExpiredBaselines() {
        int evicted = baselineCache.evictExpired();
        metricsConfig.updateCachedBaselineCount(baselineCache.size());
        if (evicted > 0) {
            log.debug("Evicted {} expired baselines, {} remain", evicted, baselineCache.size());
        }
    }

    private long bucketStart(long timestamp, Aggregation aggregation) {
        ZonedDateTime local = Instant.ofEpochMilli(timestamp).atZone(zone);
        return local.truncatedTo(aggregation.getBucketUnit()).toInstant().toEpochMilli();
    }
}
