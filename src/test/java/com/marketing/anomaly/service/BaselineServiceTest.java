package com.marketing.anomaly.service;

import com.marketing.anomaly.config.AnomalyDetectionConfig;
import com.marketing.anomaly.config.MetricsConfig;
import com.marketing.anomaly.engine.StatisticsCalculator;
import com.marketing.anomaly.exception.MetricSourceException;
import com.marketing.anomaly.model.Aggregation;
import com.marketing.anomaly.model.Baseline;
import com.marketing.anomaly.repository.InMemoryBaselineCache;
import com.marketing.anomaly.repository.MetricSource;
import com.marketing.anomaly.testutil.TestDataFactory;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class BaselineServiceTest {

    @Mock
    private MetricSource metricSource;

    private SimpleMeterRegistry registry;
    private BaselineService baselineService;

    @BeforeEach
    void setUp() {
        AnomalyDetectionConfig config = new AnomalyDetectionConfig();
        Clock clock = Clock.fixed(TestDataFactory.NOW, ZoneOffset.UTC);
        registry = new SimpleMeterRegistry();
        baselineService = new BaselineService(metricSource,
                new InMemoryBaselineCache(config, clock),
                new StatisticsCalculator(),
                config,
                new MetricsConfig(registry),
                clock);
    }

    @Test
    void calculateBaseline_realData_notReplacedBySynthetic() {
        when(metricSource.query(eq("revenue"), anyLong(), anyLong()))
                .thenReturn(TestDataFactory.createDailySamples("revenue", 100, 120, 80));

        Baseline baseline = baselineService.calculateBaseline("revenue", 30, Aggregation.DAILY);

        assertThat(baseline.isMock()).isFalse();
        assertThat(baseline.getDataPoints()).isEqualTo(3);
        assertThat(baseline.getValues()).containsExactly(100.0, 120.0, 80.0);
        assertThat(baseline.getStatistics().getMean()).isEqualTo(100.0);
        assertThat(baseline.getCalculatedAt()).isEqualTo(TestDataFactory.NOW.toEpochMilli());
    }

    @Test
    void calculateBaseline_repeatedWithinTtl_servedFromCache() {
        when(metricSource.query(eq("revenue"), anyLong(), anyLong()))
                .thenReturn(TestDataFactory.createDailySamples("revenue", 100, 120, 80));

        Baseline first = baselineService.calculateBaseline("revenue", 30, Aggregation.DAILY);
        Baseline second = baselineService.calculateBaseline("revenue", 30, Aggregation.DAILY);

        assertThat(second).isSameAs(first);
        assertThat(second.getCalculatedAt()).isEqualTo(first.getCalculatedAt());
        verify(metricSource, times(1)).query(eq("revenue"), anyLong(), anyLong());
        assertThat(registry.get("baseline.cache.lookup").tag("result", "hit").counter().count()).isEqualTo(1.0);
    }

    @Test
    void calculateBaseline_cachedSeriesCannotBeChangedByCallers() {
        when(metricSource.query(eq("revenue"), anyLong(), anyLong()))
                .thenReturn(TestDataFactory.createDailySamples("revenue", 100, 120, 80));

        Baseline first = baselineService.calculateBaseline("revenue", 30, Aggregation.DAILY);
        assertThatThrownBy(() -> first.getValues().add(9999.0))
                .isInstanceOf(UnsupportedOperationException.class);
        assertThatThrownBy(() -> first.getTimestamps().clear())
                .isInstanceOf(UnsupportedOperationException.class);

        Baseline second = baselineService.calculateBaseline("revenue", 30, Aggregation.DAILY);
        assertThat(second.getValues()).hasSize(second.getDataPoints()).containsExactly(100.0, 120.0, 80.0);
        assertThat(second.getTimestamps()).hasSize(second.getDataPoints());
    }

    @Test
    void calculateBaseline_syntheticSeriesIsReadOnly() {
        when(metricSource.query(eq("revenue"), anyLong(), anyLong())).thenReturn(Collections.emptyList());

        Baseline baseline = baselineService.calculateBaseline("revenue", 30, Aggregation.DAILY);

        assertThatThrownBy(() -> baseline.getValues().add(1.0))
                .isInstanceOf(UnsupportedOperationException.class);
        assertThat(baselineService.calculateBaseline("revenue", 30, Aggregation.DAILY).getValues()).hasSize(30);
    }

    @Test
    void calculateBaseline_queriesRequestedWindow() {
        when(metricSource.query(eq("views"), anyLong(), anyLong())).thenReturn(Collections.emptyList());

        baselineService.calculateBaseline("views", 7, Aggregation.DAILY);

        long now = TestDataFactory.NOW.toEpochMilli();
        verify(metricSource).query("views", now - 7L * 24 * 60 * 60 * 1000, now);
    }

    @Test
    void calculateBaseline_noData_returnsSyntheticBaselineOfRequestedLength() {
        when(metricSource.query(eq("revenue"), anyLong(), anyLong())).thenReturn(Collections.emptyList());

        Baseline baseline = baselineService.calculateBaseline("revenue", 30, Aggregation.DAILY);

        assertThat(baseline.isMock()).isTrue();
        assertThat(baseline.getDataPoints()).isEqualTo(30);
        assertThat(baseline.getValues()).hasSize(30);
        assertThat(baseline.getTimestamps()).hasSize(30);
        assertThat(baseline.getAggregation()).isEqualTo(Aggregation.DAILY);
        // 500 +/- (0.3 * 100 trend + 0.25 * 100 noise)
        assertThat(baseline.getValues()).allSatisfy(v -> assertThat(v).isBetween(445.0, 555.0));
    }

    @Test
    void calculateBaseline_noData_syntheticBaselineIsCached() {
        when(metricSource.query(eq("revenue"), anyLong(), anyLong())).thenReturn(Collections.emptyList());

        Baseline first = baselineService.calculateBaseline("revenue", 30, Aggregation.DAILY);
        Baseline second = baselineService.calculateBaseline("revenue", 30, Aggregation.DAILY);

        assertThat(second).isSameAs(first);
        verify(metricSource, times(1)).query(eq("revenue"), anyLong(), anyLong());
    }

    @Test
    void calculateBaseline_storeFailure_servesSyntheticWithoutCaching() {
        when(metricSource.query(eq("revenue"), anyLong(), anyLong()))
                .thenThrow(new MetricSourceException("store down"));

        Baseline first = baselineService.calculateBaseline("revenue", 30, Aggregation.DAILY);
        Baseline second = baselineService.calculateBaseline("revenue", 30, Aggregation.DAILY);

        assertThat(first.isMock()).isTrue();
        assertThat(second.isMock()).isTrue();
        verify(metricSource, times(2)).query(eq("revenue"), anyLong(), anyLong());
        assertThat(registry.get("baseline.synthetic.count").tag("reason", "source_failure").counter().count())
                .isEqualTo(2.0);
    }

    @Test
    void calculateBaseline_dailyAggregation_sumsSamplesPerCalendarDay() {
        Instant day1 = Instant.parse("2026-02-27T00:00:00Z");
        Instant day2 = Instant.parse("2026-02-28T00:00:00Z");
        when(metricSource.query(eq("spend"), anyLong(), anyLong())).thenReturn(List.of(
                TestDataFactory.createSample("spend", day1.plus(1, ChronoUnit.HOURS), 5.0),
                TestDataFactory.createSample("spend", day1.plus(23, ChronoUnit.HOURS), 7.0),
                TestDataFactory.createSample("spend", day2.plus(10, ChronoUnit.HOURS), 3.0)));

        Baseline baseline = baselineService.calculateBaseline("spend", 30, Aggregation.DAILY);

        assertThat(baseline.getValues()).containsExactly(12.0, 3.0);
        assertThat(baseline.getTimestamps()).containsExactly(day1.toEpochMilli(), day2.toEpochMilli());
    }

    @Test
    void calculateBaseline_hourlyAggregation_sumsSamplesPerHour() {
        Instant hour = Instant.parse("2026-03-01T08:00:00Z");
        when(metricSource.query(eq("views"), anyLong(), anyLong())).thenReturn(List.of(
                TestDataFactory.createSample("views", hour.plus(5, ChronoUnit.MINUTES), 40.0),
                TestDataFactory.createSample("views", hour.plus(55, ChronoUnit.MINUTES), 60.0),
                TestDataFactory.createSample("views", hour.plus(65, ChronoUnit.MINUTES), 10.0)));

        Baseline baseline = baselineService.calculateBaseline("views", 1, Aggregation.HOURLY);

        assertThat(baseline.getAggregation()).isEqualTo(Aggregation.HOURLY);
        assertThat(baseline.getValues()).containsExactly(100.0, 10.0);
        assertThat(baseline.getTimestamps()).containsExactly(
                hour.toEpochMilli(), hour.plus(1, ChronoUnit.HOURS).toEpochMilli());
    }

    @Test
    void calculateBaseline_differentAggregations_cachedSeparately() {
        when(metricSource.query(eq("revenue"), anyLong(), anyLong()))
                .thenReturn(TestDataFactory.createDailySamples("revenue", 100, 120, 80));

        baselineService.calculateBaseline("revenue", 30, Aggregation.DAILY);
        baselineService.calculateBaseline("revenue", 30, Aggregation.HOURLY);

        verify(metricSource, times(2)).query(eq("revenue"), anyLong(), anyLong());
    }

    @Test
    void clearCache_forcesRecomputation() {
        when(metricSource.query(eq("revenue"), anyLong(), anyLong()))
                .thenReturn(TestDataFactory.createDailySamples("revenue", 100, 120, 80));

        baselineService.calculateBaseline("revenue", 30, Aggregation.DAILY);
        baselineService.clearCache();
        baselineService.calculateBaseline("revenue", 30, Aggregation.DAILY);

        verify(metricSource, times(2)).query(eq("revenue"), anyLong(), anyLong());
    }

    @Test
    void computeBaseline_noSamples_isEmpty() {
        when(metricSource.query(eq("ctr"), anyLong(), anyLong())).thenReturn(Collections.emptyList());

        Optional<Baseline> baseline = baselineService.computeBaseline("ctr", 30, Aggregation.DAILY);

        assertThat(baseline).isEmpty();
    }

    @Test
    void withSyntheticFallback_presentComputation_isReturnedUnchanged() {
        Baseline real = TestDataFactory.createBaseline("revenue", List.of(1.0), null, false);

        Baseline result = baselineService.withSyntheticFallback("revenue", 30, () -> Optional.of(real));

        assertThat(result).isSameAs(real);
        verifyNoInteractions(metricSource);
    }

    @Test
    void generateSyntheticBaseline_unknownMetric_usesDefaultParameters() {
        Baseline baseline = baselineService.generateSyntheticBaseline("newsletter_signups", 14);

        assertThat(baseline.isMock()).isTrue();
        assertThat(baseline.getValues()).hasSize(14);
        // 100 +/- (6 trend + 5 noise)
        assertThat(baseline.getValues()).allSatisfy(v -> assertThat(v).isBetween(89.0, 111.0));
    }

    @Test
    void generateSyntheticBaseline_endsYesterday() {
        Baseline baseline = baselineService.generateSyntheticBaseline("views", 10);

        List<Long> timestamps = baseline.getTimestamps();
        assertThat(timestamps.get(timestamps.size() - 1))
                .isEqualTo(TestDataFactory.NOW.minus(1, ChronoUnit.DAYS).toEpochMilli());
        assertThat(timestamps.get(0))
                .isEqualTo(TestDataFactory.NOW.minus(10, ChronoUnit.DAYS).toEpochMilli());
    }

    @Test
    void evictExpiredBaselines_emptyCache_isNoop() {
        baselineService.evictExpiredBaselines();

        assertThat(registry.get("baseline.cache.size").gauge().value()).isEqualTo(0.0);
    }
}
