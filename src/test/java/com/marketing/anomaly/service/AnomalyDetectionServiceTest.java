package com.marketing.anomaly.service;

import com.marketing.anomaly.config.AnomalyDetectionConfig;
import com.marketing.anomaly.config.MetricsConfig;
import com.marketing.anomaly.engine.DetectionEngine;
import com.marketing.anomaly.engine.DeviationAnalyzer;
import com.marketing.anomaly.engine.StatisticsCalculator;
import com.marketing.anomaly.engine.detectors.IqrDetector;
import com.marketing.anomaly.engine.detectors.ModifiedZScoreDetector;
import com.marketing.anomaly.engine.detectors.MovingAverageDetector;
import com.marketing.anomaly.engine.detectors.ZScoreDetector;
import com.marketing.anomaly.model.Aggregation;
import com.marketing.anomaly.model.Anomaly;
import com.marketing.anomaly.model.AnomalyDetectionResult;
import com.marketing.anomaly.model.Baseline;
import com.marketing.anomaly.model.DetectionMethod;
import com.marketing.anomaly.model.SeverityLevel;
import com.marketing.anomaly.testutil.TestDataFactory;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class AnomalyDetectionServiceTest {

    @Mock
    private BaselineService baselineService;

    private final StatisticsCalculator calculator = new StatisticsCalculator();
    private SimpleMeterRegistry registry;
    private AnomalyDetectionService detectionService;

    @BeforeEach
    void setUp() {
        AnomalyDetectionConfig config = new AnomalyDetectionConfig();
        DetectionEngine engine = new DetectionEngine(
                List.of(new ZScoreDetector(), new IqrDetector(), new ModifiedZScoreDetector(),
                        new MovingAverageDetector(config)),
                new DeviationAnalyzer(config));
        registry = new SimpleMeterRegistry();
        detectionService = new AnomalyDetectionService(baselineService, engine, calculator, config,
                new MetricsConfig(registry), Clock.fixed(TestDataFactory.NOW, ZoneOffset.UTC));
    }

    private void givenBaseline(String metric, List<Double> values, boolean mock) {
        when(baselineService.calculateBaseline(metric, 30, Aggregation.DAILY))
                .thenReturn(TestDataFactory.createBaseline(metric, values, calculator.calculate(values), mock));
    }

    @Test
    void detect_spikeAtEnd_flagsFinalPointWithPositiveScore() {
        givenBaseline("revenue", List.of(10.0, 10.0, 10.0, 10.0, 10.0, 10.0, 50.0), false);

        AnomalyDetectionResult result = detectionService.detect("revenue", 30, DetectionMethod.Z_SCORE, 2.0);

        assertThat(result.getTotalAnomalies()).isEqualTo(1);
        Anomaly anomaly = result.getAnomalies().get(0);
        assertThat(anomaly.getValue()).isEqualTo(50.0);
        assertThat(anomaly.getScore()).isPositive();
        assertThat(result.countFor(SeverityLevel.MEDIUM)).isEqualTo(1);
        assertThat(result.getMethod()).isEqualTo(DetectionMethod.Z_SCORE);
        assertThat(result.getThreshold()).isEqualTo(2.0);
        assertThat(result.getPeriod()).isEqualTo(30);
        assertThat(result.isMockBaseline()).isFalse();
        assertThat(result.getDetectedAt()).isEqualTo(TestDataFactory.NOW.toEpochMilli());
    }

    @Test
    void detect_manyAnomalies_truncatesListButCountsAll() {
        List<Double> values = new ArrayList<>();
        for (int i = 1; i <= 30; i++) {
            values.add((double) i);
        }
        givenBaseline("views", values, false);

        // threshold 0 flags every point that is not exactly the mean (15.5)
        AnomalyDetectionResult result = detectionService.detect("views", 30, DetectionMethod.Z_SCORE, 0.0);

        assertThat(result.getTotalAnomalies()).isEqualTo(30);
        assertThat(result.getAnomalies()).hasSize(20);
        int counted = result.getSeverityCounts().values().stream().mapToInt(Integer::intValue).sum();
        assertThat(counted).isEqualTo(30);
    }

    @Test
    void detect_anomaliesSortedBySeverityScoreDescending() {
        givenBaseline("views", List.of(100.0, 102.0, 98.0, 300.0, 101.0, 99.0, 20.0, 100.0, 250.0), false);

        AnomalyDetectionResult result = detectionService.detect("views", 30, DetectionMethod.Z_SCORE, 0.5);

        assertThat(result.getAnomalies()).hasSizeGreaterThan(1);
        assertThat(result.getAnomalies())
                .isSortedAccordingTo(Comparator.comparingDouble((Anomaly a) -> a.getSeverity().getScore()).reversed());
    }

    @Test
    void detect_syntheticBaseline_isFlaggedOnResult() {
        givenBaseline("ctr", List.of(2.0, 2.1, 1.9), true);

        AnomalyDetectionResult result = detectionService.detect("ctr", 30, DetectionMethod.IQR, 1.5);

        assertThat(result.isMockBaseline()).isTrue();
    }

    @Test
    void detect_isolationMethod_usesModifiedZScore() {
        givenBaseline("revenue", List.of(10.0, 10.0, 10.0, 10.0, 10.0, 10.0, 50.0), false);

        AnomalyDetectionResult result = detectionService.detect("revenue", 30, DetectionMethod.MODIFIED_Z_SCORE, 3.5);

        assertThat(result.getTotalAnomalies()).isEqualTo(1);
        assertThat(result.getAnomalies().get(0).getMethod()).isEqualTo(DetectionMethod.MODIFIED_Z_SCORE);
        assertThat(result.getAnomalies().get(0).getSeverity().getLevel()).isEqualTo(SeverityLevel.CRITICAL);
    }

    @Test
    void detect_emptyResult_hasZeroCounts() {
        givenBaseline("spend", List.of(200.0, 200.0, 200.0), false);

        AnomalyDetectionResult result = detectionService.detect("spend", 30, DetectionMethod.Z_SCORE, 2.0);

        assertThat(result.getTotalAnomalies()).isZero();
        assertThat(result.getAnomalies()).isEmpty();
        assertThat(result.countFor(SeverityLevel.LOW)).isZero();
    }

    @Test
    void detect_recordsMetrics() {
        givenBaseline("revenue", List.of(10.0, 10.0, 10.0, 10.0, 10.0, 10.0, 50.0), false);

        detectionService.detect("revenue", 30, DetectionMethod.Z_SCORE, 2.0);

        assertThat(registry.get("detection.count").tag("method", "zscore").counter().count()).isEqualTo(1.0);
        assertThat(registry.get("detection.anomalies").tag("method", "zscore").summary().totalAmount()).isEqualTo(1.0);
    }

    @Test
    void detect_baselineFailure_propagates() {
        when(baselineService.calculateBaseline("revenue", 30, Aggregation.DAILY))
                .thenThrow(new IllegalStateException("boom"));

        assertThatThrownBy(() -> detectionService.detect("revenue", 30, DetectionMethod.Z_SCORE, 2.0))
                .isInstanceOf(IllegalStateException.class);
    }
}
