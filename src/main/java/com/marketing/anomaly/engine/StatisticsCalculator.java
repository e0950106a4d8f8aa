package com.marketing.anomaly.engine;

import com.marketing.anomaly.model.Statistics;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Descriptive statistics over a numeric series.
 *
 * Percentiles use the nearest-rank index {@code floor(n * p)} on the sorted copy, without
 * interpolation. Historical anomaly thresholds were computed this way, so the rule must not be
 * swapped for an interpolated percentile.
 */
@Component
public class StatisticsCalculator {

    public Statistics calculate(List<Double> values) {
        int n = values.size();
        if (n == 0) {
            return Statistics.empty();
        }

        double sum = 0.0;
        for (double v : values) {
            sum += v;
        }
        double mean = sum / n;

        List<Double> sorted = new ArrayList<>(values);
        Collections.sort(sorted);
        double median = n % 2 == 0
                ? (sorted.get(n / 2 - 1) + sorted.get(n / 2)) / 2.0
                : sorted.get(n / 2);

        double sumSquaredDiffs = 0.0;
        for (double v : values) {
            double diff = v - mean;
            sumSquaredDiffs += diff * diff;
        }
        double variance = sumSquaredDiffs / n;
        double stdDev = Math.sqrt(variance);

        double min = sorted.get(0);
        double max = sorted.get(n - 1);
        double p25 = sorted.get((int) Math.floor(n * 0.25));
        double p75 = sorted.get((int) Math.floor(n * 0.75));

        return Statistics.builder()
                .mean(mean)
                .median(median)
                .stdDev(stdDev)
                .variance(variance)
                .min(min)
                .max(max)
                .percentile25(p25)
                .percentile75(p75)
                .coefficientOfVariation(mean > 0 ? (stdDev / mean) * 100.0 : 0.0)
                .range(max - min)
                .iqr(p75 - p25)
                .build();
    }

    /**
     * Mean of |x - median| over the series. Used as the spread estimate of the modified z-score.
     */
    public double meanAbsoluteDeviation(List<Double> values, double median) {
        if (values.isEmpty()) {
            return 0.0;
        }
        double sum = 0.0;
        for (double v : values) {
            sum += Math.abs(v - median);
        }
        return sum / values.size();
    }

    public static double round2(double value) {
        return Math.round(value * 100.0) / 100.0;
    }
}
