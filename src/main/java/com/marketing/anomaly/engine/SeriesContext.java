package com.marketing.anomaly.engine;

import com.marketing.anomaly.model.Statistics;
import lombok.Builder;
import lombok.Data;

import java.util.List;

/**
 * Series-level data computed once per detection run and shared by every point evaluation.
 */
@Data
@Builder
public class SeriesContext {
    // Bucket values, ascending by time
    private List<Double> values;

    // Bucket start times, parallel to values
    private List<Long> timestamps;

    private Statistics statistics;

    // Mean absolute deviation from the median, for the modified z-score
    private double meanAbsoluteDeviation;
}
