package com.marketing.anomaly.repository;

import com.marketing.anomaly.model.MetricSample;

import java.util.List;

/**
 * Read-only view of the metric time-series store.
 * Implementations throw {@link com.marketing.anomaly.exception.MetricSourceException} when the
 * store cannot be reached.
 */
public interface MetricSource {

    /**
     * Samples of a metric with {@code fromMillis <= timestamp <= toMillis}, ascending by timestamp.
     */
    List<MetricSample> query(String metric, long fromMillis, long toMillis);

    /**
     * Most recent sample of a metric, or null if the metric has none.
     */
    MetricSample latest(String metric);
}
