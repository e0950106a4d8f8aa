package com.marketing.anomaly.engine;

import com.marketing.anomaly.model.DetectionMethod;

/**
 * Interface for all point-level outlier detectors.
 * Each implementation handles a specific DetectionMethod.
 */
public interface PointDetector {

    /**
     * The detection method this detector implements.
     */
    DetectionMethod getSupportedMethod();

    /**
     * Score the point at {@code index} of the series.
     *
     * @param series    the full series with precomputed statistics
     * @param index     position of the point in {@code series.getValues()}
     * @param threshold method-specific sensitivity (sigma count or fence multiplier)
     * @return the point's score and whether it is anomalous
     */
    PointScore score(SeriesContext series, int index, double threshold);
}
