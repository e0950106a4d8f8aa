package com.marketing.anomaly.engine;

/**
 * Outcome of scoring one point of a series.
 *
 * @param score     signed, unrounded method score (0 when the method cannot score the point)
 * @param anomalous whether the point crosses the method's threshold
 */
public record PointScore(double score, boolean anomalous) {

    public static PointScore notScored() {
        return new PointScore(0.0, false);
    }
}
