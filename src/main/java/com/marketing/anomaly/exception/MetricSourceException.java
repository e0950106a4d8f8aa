package com.marketing.anomaly.exception;

/**
 * The time-series store could not be read (connectivity, timeout, scan failure).
 *
 * <p>Callers convert this into a degraded result where a fallback exists: synthetic baselines,
 * a zero latest value, an empty context window, or a metric excluded from a report.
 */
public class MetricSourceException extends RuntimeException {

    public MetricSourceException(String message, Throwable cause) {
        super(message, cause);
    }

    public MetricSourceException(String message) {
        super(message);
    }
}
