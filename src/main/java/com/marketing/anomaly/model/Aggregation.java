package com.marketing.anomaly.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.time.temporal.ChronoUnit;

/**
 * Bucket granularity used when rolling raw samples up into a baseline series.
 */
public enum Aggregation {
    HOURLY("hourly", ChronoUnit.HOURS),
    DAILY("daily", ChronoUnit.DAYS);

    private final String value;
    private final ChronoUnit bucketUnit;

    Aggregation(String value, ChronoUnit bucketUnit) {
        this.value = value;
        this.bucketUnit = bucketUnit;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public ChronoUnit getBucketUnit() {
        return bucketUnit;
    }

    /**
     * Resolve a wire value (case-insensitive). Returns null for unknown values.
     */
    @JsonCreator
    public static Aggregation fromValue(String value) {
        if (value == null) return null;
        for (Aggregation aggregation : values()) {
            if (aggregation.value.equalsIgnoreCase(value.trim())) {
                return aggregation;
            }
        }
        return null;
    }
}
