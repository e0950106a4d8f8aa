package com.marketing.anomaly.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.List;

/**
 * Point-level outlier detection algorithms. All four share the same detector contract.
 *
 * MODIFIED_Z_SCORE is published under the wire name "isolation" for compatibility with existing
 * dashboards; it is a median-absolute-deviation score, not an isolation forest.
 */
public enum DetectionMethod {
    Z_SCORE("zscore", "Z-Score", "Standard deviation-based detection"),
    IQR("iqr", "IQR (Interquartile Range)", "Percentile-based detection"),
    MODIFIED_Z_SCORE("isolation", "Modified Z-Score", "Median Absolute Deviation",
            "modified_zscore", "mad"),
    MOVING_AVERAGE("movingaverage", "Moving Average", "Rolling window comparison",
            "moving_average");

    private final String value;
    private final String displayName;
    private final String description;
    private final List<String> aliases;

    DetectionMethod(String value, String displayName, String description, String... aliases) {
        this.value = value;
        this.displayName = displayName;
        this.description = description;
        this.aliases = List.of(aliases);
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public String getDisplayName() {
        return displayName;
    }

    public String getDescription() {
        return description;
    }

    /**
     * Resolve a wire value or alias (case-insensitive). Returns null for unknown values so the
     * calling boundary can reject the request.
     */
    @JsonCreator
    public static DetectionMethod fromValue(String value) {
        if (value == null) return null;
        String normalized = value.trim().toLowerCase();
        for (DetectionMethod method : values()) {
            if (method.value.equals(normalized) || method.aliases.contains(normalized)) {
                return method;
            }
        }
        return null;
    }
}
