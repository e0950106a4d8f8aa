package com.marketing.anomaly.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum TrendDirection {
    INCREASING,
    DECREASING,
    STABLE,
    UNKNOWN;

    @JsonValue
    public String getValue() {
        return name().toLowerCase();
    }
}
