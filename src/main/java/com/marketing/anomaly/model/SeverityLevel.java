package com.marketing.anomaly.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum SeverityLevel {
    LOW("low", 1, "#ffd60a"),
    MEDIUM("medium", 2, "#ffb020"),
    HIGH("high", 3, "#ff6b6b"),
    CRITICAL("critical", 4, "#f8312f");

    private final String value;
    private final int rank;
    private final String colorHint;

    SeverityLevel(String value, int rank, String colorHint) {
        this.value = value;
        this.rank = rank;
        this.colorHint = colorHint;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public int getRank() {
        return rank;
    }

    public String getColorHint() {
        return colorHint;
    }

    public boolean isAtLeast(SeverityLevel other) {
        return rank >= other.rank;
    }

    public static SeverityLevel fromScore(double score) {
        double abs = Math.abs(score);
        if (abs >= 4) return CRITICAL;
        if (abs >= 3) return HIGH;
        if (abs >= 2) return MEDIUM;
        return LOW;
    }

    @JsonCreator
    public static SeverityLevel fromValue(String value) {
        if (value == null) return null;
        for (SeverityLevel level : values()) {
            if (level.value.equalsIgnoreCase(value.trim())) {
                return level;
            }
        }
        return null;
    }
}
