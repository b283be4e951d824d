package com.finance.anomaly.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Severity of an anomaly, also used as the significance of a pattern.
 */
public enum Severity {
    LOW,
    MEDIUM,
    HIGH;

    @JsonValue
    public String toJson() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static Severity fromJson(String value) {
        if (value == null) return null;
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }

    /**
     * Mapping shared by the time-series detectors: confidence strictly above {@code highAbove}
     * is high, anything else medium.
     */
    public static Severity fromConfidence(double confidence, double highAbove) {
        return confidence > highAbove ? HIGH : MEDIUM;
    }
}
