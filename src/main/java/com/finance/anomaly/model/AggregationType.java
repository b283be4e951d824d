package com.finance.anomaly.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * How a reported value accumulates: a single month, fiscal year to date, or rolling twelve months.
 */
public enum AggregationType {
    MONTHLY,
    FYTD,
    R12;

    @JsonValue
    public String toJson() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static AggregationType fromJson(String value) {
        if (value == null) return null;
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
