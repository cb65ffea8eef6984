package com.metricsentinel.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Shape of a detected anomaly.
 *
 * @since 1.0.0
 */
public enum AnomalyType {
    SPIKE,
    DROP,
    TREND_CHANGE,
    PATTERN_BREAK,
    OUTLIER;

    @JsonValue
    public String id() {
        return name().toLowerCase(Locale.ROOT);
    }
}
