package com.metricsentinel.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Alert severity, ordered from least to most severe.
 *
 * @since 1.0.0
 */
public enum Severity {
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL;

    /**
     * Severity ladder shared by every strategy.
     *
     * @param score anomaly score in [0, 1]
     * @return {@code CRITICAL} from 0.9, {@code HIGH} from 0.7,
     *         {@code MEDIUM} from 0.5, {@code LOW} otherwise
     */
    public static Severity fromScore(double score) {
        if (score >= 0.9) {
            return CRITICAL;
        }
        if (score >= 0.7) {
            return HIGH;
        }
        if (score >= 0.5) {
            return MEDIUM;
        }
        return LOW;
    }

    /**
     * Parse a case-insensitive severity name.
     *
     * @throws IllegalArgumentException if {@code name} is not a known severity
     */
    public static Severity parse(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Severity must not be blank");
        }
        try {
            return valueOf(name.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown severity: '" + name
                    + "'. Supported: low, medium, high, critical", e);
        }
    }

    @JsonValue
    public String id() {
        return name().toLowerCase(Locale.ROOT);
    }
}
