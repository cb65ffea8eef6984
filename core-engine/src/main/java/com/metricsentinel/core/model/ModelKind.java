package com.metricsentinel.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Detection strategy family a {@link DetectionModel} parameterizes.
 *
 * @since 1.0.0
 */
public enum ModelKind {
    STATISTICAL,
    RULE_BASED,
    RANK_OUTLIER;

    /**
     * Parse a case-insensitive kind such as {@code rule_based} or
     * {@code rank-outlier}.
     *
     * @throws IllegalArgumentException if {@code name} is not a known kind
     */
    public static ModelKind parse(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Model kind must not be blank");
        }
        String normalized = name.trim().toUpperCase(Locale.ROOT).replace('-', '_');
        try {
            return valueOf(normalized);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown model kind: '" + name
                    + "'. Supported: statistical, rule_based, rank_outlier", e);
        }
    }

    @JsonValue
    public String id() {
        return name().toLowerCase(Locale.ROOT);
    }
}
