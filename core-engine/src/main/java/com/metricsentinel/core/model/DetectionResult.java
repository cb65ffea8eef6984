package com.metricsentinel.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Verdict of one detection strategy, or of the fusion of several.
 *
 * <h3>Construction</h3>
 * <p>
 * Use the {@link Builder}; {@code type}, {@code severity} and
 * {@code timestamp} are required. Non-anomalous verdicts are created with
 * {@link #notAnomalous(List)}. Instances are immutable; derive modified
 * copies through {@link #toBuilder()}.
 * </p>
 *
 * @since 1.0.0
 */
public final class DetectionResult implements Serializable {

    private static final long serialVersionUID = 1L;

    public static final String NO_ANOMALY_DESCRIPTION = "No anomaly detected";

    private final boolean anomaly;
    private final double score;
    private final double confidence;
    private final AnomalyType type;
    private final Severity severity;
    /** Baseline the strategy compared against; {@code null} when it has none. */
    private final Double expectedValue;
    private final double actualValue;
    private final double deviation;
    private final Instant timestamp;
    private final String description;
    private final Map<String, Object> metadata;

    private DetectionResult(Builder builder) {
        this.anomaly = builder.anomaly;
        this.score = builder.score;
        this.confidence = builder.confidence;
        this.type = Objects.requireNonNull(builder.type, "type must not be null");
        this.severity = Objects.requireNonNull(builder.severity, "severity must not be null");
        this.expectedValue = builder.expectedValue;
        this.actualValue = builder.actualValue;
        this.deviation = builder.deviation;
        this.timestamp = Objects.requireNonNull(builder.timestamp, "timestamp must not be null");
        this.description = builder.description != null ? builder.description : "";
        this.metadata = builder.metadata.isEmpty()
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(builder.metadata));
    }

    /**
     * Zero-score verdict for a series that did not trigger a strategy.
     *
     * <p>
     * Actual value and timestamp come from the latest point; an empty series
     * yields {@code actualValue = 0} stamped with {@link Instant#EPOCH}.
     * </p>
     *
     * @param series the evaluated series, oldest first
     * @return a non-anomalous result
     */
    public static DetectionResult notAnomalous(List<DataPoint> series) {
        DataPoint latest = series == null || series.isEmpty() ? null : series.get(series.size() - 1);
        return builder()
                .anomaly(false)
                .score(0)
                .confidence(0)
                .type(AnomalyType.OUTLIER)
                .severity(Severity.LOW)
                .actualValue(latest != null ? latest.getValue() : 0)
                .deviation(0)
                .timestamp(latest != null ? latest.getTimestamp() : Instant.EPOCH)
                .description(NO_ANOMALY_DESCRIPTION)
                .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * @return a builder pre-populated with every field of this result
     */
    public Builder toBuilder() {
        return new Builder()
                .anomaly(anomaly)
                .score(score)
                .confidence(confidence)
                .type(type)
                .severity(severity)
                .expectedValue(expectedValue)
                .actualValue(actualValue)
                .deviation(deviation)
                .timestamp(timestamp)
                .description(description)
                .metadata(metadata);
    }

    /**
     * Fluent builder for {@link DetectionResult}.
     */
    public static class Builder {
        private boolean anomaly;
        private double score;
        private double confidence;
        private AnomalyType type;
        private Severity severity;
        private Double expectedValue;
        private double actualValue;
        private double deviation;
        private Instant timestamp;
        private String description;
        private final Map<String, Object> metadata = new LinkedHashMap<>();

        public Builder anomaly(boolean anomaly) {
            this.anomaly = anomaly;
            return this;
        }

        public Builder score(double score) {
            this.score = score;
            return this;
        }

        public Builder confidence(double confidence) {
            this.confidence = confidence;
            return this;
        }

        public Builder type(AnomalyType type) {
            this.type = type;
            return this;
        }

        public Builder severity(Severity severity) {
            this.severity = severity;
            return this;
        }

        public Builder expectedValue(Double expectedValue) {
            this.expectedValue = expectedValue;
            return this;
        }

        public Builder actualValue(double actualValue) {
            this.actualValue = actualValue;
            return this;
        }

        public Builder deviation(double deviation) {
            this.deviation = deviation;
            return this;
        }

        public Builder timestamp(Instant timestamp) {
            this.timestamp = timestamp;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder metadata(Map<String, Object> metadata) {
            this.metadata.clear();
            if (metadata != null) {
                this.metadata.putAll(metadata);
            }
            return this;
        }

        public Builder putMetadata(String key, Object value) {
            this.metadata.put(Objects.requireNonNull(key, "metadata key must not be null"), value);
            return this;
        }

        /**
         * @throws NullPointerException if {@code type}, {@code severity} or
         *                              {@code timestamp} is missing
         */
        public DetectionResult build() {
            return new DetectionResult(this);
        }
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    public boolean isAnomaly() {
        return anomaly;
    }

    public double getScore() {
        return score;
    }

    public double getConfidence() {
        return confidence;
    }

    public AnomalyType getType() {
        return type;
    }

    public Severity getSeverity() {
        return severity;
    }

    public Double getExpectedValue() {
        return expectedValue;
    }

    public double getActualValue() {
        return actualValue;
    }

    public double getDeviation() {
        return deviation;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public String getDescription() {
        return description;
    }

    /**
     * @return unmodifiable strategy-specific attributes (e.g. {@code zScore})
     */
    public Map<String, Object> getMetadata() {
        return metadata;
    }

    // ---------------------------------------------------------------
    // equals / hashCode / toString
    // ---------------------------------------------------------------

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof DetectionResult that))
            return false;
        return anomaly == that.anomaly
                && Double.compare(score, that.score) == 0
                && Double.compare(confidence, that.confidence) == 0
                && Double.compare(actualValue, that.actualValue) == 0
                && Double.compare(deviation, that.deviation) == 0
                && type == that.type
                && severity == that.severity
                && Objects.equals(expectedValue, that.expectedValue)
                && timestamp.equals(that.timestamp)
                && description.equals(that.description)
                && metadata.equals(that.metadata);
    }

    @Override
    public int hashCode() {
        return Objects.hash(anomaly, score, confidence, type, severity, expectedValue,
                actualValue, deviation, timestamp, description, metadata);
    }

    @Override
    public String toString() {
        return "DetectionResult{" +
                "anomaly=" + anomaly +
                ", score=" + score +
                ", confidence=" + confidence +
                ", type=" + type +
                ", severity=" + severity +
                ", actualValue=" + actualValue +
                ", description='" + description + '\'' +
                '}';
    }
}
