package com.metricsentinel.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A single timestamped observation of a metric.
 *
 * <p>
 * Instances are immutable. The optional metadata map is copied on
 * construction and exposed as an unmodifiable view.
 * </p>
 *
 * @since 1.0.0
 */
public final class DataPoint implements Serializable {

    private static final long serialVersionUID = 1L;

    private final Instant timestamp;
    private final double value;
    private final Map<String, Object> metadata;

    /**
     * @param timestamp when the value was observed; must not be {@code null}
     * @param value     the observed value
     * @param metadata  optional free-form attributes, may be {@code null}
     * @throws NullPointerException if {@code timestamp} is {@code null}
     */
    public DataPoint(Instant timestamp, double value, Map<String, Object> metadata) {
        this.timestamp = Objects.requireNonNull(timestamp, "timestamp must not be null");
        this.value = value;
        this.metadata = metadata == null || metadata.isEmpty()
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    public DataPoint(Instant timestamp, double value) {
        this(timestamp, value, null);
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public double getValue() {
        return value;
    }

    /**
     * @return unmodifiable metadata map, empty when none was supplied
     */
    public Map<String, Object> getMetadata() {
        return metadata;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof DataPoint that))
            return false;
        return Double.compare(value, that.value) == 0
                && timestamp.equals(that.timestamp)
                && metadata.equals(that.metadata);
    }

    @Override
    public int hashCode() {
        return Objects.hash(timestamp, value, metadata);
    }

    @Override
    public String toString() {
        return "DataPoint{" +
                "timestamp=" + timestamp +
                ", value=" + value +
                (metadata.isEmpty() ? "" : ", metadata=" + metadata) +
                '}';
    }
}
