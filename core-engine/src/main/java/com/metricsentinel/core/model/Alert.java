package com.metricsentinel.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.Objects;

/**
 * Durable record of a fused anomalous verdict for one series.
 *
 * <p>
 * Alerts are immutable. Acknowledgement produces a new instance through
 * {@link #acknowledged(String, Instant)}; the alert store swaps it in place
 * of the original.
 * </p>
 *
 * <h3>Construction</h3>
 * <p>
 * Use the {@link Builder}. {@code id}, the three series identifiers,
 * {@code result} and {@code createdAt} are required; omitting any of them
 * throws a {@link NullPointerException} at build time.
 * </p>
 *
 * @since 1.0.0
 */
public final class Alert implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String id;
    private final String organizationId;
    private final String resourceId;
    private final String metricName;

    /** The fused detection verdict that triggered the alert. */
    private final DetectionResult result;

    private final boolean acknowledged;
    private final String acknowledgedBy;
    private final Instant acknowledgedAt;
    private final Instant createdAt;

    private Alert(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "id must not be null");
        this.organizationId = Objects.requireNonNull(builder.organizationId, "organizationId must not be null");
        this.resourceId = Objects.requireNonNull(builder.resourceId, "resourceId must not be null");
        this.metricName = Objects.requireNonNull(builder.metricName, "metricName must not be null");
        this.result = Objects.requireNonNull(builder.result, "result must not be null");
        this.acknowledged = builder.acknowledged;
        this.acknowledgedBy = builder.acknowledgedBy;
        this.acknowledgedAt = builder.acknowledgedAt;
        this.createdAt = Objects.requireNonNull(builder.createdAt, "createdAt must not be null");
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Fluent builder for {@link Alert} instances.
     */
    public static class Builder {
        private String id;
        private String organizationId;
        private String resourceId;
        private String metricName;
        private DetectionResult result;
        private boolean acknowledged;
        private String acknowledgedBy;
        private Instant acknowledgedAt;
        private Instant createdAt;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        /**
         * Copy organization, resource and metric from a series key.
         */
        public Builder seriesKey(SeriesKey key) {
            Objects.requireNonNull(key, "SeriesKey must not be null");
            this.organizationId = key.getOrganizationId();
            this.resourceId = key.getResourceId();
            this.metricName = key.getMetricName();
            return this;
        }

        public Builder organizationId(String organizationId) {
            this.organizationId = organizationId;
            return this;
        }

        public Builder resourceId(String resourceId) {
            this.resourceId = resourceId;
            return this;
        }

        public Builder metricName(String metricName) {
            this.metricName = metricName;
            return this;
        }

        public Builder result(DetectionResult result) {
            this.result = result;
            return this;
        }

        public Builder acknowledged(boolean acknowledged) {
            this.acknowledged = acknowledged;
            return this;
        }

        public Builder acknowledgedBy(String acknowledgedBy) {
            this.acknowledgedBy = acknowledgedBy;
            return this;
        }

        public Builder acknowledgedAt(Instant acknowledgedAt) {
            this.acknowledgedAt = acknowledgedAt;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Alert build() {
            return new Alert(this);
        }
    }

    /**
     * Return an acknowledged copy of this alert.
     *
     * @param who  identity of the acknowledging user
     * @param when acknowledgement time; must not be {@code null}
     * @return a new alert with the acknowledgement fields set
     */
    public Alert acknowledged(String who, Instant when) {
        return builder()
                .id(id)
                .organizationId(organizationId)
                .resourceId(resourceId)
                .metricName(metricName)
                .result(result)
                .acknowledged(true)
                .acknowledgedBy(who)
                .acknowledgedAt(Objects.requireNonNull(when, "acknowledgement time must not be null"))
                .createdAt(createdAt)
                .build();
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    public String getId() {
        return id;
    }

    public String getOrganizationId() {
        return organizationId;
    }

    public String getResourceId() {
        return resourceId;
    }

    public String getMetricName() {
        return metricName;
    }

    public DetectionResult getResult() {
        return result;
    }

    public boolean isAcknowledged() {
        return acknowledged;
    }

    public String getAcknowledgedBy() {
        return acknowledgedBy;
    }

    public Instant getAcknowledgedAt() {
        return acknowledgedAt;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    // ---------------------------------------------------------------
    // equals / hashCode / toString
    // ---------------------------------------------------------------

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Alert alert))
            return false;
        return acknowledged == alert.acknowledged
                && id.equals(alert.id)
                && Objects.equals(acknowledgedAt, alert.acknowledgedAt);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, acknowledged, acknowledgedAt);
    }

    @Override
    public String toString() {
        return "Alert{" +
                "id='" + id + '\'' +
                ", organizationId='" + organizationId + '\'' +
                ", resourceId='" + resourceId + '\'' +
                ", metricName='" + metricName + '\'' +
                ", severity=" + result.getSeverity() +
                ", type=" + result.getType() +
                ", acknowledged=" + acknowledged +
                ", createdAt=" + createdAt +
                '}';
    }
}
