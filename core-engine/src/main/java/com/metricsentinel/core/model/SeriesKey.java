package com.metricsentinel.core.model;

import java.io.Serializable;
import java.util.Objects;

/**
 * Identifies one time series: a metric of a resource owned by an
 * organization.
 *
 * @since 1.0.0
 */
public final class SeriesKey implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String organizationId;
    private final String resourceId;
    private final String metricName;

    /**
     * @throws NullPointerException     if any part is {@code null}
     * @throws IllegalArgumentException if any part is blank
     */
    public SeriesKey(String organizationId, String resourceId, String metricName) {
        this.organizationId = requireNonBlank(organizationId, "organizationId");
        this.resourceId = requireNonBlank(resourceId, "resourceId");
        this.metricName = requireNonBlank(metricName, "metricName");
    }

    public static SeriesKey of(String organizationId, String resourceId, String metricName) {
        return new SeriesKey(organizationId, resourceId, metricName);
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

    private static String requireNonBlank(String value, String name) {
        Objects.requireNonNull(value, name + " must not be null");
        if (value.isBlank()) {
            throw new IllegalArgumentException(name + " must not be blank");
        }
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof SeriesKey that))
            return false;
        return organizationId.equals(that.organizationId)
                && resourceId.equals(that.resourceId)
                && metricName.equals(that.metricName);
    }

    @Override
    public int hashCode() {
        return Objects.hash(organizationId, resourceId, metricName);
    }

    @Override
    public String toString() {
        return organizationId + '/' + resourceId + '/' + metricName;
    }
}
