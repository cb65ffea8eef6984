package com.metricsentinel.service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * JSON body of {@code POST /ingest}: one metric value for one series.
 *
 * <pre>
 * {"organizationId":"org-1","resourceId":"api-gateway",
 *  "metricName":"response_time","value":412.0,"metadata":{"region":"eu"}}
 * </pre>
 *
 * @since 1.0.0
 */
public class IngestRequest {

    private String organizationId;
    private String resourceId;
    private String metricName;
    private Double value;
    private Map<String, Object> metadata;

    /**
     * @throws IllegalArgumentException naming every missing field, or if
     *                                  {@code value} is NaN or infinite
     */
    public void validate() {
        List<String> missing = new ArrayList<>();
        if (organizationId == null || organizationId.isBlank()) {
            missing.add("organizationId");
        }
        if (resourceId == null || resourceId.isBlank()) {
            missing.add("resourceId");
        }
        if (metricName == null || metricName.isBlank()) {
            missing.add("metricName");
        }
        if (value == null) {
            missing.add("value");
        }
        if (!missing.isEmpty()) {
            throw new IllegalArgumentException("Missing required field(s): " + String.join(", ", missing));
        }
        if (!Double.isFinite(value)) {
            throw new IllegalArgumentException("value must be a finite number, got: " + value);
        }
    }

    public String getOrganizationId() {
        return organizationId;
    }

    public void setOrganizationId(String organizationId) {
        this.organizationId = organizationId;
    }

    public String getResourceId() {
        return resourceId;
    }

    public void setResourceId(String resourceId) {
        this.resourceId = resourceId;
    }

    public String getMetricName() {
        return metricName;
    }

    public void setMetricName(String metricName) {
        this.metricName = metricName;
    }

    public Double getValue() {
        return value;
    }

    public void setValue(Double value) {
        this.value = value;
    }

    public Map<String, Object> getMetadata() {
        return metadata;
    }

    public void setMetadata(Map<String, Object> metadata) {
        this.metadata = metadata;
    }

    @Override
    public String toString() {
        return "IngestRequest{" +
                "organizationId='" + organizationId + '\'' +
                ", resourceId='" + resourceId + '\'' +
                ", metricName='" + metricName + '\'' +
                ", value=" + value +
                '}';
    }
}
