package com.metricsentinel.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Human-authored description of a known anomaly shape.
 *
 * <p>
 * Patterns are reference material for operators and dashboards; they are
 * never evaluated by the detection strategies. Instances are JavaBeans so
 * they can be bound from YAML; call {@link #validate()} after binding.
 * </p>
 *
 * @since 1.0.0
 */
public class DetectionPattern implements Serializable {

    private static final long serialVersionUID = 1L;

    private String id;
    private String name;
    private String description;

    /** Free-form condition, e.g. {@code response_time > 5000ms}. */
    private String matchExpression;

    /** Severity, normalised to lowercase. */
    private String severity;

    private boolean active = true;
    private Instant createdAt;

    public DetectionPattern() {
    }

    /**
     * Copy constructor.
     */
    public DetectionPattern(DetectionPattern other) {
        Objects.requireNonNull(other, "DetectionPattern must not be null");
        this.id = other.id;
        this.name = other.name;
        this.description = other.description;
        this.matchExpression = other.matchExpression;
        this.severity = other.severity;
        this.active = other.active;
        this.createdAt = other.createdAt;
    }

    /**
     * @throws IllegalStateException if name, match expression or severity is
     *                               missing or invalid
     */
    public void validate() {
        List<String> errors = new ArrayList<>();

        if (name == null || name.isBlank()) {
            errors.add("Pattern 'name' is required");
        }
        if (matchExpression == null || matchExpression.isBlank()) {
            errors.add("Pattern '" + name + "' requires 'matchExpression'");
        }
        try {
            Severity.parse(severity);
        } catch (IllegalArgumentException e) {
            errors.add("Pattern '" + name + "': " + e.getMessage());
        }

        if (!errors.isEmpty()) {
            throw new IllegalStateException(
                    "Invalid DetectionPattern: " + String.join("; ", errors));
        }
    }

    /**
     * @return the parsed severity
     * @throws IllegalArgumentException if the severity is missing or unknown
     */
    public Severity resolveSeverity() {
        return Severity.parse(severity);
    }

    // ---------------------------------------------------------------
    // Getters / Setters
    // ---------------------------------------------------------------

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getDescription() {
        return description;
    }

    public void setDescription(String description) {
        this.description = description;
    }

    public String getMatchExpression() {
        return matchExpression;
    }

    public void setMatchExpression(String matchExpression) {
        this.matchExpression = matchExpression;
    }

    public String getSeverity() {
        return severity;
    }

    public void setSeverity(String severity) {
        this.severity = severity != null ? severity.trim().toLowerCase(Locale.ROOT) : null;
    }

    public boolean isActive() {
        return active;
    }

    public void setActive(boolean active) {
        this.active = active;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(Instant createdAt) {
        this.createdAt = createdAt;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof DetectionPattern that))
            return false;
        return Objects.equals(id, that.id) && Objects.equals(name, that.name);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, name);
    }

    @Override
    public String toString() {
        return "DetectionPattern{" +
                "id='" + id + '\'' +
                ", name='" + name + '\'' +
                ", matchExpression='" + matchExpression + '\'' +
                ", severity='" + severity + '\'' +
                ", active=" + active +
                '}';
    }
}
