package com.metricsentinel.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Named parameter set for one detection strategy.
 *
 * <p>
 * Supported kinds:
 * </p>
 * <ul>
 * <li>{@code statistical} - z-score over a trailing window
 * ({@code threshold}, {@code windowSize})</li>
 * <li>{@code rule_based} - ratio against the recent average
 * ({@code spikeThreshold}, {@code dropThreshold})</li>
 * <li>{@code rank_outlier} - rank distance from the tails of the sorted series
 * ({@code contamination})</li>
 * </ul>
 *
 * <p>
 * Instances are mutable JavaBeans so they can be bound from YAML. The
 * {@code ModelRegistry} only ever hands out copies; call {@link #validate()}
 * after binding.
 * </p>
 *
 * @since 1.0.0
 */
public class DetectionModel implements Serializable {

    private static final long serialVersionUID = 1L;

    private String id;
    private String name;

    /** Strategy kind, normalised to lowercase. */
    private String kind;

    private Map<String, Double> parameters = new LinkedHashMap<>();
    private boolean trained;

    /** Caller-reported accuracy of the last training run, if any. */
    private Double accuracy;

    private Instant lastTrainedAt;
    private int trainingSampleCount;

    public DetectionModel() {
    }

    public DetectionModel(String id, String name, ModelKind kind, Map<String, Double> parameters, boolean trained) {
        this.id = id;
        this.name = name;
        this.kind = kind.id();
        setParameters(parameters);
        this.trained = trained;
    }

    /**
     * Copy constructor.
     */
    public DetectionModel(DetectionModel other) {
        Objects.requireNonNull(other, "DetectionModel must not be null");
        this.id = other.id;
        this.name = other.name;
        this.kind = other.kind;
        this.parameters = new LinkedHashMap<>(other.parameters);
        this.trained = other.trained;
        this.accuracy = other.accuracy;
        this.lastTrainedAt = other.lastTrainedAt;
        this.trainingSampleCount = other.trainingSampleCount;
    }

    // ---------------------------------------------------------------
    // Validation
    // ---------------------------------------------------------------

    /**
     * Validate identity, kind and parameter values.
     *
     * @throws IllegalStateException if validation fails
     */
    public void validate() {
        List<String> errors = new ArrayList<>();

        if (id == null || id.isBlank()) {
            errors.add("Model 'id' is required");
        }
        if (kind == null || kind.isBlank()) {
            errors.add("Model '" + id + "' requires 'kind'");
        } else {
            try {
                ModelKind.parse(kind);
            } catch (IllegalArgumentException e) {
                errors.add("Model '" + id + "': " + e.getMessage());
            }
        }
        parameters.forEach((key, value) -> {
            if (value == null || !Double.isFinite(value)) {
                errors.add("Model '" + id + "' parameter '" + key + "' must be a finite number");
            }
        });
        if (accuracy != null && (accuracy < 0 || accuracy > 1)) {
            errors.add("Model '" + id + "' accuracy must be in [0, 1], got: " + accuracy);
        }

        if (!errors.isEmpty()) {
            throw new IllegalStateException(
                    "Invalid DetectionModel: " + String.join("; ", errors));
        }
    }

    // ---------------------------------------------------------------
    // Parameter access
    // ---------------------------------------------------------------

    /**
     * @param key          parameter name
     * @param defaultValue value used when the parameter is absent
     * @return the parameter value or {@code defaultValue}
     */
    public double getParameter(String key, double defaultValue) {
        Double value = parameters.get(key);
        return value != null ? value : defaultValue;
    }

    /**
     * @return the parsed kind
     * @throws IllegalArgumentException if the kind is missing or unknown
     */
    public ModelKind resolveKind() {
        return ModelKind.parse(kind);
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

    public String getKind() {
        return kind;
    }

    /**
     * Set the kind, normalised to lowercase with underscores.
     */
    public void setKind(String kind) {
        this.kind = kind != null ? kind.trim().toLowerCase(Locale.ROOT).replace('-', '_') : null;
    }

    /**
     * @return unmodifiable view of the parameters
     */
    public Map<String, Double> getParameters() {
        return Collections.unmodifiableMap(parameters);
    }

    /**
     * Replace the parameters. YAML integers are widened to {@code double};
     * non-numeric values are rejected.
     *
     * @throws IllegalArgumentException if a value is not numeric
     */
    public void setParameters(Map<String, Double> parameters) {
        Map<String, Double> copy = new LinkedHashMap<>();
        if (parameters != null) {
            Map<String, ?> raw = parameters;
            for (Map.Entry<String, ?> entry : raw.entrySet()) {
                copy.put(entry.getKey(), toDouble(entry.getKey(), entry.getValue()));
            }
        }
        this.parameters = copy;
    }

    public boolean isTrained() {
        return trained;
    }

    public void setTrained(boolean trained) {
        this.trained = trained;
    }

    public Double getAccuracy() {
        return accuracy;
    }

    public void setAccuracy(Double accuracy) {
        this.accuracy = accuracy;
    }

    public Instant getLastTrainedAt() {
        return lastTrainedAt;
    }

    public void setLastTrainedAt(Instant lastTrainedAt) {
        this.lastTrainedAt = lastTrainedAt;
    }

    public int getTrainingSampleCount() {
        return trainingSampleCount;
    }

    public void setTrainingSampleCount(int trainingSampleCount) {
        this.trainingSampleCount = trainingSampleCount;
    }

    private static Double toDouble(String key, Object value) {
        if (value instanceof Number n) {
            return n.doubleValue();
        }
        if (value instanceof String s) {
            try {
                return Double.parseDouble(s);
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Parameter '" + key + "' is not numeric: " + s, e);
            }
        }
        throw new IllegalArgumentException("Parameter '" + key + "' is not numeric: " + value);
    }

    // ---------------------------------------------------------------
    // equals / hashCode / toString
    // ---------------------------------------------------------------

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof DetectionModel that))
            return false;
        return Objects.equals(id, that.id) && Objects.equals(kind, that.kind);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, kind);
    }

    @Override
    public String toString() {
        return "DetectionModel{" +
                "id='" + id + '\'' +
                ", kind='" + kind + '\'' +
                ", parameters=" + parameters +
                ", trained=" + trained +
                ", accuracy=" + accuracy +
                ", lastTrainedAt=" + lastTrainedAt +
                '}';
    }
}
