package com.metricsentinel.core.config;

import com.metricsentinel.core.model.DetectionModel;
import com.metricsentinel.core.model.DetectionPattern;
import com.metricsentinel.core.registry.ModelRegistry;

import java.io.Serializable;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Top-level POJO for the engine YAML configuration.
 *
 * <p>
 * Expected YAML structure (every key is optional):
 * </p>
 *
 * <pre>
 * sweepIntervalSeconds: 30
 * seriesCapacity: 1000
 * minSweepPoints: 20
 * dataRetentionDays: 30
 * alertRetentionDays: 30
 * cleanupIntervalMinutes: 60
 * models:
 *   - id: statistical-zscore
 *     parameters:
 *       threshold: 3.0
 * patterns:
 *   - name: Response Time Spike
 *     matchExpression: response_time &gt; 5000ms
 *     severity: high
 * </pre>
 *
 * <p>
 * Call {@link #validate()} after loading.
 * </p>
 *
 * @since 1.0.0
 */
public class EngineConfig implements Serializable {

    private static final long serialVersionUID = 1L;

    private int sweepIntervalSeconds = 30;
    private int seriesCapacity = 1000;
    private int minSweepPoints = 20;
    private int dataRetentionDays = 30;
    private int alertRetentionDays = 30;

    /** Period of the automatic retention sweep; 0 disables it. */
    private int cleanupIntervalMinutes = 60;

    private List<DetectionModel> models = new ArrayList<>();
    private List<DetectionPattern> patterns = new ArrayList<>();

    /**
     * Validate scalar settings, configured models and patterns.
     *
     * <p>
     * Collects all errors and throws a single exception if anything is
     * invalid.
     * </p>
     *
     * @throws IllegalStateException if the configuration is invalid
     */
    public void validate() {
        List<String> errors = new ArrayList<>();

        if (sweepIntervalSeconds < 1) {
            errors.add("sweepIntervalSeconds must be >= 1, got: " + sweepIntervalSeconds);
        }
        if (seriesCapacity < 1) {
            errors.add("seriesCapacity must be >= 1, got: " + seriesCapacity);
        }
        if (minSweepPoints < 1) {
            errors.add("minSweepPoints must be >= 1, got: " + minSweepPoints);
        }
        if (dataRetentionDays < 1) {
            errors.add("dataRetentionDays must be >= 1, got: " + dataRetentionDays);
        }
        if (alertRetentionDays < 1) {
            errors.add("alertRetentionDays must be >= 1, got: " + alertRetentionDays);
        }
        if (cleanupIntervalMinutes < 0) {
            errors.add("cleanupIntervalMinutes must be >= 0, got: " + cleanupIntervalMinutes);
        }

        Set<String> knownModels = Set.of(ModelRegistry.STATISTICAL_ID,
                ModelRegistry.RULE_BASED_ID, ModelRegistry.RANK_OUTLIER_ID);
        for (int i = 0; i < models.size(); i++) {
            DetectionModel model = Objects.requireNonNull(models.get(i),
                    "Model at index " + i + " is null");
            if (model.getId() == null || !knownModels.contains(model.getId())) {
                errors.add("Model at index " + i + " has unknown id '" + model.getId()
                        + "'. Supported: " + String.join(", ", knownModels));
                continue;
            }
            // configured entries may omit the kind; the built-in kind applies
            if (model.getKind() == null) {
                continue;
            }
            try {
                model.validate();
            } catch (IllegalStateException e) {
                errors.add(e.getMessage());
            }
        }

        for (int i = 0; i < patterns.size(); i++) {
            DetectionPattern pattern = Objects.requireNonNull(patterns.get(i),
                    "Pattern at index " + i + " is null");
            try {
                pattern.validate();
            } catch (IllegalStateException e) {
                errors.add(e.getMessage());
            }
        }

        if (!errors.isEmpty()) {
            throw new IllegalStateException(
                    "Engine configuration validation failed:\n  - "
                            + String.join("\n  - ", errors));
        }
    }

    // ---------------------------------------------------------------
    // Derived durations
    // ---------------------------------------------------------------

    public Duration sweepInterval() {
        return Duration.ofSeconds(sweepIntervalSeconds);
    }

    public Duration dataRetention() {
        return Duration.ofDays(dataRetentionDays);
    }

    public Duration alertRetention() {
        return Duration.ofDays(alertRetentionDays);
    }

    public Duration cleanupInterval() {
        return Duration.ofMinutes(cleanupIntervalMinutes);
    }

    // ---------------------------------------------------------------
    // Getters / Setters (used by SnakeYAML)
    // ---------------------------------------------------------------

    public int getSweepIntervalSeconds() {
        return sweepIntervalSeconds;
    }

    public void setSweepIntervalSeconds(int sweepIntervalSeconds) {
        this.sweepIntervalSeconds = sweepIntervalSeconds;
    }

    public int getSeriesCapacity() {
        return seriesCapacity;
    }

    public void setSeriesCapacity(int seriesCapacity) {
        this.seriesCapacity = seriesCapacity;
    }

    public int getMinSweepPoints() {
        return minSweepPoints;
    }

    public void setMinSweepPoints(int minSweepPoints) {
        this.minSweepPoints = minSweepPoints;
    }

    public int getDataRetentionDays() {
        return dataRetentionDays;
    }

    public void setDataRetentionDays(int dataRetentionDays) {
        this.dataRetentionDays = dataRetentionDays;
    }

    public int getAlertRetentionDays() {
        return alertRetentionDays;
    }

    public void setAlertRetentionDays(int alertRetentionDays) {
        this.alertRetentionDays = alertRetentionDays;
    }

    public int getCleanupIntervalMinutes() {
        return cleanupIntervalMinutes;
    }

    public void setCleanupIntervalMinutes(int cleanupIntervalMinutes) {
        this.cleanupIntervalMinutes = cleanupIntervalMinutes;
    }

    /**
     * @return unmodifiable list of configured model overrides
     */
    public List<DetectionModel> getModels() {
        return Collections.unmodifiableList(models);
    }

    public void setModels(List<DetectionModel> models) {
        this.models = models != null ? new ArrayList<>(models) : new ArrayList<>();
    }

    /**
     * @return unmodifiable list of configured patterns
     */
    public List<DetectionPattern> getPatterns() {
        return Collections.unmodifiableList(patterns);
    }

    public void setPatterns(List<DetectionPattern> patterns) {
        this.patterns = patterns != null ? new ArrayList<>(patterns) : new ArrayList<>();
    }

    @Override
    public String toString() {
        return "EngineConfig{" +
                "sweepIntervalSeconds=" + sweepIntervalSeconds +
                ", seriesCapacity=" + seriesCapacity +
                ", minSweepPoints=" + minSweepPoints +
                ", dataRetentionDays=" + dataRetentionDays +
                ", alertRetentionDays=" + alertRetentionDays +
                ", cleanupIntervalMinutes=" + cleanupIntervalMinutes +
                ", models=" + models.size() +
                ", patterns=" + patterns.size() +
                '}';
    }
}
