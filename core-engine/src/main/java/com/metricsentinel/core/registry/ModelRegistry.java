package com.metricsentinel.core.registry;

import com.metricsentinel.core.detection.StrategyFactory;
import com.metricsentinel.core.model.DetectionModel;
import com.metricsentinel.core.model.ModelKind;
import com.metricsentinel.core.model.TrainingData;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Holds the parameter sets of the three built-in detection models.
 *
 * <p>
 * The registry is seeded with the built-ins in evaluation order
 * (statistical, rule-based, rank-outlier). Configured models may override
 * the parameters of a built-in with the same id; training replaces
 * parameters and records when it happened. Callers only ever receive copies.
 * </p>
 *
 * @since 1.0.0
 */
public class ModelRegistry {

    private static final Logger LOG = LoggerFactory.getLogger(ModelRegistry.class);

    public static final String STATISTICAL_ID = "statistical-zscore";
    public static final String RULE_BASED_ID = "rule-based-thresholds";
    public static final String RANK_OUTLIER_ID = "rank-outlier";

    private final Clock clock;
    private final Map<String, DetectionModel> models = new LinkedHashMap<>();

    /**
     * @param clock      source of training timestamps
     * @param overrides  configured models; each must carry the id of a built-in
     * @throws IllegalArgumentException if an override names an unknown model or
     *                                  changes a built-in's kind
     */
    public ModelRegistry(Clock clock, List<DetectionModel> overrides) {
        this.clock = Objects.requireNonNull(clock, "Clock must not be null");
        for (DetectionModel model : builtIns()) {
            models.put(model.getId(), model);
        }
        if (overrides != null) {
            overrides.forEach(this::applyOverride);
        }
    }

    public ModelRegistry(Clock clock) {
        this(clock, List.of());
    }

    /**
     * @return fresh copies of the three built-in models in evaluation order
     */
    public static List<DetectionModel> builtIns() {
        Map<String, Double> statistical = new LinkedHashMap<>();
        statistical.put("threshold", 2.5);
        statistical.put("windowSize", 100.0);
        statistical.put("minDataPoints", 20.0);

        Map<String, Double> ruleBased = new LinkedHashMap<>();
        ruleBased.put("spikeThreshold", 3.0);
        ruleBased.put("dropThreshold", 0.3);
        ruleBased.put("trendChangeThreshold", 0.5);

        Map<String, Double> rankOutlier = new LinkedHashMap<>();
        rankOutlier.put("contamination", 0.1);
        rankOutlier.put("nEstimators", 100.0);
        rankOutlier.put("maxSamples", 256.0);

        return List.of(
                new DetectionModel(STATISTICAL_ID, "Z-Score Statistical Model",
                        ModelKind.STATISTICAL, statistical, false),
                new DetectionModel(RULE_BASED_ID, "Rule-Based Threshold Model",
                        ModelKind.RULE_BASED, ruleBased, true),
                new DetectionModel(RANK_OUTLIER_ID, "Rank Outlier Model",
                        ModelKind.RANK_OUTLIER, rankOutlier, false));
    }

    /**
     * @param modelId the model id
     * @return a copy of the model, or empty if unknown
     */
    public synchronized Optional<DetectionModel> get(String modelId) {
        DetectionModel model = models.get(modelId);
        return model != null ? Optional.of(new DetectionModel(model)) : Optional.empty();
    }

    /**
     * @return copies of all models in evaluation order
     */
    public synchronized List<DetectionModel> getModels() {
        List<DetectionModel> copies = new ArrayList<>(models.size());
        for (DetectionModel model : models.values()) {
            copies.add(new DetectionModel(model));
        }
        return copies;
    }

    /**
     * Train a model with caller-supplied data.
     *
     * <p>
     * Supplied parameters are merged over the current ones, the model is
     * marked trained, the reported accuracy is recorded (or cleared when
     * none is reported) and the training time is stamped. Repeating the same
     * call leaves the same parameters in place.
     * </p>
     *
     * @param modelId the model to train
     * @param data    training input; must not be {@code null}
     * @return {@code false} if no model has that id
     * @throws IllegalArgumentException if a parameter or the accuracy is invalid
     */
    public synchronized boolean train(String modelId, TrainingData data) {
        Objects.requireNonNull(data, "TrainingData must not be null");
        DetectionModel current = modelId != null ? models.get(modelId) : null;
        if (current == null) {
            LOG.warn("Training requested for unknown model '{}'", modelId);
            return false;
        }

        DetectionModel trained = new DetectionModel(current);
        Map<String, Double> merged = new LinkedHashMap<>(current.getParameters());
        merged.putAll(data.getParameters());
        trained.setParameters(merged);
        trained.setTrained(true);
        trained.setAccuracy(data.getAccuracy());
        trained.setLastTrainedAt(clock.instant());
        trained.setTrainingSampleCount(data.getSamples().size());
        try {
            trained.validate();
        } catch (IllegalStateException e) {
            throw new IllegalArgumentException(e.getMessage(), e);
        }
        // strategies reject parameters they cannot run with
        StrategyFactory.create(trained);

        models.put(modelId, trained);
        LOG.info("Model trained: id={} samples={} parameters={}",
                modelId, data.getSamples().size(), trained.getParameters());
        return true;
    }

    /**
     * @return number of models marked trained
     */
    public synchronized int trainedCount() {
        return (int) models.values().stream().filter(DetectionModel::isTrained).count();
    }

    public synchronized int size() {
        return models.size();
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private void applyOverride(DetectionModel override) {
        Objects.requireNonNull(override, "Configured model must not be null");
        DetectionModel builtIn = models.get(override.getId());
        if (builtIn == null) {
            throw new IllegalArgumentException("Unknown model id '" + override.getId()
                    + "'. Supported: " + String.join(", ", models.keySet()));
        }
        if (override.getKind() != null && override.resolveKind() != builtIn.resolveKind()) {
            throw new IllegalArgumentException("Model '" + override.getId() + "' must have kind '"
                    + builtIn.getKind() + "', got: '" + override.getKind() + "'");
        }

        DetectionModel merged = new DetectionModel(builtIn);
        if (override.getName() != null && !override.getName().isBlank()) {
            merged.setName(override.getName());
        }
        Map<String, Double> parameters = new LinkedHashMap<>(builtIn.getParameters());
        parameters.putAll(override.getParameters());
        merged.setParameters(parameters);
        merged.validate();
        StrategyFactory.create(merged);

        models.put(merged.getId(), merged);
        LOG.info("Applied configured parameters to model '{}': {}", merged.getId(), merged.getParameters());
    }
}
