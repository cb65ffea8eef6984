package com.metricsentinel.core.detection;

import com.metricsentinel.core.model.DetectionModel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Factory that creates {@link DetectionStrategy} instances from
 * {@link DetectionModel} snapshots.
 *
 * <p>
 * This is the single point of extension when adding new model kinds:
 * register the new kind here and create the corresponding strategy.
 * </p>
 *
 * @since 1.0.0
 */
public final class StrategyFactory {

    private static final Logger LOG = LoggerFactory.getLogger(StrategyFactory.class);

    private StrategyFactory() {
        // utility class, not instantiable
    }

    /**
     * Create a strategy for the given model.
     *
     * @param model the model snapshot; must not be {@code null}
     * @return the strategy matching the model kind
     * @throws NullPointerException     if {@code model} is {@code null}
     * @throws IllegalArgumentException if the kind is unknown or a parameter is
     *                                  invalid
     */
    public static DetectionStrategy create(DetectionModel model) {
        Objects.requireNonNull(model, "DetectionModel must not be null");

        return switch (model.resolveKind()) {
            case STATISTICAL -> new StatisticalStrategy(model);
            case RULE_BASED -> new RuleBasedStrategy(model);
            case RANK_OUTLIER -> new RankOutlierStrategy(model);
        };
    }

    /**
     * Create strategies for every model, preserving order.
     *
     * <p>
     * The returned list is <strong>unmodifiable</strong>.
     * </p>
     *
     * @param models model snapshots in evaluation order; must not be {@code null}
     * @return unmodifiable list of strategies (one per model)
     */
    public static List<DetectionStrategy> createAll(List<DetectionModel> models) {
        Objects.requireNonNull(models, "Models list must not be null");
        LOG.debug("Creating {} strategy(ies) from model registry", models.size());
        List<DetectionStrategy> strategies = models.stream()
                .map(StrategyFactory::create)
                .toList();
        return Collections.unmodifiableList(strategies);
    }
}
