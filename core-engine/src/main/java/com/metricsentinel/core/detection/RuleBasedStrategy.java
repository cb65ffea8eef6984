package com.metricsentinel.core.detection;

import com.metricsentinel.core.model.AnomalyType;
import com.metricsentinel.core.model.DataPoint;
import com.metricsentinel.core.model.DetectionModel;
import com.metricsentinel.core.model.DetectionResult;
import com.metricsentinel.core.model.ModelKind;
import com.metricsentinel.core.model.Severity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Ratio-threshold detector.
 *
 * <p>
 * Compares the latest value against the average of the last
 * {@value #RECENT_WINDOW} points (the latest included). A value above
 * {@code avg × spikeThreshold} is a spike; otherwise a value below
 * {@code avg × dropThreshold} is a drop. The spike check always runs first.
 * </p>
 *
 * <p>
 * Ratios are only meaningful against a positive baseline, so a
 * non-positive average is reported as non-anomalous.
 * </p>
 *
 * @since 1.0.0
 */
public class RuleBasedStrategy implements DetectionStrategy {

    private static final Logger LOG = LoggerFactory.getLogger(RuleBasedStrategy.class);

    public static final String PARAM_SPIKE_THRESHOLD = "spikeThreshold";
    public static final String PARAM_DROP_THRESHOLD = "dropThreshold";

    static final double DEFAULT_SPIKE_THRESHOLD = 3.0;
    static final double DEFAULT_DROP_THRESHOLD = 0.3;

    /** Number of most recent points averaged into the baseline. */
    static final int RECENT_WINDOW = 10;

    private static final double RULE_CONFIDENCE = 0.8;

    private final String modelId;
    private final double spikeThreshold;
    private final double dropThreshold;

    /**
     * @param model the rule-based model parameters
     * @throws NullPointerException     if {@code model} is {@code null}
     * @throws IllegalArgumentException if a threshold is not positive
     */
    public RuleBasedStrategy(DetectionModel model) {
        Objects.requireNonNull(model, "DetectionModel must not be null");
        this.modelId = model.getId();
        this.spikeThreshold = model.getParameter(PARAM_SPIKE_THRESHOLD, DEFAULT_SPIKE_THRESHOLD);
        this.dropThreshold = model.getParameter(PARAM_DROP_THRESHOLD, DEFAULT_DROP_THRESHOLD);

        if (spikeThreshold <= 0) {
            throw new IllegalArgumentException(
                    "spikeThreshold must be > 0 for model '" + modelId + "', got: " + spikeThreshold);
        }
        if (dropThreshold <= 0) {
            throw new IllegalArgumentException(
                    "dropThreshold must be > 0 for model '" + modelId + "', got: " + dropThreshold);
        }
    }

    @Override
    public DetectionResult evaluate(List<DataPoint> series) {
        Objects.requireNonNull(series, "Series must not be null");

        if (series.size() < RECENT_WINDOW) {
            return DetectionResult.notAnomalous(series);
        }

        DataPoint latest = series.get(series.size() - 1);
        double current = latest.getValue();
        double average = 0;
        for (DataPoint p : series.subList(series.size() - RECENT_WINDOW, series.size())) {
            average += p.getValue();
        }
        average /= RECENT_WINDOW;

        if (average <= 0) {
            return DetectionResult.notAnomalous(series);
        }

        if (current > average * spikeThreshold) {
            LOG.debug("Model [{}] fired: spike value={} average={}", modelId, current, average);
            return DetectionResult.builder()
                    .anomaly(true)
                    .score(Math.min((current / average) / spikeThreshold, 1))
                    .confidence(RULE_CONFIDENCE)
                    .type(AnomalyType.SPIKE)
                    .severity(Severity.HIGH)
                    .expectedValue(average)
                    .actualValue(current)
                    .deviation(current - average)
                    .timestamp(latest.getTimestamp())
                    .description(String.format(Locale.ROOT,
                            "Spike detected: %.2f vs average %.2f", current, average))
                    .putMetadata(PARAM_SPIKE_THRESHOLD, spikeThreshold)
                    .putMetadata("averageValue", average)
                    .build();
        }

        if (current < average * dropThreshold) {
            LOG.debug("Model [{}] fired: drop value={} average={}", modelId, current, average);
            // a non-positive value makes the ratio unbounded
            double score = current > 0 ? Math.min((average / current) / (1 / dropThreshold), 1) : 1;
            return DetectionResult.builder()
                    .anomaly(true)
                    .score(score)
                    .confidence(RULE_CONFIDENCE)
                    .type(AnomalyType.DROP)
                    .severity(Severity.MEDIUM)
                    .expectedValue(average)
                    .actualValue(current)
                    .deviation(average - current)
                    .timestamp(latest.getTimestamp())
                    .description(String.format(Locale.ROOT,
                            "Drop detected: %.2f vs average %.2f", current, average))
                    .putMetadata(PARAM_DROP_THRESHOLD, dropThreshold)
                    .putMetadata("averageValue", average)
                    .build();
        }

        return DetectionResult.notAnomalous(series);
    }

    @Override
    public String getModelId() {
        return modelId;
    }

    @Override
    public ModelKind getKind() {
        return ModelKind.RULE_BASED;
    }
}
