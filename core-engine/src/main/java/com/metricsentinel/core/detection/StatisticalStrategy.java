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
 * Z-score detector over a trailing window.
 *
 * <p>
 * The window is the most recent {@code windowSize} points. The latest point
 * is the value under test; mean and population standard deviation are taken
 * over the points of the window that precede it, so the value does not
 * influence its own baseline. The value is anomalous when
 * {@code |value − mean| / σ > threshold}.
 * </p>
 *
 * <h3>Degenerate input</h3>
 * <p>
 * A series shorter than {@code windowSize}, or a baseline with zero
 * variance, is reported as non-anomalous.
 * </p>
 *
 * @since 1.0.0
 */
public class StatisticalStrategy implements DetectionStrategy {

    private static final Logger LOG = LoggerFactory.getLogger(StatisticalStrategy.class);

    public static final String PARAM_THRESHOLD = "threshold";
    public static final String PARAM_WINDOW_SIZE = "windowSize";

    static final double DEFAULT_THRESHOLD = 2.5;
    static final int DEFAULT_WINDOW_SIZE = 100;

    /** Smallest window that leaves a baseline of two points. */
    static final int MIN_WINDOW_SIZE = 3;

    private final String modelId;
    private final double threshold;
    private final int windowSize;

    /**
     * @param model the statistical model parameters
     * @throws NullPointerException     if {@code model} is {@code null}
     * @throws IllegalArgumentException if {@code threshold} or
     *                                  {@code windowSize} are invalid
     */
    public StatisticalStrategy(DetectionModel model) {
        Objects.requireNonNull(model, "DetectionModel must not be null");
        this.modelId = model.getId();
        this.threshold = model.getParameter(PARAM_THRESHOLD, DEFAULT_THRESHOLD);
        this.windowSize = (int) model.getParameter(PARAM_WINDOW_SIZE, DEFAULT_WINDOW_SIZE);

        if (threshold <= 0) {
            throw new IllegalArgumentException(
                    "threshold must be > 0 for model '" + modelId + "', got: " + threshold);
        }
        if (windowSize < MIN_WINDOW_SIZE) {
            throw new IllegalArgumentException(
                    "windowSize must be >= " + MIN_WINDOW_SIZE + " for model '" + modelId
                            + "', got: " + windowSize);
        }
    }

    @Override
    public DetectionResult evaluate(List<DataPoint> series) {
        Objects.requireNonNull(series, "Series must not be null");

        if (series.size() < windowSize) {
            return DetectionResult.notAnomalous(series);
        }

        DataPoint latest = series.get(series.size() - 1);
        List<DataPoint> baseline = series.subList(series.size() - windowSize, series.size() - 1);
        double current = latest.getValue();

        double mean = computeMean(baseline);
        double stdDev = computeStdDev(baseline, mean);

        if (stdDev == 0) {
            return DetectionResult.notAnomalous(series);
        }

        double zScore = Math.abs(current - mean) / stdDev;
        if (zScore <= threshold) {
            return DetectionResult.notAnomalous(series);
        }

        double score = Math.min(zScore / threshold, 1);
        LOG.debug("Model [{}] fired: value={} mean={} stddev={} z={}", modelId, current, mean, stdDev, zScore);

        return DetectionResult.builder()
                .anomaly(true)
                .score(score)
                .confidence(Math.min(score, 0.95))
                .type(current > mean ? AnomalyType.SPIKE : AnomalyType.DROP)
                .severity(Severity.fromScore(score))
                .expectedValue(mean)
                .actualValue(current)
                .deviation(Math.abs(current - mean))
                .timestamp(latest.getTimestamp())
                .description(String.format(Locale.ROOT,
                        "Statistical anomaly detected: Z-score %.2f (threshold: %s)", zScore, threshold))
                .putMetadata("zScore", zScore)
                .putMetadata("mean", mean)
                .putMetadata("stdDev", stdDev)
                .build();
    }

    @Override
    public String getModelId() {
        return modelId;
    }

    @Override
    public ModelKind getKind() {
        return ModelKind.STATISTICAL;
    }

    // ---------------------------------------------------------------
    // Statistics helpers
    // ---------------------------------------------------------------

    private static double computeMean(List<DataPoint> points) {
        double sum = 0;
        for (DataPoint p : points) {
            sum += p.getValue();
        }
        return sum / points.size();
    }

    private static double computeStdDev(List<DataPoint> points, double mean) {
        double sumSquaredDiff = 0;
        for (DataPoint p : points) {
            double diff = p.getValue() - mean;
            sumSquaredDiff += diff * diff;
        }
        return Math.sqrt(sumSquaredDiff / points.size());
    }
}
