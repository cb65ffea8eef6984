package com.metricsentinel.core.detection;

import com.metricsentinel.core.model.AnomalyType;
import com.metricsentinel.core.model.DataPoint;
import com.metricsentinel.core.model.DetectionModel;
import com.metricsentinel.core.model.DetectionResult;
import com.metricsentinel.core.model.ModelKind;
import com.metricsentinel.core.model.Severity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Rank-based outlier heuristic.
 *
 * <p>
 * Sorts every value of the series and locates the latest value by its first
 * occurrence in sorted order. The isolation score is the distance from the
 * nearer tail, {@code min(rank, n − 1 − rank)}, divided by {@code n / 2} and
 * capped at 1; the point fires when the score exceeds
 * {@code contamination}.
 * </p>
 *
 * <p>
 * Note that the score grows towards the <em>centre</em> of the distribution,
 * not towards the tails.
 * </p>
 *
 * <p>
 * The heuristic has no expected value; results carry {@code deviation = 0}
 * and no {@code expectedValue}.
 * </p>
 *
 * @since 1.0.0
 */
public class RankOutlierStrategy implements DetectionStrategy {

    private static final Logger LOG = LoggerFactory.getLogger(RankOutlierStrategy.class);

    public static final String PARAM_CONTAMINATION = "contamination";

    static final double DEFAULT_CONTAMINATION = 0.1;

    /** Minimum series length before ranks are considered meaningful. */
    static final int MIN_HISTORY_SIZE = 50;

    private static final double MAX_CONFIDENCE = 0.9;

    private final String modelId;
    private final double contamination;

    /**
     * @param model the rank-outlier model parameters
     * @throws NullPointerException     if {@code model} is {@code null}
     * @throws IllegalArgumentException if {@code contamination} is outside [0, 1)
     */
    public RankOutlierStrategy(DetectionModel model) {
        Objects.requireNonNull(model, "DetectionModel must not be null");
        this.modelId = model.getId();
        this.contamination = model.getParameter(PARAM_CONTAMINATION, DEFAULT_CONTAMINATION);

        if (contamination < 0 || contamination >= 1) {
            throw new IllegalArgumentException(
                    "contamination must be in [0, 1) for model '" + modelId + "', got: " + contamination);
        }
    }

    @Override
    public DetectionResult evaluate(List<DataPoint> series) {
        Objects.requireNonNull(series, "Series must not be null");

        if (series.size() < MIN_HISTORY_SIZE) {
            return DetectionResult.notAnomalous(series);
        }

        DataPoint latest = series.get(series.size() - 1);
        double current = latest.getValue();
        double isolationScore = isolationScore(series, current);

        if (isolationScore <= contamination) {
            return DetectionResult.notAnomalous(series);
        }

        LOG.debug("Model [{}] fired: value={} isolationScore={}", modelId, current, isolationScore);

        return DetectionResult.builder()
                .anomaly(true)
                .score(isolationScore)
                .confidence(Math.min(isolationScore, MAX_CONFIDENCE))
                .type(AnomalyType.OUTLIER)
                .severity(Severity.fromScore(isolationScore))
                .actualValue(current)
                .deviation(0)
                .timestamp(latest.getTimestamp())
                .description(String.format(Locale.ROOT,
                        "ML anomaly detected: isolation score %.3f", isolationScore))
                .putMetadata("isolationScore", isolationScore)
                .putMetadata(PARAM_CONTAMINATION, contamination)
                .build();
    }

    /**
     * @param series non-empty series containing {@code target}
     * @param target the value to rank
     * @return tail distance of {@code target}, normalised to [0, 1]
     */
    static double isolationScore(List<DataPoint> series, double target) {
        double[] sorted = new double[series.size()];
        for (int i = 0; i < sorted.length; i++) {
            sorted[i] = series.get(i).getValue();
        }
        Arrays.sort(sorted);

        int rank = 0;
        while (rank < sorted.length - 1 && Double.compare(sorted[rank], target) != 0) {
            rank++;
        }

        int n = sorted.length;
        int distanceFromEdge = Math.min(rank, n - 1 - rank);
        return Math.min(distanceFromEdge / (n / 2.0), 1);
    }

    @Override
    public String getModelId() {
        return modelId;
    }

    @Override
    public ModelKind getKind() {
        return ModelKind.RANK_OUTLIER;
    }
}
