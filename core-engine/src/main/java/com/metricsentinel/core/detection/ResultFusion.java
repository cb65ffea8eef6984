package com.metricsentinel.core.detection;

import com.metricsentinel.core.model.DetectionResult;

import java.util.List;
import java.util.Objects;

/**
 * Combines per-strategy verdicts into a single verdict.
 *
 * <p>
 * Inputs are positional: statistical, rule-based, rank-outlier, weighted
 * {@code 0.4 / 0.3 / 0.3}. When no input is anomalous the first input is
 * returned unchanged. Otherwise score and confidence are weighted means over
 * the anomalous inputs only, with the weights renormalised over that subset.
 * Every other field is copied from the anomalous input with the highest
 * individual score; on equal scores the earlier input wins.
 * </p>
 *
 * @since 1.0.0
 */
public final class ResultFusion {

    /** Weights by evaluation position: statistical, rule-based, rank-outlier. */
    static final double[] WEIGHTS = {0.4, 0.3, 0.3};

    static final String DESCRIPTION_PREFIX = "Combined anomaly detection: ";

    private ResultFusion() {
        // utility class, not instantiable
    }

    /**
     * @param results verdicts in evaluation order; one to three entries
     * @return the fused verdict
     * @throws NullPointerException     if {@code results} or an entry is {@code null}
     * @throws IllegalArgumentException if {@code results} is empty or has more
     *                                  entries than there are weights
     */
    public static DetectionResult fuse(List<DetectionResult> results) {
        Objects.requireNonNull(results, "Results must not be null");
        if (results.isEmpty() || results.size() > WEIGHTS.length) {
            throw new IllegalArgumentException(
                    "Fusion expects 1.." + WEIGHTS.length + " results, got: " + results.size());
        }

        double weightedScore = 0;
        double weightedConfidence = 0;
        double totalWeight = 0;
        DetectionResult best = null;

        for (int i = 0; i < results.size(); i++) {
            DetectionResult result = Objects.requireNonNull(results.get(i), "Result at index " + i + " is null");
            if (!result.isAnomaly()) {
                continue;
            }
            weightedScore += result.getScore() * WEIGHTS[i];
            weightedConfidence += result.getConfidence() * WEIGHTS[i];
            totalWeight += WEIGHTS[i];
            if (best == null || result.getScore() > best.getScore()) {
                best = result;
            }
        }

        if (best == null) {
            return results.get(0);
        }

        return best.toBuilder()
                .score(weightedScore / totalWeight)
                .confidence(weightedConfidence / totalWeight)
                .description(DESCRIPTION_PREFIX + best.getDescription())
                .build();
    }
}
