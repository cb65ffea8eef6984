package com.metricsentinel.core.detection;

import com.metricsentinel.core.model.DataPoint;
import com.metricsentinel.core.model.DetectionResult;
import com.metricsentinel.core.model.ModelKind;

import java.util.List;

/**
 * Contract for all detection strategies.
 * <p>
 * Implementations are <strong>stateless</strong>: every call to
 * {@link #evaluate(List)} receives an immutable snapshot of one series and
 * judges its most recent point. Parameters are fixed at construction from a
 * {@link com.metricsentinel.core.model.DetectionModel} snapshot.
 * </p>
 * <p>
 * A series shorter than the strategy's minimum history, or one whose
 * statistics are degenerate, yields
 * {@link DetectionResult#notAnomalous(List)} rather than an exception.
 * </p>
 */
public interface DetectionStrategy {

    /**
     * Evaluate the latest point of a series.
     *
     * @param series the series, oldest point first; must not be {@code null}
     * @return the verdict for the latest point
     */
    DetectionResult evaluate(List<DataPoint> series);

    /**
     * @return id of the model this strategy was built from
     */
    String getModelId();

    /**
     * @return the strategy family
     */
    ModelKind getKind();
}
