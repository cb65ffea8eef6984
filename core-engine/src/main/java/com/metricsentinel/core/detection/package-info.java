/**
 * Detection strategies and verdict fusion.
 *
 * <p>
 * All strategies implement the
 * {@link com.metricsentinel.core.detection.DetectionStrategy}
 * interface and are instantiated via
 * {@link com.metricsentinel.core.detection.StrategyFactory}.
 * Built-in strategies:
 * </p>
 * <ul>
 * <li>{@link com.metricsentinel.core.detection.StatisticalStrategy} - z-score
 * over a trailing window</li>
 * <li>{@link com.metricsentinel.core.detection.RuleBasedStrategy} - spike /
 * drop ratio against the recent average</li>
 * <li>{@link com.metricsentinel.core.detection.RankOutlierStrategy} - rank
 * distance from the tails of the sorted series</li>
 * </ul>
 *
 * <p>
 * {@link com.metricsentinel.core.detection.ResultFusion} merges the three
 * verdicts into the one the engine acts on.
 * </p>
 *
 * <h3>Extending</h3>
 * <p>
 * To add a new strategy, implement {@code DetectionStrategy}, add a
 * {@code ModelKind} constant and map it in {@code StrategyFactory.create()}.
 * </p>
 *
 * @since 1.0.0
 */
package com.metricsentinel.core.detection;
