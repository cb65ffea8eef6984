/**
 * Domain model classes for Metric Sentinel.
 *
 * <p>
 * This package contains the value types shared between the stores, the
 * detection strategies and the engine facade:
 * </p>
 * <ul>
 * <li>{@link com.metricsentinel.core.model.DataPoint} and
 * {@link com.metricsentinel.core.model.SeriesKey} - time series input</li>
 * <li>{@link com.metricsentinel.core.model.DetectionResult} - per-strategy or
 * fused verdict</li>
 * <li>{@link com.metricsentinel.core.model.Alert} - acknowledgeable record of
 * an anomalous verdict</li>
 * <li>{@link com.metricsentinel.core.model.DetectionModel} and
 * {@link com.metricsentinel.core.model.DetectionPattern} - configuration
 * POJOs</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.metricsentinel.core.model;
