/**
 * Engine facade and sweep scheduling.
 *
 * <p>
 * {@link com.metricsentinel.core.engine.AnomalyEngine} owns the series and
 * alert stores and the model and pattern registries, drives the periodic
 * sweep, and notifies {@link com.metricsentinel.core.engine.AlertListener}s
 * of every new alert.
 * </p>
 *
 * @since 1.0.0
 */
package com.metricsentinel.core.engine;
