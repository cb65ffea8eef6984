/**
 * Configuration loading and validation for the anomaly detection engine.
 *
 * <p>
 * Sweep cadence, retention, model parameter overrides and detection patterns
 * are defined in YAML and loaded by
 * {@link com.metricsentinel.core.config.EngineConfigLoader} into an
 * {@link com.metricsentinel.core.config.EngineConfig} instance. Validation
 * is performed automatically after parsing to ensure fail-fast behaviour.
 * </p>
 *
 * @since 1.0.0
 */
package com.metricsentinel.core.config;
