/**
 * Runnable host process for the anomaly detection engine.
 *
 * <p>
 * This package wires the core engine into a standalone service that accepts
 * metric values over HTTP, sweeps them on a schedule, and publishes alerts
 * as JSON log lines.
 * </p>
 *
 * <h3>Key Classes</h3>
 * <ul>
 * <li>{@link com.metricsentinel.service.AnomalyEngineMain} - main entry
 * point</li>
 * <li>{@link com.metricsentinel.service.ServiceConfig} - environment-driven
 * configuration</li>
 * <li>{@link com.metricsentinel.service.HealthServer} - HTTP health checks and
 * ingest endpoint</li>
 * <li>{@link com.metricsentinel.service.LoggingAlertPublisher} - JSON alert
 * output</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.metricsentinel.service;
