package com.metricsentinel.service;

import com.metricsentinel.core.config.EngineConfig;
import com.metricsentinel.core.config.EngineConfigLoader;
import com.metricsentinel.core.engine.AnomalyEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CountDownLatch;

/**
 * Main entry point of the anomaly engine service.
 *
 * <h3>Process</h3>
 *
 * <pre>
 *   env vars → ServiceConfig
 *   anomaly-engine.yml → EngineConfig → AnomalyEngine (sweep scheduler)
 *     → LoggingAlertPublisher (metricsentinel.alerts logger)
 *   HealthServer: /health, /readiness, POST /ingest
 * </pre>
 *
 * <p>
 * The process runs until it receives a termination signal; the shutdown hook
 * stops the HTTP server first, then the engine.
 * </p>
 *
 * @since 1.0.0
 */
public final class AnomalyEngineMain {

    private static final Logger LOG = LoggerFactory.getLogger(AnomalyEngineMain.class);

    private AnomalyEngineMain() {
        // entry-point class, not instantiable
    }

    public static void main(String[] args) throws InterruptedException {
        // 1. Load configuration
        ServiceConfig config = ServiceConfig.fromEnvironment();
        LOG.info("Starting anomaly engine service with config: {}", config);
        EngineConfig engineConfig = loadEngineConfig(config);

        // 2. Build the engine and attach the alert publisher
        AnomalyEngine engine = new AnomalyEngine(engineConfig);
        engine.addAlertListener(new LoggingAlertPublisher(new AlertJsonSerializer()));

        // 3. Start sweeping and serving
        engine.start();
        HealthServer healthServer = new HealthServer(engine, new IngestRequestParser());
        healthServer.start(config.getHealthPort());

        // 4. Block until shutdown
        CountDownLatch stopped = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            LOG.info("Shutting down anomaly engine service");
            healthServer.stop(config.getShutdownTimeoutSeconds());
            engine.close();
            stopped.countDown();
        }, "engine-shutdown"));
        stopped.await();
    }

    private static EngineConfig loadEngineConfig(ServiceConfig config) {
        return EngineConfigLoader.load(config.hasEngineConfigPath() ? config.getEngineConfigPath() : null);
    }
}
