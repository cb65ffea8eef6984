package com.metricsentinel.core.engine;

import com.metricsentinel.core.config.EngineConfig;
import com.metricsentinel.core.detection.DetectionStrategy;
import com.metricsentinel.core.detection.ResultFusion;
import com.metricsentinel.core.detection.StrategyFactory;
import com.metricsentinel.core.model.Alert;
import com.metricsentinel.core.model.AnomalyStats;
import com.metricsentinel.core.model.DataPoint;
import com.metricsentinel.core.model.DetectionModel;
import com.metricsentinel.core.model.DetectionPattern;
import com.metricsentinel.core.model.DetectionResult;
import com.metricsentinel.core.model.SeriesKey;
import com.metricsentinel.core.model.ServiceStats;
import com.metricsentinel.core.model.TrainingData;
import com.metricsentinel.core.registry.ModelRegistry;
import com.metricsentinel.core.registry.PatternRegistry;
import com.metricsentinel.core.store.AlertStore;
import com.metricsentinel.core.store.SeriesStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Facade of the anomaly detection engine.
 *
 * <h3>Pipeline</h3>
 *
 * <pre>
 *   addDataPoint → SeriesStore
 *     → (every sweep) snapshot of each series with enough history
 *     → statistical, rule-based and rank-outlier strategies
 *     → ResultFusion
 *     → AlertStore (anomalous verdicts only)
 *     → AlertListeners
 * </pre>
 *
 * <h3>Scheduling</h3>
 * <p>
 * {@link #start()} schedules the sweep every
 * {@code sweepIntervalSeconds} on a single daemon thread, plus the
 * retention sweep every {@code cleanupIntervalMinutes} when enabled. Sweeps
 * never overlap: a sweep requested while another one runs (for example a
 * manual {@link #runSweep()} during a scheduled tick) is skipped.
 * </p>
 *
 * <h3>Failure isolation</h3>
 * <p>
 * A failure while evaluating one series is logged with its key and the sweep
 * continues with the next series. Each tick is a fresh attempt; nothing is
 * retried.
 * </p>
 *
 * @since 1.0.0
 */
public class AnomalyEngine implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(AnomalyEngine.class);

    public static final int DEFAULT_ALERT_LIMIT = 100;
    public static final int DEFAULT_STATS_DAYS = 7;

    private static final long SHUTDOWN_TIMEOUT_SECONDS = 10;

    private final EngineConfig config;
    private final Clock clock;
    private final SeriesStore seriesStore;
    private final AlertStore alertStore;
    private final ModelRegistry modelRegistry;
    private final PatternRegistry patternRegistry;
    private final List<AlertListener> listeners = new CopyOnWriteArrayList<>();
    private final AtomicBoolean sweepInProgress = new AtomicBoolean(false);

    /** Guarded by {@code this}. */
    private ScheduledExecutorService scheduler;
    private boolean closed;

    /**
     * @param config validated engine configuration
     * @param clock  time source for ingestion, alerts and retention
     * @throws IllegalStateException    if the configuration is invalid
     * @throws IllegalArgumentException if a configured model override is invalid
     */
    public AnomalyEngine(EngineConfig config, Clock clock) {
        this.config = Objects.requireNonNull(config, "EngineConfig must not be null");
        this.clock = Objects.requireNonNull(clock, "Clock must not be null");
        config.validate();

        this.seriesStore = new SeriesStore(config.getSeriesCapacity(), clock);
        this.alertStore = new AlertStore(clock);
        this.modelRegistry = new ModelRegistry(clock, config.getModels());
        this.patternRegistry = new PatternRegistry(clock);
        config.getPatterns().forEach(patternRegistry::register);

        LOG.info("AnomalyEngine initialized with {} model(s) and {} pattern(s)",
                modelRegistry.size(), patternRegistry.size());
    }

    public AnomalyEngine(EngineConfig config) {
        this(config, Clock.systemUTC());
    }

    // ---------------------------------------------------------------
    // Lifecycle
    // ---------------------------------------------------------------

    /**
     * Start the periodic sweep (and retention sweep, if enabled).
     * Calling {@code start()} on a running engine has no effect.
     *
     * @throws IllegalStateException if the engine has been closed
     */
    public synchronized void start() {
        if (closed) {
            throw new IllegalStateException("AnomalyEngine has been closed");
        }
        if (scheduler != null) {
            return;
        }
        scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "anomaly-sweep");
            t.setDaemon(true);
            return t;
        });

        long sweepSeconds = config.sweepInterval().toSeconds();
        scheduler.scheduleAtFixedRate(this::scheduledSweep, sweepSeconds, sweepSeconds, TimeUnit.SECONDS);

        long cleanupMinutes = config.cleanupInterval().toMinutes();
        if (cleanupMinutes > 0) {
            scheduler.scheduleAtFixedRate(this::scheduledCleanup, cleanupMinutes, cleanupMinutes, TimeUnit.MINUTES);
        }
        LOG.info("AnomalyEngine started: sweep every {}s, cleanup every {} min",
                sweepSeconds, cleanupMinutes > 0 ? cleanupMinutes : "never");
    }

    /**
     * @return {@code true} while the periodic sweep is scheduled
     */
    public synchronized boolean isRunning() {
        return scheduler != null && !closed;
    }

    /**
     * Stop scheduling sweeps. A sweep already in progress is allowed to
     * finish. Idempotent.
     * <p>
     * The engine reports not running as soon as this method is entered; the
     * wait for an in-flight sweep happens without holding the engine's
     * monitor, so {@link #isRunning()} never blocks on it.
     * </p>
     */
    @Override
    public void close() {
        ScheduledExecutorService toStop;
        synchronized (this) {
            if (closed) {
                return;
            }
            closed = true;
            toStop = scheduler;
        }
        if (toStop == null) {
            return;
        }
        toStop.shutdown();
        try {
            if (!toStop.awaitTermination(SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                LOG.warn("Sweep did not finish within {}s, interrupting", SHUTDOWN_TIMEOUT_SECONDS);
                toStop.shutdownNow();
            }
        } catch (InterruptedException e) {
            toStop.shutdownNow();
            Thread.currentThread().interrupt();
        }
        LOG.info("AnomalyEngine stopped");
    }

    // ---------------------------------------------------------------
    // Ingest
    // ---------------------------------------------------------------

    /**
     * Record a metric value, stamped with the current time.
     *
     * @return {@code false} if the value was dropped because it is not finite
     * @throws NullPointerException     if an identifier is {@code null}
     * @throws IllegalArgumentException if an identifier is blank
     */
    public boolean addDataPoint(String organizationId, String resourceId, String metricName,
            double value, Map<String, Object> metadata) {
        return seriesStore.addDataPoint(SeriesKey.of(organizationId, resourceId, metricName), value, metadata);
    }

    public boolean addDataPoint(String organizationId, String resourceId, String metricName, double value) {
        return addDataPoint(organizationId, resourceId, metricName, value, null);
    }

    /**
     * @return immutable copy of one series, oldest first; empty if unknown
     */
    public List<DataPoint> getSeries(String organizationId, String resourceId, String metricName) {
        return seriesStore.snapshot(SeriesKey.of(organizationId, resourceId, metricName));
    }

    // ---------------------------------------------------------------
    // Sweep
    // ---------------------------------------------------------------

    /**
     * Evaluate every series with enough history and create alerts for
     * anomalous verdicts.
     *
     * @return number of alerts created; 0 if another sweep was in progress
     */
    public int runSweep() {
        if (!sweepInProgress.compareAndSet(false, true)) {
            LOG.warn("Sweep already in progress, skipping this one");
            return 0;
        }
        try {
            long startNanos = System.nanoTime();
            List<DetectionStrategy> strategies = StrategyFactory.createAll(modelRegistry.getModels());
            int evaluated = 0;
            int created = 0;
            int failed = 0;

            for (SeriesKey key : seriesStore.keys()) {
                List<DataPoint> series = seriesStore.snapshot(key);
                if (series.size() < config.getMinSweepPoints()) {
                    continue;
                }
                evaluated++;
                try {
                    DetectionResult fused = evaluate(key, series, strategies);
                    if (fused.isAnomaly()) {
                        publish(alertStore.createAlert(key, fused));
                        created++;
                    }
                } catch (RuntimeException e) {
                    failed++;
                    LOG.error("Evaluation of series {} failed, continuing with next series", key, e);
                }
            }

            long durationMs = (System.nanoTime() - startNanos) / 1_000_000;
            LOG.debug("Sweep finished in {} ms: evaluated={} alerts={} failed={}",
                    durationMs, evaluated, created, failed);
            return created;
        } finally {
            sweepInProgress.set(false);
        }
    }

    /**
     * Run every strategy over one series snapshot and fuse the verdicts.
     *
     * @param key        the series key
     * @param series     immutable snapshot, oldest first
     * @param strategies strategies in evaluation order
     * @return the fused verdict
     */
    protected DetectionResult evaluate(SeriesKey key, List<DataPoint> series, List<DetectionStrategy> strategies) {
        List<DetectionResult> results = new ArrayList<>(strategies.size());
        for (DetectionStrategy strategy : strategies) {
            results.add(strategy.evaluate(series));
        }
        return ResultFusion.fuse(results);
    }

    private void publish(Alert alert) {
        LOG.warn("Anomaly alert created: id={} series={}/{}/{} type={} severity={} score={}",
                alert.getId(), alert.getOrganizationId(), alert.getResourceId(), alert.getMetricName(),
                alert.getResult().getType().id(), alert.getResult().getSeverity().id(),
                alert.getResult().getScore());
        for (AlertListener listener : listeners) {
            try {
                listener.onAlert(alert);
            } catch (RuntimeException e) {
                LOG.error("Alert listener {} failed for alert {}", listener, alert.getId(), e);
            }
        }
    }

    private void scheduledSweep() {
        try {
            runSweep();
        } catch (RuntimeException e) {
            // an escaping exception would cancel the periodic task
            LOG.error("Scheduled sweep failed", e);
        }
    }

    private void scheduledCleanup() {
        try {
            cleanup();
        } catch (RuntimeException e) {
            LOG.error("Scheduled cleanup failed", e);
        }
    }

    // ---------------------------------------------------------------
    // Alerts
    // ---------------------------------------------------------------

    /**
     * @param organizationId the organization
     * @param resourceId     one resource, or {@code null} for all of them
     * @param limit          maximum number of alerts
     * @return alerts newest first
     */
    public List<Alert> listAlerts(String organizationId, String resourceId, int limit) {
        return alertStore.listAlerts(organizationId, resourceId, limit);
    }

    public List<Alert> listAlerts(String organizationId) {
        return listAlerts(organizationId, null, DEFAULT_ALERT_LIMIT);
    }

    /**
     * Acknowledge an alert. Re-acknowledging keeps the first acknowledgement.
     *
     * @return {@code false} if the id is unknown (e.g. already evicted)
     */
    public boolean acknowledgeAlert(String alertId, String acknowledgedBy) {
        return alertStore.acknowledge(alertId, acknowledgedBy);
    }

    public void addAlertListener(AlertListener listener) {
        listeners.add(Objects.requireNonNull(listener, "AlertListener must not be null"));
    }

    public void removeAlertListener(AlertListener listener) {
        listeners.remove(listener);
    }

    // ---------------------------------------------------------------
    // Patterns & models
    // ---------------------------------------------------------------

    public List<DetectionPattern> getPatterns() {
        return patternRegistry.getPatterns();
    }

    /**
     * @return the id of the registered pattern
     * @throws IllegalStateException if the pattern is invalid
     */
    public String registerPattern(DetectionPattern pattern) {
        return patternRegistry.register(pattern);
    }

    public List<DetectionModel> getModels() {
        return modelRegistry.getModels();
    }

    public Optional<DetectionModel> getModel(String modelId) {
        return modelRegistry.get(modelId);
    }

    /**
     * @return {@code false} if the model id is unknown
     * @throws IllegalArgumentException if the training parameters are invalid
     */
    public boolean trainModel(String modelId, TrainingData trainingData) {
        return modelRegistry.train(modelId, trainingData);
    }

    // ---------------------------------------------------------------
    // Statistics
    // ---------------------------------------------------------------

    /**
     * @param organizationId the organization
     * @param days           look-back window in days; must be &gt; 0
     * @return statistics over the organization's alerts in the window
     */
    public AnomalyStats getStats(String organizationId, int days) {
        if (days <= 0) {
            throw new IllegalArgumentException("days must be > 0, got: " + days);
        }
        Instant cutoff = clock.instant().minus(Duration.ofDays(days));
        return AnomalyStats.of(alertStore.alertsSince(organizationId, cutoff));
    }

    public AnomalyStats getStats(String organizationId) {
        return getStats(organizationId, DEFAULT_STATS_DAYS);
    }

    public ServiceStats getServiceStats() {
        return new ServiceStats(
                modelRegistry.size(),
                modelRegistry.trainedCount(),
                patternRegistry.size(),
                patternRegistry.activeCount(),
                alertStore.count(),
                seriesStore.totalPoints(),
                seriesStore.keys().size());
    }

    // ---------------------------------------------------------------
    // Retention
    // ---------------------------------------------------------------

    /**
     * Remove data points and alerts older than the configured retention ages.
     *
     * @return total number of points and alerts removed
     */
    public int cleanup() {
        int points = seriesStore.retentionSweep(config.dataRetention());
        int alerts = alertStore.retentionSweep(config.alertRetention());
        if (points + alerts > 0) {
            LOG.info("Cleanup completed: removed {} data point(s) and {} alert(s)", points, alerts);
        }
        return points + alerts;
    }
}
