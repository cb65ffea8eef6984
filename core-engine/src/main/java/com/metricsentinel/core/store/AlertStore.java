package com.metricsentinel.core.store;

import com.metricsentinel.core.model.Alert;
import com.metricsentinel.core.model.DetectionResult;
import com.metricsentinel.core.model.SeriesKey;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * In-process registry of alerts, grouped per (organization, resource).
 *
 * <h3>Lifecycle</h3>
 * <p>
 * An alert is created once, may be acknowledged once, and disappears only
 * through {@link #retentionSweep(Duration)}. Acknowledging an alert that is
 * already acknowledged is a no-op that still reports success and keeps the
 * original {@code acknowledgedBy} / {@code acknowledgedAt}.
 * </p>
 *
 * <h3>Thread Safety</h3>
 * <p>
 * A single {@link ReadWriteLock} guards every list. Queries take the read
 * lock and return immutable alerts; creation, acknowledgement and retention
 * take the write lock.
 * </p>
 *
 * @since 1.0.0
 */
public class AlertStore {

    private static final Logger LOG = LoggerFactory.getLogger(AlertStore.class);

    static final String ID_PREFIX = "anomaly_";

    /** Creation time descending; alerts created at the same instant newest first. */
    private static final Comparator<StoredAlert> NEWEST_FIRST =
            Comparator.comparing((StoredAlert s) -> s.alert.getCreatedAt())
                    .thenComparingLong(s -> s.sequence)
                    .reversed();

    private final Clock clock;
    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    /** Alerts per (organization, resource), in creation order. */
    private final Map<ResourceKey, List<StoredAlert>> alerts = new LinkedHashMap<>();

    /** Guarded by the write lock. */
    private long nextSequence;

    public AlertStore(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "Clock must not be null");
    }

    public AlertStore() {
        this(Clock.systemUTC());
    }

    /**
     * Record a new alert for an anomalous verdict.
     *
     * @param key    the series that produced the verdict
     * @param result the fused verdict
     * @return the stored alert
     */
    public Alert createAlert(SeriesKey key, DetectionResult result) {
        Objects.requireNonNull(key, "SeriesKey must not be null");
        Objects.requireNonNull(result, "DetectionResult must not be null");

        Alert alert = Alert.builder()
                .id(ID_PREFIX + UUID.randomUUID())
                .seriesKey(key)
                .result(result)
                .createdAt(clock.instant())
                .build();

        lock.writeLock().lock();
        try {
            alerts.computeIfAbsent(new ResourceKey(key.getOrganizationId(), key.getResourceId()),
                    k -> new ArrayList<>()).add(new StoredAlert(nextSequence++, alert));
        } finally {
            lock.writeLock().unlock();
        }
        return alert;
    }

    /**
     * Mark an alert as acknowledged.
     *
     * @param alertId the alert id
     * @param who     identity of the acknowledging user
     * @return {@code true} if the alert exists (acknowledged now or earlier),
     *         {@code false} if the id is unknown
     */
    public boolean acknowledge(String alertId, String who) {
        if (alertId == null) {
            return false;
        }
        lock.writeLock().lock();
        try {
            for (List<StoredAlert> list : alerts.values()) {
                for (StoredAlert stored : list) {
                    Alert alert = stored.alert;
                    if (!alert.getId().equals(alertId)) {
                        continue;
                    }
                    if (!alert.isAcknowledged()) {
                        stored.alert = alert.acknowledged(who, clock.instant());
                        LOG.info("Alert acknowledged: id={} by={}", alertId, who);
                    } else {
                        LOG.debug("Alert {} already acknowledged by {}", alertId, alert.getAcknowledgedBy());
                    }
                    return true;
                }
            }
            return false;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * List alerts newest first.
     *
     * @param organizationId the organization; must not be {@code null}
     * @param resourceId     restrict to one resource, or {@code null} for all
     *                       resources of the organization
     * @param limit          maximum number of alerts; non-positive yields an
     *                       empty list
     * @return immutable list sorted by {@code createdAt} descending, ties
     *         broken by creation order
     */
    public List<Alert> listAlerts(String organizationId, String resourceId, int limit) {
        Objects.requireNonNull(organizationId, "organizationId must not be null");
        if (limit <= 0) {
            return List.of();
        }
        List<StoredAlert> matching = collect(organizationId, resourceId, null);
        matching.sort(NEWEST_FIRST);
        List<Alert> result = new ArrayList<>(Math.min(limit, matching.size()));
        for (StoredAlert stored : matching.subList(0, Math.min(limit, matching.size()))) {
            result.add(stored.alert);
        }
        return List.copyOf(result);
    }

    /**
     * @param organizationId the organization; must not be {@code null}
     * @param cutoff         include alerts created at or after this instant
     * @return every matching alert of the organization, unordered
     */
    public List<Alert> alertsSince(String organizationId, Instant cutoff) {
        Objects.requireNonNull(organizationId, "organizationId must not be null");
        Objects.requireNonNull(cutoff, "cutoff must not be null");
        List<Alert> result = new ArrayList<>();
        for (StoredAlert stored : collect(organizationId, null, cutoff)) {
            result.add(stored.alert);
        }
        return List.copyOf(result);
    }

    /**
     * Drop alerts older than {@code maxAge}, acknowledged or not.
     *
     * @param maxAge retention age; must not be negative
     * @return number of alerts removed
     */
    public int retentionSweep(Duration maxAge) {
        Objects.requireNonNull(maxAge, "maxAge must not be null");
        if (maxAge.isNegative()) {
            throw new IllegalArgumentException("maxAge must not be negative, got: " + maxAge);
        }
        Instant cutoff = clock.instant().minus(maxAge);
        int removed = 0;

        lock.writeLock().lock();
        try {
            for (List<StoredAlert> list : alerts.values()) {
                int before = list.size();
                list.removeIf(s -> s.alert.getCreatedAt().isBefore(cutoff));
                removed += before - list.size();
            }
            alerts.values().removeIf(List::isEmpty);
        } finally {
            lock.writeLock().unlock();
        }
        return removed;
    }

    /**
     * @return number of alerts currently held
     */
    public int count() {
        lock.readLock().lock();
        try {
            int total = 0;
            for (List<StoredAlert> list : alerts.values()) {
                total += list.size();
            }
            return total;
        } finally {
            lock.readLock().unlock();
        }
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private List<StoredAlert> collect(String organizationId, String resourceId, Instant cutoff) {
        List<StoredAlert> result = new ArrayList<>();
        lock.readLock().lock();
        try {
            for (Map.Entry<ResourceKey, List<StoredAlert>> entry : alerts.entrySet()) {
                ResourceKey k = entry.getKey();
                if (!k.organizationId.equals(organizationId)
                        || (resourceId != null && !k.resourceId.equals(resourceId))) {
                    continue;
                }
                for (StoredAlert stored : entry.getValue()) {
                    if (cutoff == null || !stored.alert.getCreatedAt().isBefore(cutoff)) {
                        result.add(stored);
                    }
                }
            }
        } finally {
            lock.readLock().unlock();
        }
        return result;
    }

    /** An alert plus its position in the store's creation order. */
    private static final class StoredAlert {
        private final long sequence;
        private Alert alert;

        StoredAlert(long sequence, Alert alert) {
            this.sequence = sequence;
            this.alert = alert;
        }
    }

    private static final class ResourceKey {
        private final String organizationId;
        private final String resourceId;

        ResourceKey(String organizationId, String resourceId) {
            this.organizationId = organizationId;
            this.resourceId = resourceId;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o)
                return true;
            if (!(o instanceof ResourceKey that))
                return false;
            return organizationId.equals(that.organizationId) && resourceId.equals(that.resourceId);
        }

        @Override
        public int hashCode() {
            return Objects.hash(organizationId, resourceId);
        }
    }
}
