package com.metricsentinel.core.store;

import com.metricsentinel.core.model.DataPoint;
import com.metricsentinel.core.model.SeriesKey;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Capacity-bounded, append-only store of time series.
 *
 * <h3>Eviction</h3>
 * <p>
 * Each series holds at most {@code capacity} points. Appending to a full
 * series evicts the oldest point first, so the retained points are always the
 * most recent ones in arrival order.
 * </p>
 *
 * <h3>Thread Safety</h3>
 * <p>
 * Series are created lazily in a {@link ConcurrentHashMap}. Every series is
 * guarded by its own monitor; appends, evictions, retention sweeps and
 * snapshots of the same series are mutually exclusive, so a reader never
 * observes a half-applied append or eviction.
 * </p>
 *
 * @since 1.0.0
 */
public class SeriesStore {

    private static final Logger LOG = LoggerFactory.getLogger(SeriesStore.class);

    public static final int DEFAULT_CAPACITY = 1000;

    private final int capacity;
    private final Clock clock;
    private final Map<SeriesKey, Series> series = new ConcurrentHashMap<>();

    /**
     * @param capacity maximum points per series; must be &gt; 0
     * @param clock    source of ingestion timestamps
     * @throws IllegalArgumentException if {@code capacity} is not positive
     */
    public SeriesStore(int capacity, Clock clock) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be > 0, got: " + capacity);
        }
        this.capacity = capacity;
        this.clock = Objects.requireNonNull(clock, "Clock must not be null");
    }

    public SeriesStore() {
        this(DEFAULT_CAPACITY, Clock.systemUTC());
    }

    /**
     * Append a value stamped with the current time.
     *
     * <p>
     * Non-finite values are dropped with a warning.
     * </p>
     *
     * @param key      the series key; must not be {@code null}
     * @param value    the observed value
     * @param metadata optional attributes, may be {@code null}
     * @return {@code true} if the point was appended
     */
    public boolean addDataPoint(SeriesKey key, double value, Map<String, Object> metadata) {
        Objects.requireNonNull(key, "SeriesKey must not be null");
        if (!Double.isFinite(value)) {
            LOG.warn("Dropping non-finite value {} for series {}", value, key);
            return false;
        }
        DataPoint point = new DataPoint(clock.instant(), value, metadata);
        series.computeIfAbsent(key, k -> new Series()).append(point, capacity);
        return true;
    }

    /**
     * Return an immutable copy of a series.
     *
     * @param key the series key
     * @return the points oldest first; empty if the series is unknown
     */
    public List<DataPoint> snapshot(SeriesKey key) {
        Series s = series.get(key);
        return s != null ? s.snapshot() : List.of();
    }

    /**
     * @return a point-in-time copy of all known keys
     */
    public Set<SeriesKey> keys() {
        return Set.copyOf(series.keySet());
    }

    /**
     * @return number of points currently held for {@code key}
     */
    public int size(SeriesKey key) {
        Series s = series.get(key);
        return s != null ? s.size() : 0;
    }

    /**
     * @return number of points across all series
     */
    public long totalPoints() {
        long total = 0;
        for (Series s : series.values()) {
            total += s.size();
        }
        return total;
    }

    /**
     * Remove every point older than {@code maxAge} from every series.
     *
     * <p>
     * Emptied series stay registered; they refill on the next append.
     * </p>
     *
     * @param maxAge retention age; must not be negative
     * @return number of points removed
     */
    public int retentionSweep(Duration maxAge) {
        Objects.requireNonNull(maxAge, "maxAge must not be null");
        if (maxAge.isNegative()) {
            throw new IllegalArgumentException("maxAge must not be negative, got: " + maxAge);
        }
        Instant cutoff = clock.instant().minus(maxAge);
        int removed = 0;
        for (Series s : series.values()) {
            removed += s.removeOlderThan(cutoff);
        }
        if (removed > 0) {
            LOG.debug("Series retention removed {} point(s) older than {}", removed, cutoff);
        }
        return removed;
    }

    public int getCapacity() {
        return capacity;
    }

    // ---------------------------------------------------------------
    // Series
    // ---------------------------------------------------------------

    /** One series, guarded by its own monitor. */
    private static final class Series {

        private final Deque<DataPoint> points = new ArrayDeque<>();

        synchronized void append(DataPoint point, int capacity) {
            points.addLast(point);
            while (points.size() > capacity) {
                points.pollFirst();
            }
        }

        synchronized List<DataPoint> snapshot() {
            return List.copyOf(points);
        }

        synchronized int size() {
            return points.size();
        }

        synchronized int removeOlderThan(Instant cutoff) {
            int before = points.size();
            points.removeIf(p -> p.getTimestamp().isBefore(cutoff));
            return before - points.size();
        }
    }
}
