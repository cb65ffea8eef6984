package com.metricsentinel.core.registry;

import com.metricsentinel.core.model.DetectionPattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * Registry of operator-authored detection patterns.
 *
 * <p>
 * Patterns are metadata for dashboards and never expire. Registration order
 * is preserved; callers receive copies.
 * </p>
 *
 * @since 1.0.0
 */
public class PatternRegistry {

    private static final Logger LOG = LoggerFactory.getLogger(PatternRegistry.class);

    static final String ID_PREFIX = "pattern_";

    private final Clock clock;
    private final Map<String, DetectionPattern> patterns = new LinkedHashMap<>();

    public PatternRegistry(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "Clock must not be null");
    }

    /**
     * Register a pattern.
     *
     * <p>
     * A pattern without an id gets a generated {@code pattern_<uuid>} id;
     * {@code createdAt} is always stamped at registration. Registering an id
     * that already exists replaces the earlier pattern.
     * </p>
     *
     * @param pattern the pattern; must not be {@code null}
     * @return the id under which the pattern is stored
     * @throws IllegalStateException if the pattern fails validation
     */
    public synchronized String register(DetectionPattern pattern) {
        Objects.requireNonNull(pattern, "DetectionPattern must not be null");
        pattern.validate();

        DetectionPattern stored = new DetectionPattern(pattern);
        if (stored.getId() == null || stored.getId().isBlank()) {
            stored.setId(ID_PREFIX + UUID.randomUUID());
        }
        stored.setCreatedAt(clock.instant());

        patterns.put(stored.getId(), stored);
        LOG.info("Detection pattern registered: id={} name={}", stored.getId(), stored.getName());
        return stored.getId();
    }

    /**
     * @return copies of all patterns in registration order
     */
    public synchronized List<DetectionPattern> getPatterns() {
        List<DetectionPattern> copies = new ArrayList<>(patterns.size());
        for (DetectionPattern pattern : patterns.values()) {
            copies.add(new DetectionPattern(pattern));
        }
        return copies;
    }

    public synchronized int size() {
        return patterns.size();
    }

    public synchronized int activeCount() {
        return (int) patterns.values().stream().filter(DetectionPattern::isActive).count();
    }
}
