package com.metricsentinel.core.registry;

import com.metricsentinel.core.MutableClock;
import com.metricsentinel.core.model.DetectionPattern;
import com.metricsentinel.core.model.Severity;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link PatternRegistry}.
 */
class PatternRegistryTest {

    private MutableClock clock;
    private PatternRegistry registry;

    @BeforeEach
    void setUp() {
        clock = new MutableClock();
        registry = new PatternRegistry(clock);
    }

    private static DetectionPattern pattern(String name, String severity) {
        DetectionPattern pattern = new DetectionPattern();
        pattern.setName(name);
        pattern.setMatchExpression("error_rate > 10%");
        pattern.setSeverity(severity);
        return pattern;
    }

    @Test
    @DisplayName("Should assign an id and stamp the registration time")
    void shouldRegisterPattern() {
        String id = registry.register(pattern("Error Rate Surge", "CRITICAL"));

        DetectionPattern stored = registry.getPatterns().get(0);
        assertThat(id).startsWith("pattern_");
        assertThat(stored.getId()).isEqualTo(id);
        assertThat(stored.getCreatedAt()).isEqualTo(clock.instant());
        assertThat(stored.resolveSeverity()).isEqualTo(Severity.CRITICAL);
        assertThat(stored.isActive()).isTrue();
    }

    @Test
    @DisplayName("Should keep an explicit id and preserve registration order")
    void shouldKeepExplicitIdAndOrder() {
        DetectionPattern first = pattern("Throughput Drop", "medium");
        first.setId("throughput-drop");
        registry.register(first);
        clock.advance(Duration.ofSeconds(1));
        registry.register(pattern("Memory Leak", "medium"));

        assertThat(registry.getPatterns()).extracting(DetectionPattern::getName)
                .containsExactly("Throughput Drop", "Memory Leak");
        assertThat(registry.getPatterns().get(0).getId()).isEqualTo("throughput-drop");
    }

    @Test
    @DisplayName("Should count active patterns")
    void shouldCountActivePatterns() {
        DetectionPattern inactive = pattern("Disabled", "low");
        inactive.setActive(false);
        registry.register(inactive);
        registry.register(pattern("Enabled", "low"));

        assertThat(registry.size()).isEqualTo(2);
        assertThat(registry.activeCount()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should reject a pattern without a match expression")
    void shouldRejectInvalidPattern() {
        DetectionPattern invalid = pattern("Broken", "high");
        invalid.setMatchExpression(" ");

        assertThatThrownBy(() -> registry.register(invalid))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("matchExpression");
        assertThat(registry.size()).isZero();
    }
}
