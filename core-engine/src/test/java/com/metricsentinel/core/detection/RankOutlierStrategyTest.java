package com.metricsentinel.core.detection;

import com.metricsentinel.core.TestSeries;
import com.metricsentinel.core.model.AnomalyType;
import com.metricsentinel.core.model.DetectionModel;
import com.metricsentinel.core.model.DetectionResult;
import com.metricsentinel.core.model.ModelKind;
import com.metricsentinel.core.model.Severity;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static com.metricsentinel.core.TestSeries.repeat;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link RankOutlierStrategy}.
 */
class RankOutlierStrategyTest {

    private static RankOutlierStrategy strategy(double contamination) {
        return new RankOutlierStrategy(new DetectionModel("rank", "Rank", ModelKind.RANK_OUTLIER,
                Map.of("contamination", contamination), false));
    }

    /** 0..99 with 50 moved to the end. */
    private static double[] medianLast() {
        double[] values = new double[100];
        int i = 0;
        for (int v = 0; v < 100; v++) {
            if (v != 50) {
                values[i++] = v;
            }
        }
        values[99] = 50;
        return values;
    }

    @Test
    @DisplayName("Should not fire with fewer than fifty points")
    void shouldNotFireWithInsufficientData() {
        double[] values = new double[49];
        for (int i = 0; i < values.length; i++) {
            values[i] = i;
        }
        values[48] = 24;

        assertThat(strategy(0.1).evaluate(TestSeries.of(values)).isAnomaly()).isFalse();
    }

    @Test
    @DisplayName("Should score a value by its distance from the nearer tail")
    void shouldComputeIsolationScore() {
        double[] ascending = new double[100];
        for (int i = 0; i < ascending.length; i++) {
            ascending[i] = i;
        }

        assertThat(RankOutlierStrategy.isolationScore(TestSeries.of(ascending), 50)).isCloseTo(0.98, within(1e-12));
        assertThat(RankOutlierStrategy.isolationScore(TestSeries.of(ascending), 0)).isZero();
        assertThat(RankOutlierStrategy.isolationScore(TestSeries.of(ascending), 99)).isZero();
        assertThat(RankOutlierStrategy.isolationScore(TestSeries.of(ascending), 25)).isCloseTo(0.5, within(1e-12));
    }

    @Test
    @DisplayName("Should fire when the latest value sits in the middle of the distribution")
    void shouldFireOnCentralValue() {
        DetectionResult result = strategy(0.1).evaluate(TestSeries.of(medianLast()));

        assertThat(result.isAnomaly()).isTrue();
        assertThat(result.getType()).isEqualTo(AnomalyType.OUTLIER);
        assertThat(result.getScore()).isCloseTo(0.98, within(1e-12));
        assertThat(result.getConfidence()).isEqualTo(0.9);
        assertThat(result.getSeverity()).isEqualTo(Severity.CRITICAL);
        assertThat(result.getExpectedValue()).isNull();
        assertThat(result.getDeviation()).isZero();
        assertThat(result.getDescription()).isEqualTo("ML anomaly detected: isolation score 0.980");
    }

    @Test
    @DisplayName("Should not fire when the latest value is the series maximum")
    void shouldNotFireOnTailValue() {
        double[] values = new double[60];
        for (int i = 0; i < values.length; i++) {
            values[i] = i;
        }

        assertThat(strategy(0.1).evaluate(TestSeries.of(values)).isAnomaly()).isFalse();
    }

    @Test
    @DisplayName("Should rank duplicates by their first occurrence")
    void shouldUseFirstOccurrenceForDuplicates() {
        assertThat(strategy(0.1).evaluate(TestSeries.of(repeat(5, 60))).isAnomaly()).isFalse();
    }

    @Test
    @DisplayName("Should not fire when the score equals the contamination")
    void shouldNotFireAtContamination() {
        assertThat(strategy(0.98).evaluate(TestSeries.of(medianLast())).isAnomaly()).isFalse();
    }

    @Test
    @DisplayName("Should reject contamination outside [0, 1)")
    void shouldRejectInvalidContamination() {
        assertThatThrownBy(() -> strategy(1.0))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("contamination");
        assertThatThrownBy(() -> strategy(-0.1))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
