package com.metricsentinel.core.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link Severity}.
 */
class SeverityTest {

    @ParameterizedTest(name = "score {0} -> {1}")
    @CsvSource({
            "0.0, LOW",
            "0.49, LOW",
            "0.5, MEDIUM",
            "0.69, MEDIUM",
            "0.7, HIGH",
            "0.89, HIGH",
            "0.9, CRITICAL",
            "1.0, CRITICAL"
    })
    @DisplayName("Should map scores onto the severity ladder")
    void shouldMapScores(double score, Severity expected) {
        assertThat(Severity.fromScore(score)).isEqualTo(expected);
    }

    @Test
    @DisplayName("Should parse case-insensitively and render lowercase ids")
    void shouldParseAndRender() {
        assertThat(Severity.parse(" High ")).isEqualTo(Severity.HIGH);
        assertThat(Severity.CRITICAL.id()).isEqualTo("critical");
    }

    @Test
    @DisplayName("Should reject unknown severities")
    void shouldRejectUnknown() {
        assertThatThrownBy(() -> Severity.parse("urgent"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("urgent");
    }
}
