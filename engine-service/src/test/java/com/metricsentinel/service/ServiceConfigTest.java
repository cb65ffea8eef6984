package com.metricsentinel.service;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link ServiceConfig}.
 */
class ServiceConfigTest {

    @Test
    @DisplayName("Should use defaults when nothing is set")
    void shouldUseDefaults() {
        ServiceConfig config = new ServiceConfig.Builder().build();

        assertThat(config.getHealthPort()).isEqualTo(8080);
        assertThat(config.getShutdownTimeoutSeconds()).isEqualTo(10);
        assertThat(config.hasEngineConfigPath()).isFalse();
    }

    @Test
    @DisplayName("Should keep explicit values")
    void shouldKeepExplicitValues() {
        ServiceConfig config = new ServiceConfig.Builder()
                .healthPort(9090)
                .engineConfigPath("/etc/metric-sentinel/anomaly-engine.yml")
                .shutdownTimeoutSeconds(0)
                .build();

        assertThat(config.getHealthPort()).isEqualTo(9090);
        assertThat(config.hasEngineConfigPath()).isTrue();
        assertThat(config.getEngineConfigPath()).isEqualTo("/etc/metric-sentinel/anomaly-engine.yml");
        assertThat(config.getShutdownTimeoutSeconds()).isZero();
    }

    @Test
    @DisplayName("Should treat a null config path as unset")
    void shouldTreatNullPathAsUnset() {
        ServiceConfig config = new ServiceConfig.Builder().engineConfigPath(null).build();

        assertThat(config.hasEngineConfigPath()).isFalse();
    }

    @Test
    @DisplayName("Should reject a port outside [1, 65535]")
    void shouldRejectInvalidPort() {
        assertThatThrownBy(() -> new ServiceConfig.Builder().healthPort(0).build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("healthPort");
        assertThatThrownBy(() -> new ServiceConfig.Builder().healthPort(70_000).build())
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Should reject a negative shutdown timeout")
    void shouldRejectNegativeTimeout() {
        assertThatThrownBy(() -> new ServiceConfig.Builder().shutdownTimeoutSeconds(-1).build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("shutdownTimeoutSeconds");
    }
}
