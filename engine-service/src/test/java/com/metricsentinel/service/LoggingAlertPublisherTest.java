package com.metricsentinel.service;

import com.metricsentinel.core.config.EngineConfig;
import com.metricsentinel.core.engine.AnomalyEngine;
import com.metricsentinel.core.model.Alert;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link LoggingAlertPublisher}.
 */
class LoggingAlertPublisherTest {

    /** Records what the publisher serializes. */
    private static final class RecordingSerializer extends AlertJsonSerializer {
        private final List<String> written = new ArrayList<>();

        @Override
        public Optional<String> serialize(Alert alert) {
            Optional<String> json = super.serialize(alert);
            json.ifPresent(written::add);
            return json;
        }
    }

    @Test
    @DisplayName("Should publish every alert created by a sweep")
    void shouldPublishSweepAlerts() {
        EngineConfig config = new EngineConfig();
        config.setCleanupIntervalMinutes(0);
        RecordingSerializer serializer = new RecordingSerializer();

        try (AnomalyEngine engine = new AnomalyEngine(config)) {
            engine.addAlertListener(new LoggingAlertPublisher(serializer));
            for (int i = 0; i < 8; i++) {
                engine.addDataPoint("org-1", "api", "latency", 70);
            }
            for (int i = 0; i < 11; i++) {
                engine.addDataPoint("org-1", "api", "latency", i == 10 ? 90 : 100);
            }
            engine.addDataPoint("org-1", "api", "latency", 900);

            assertThat(engine.runSweep()).isEqualTo(1);
        }

        assertThat(serializer.written).hasSize(1);
        assertThat(serializer.written.get(0)).contains("\"resourceId\":\"api\"").contains("\"type\":\"spike\"");
    }
}
