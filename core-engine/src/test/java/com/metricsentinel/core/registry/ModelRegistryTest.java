package com.metricsentinel.core.registry;

import com.metricsentinel.core.MutableClock;
import com.metricsentinel.core.model.DetectionModel;
import com.metricsentinel.core.model.TrainingData;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link ModelRegistry}.
 */
class ModelRegistryTest {

    private MutableClock clock;
    private ModelRegistry registry;

    @BeforeEach
    void setUp() {
        clock = new MutableClock();
        registry = new ModelRegistry(clock);
    }

    @Test
    @DisplayName("Should seed the three built-in models in evaluation order")
    void shouldSeedBuiltIns() {
        List<DetectionModel> models = registry.getModels();

        assertThat(models).extracting(DetectionModel::getId)
                .containsExactly(ModelRegistry.STATISTICAL_ID, ModelRegistry.RULE_BASED_ID,
                        ModelRegistry.RANK_OUTLIER_ID);
        assertThat(models).extracting(DetectionModel::getKind)
                .containsExactly("statistical", "rule_based", "rank_outlier");
        assertThat(models.get(0).getParameter("threshold", 0)).isEqualTo(2.5);
        assertThat(registry.trainedCount()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should hand out copies that do not affect the registry")
    void shouldReturnCopies() {
        DetectionModel copy = registry.get(ModelRegistry.STATISTICAL_ID).orElseThrow();
        copy.setParameters(Map.of("threshold", 99.0));
        copy.setTrained(true);

        DetectionModel stored = registry.get(ModelRegistry.STATISTICAL_ID).orElseThrow();
        assertThat(stored.getParameter("threshold", 0)).isEqualTo(2.5);
        assertThat(stored.isTrained()).isFalse();
    }

    @Test
    @DisplayName("Should return false when training an unknown model")
    void shouldNotTrainUnknownModel() {
        assertThat(registry.train("neural-net", TrainingData.ofSamples(List.of(1.0)))).isFalse();
        assertThat(registry.get("neural-net")).isEmpty();
    }

    @Test
    @DisplayName("Should merge parameters and record the training run")
    void shouldTrainModel() {
        TrainingData data = new TrainingData(List.of(1.0, 2.0, 3.0), Map.of("threshold", 3.5), 0.87);

        assertThat(registry.train(ModelRegistry.STATISTICAL_ID, data)).isTrue();

        DetectionModel trained = registry.get(ModelRegistry.STATISTICAL_ID).orElseThrow();
        assertThat(trained.isTrained()).isTrue();
        assertThat(trained.getParameter("threshold", 0)).isEqualTo(3.5);
        assertThat(trained.getParameter("windowSize", 0)).isEqualTo(100);
        assertThat(trained.getAccuracy()).isEqualTo(0.87);
        assertThat(trained.getLastTrainedAt()).isEqualTo(clock.instant());
        assertThat(trained.getTrainingSampleCount()).isEqualTo(3);
        assertThat(registry.trainedCount()).isEqualTo(2);
    }

    @Test
    @DisplayName("Should leave the same parameters when training is repeated")
    void shouldBeIdempotent() {
        TrainingData data = new TrainingData(List.of(), Map.of("contamination", 0.2), null);

        registry.train(ModelRegistry.RANK_OUTLIER_ID, data);
        Map<String, Double> afterFirst = registry.get(ModelRegistry.RANK_OUTLIER_ID).orElseThrow().getParameters();
        registry.train(ModelRegistry.RANK_OUTLIER_ID, data);

        assertThat(registry.get(ModelRegistry.RANK_OUTLIER_ID).orElseThrow().getParameters())
                .isEqualTo(afterFirst)
                .containsEntry("contamination", 0.2);
    }

    @Test
    @DisplayName("Should reject training parameters the strategy cannot run with")
    void shouldRejectInvalidTraining() {
        TrainingData data = new TrainingData(List.of(), Map.of("contamination", 1.5), null);

        assertThatThrownBy(() -> registry.train(ModelRegistry.RANK_OUTLIER_ID, data))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("contamination");
        assertThat(registry.get(ModelRegistry.RANK_OUTLIER_ID).orElseThrow().getParameter("contamination", 0))
                .isEqualTo(0.1);
    }

    @Test
    @DisplayName("Should reject an accuracy outside [0, 1]")
    void shouldRejectInvalidAccuracy() {
        TrainingData data = new TrainingData(List.of(), Map.of(), 1.5);

        assertThatThrownBy(() -> registry.train(ModelRegistry.RULE_BASED_ID, data))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("accuracy");
    }

    @Test
    @DisplayName("Should apply configured parameter overrides to built-ins")
    void shouldApplyOverrides() {
        DetectionModel override = new DetectionModel();
        override.setId(ModelRegistry.RULE_BASED_ID);
        override.setParameters(Map.of("spikeThreshold", 5.0));

        ModelRegistry configured = new ModelRegistry(clock, List.of(override));

        DetectionModel model = configured.get(ModelRegistry.RULE_BASED_ID).orElseThrow();
        assertThat(model.getParameter("spikeThreshold", 0)).isEqualTo(5.0);
        assertThat(model.getParameter("dropThreshold", 0)).isEqualTo(0.3);
        assertThat(model.getKind()).isEqualTo("rule_based");
    }

    @Test
    @DisplayName("Should reject overrides for unknown ids or with a different kind")
    void shouldRejectInvalidOverrides() {
        DetectionModel unknown = new DetectionModel();
        unknown.setId("neural-net");
        DetectionModel wrongKind = new DetectionModel();
        wrongKind.setId(ModelRegistry.STATISTICAL_ID);
        wrongKind.setKind("rule_based");

        assertThatThrownBy(() -> new ModelRegistry(clock, List.of(unknown)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("neural-net");
        assertThatThrownBy(() -> new ModelRegistry(clock, List.of(wrongKind)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("kind");
    }
}
