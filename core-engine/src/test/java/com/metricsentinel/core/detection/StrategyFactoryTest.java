package com.metricsentinel.core.detection;

import com.metricsentinel.core.model.DetectionModel;
import com.metricsentinel.core.model.ModelKind;
import com.metricsentinel.core.registry.ModelRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link StrategyFactory}.
 */
class StrategyFactoryTest {

    @Test
    @DisplayName("Should create one strategy per built-in model, in order")
    void shouldCreateAllBuiltIns() {
        List<DetectionStrategy> strategies = StrategyFactory.createAll(ModelRegistry.builtIns());

        assertThat(strategies).hasSize(3);
        assertThat(strategies.get(0)).isInstanceOf(StatisticalStrategy.class);
        assertThat(strategies.get(1)).isInstanceOf(RuleBasedStrategy.class);
        assertThat(strategies.get(2)).isInstanceOf(RankOutlierStrategy.class);
        assertThat(strategies).extracting(DetectionStrategy::getModelId)
                .containsExactly(ModelRegistry.STATISTICAL_ID, ModelRegistry.RULE_BASED_ID,
                        ModelRegistry.RANK_OUTLIER_ID);
    }

    @Test
    @DisplayName("Should return an unmodifiable list")
    void shouldReturnUnmodifiableList() {
        List<DetectionStrategy> strategies = StrategyFactory.createAll(ModelRegistry.builtIns());

        assertThatThrownBy(() -> strategies.add(strategies.get(0)))
                .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    @DisplayName("Should map the kind to the matching strategy")
    void shouldCreateByKind() {
        DetectionModel model = new DetectionModel("custom", "Custom", ModelKind.RULE_BASED, Map.of(), true);

        DetectionStrategy strategy = StrategyFactory.create(model);

        assertThat(strategy.getKind()).isEqualTo(ModelKind.RULE_BASED);
        assertThat(strategy.getModelId()).isEqualTo("custom");
    }

    @Test
    @DisplayName("Should throw for an unknown kind")
    void shouldThrowForUnknownKind() {
        DetectionModel model = new DetectionModel();
        model.setId("bad");
        model.setKind("neural_net");

        assertThatThrownBy(() -> StrategyFactory.create(model))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Unknown model kind");
    }
}
