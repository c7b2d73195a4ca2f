package com.phillippitts.hsie.config.analysis;

import com.phillippitts.hsie.domain.AnalyzerKind;
import com.phillippitts.hsie.domain.WeightingConfig;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class WeightingPropertiesTest {

    @Test
    void unsetPropertiesGiveEqualWeightsAndDefaultEscalation() {
        WeightingConfig config = new WeightingProperties().toWeightingConfig();

        assertThat(config).isEqualTo(WeightingConfig.equalWeights());
    }

    @Test
    void configuredWeightsOverrideOnlyNamedDimensions() {
        WeightingConfig config = new WeightingProperties(Map.of(AnalyzerKind.SEMANTIC, 3.0), 0.5, 4.0)
                .toWeightingConfig();

        assertThat(config.weightOf(AnalyzerKind.SEMANTIC)).isEqualTo(3.0);
        assertThat(config.weightOf(AnalyzerKind.ACOUSTIC)).isEqualTo(1.0);
        assertThat(config.escalationStep()).isEqualTo(0.5);
        assertThat(config.escalationCap()).isEqualTo(4.0);
    }

    @Test
    void negativeWeightIsRejected() {
        WeightingProperties props = new WeightingProperties(Map.of(AnalyzerKind.ACOUSTIC, -1.0), null, null);

        assertThatThrownBy(props::toWeightingConfig)
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("non-negative");
    }

    @Test
    void capBelowOneIsRejected() {
        WeightingProperties props = new WeightingProperties(null, 0.25, 0.5);

        assertThatThrownBy(props::toWeightingConfig).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void infiniteWeightIsRejected() {
        WeightingProperties props = new WeightingProperties(
                Map.of(AnalyzerKind.SEMANTIC, Double.POSITIVE_INFINITY), null, null);

        assertThatThrownBy(props::toWeightingConfig)
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("finite");
    }

    @Test
    void infiniteEscalationStepIsRejected() {
        WeightingProperties props = new WeightingProperties(null, Double.POSITIVE_INFINITY, 2.0);

        assertThatThrownBy(props::toWeightingConfig).isInstanceOf(IllegalArgumentException.class);
    }
}
