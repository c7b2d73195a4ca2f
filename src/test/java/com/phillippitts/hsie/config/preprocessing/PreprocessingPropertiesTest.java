package com.phillippitts.hsie.config.preprocessing;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PreprocessingPropertiesTest {

    @Test
    void defaultsMatchDocumentedValues() {
        PreprocessingProperties props = new PreprocessingProperties(null, null, null, null, null);

        assertThat(props.getDiarizationConfidenceThreshold()).isEqualTo(0.6);
        assertThat(props.getShortPauseSeconds()).isEqualTo(0.7);
        assertThat(props.getLongPauseSeconds()).isEqualTo(2.0);
        assertThat(props.getFillerWords()).contains("um", "えー");
        assertThat(props.getIncompleteEndings()).contains("て", "から");
    }

    @Test
    void customListsReplaceDefaults() {
        PreprocessingProperties props = new PreprocessingProperties(0.5, 0.3, 1.0, Set.of("like"), List.of("and"));

        assertThat(props.getFillerWords()).containsExactly("like");
        assertThat(props.getIncompleteEndings()).containsExactly("and");
    }

    @Test
    void thresholdOutsideUnitIntervalIsRejected() {
        assertThatThrownBy(() -> new PreprocessingProperties(1.5))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("diarization-confidence-threshold");
    }

    @Test
    void longPauseShorterThanShortPauseIsRejected() {
        assertThatThrownBy(() -> new PreprocessingProperties(0.6, 2.0, 1.0, null, null))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void diarizationCommandTypeRequiresCommand() {
        assertThatThrownBy(() -> new DiarizationProperties(DiarizationProperties.Type.COMMAND, null, null, null))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("hsie.diarization.command");
    }

    @Test
    void unknownIsNotAValidDefaultSpeaker() {
        assertThatThrownBy(() -> new DiarizationProperties(null, "unknown", null, null))
                .isInstanceOf(IllegalArgumentException.class);
        assertThat(new DiarizationProperties(null, null, null, null).getDefaultSpeaker()).isEqualTo("speaker_0");
    }
}
