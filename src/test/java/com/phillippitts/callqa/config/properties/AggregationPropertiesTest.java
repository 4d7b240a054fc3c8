package com.phillippitts.callqa.config.properties;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AggregationPropertiesTest {

    @Test
    void appliesDefaults() {
        AggregationProperties p = new AggregationProperties(null, null, null);

        assertThat(p.getSimilarityThreshold()).isEqualTo(0.30);
        assertThat(p.getEvidenceSampleSize()).isEqualTo(3);
        assertThat(p.getVocabulary().extraStopwords()).isEmpty();
        assertThat(p.getVocabulary().extraSynonyms()).isEmpty();
    }

    @Test
    void rejectsThresholdOutOfRange() {
        assertThatThrownBy(() -> new AggregationProperties(1.5, null, null))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("aggregation.similarity-threshold must be in [0,1]");
        assertThatThrownBy(() -> new AggregationProperties(-0.01, null, null))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void rejectsNonPositiveSampleSize() {
        assertThatThrownBy(() -> new AggregationProperties(null, 0, null))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("evidence-sample-size");
    }

    @Test
    void keepsVocabularyExtras() {
        AggregationProperties p = new AggregationProperties(0.4, 5,
                new AggregationProperties.Vocabulary(List.of("agent"), Map.of("hangup", "disconnect")));

        assertThat(p.getSimilarityThreshold()).isEqualTo(0.4);
        assertThat(p.getVocabulary().extraStopwords()).containsExactly("agent");
        assertThat(p.getVocabulary().extraSynonyms()).containsEntry("hangup", "disconnect");
    }
}
