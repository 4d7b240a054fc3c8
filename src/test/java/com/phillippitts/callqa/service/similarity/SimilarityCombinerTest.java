package com.phillippitts.callqa.service.similarity;

import org.junit.jupiter.api.Test;

import java.util.OptionalDouble;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class SimilarityCombinerTest {

    private final SimilarityCombiner combiner = new SimilarityCombiner();

    @Test
    void strongEmbeddingWins() {
        assertThat(combiner.selectWeights(0, 0, 0, OptionalDouble.of(0.8)))
                .isEqualTo(SignalWeights.EMBEDDING_STRONG);
        // 0.7 is not strong
        assertThat(combiner.selectWeights(0, 0, 0, OptionalDouble.of(0.7)))
                .isEqualTo(SignalWeights.EMBEDDING_BALANCED);
    }

    @Test
    void embeddingWithStructuredSignal() {
        assertThat(combiner.selectWeights(0.5, 0, 0, OptionalDouble.of(0.5)))
                .isEqualTo(SignalWeights.EMBEDDING_STRUCTURED);
        assertThat(combiner.selectWeights(0.1, 0.31, 0, OptionalDouble.of(0.5)))
                .isEqualTo(SignalWeights.EMBEDDING_STRUCTURED);
    }

    @Test
    void structuredWithoutEmbedding() {
        assertThat(combiner.selectWeights(0.31, 0, 0.9, OptionalDouble.empty()))
                .isEqualTo(SignalWeights.STRUCTURED);
        assertThat(combiner.selectWeights(0.3, 0.3, 0.9, OptionalDouble.empty()))
                .isEqualTo(SignalWeights.LEXICAL);
    }

    @Test
    void lexicalAndBalancedFallbacks() {
        assertThat(combiner.selectWeights(0, 0, 0.41, OptionalDouble.empty())).isEqualTo(SignalWeights.LEXICAL);
        assertThat(combiner.selectWeights(0, 0, 0.4, OptionalDouble.empty())).isEqualTo(SignalWeights.BALANCED);
    }

    @Test
    void weightSetsSumToOne() {
        for (SignalWeights w : new SignalWeights[]{SignalWeights.EMBEDDING_STRONG, SignalWeights.EMBEDDING_STRUCTURED,
                SignalWeights.EMBEDDING_BALANCED, SignalWeights.STRUCTURED, SignalWeights.LEXICAL,
                SignalWeights.BALANCED}) {
            assertThat(w.embedding() + w.entity() + w.action() + w.token()).as(w.name()).isCloseTo(1.0, within(1e-9));
        }
    }

    @Test
    void combinesWithSelectedWeights() {
        assertThat(combiner.combine(0, 0, 0.6, OptionalDouble.empty())).isCloseTo(0.3, within(1e-12));
        assertThat(combiner.combine(1.0, 1.0, 0.5, OptionalDouble.empty())).isCloseTo(0.9, within(1e-12));
        assertThat(combiner.combine(0, 0, 0.2, OptionalDouble.of(0.9))).isCloseTo(0.47, within(1e-12));
    }

    @Test
    void entityBoostNeedsTwoSharedEntities() {
        double boosted = combiner.combine(new SimilaritySignals(0.5, 2, 0, 0, OptionalDouble.empty()));
        double plain = combiner.combine(new SimilaritySignals(0.5, 1, 0, 0, OptionalDouble.empty()));

        assertThat(boosted).isCloseTo(0.4 * 0.75, within(1e-12));
        assertThat(plain).isCloseTo(0.4 * 0.5, within(1e-12));
    }

    @Test
    void weightSelectionSeesBoostedEntitySignal() {
        // 0.25 boosted to 0.375 crosses the structured cut-off
        assertThat(combiner.selectWeights(new SimilaritySignals(0.25, 2, 0, 0, OptionalDouble.empty())).name())
                .isEqualTo("structured");
        assertThat(combiner.selectWeights(new SimilaritySignals(0.25, 1, 0, 0, OptionalDouble.empty())).name())
                .isEqualTo("balanced");
    }

    @Test
    void boostIsCappedAtOne() {
        double score = combiner.combine(new SimilaritySignals(0.9, 3, 1.0, 1.0, OptionalDouble.empty()));

        assertThat(score).isCloseTo(1.0, within(1e-12)).isLessThanOrEqualTo(1.0);
    }

    @Test
    void resultStaysInUnitInterval() {
        assertThat(combiner.combine(1, 1, 1, OptionalDouble.of(1))).isBetween(0.0, 1.0);
        assertThat(combiner.combine(0, 0, 0, OptionalDouble.of(0))).isZero();
    }
}
