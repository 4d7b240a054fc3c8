package com.phillippitts.callqa.service.similarity;

import com.phillippitts.callqa.service.embedding.EmbeddingIndex;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class TextSimilarityScorerTest {

    private final TextSimilarityScorer scorer = TextSimilarityScorer.create(SimilarityVocabulary.defaults());

    @Test
    void paraphrasedFailuresScoreHigh() {
        double score = scorer.score("quality_issue skipped customer name capture",
                "quality_issue agent missed collecting the customer's name");

        assertThat(score).isGreaterThan(0.9);
    }

    @Test
    void unrelatedFailuresScoreLow() {
        double score = scorer.score("quality_issue skipped customer name capture",
                "quality_issue agent was rude to the customer");

        // only qualityissue and customer are shared: balanced weights on token Jaccard 2/7
        assertThat(score).isCloseTo(0.3 * 2 / 7, within(1e-9));
    }

    @Test
    void scoreIsSymmetric() {
        String a = "Agent did not verify the caller's identity";
        String b = "Identity verification skipped";

        assertThat(scorer.score(a, b)).isEqualTo(scorer.score(b, a));
    }

    @Test
    void embeddingSignalOnlyWhenBothSidesHaveVectors() {
        EmbeddingIndex index = EmbeddingIndex.of(Map.of("a", new float[]{1, 0}, "b", new float[]{1, 0}));

        TextFeatures withA = scorer.features("background noise", "a", index);
        TextFeatures withB = scorer.features("static interference", "b", index);
        TextFeatures none = scorer.features("static interference", "missing", index);

        assertThat(scorer.signals(withA, withB).embedding()).hasValue(1.0);
        assertThat(scorer.signals(withA, none).embedding()).isEmpty();
        assertThat(scorer.score(withA, withB)).isCloseTo(0.5, within(1e-9));
        assertThat(scorer.score(withA, none)).isZero();
    }

    @Test
    void emptyTextsScoreZero() {
        assertThat(scorer.score("", null)).isZero();
    }
}
