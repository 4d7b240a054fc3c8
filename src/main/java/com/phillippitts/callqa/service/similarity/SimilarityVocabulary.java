package com.phillippitts.callqa.service.similarity;

import java.util.Objects;

/**
 * Immutable bundle of the vocabularies used by the similarity signals.
 * Bound into the taggers and the token scorer at construction time.
 */
public record SimilarityVocabulary(EntityVocabulary entities, ActionVocabulary actions, TokenVocabulary tokens) {

    public SimilarityVocabulary {
        Objects.requireNonNull(entities, "entities");
        Objects.requireNonNull(actions, "actions");
        Objects.requireNonNull(tokens, "tokens");
    }

    public static SimilarityVocabulary defaults() {
        return new SimilarityVocabulary(EntityVocabulary.defaults(), ActionVocabulary.defaults(),
                TokenVocabulary.defaults());
    }
}
