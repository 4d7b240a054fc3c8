package com.phillippitts.callqa.service.similarity;

import java.util.Objects;
import java.util.Set;

/**
 * Jaccard similarity over stopword-filtered, synonym-normalized token sets.
 */
public final class TokenSimilarityScorer {

    private final TokenVocabulary vocabulary;

    public TokenSimilarityScorer(TokenVocabulary vocabulary) {
        this.vocabulary = Objects.requireNonNull(vocabulary, "vocabulary");
    }

    /**
     * Normalized token set for one text.
     */
    public Set<String> tokens(String text) {
        return TokenizerUtil.tokenize(text, vocabulary);
    }

    /**
     * Token similarity of two texts in [0,1]; 0.0 when either side has no surviving tokens.
     */
    public double similarity(String a, String b) {
        return SetSimilarity.jaccard(tokens(a), tokens(b));
    }
}
