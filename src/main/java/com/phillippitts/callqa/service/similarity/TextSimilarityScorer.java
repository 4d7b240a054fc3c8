package com.phillippitts.callqa.service.similarity;

import com.phillippitts.callqa.service.embedding.EmbeddingIndex;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Objects;
import java.util.OptionalDouble;

/**
 * Computes the combined multi-signal similarity of two canonical texts.
 *
 * <p>Signals: entity tags and action-object tags (both from {@link TextTagger}s), token Jaccard and,
 * when both sides have a vector, clamped cosine similarity. Signals are merged by
 * {@link SimilarityCombiner}. Stateless and thread-safe.
 */
public final class TextSimilarityScorer {

    private static final Logger LOG = LogManager.getLogger(TextSimilarityScorer.class);

    private final TextTagger entityTagger;
    private final TextTagger actionTagger;
    private final TokenSimilarityScorer tokenScorer;
    private final SimilarityCombiner combiner;

    public TextSimilarityScorer(TextTagger entityTagger, TextTagger actionTagger,
                                TokenSimilarityScorer tokenScorer, SimilarityCombiner combiner) {
        this.entityTagger = Objects.requireNonNull(entityTagger, "entityTagger");
        this.actionTagger = Objects.requireNonNull(actionTagger, "actionTagger");
        this.tokenScorer = Objects.requireNonNull(tokenScorer, "tokenScorer");
        this.combiner = Objects.requireNonNull(combiner, "combiner");
    }

    /**
     * Builds a scorer over the given vocabulary with the default combiner.
     */
    public static TextSimilarityScorer create(SimilarityVocabulary vocabulary) {
        return new TextSimilarityScorer(
                new EntityTagger(vocabulary.entities()),
                new ActionObjectTagger(vocabulary.actions()),
                new TokenSimilarityScorer(vocabulary.tokens()),
                new SimilarityCombiner());
    }

    /**
     * Extracts features for a text.
     *
     * @param text         canonical text (may be null)
     * @param embeddingKey key to look up in the index (may be null)
     * @param embeddings   available vectors (may be empty)
     */
    public TextFeatures features(String text, String embeddingKey, EmbeddingIndex embeddings) {
        float[] vector = embeddings == null ? null : embeddings.vectorFor(embeddingKey);
        return new TextFeatures(entityTagger.tag(text), actionTagger.tag(text), tokenScorer.tokens(text), vector);
    }

    /**
     * Features for a text with no embedding.
     */
    public TextFeatures features(String text) {
        return features(text, null, EmbeddingIndex.empty());
    }

    /**
     * Raw signals between two feature sets.
     */
    public SimilaritySignals signals(TextFeatures a, TextFeatures b) {
        OptionalDouble embedding = a.hasEmbedding() && b.hasEmbedding()
                ? OptionalDouble.of(CosineSimilarity.clamped(a.embedding(), b.embedding()))
                : OptionalDouble.empty();
        return new SimilaritySignals(
                SetSimilarity.jaccard(a.entities(), b.entities()),
                SetSimilarity.intersectionSize(a.entities(), b.entities()),
                SetSimilarity.jaccard(a.actions(), b.actions()),
                SetSimilarity.jaccard(a.tokens(), b.tokens()),
                embedding);
    }

    /**
     * Combined similarity between two feature sets in [0,1].
     */
    public double score(TextFeatures a, TextFeatures b) {
        SimilaritySignals s = signals(a, b);
        double score = combiner.combine(s);
        if (LOG.isTraceEnabled()) {
            LOG.trace("similarity={} weights={} entity={} (shared {}) action={} token={} embedding={}",
                    score, combiner.selectWeights(s).name(), s.entity(), s.entityOverlap(), s.action(), s.token(),
                    s.embedding());
        }
        return score;
    }

    /**
     * Convenience: combined similarity of two raw texts with no embeddings.
     */
    public double score(String a, String b) {
        return score(features(a), features(b));
    }
}
