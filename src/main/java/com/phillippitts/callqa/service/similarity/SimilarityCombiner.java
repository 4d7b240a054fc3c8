package com.phillippitts.callqa.service.similarity;

import java.util.OptionalDouble;

/**
 * Merges entity, action-object, token and optional embedding signals into one score in [0,1].
 *
 * <p>Weights are chosen by signal strength, evaluated in this order:
 * <ol>
 *   <li>embedding present and &gt; 0.7 → {@link SignalWeights#EMBEDDING_STRONG}</li>
 *   <li>embedding present and entity or action &gt; 0.3 → {@link SignalWeights#EMBEDDING_STRUCTURED}</li>
 *   <li>embedding present → {@link SignalWeights#EMBEDDING_BALANCED}</li>
 *   <li>entity or action &gt; 0.3 → {@link SignalWeights#STRUCTURED}</li>
 *   <li>token &gt; 0.4 → {@link SignalWeights#LEXICAL}</li>
 *   <li>otherwise → {@link SignalWeights#BALANCED}</li>
 * </ol>
 *
 * <p>Before weighting, the entity signal is multiplied by {@value #ENTITY_BOOST} (capped at 1.0) when
 * the two texts share at least {@value #ENTITY_BOOST_MIN_OVERLAP} entities.
 */
public final class SimilarityCombiner {

    static final double ENTITY_BOOST = 1.5;
    static final int ENTITY_BOOST_MIN_OVERLAP = 2;

    private static final double STRONG_EMBEDDING = 0.7;
    private static final double STRUCTURED_SIGNAL = 0.3;
    private static final double LEXICAL_SIGNAL = 0.4;

    /**
     * Combines raw signals, applying the multi-entity boost first.
     */
    public double combine(SimilaritySignals signals) {
        return combine(boostedEntity(signals), signals.action(), signals.token(), signals.embedding());
    }

    /**
     * Weight set that {@link #combine(SimilaritySignals)} applies to these raw signals.
     */
    public SignalWeights selectWeights(SimilaritySignals signals) {
        return selectWeights(boostedEntity(signals), signals.action(), signals.token(), signals.embedding());
    }

    private static double boostedEntity(SimilaritySignals signals) {
        double entity = signals.entity();
        if (signals.entityOverlap() >= ENTITY_BOOST_MIN_OVERLAP) {
            entity = Math.min(1.0, entity * ENTITY_BOOST);
        }
        return entity;
    }

    /**
     * Combines already-boosted signals.
     *
     * @param entitySim    entity similarity in [0,1]
     * @param actionSim    action-object similarity in [0,1]
     * @param tokenSim     token similarity in [0,1]
     * @param embeddingSim clamped embedding similarity, or empty when unavailable
     * @return combined similarity in [0,1]
     */
    public double combine(double entitySim, double actionSim, double tokenSim, OptionalDouble embeddingSim) {
        SignalWeights w = selectWeights(entitySim, actionSim, tokenSim, embeddingSim);
        double score = w.entity() * entitySim + w.action() * actionSim + w.token() * tokenSim;
        if (embeddingSim.isPresent()) {
            score += w.embedding() * embeddingSim.getAsDouble();
        }
        return Math.max(0.0, Math.min(1.0, score));
    }

    /**
     * Picks the weight set for the given signal strengths.
     */
    public SignalWeights selectWeights(double entitySim, double actionSim, double tokenSim,
                                       OptionalDouble embeddingSim) {
        boolean structured = entitySim > STRUCTURED_SIGNAL || actionSim > STRUCTURED_SIGNAL;
        if (embeddingSim.isPresent()) {
            if (embeddingSim.getAsDouble() > STRONG_EMBEDDING) {
                return SignalWeights.EMBEDDING_STRONG;
            }
            return structured ? SignalWeights.EMBEDDING_STRUCTURED : SignalWeights.EMBEDDING_BALANCED;
        }
        if (structured) {
            return SignalWeights.STRUCTURED;
        }
        return tokenSim > LEXICAL_SIGNAL ? SignalWeights.LEXICAL : SignalWeights.BALANCED;
    }
}
