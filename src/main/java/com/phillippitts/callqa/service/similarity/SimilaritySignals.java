package com.phillippitts.callqa.service.similarity;

import java.util.OptionalDouble;

/**
 * Raw similarity signals between two texts, before weighting.
 *
 * @param entity        entity Jaccard similarity
 * @param entityOverlap number of shared entities (drives the multi-entity boost)
 * @param action        action-object Jaccard similarity
 * @param token         token Jaccard similarity
 * @param embedding     clamped cosine similarity, empty when either side has no vector
 */
public record SimilaritySignals(double entity, int entityOverlap, double action, double token,
                                OptionalDouble embedding) {

    public SimilaritySignals {
        embedding = embedding == null ? OptionalDouble.empty() : embedding;
    }
}
