/**
 * Pairwise similarity between finding texts.
 *
 * <p>Four signals feed {@link com.phillippitts.callqa.service.similarity.SimilarityCombiner}: entity tags,
 * action-object tags, normalized token sets and (optionally) embedding cosine. Weights are chosen per pair
 * from which signals are present.
 */
package com.phillippitts.callqa.service.similarity;
