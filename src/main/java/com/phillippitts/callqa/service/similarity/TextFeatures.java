package com.phillippitts.callqa.service.similarity;

import java.util.Set;

/**
 * Per-text features computed once per finding so pairwise scoring stays cheap.
 *
 * @param entities  entity tags
 * @param actions   action-object tags
 * @param tokens    normalized token set
 * @param embedding embedding vector, or null when none was supplied for this text's key
 */
public record TextFeatures(Set<String> entities, Set<String> actions, Set<String> tokens, float[] embedding) {

    public TextFeatures {
        entities = Set.copyOf(entities);
        actions = Set.copyOf(actions);
        tokens = Set.copyOf(tokens);
    }

    public boolean hasEmbedding() {
        return embedding != null && embedding.length > 0;
    }
}
