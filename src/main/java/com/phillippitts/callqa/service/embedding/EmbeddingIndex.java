package com.phillippitts.callqa.service.embedding;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Immutable map of embedding key → vector produced by the embedding pre-pass.
 *
 * <p>The map may be incomplete or empty. A missing key means "no embedding available" and is never
 * an error; blank keys and empty vectors are ignored on construction.
 */
public final class EmbeddingIndex {

    private static final EmbeddingIndex EMPTY = new EmbeddingIndex(Map.of());

    private final Map<String, float[]> vectors;

    private EmbeddingIndex(Map<String, float[]> vectors) {
        this.vectors = vectors;
    }

    public static EmbeddingIndex empty() {
        return EMPTY;
    }

    /**
     * Creates an index from a possibly partial key → vector map (null treated as empty).
     */
    public static EmbeddingIndex of(Map<String, float[]> vectors) {
        if (vectors == null || vectors.isEmpty()) {
            return EMPTY;
        }
        Map<String, float[]> copy = new LinkedHashMap<>();
        vectors.forEach((key, vector) -> {
            if (key != null && !key.isBlank() && vector != null && vector.length > 0) {
                copy.put(key, vector.clone());
            }
        });
        return copy.isEmpty() ? EMPTY : new EmbeddingIndex(Collections.unmodifiableMap(copy));
    }

    /**
     * Copy of the vector for the key, or null when absent.
     */
    public float[] vectorFor(String key) {
        float[] vector = key == null ? null : vectors.get(key);
        return vector == null ? null : vector.clone();
    }

    public boolean contains(String key) {
        return key != null && vectors.containsKey(key);
    }

    public Set<String> keys() {
        return vectors.keySet();
    }

    public int size() {
        return vectors.size();
    }

    public boolean isEmpty() {
        return vectors.isEmpty();
    }
}
