package com.phillippitts.callqa.service.embedding;

import com.phillippitts.callqa.exception.EmbeddingException;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Contract for text-embedding back ends used by the similarity pre-pass.
 *
 * <p>Implementations wrap a concrete embedding API behind a uniform call shape. Failures surface as
 * {@link EmbeddingException}; callers decide whether to retry or omit the affected keys.
 *
 * <p>Thread Safety: implementations should be safe for concurrent calls.
 */
public interface EmbeddingProvider {

    /**
     * Singleton provider wired when the embedding pre-pass is switched off.
     *
     * <p>It reports as disabled via {@link #isEnabled()}, returns an empty map from
     * {@link #embedAll(List)} and rejects single {@link #embed(String)} calls.
     */
    EmbeddingProvider NOOP = new EmbeddingProvider() {
        @Override
        public float[] embed(String text) {
            throw new EmbeddingException("Embeddings are disabled", getProviderName(), 1);
        }

        @Override
        public Map<String, float[]> embedAll(List<String> texts) {
            return Map.of();
        }

        @Override
        public String getProviderName() {
            return "noop";
        }

        @Override
        public boolean isEnabled() {
            return false;
        }
    };

    /**
     * Embeds a single text.
     *
     * @param text text to embed
     * @return embedding vector
     * @throws EmbeddingException if the back end fails
     */
    float[] embed(String text);

    /**
     * Embeds a batch of texts. The default calls {@link #embed(String)} once per text.
     *
     * @param texts texts to embed
     * @return vectors keyed by their text, in input order
     * @throws EmbeddingException if any call fails
     */
    default Map<String, float[]> embedAll(List<String> texts) {
        Map<String, float[]> out = new LinkedHashMap<>();
        for (String text : texts) {
            out.put(text, embed(text));
        }
        return out;
    }

    /**
     * Returns the provider name for logging and metrics (e.g. "openai", "noop").
     */
    String getProviderName();

    /**
     * Whether this provider produces vectors at all. A disabled provider lets the pre-pass
     * return an empty index without doing any work.
     */
    default boolean isEnabled() {
        return true;
    }
}
