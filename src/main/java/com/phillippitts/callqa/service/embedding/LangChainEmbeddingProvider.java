package com.phillippitts.callqa.service.embedding;

import com.phillippitts.callqa.exception.EmbeddingException;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.embedding.EmbeddingModel;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * {@link EmbeddingProvider} backed by a LangChain4j {@link EmbeddingModel}.
 *
 * <p>Batches go through {@link EmbeddingModel#embedAll(List)} in a single request. Any runtime failure of
 * the model, or a response whose size does not match the request, is rethrown as {@link EmbeddingException}.
 */
public class LangChainEmbeddingProvider implements EmbeddingProvider {

    private final EmbeddingModel model;
    private final String providerName;

    public LangChainEmbeddingProvider(EmbeddingModel model, String providerName) {
        this.model = Objects.requireNonNull(model, "model");
        this.providerName = providerName == null || providerName.isBlank() ? "langchain4j" : providerName;
    }

    @Override
    public float[] embed(String text) {
        try {
            return model.embed(text).content().vector();
        } catch (RuntimeException e) {
            throw new EmbeddingException("Embedding request failed: " + e.getMessage(), providerName, 1, e);
        }
    }

    @Override
    public Map<String, float[]> embedAll(List<String> texts) {
        if (texts.isEmpty()) {
            return Map.of();
        }
        List<Embedding> embeddings;
        try {
            List<TextSegment> segments = texts.stream().map(TextSegment::from).toList();
            embeddings = model.embedAll(segments).content();
        } catch (RuntimeException e) {
            throw new EmbeddingException("Batch embedding request failed: " + e.getMessage(), providerName,
                    texts.size(), e);
        }
        if (embeddings == null || embeddings.size() != texts.size()) {
            throw new EmbeddingException("Batch embedding returned "
                    + (embeddings == null ? 0 : embeddings.size()) + " vectors", providerName, texts.size());
        }
        Map<String, float[]> out = new LinkedHashMap<>();
        for (int i = 0; i < texts.size(); i++) {
            out.put(texts.get(i), embeddings.get(i).vector());
        }
        return out;
    }

    @Override
    public String getProviderName() {
        return providerName;
    }
}
