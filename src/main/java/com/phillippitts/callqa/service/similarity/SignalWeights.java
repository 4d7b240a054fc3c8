package com.phillippitts.callqa.service.similarity;

/**
 * Weight set applied by {@link SimilarityCombiner}. Each set sums to 1.0.
 *
 * @param name      short label for trace logging
 * @param embedding weight of the embedding signal (0 when no embedding is available)
 * @param entity    weight of the entity signal
 * @param action    weight of the action-object signal
 * @param token     weight of the token signal
 */
public record SignalWeights(String name, double embedding, double entity, double action, double token) {

    public static final SignalWeights EMBEDDING_STRONG = new SignalWeights("embedding-strong", 0.50, 0.20, 0.20, 0.10);
    public static final SignalWeights EMBEDDING_STRUCTURED = new SignalWeights("embedding-structured", 0.30, 0.30, 0.30, 0.10);
    public static final SignalWeights EMBEDDING_BALANCED = new SignalWeights("embedding-balanced", 0.35, 0.25, 0.25, 0.15);
    public static final SignalWeights STRUCTURED = new SignalWeights("structured", 0.0, 0.40, 0.40, 0.20);
    public static final SignalWeights LEXICAL = new SignalWeights("lexical", 0.0, 0.25, 0.25, 0.50);
    public static final SignalWeights BALANCED = new SignalWeights("balanced", 0.0, 0.35, 0.35, 0.30);
}
